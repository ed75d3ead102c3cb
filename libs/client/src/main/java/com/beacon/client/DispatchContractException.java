package com.beacon.client;

/**
 * A caller-supplied enrichment or pipeline broke the dispatch contract: it emitted an event from
 * inside a dispatch, or changed the kind of the event it was given.
 * <p>
 * WHY an IllegalStateException that reaches the caller: this is a programming error in the
 * application's own code. Unlike payload or validation failures it is not reported and absorbed.
 */
public class DispatchContractException extends IllegalStateException {

    public DispatchContractException(String message) {
        super(message);
    }
}
