package com.beacon.observability;

/**
 * Sink for internal errors the client cannot hand back to its caller.
 * <p>
 * The dispatch entry points never throw serialization or validation failures at the call site;
 * they report them here. {@code fatal} marks failures that aborted the call entirely, as opposed
 * to ones the client recovered from (e.g. by dispatching without a payload).
 */
@FunctionalInterface
public interface ErrorReporter {

    void report(Throwable error, boolean fatal);
}
