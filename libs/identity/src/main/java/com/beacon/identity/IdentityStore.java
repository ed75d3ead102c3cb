package com.beacon.identity;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.UUID;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Supplier;

/**
 * The single authoritative identity snapshot, shared by every dispatching thread.
 * <p>
 * The state is an immutable {@link IdentityState} behind an {@link AtomicReference}. An action is
 * applied with a compare-and-set loop, so readers always see a whole snapshot from before or after
 * an action, never a half-applied one, and no lock is held while callers serialize payloads or run
 * enrichments.
 * <p>
 * After a successful swap the new state is written to the {@link IdentityStorage} and listeners
 * are notified, both on the dispatching thread. A storage or listener failure is logged and never
 * undoes the swap or reaches the caller.
 */
public final class IdentityStore {

    private static final Logger log = LoggerFactory.getLogger(IdentityStore.class);

    private final AtomicReference<IdentityState> state;
    private final Supplier<String> anonymousIdGenerator;
    private final IdentityStorage storage;
    private final List<IdentityListener> listeners = new CopyOnWriteArrayList<>();
    private final Object persistLock = new Object();
    private long persistedVersion = -1;

    /** In-memory store with random UUID anonymous ids. */
    public IdentityStore() {
        this(new InMemoryIdentityStorage(), () -> UUID.randomUUID().toString());
    }

    /**
     * Creates a store, restoring the saved state from {@code storage} or starting a fresh one with
     * a newly generated anonymous id.
     */
    public IdentityStore(IdentityStorage storage, Supplier<String> anonymousIdGenerator) {
        if (storage == null) {
            throw new IllegalArgumentException("storage must not be null");
        }
        if (anonymousIdGenerator == null) {
            throw new IllegalArgumentException("anonymousIdGenerator must not be null");
        }
        this.storage = storage;
        this.anonymousIdGenerator = anonymousIdGenerator;
        IdentityState initial = storage.load().orElse(null);
        if (initial == null) {
            initial = IdentityState.initial(anonymousIdGenerator.get());
            log.debug("Generated anonymousId={}", initial.anonymousId());
        } else {
            log.debug("Restored identity anonymousId={} version={}", initial.anonymousId(), initial.version());
        }
        this.state = new AtomicReference<>(initial);
        persist(initial);
    }

    /** Returns the current snapshot. */
    public IdentityState current() {
        return state.get();
    }

    /**
     * Applies an action atomically.
     *
     * @return the snapshots before and after the action
     */
    public IdentityTransition dispatch(IdentityAction action) {
        if (action == null) {
            throw new IllegalArgumentException("action must not be null");
        }
        IdentityState before;
        IdentityState after;
        do {
            before = state.get();
            after = action.apply(before);
        } while (!state.compareAndSet(before, after));

        log.debug("Applied {} version={}", action.getClass().getSimpleName(), after.version());
        var transition = new IdentityTransition(action, before, after);
        persist(after);
        notifyListeners(transition);
        return transition;
    }

    /** Clears user id and traits and regenerates the anonymous id. */
    public IdentityTransition reset() {
        return dispatch(new IdentityAction.Reset(anonymousIdGenerator.get()));
    }

    public void addListener(IdentityListener listener) {
        if (listener == null) {
            throw new IllegalArgumentException("listener must not be null");
        }
        listeners.add(listener);
    }

    public boolean removeListener(IdentityListener listener) {
        return listeners.remove(listener);
    }

    // Concurrent dispatches may reach here out of order; only ever save a newer version.
    // A failed save leaves persistedVersion behind so the next transition writes again.
    private void persist(IdentityState next) {
        synchronized (persistLock) {
            if (next.version() <= persistedVersion) {
                return;
            }
            try {
                storage.save(next);
                persistedVersion = next.version();
            } catch (RuntimeException e) {
                log.warn("Identity storage failed to save version={}: {}", next.version(), e.getMessage(), e);
            }
        }
    }

    private void notifyListeners(IdentityTransition transition) {
        for (IdentityListener listener : listeners) {
            try {
                listener.onTransition(transition);
            } catch (RuntimeException e) {
                log.warn("Identity listener {} failed: {}", listener, e.getMessage(), e);
            }
        }
    }
}
