package com.beacon.identity;

import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

/** Process-local {@link IdentityStorage}; the default when no durable storage is configured. */
public final class InMemoryIdentityStorage implements IdentityStorage {

    private final AtomicReference<IdentityState> state = new AtomicReference<>();

    public InMemoryIdentityStorage() {}

    /** Starts out holding {@code initial}, as if it had been saved by an earlier run. */
    public InMemoryIdentityStorage(IdentityState initial) {
        state.set(initial);
    }

    @Override
    public Optional<IdentityState> load() {
        return Optional.ofNullable(state.get());
    }

    @Override
    public void save(IdentityState state) {
        this.state.set(state);
    }
}
