package com.beacon.identity;

import java.util.Optional;

/**
 * Where the identity state outlives the process, so the anonymous id is generated once per
 * install rather than once per start.
 */
public interface IdentityStorage {

    /** Returns the last saved state, or empty on first start. */
    Optional<IdentityState> load();

    void save(IdentityState state);
}
