package com.beacon.identity;

import com.beacon.eventmodel.ObjectValue;

/**
 * Immutable snapshot of who the current user is.
 *
 * @param anonymousId id generated once per install; never null or blank
 * @param userId      id of the identified user; {@code null} until identify or alias sets one
 * @param traits      traits last set for the user; {@code null} when none are known
 * @param version     number of transitions applied since the state was first created
 */
public record IdentityState(String anonymousId, String userId, ObjectValue traits, long version) {

    public IdentityState {
        if (anonymousId == null || anonymousId.isBlank()) {
            throw new IllegalArgumentException("anonymousId must not be null or blank");
        }
        if (version < 0) {
            throw new IllegalArgumentException("version must be >= 0");
        }
    }

    /** A fresh state: no user id, no traits, version 0. */
    public static IdentityState initial(String anonymousId) {
        return new IdentityState(anonymousId, null, null, 0);
    }

    IdentityState next(String anonymousId, String userId, ObjectValue traits) {
        return new IdentityState(anonymousId, userId, traits, version + 1);
    }
}
