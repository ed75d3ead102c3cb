package com.beacon.identity;

import com.beacon.eventmodel.ObjectValue;

/**
 * The only ways the identity state can change. Each action is a pure function from the current
 * snapshot to the next one; {@link IdentityStore} applies it atomically.
 */
public sealed interface IdentityAction
        permits IdentityAction.SetUserId, IdentityAction.SetTraits,
                IdentityAction.SetUserIdAndTraits, IdentityAction.Reset {

    IdentityState apply(IdentityState current);

    /** Sets the user id; traits are left as they are. */
    record SetUserId(String userId) implements IdentityAction {
        @Override
        public IdentityState apply(IdentityState current) {
            return current.next(current.anonymousId(), userId, current.traits());
        }
    }

    /** Replaces the traits wholesale; the user id is left as it is. */
    record SetTraits(ObjectValue traits) implements IdentityAction {
        @Override
        public IdentityState apply(IdentityState current) {
            return current.next(current.anonymousId(), current.userId(), traits);
        }
    }

    /** Sets the user id and, when {@code traits} is present, replaces the traits in the same step. */
    record SetUserIdAndTraits(String userId, ObjectValue traits) implements IdentityAction {
        @Override
        public IdentityState apply(IdentityState current) {
            return current.next(current.anonymousId(), userId, traits != null ? traits : current.traits());
        }
    }

    /** Forgets the user: new anonymous id, no user id, no traits. */
    record Reset(String anonymousId) implements IdentityAction {
        @Override
        public IdentityState apply(IdentityState current) {
            return current.next(anonymousId, null, null);
        }
    }
}
