package com.beacon.identity;

/** Observer of applied identity transitions. Called on the thread that dispatched the action. */
@FunctionalInterface
public interface IdentityListener {

    void onTransition(IdentityTransition transition);
}
