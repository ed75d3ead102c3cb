package com.beacon.identity;

/**
 * Outcome of applying one action: the snapshot it replaced and the snapshot it produced.
 *
 * <p>Alias needs both sides: the event carries the user id being replaced ({@code before}) while
 * the state moves on to the new one ({@code after}).
 */
public record IdentityTransition(IdentityAction action, IdentityState before, IdentityState after) {}
