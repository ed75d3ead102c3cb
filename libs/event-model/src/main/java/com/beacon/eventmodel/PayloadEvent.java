package com.beacon.eventmodel;

import java.util.Optional;

/**
 * An event that carries an optional object payload: properties for Track and Screen, traits for
 * Identify and Group.
 *
 * <p>{@link #withPayload(ObjectValue)} is the single "payload replaced" constructor shared by all
 * four kinds, which keeps the typed and untyped input paths on one construction route.
 */
public sealed interface PayloadEvent extends Event permits TrackEvent, IdentifyEvent, ScreenEvent, GroupEvent {

    /** The properties or traits; empty when the caller supplied none. */
    Optional<ObjectValue> payload();

    /** Returns a copy with the payload replaced; {@code null} means absent. */
    PayloadEvent withPayload(ObjectValue payload);
}
