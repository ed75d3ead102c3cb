package com.beacon.client;

import java.util.Map;
import java.util.Set;

/**
 * Settings of one {@link Analytics} client.
 *
 * <p>The compact constructor applies defaults for absent values, so a configuration bound from
 * partial YAML or built with nulls is always complete.
 *
 * @param name                name of this client, used as the {@code client} tag on its metrics
 *                            and in the library context. Defaults to {@code beacon}.
 * @param rejectInvalidEvents whether blank event names, screen titles, group ids and user ids
 *                            are rejected. Defaults to {@code true}.
 * @param redactedKeys        payload key patterns whose values are masked before dispatch. Empty
 *                            (the default) disables redaction.
 * @param context             static entries merged into every event's context (e.g. app name,
 *                            environment). Defaults to empty.
 */
public record AnalyticsConfiguration(
        String name, Boolean rejectInvalidEvents, Set<String> redactedKeys, Map<String, String> context) {

    public static final String DEFAULT_NAME = "beacon";

    public AnalyticsConfiguration {
        if (name == null || name.isBlank()) {
            name = DEFAULT_NAME;
        }
        if (rejectInvalidEvents == null) {
            rejectInvalidEvents = Boolean.TRUE;
        }
        redactedKeys = redactedKeys == null ? Set.of() : Set.copyOf(redactedKeys);
        context = context == null ? Map.of() : Map.copyOf(context);
    }

    /** All defaults. */
    public static AnalyticsConfiguration defaults() {
        return new AnalyticsConfiguration(null, null, null, null);
    }
}
