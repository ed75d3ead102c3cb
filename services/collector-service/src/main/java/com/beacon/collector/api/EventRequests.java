package com.beacon.collector.api;

import jakarta.validation.constraints.NotBlank;
import java.util.Map;

/**
 * JSON request bodies of the ingest endpoints. Field names follow the event wire format, so a body
 * can be copied from a serialized event.
 */
public final class EventRequests {

    private EventRequests() {
        // utility class
    }

    /** Body of {@code POST /api/v1/track}; {@code messageId} is optional. */
    public record TrackRequest(String messageId, @NotBlank String event, Map<String, Object> properties) {}

    /** Body of {@code POST /api/v1/identify}; at least one of the fields must be present. */
    public record IdentifyRequest(String userId, Map<String, Object> traits) {}

    public record ScreenRequest(@NotBlank String name, String category, Map<String, Object> properties) {}

    public record GroupRequest(@NotBlank String groupId, Map<String, Object> traits) {}

    /** Body of {@code POST /api/v1/alias}; {@code userId} is the new id. */
    public record AliasRequest(@NotBlank String userId) {}
}
