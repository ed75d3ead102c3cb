package com.beacon.observability;

/**
 * Identifiers of the event being processed on the current thread, mirrored into the SLF4J MDC so
 * that every log line written by an enrichment or by the pipeline hand-off names its event.
 *
 * @param messageId   id of the event
 * @param eventType   wire tag of the event kind (e.g. "track")
 * @param anonymousId anonymous id carried by the event
 * @param userId      user id carried by the event (nullable)
 */
public record LogContext(String messageId, String eventType, String anonymousId, String userId) {

    /** MDC key for the message id. */
    public static final String MDC_MESSAGE_ID = "messageId";

    /** MDC key for the event type. */
    public static final String MDC_EVENT_TYPE = "eventType";

    /** MDC key for the anonymous id. */
    public static final String MDC_ANONYMOUS_ID = "anonymousId";

    /** MDC key for the user id. */
    public static final String MDC_USER_ID = "userId";

    public LogContext {
        if (messageId == null || messageId.isBlank()) {
            throw new IllegalArgumentException("messageId must not be null or blank");
        }
    }
}
