package com.beacon.client;

import com.beacon.client.enrichment.RedactionEnrichment;
import com.beacon.eventmodel.Event;
import com.beacon.eventmodel.EventSerializer;
import com.beacon.observability.SensitiveDataRedactor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link EventPipeline} that writes each event's JSON wire form to the log. Useful in development
 * and as the collector service's fallback when no delivery pipeline is configured.
 * <p>
 * Sensitive keys in the payload and the context are masked before the line is written, whatever
 * the client's own redaction settings are.
 */
public final class LoggingEventPipeline implements EventPipeline {

    private static final Logger log = LoggerFactory.getLogger(LoggingEventPipeline.class);

    private final RedactionEnrichment redaction;

    /** Masks the default credential patterns. */
    public LoggingEventPipeline() {
        this(new SensitiveDataRedactor());
    }

    public LoggingEventPipeline(SensitiveDataRedactor redactor) {
        if (redactor == null) {
            throw new IllegalArgumentException("redactor must not be null");
        }
        this.redaction = new RedactionEnrichment(redactor);
    }

    @Override
    public void process(Event event) {
        if (log.isInfoEnabled()) {
            log.info("{} {}", event.type().value(), EventSerializer.serialize(masked(event)));
        }
    }

    private Event masked(Event event) {
        Event redacted = redaction.redactPayload(event);
        var context = redacted.envelope().context();
        var maskedContext = redaction.redact(context);
        if (maskedContext == context) {
            return redacted;
        }
        return redacted.withEnvelope(redacted.envelope().withContext(maskedContext));
    }
}
