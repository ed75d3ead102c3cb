package com.beacon.collector.config;

import com.beacon.client.AnalyticsConfiguration;
import com.beacon.observability.SensitiveDataRedactor;
import jakarta.validation.constraints.NotBlank;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Type-safe configuration of the collector, bound from the {@code beacon.collector.*} prefix:
 *
 * <pre>
 * beacon:
 *   collector:
 *     name: storefront-collector
 *     environment: production
 *     reject-invalid-events: true
 *     redacted-keys: [password, ssn]
 *     context:
 *       app: storefront
 * </pre>
 *
 * <p>Invalid config fails the startup with a Bean Validation message.
 *
 * @param name                client name, used as the {@code client} metric tag. Required.
 * @param environment         deployment environment, added to every event's context.
 * @param rejectInvalidEvents whether blank identifiers are rejected before dispatch.
 * @param redactedKeys        payload key patterns masked before dispatch.
 * @param context             static entries merged into every event's context.
 */
@ConfigurationProperties(prefix = "beacon.collector")
@Validated
public record CollectorProperties(
        @NotBlank String name,
        String environment,
        Boolean rejectInvalidEvents,
        Set<String> redactedKeys,
        Map<String, String> context) {

    /** Applies defaults for optional fields; runs before Bean Validation. */
    public CollectorProperties {
        if (environment == null || environment.isBlank()) {
            environment = "development";
        }
        if (rejectInvalidEvents == null) {
            rejectInvalidEvents = Boolean.TRUE;
        }
        redactedKeys = redactedKeys == null ? Set.of() : Set.copyOf(redactedKeys);
        context = context == null ? Map.of() : Map.copyOf(context);
    }

    /** The client settings these properties describe; the environment joins the static context. */
    public AnalyticsConfiguration toAnalyticsConfiguration() {
        var staticContext = new HashMap<>(context);
        staticContext.putIfAbsent("environment", environment);
        return new AnalyticsConfiguration(name, rejectInvalidEvents, redactedKeys, staticContext);
    }

    /**
     * Redactor for what the collector itself writes out (log lines, identity responses): the
     * default credential patterns plus the configured keys.
     */
    public SensitiveDataRedactor outputRedactor() {
        var patterns = new HashSet<>(SensitiveDataRedactor.DEFAULT_SENSITIVE_PATTERNS);
        patterns.addAll(redactedKeys);
        return new SensitiveDataRedactor(patterns);
    }
}
