package com.beacon.collector.config;

import com.beacon.client.Analytics;
import com.beacon.client.EventPipeline;
import com.beacon.client.LoggingEventPipeline;
import com.beacon.client.enrichment.RedactionEnrichment;
import com.beacon.eventmodel.CanonicalValueModule;
import com.beacon.identity.IdentityStore;
import com.fasterxml.jackson.databind.Module;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Wires the Beacon client into the application context.
 *
 * <p>The delivery pipeline is whatever {@link EventPipeline} bean the application defines; without
 * one, events are written to the log by {@link LoggingEventPipeline}, masked with the same patterns
 * as the identity responses. Metrics go to the Actuator
 * registry so they show up under {@code /actuator/metrics}.
 */
@Configuration
public class AnalyticsConfig {

    private static final Logger log = LoggerFactory.getLogger(AnalyticsConfig.class);

    @Bean
    public IdentityStore identityStore() {
        var store = new IdentityStore();
        store.addListener(transition -> log.info("Identity {} -> version {} (userId={})",
                transition.action().getClass().getSimpleName(),
                transition.after().version(),
                transition.after().userId()));
        return store;
    }

    @Bean
    public Analytics analytics(
            CollectorProperties properties,
            IdentityStore identityStore,
            MeterRegistry meterRegistry,
            ObjectProvider<EventPipeline> pipeline) {
        EventPipeline delivery = pipeline.getIfAvailable(() -> new LoggingEventPipeline(properties.outputRedactor()));
        return Analytics.builder(delivery)
                .configuration(properties.toAnalyticsConfiguration())
                .identityStore(identityStore)
                .meterRegistry(meterRegistry)
                .build();
    }

    /** Masks sensitive traits before the identity endpoints return them. */
    @Bean
    public RedactionEnrichment responseRedaction(CollectorProperties properties) {
        return new RedactionEnrichment(properties.outputRedactor());
    }

    /** Lets MVC write canonical values (identity traits) as plain JSON. */
    @Bean
    public Module canonicalValueModule() {
        return new CanonicalValueModule();
    }
}
