package com.beacon.client;

import com.beacon.client.enrichment.ContextEnrichment;
import com.beacon.client.enrichment.RedactionEnrichment;
import com.beacon.eventmodel.AliasEvent;
import com.beacon.eventmodel.Event;
import com.beacon.eventmodel.EventFactory;
import com.beacon.eventmodel.EventValidator;
import com.beacon.eventmodel.JacksonPayloadSerializer;
import com.beacon.eventmodel.ObjectValue;
import com.beacon.eventmodel.PayloadEvent;
import com.beacon.eventmodel.PayloadSerializationException;
import com.beacon.eventmodel.PayloadSerializer;
import com.beacon.eventmodel.ValidationResult;
import com.beacon.identity.IdentityAction;
import com.beacon.identity.IdentityState;
import com.beacon.identity.IdentityStore;
import com.beacon.identity.IdentityTransition;
import com.beacon.observability.ErrorReporter;
import com.beacon.observability.LogContext;
import com.beacon.observability.LogContextHolder;
import com.beacon.observability.LoggingErrorReporter;
import com.beacon.observability.MetricFactory;
import com.beacon.observability.SensitiveDataRedactor;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;

/**
 * The public entry surface of the client: {@code track}, {@code identify}, {@code screen},
 * {@code group} and {@code alias}, each taking a typed payload, an untyped map, or nothing, with or
 * without call-scoped enrichments.
 * <p>
 * Every overload is a thin wrapper around one construction path per event kind:
 * <ol>
 *   <li>build the bare event from the identity snapshot and validate it,</li>
 *   <li>serialize the payload,</li>
 *   <li>for Identify and Alias, apply the identity action and re-stamp the envelope,</li>
 *   <li>run the enrichment chain,</li>
 *   <li>hand the result to the {@link EventPipeline}.</li>
 * </ol>
 * <p>
 * Nothing in that path throws to the caller. Failures go to the {@link ErrorReporter}:
 * <ul>
 *   <li>a typed payload that cannot be serialized aborts the call ({@code fatal=true});</li>
 *   <li>an untyped map that cannot be serialized is reported ({@code fatal=false}) and the event is
 *       sent without a payload;</li>
 *   <li>an invalid event, a failing enrichment or a failing pipeline aborts ({@code fatal=true}).</li>
 * </ul>
 * The only exception a caller sees is {@link DispatchContractException}, raised when an enrichment
 * or the pipeline emits an event from inside a dispatch or changes an event's kind.
 * <p>
 * Thread-safe. Calls run synchronously on the caller's thread, so one thread's events reach the
 * pipeline in program order.
 */
public final class Analytics {

    /** Name reported in the library context of every event. */
    public static final String LIBRARY_NAME = "beacon-java";

    /** Version reported in the library context of every event. */
    public static final String LIBRARY_VERSION = "0.1.0";

    private static final Logger log = LoggerFactory.getLogger(Analytics.class);

    /**
     * How a payload arrived, which fixes what a serialization failure does to the call.
     */
    private enum InputShape {
        TYPED(true),
        UNTYPED(false);

        private final boolean abortOnFailure;

        InputShape(boolean abortOnFailure) {
            this.abortOnFailure = abortOnFailure;
        }
    }

    /** Serialized payload; {@code aborted} means the call must stop here. */
    private record PayloadResult(ObjectValue value, boolean aborted) {
        static final PayloadResult ABSENT = new PayloadResult(null, false);
        static final PayloadResult ABORTED = new PayloadResult(null, true);
    }

    private final AnalyticsConfiguration configuration;
    private final EventPipeline pipeline;
    private final PayloadSerializer serializer;
    private final ErrorReporter errorReporter;
    private final IdentityStore identityStore;
    private final EventFactory eventFactory;
    private final EnrichmentChain enrichments;
    private final DispatchMetrics metrics;
    private final ThreadLocal<Boolean> dispatching = ThreadLocal.withInitial(() -> Boolean.FALSE);

    private Analytics(Builder builder, MetricFactory metricFactory, ErrorReporter errorReporter) {
        this.configuration = builder.configuration;
        this.pipeline = builder.pipeline;
        this.serializer = builder.serializer;
        this.errorReporter = errorReporter;
        this.identityStore = builder.identityStore;
        this.eventFactory = builder.eventFactory;
        this.metrics = new DispatchMetrics(metricFactory);
        this.enrichments = new EnrichmentChain();
        enrichments.add(new ContextEnrichment(ContextEnrichment.staticContext(configuration)));
        if (!configuration.redactedKeys().isEmpty()) {
            enrichments.add(new RedactionEnrichment(new SensitiveDataRedactor(configuration.redactedKeys())));
        }
        builder.enrichments.forEach(enrichments::add);
    }

    /**
     * Starts building a client that delivers to {@code pipeline}.
     *
     * @throws IllegalArgumentException if pipeline is null
     */
    public static Builder builder(EventPipeline pipeline) {
        return new Builder(pipeline);
    }

    // ---- Track ----

    /**
     * Tracks an action performed by the user.
     *
     * @param name name of the action, e.g. "Purchased a T-Shirt"
     */
    public void track(String name) {
        track(name, (List<Enrichment>) null);
    }

    /**
     * Tracks an action with typed properties. If the properties cannot be serialized the error is
     * reported as fatal and nothing is sent.
     *
     * @param name       name of the action
     * @param properties any serializable value (record, bean); {@code null} for none
     */
    public <P> void track(String name, P properties) {
        track(name, properties, null);
    }

    /**
     * Tracks an action with untyped properties. If the map cannot be serialized the error is
     * reported and the event is sent without properties.
     *
     * @param name       name of the action
     * @param properties properties keyed by name; {@code null} for none
     */
    public void track(String name, Map<String, ?> properties) {
        track(name, properties, null);
    }

    /**
     * Tracks an action under a caller-chosen message id, e.g. to make retries idempotent.
     *
     * @param messageId  unique id for the event
     * @param name       name of the action
     * @param properties untyped properties; {@code null} for none
     */
    public void track(String messageId, String name, Map<String, ?> properties) {
        emitTrack(messageId, name, properties, InputShape.UNTYPED, null);
    }

    /**
     * Tracks an action, applying {@code enrichments} to this event only.
     *
     * @param enrichments call-scoped enrichments, run after the pipeline-wide ones; may be null
     */
    public void track(String name, List<Enrichment> enrichments) {
        emitTrack(null, name, null, InputShape.TYPED, enrichments);
    }

    /** Typed-properties track with call-scoped enrichments. */
    public <P> void track(String name, P properties, List<Enrichment> enrichments) {
        emitTrack(null, name, properties, InputShape.TYPED, enrichments);
    }

    /** Untyped-properties track with call-scoped enrichments. */
    public void track(String name, Map<String, ?> properties, List<Enrichment> enrichments) {
        emitTrack(null, name, properties, InputShape.UNTYPED, enrichments);
    }

    // ---- Identify ----

    /**
     * Sets the current user id and records an Identify event. Known traits are kept.
     * <p>
     * When the user logs out, call {@link #reset()} to clear their identity.
     *
     * @param userId database id of the user; a {@code null} or blank id is reported as an invalid
     *               event and the identity is left as it was
     */
    public void identify(String userId) {
        identify(userId, (List<Enrichment>) null);
    }

    /**
     * Replaces the user's traits with {@code traits} and records an Identify event. The user id
     * is kept. If the traits cannot be serialized the error is reported as fatal, the state is not
     * touched and nothing is sent.
     *
     * @param traits what is known about the user (email, name, plan, ...), as a typed value
     */
    public <T> void identify(T traits) {
        identify(traits, (List<Enrichment>) null);
    }

    /**
     * Untyped flavour of {@link #identify(Object)}. If the map cannot be serialized the error is
     * reported, the traits are left as they were and the event is sent without traits.
     */
    public void identify(Map<String, ?> traits) {
        identify(traits, (List<Enrichment>) null);
    }

    /**
     * Sets the user id and, when {@code traits} is not null, replaces the traits in the same atomic
     * step, then records an Identify event.
     *
     * @param userId database id of the user
     * @param traits typed traits; {@code null} to keep the known traits
     */
    public <T> void identify(String userId, T traits) {
        identify(userId, traits, null);
    }

    /** Untyped flavour of {@link #identify(String, Object)}. */
    public void identify(String userId, Map<String, ?> traits) {
        identify(userId, traits, null);
    }

    /** {@link #identify(String)} with call-scoped enrichments. */
    public void identify(String userId, List<Enrichment> enrichments) {
        emitIdentify(userId, true, null, InputShape.TYPED, traits -> new IdentityAction.SetUserId(userId), enrichments);
    }

    /** {@link #identify(Object)} with call-scoped enrichments. */
    public <T> void identify(T traits, List<Enrichment> enrichments) {
        emitIdentify(null, false, traits, InputShape.TYPED, Analytics::setTraits, enrichments);
    }

    /** {@link #identify(Map)} with call-scoped enrichments. */
    public void identify(Map<String, ?> traits, List<Enrichment> enrichments) {
        emitIdentify(null, false, traits, InputShape.UNTYPED, Analytics::setTraits, enrichments);
    }

    /** {@link #identify(String, Object)} with call-scoped enrichments. */
    public <T> void identify(String userId, T traits, List<Enrichment> enrichments) {
        emitIdentify(userId, true, traits, InputShape.TYPED,
                serialized -> new IdentityAction.SetUserIdAndTraits(userId, serialized), enrichments);
    }

    /** {@link #identify(String, Map)} with call-scoped enrichments. */
    public void identify(String userId, Map<String, ?> traits, List<Enrichment> enrichments) {
        emitIdentify(userId, true, traits, InputShape.UNTYPED,
                serialized -> new IdentityAction.SetUserIdAndTraits(userId, serialized), enrichments);
    }

    // ---- Screen ----

    /** Records a screen view. */
    public void screen(String title) {
        screen(title, (String) null);
    }

    /**
     * Records a screen view.
     *
     * @param title    title of the screen
     * @param category category of the screen; {@code null} if it does not apply
     */
    public void screen(String title, String category) {
        screen(title, category, (List<Enrichment>) null);
    }

    /** Records a screen view with typed properties (method of access, size, ...). */
    public <P> void screen(String title, String category, P properties) {
        screen(title, category, properties, null);
    }

    /** Records a screen view with untyped properties. */
    public void screen(String title, String category, Map<String, ?> properties) {
        screen(title, category, properties, null);
    }

    public void screen(String title, String category, List<Enrichment> enrichments) {
        emitScreen(title, category, null, InputShape.TYPED, enrichments);
    }

    public <P> void screen(String title, String category, P properties, List<Enrichment> enrichments) {
        emitScreen(title, category, properties, InputShape.TYPED, enrichments);
    }

    public void screen(String title, String category, Map<String, ?> properties, List<Enrichment> enrichments) {
        emitScreen(title, category, properties, InputShape.UNTYPED, enrichments);
    }

    // ---- Group ----

    /**
     * Associates the user with a group such as a company, organization or project.
     *
     * @param groupId id of the group in your system
     */
    public void group(String groupId) {
        group(groupId, (List<Enrichment>) null);
    }

    /** Associates the user with a group described by typed traits. */
    public <T> void group(String groupId, T traits) {
        group(groupId, traits, null);
    }

    /** Associates the user with a group described by untyped traits. */
    public void group(String groupId, Map<String, ?> traits) {
        group(groupId, traits, null);
    }

    public void group(String groupId, List<Enrichment> enrichments) {
        emitGroup(groupId, null, InputShape.TYPED, enrichments);
    }

    public <T> void group(String groupId, T traits, List<Enrichment> enrichments) {
        emitGroup(groupId, traits, InputShape.TYPED, enrichments);
    }

    public void group(String groupId, Map<String, ?> traits, List<Enrichment> enrichments) {
        emitGroup(groupId, traits, InputShape.UNTYPED, enrichments);
    }

    // ---- Alias ----

    /**
     * Links {@code newId} to the current identity and makes it the user id. The event's
     * {@code previousId} is the user id before the call, or the anonymous id when there was none.
     */
    public void alias(String newId) {
        alias(newId, null);
    }

    public void alias(String newId, List<Enrichment> enrichments) {
        enterDispatch();
        try {
            IdentityState current = identityStore.current();
            AliasEvent bare = eventFactory.alias(newId, previousId(current), current.anonymousId());
            if (!accept(bare)) {
                return;
            }
            IdentityTransition transition = identityStore.dispatch(new IdentityAction.SetUserId(newId));
            IdentityState after = transition.after();
            var event = new AliasEvent(
                    bare.envelope().withIdentity(after.anonymousId(), after.userId()),
                    newId,
                    previousId(transition.before()));
            forward(event, enrichments);
        } finally {
            exitDispatch();
        }
    }

    // ---- Identity ----

    /**
     * Forgets the current user: clears user id and traits and generates a new anonymous id.
     * Call it when the user logs out.
     */
    public void reset() {
        IdentityTransition transition = identityStore.reset();
        log.debug("Identity reset, anonymousId={}", transition.after().anonymousId());
    }

    public String anonymousId() {
        return identityStore.current().anonymousId();
    }

    /** The current user id, if one has been set. */
    public Optional<String> userId() {
        return Optional.ofNullable(identityStore.current().userId());
    }

    /** The current traits, if any have been set. */
    public Optional<ObjectValue> traits() {
        return Optional.ofNullable(identityStore.current().traits());
    }

    /**
     * The current traits read back as {@code type}. A mismatch is reported (non-fatal) and gives
     * empty.
     */
    public <T> Optional<T> traits(Class<T> type) {
        ObjectValue traits = identityStore.current().traits();
        if (traits == null) {
            return Optional.empty();
        }
        try {
            return Optional.of(serializer.deserialize(traits, type));
        } catch (PayloadSerializationException e) {
            errorReporter.report(e, false);
            return Optional.empty();
        }
    }

    // ---- Enrichment registration ----

    /** Adds a pipeline-wide enrichment, run for every later event after those added before it. */
    public void add(Enrichment enrichment) {
        enrichments.add(enrichment);
    }

    public boolean remove(Enrichment enrichment) {
        return enrichments.remove(enrichment);
    }

    public AnalyticsConfiguration configuration() {
        return configuration;
    }

    public IdentityStore identityStore() {
        return identityStore;
    }

    // ---- Construction paths ----

    private void emitTrack(String messageId, String name, Object properties, InputShape shape,
                           List<Enrichment> callScoped) {
        enterDispatch();
        try {
            IdentityState state = identityStore.current();
            emit(eventFactory.track(messageId, name, null, state.anonymousId(), state.userId()),
                    false, properties, shape, null, callScoped);
        } finally {
            exitDispatch();
        }
    }

    private void emitIdentify(String userId, boolean userIdRequired, Object traits, InputShape shape,
                              Function<ObjectValue, IdentityAction> mutation, List<Enrichment> callScoped) {
        enterDispatch();
        try {
            IdentityState state = identityStore.current();
            emit(eventFactory.identify(userId, null, state.anonymousId(), state.userId()), userIdRequired,
                    traits, shape, mutation, callScoped);
        } finally {
            exitDispatch();
        }
    }

    private void emitScreen(String title, String category, Object properties, InputShape shape,
                            List<Enrichment> callScoped) {
        enterDispatch();
        try {
            IdentityState state = identityStore.current();
            emit(eventFactory.screen(title, category, null, state.anonymousId(), state.userId()),
                    false, properties, shape, null, callScoped);
        } finally {
            exitDispatch();
        }
    }

    private void emitGroup(String groupId, Object traits, InputShape shape, List<Enrichment> callScoped) {
        enterDispatch();
        try {
            IdentityState state = identityStore.current();
            emit(eventFactory.group(groupId, null, state.anonymousId(), state.userId()),
                    false, traits, shape, null, callScoped);
        } finally {
            exitDispatch();
        }
    }

    /**
     * Shared tail of every payload-carrying kind.
     *
     * @param bare           the event without payload, stamped with the pre-call identity
     * @param userIdRequired whether an identify event must carry a userId
     * @param mutation       maps the serialized payload to the identity action to apply, or to
     *                       {@code null} for none; {@code null} for kinds that do not touch identity
     */
    private void emit(PayloadEvent bare, boolean userIdRequired, Object rawPayload, InputShape shape,
                      Function<ObjectValue, IdentityAction> mutation, List<Enrichment> callScoped) {
        if (!accept(bare, userIdRequired)) {
            return;
        }
        PayloadResult payload = serializePayload(bare, rawPayload, shape);
        if (payload.aborted()) {
            return;
        }
        Event event = bare.withPayload(payload.value());
        if (mutation != null) {
            IdentityAction action = mutation.apply(payload.value());
            if (action != null) {
                IdentityState after = identityStore.dispatch(action).after();
                event = event.withEnvelope(event.envelope().withIdentity(after.anonymousId(), after.userId()));
            }
        }
        forward(event, callScoped);
    }

    private PayloadResult serializePayload(PayloadEvent bare, Object rawPayload, InputShape shape) {
        if (rawPayload == null) {
            return PayloadResult.ABSENT;
        }
        try {
            return new PayloadResult(serializer.serializeObject(rawPayload), false);
        } catch (PayloadSerializationException e) {
            errorReporter.report(e, shape.abortOnFailure);
            if (shape.abortOnFailure) {
                metrics.rejected(bare.type());
                return PayloadResult.ABORTED;
            }
            return PayloadResult.ABSENT;
        }
    }

    private boolean accept(Event event) {
        return accept(event, false);
    }

    private boolean accept(Event event, boolean userIdRequired) {
        if (!configuration.rejectInvalidEvents()) {
            return true;
        }
        ValidationResult result = EventValidator.validate(event, userIdRequired);
        if (result.valid()) {
            return true;
        }
        metrics.rejected(event.type());
        errorReporter.report(result.toException(), true);
        return false;
    }

    private void forward(Event event, List<Enrichment> callScoped) {
        var envelope = event.envelope();
        var logContext = new LogContext(
                envelope.messageId(), envelope.type().value(), envelope.anonymousId(), envelope.userId());
        LogContextHolder.runWithContext(logContext, () -> {
            Optional<Event> enriched;
            try {
                enriched = enrichments.apply(event, callScoped, this);
            } catch (DispatchContractException e) {
                throw e;
            } catch (RuntimeException e) {
                metrics.dropped(event.type());
                errorReporter.report(e, true);
                return;
            }
            if (enriched.isEmpty()) {
                log.debug("Event dropped by enrichment");
                metrics.dropped(event.type());
                return;
            }
            try {
                pipeline.process(enriched.get());
                metrics.dispatched(event.type());
            } catch (DispatchContractException e) {
                throw e;
            } catch (RuntimeException e) {
                metrics.dropped(event.type());
                errorReporter.report(e, true);
            }
        });
    }

    private void enterDispatch() {
        if (dispatching.get()) {
            throw new DispatchContractException(
                    "Events must not be emitted from inside an enrichment or the pipeline hand-off");
        }
        dispatching.set(Boolean.TRUE);
    }

    private void exitDispatch() {
        dispatching.remove();
    }

    private static IdentityAction setTraits(ObjectValue traits) {
        return traits != null ? new IdentityAction.SetTraits(traits) : null;
    }

    private static String previousId(IdentityState state) {
        return state.userId() != null ? state.userId() : state.anonymousId();
    }

    /**
     * Builder for {@link Analytics}. Only the pipeline is required; every other collaborator has
     * an in-process default.
     */
    public static final class Builder {
        private final EventPipeline pipeline;
        private AnalyticsConfiguration configuration = AnalyticsConfiguration.defaults();
        private PayloadSerializer serializer = new JacksonPayloadSerializer();
        private ErrorReporter errorReporter;
        private IdentityStore identityStore;
        private EventFactory eventFactory = new EventFactory();
        private MeterRegistry meterRegistry;
        private final List<Enrichment> enrichments = new ArrayList<>();

        private Builder(EventPipeline pipeline) {
            if (pipeline == null) {
                throw new IllegalArgumentException("pipeline must not be null");
            }
            this.pipeline = pipeline;
        }

        public Builder configuration(AnalyticsConfiguration configuration) {
            if (configuration == null) {
                throw new IllegalArgumentException("configuration must not be null");
            }
            this.configuration = configuration;
            return this;
        }

        public Builder payloadSerializer(PayloadSerializer serializer) {
            if (serializer == null) {
                throw new IllegalArgumentException("serializer must not be null");
            }
            this.serializer = serializer;
            return this;
        }

        /** Replaces the default {@link LoggingErrorReporter}. */
        public Builder errorReporter(ErrorReporter errorReporter) {
            if (errorReporter == null) {
                throw new IllegalArgumentException("errorReporter must not be null");
            }
            this.errorReporter = errorReporter;
            return this;
        }

        public Builder identityStore(IdentityStore identityStore) {
            if (identityStore == null) {
                throw new IllegalArgumentException("identityStore must not be null");
            }
            this.identityStore = identityStore;
            return this;
        }

        public Builder eventFactory(EventFactory eventFactory) {
            if (eventFactory == null) {
                throw new IllegalArgumentException("eventFactory must not be null");
            }
            this.eventFactory = eventFactory;
            return this;
        }

        /** Registry for dispatch and error metrics; a private {@link SimpleMeterRegistry} if unset. */
        public Builder meterRegistry(MeterRegistry meterRegistry) {
            if (meterRegistry == null) {
                throw new IllegalArgumentException("meterRegistry must not be null");
            }
            this.meterRegistry = meterRegistry;
            return this;
        }

        /** Adds a pipeline-wide enrichment, after the built-in context and redaction enrichments. */
        public Builder enrichment(Enrichment enrichment) {
            if (enrichment == null) {
                throw new IllegalArgumentException("enrichment must not be null");
            }
            enrichments.add(enrichment);
            return this;
        }

        public Analytics build() {
            if (identityStore == null) {
                identityStore = new IdentityStore();
            }
            var metricFactory = new MetricFactory(
                    meterRegistry != null ? meterRegistry : new SimpleMeterRegistry(), configuration.name());
            ErrorReporter reporter = errorReporter != null ? errorReporter : new LoggingErrorReporter(metricFactory);
            var analytics = new Analytics(this, metricFactory, reporter);
            log.info("Beacon client '{}' started, anonymousId={}", configuration.name(), analytics.anonymousId());
            return analytics;
        }
    }
}
