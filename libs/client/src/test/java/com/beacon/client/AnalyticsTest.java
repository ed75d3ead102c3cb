package com.beacon.client;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isA;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;

import com.beacon.eventmodel.AliasEvent;
import com.beacon.eventmodel.Event;
import com.beacon.eventmodel.EventFactory;
import com.beacon.eventmodel.EventType;
import com.beacon.eventmodel.GroupEvent;
import com.beacon.eventmodel.IdentifyEvent;
import com.beacon.eventmodel.InvalidEventException;
import com.beacon.eventmodel.ObjectValue;
import com.beacon.eventmodel.PayloadSerializationException;
import com.beacon.eventmodel.ScreenEvent;
import com.beacon.eventmodel.StringValue;
import com.beacon.eventmodel.TrackEvent;
import com.beacon.identity.IdentityState;
import com.beacon.identity.IdentityStorage;
import com.beacon.identity.IdentityStore;
import com.beacon.identity.InMemoryIdentityStorage;
import com.beacon.observability.ErrorReporter;
import com.beacon.observability.LogContextHolder;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
@DisplayName("Analytics")
class AnalyticsTest {

    private static final Instant NOW = Instant.parse("2026-03-01T12:00:00Z");

    record Purchase(String sku, int quantity) {}

    record Profile(String email, String plan) {}

    static final class ExplodingBean {
        public String getValue() {
            throw new IllegalStateException("boom");
        }
    }

    @Mock
    private ErrorReporter reporter;

    private final List<Event> delivered = new ArrayList<>();
    private SimpleMeterRegistry registry;
    private Analytics analytics;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        analytics = newClient(AnalyticsConfiguration.defaults());
    }

    private Analytics newClient(AnalyticsConfiguration configuration) {
        var messageIds = new AtomicInteger();
        var anonymousIds = new AtomicInteger();
        return Analytics.builder(delivered::add)
                .configuration(configuration)
                .errorReporter(reporter)
                .meterRegistry(registry)
                .eventFactory(new EventFactory(Clock.fixed(NOW, ZoneOffset.UTC), () -> "msg-" + messageIds.incrementAndGet()))
                .identityStore(new IdentityStore(new InMemoryIdentityStorage(), () -> "anon-" + anonymousIds.incrementAndGet()))
                .build();
    }

    private Event only() {
        assertThat(delivered).hasSize(1);
        return delivered.get(0);
    }

    private double count(String metric, EventType type) {
        var counter = registry.find(metric).tag("type", type.value()).counter();
        return counter == null ? 0 : counter.count();
    }

    @Nested
    @DisplayName("track")
    class Track {

        @Test
        @DisplayName("typed and untyped properties for the same data are equal")
        void typedEqualsUntyped() {
            analytics.track("Purchased", new Purchase("A1", 2));
            analytics.track("Purchased", Map.of("quantity", 2, "sku", "A1"));

            var typed = (TrackEvent) delivered.get(0);
            var untyped = (TrackEvent) delivered.get(1);
            assertThat(typed.properties()).isNotNull().isEqualTo(untyped.properties());
            assertThat(typed.properties().string("sku")).contains("A1");
        }

        @Test
        @DisplayName("no properties and null properties both give an absent payload")
        void absentPayload() {
            analytics.track("x");
            analytics.track("x", (Map<String, ?>) null);
            analytics.track("x", (Purchase) null);

            assertThat(delivered).hasSize(3)
                    .allSatisfy(event -> assertThat(((TrackEvent) event).payload()).isEmpty());
        }

        @Test
        @DisplayName("stamps the envelope from the factory and the identity snapshot")
        void envelope() {
            analytics.identify("u1");
            delivered.clear();

            analytics.track("Opened");

            var event = (TrackEvent) only();
            assertThat(event.event()).isEqualTo("Opened");
            assertThat(event.envelope().messageId()).isEqualTo("msg-2");
            assertThat(event.envelope().timestamp()).isEqualTo(NOW);
            assertThat(event.envelope().anonymousId()).isEqualTo("anon-1");
            assertThat(event.envelope().userId()).isEqualTo("u1");
        }

        @Test
        @DisplayName("uses a caller-supplied message id")
        void callerMessageId() {
            analytics.track("retry-42", "Checkout", Map.of("step", 3));

            assertThat(only().messageId()).isEqualTo("retry-42");
        }

        @Test
        @DisplayName("typed serialization failure is reported fatal and nothing is sent")
        void typedFailure() {
            analytics.track("Broken", new ExplodingBean());

            assertThat(delivered).isEmpty();
            verify(reporter).report(isA(PayloadSerializationException.class), eq(true));
            assertThat(count(DispatchMetrics.REJECTED, EventType.TRACK)).isEqualTo(1);
        }

        @Test
        @DisplayName("untyped serialization failure is reported and the event is sent without properties")
        void untypedFailure() {
            analytics.track("Broken", Map.of("handle", new Object()));

            verify(reporter).report(isA(PayloadSerializationException.class), eq(false));
            var event = (TrackEvent) only();
            assertThat(event.event()).isEqualTo("Broken");
            assertThat(event.properties()).isNull();
        }

        @Test
        @DisplayName("blank name is rejected as a fatal invalid event")
        void blankName() {
            analytics.track(" ");

            assertThat(delivered).isEmpty();
            var captor = ArgumentCaptor.forClass(Throwable.class);
            verify(reporter).report(captor.capture(), eq(true));
            assertThat(captor.getValue()).isInstanceOf(InvalidEventException.class)
                    .hasMessageContaining("event name");
        }

        @Test
        @DisplayName("blank name passes when validation is switched off")
        void validationOff() {
            var lenient = newClient(new AnalyticsConfiguration(null, false, null, null));

            lenient.track("");

            assertThat(((TrackEvent) only()).event()).isEmpty();
            verifyNoInteractions(reporter);
        }

        @Test
        @DisplayName("counts dispatched events per type")
        void metrics() {
            analytics.track("a");
            analytics.track("b");
            analytics.screen("Home");

            assertThat(count(DispatchMetrics.DISPATCHED, EventType.TRACK)).isEqualTo(2);
            assertThat(count(DispatchMetrics.DISPATCHED, EventType.SCREEN)).isEqualTo(1);
        }
    }

    @Nested
    @DisplayName("identify")
    class Identify {

        @Test
        @DisplayName("userId and traits update together and the event carries the new identity")
        void userIdAndTraits() {
            analytics.identify("u1", Map.of("a", 1));

            assertThat(analytics.userId()).contains("u1");
            assertThat(analytics.traits()).contains(ObjectValue.builder().put("a", 1).build());
            var event = (IdentifyEvent) only();
            assertThat(event.userId()).isEqualTo("u1");
            assertThat(event.envelope().userId()).isEqualTo("u1");
            assertThat(event.traits()).isEqualTo(ObjectValue.builder().put("a", 1).build());
        }

        @Test
        @DisplayName("traits-only identify keeps the user id and replaces the traits")
        void traitsOnly() {
            analytics.identify("u1", Map.of("a", 1));

            analytics.identify(Map.of("b", 2));

            assertThat(analytics.userId()).contains("u1");
            assertThat(analytics.traits()).contains(ObjectValue.builder().put("b", 2).build());
            var event = (IdentifyEvent) delivered.get(1);
            assertThat(event.userId()).isNull();
            assertThat(event.envelope().userId()).isEqualTo("u1");
        }

        @Test
        @DisplayName("userId-only identify keeps the known traits")
        void userIdOnly() {
            analytics.identify(new Profile("ada@example.com", "pro"));

            analytics.identify("u7");

            assertThat(analytics.userId()).contains("u7");
            assertThat(analytics.traits(Profile.class)).contains(new Profile("ada@example.com", "pro"));
        }

        @Test
        @DisplayName("typed traits failure leaves the state untouched")
        void typedFailure() {
            analytics.identify("u1", Map.of("a", 1));
            delivered.clear();

            analytics.identify("u2", new ExplodingBean());

            assertThat(delivered).isEmpty();
            assertThat(analytics.userId()).contains("u1");
            verify(reporter).report(isA(PayloadSerializationException.class), eq(true));
        }

        @Test
        @DisplayName("untyped traits failure still sets the user id and keeps the traits")
        void untypedFailureWithUserId() {
            analytics.identify("u1", Map.of("a", 1));
            delivered.clear();

            analytics.identify("u2", Map.of("handle", new Object()));

            assertThat(analytics.userId()).contains("u2");
            assertThat(analytics.traits()).contains(ObjectValue.builder().put("a", 1).build());
            var event = (IdentifyEvent) only();
            assertThat(event.traits()).isNull();
            assertThat(event.envelope().userId()).isEqualTo("u2");
            verify(reporter).report(isA(PayloadSerializationException.class), eq(false));
        }

        @Test
        @DisplayName("untyped traits-only failure changes no state")
        void untypedTraitsOnlyFailure() {
            analytics.identify("u1", Map.of("a", 1));
            long version = analytics.identityStore().current().version();

            analytics.identify(Map.of("handle", new Object()));

            assertThat(analytics.identityStore().current().version()).isEqualTo(version);
            assertThat(delivered).hasSize(2);
        }

        @Test
        @DisplayName("a null userId on the userId overloads is rejected and the identity is kept")
        void nullUserIdRejected() {
            analytics.identify("u1", Map.of("a", 1));
            delivered.clear();

            analytics.identify((String) null);
            analytics.identify((String) null, Map.of("b", 2));
            analytics.identify((String) null, new Profile("ada@example.com", "pro"));

            assertThat(delivered).isEmpty();
            assertThat(analytics.userId()).contains("u1");
            assertThat(analytics.traits()).contains(ObjectValue.builder().put("a", 1).build());
            var captor = ArgumentCaptor.forClass(Throwable.class);
            verify(reporter, times(3)).report(captor.capture(), eq(true));
            assertThat(captor.getAllValues()).allSatisfy(error -> assertThat(error)
                    .isInstanceOf(InvalidEventException.class)
                    .hasMessageContaining("userId must not be null or blank"));
            assertThat(count(DispatchMetrics.REJECTED, EventType.IDENTIFY)).isEqualTo(3);
        }

        @Test
        @DisplayName("a failing identity storage still delivers the event with the new identity")
        void failingStorage() {
            IdentityStorage storage = new IdentityStorage() {
                private IdentityState saved;

                @Override
                public Optional<IdentityState> load() {
                    return Optional.ofNullable(saved);
                }

                @Override
                public void save(IdentityState state) {
                    if (saved != null) {
                        throw new IllegalStateException("disk full");
                    }
                    saved = state;
                }
            };
            var client = Analytics.builder(delivered::add)
                    .errorReporter(reporter)
                    .meterRegistry(registry)
                    .identityStore(new IdentityStore(storage, () -> "anon-s"))
                    .build();

            client.identify("u1", Map.of("a", 1));

            assertThat(client.userId()).contains("u1");
            assertThat(only().envelope().userId()).isEqualTo("u1");
            verifyNoInteractions(reporter);
        }

        @Test
        @DisplayName("reading traits as a mismatched type reports a recovered error")
        void traitsMismatch() {
            analytics.identify(Map.of("email", Map.of("nested", true)));

            assertThat(analytics.traits(Profile.class)).isEmpty();
            verify(reporter).report(isA(PayloadSerializationException.class), eq(false));
        }
    }

    @Nested
    @DisplayName("screen and group")
    class ScreenAndGroup {

        @Test
        @DisplayName("screen carries title, category and properties")
        void screen() {
            analytics.screen("Cart", "Checkout", Map.of("items", 3));

            var event = (ScreenEvent) only();
            assertThat(event.name()).isEqualTo("Cart");
            assertThat(event.category()).isEqualTo("Checkout");
            assertThat(event.properties().get("items")).isPresent();
        }

        @Test
        @DisplayName("screen without category")
        void screenWithoutCategory() {
            analytics.screen("Home");

            var event = (ScreenEvent) only();
            assertThat(event.category()).isNull();
            assertThat(event.payload()).isEmpty();
        }

        @Test
        @DisplayName("group does not touch identity state")
        void group() {
            analytics.group("acme", new Profile("ops@acme.io", "enterprise"));

            var event = (GroupEvent) only();
            assertThat(event.groupId()).isEqualTo("acme");
            assertThat(event.traits().string("plan")).contains("enterprise");
            assertThat(analytics.traits()).isEmpty();
        }

        @Test
        @DisplayName("call-scoped enrichments reach group events")
        void groupEnrichments() {
            Enrichment tag = (event, client) -> Optional.of(event.withEnvelope(
                    event.envelope().withIntegrations(ObjectValue.builder().put("All", false).build())));

            analytics.group("acme", Map.of("seats", 10), List.of(tag));

            assertThat(only().envelope().integrations().containsKey("All")).isTrue();
        }
    }

    @Nested
    @DisplayName("alias and reset")
    class AliasAndReset {

        @Test
        @DisplayName("alias links the previous user id to the new one")
        void alias() {
            analytics.identify("u1");
            delivered.clear();

            analytics.alias("u2");

            var event = (AliasEvent) only();
            assertThat(event.previousId()).isEqualTo("u1");
            assertThat(event.newId()).isEqualTo("u2");
            assertThat(event.envelope().userId()).isEqualTo("u2");
            assertThat(analytics.userId()).contains("u2");
        }

        @Test
        @DisplayName("alias without a user id falls back to the anonymous id")
        void aliasAnonymous() {
            analytics.alias("u2");

            assertThat(((AliasEvent) only()).previousId()).isEqualTo("anon-1");
        }

        @Test
        @DisplayName("blank alias id is rejected and the state is untouched")
        void blankAlias() {
            analytics.alias("");

            assertThat(delivered).isEmpty();
            assertThat(analytics.userId()).isEmpty();
            verify(reporter).report(isA(InvalidEventException.class), eq(true));
        }

        @Test
        @DisplayName("reset forgets the user and regenerates the anonymous id")
        void reset() {
            analytics.identify("u1", Map.of("a", 1));

            analytics.reset();

            assertThat(analytics.anonymousId()).isEqualTo("anon-2");
            assertThat(analytics.userId()).isEmpty();
            assertThat(analytics.traits()).isEmpty();
        }
    }

    @Nested
    @DisplayName("enrichment")
    class Enrichments {

        @Test
        @DisplayName("runs pipeline-wide enrichments before call-scoped ones, each in order")
        void ordering() {
            var calls = new ArrayList<String>();
            analytics.add(recording("wide-1", calls));
            analytics.add(recording("wide-2", calls));
            List<Enrichment> callScoped = List.of(recording("call-1", calls), recording("call-2", calls));

            analytics.track("x", callScoped);

            assertThat(calls).containsExactly("wide-1", "wide-2", "call-1", "call-2");
            assertThat(delivered).hasSize(1);
        }

        @Test
        @DisplayName("a drop halts the chain and nothing reaches the pipeline")
        void drop() {
            var calls = new ArrayList<String>();
            Enrichment dropper = (event, client) -> Optional.empty();
            analytics.add(dropper);
            List<Enrichment> callScoped = List.of(recording("after-drop", calls));

            analytics.track("x", callScoped);

            assertThat(delivered).isEmpty();
            assertThat(calls).isEmpty();
            assertThat(count(DispatchMetrics.DROPPED, EventType.TRACK)).isEqualTo(1);
            verifyNoInteractions(reporter);
        }

        @Test
        @DisplayName("removed enrichments no longer run")
        void remove() {
            Enrichment dropper = (event, client) -> Optional.empty();
            analytics.add(dropper);
            assertThat(analytics.remove(dropper)).isTrue();

            analytics.track("x");

            assertThat(delivered).hasSize(1);
        }

        @Test
        @DisplayName("emitting an event from inside an enrichment throws to the caller")
        void reentrantDispatch() {
            Enrichment reentrant = (event, client) -> {
                client.track("nested");
                return Optional.of(event);
            };
            analytics.add(reentrant);

            assertThatThrownBy(() -> analytics.track("outer"))
                    .isInstanceOf(DispatchContractException.class)
                    .isInstanceOf(IllegalStateException.class);
            assertThat(delivered).isEmpty();

            analytics.remove(reentrant);
            analytics.track("after");
            assertThat(delivered).hasSize(1);
        }

        @Test
        @DisplayName("changing an event's kind throws to the caller")
        void kindChange() {
            var factory = new EventFactory();
            Enrichment swap = (event, client) ->
                    Optional.of(factory.identify("u1", null, event.envelope().anonymousId(), null));
            analytics.add(swap);

            assertThatThrownBy(() -> analytics.track("x"))
                    .isInstanceOf(DispatchContractException.class)
                    .hasMessageContaining("track")
                    .hasMessageContaining("identify");
        }

        @Test
        @DisplayName("a failing enrichment is reported fatal and the event is discarded")
        void failingEnrichment() {
            Enrichment failing = (event, client) -> {
                throw new IllegalArgumentException("bad enrichment");
            };
            analytics.add(failing);

            analytics.track("x");

            assertThat(delivered).isEmpty();
            verify(reporter).report(isA(IllegalArgumentException.class), eq(true));
        }

        @Test
        @DisplayName("enrichments may read the identity state")
        void readsIdentity() {
            analytics.identify("u1");
            delivered.clear();
            Enrichment stamp = (event, client) -> Optional.of(event.withEnvelope(event.envelope().withContext(
                    event.envelope().context().with("seenUser", new StringValue(client.userId().orElse("none"))))));

            analytics.track("x", List.of(stamp));

            assertThat(only().envelope().context().string("seenUser")).contains("u1");
        }

        @Test
        @DisplayName("the log context is set during enrichment and cleared afterwards")
        void logContext() {
            var seen = new ArrayList<String>();
            analytics.add((event, client) -> {
                LogContextHolder.get().ifPresent(ctx -> seen.add(ctx.eventType() + ":" + ctx.messageId()));
                return Optional.of(event);
            });

            analytics.track("x");

            assertThat(seen).containsExactly("track:msg-1");
            assertThat(LogContextHolder.get()).isEmpty();
        }

        private Enrichment recording(String name, List<String> calls) {
            return (event, client) -> {
                calls.add(name);
                return Optional.of(event);
            };
        }
    }

    @Nested
    @DisplayName("built-in enrichments")
    class BuiltIns {

        @Test
        @DisplayName("every event carries the library context and configured static context")
        void context() {
            var client = newClient(new AnalyticsConfiguration("shop", null, null, Map.of("app", "shop-ios")));

            client.track("x");

            var context = only().envelope().context();
            assertThat(context.object("library").flatMap(lib -> lib.string("name"))).contains(Analytics.LIBRARY_NAME);
            assertThat(context.string("app")).contains("shop-ios");
        }

        @Test
        @DisplayName("configured keys are redacted before user enrichments see the payload")
        void redaction() {
            var client = newClient(new AnalyticsConfiguration(null, null, Set.of("password"), null));
            var seen = new ArrayList<ObjectValue>();
            client.add((event, c) -> {
                ((TrackEvent) event).payload().ifPresent(seen::add);
                return Optional.of(event);
            });

            client.track("Signed Up", Map.of("user", "ada", "password", "hunter2"));

            assertThat(seen.get(0).string("password")).contains("[REDACTED]");
            assertThat(((TrackEvent) only()).properties().string("user")).contains("ada");
        }
    }

    @Nested
    @DisplayName("pipeline failures")
    class PipelineFailures {

        @Test
        @DisplayName("a throwing pipeline is reported fatal and later calls still work")
        void throwingPipeline() {
            var failing = Analytics.builder(event -> {
                        throw new IllegalStateException("queue full");
                    })
                    .errorReporter(reporter)
                    .meterRegistry(registry)
                    .build();

            failing.track("x");
            failing.track("y");

            verify(reporter, times(2)).report(isA(IllegalStateException.class), eq(true));
            assertThat(count(DispatchMetrics.DROPPED, EventType.TRACK)).isEqualTo(2);
        }

        @Test
        @DisplayName("builder rejects a null pipeline")
        void nullPipeline() {
            assertThatThrownBy(() -> Analytics.builder(null))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("pipeline");
        }

        @Test
        @DisplayName("builder rejects null collaborators with IllegalArgumentException")
        void nullCollaborators() {
            var builder = Analytics.builder(delivered::add);

            assertThatThrownBy(() -> builder.errorReporter(null))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessage("errorReporter must not be null");
            assertThatThrownBy(() -> builder.identityStore(null))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessage("identityStore must not be null");
            assertThatThrownBy(() -> builder.enrichment(null))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessage("enrichment must not be null");
        }

        @Test
        @DisplayName("successful dispatch reports nothing")
        void noReports() {
            analytics.track("x", new Purchase("A1", 1));

            verify(reporter, never()).report(any(), anyBoolean());
        }
    }
}
