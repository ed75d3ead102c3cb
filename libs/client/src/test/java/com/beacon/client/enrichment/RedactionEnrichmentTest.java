package com.beacon.client.enrichment;

import static org.assertj.core.api.Assertions.assertThat;

import com.beacon.eventmodel.AliasEvent;
import com.beacon.eventmodel.EventFactory;
import com.beacon.eventmodel.ListValue;
import com.beacon.eventmodel.ObjectValue;
import com.beacon.eventmodel.StringValue;
import com.beacon.eventmodel.TrackEvent;
import com.beacon.observability.SensitiveDataRedactor;
import java.util.Set;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("RedactionEnrichment")
class RedactionEnrichmentTest {

    private static final StringValue MASK = new StringValue(SensitiveDataRedactor.REDACTED);

    private final EventFactory factory = new EventFactory();
    private final RedactionEnrichment enrichment =
            new RedactionEnrichment(new SensitiveDataRedactor(Set.of("password", "ssn")));

    @Test
    @DisplayName("masks sensitive keys at any depth and inside lists")
    void nested() {
        var payload = ObjectValue.builder()
                .put("user", "ada")
                .put("userPassword", "hunter2")
                .put("billing", ObjectValue.builder().put("SSN", "123-45-6789").put("zip", "10001").build())
                .put("accounts", ListValue.of(ObjectValue.builder().put("password", "x").build()))
                .build();
        var event = factory.track(null, "Signed Up", payload, "anon-1", null);

        var properties = ((TrackEvent) enrichment.enrich(event, null).orElseThrow()).properties();

        assertThat(properties.string("user")).contains("ada");
        assertThat(properties.get("userPassword")).contains(MASK);
        assertThat(properties.object("billing").orElseThrow().get("SSN")).contains(MASK);
        assertThat(properties.object("billing").orElseThrow().string("zip")).contains("10001");
        var account = (ObjectValue) ((ListValue) properties.get("accounts").orElseThrow()).get(0);
        assertThat(account.get("password")).contains(MASK);
    }

    @Test
    @DisplayName("returns the same event when nothing is sensitive")
    void untouched() {
        var event = factory.track(null, "Opened", ObjectValue.builder().put("screen", "home").build(), "anon-1", null);

        assertThat(enrichment.enrich(event, null)).containsSame(event);
    }

    @Test
    @DisplayName("passes events without a payload through")
    void noPayload() {
        AliasEvent alias = factory.alias("u2", "u1", "anon-1");
        var track = factory.track(null, "Opened", null, "anon-1", null);

        assertThat(enrichment.enrich(alias, null)).containsSame(alias);
        assertThat(enrichment.enrich(track, null)).containsSame(track);
    }

    @Test
    @DisplayName("redacts a standalone object and passes null through")
    void standaloneObject() {
        var traits = ObjectValue.builder().put("ssn", "123-45-6789").put("plan", "pro").build();

        var masked = enrichment.redact(traits);

        assertThat(masked.get("ssn")).contains(MASK);
        assertThat(masked.string("plan")).contains("pro");
        assertThat(traits.string("ssn")).contains("123-45-6789");
        assertThat(enrichment.redact(null)).isNull();
    }
}
