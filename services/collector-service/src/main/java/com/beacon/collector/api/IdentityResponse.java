package com.beacon.collector.api;

import com.beacon.client.enrichment.RedactionEnrichment;
import com.beacon.eventmodel.ObjectValue;
import com.beacon.identity.IdentityState;
import com.fasterxml.jackson.annotation.JsonInclude;

/** Snapshot of the collector's identity state as returned by the identity endpoints. */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record IdentityResponse(String anonymousId, String userId, ObjectValue traits, long version) {

    /** The state with sensitive trait keys masked; the stored traits are not changed. */
    public static IdentityResponse from(IdentityState state, RedactionEnrichment redaction) {
        return new IdentityResponse(
                state.anonymousId(), state.userId(), redaction.redact(state.traits()), state.version());
    }
}
