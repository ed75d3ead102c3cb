package com.beacon.collector.api;

import com.beacon.client.Analytics;
import com.beacon.client.enrichment.RedactionEnrichment;
import com.beacon.collector.api.EventRequests.AliasRequest;
import com.beacon.collector.api.EventRequests.GroupRequest;
import com.beacon.collector.api.EventRequests.IdentifyRequest;
import com.beacon.collector.api.EventRequests.ScreenRequest;
import com.beacon.collector.api.EventRequests.TrackRequest;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;

/**
 * Ingest endpoints, one per event kind, each feeding the untyped entry point of {@link Analytics}.
 *
 * <p>Events are accepted, not confirmed: {@code 202} means the event went through the client, which
 * reports payload and pipeline problems through its error reporter rather than to the caller. Only
 * malformed request bodies are refused with {@code 400}. Identity responses mask sensitive trait
 * keys.
 */
@RestController
@RequestMapping("/api/v1")
public class EventIngestController {

    private final Analytics analytics;
    private final RedactionEnrichment responseRedaction;

    public EventIngestController(Analytics analytics, RedactionEnrichment responseRedaction) {
        this.analytics = analytics;
        this.responseRedaction = responseRedaction;
    }

    @PostMapping("/track")
    @ResponseStatus(HttpStatus.ACCEPTED)
    public void track(@Valid @RequestBody TrackRequest request) {
        if (request.messageId() != null) {
            analytics.track(request.messageId(), request.event(), request.properties());
        } else {
            analytics.track(request.event(), request.properties());
        }
    }

    @PostMapping("/identify")
    @ResponseStatus(HttpStatus.ACCEPTED)
    public void identify(@RequestBody IdentifyRequest request) {
        if (request.userId() == null && request.traits() == null) {
            throw new IllegalArgumentException("identify needs a userId, traits, or both");
        }
        if (request.userId() == null) {
            analytics.identify(request.traits());
        } else {
            analytics.identify(request.userId(), request.traits());
        }
    }

    @PostMapping("/screen")
    @ResponseStatus(HttpStatus.ACCEPTED)
    public void screen(@Valid @RequestBody ScreenRequest request) {
        analytics.screen(request.name(), request.category(), request.properties());
    }

    @PostMapping("/group")
    @ResponseStatus(HttpStatus.ACCEPTED)
    public void group(@Valid @RequestBody GroupRequest request) {
        analytics.group(request.groupId(), request.traits());
    }

    @PostMapping("/alias")
    @ResponseStatus(HttpStatus.ACCEPTED)
    public void alias(@Valid @RequestBody AliasRequest request) {
        analytics.alias(request.userId());
    }

    /** Forgets the current user; returns the fresh identity. */
    @PostMapping("/reset")
    public IdentityResponse reset() {
        analytics.reset();
        return identity();
    }

    @GetMapping("/identity")
    public IdentityResponse identity() {
        return IdentityResponse.from(analytics.identityStore().current(), responseRedaction);
    }
}
