package com.gt.lse.session;

import com.gt.lse.model.InteractionEvent;
import com.gt.lse.model.InteractionResponse;
import com.gt.lse.model.SessionContext;
import com.gt.lse.model.SessionSummary;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/rest/session")
public class SessionController {

    private final SessionOrchestrator sessionOrchestrator;

    public SessionController(SessionOrchestrator sessionOrchestrator) {
        this.sessionOrchestrator = sessionOrchestrator;
    }

    @PostMapping(value = "/start", consumes = "application/json", produces = "application/json")
    public SessionContext startSession(@RequestBody StartSessionRequest request) {
        return sessionOrchestrator.startSession(request.userId(), request.skillDomains(), request.extraCurricular());
    }

    @GetMapping(value = "/{sessionId}", produces = "application/json")
    public SessionContext getSession(@PathVariable("sessionId") String sessionId) {
        return sessionOrchestrator.getSession(sessionId);
    }

    @PostMapping(value = "/{sessionId}/interact", consumes = "application/json", produces = "application/json")
    public InteractionResponse interact(@PathVariable("sessionId") String sessionId,
                                        @RequestBody InteractionEvent event) {
        // Events posted without a session id belong to the session in the path
        InteractionEvent sessionEvent = event.sessionId() != null
                ? event
                : new InteractionEvent(event.eventId(), sessionId, event.itemId(), event.outcome(), event.latencyMs(),
                        event.cursorPosition(), event.kind(), event.occurredAt());

        return sessionOrchestrator.interact(sessionId, sessionEvent);
    }

    @PostMapping(value = "/{sessionId}/pause", produces = "application/json")
    public SessionContext pauseSession(@PathVariable("sessionId") String sessionId) {
        return sessionOrchestrator.pauseSession(sessionId);
    }

    @PostMapping(value = "/{sessionId}/resume", produces = "application/json")
    public SessionContext resumeSession(@PathVariable("sessionId") String sessionId) {
        return sessionOrchestrator.resumeSession(sessionId);
    }

    @PostMapping(value = "/{sessionId}/end", produces = "application/json")
    public SessionSummary endSession(@PathVariable("sessionId") String sessionId) {
        return sessionOrchestrator.endSession(sessionId);
    }

    private record StartSessionRequest(String userId, List<String> skillDomains, boolean extraCurricular) { }
}
