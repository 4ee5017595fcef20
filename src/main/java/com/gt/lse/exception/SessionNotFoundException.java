package com.gt.lse.exception;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

// Thrown when a session is in neither the fast tier nor the durable store. The caller has to start a new session.
@ResponseStatus(value = HttpStatus.NOT_FOUND)
public class SessionNotFoundException extends RuntimeException {

    private final String sessionId;

    public SessionNotFoundException(String sessionId) {
        super("Session " + sessionId + " does not exist");
        this.sessionId = sessionId;
    }

    public String getSessionId() {
        return sessionId;
    }
}
