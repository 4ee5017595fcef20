package com.gt.lse.exception;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

// Thrown when an interaction cannot be applied to the session as it currently stands. Never retriable.
@ResponseStatus(value = HttpStatus.CONFLICT)
public class InvalidEventException extends RuntimeException {

    public enum Reason {
        MalformedEvent,
        SessionMismatch,
        SessionNotActive,
        CursorSuperseded,
        CursorAhead,
        ItemNotInQueue
    }

    private final Reason reason;

    public InvalidEventException(Reason reason, String msg) {
        super(msg);
        this.reason = reason;
    }

    public Reason getReason() {
        return reason;
    }

    public boolean isRetriable() {
        return false;
    }
}
