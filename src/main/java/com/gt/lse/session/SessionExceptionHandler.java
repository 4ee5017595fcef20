package com.gt.lse.session;

import com.gt.lse.exception.ContentServiceUnavailableException;
import com.gt.lse.exception.DaoException;
import com.gt.lse.exception.InvalidEventException;
import com.gt.lse.exception.SchedulerBoundsViolationException;
import com.gt.lse.exception.SessionNotFoundException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestControllerAdvice;

// Error bodies tell the caller whether repeating the same request can succeed
@RestControllerAdvice
public class SessionExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(SessionExceptionHandler.class);

    public record ErrorResponse(String error, String reason, String message, boolean retriable) { }

    @ExceptionHandler(SessionNotFoundException.class)
    @ResponseStatus(HttpStatus.NOT_FOUND)
    public ErrorResponse handleSessionNotFound(SessionNotFoundException ex) {
        return new ErrorResponse("SessionNotFound", null, ex.getMessage(), false);
    }

    @ExceptionHandler(InvalidEventException.class)
    @ResponseStatus(HttpStatus.CONFLICT)
    public ErrorResponse handleInvalidEvent(InvalidEventException ex) {
        log.debug("Rejected interaction: {}", ex.getMessage());
        return new ErrorResponse("InvalidEvent", ex.getReason().toString(), ex.getMessage(), ex.isRetriable());
    }

    @ExceptionHandler(DaoException.class)
    @ResponseStatus(HttpStatus.SERVICE_UNAVAILABLE)
    public ErrorResponse handleStoreUnavailable(DaoException ex) {
        log.error("Durable store failure", ex);
        return new ErrorResponse("StoreUnavailable", null, ex.getMessage(), true);
    }

    @ExceptionHandler(ContentServiceUnavailableException.class)
    @ResponseStatus(HttpStatus.SERVICE_UNAVAILABLE)
    public ErrorResponse handleContentServiceUnavailable(ContentServiceUnavailableException ex) {
        return new ErrorResponse("ContentServiceUnavailable", null, ex.getMessage(), true);
    }

    @ExceptionHandler(SchedulerBoundsViolationException.class)
    @ResponseStatus(HttpStatus.INTERNAL_SERVER_ERROR)
    public ErrorResponse handleSchedulerBoundsViolation(SchedulerBoundsViolationException ex) {
        log.error("Scheduler produced an out-of-bounds review state", ex);
        return new ErrorResponse("SchedulerBoundsViolation", null, ex.getMessage(), false);
    }
}
