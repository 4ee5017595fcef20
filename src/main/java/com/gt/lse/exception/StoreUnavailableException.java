package com.gt.lse.exception;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

// Thrown when the durable store could not be reached after retries were exhausted
@ResponseStatus(value = HttpStatus.SERVICE_UNAVAILABLE)
public class StoreUnavailableException extends DaoException {

    public StoreUnavailableException(String errMsg) {
        super(errMsg);
    }

    public StoreUnavailableException(String errMsg, Exception ex) {
        super(errMsg, ex);
    }
}
