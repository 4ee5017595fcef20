package com.gt.lse.exception;

public class ContentServiceUnavailableException extends RuntimeException {

    public ContentServiceUnavailableException(String errMsg) {
        super(errMsg);
    }

    public ContentServiceUnavailableException(String errMsg, Exception ex) {
        super(errMsg, ex);
    }
}
