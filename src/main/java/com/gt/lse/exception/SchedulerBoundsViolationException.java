package com.gt.lse.exception;

// A scheduled review state fell outside its configured bounds after clamping. Indicates a programming defect.
public class SchedulerBoundsViolationException extends IllegalStateException {

    public SchedulerBoundsViolationException(String msg) {
        super(msg);
    }
}
