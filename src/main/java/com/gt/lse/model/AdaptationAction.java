package com.gt.lse.model;

public enum AdaptationAction {
    Hold,
    Escalate,
    Remediate
}
