package com.gt.lse.model;

public enum SessionStatus {
    Active,
    Paused,
    Completed
}
