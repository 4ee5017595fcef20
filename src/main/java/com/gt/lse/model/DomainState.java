package com.gt.lse.model;

public enum DomainState {
    Nominal,
    Struggling,
    Accelerating
}
