package com.gt.lse.model;

public enum Outcome {
    Correct(1.0),
    Partial(0.5),
    Incorrect(0.0);

    private final double credit;

    Outcome(double credit) {
        this.credit = credit;
    }

    // Share of an accuracy point this outcome earns in an effectiveness window
    public double getCredit() {
        return credit;
    }
}
