package com.gt.lse.model;

public record DifficultyRange(double min, double max) {

    public boolean contains(double difficulty) {
        return difficulty >= min && difficulty <= max;
    }
}
