package com.gt.lse.model;

import java.time.Instant;

public record ReviewState(String userId,
                          String itemId,
                          int repetitions,
                          double stabilityDays,
                          double difficultyFactor,
                          Instant lastReviewed,
                          Instant nextDue,
                          int lapses,
                          int correctStreak,
                          long version) {

    // State for an item the user has never been shown. Version 0 means no durable row exists yet.
    public static ReviewState firstExposure(String userId, String itemId, double difficultyFactor) {
        return new ReviewState(userId, itemId, 0, 0, difficultyFactor, null, null, 0, 0, 0);
    }

    public boolean isPersisted() {
        return version > 0;
    }
}
