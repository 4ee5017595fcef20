package com.gt.lse.model;

import java.time.Duration;

/**
 * End-of-session view of one skill domain. {@code estimatedMasteryTime} is null when the window
 * holds no trajectory to project from.
 */
public record DomainSummary(String skillDomain,
                            DomainState finalState,
                            double finalScore,
                            int windowSize,
                            double accuracy,
                            double difficultyTrend,
                            double difficultyProgression,
                            double retentionRate,
                            Duration estimatedMasteryTime) { }
