package com.gt.lse.model;

import java.time.Instant;
import java.util.List;

public record SessionSummary(String sessionId,
                             String userId,
                             int interactionCount,
                             OutcomeCounts outcomeCounts,
                             int itemsReviewed,
                             int itemsRemaining,
                             double learningVelocity,
                             List<DomainSummary> domains,
                             Instant startedAt,
                             Instant endedAt) { }
