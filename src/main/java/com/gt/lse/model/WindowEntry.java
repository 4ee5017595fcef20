package com.gt.lse.model;

import java.time.Instant;

public record WindowEntry(String itemId,
                          Outcome outcome,
                          long latencyMs,
                          double baseDifficulty,
                          Instant occurredAt) { }
