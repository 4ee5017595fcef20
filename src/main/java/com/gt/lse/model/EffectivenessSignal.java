package com.gt.lse.model;

import java.time.Instant;

public record EffectivenessSignal(String sessionId,
                                  String skillDomain,
                                  double score,
                                  double accuracy,
                                  double averageLatencyMs,
                                  double hesitationRate,
                                  double difficultyTrend,
                                  int sampleSize,
                                  Instant computedAt) { }
