package com.gt.lse.model;

public record InteractionResponse(String sessionId,
                                  LearningItem nextItem,
                                  int cursor,
                                  int remainingItems,
                                  AdaptationHint adaptation,
                                  EffectivenessSignal signal,
                                  boolean degraded) { }
