package com.gt.lse.model;

public record AnalyticsRecord(String userId,
                              InteractionEvent event,
                              EffectivenessSignal signal) { }
