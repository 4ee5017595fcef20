package com.gt.lse.model;

import java.time.Instant;

public record InteractionEvent(String eventId,
                               String sessionId,
                               String itemId,
                               Outcome outcome,
                               long latencyMs,
                               int cursorPosition,
                               InteractionKind kind,
                               Instant occurredAt) { }
