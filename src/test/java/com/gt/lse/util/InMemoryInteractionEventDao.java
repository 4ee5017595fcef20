package com.gt.lse.util;

import com.gt.lse.interaction.InteractionEventDao;
import com.gt.lse.model.InteractionEvent;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public class InMemoryInteractionEventDao implements InteractionEventDao {

    private final Map<String, InteractionEvent> events = new LinkedHashMap<>();

    @Override
    public synchronized void appendEvents(List<InteractionEvent> newEvents) {
        newEvents.forEach(event -> events.putIfAbsent(event.eventId(), event));
    }

    @Override
    public synchronized List<InteractionEvent> loadSessionEvents(String sessionId) {
        List<InteractionEvent> sessionEvents = new ArrayList<>();
        for (InteractionEvent event : events.values()) {
            if (event.sessionId().equals(sessionId)) {
                sessionEvents.add(event);
            }
        }
        sessionEvents.sort(Comparator.comparingInt(InteractionEvent::cursorPosition).thenComparing(InteractionEvent::occurredAt));
        return sessionEvents;
    }

    @Override
    public synchronized int purgeOldEvents(Instant cutoff) {
        int before = events.size();
        events.values().removeIf(event -> event.occurredAt().isBefore(cutoff));
        return before - events.size();
    }
}
