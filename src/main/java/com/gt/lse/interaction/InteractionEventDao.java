package com.gt.lse.interaction;

import com.gt.lse.model.InteractionEvent;

import java.time.Instant;
import java.util.List;

public interface InteractionEventDao {

    // Appending an event id that is already stored is a no-op, so a failed flush can be replayed
    void appendEvents(List<InteractionEvent> events);

    List<InteractionEvent> loadSessionEvents(String sessionId);

    int purgeOldEvents(Instant cutoff);
}
