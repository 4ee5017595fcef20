package com.gt.lse.sessionState;

import com.gt.lse.model.SessionContext;

import java.time.Instant;
import java.util.Optional;

public interface SessionContextDao {

    Optional<SessionContext> loadSessionContext(String sessionId);

    // Insert or replace the stored snapshot for the context's session
    void saveSessionContext(SessionContext sessionContext);

    int purgeCompletedSessions(Instant cutoff);

    // Removes sessions that were never ended and have not been written since the cutoff
    int purgeAbandonedSessions(Instant cutoff);
}
