package com.gt.lse.model;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Mutable-by-replacement state of one learning session. Queue entries before {@code cursor} have
 * been answered; entries from {@code cursor} on are the remaining candidates.
 */
public record SessionContext(String sessionId,
                             String userId,
                             List<String> skillDomains,
                             List<QueuedItem> queue,
                             int cursor,
                             int interactionCount,
                             OutcomeCounts outcomeCounts,
                             Map<String, DomainProgress> effectiveness,
                             SessionStatus status,
                             boolean extraCurricular,
                             boolean degraded,
                             Instant startedAt,
                             Instant endedAt) {

    public Optional<QueuedItem> currentItem() {
        return cursor < queue.size() ? Optional.of(queue.get(cursor)) : Optional.empty();
    }

    public List<QueuedItem> remainingQueue() {
        return queue.subList(Math.min(cursor, queue.size()), queue.size());
    }

    public List<QueuedItem> consumedQueue() {
        return queue.subList(0, Math.min(cursor, queue.size()));
    }

    public SessionContext withStatus(SessionStatus newStatus) {
        return new SessionContext(sessionId, userId, skillDomains, queue, cursor, interactionCount, outcomeCounts,
                effectiveness, newStatus, extraCurricular, degraded, startedAt, endedAt);
    }

    public SessionContext withEffectiveness(Map<String, DomainProgress> newEffectiveness) {
        return new SessionContext(sessionId, userId, skillDomains, queue, cursor, interactionCount, outcomeCounts,
                newEffectiveness, status, extraCurricular, degraded, startedAt, endedAt);
    }

    public SessionContext completed(Instant endInstant) {
        return new SessionContext(sessionId, userId, skillDomains, queue, cursor, interactionCount, outcomeCounts,
                effectiveness, SessionStatus.Completed, extraCurricular, degraded, startedAt, endInstant);
    }
}
