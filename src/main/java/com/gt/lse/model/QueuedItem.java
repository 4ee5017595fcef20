package com.gt.lse.model;

import java.time.Instant;

/**
 * An entry in a session queue. {@code nextDue} and {@code stabilityDays} mirror the learner's
 * review state at the time the entry was queued (or answered, for consumed entries). Injected
 * entries were added by the adaptive controller and may not be due yet.
 */
public record QueuedItem(LearningItem item,
                         Instant nextDue,
                         double stabilityDays,
                         boolean injected) {

    public String itemId() {
        return item.id();
    }

    public boolean isDue(Instant now) {
        return nextDue == null || !nextDue.isAfter(now);
    }

    public QueuedItem withReviewState(ReviewState reviewState) {
        return new QueuedItem(item, reviewState.nextDue(), reviewState.stabilityDays(), injected);
    }

    public QueuedItem asInjected() {
        return new QueuedItem(item, nextDue, stabilityDays, true);
    }
}
