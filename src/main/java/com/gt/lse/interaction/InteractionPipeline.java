package com.gt.lse.interaction;

import com.gt.lse.adaptive.AdaptationDecision;
import com.gt.lse.adaptive.AdaptiveController;
import com.gt.lse.adaptive.EffectivenessCalculator;
import com.gt.lse.analytics.AnalyticsPublisher;
import com.gt.lse.content.ContentService;
import com.gt.lse.exception.DaoException;
import com.gt.lse.exception.InvalidEventException;
import com.gt.lse.model.AnalyticsRecord;
import com.gt.lse.model.DomainProgress;
import com.gt.lse.model.EffectivenessSignal;
import com.gt.lse.model.InteractionEvent;
import com.gt.lse.model.InteractionKind;
import com.gt.lse.model.InteractionResponse;
import com.gt.lse.model.LearningItem;
import com.gt.lse.model.QueuedItem;
import com.gt.lse.model.ReviewState;
import com.gt.lse.model.SessionContext;
import com.gt.lse.model.SessionStatus;
import com.gt.lse.model.WindowEntry;
import com.gt.lse.reviewState.ReviewStateService;
import com.gt.lse.sessionState.SessionStateStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Applies one interaction event to a session: validates it against the queue, updates the learner's
 * review state, rescores the item's skill domain, consults the adaptive controller, advances the
 * queue and writes the new context behind. Callers hold the session's lock.
 */
@Component
public class InteractionPipeline {

    private static final Logger log = LoggerFactory.getLogger(InteractionPipeline.class);

    private final ReviewStateService reviewStateService;
    private final EffectivenessCalculator effectivenessCalculator;
    private final AdaptiveController adaptiveController;
    private final ContentService contentService;
    private final SessionStateStore sessionStateStore;
    private final AnalyticsPublisher analyticsPublisher;
    private final Clock clock;

    @Autowired
    public InteractionPipeline(ReviewStateService reviewStateService,
                               EffectivenessCalculator effectivenessCalculator,
                               AdaptiveController adaptiveController,
                               ContentService contentService,
                               SessionStateStore sessionStateStore,
                               AnalyticsPublisher analyticsPublisher,
                               Clock clock) {
        this.reviewStateService = reviewStateService;
        this.effectivenessCalculator = effectivenessCalculator;
        this.adaptiveController = adaptiveController;
        this.contentService = contentService;
        this.sessionStateStore = sessionStateStore;
        this.analyticsPublisher = analyticsPublisher;
        this.clock = clock;
    }

    public InteractionResult handleInteraction(SessionContext context, InteractionEvent rawEvent) {
        Instant now = clock.instant();
        InteractionEvent event = normalize(rawEvent, now);

        validate(context, event);
        List<QueuedItem> queue = new ArrayList<>(context.queue());
        int answeredIndex = locateAnsweredItem(context, event, queue);
        QueuedItem answered = queue.remove(answeredIndex);
        LearningItem item = answered.item();

        ReviewState reviewState = null;
        boolean degraded = false;
        try {
            reviewState = reviewStateService.recordOutcome(context.userId(), item, event.outcome(), now);
            if (context.degraded()) {
                log.info("Durable store reachable again, session {} leaves degraded mode", context.sessionId());
            }
        } catch (DaoException ex) {
            log.warn("Unable to record review state for item {} in session {}, continuing in degraded mode", item.id(), context.sessionId(), ex);
            degraded = true;
        }

        int cursor = context.cursor();
        queue.add(cursor, reviewState == null ? answered : answered.withReviewState(reviewState));
        int newCursor = cursor + 1;

        String domain = item.primaryDomain();
        DomainProgress progress = context.effectiveness().getOrDefault(domain,
                DomainProgress.empty(domain, effectivenessCalculator.getNeutralScore()));
        List<WindowEntry> window = effectivenessCalculator.append(progress.window(),
                new WindowEntry(item.id(), event.outcome(), event.latencyMs(), item.baseDifficulty(), event.occurredAt()));
        EffectivenessSignal signal = effectivenessCalculator.compute(context.sessionId(), domain, window, now);

        AdaptationDecision decision = adaptiveController.adapt(new DomainProgress(domain, window, signal.score(), progress.state(),
                        progress.belowLowStreak(), progress.aboveLowStreak(), progress.aboveHighStreak(), progress.adaptationPending()),
                queue, newCursor);

        List<QueuedItem> remaining = new ArrayList<>(queue.subList(newCursor, queue.size()));
        remaining.addAll(buildInjections(context, decision, queue, newCursor, now));

        List<QueuedItem> newQueue = new ArrayList<>(queue.subList(0, newCursor));
        newQueue.addAll(QueueOrdering.sort(remaining, now));

        Map<String, DomainProgress> effectiveness = new LinkedHashMap<>(context.effectiveness());
        effectiveness.put(domain, decision.progress());

        SessionContext updated = new SessionContext(context.sessionId(), context.userId(), context.skillDomains(), newQueue,
                newCursor, context.interactionCount() + 1, context.outcomeCounts().plus(event.outcome()), effectiveness,
                context.status(), context.extraCurricular(), degraded, context.startedAt(), context.endedAt());

        sessionStateStore.record(context.sessionId(), updated, event);
        boolean writeBehindFailing = sessionStateStore.isDegraded(context.sessionId());
        if (writeBehindFailing) {
            log.warn("Session {} is not reaching the durable tier, reporting degraded mode", context.sessionId());
        }
        analyticsPublisher.publish(new AnalyticsRecord(context.userId(), event, signal));

        InteractionResponse response = new InteractionResponse(context.sessionId(),
                updated.currentItem().map(QueuedItem::item).orElse(null),
                newCursor,
                updated.remainingQueue().size(),
                decision.hint(),
                signal,
                degraded || writeBehindFailing);

        return new InteractionResult(updated, response);
    }

    private void validate(SessionContext context, InteractionEvent event) {
        if (event.itemId() == null || event.outcome() == null) {
            throw new InvalidEventException(InvalidEventException.Reason.MalformedEvent,
                    "Event " + event.eventId() + " is missing its item or outcome");
        }
        if (!context.sessionId().equals(event.sessionId())) {
            throw new InvalidEventException(InvalidEventException.Reason.SessionMismatch,
                    "Event " + event.eventId() + " belongs to session " + event.sessionId() + ", not " + context.sessionId());
        }
        if (context.status() != SessionStatus.Active) {
            throw new InvalidEventException(InvalidEventException.Reason.SessionNotActive,
                    "Session " + context.sessionId() + " is " + context.status());
        }
        if (event.cursorPosition() < context.cursor()) {
            throw new InvalidEventException(InvalidEventException.Reason.CursorSuperseded,
                    "Event for cursor " + event.cursorPosition() + " superseded, session " + context.sessionId() + " is at " + context.cursor());
        }
        if (event.cursorPosition() > context.cursor()) {
            throw new InvalidEventException(InvalidEventException.Reason.CursorAhead,
                    "Event for cursor " + event.cursorPosition() + " is ahead of session " + context.sessionId() + " at " + context.cursor());
        }
    }

    // Index of the answered item in the queue. Extra-curricular items are fetched and placed at the cursor.
    private int locateAnsweredItem(SessionContext context, InteractionEvent event, List<QueuedItem> queue) {
        for (int i = context.cursor(); i < queue.size(); i++) {
            if (queue.get(i).itemId().equals(event.itemId())) {
                return i;
            }
        }

        if (!context.extraCurricular()) {
            throw new InvalidEventException(InvalidEventException.Reason.ItemNotInQueue,
                    "Item " + event.itemId() + " is not queued in session " + context.sessionId());
        }

        LearningItem item = contentService.getItem(event.itemId())
                .orElseThrow(() -> new InvalidEventException(InvalidEventException.Reason.ItemNotInQueue,
                        "Item " + event.itemId() + " does not exist"));

        log.debug("Extra-curricular review of item {} in session {}", item.id(), context.sessionId());
        queue.add(context.cursor(), new QueuedItem(item, null, 0, true));
        return context.cursor();
    }

    private List<QueuedItem> buildInjections(SessionContext context, AdaptationDecision decision, List<QueuedItem> queue, int cursor, Instant now) {
        if (!decision.hasInjections()) {
            return List.of();
        }

        List<QueuedItem> injections = new ArrayList<>();

        Map<String, QueuedItem> consumed = new LinkedHashMap<>();
        queue.subList(0, cursor).forEach(queuedItem -> consumed.put(queuedItem.itemId(), queuedItem));
        for (String itemId : decision.requeueItemIds()) {
            QueuedItem lapsed = consumed.get(itemId);
            if (lapsed != null) {
                injections.add(lapsed.asInjected());
            }
        }

        Map<String, ReviewState> knownStates = loadKnownStates(context, decision.fetchedItems());
        for (LearningItem fetched : decision.fetchedItems()) {
            ReviewState known = knownStates.get(fetched.id());
            injections.add(known == null
                    ? new QueuedItem(fetched, now, 0, true)
                    : new QueuedItem(fetched, known.nextDue(), known.stabilityDays(), true));
        }

        return injections;
    }

    private Map<String, ReviewState> loadKnownStates(SessionContext context, List<LearningItem> items) {
        if (items.isEmpty()) {
            return Map.of();
        }

        try {
            return reviewStateService.loadReviewStates(context.userId(), items.stream().map(LearningItem::id).collect(Collectors.toList()));
        } catch (DaoException ex) {
            log.warn("Unable to load review states of injected items for session {}, treating them as new", context.sessionId(), ex);
            return Map.of();
        }
    }

    // Fills in what a caller may leave out: event id, kind, timestamp
    private static InteractionEvent normalize(InteractionEvent event, Instant now) {
        if (event.eventId() != null && event.kind() != null && event.occurredAt() != null && event.latencyMs() >= 0) {
            return event;
        }

        return new InteractionEvent(
                event.eventId() == null ? UUID.randomUUID().toString() : event.eventId(),
                event.sessionId(),
                event.itemId(),
                event.outcome(),
                Math.max(0, event.latencyMs()),
                event.cursorPosition(),
                event.kind() == null ? InteractionKind.Answer : event.kind(),
                event.occurredAt() == null ? now : event.occurredAt());
    }
}
