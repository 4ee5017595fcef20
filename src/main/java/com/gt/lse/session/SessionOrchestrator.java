package com.gt.lse.session;

import com.gt.lse.adaptive.EffectivenessRebuilder;
import com.gt.lse.adaptive.LearningMetrics;
import com.gt.lse.content.ContentService;
import com.gt.lse.exception.ContentServiceUnavailableException;
import com.gt.lse.exception.DaoException;
import com.gt.lse.exception.InvalidEventException;
import com.gt.lse.exception.SessionNotFoundException;
import com.gt.lse.interaction.InteractionEventDao;
import com.gt.lse.interaction.InteractionPipeline;
import com.gt.lse.interaction.QueueOrdering;
import com.gt.lse.model.DomainProgress;
import com.gt.lse.model.DomainSummary;
import com.gt.lse.model.InteractionEvent;
import com.gt.lse.model.InteractionResponse;
import com.gt.lse.model.LearningItem;
import com.gt.lse.model.OutcomeCounts;
import com.gt.lse.model.QueuedItem;
import com.gt.lse.model.ReviewState;
import com.gt.lse.model.SessionContext;
import com.gt.lse.model.SessionStatus;
import com.gt.lse.model.SessionSummary;
import com.gt.lse.reviewState.ReviewStateService;
import com.gt.lse.sessionState.SessionLocks;
import com.gt.lse.sessionState.SessionStateStore;
import com.gt.lse.util.DurableStoreRetry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Entry point for the session lifecycle. Every operation on an existing session runs under that
 * session's lock, so interactions, pauses and ends on one session are applied one at a time.
 */
@Component
public class SessionOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(SessionOrchestrator.class);

    private final SessionStateStore sessionStateStore;
    private final SessionLocks sessionLocks;
    private final InteractionPipeline interactionPipeline;
    private final ReviewStateService reviewStateService;
    private final ContentService contentService;
    private final InteractionEventDao interactionEventDao;
    private final EffectivenessRebuilder effectivenessRebuilder;
    private final LearningMetrics learningMetrics;
    private final DurableStoreRetry durableStoreRetry;
    private final Clock clock;
    private final int maxSessionSize;
    private final int dueCandidateLimit;

    @Autowired
    public SessionOrchestrator(SessionStateStore sessionStateStore,
                               SessionLocks sessionLocks,
                               InteractionPipeline interactionPipeline,
                               ReviewStateService reviewStateService,
                               ContentService contentService,
                               InteractionEventDao interactionEventDao,
                               EffectivenessRebuilder effectivenessRebuilder,
                               LearningMetrics learningMetrics,
                               @Qualifier("durableStoreRetry") DurableStoreRetry durableStoreRetry,
                               Clock clock,
                               @Value("${lse.session.maxSize:20}") int maxSessionSize,
                               @Value("${lse.session.dueCandidateLimit:500}") int dueCandidateLimit) {
        this.sessionStateStore = sessionStateStore;
        this.sessionLocks = sessionLocks;
        this.interactionPipeline = interactionPipeline;
        this.reviewStateService = reviewStateService;
        this.contentService = contentService;
        this.interactionEventDao = interactionEventDao;
        this.effectivenessRebuilder = effectivenessRebuilder;
        this.learningMetrics = learningMetrics;
        this.durableStoreRetry = durableStoreRetry;
        this.clock = clock;

        this.maxSessionSize = maxSessionSize;
        this.dueCandidateLimit = Math.max(dueCandidateLimit, maxSessionSize);
    }

    public SessionContext startSession(String userId, List<String> skillDomains, boolean extraCurricular) {
        Instant now = clock.instant();
        String sessionId = UUID.randomUUID().toString();
        List<String> domains = skillDomains == null ? List.of() : List.copyOf(skillDomains);

        List<QueuedItem> queue;
        boolean degraded = false;
        try {
            queue = buildQueue(userId, domains, now);
        } catch (DaoException | ContentServiceUnavailableException ex) {
            log.warn("Unable to build queue for user {}, starting session {} empty in degraded mode", userId, sessionId, ex);
            queue = List.of();
            degraded = true;
        }

        SessionContext context = new SessionContext(sessionId, userId, domains, queue, 0, 0, OutcomeCounts.NONE, Map.of(),
                SessionStatus.Active, extraCurricular, degraded, now, null);

        sessionLocks.runWithSessionLock(sessionId, () -> sessionStateStore.put(sessionId, context));

        log.info("Started session {} for user {} with {} queued items", sessionId, userId, queue.size());
        return context;
    }

    public InteractionResponse interact(String sessionId, InteractionEvent event) {
        return sessionLocks.withSessionLock(sessionId, () ->
                interactionPipeline.handleInteraction(loadSession(sessionId), event).response());
    }

    public SessionContext getSession(String sessionId) {
        return sessionLocks.withSessionLock(sessionId, () -> loadSession(sessionId));
    }

    // Takes the session lock, so it returns only after any in-flight interaction has been applied
    public SessionContext pauseSession(String sessionId) {
        return sessionLocks.withSessionLock(sessionId, () -> {
            SessionContext context = loadSession(sessionId);
            requireNotCompleted(context);

            if (context.status() == SessionStatus.Paused) {
                return context;
            }

            SessionContext paused = context.withStatus(SessionStatus.Paused);
            sessionStateStore.put(sessionId, paused);

            log.info("Paused session {} at cursor {}", sessionId, context.cursor());
            return paused;
        });
    }

    public SessionContext resumeSession(String sessionId) {
        return sessionLocks.withSessionLock(sessionId, () -> {
            SessionContext context = loadSession(sessionId);
            requireNotCompleted(context);

            SessionContext resumed = context;
            if (context.interactionCount() > 0 && context.effectiveness().isEmpty()) {
                resumed = rebuildEffectiveness(resumed);
            }
            if (resumed.status() == SessionStatus.Paused) {
                resumed = resumed.withStatus(SessionStatus.Active);
            }

            if (!resumed.equals(context)) {
                sessionStateStore.put(sessionId, resumed);
                log.info("Resumed session {} at cursor {}", sessionId, resumed.cursor());
            }
            return resumed;
        });
    }

    /**
     * Completes the session, writes it to the durable tier and releases its fast-tier entry. Ending
     * an already completed session returns its summary again.
     *
     * @throws com.gt.lse.exception.StoreUnavailableException if the final flush fails
     */
    public SessionSummary endSession(String sessionId) {
        return sessionLocks.withSessionLock(sessionId, () -> {
            SessionContext context = loadSession(sessionId);

            SessionContext completed = context;
            if (context.status() != SessionStatus.Completed) {
                completed = context.completed(clock.instant());
                sessionStateStore.put(sessionId, completed);
            }

            sessionStateStore.flush(sessionId);
            sessionStateStore.evict(sessionId);

            log.info("Ended session {} after {} interactions", sessionId, completed.interactionCount());
            return summarize(completed);
        });
    }

    private List<QueuedItem> buildQueue(String userId, List<String> domains, Instant now) {
        List<ReviewState> dueStates = reviewStateService.loadDueReviewStates(userId, now, domains, dueCandidateLimit);
        if (dueStates.isEmpty()) {
            return List.of();
        }

        Map<String, LearningItem> items = contentService.loadItems(dueStates.stream().map(ReviewState::itemId).toList())
                .stream()
                .collect(Collectors.toMap(LearningItem::id, Function.identity(), (first, second) -> first));

        List<QueuedItem> candidates = new ArrayList<>();
        for (ReviewState state : dueStates) {
            LearningItem item = items.get(state.itemId());
            if (item == null) {
                log.debug("Due item {} for user {} no longer published, skipping", state.itemId(), userId);
            } else if (domains.isEmpty() || item.belongsToAny(domains)) {
                candidates.add(new QueuedItem(item, state.nextDue(), state.stabilityDays(), false));
            }
        }

        List<QueuedItem> sorted = QueueOrdering.sort(candidates, now);
        return sorted.size() > maxSessionSize ? new ArrayList<>(sorted.subList(0, maxSessionSize)) : sorted;
    }

    private SessionContext rebuildEffectiveness(SessionContext context) {
        try {
            List<InteractionEvent> events = durableStoreRetry.execute("loadSessionEvents",
                    () -> interactionEventDao.loadSessionEvents(context.sessionId()));
            Map<String, DomainProgress> rebuilt = effectivenessRebuilder.rebuild(context, events);

            log.info("Rebuilt effectiveness for session {} from {} events", context.sessionId(), events.size());
            return context.withEffectiveness(rebuilt);
        } catch (DaoException ex) {
            log.warn("Unable to replay events of session {}, resuming without effectiveness history", context.sessionId(), ex);
            return context;
        }
    }

    private SessionContext loadSession(String sessionId) {
        return sessionStateStore.get(sessionId).orElseThrow(() -> new SessionNotFoundException(sessionId));
    }

    private static void requireNotCompleted(SessionContext context) {
        if (context.status() == SessionStatus.Completed) {
            throw new InvalidEventException(InvalidEventException.Reason.SessionNotActive,
                    "Session " + context.sessionId() + " has already ended");
        }
    }

    private SessionSummary summarize(SessionContext context) {
        List<DomainSummary> domains = context.effectiveness().values().stream()
                .map(learningMetrics::summarize)
                .toList();

        return new SessionSummary(
                context.sessionId(),
                context.userId(),
                context.interactionCount(),
                context.outcomeCounts(),
                context.consumedQueue().size(),
                context.remainingQueue().size(),
                learningMetrics.learningVelocity(context.outcomeCounts(), context.startedAt(), context.endedAt()),
                domains,
                context.startedAt(),
                context.endedAt());
    }
}
