package com.gt.lse.reviewState;

import com.gt.lse.exception.DaoException;
import com.gt.lse.model.LearningItem;
import com.gt.lse.model.Outcome;
import com.gt.lse.model.ReviewState;
import com.gt.lse.scheduler.ItemScheduler;
import com.gt.lse.util.DurableStoreRetry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

@Component
public class ReviewStateService {

    private static final Logger log = LoggerFactory.getLogger(ReviewStateService.class);

    private final ReviewStateDao reviewStateDao;
    private final ItemScheduler itemScheduler;
    private final DurableStoreRetry durableStoreRetry;
    private final int maxSwapAttempts;

    @Autowired
    public ReviewStateService(ReviewStateDao reviewStateDao,
                              ItemScheduler itemScheduler,
                              @Qualifier("durableStoreRetry") DurableStoreRetry durableStoreRetry,
                              @Value("${lse.reviewState.maxSwapAttempts:5}") int maxSwapAttempts) {
        this.reviewStateDao = reviewStateDao;
        this.itemScheduler = itemScheduler;
        this.durableStoreRetry = durableStoreRetry;

        this.maxSwapAttempts = maxSwapAttempts;
    }

    /**
     * Applies an outcome to the learner's review state for an item and persists the result. Concurrent
     * writers (e.g. a flush racing a reload after crash recovery) are resolved by reloading and
     * rescheduling until the compare-and-swap succeeds.
     *
     * @throws DaoException if the store stays unavailable or the swap keeps losing races
     */
    public ReviewState recordOutcome(String userId, LearningItem item, Outcome outcome, Instant now) {
        for (int attempt = 1; attempt <= maxSwapAttempts; attempt++) {
            ReviewState current = durableStoreRetry.execute("loadReviewState",
                    () -> reviewStateDao.loadReviewState(userId, item.id()))
                    .orElseGet(() -> ReviewState.firstExposure(userId, item.id(), itemScheduler.clampDifficulty(item.baseDifficulty())));

            ReviewState scheduled = itemScheduler.schedule(current, outcome, now);

            boolean swapped = durableStoreRetry.execute("compareAndSwapReviewState",
                    () -> reviewStateDao.compareAndSwap(scheduled, current.version()));
            if (swapped) {
                return withVersion(scheduled, current.version() + 1);
            }

            log.info("Review state for user {} item {} changed concurrently, attempt {} of {}", userId, item.id(), attempt, maxSwapAttempts);
        }

        throw new DaoException("Unable to update review state for user " + userId + " item " + item.id()
                + " after " + maxSwapAttempts + " attempts");
    }

    public List<ReviewState> loadDueReviewStates(String userId, Instant now, Collection<String> skillDomains, int limit) {
        return durableStoreRetry.execute("loadDueReviewStates", () -> reviewStateDao.loadDueReviewStates(userId, now, skillDomains, limit));
    }

    public Map<String, ReviewState> loadReviewStates(String userId, Collection<String> itemIds) {
        if (itemIds.isEmpty()) {
            return Map.of();
        }

        return durableStoreRetry.execute("loadReviewStates", () -> reviewStateDao.loadReviewStates(userId, itemIds))
                .stream()
                .collect(Collectors.toMap(ReviewState::itemId, Function.identity(), (first, second) -> first));
    }

    private static ReviewState withVersion(ReviewState state, long version) {
        return new ReviewState(state.userId(), state.itemId(), state.repetitions(), state.stabilityDays(), state.difficultyFactor(),
                state.lastReviewed(), state.nextDue(), state.lapses(), state.correctStreak(), version);
    }
}
