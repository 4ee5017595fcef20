package com.gt.lse.reviewState;

import com.gt.lse.model.ReviewState;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

public interface ReviewStateDao {

    Optional<ReviewState> loadReviewState(String userId, String itemId);

    List<ReviewState> loadReviewStates(String userId, Collection<String> itemIds);

    /**
     * Due states of published items, oldest due first. When {@code skillDomains} is non-empty only
     * items tagged with at least one of them are returned, and the limit applies after that filter.
     */
    List<ReviewState> loadDueReviewStates(String userId, Instant cutoff, Collection<String> skillDomains, int limit);

    /**
     * Writes {@code updated} only if the stored row still carries {@code expectedVersion}. An
     * expected version of 0 means the row must not exist yet. The stored version becomes
     * {@code expectedVersion + 1}.
     *
     * @return true if the write was applied, false if another writer got there first
     */
    boolean compareAndSwap(ReviewState updated, long expectedVersion);
}
