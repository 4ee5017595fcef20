package com.gt.lse.adaptive;

import com.gt.lse.model.AdaptationHint;
import com.gt.lse.model.DomainProgress;
import com.gt.lse.model.LearningItem;

import java.util.List;

/**
 * Outcome of consulting the adaptive controller after one interaction. {@code requeueItemIds} name
 * already-answered items to put back in the remaining queue; {@code fetchedItems} are new content.
 */
public record AdaptationDecision(DomainProgress progress,
                                 AdaptationHint hint,
                                 List<LearningItem> fetchedItems,
                                 List<String> requeueItemIds) {

    public boolean hasInjections() {
        return !fetchedItems.isEmpty() || !requeueItemIds.isEmpty();
    }
}
