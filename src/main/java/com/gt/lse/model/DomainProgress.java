package com.gt.lse.model;

import java.util.List;

/**
 * Rolling effectiveness for one skill domain within a session. The streak counters count
 * consecutive events for which the recomputed score stayed on one side of a threshold.
 */
public record DomainProgress(String skillDomain,
                             List<WindowEntry> window,
                             double score,
                             DomainState state,
                             int belowLowStreak,
                             int aboveLowStreak,
                             int aboveHighStreak,
                             boolean adaptationPending) {

    public static DomainProgress empty(String skillDomain, double neutralScore) {
        return new DomainProgress(skillDomain, List.of(), neutralScore, DomainState.Nominal, 0, 0, 0, false);
    }
}
