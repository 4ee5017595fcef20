package com.gt.lse.model;

import java.util.List;

public record AdaptationHint(String skillDomain,
                             DomainState domainState,
                             AdaptationAction action,
                             List<String> injectedItemIds,
                             boolean contentDegraded) {

    public static AdaptationHint hold(String skillDomain, DomainState domainState) {
        return new AdaptationHint(skillDomain, domainState, AdaptationAction.Hold, List.of(), false);
    }
}
