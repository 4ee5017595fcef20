package com.gt.lse.model;

import java.util.Collection;
import java.util.List;

public record LearningItem(String id,
                           List<String> skillDomains,
                           double baseDifficulty,
                           String payloadRef) {

    public String primaryDomain() {
        return skillDomains == null || skillDomains.isEmpty() ? "" : skillDomains.get(0);
    }

    public boolean belongsToAny(Collection<String> domains) {
        if (skillDomains == null) {
            return false;
        }

        for (String domain : skillDomains) {
            if (domains.contains(domain)) {
                return true;
            }
        }

        return false;
    }
}
