package com.covidamp.api;

import org.springframework.stereotype.Component;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Keeps only the first policy of each group number, so related enactments are counted once.
 */
@Component
public class GroupDeduplicator {

    /**
     * @param policies the filtered policies
     * @param representatives lowest policy id per group number across all policies
     * @return the policies that represent their group, plus every ungrouped policy, in input order
     */
    public List<PolicyRecord> dedupe(List<PolicyRecord> policies, List<GroupRepresentative> representatives) {
        Set<Long> representativeIds = new HashSet<>();
        for (GroupRepresentative r : representatives) {
            representativeIds.add(r.minPolicyId());
        }
        return policies.stream()
            .filter(p -> !p.isGrouped() || representativeIds.contains(p.id()))
            .toList();
    }
}
