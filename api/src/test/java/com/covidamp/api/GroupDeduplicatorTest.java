package com.covidamp.api;

import org.junit.jupiter.api.Test;

import java.util.List;

import static com.covidamp.api.TestPlaces.CALIFORNIA;
import static com.covidamp.api.TestPlaces.policy;
import static org.assertj.core.api.Assertions.assertThat;

class GroupDeduplicatorTest {

    private final GroupDeduplicator deduplicator = new GroupDeduplicator();

    @Test
    void keepsLowestIdOfEachGroupAndEveryUngroupedPolicy() {
        List<PolicyRecord> policies = List.of(
            policy(10, 1, "2020-03-01", null, CALIFORNIA),
            policy(11, 1, "2020-03-02", null, CALIFORNIA),
            policy(12, 2, "2020-03-03", null, CALIFORNIA),
            policy(13, null, "2020-03-04", null, CALIFORNIA),
            policy(14, null, "2020-03-05", null, CALIFORNIA)
        );
        List<GroupRepresentative> index = List.of(
            new GroupRepresentative(10, 1),
            new GroupRepresentative(12, 2)
        );

        assertThat(deduplicator.dedupe(policies, index))
            .extracting(PolicyRecord::id)
            .containsExactly(10L, 12L, 13L, 14L);
    }

    @Test
    void groupWhoseRepresentativeWasFilteredOutContributesNothing() {
        List<PolicyRecord> policies = List.of(policy(11, 1, "2020-03-02", null, CALIFORNIA));

        assertThat(deduplicator.dedupe(policies, List.of(new GroupRepresentative(10, 1)))).isEmpty();
    }
}
