package com.covidamp.api;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Finds the highest number of policies in effect in any location on any day, for baselining
 * map scales. The minimum is fixed at one policy in effect.
 *
 * Days are scanned from the configured window start through today. Callers pass filters with
 * date and location filters already removed, since the result must not depend on them.
 */
@Component
public class AllTimeMaxCounter {
    private static final Logger logger = LoggerFactory.getLogger(AllTimeMaxCounter.class);

    public static final int MIN_POLICIES_IN_EFFECT = 1;

    private static final Comparator<PlaceObs> ROW_ORDER = Comparator
        .comparingInt(PlaceObs::value)
        .thenComparing(PlaceObs::datestamp)
        .thenComparing(PlaceObs::placeName);

    private final PolicyRecordSource policyRecordSource;
    private final GroupDeduplicator groupDeduplicator;
    private final Clock clock;
    private final LocalDate windowStart;

    public AllTimeMaxCounter(
        PolicyRecordSource policyRecordSource,
        GroupDeduplicator groupDeduplicator,
        Clock clock,
        PolicyCountProperties properties
    ) {
        this.policyRecordSource = policyRecordSource;
        this.groupDeduplicator = groupDeduplicator;
        this.clock = clock;
        this.windowStart = properties.windowStart();
    }

    public MinMax findMinMax(GeoRes geoRes, Map<String, List<String>> filtersNoDates, boolean byGroupNumber) {
        return findMinMax(geoRes, filtersNoDates, byGroupNumber, false);
    }

    /**
     * With {@code filterBySubgeo} the places of every finer resolution are scanned, still grouped
     * by the location field of {@code geoRes}, so the result bounds sub-geography counts too.
     */
    public MinMax findMinMax(
        GeoRes geoRes,
        Map<String, List<String>> filtersNoDates,
        boolean byGroupNumber,
        boolean filterBySubgeo
    ) {
        Map<String, List<String>> filters = PolicyFilters.copyOf(filtersNoDates);
        List<String> levels;
        if (filterBySubgeo) {
            levels = geoRes.getSubgeoLevels();
        } else {
            levels = filters.getOrDefault(PolicyFilters.LEVEL, List.of());
            if (levels.size() > 1) {
                throw new UnsupportedOperationException(
                    "All-time min/max counts are not implemented for more than one level: " + levels);
            }
            levels = levels.isEmpty() ? List.of(geoRes.getLevel()) : levels;
        }
        filters.put(PolicyFilters.LEVEL, levels);

        List<PolicyRecord> policies = policyRecordSource.findPolicies(filters);
        if (byGroupNumber) {
            policies = groupDeduplicator.dedupe(policies, policyRecordSource.findGroupRepresentatives());
        }

        PlaceObs max = findMax(policies, geoRes, levels);
        if (max == null) {
            logger.info("[INFO] no policies in effect for geoRes={}, levels={}", geoRes, levels);
            return MinMax.NONE;
        }
        PlaceObs min = new PlaceObs(null, null, MIN_POLICIES_IN_EFFECT, null);
        return new MinMax(min, max);
    }

    /**
     * Sweeps the per-location start/end events; the count is constant between consecutive
     * event days, so each run contributes its last day as the candidate row.
     */
    PlaceObs findMax(List<PolicyRecord> policies, GeoRes geoRes, Collection<String> levels) {
        LocalDate today = LocalDate.now(clock);
        if (today.isBefore(windowStart)) return null;

        Map<String, TreeMap<LocalDate, Integer>> eventsByLoc = new HashMap<>();
        for (PolicyRecord policy : policies) {
            if (policy.startDate() == null) continue;
            LocalDate start = policy.startDate().isBefore(windowStart) ? windowStart : policy.startDate();
            LocalDate end = policy.endDate() == null || policy.endDate().isAfter(today) ? today : policy.endDate();
            if (start.isAfter(end)) continue;

            for (Place place : policy.places()) {
                if (!levels.contains(place.level())) continue;
                String locValue = place.locValue(geoRes.getLocField());
                if (!LocationAggregator.isCountable(locValue)) continue;
                locValue = geoRes.normalizeLocValue(locValue);

                TreeMap<LocalDate, Integer> events = eventsByLoc.computeIfAbsent(locValue, k -> new TreeMap<>());
                events.merge(start, 1, Integer::sum);
                events.merge(end.plusDays(1), -1, Integer::sum);
            }
        }

        List<PlaceObs> candidates = new ArrayList<>();
        eventsByLoc.forEach((locValue, events) -> {
            int running = 0;
            LocalDate runStart = null;
            for (Map.Entry<LocalDate, Integer> event : events.entrySet()) {
                if (runStart != null && running > 0) {
                    candidates.add(new PlaceObs(null, locValue, running, event.getKey().minusDays(1)));
                }
                running += event.getValue();
                runStart = event.getKey();
            }
        });

        return candidates.stream().max(ROW_ORDER).orElse(null);
    }
}
