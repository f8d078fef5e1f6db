package com.covidamp.api;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Counts (policy, place) pairs per location value at a geographic resolution.
 *
 * Only places whose level is allowed are counted; a policy without such a place contributes
 * nothing. A location value is identified within its parent geography (iso3 for states,
 * iso3 + area1 for counties). When the same value shows up under a different parent the
 * first-seen parent keeps the count and the conflict is logged.
 */
@Component
public class LocationAggregator {
    private static final Logger logger = LoggerFactory.getLogger(LocationAggregator.class);

    public static final String UNSPECIFIED = "Unspecified";

    public Map<String, PlaceObs> countByLocation(
        List<PolicyRecord> policies,
        GeoRes geoRes,
        Collection<String> allowedLevels
    ) {
        String locField = geoRes.getLocField();
        Map<String, Integer> counts = new LinkedHashMap<>();
        Map<String, List<String>> parentByLoc = new HashMap<>();
        Set<String> reportedConflicts = new HashSet<>();

        for (PolicyRecord policy : policies) {
            for (Place place : policy.places()) {
                if (!allowedLevels.contains(place.level())) continue;
                String locValue = place.locValue(locField);
                if (!isCountable(locValue)) continue;
                locValue = geoRes.normalizeLocValue(locValue);

                List<String> parent = parentOf(geoRes, place);
                List<String> firstParent = parentByLoc.putIfAbsent(locValue, parent);
                if (firstParent != null && !firstParent.equals(parent)) {
                    if (reportedConflicts.add(locValue + "|" + parent)) {
                        logger.warn("[WARN] location value {} appears under parents {} and {}; keeping first",
                            locValue, firstParent, parent);
                    }
                    continue;
                }
                counts.merge(locValue, 1, Integer::sum);
            }
        }

        Map<String, PlaceObs> data = new LinkedHashMap<>();
        counts.forEach((locValue, count) -> data.put(locValue, PlaceObs.of(locValue, count)));
        return data;
    }

    static boolean isCountable(String locValue) {
        return locValue != null && !locValue.isBlank() && !UNSPECIFIED.equals(locValue);
    }

    private static List<String> parentOf(GeoRes geoRes, Place place) {
        return switch (geoRes) {
            case country -> List.of();
            case state -> List.of(Objects.toString(place.iso3(), ""));
            case county, county_plus_state -> List.of(
                Objects.toString(place.iso3(), ""),
                Objects.toString(place.area1(), "")
            );
            default -> throw new IllegalStateException("No parent geography defined for this GeoRes: " + geoRes);
        };
    }
}
