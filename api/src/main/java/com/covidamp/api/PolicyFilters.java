package com.covidamp.api;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Field names recognised in policy filter maps, and copy helpers.
 *
 * Filter maps go from field name to the list of allowed values. They are always copied before
 * being modified so callers never see injected keys.
 */
public final class PolicyFilters {
    private PolicyFilters() {}

    public static final String LEVEL = "level";
    public static final String ISO3 = "iso3";
    public static final String AREA1 = "area1";
    public static final String AREA2 = "area2";
    public static final String ANSI_FIPS = "ansi_fips";
    public static final String DATES_IN_EFFECT = "dates_in_effect";
    public static final String PRIMARY_PH_MEASURE = "primary_ph_measure";
    public static final String PH_MEASURE_DETAILS = "ph_measure_details";
    public static final String SUBTARGET = "subtarget";

    /** Date and location filters never apply to the all-time min/max. */
    public static final Set<String> MIN_MAX_SKIPPED = Set.of(DATES_IN_EFFECT, ISO3, AREA1, ANSI_FIPS);

    public static final Set<String> CATEGORY_FIELDS = Set.of(PRIMARY_PH_MEASURE, PH_MEASURE_DETAILS);

    public static Map<String, List<String>> copyOf(Map<String, List<String>> filters) {
        Map<String, List<String>> copy = new LinkedHashMap<>();
        if (filters != null) {
            filters.forEach((field, values) -> copy.put(field, values == null ? List.of() : List.copyOf(values)));
        }
        return copy;
    }

    public static Map<String, List<String>> without(Map<String, List<String>> filters, Collection<String> fields) {
        Map<String, List<String>> copy = copyOf(filters);
        copy.keySet().removeAll(fields);
        return copy;
    }

    public static Map<String, List<String>> withoutDates(Map<String, List<String>> filters) {
        return without(filters, Set.of(DATES_IN_EFFECT));
    }
}
