package com.covidamp.api;

import java.util.List;
import java.util.Map;

/**
 * Fetches policy records matching field filters.
 *
 * Filters map a field name to its allowed values; an empty value list means no restriction.
 * A policy matches a place-field filter when any of its places matches it.
 */
public interface PolicyRecordSource {

    /** Policies matching every filter, each with all of its places. */
    List<PolicyRecord> findPolicies(Map<String, List<String>> filters);

    /** Lowest policy id for each group number, ordered by group number. Ungrouped policies are absent. */
    List<GroupRepresentative> findGroupRepresentatives();

    /**
     * Places at the filtered levels that have had at least one policy matching the filters.
     * Callers remove date filters first.
     */
    List<PlaceLocation> findPlacesWithPolicies(Map<String, List<String>> filters);
}
