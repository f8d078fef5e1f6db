package com.covidamp.api;

import java.util.List;
import java.util.Map;

/**
 * Arguments of a policy status count. Also the cache key, so filters are deep-copied.
 *
 * @param byGroupNumber count only the first policy of each group number
 * @param filterBySubgeo count policies of locations beneath {@code geoRes}, grouped by it
 * @param includeZeros add zero observations for locations with historical matches only
 * @param includeMinMax attach the all-time min/max observations
 * @param countMinMaxByCat keep category filters when computing the min/max
 * @param one return a single observation
 * @param countedParentGeos parent resolutions whose policies are counted as well
 */
public record PolicyCountRequest(
    GeoRes geoRes,
    Map<String, List<String>> filters,
    boolean byGroupNumber,
    boolean filterBySubgeo,
    boolean includeZeros,
    boolean includeMinMax,
    boolean countMinMaxByCat,
    boolean one,
    List<GeoRes> countedParentGeos
) {
    public PolicyCountRequest {
        filters = Map.copyOf(PolicyFilters.copyOf(filters));
        countedParentGeos = countedParentGeos == null ? List.of() : List.copyOf(countedParentGeos);
    }

    /** Request with the default flags: grouped, zero-filled, with min/max. */
    public static PolicyCountRequest of(GeoRes geoRes, Map<String, List<String>> filters) {
        return new PolicyCountRequest(geoRes, filters, true, false, true, true, false, false, List.of());
    }
}
