package com.covidamp.api;

import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Adds zero-valued observations for locations that had matching policies at some point but
 * have none under the current filters, so "currently zero" is distinguishable from "no data".
 */
@Component
public class ZeroFillAugmenter {

    private static final String USA = "USA";

    /**
     * @param data counted observations keyed by location value
     * @param places places that ever had a policy matching the filters, ignoring dates
     * @return a new map holding {@code data} unchanged plus a zero entry for each new location
     */
    public Map<String, PlaceObs> addZeros(GeoRes geoRes, Map<String, PlaceObs> data, List<PlaceLocation> places) {
        Map<String, PlaceObs> filled = new LinkedHashMap<>(data);
        for (PlaceLocation place : places) {
            String locValue = zeroFillLocValue(geoRes, place);
            if (locValue != null && LocationAggregator.isCountable(locValue)) {
                filled.putIfAbsent(locValue, PlaceObs.of(locValue, 0));
            }
        }
        return filled;
    }

    /** Location value of {@code place} at {@code geoRes}, or null when the place does not apply. */
    static String zeroFillLocValue(GeoRes geoRes, PlaceLocation place) {
        switch (geoRes) {
            case country:
                return place.iso3();
            case state:
                return USA.equals(place.iso3()) ? place.area1() : null;
            case county:
            case county_plus_state:
                // rows without a FIPS code cannot be identified
                if (place.ansiFips() == null || !USA.equals(place.iso3())) return null;
                return geoRes.normalizeLocValue(place.ansiFips());
            default:
                throw new UnsupportedOperationException("Unknown geo_res: " + geoRes);
        }
    }
}
