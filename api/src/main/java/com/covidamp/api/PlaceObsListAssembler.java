package com.covidamp.api;

import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Sorts, optionally trims to one observation, and describes the counted observations.
 */
@Component
public class PlaceObsListAssembler {

    public PlaceObsList assemble(
        Collection<PlaceObs> observations,
        GeoRes geoRes,
        Map<String, List<String>> filters,
        boolean filterBySubgeo,
        boolean one,
        List<GeoRes> countedParentGeos
    ) {
        List<PlaceObs> data = new ArrayList<>(observations);
        data.sort(Comparator.comparingInt(PlaceObs::value).reversed());

        if (one && !data.isEmpty()) {
            data = List.of(pickOne(data, geoRes, filters.get(geoRes.getLocField())));
        }

        return new PlaceObsList(data, true, describe(data.size(), geoRes, filterBySubgeo, countedParentGeos), null, null);
    }

    /** The observation for the filtered location if there is one, else the highest value. */
    private static PlaceObs pickOne(List<PlaceObs> sorted, GeoRes geoRes, List<String> filteredLocValues) {
        if (filteredLocValues != null && !filteredLocValues.isEmpty() && filteredLocValues.get(0) != null) {
            String wanted = geoRes.normalizeLocValue(filteredLocValues.get(0));
            for (PlaceObs obs : sorted) {
                if (obs.placeName().equals(wanted)) return obs;
            }
        }
        return sorted.get(0);
    }

    static String describe(int count, GeoRes geoRes, boolean filterBySubgeo, List<GeoRes> countedParentGeos) {
        String resCounted = filterBySubgeo ? "sub-" + geoRes.getName() : geoRes.getName();
        String parentResCounted = countedParentGeos.isEmpty()
            ? ""
            : ", including parent geographies at resolution(s) "
                + countedParentGeos.stream().map(g -> "'" + g.getName() + "'").collect(Collectors.joining(", "))
                + ", ";
        return "Found " + count + " values counting " + resCounted + " policies" + parentResCounted
            + " grouped by " + geoRes.getName();
    }
}
