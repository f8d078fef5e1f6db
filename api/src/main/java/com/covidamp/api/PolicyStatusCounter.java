package com.covidamp.api;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.LocalDate;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Counts the number of policies in effect in each location at a geographic resolution,
 * optionally matching filters.
 */
@Service
public class PolicyStatusCounter implements QueryResolver {
    private static final Logger logger = LoggerFactory.getLogger(PolicyStatusCounter.class);

    private final PolicyRecordSource policyRecordSource;
    private final GroupDeduplicator groupDeduplicator;
    private final LocationAggregator locationAggregator;
    private final ZeroFillAugmenter zeroFillAugmenter;
    private final AllTimeMaxCounter allTimeMaxCounter;
    private final PlaceObsListAssembler assembler;
    private final PolicyCountCache cache;

    public PolicyStatusCounter(
        PolicyRecordSource policyRecordSource,
        GroupDeduplicator groupDeduplicator,
        LocationAggregator locationAggregator,
        ZeroFillAugmenter zeroFillAugmenter,
        AllTimeMaxCounter allTimeMaxCounter,
        PlaceObsListAssembler assembler,
        PolicyCountCache cache
    ) {
        this.policyRecordSource = policyRecordSource;
        this.groupDeduplicator = groupDeduplicator;
        this.locationAggregator = locationAggregator;
        this.zeroFillAugmenter = zeroFillAugmenter;
        this.allTimeMaxCounter = allTimeMaxCounter;
        this.assembler = assembler;
        this.cache = cache;
    }

    @Override
    public void validate(GeoRes geoRes, boolean filterBySubgeo) {
        if (filterBySubgeo && (geoRes == GeoRes.county || geoRes == GeoRes.county_plus_state)) {
            throw new UnsupportedOperationException("Cannot count sub-geography policies for counties.");
        }
    }

    /**
     * Returns the number of active policies matching the request's filters, by location at the
     * request's geographic resolution.
     *
     * The caller's filter map is never modified. {@code level} is set from the resolution (or
     * from the finer resolutions when counting sub-geographies) and {@code iso3} is restricted
     * to the USA for state and county resolutions.
     */
    public PlaceObsList getPolicyStatusCounts(PolicyCountRequest request) {
        Optional<PlaceObsList> cached = cache.get(request);
        if (cached.isPresent()) {
            logger.debug("[DEBUG] policy status counts cache hit: {}", request);
            return cached.get();
        }

        GeoRes geoRes = request.geoRes();
        validate(geoRes, request.filterBySubgeo());

        Map<String, List<String>> filters = PolicyFilters.copyOf(request.filters());
        if (geoRes.isUsaOnly()) {
            filters.put(PolicyFilters.ISO3, List.of("USA"));
        }
        List<String> levels = request.filterBySubgeo() ? geoRes.getSubgeoLevels() : List.of(geoRes.getLevel());
        filters.put(PolicyFilters.LEVEL, levels);

        List<PolicyRecord> policies = policyRecordSource.findPolicies(filters);
        if (request.byGroupNumber()) {
            policies = groupDeduplicator.dedupe(policies, policyRecordSource.findGroupRepresentatives());
        }

        Map<String, PlaceObs> data = locationAggregator.countByLocation(policies, geoRes, levels);

        if (request.includeZeros()) {
            List<PlaceLocation> placesAllTime = policyRecordSource.findPlacesWithPolicies(PolicyFilters.withoutDates(filters));
            data = zeroFillAugmenter.addZeros(geoRes, data, placesAllTime);
        }

        PlaceObsList response = assembler.assemble(
            data.values(),
            geoRes,
            filters,
            request.filterBySubgeo(),
            request.one(),
            request.countedParentGeos()
        );

        if (request.includeMinMax()) {
            Set<String> skipped = new HashSet<>(PolicyFilters.MIN_MAX_SKIPPED);
            if (!request.countMinMaxByCat()) {
                skipped.addAll(PolicyFilters.CATEGORY_FIELDS);
            }
            Map<String, List<String>> filtersNoDates = PolicyFilters.without(filters, skipped);
            filtersNoDates.put(PolicyFilters.LEVEL, List.of(geoRes.getLevel()));
            response = response.withMinMax(allTimeMaxCounter.findMinMax(
                geoRes, filtersNoDates, request.byGroupNumber(), request.filterBySubgeo()
            ));
        }

        logger.info("[INFO] policy status counts geoRes={}, subgeo={}, byGroupNumber={}, filters={}, values={}",
            geoRes, request.filterBySubgeo(), request.byGroupNumber(), filters.keySet(), response.data().size());

        cache.put(request, response);
        return response;
    }

    /**
     * Counts policies in effect on {@code date}, optionally restricted to categories,
     * subcategories and subtargets. Zero-valued locations and the all-time min/max are
     * always included.
     */
    public PlaceObsList getPolicyStatusCountsForMap(
        GeoRes geoRes,
        List<String> categories,
        List<String> subcategories,
        List<String> subtargets,
        LocalDate date
    ) {
        if (date == null) {
            throw new IllegalArgumentException("date is required");
        }
        Map<String, List<String>> filters = new LinkedHashMap<>();
        putIfNotEmpty(filters, PolicyFilters.PRIMARY_PH_MEASURE, categories);
        putIfNotEmpty(filters, PolicyFilters.PH_MEASURE_DETAILS, subcategories);
        putIfNotEmpty(filters, PolicyFilters.SUBTARGET, subtargets);
        filters.put(PolicyFilters.DATES_IN_EFFECT, List.of(date.toString(), date.toString()));

        return getPolicyStatusCounts(PolicyCountRequest.of(geoRes, filters));
    }

    private static void putIfNotEmpty(Map<String, List<String>> filters, String field, List<String> values) {
        if (values != null && !values.isEmpty()) {
            filters.put(field, values);
        }
    }
}
