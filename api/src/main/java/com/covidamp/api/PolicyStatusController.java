package com.covidamp.api;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.CrossOrigin;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.LocalDate;
import java.util.List;
import java.util.Map;

@RestController
public class PolicyStatusController {
    private static final Logger logger = LoggerFactory.getLogger(PolicyStatusController.class);

    private final PolicyStatusCounter policyStatusCounter;

    public PolicyStatusController(PolicyStatusCounter policyStatusCounter) {
        this.policyStatusCounter = policyStatusCounter;
    }

    public record PolicyFiltersBody(Map<String, List<String>> filters) {}

    @CrossOrigin(origins = "*")
    @PostMapping(
        value = "/policy_status_counts/{geo_res}",
        consumes = MediaType.APPLICATION_JSON_VALUE,
        produces = MediaType.APPLICATION_JSON_VALUE
    )
    public PlaceObsList getPolicyStatusCounts(
        @PathVariable("geo_res") String geoRes,
        @RequestParam(value = "by_group_number", defaultValue = "true") boolean byGroupNumber,
        @RequestParam(value = "filter_by_subgeo", defaultValue = "false") boolean filterBySubgeo,
        @RequestParam(value = "include_zeros", defaultValue = "true") boolean includeZeros,
        @RequestParam(value = "include_min_max", defaultValue = "true") boolean includeMinMax,
        @RequestParam(value = "count_min_max_by_cat", defaultValue = "false") boolean countMinMaxByCat,
        @RequestParam(value = "one", defaultValue = "false") boolean one,
        @RequestParam(value = "counted_parent_geos", required = false) List<String> countedParentGeos,
        @RequestBody(required = false) PolicyFiltersBody body
    ) {
        logger.info("[INFO] policy_status_counts geo_res={}, subgeo={}, one={}", geoRes, filterBySubgeo, one);
        List<GeoRes> parents = countedParentGeos == null
            ? List.of()
            : countedParentGeos.stream().map(GeoRes::fromName).toList();

        return policyStatusCounter.getPolicyStatusCounts(new PolicyCountRequest(
            GeoRes.fromName(geoRes),
            body == null || body.filters() == null ? Map.of() : body.filters(),
            byGroupNumber,
            filterBySubgeo,
            includeZeros,
            includeMinMax,
            countMinMaxByCat,
            one,
            parents
        ));
    }

    @CrossOrigin(origins = "*")
    @GetMapping(
        value = { "/policy_status_counts_for_map/{geo_res}", "/get/policy_status_counts_for_map/{geo_res}" },
        produces = MediaType.APPLICATION_JSON_VALUE
    )
    public PlaceObsList getPolicyStatusCountsForMap(
        @PathVariable("geo_res") String geoRes,
        @RequestParam(value = "categories", required = false) List<String> categories,
        @RequestParam(value = "subcategories", required = false) List<String> subcategories,
        @RequestParam(value = "subtargets", required = false) List<String> subtargets,
        @RequestParam(value = "date", required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate date
    ) {
        logger.info("[INFO] policy_status_counts_for_map geo_res={}, date={}", geoRes, date);
        return policyStatusCounter.getPolicyStatusCountsForMap(
            GeoRes.fromName(geoRes),
            categories == null ? List.of() : categories,
            subcategories == null ? List.of() : subcategories,
            subtargets == null ? List.of() : subtargets,
            date
        );
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<PlaceObsList> badRequest(IllegalArgumentException e) {
        logger.info("[INFO] rejected policy status request: {}", e.getMessage());
        return ResponseEntity.badRequest().body(PlaceObsList.failure(e.getMessage()));
    }

    @ExceptionHandler(UnsupportedOperationException.class)
    public ResponseEntity<PlaceObsList> notImplemented(UnsupportedOperationException e) {
        logger.error("[ERROR] unsupported policy status request: {}", e.getMessage());
        return ResponseEntity.status(HttpStatus.NOT_IMPLEMENTED).body(PlaceObsList.failure(e.getMessage()));
    }
}
