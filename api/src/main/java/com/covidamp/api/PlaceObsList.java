package com.covidamp.api;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Observations for places, along with optional min and max observations for all time.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record PlaceObsList(
    @JsonProperty("data") List<PlaceObs> data,
    @JsonProperty("success") boolean success,
    @JsonProperty("message") String message,
    @JsonProperty("min_all_time") PlaceObs minAllTime,
    @JsonProperty("max_all_time") PlaceObs maxAllTime
) {
    public PlaceObsList {
        data = data == null ? null : List.copyOf(data);
    }

    public PlaceObsList withMinMax(MinMax minMax) {
        return new PlaceObsList(data, success, message, minMax.min(), minMax.max());
    }

    public static PlaceObsList failure(String message) {
        return new PlaceObsList(null, false, message, null, null);
    }
}
