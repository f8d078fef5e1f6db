package com.covidamp.api;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.LocalDate;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record PlaceObs(
    @JsonProperty("place_id") Long placeId,
    @JsonProperty("place_name") String placeName,
    @JsonProperty("value") int value,
    @JsonProperty("datestamp") LocalDate datestamp
) {
    public static PlaceObs of(String placeName, int value) {
        return new PlaceObs(null, placeName, value, null);
    }
}
