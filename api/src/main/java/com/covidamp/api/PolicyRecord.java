package com.covidamp.api;

import java.time.LocalDate;
import java.util.List;

/**
 * A policy as returned by the record source, with the places it affects.
 *
 * A null {@code groupNumber} means the policy is its own group. A null {@code endDate}
 * means the policy is still in effect.
 */
public record PolicyRecord(
    long id,
    Integer groupNumber,
    LocalDate startDate,
    LocalDate endDate,
    List<Place> places
) {
    public PolicyRecord {
        places = places == null ? List.of() : List.copyOf(places);
    }

    public boolean isGrouped() {
        return groupNumber != null;
    }
}
