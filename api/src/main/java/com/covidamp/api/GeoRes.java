package com.covidamp.api;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.ArrayList;
import java.util.List;

/**
 * Geographic resolution at which policies are counted.
 *
 * Each resolution maps to the {@link Place} field that identifies a location at that
 * resolution, the place level a counted place must carry, and the map type used by clients.
 * Ordering for {@link #isChildOf(GeoRes)} is country > state > county; county_plus_state
 * ranks with county.
 */
public enum GeoRes {
    country,
    state,
    county,
    county_plus_state;

    public static final String LOC_FIELD_ISO3 = "iso3";
    public static final String LOC_FIELD_AREA1 = "area1";
    public static final String LOC_FIELD_ANSI_FIPS = "ansi_fips";

    @JsonValue
    public String getName() {
        return name();
    }

    @JsonCreator
    public static GeoRes fromName(String name) {
        if (name != null) {
            for (GeoRes geoRes : values()) {
                if (geoRes.name().equals(name)) return geoRes;
            }
        }
        throw new IllegalArgumentException("Unknown geographic resolution: " + name);
    }

    public String getLocField() {
        return switch (this) {
            case country -> LOC_FIELD_ISO3;
            case state -> LOC_FIELD_AREA1;
            case county, county_plus_state -> LOC_FIELD_ANSI_FIPS;
            default -> throw new IllegalStateException(
                "No location field defined for this GeoRes, please update getLocField: " + this);
        };
    }

    public String getLevel() {
        return switch (this) {
            case country -> "Country";
            case state -> "State / Province";
            case county -> "Local";
            case county_plus_state -> "Local plus state/province";
            default -> throw new IllegalStateException(
                "No level defined for this GeoRes, please update getLevel: " + this);
        };
    }

    public String getMapType() {
        return switch (this) {
            case country -> "global";
            case state -> "us";
            case county -> "us-county";
            case county_plus_state -> "us-county-plus-state";
            default -> throw new IllegalStateException(
                "No map type defined for this GeoRes, please update getMapType: " + this);
        };
    }

    /** Pads 4-digit FIPS codes to 5 digits for county resolutions; other values pass through. */
    public String normalizeLocValue(String locValue) {
        if (locValue != null && locValue.length() == 4 && LOC_FIELD_ANSI_FIPS.equals(getLocField())) {
            return "0" + locValue;
        }
        return locValue;
    }

    /** True only when this resolution is strictly finer than {@code other}. */
    public boolean isChildOf(GeoRes other) {
        return rank() > other.rank();
    }

    /** Resolutions counted only within the USA. */
    public boolean isUsaOnly() {
        return this != country;
    }

    /** Levels of every resolution strictly finer than this one, coarsest first. */
    public List<String> getSubgeoLevels() {
        List<String> levels = new ArrayList<>();
        for (GeoRes geoRes : values()) {
            if (geoRes.isChildOf(this)) levels.add(geoRes.getLevel());
        }
        return levels;
    }

    private int rank() {
        return switch (this) {
            case country -> 0;
            case state -> 1;
            case county, county_plus_state -> 2;
            default -> throw new IllegalStateException("No rank defined for this GeoRes: " + this);
        };
    }
}
