package com.covidamp.api;

/**
 * A location affected by policies. Parentage is implied by shared iso3/area1 values.
 */
public record Place(
    Long id,
    String level,
    String iso3,
    String area1,
    String area2,
    String ansiFips
) {
    public String locValue(String locField) {
        return switch (locField) {
            case GeoRes.LOC_FIELD_ISO3 -> iso3;
            case GeoRes.LOC_FIELD_AREA1 -> area1;
            case GeoRes.LOC_FIELD_ANSI_FIPS -> ansiFips;
            default -> throw new IllegalArgumentException("Unknown location field: " + locField);
        };
    }
}
