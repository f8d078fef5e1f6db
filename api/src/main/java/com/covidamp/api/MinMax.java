package com.covidamp.api;

/** All-time min and max observations; both are null when nothing was ever in effect. */
public record MinMax(PlaceObs min, PlaceObs max) {
    public static final MinMax NONE = new MinMax(null, null);
}
