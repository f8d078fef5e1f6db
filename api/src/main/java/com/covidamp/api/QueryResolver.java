package com.covidamp.api;

/** A resolver that checks its arguments before running any query. */
public interface QueryResolver {

    /**
     * @throws UnsupportedOperationException if the combination is not implemented
     */
    void validate(GeoRes geoRes, boolean filterBySubgeo);
}
