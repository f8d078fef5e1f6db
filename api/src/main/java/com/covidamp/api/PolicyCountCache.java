package com.covidamp.api;

import java.util.Optional;

/**
 * Memoizes completed count responses by request. Results must be identical with or without it.
 */
public interface PolicyCountCache {

    Optional<PlaceObsList> get(PolicyCountRequest key);

    void put(PolicyCountRequest key, PlaceObsList value);

    /** A cache that never stores anything. */
    PolicyCountCache DISABLED = new PolicyCountCache() {
        @Override
        public Optional<PlaceObsList> get(PolicyCountRequest key) {
            return Optional.empty();
        }

        @Override
        public void put(PolicyCountRequest key, PlaceObsList value) {
        }
    };
}
