package com.picframe.cache.service;

import java.util.Optional;

/**
 * Used when reverse geocoding is switched off; never resolves anything.
 */
public class NoOpGeoReverser implements GeoReverser {

    @Override
    public Optional<String> resolve(double latitude, double longitude) {
        return Optional.empty();
    }
}
