package com.picframe.cache.service;

import java.util.Optional;

/**
 * Resolves a coordinate pair to a human-readable place description.
 * An empty result means no answer is available right now.
 */
public interface GeoReverser {

    Optional<String> resolve(double latitude, double longitude);
}
