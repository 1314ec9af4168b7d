package com.picframe.cache.service;

import com.picframe.cache.model.Location;
import com.picframe.cache.repository.LocationRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

import java.util.Optional;

/**
 * Resolves coordinates through the {@link GeoReverser} and caches answers in the {@code location} table.
 * <p>
 * This is the only write made from a read path. It runs outside any caller transaction and only ever
 * inserts into {@code location}, a table the cache update cycle never touches, so it cannot conflict
 * with the writer thread.
 */
@Service
public class GeoLocationService {

    private static final Logger logger = LoggerFactory.getLogger(GeoLocationService.class);

    private final GeoReverser geoReverser;
    private final LocationRepository locationRepository;

    public GeoLocationService(GeoReverser geoReverser, LocationRepository locationRepository) {
        this.geoReverser = geoReverser;
        this.locationRepository = locationRepository;
    }

    /**
     * Looks up a description for the rounded pair and stores it.
     *
     * @return true if a description is now cached for the pair
     */
    public boolean resolveAndCache(double latitude, double longitude) {
        double lat = Coordinates.round(latitude);
        double lon = Coordinates.round(longitude);

        // TODO remember coordinates that keep coming back empty so they stop costing a geocoder call per read
        Optional<String> description = geoReverser.resolve(lat, lon).filter(StringUtils::hasText);
        if (description.isEmpty()) {
            logger.debug("No location yet for ({}, {})", lat, lon);
            return false;
        }

        if (locationRepository.existsByLatitudeAndLongitude(lat, lon)) {
            return true;
        }
        try {
            locationRepository.save(new Location(lat, lon, description.get()));
            logger.info("Cached location for ({}, {}): {}", lat, lon, description.get());
        } catch (DataIntegrityViolationException e) {
            // another reader cached the same pair first
            logger.debug("Location for ({}, {}) already cached: {}", lat, lon, e.getMessage());
        }
        return true;
    }
}
