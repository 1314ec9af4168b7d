package com.picframe.cache.repository;

import com.picframe.cache.model.Location;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;

@Repository
public interface LocationRepository extends JpaRepository<Location, Long> {
    /**
     * Finds the cached description for an exact (already rounded) coordinate pair.
     */
    Optional<Location> findByLatitudeAndLongitude(double latitude, double longitude);

    boolean existsByLatitudeAndLongitude(double latitude, double longitude);
}
