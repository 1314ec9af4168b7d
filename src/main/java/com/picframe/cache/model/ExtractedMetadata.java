package com.picframe.cache.model;

import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

import java.time.Instant;

/**
 * What the metadata extractor could read from one image. Sizes are raw (not rotated),
 * coordinates unrounded; absent values are null.
 */
@Getter
@Builder
@ToString
public class ExtractedMetadata {

    @Builder.Default
    private final int orientation = 1;
    private final int width;
    private final int height;
    private final Double fNumber;
    private final String make;
    private final String model;
    private final String exposureTime;
    private final Double iso;
    private final String focalLength;
    private final Integer rating;
    private final String lens;
    private final Instant captureTime;
    private final Double latitude;
    private final Double longitude;

    /**
     * EXIF orientations 5 to 8 are rotated a quarter turn, so width and height swap on display.
     */
    public boolean isSideways() {
        return orientation >= 5 && orientation <= 8;
    }

    public boolean hasLocation() {
        return latitude != null && longitude != null;
    }
}
