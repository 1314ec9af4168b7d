package com.picframe.cache.service;

/**
 * GPS coordinate handling shared by the metadata writer and the location cache.
 */
public final class Coordinates {

    private static final double SCALE = 10_000d;

    private Coordinates() {
    }

    /**
     * Rounds to 4 decimal places (about 11 m) so near-identical readings share one cached location.
     */
    public static double round(double value) {
        return Math.round(value * SCALE) / SCALE;
    }

    public static Double round(Double value) {
        return value == null ? null : round(value.doubleValue());
    }
}
