package com.picframe.cache.service;

import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Columns of the {@code all_data} view that filter and sort expressions may reference.
 * Each field answers to its camelCase name and to its column name.
 */
public enum QueryField {
    FILE_ID("fileId", "file_id", ValueType.NUMBER),
    FNAME("fname", "fname", ValueType.TEXT),
    LAST_MODIFIED("lastModified", "last_modified", ValueType.NUMBER),
    ORIENTATION("orientation", "orientation", ValueType.NUMBER),
    CAPTURE_TIME("captureTime", "exif_datetime", ValueType.NUMBER),
    F_NUMBER("fNumber", "f_number", ValueType.NUMBER),
    EXPOSURE_TIME("exposureTime", "exposure_time", ValueType.TEXT),
    ISO("iso", "iso", ValueType.NUMBER),
    FOCAL_LENGTH("focalLength", "focal_length", ValueType.TEXT),
    MAKE("make", "make", ValueType.TEXT),
    MODEL("model", "model", ValueType.TEXT),
    LENS("lens", "lens", ValueType.TEXT),
    RATING("rating", "rating", ValueType.NUMBER),
    LATITUDE("latitude", "latitude", ValueType.NUMBER),
    LONGITUDE("longitude", "longitude", ValueType.NUMBER),
    WIDTH("width", "width", ValueType.NUMBER),
    HEIGHT("height", "height", ValueType.NUMBER),
    IS_PORTRAIT("isPortrait", "is_portrait", ValueType.BOOLEAN),
    LOCATION("location", "location", ValueType.TEXT);

    public enum ValueType {
        NUMBER,
        TEXT,
        BOOLEAN
    }

    private static final Map<String, QueryField> BY_NAME = Stream.of(values())
            .flatMap(f -> Stream.of(Map.entry(f.name.toLowerCase(Locale.ROOT), f),
                    Map.entry(f.column.toLowerCase(Locale.ROOT), f)))
            .distinct()
            .collect(Collectors.toMap(Map.Entry::getKey, Map.Entry::getValue, (a, b) -> a));

    private final String name;
    private final String column;
    private final ValueType type;

    QueryField(String name, String column, ValueType type) {
        this.name = name;
        this.column = column;
        this.type = type;
    }

    public static Optional<QueryField> lookup(String identifier) {
        return Optional.ofNullable(BY_NAME.get(identifier.toLowerCase(Locale.ROOT)));
    }

    public String getName() {
        return name;
    }

    public String getColumn() {
        return column;
    }

    public ValueType getType() {
        return type;
    }
}
