package com.picframe.cache.service;

import com.picframe.cache.model.ExtractedMetadata;

import java.nio.file.Path;

/**
 * Reads orientation, pixel size, camera fields and GPS position from an image file.
 * Implementations return defaults for anything they cannot read instead of failing the caller.
 */
public interface ImageMetadataExtractor {

    ExtractedMetadata extract(Path imagePath);
}
