package com.picframe.cache.service;

import com.picframe.cache.model.ExtractedMetadata;
import com.picframe.cache.model.MetadataUpdateResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;

/**
 * Extracts metadata for changed files and writes one {@code meta} row per file in a single batch.
 * A file whose extraction fails is logged and left out; the rest of the batch still goes in.
 */
@Service
public class MetadataUpdater {

    private static final Logger logger = LoggerFactory.getLogger(MetadataUpdater.class);

    private static final String UPSERT_META =
            "MERGE INTO meta (file_id, orientation, exif_datetime, f_number, exposure_time, iso, focal_length, " +
            "make, model, lens, rating, latitude, longitude, width, height) " +
            "KEY (file_id) " +
            "VALUES ((SELECT file_id FROM all_data WHERE fname = ?), ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)";

    private final ImageMetadataExtractor metadataExtractor;
    private final JdbcTemplate jdbcTemplate;

    public MetadataUpdater(ImageMetadataExtractor metadataExtractor, JdbcTemplate jdbcTemplate) {
        this.metadataExtractor = metadataExtractor;
        this.jdbcTemplate = jdbcTemplate;
    }

    public MetadataUpdateResult updateMetadata(List<String> modifiedFiles) {
        List<Object[]> rows = new ArrayList<>(modifiedFiles.size());
        int failed = 0;
        for (String file : modifiedFiles) {
            try {
                rows.add(toRow(file, metadataExtractor.extract(Paths.get(file))));
            } catch (Exception e) {
                failed++;
                logger.warn("Metadata extraction failed for {}: {}", file, e.getMessage(), e);
            }
        }

        if (!rows.isEmpty()) {
            jdbcTemplate.batchUpdate(UPSERT_META, rows);
        }
        return new MetadataUpdateResult(rows.size(), failed);
    }

    /**
     * Builds the bind values for {@link #UPSERT_META}, applying orientation, time fallback and rounding.
     */
    Object[] toRow(String file, ExtractedMetadata meta) throws IOException {
        int width = meta.getWidth();
        int height = meta.getHeight();
        if (meta.isSideways()) {
            int swap = width;
            width = height;
            height = swap;
        }

        double captureTime = meta.getCaptureTime() != null
                ? meta.getCaptureTime().toEpochMilli() / 1000d
                : Files.getLastModifiedTime(Path.of(file)).toMillis() / 1000d;

        Double latitude = null;
        Double longitude = null;
        if (meta.hasLocation()) {
            latitude = Coordinates.round(meta.getLatitude());
            longitude = Coordinates.round(meta.getLongitude());
        }

        return new Object[]{
                file,
                meta.getOrientation(),
                captureTime,
                meta.getFNumber(),
                meta.getExposureTime(),
                meta.getIso(),
                meta.getFocalLength(),
                meta.getMake(),
                meta.getModel(),
                meta.getLens(),
                meta.getRating(),
                latitude,
                longitude,
                width,
                height
        };
    }
}
