package com.picframe.cache.service;

import com.drew.imaging.ImageMetadataReader;
import com.drew.imaging.ImageProcessingException;
import com.drew.lang.GeoLocation;
import com.drew.lang.Rational;
import com.drew.metadata.Directory;
import com.drew.metadata.Metadata;
import com.drew.metadata.exif.ExifDirectoryBase;
import com.drew.metadata.exif.ExifIFD0Directory;
import com.drew.metadata.exif.ExifSubIFDDirectory;
import com.drew.metadata.exif.GpsDirectory;
import com.drew.metadata.heif.HeifDirectory;
import com.drew.metadata.jpeg.JpegDirectory;
import com.drew.metadata.png.PngDirectory;
import com.picframe.cache.model.ExtractedMetadata;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import javax.imageio.ImageIO;
import javax.imageio.ImageReader;
import javax.imageio.stream.ImageInputStream;
import java.io.IOException;
import java.nio.file.Path;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.Iterator;

/**
 * {@link ImageMetadataExtractor} built on the metadata-extractor library.
 */
@Service
public class ExifImageMetadataExtractor implements ImageMetadataExtractor {

    private static final Logger logger = LoggerFactory.getLogger(ExifImageMetadataExtractor.class);

    private static final DateTimeFormatter EXIF_DATE_TIME = DateTimeFormatter.ofPattern("yyyy:MM:dd HH:mm:ss");

    @Override
    public ExtractedMetadata extract(Path imagePath) {
        Metadata metadata;
        try {
            metadata = ImageMetadataReader.readMetadata(imagePath.toFile());
        } catch (ImageProcessingException | IOException e) {
            logger.warn("Could not read metadata from {}: {}", imagePath, e.getMessage());
            return ExtractedMetadata.builder().build();
        }

        ExtractedMetadata.ExtractedMetadataBuilder builder = ExtractedMetadata.builder();

        ExifIFD0Directory ifd0 = metadata.getFirstDirectoryOfType(ExifIFD0Directory.class);
        if (ifd0 != null) {
            Integer orientation = ifd0.getInteger(ExifDirectoryBase.TAG_ORIENTATION);
            if (orientation != null) {
                builder.orientation(orientation);
            }
            builder.make(trimToNull(ifd0.getString(ExifDirectoryBase.TAG_MAKE)));
            builder.model(trimToNull(ifd0.getString(ExifDirectoryBase.TAG_MODEL)));
            builder.rating(ifd0.getInteger(ExifDirectoryBase.TAG_RATING));
        }

        ExifSubIFDDirectory subIfd = metadata.getFirstDirectoryOfType(ExifSubIFDDirectory.class);
        if (subIfd != null) {
            builder.fNumber(subIfd.getDoubleObject(ExifDirectoryBase.TAG_FNUMBER));
            builder.exposureTime(rationalText(subIfd, ExifDirectoryBase.TAG_EXPOSURE_TIME));
            builder.iso(subIfd.getDoubleObject(ExifDirectoryBase.TAG_ISO_EQUIVALENT));
            builder.focalLength(rationalText(subIfd, ExifDirectoryBase.TAG_FOCAL_LENGTH));
            builder.lens(trimToNull(subIfd.getString(ExifDirectoryBase.TAG_LENS_MODEL)));
            builder.captureTime(parseCaptureTime(subIfd.getString(ExifDirectoryBase.TAG_DATETIME_ORIGINAL), imagePath));
        }

        GpsDirectory gps = metadata.getFirstDirectoryOfType(GpsDirectory.class);
        if (gps != null) {
            GeoLocation location = gps.getGeoLocation();
            if (location != null && !location.isZero()) {
                builder.latitude(location.getLatitude());
                builder.longitude(location.getLongitude());
            }
        }

        int[] size = readSize(metadata, subIfd);
        if (size == null) {
            size = readSizeWithImageIo(imagePath);
        }
        builder.width(size[0]);
        builder.height(size[1]);

        return builder.build();
    }

    /**
     * Pixel size from the container header, or the EXIF copy of it.
     */
    int[] readSize(Metadata metadata, ExifSubIFDDirectory subIfd) {
        JpegDirectory jpeg = metadata.getFirstDirectoryOfType(JpegDirectory.class);
        int[] size = sizeFrom(jpeg, JpegDirectory.TAG_IMAGE_WIDTH, JpegDirectory.TAG_IMAGE_HEIGHT);
        if (size == null) {
            PngDirectory png = metadata.getFirstDirectoryOfType(PngDirectory.class);
            size = sizeFrom(png, PngDirectory.TAG_IMAGE_WIDTH, PngDirectory.TAG_IMAGE_HEIGHT);
        }
        if (size == null) {
            // HEIC keeps its size in the ispe box
            HeifDirectory heif = metadata.getFirstDirectoryOfType(HeifDirectory.class);
            size = sizeFrom(heif, HeifDirectory.TAG_IMAGE_WIDTH, HeifDirectory.TAG_IMAGE_HEIGHT);
        }
        if (size == null) {
            size = sizeFrom(subIfd, ExifDirectoryBase.TAG_EXIF_IMAGE_WIDTH, ExifDirectoryBase.TAG_EXIF_IMAGE_HEIGHT);
        }
        return size;
    }

    private int[] sizeFrom(Directory directory, int widthTag, int heightTag) {
        if (directory == null) {
            return null;
        }
        Integer width = directory.getInteger(widthTag);
        Integer height = directory.getInteger(heightTag);
        if (width == null || height == null || width <= 0 || height <= 0) {
            return null;
        }
        return new int[]{width, height};
    }

    private int[] readSizeWithImageIo(Path imagePath) {
        try (ImageInputStream input = ImageIO.createImageInputStream(imagePath.toFile())) {
            if (input == null) {
                return new int[]{0, 0};
            }
            Iterator<ImageReader> readers = ImageIO.getImageReaders(input);
            if (!readers.hasNext()) {
                return new int[]{0, 0};
            }
            ImageReader reader = readers.next();
            try {
                reader.setInput(input, true, true);
                return new int[]{reader.getWidth(0), reader.getHeight(0)};
            } finally {
                reader.dispose();
            }
        } catch (IOException e) {
            logger.debug("No decodable size for {}: {}", imagePath, e.getMessage());
            return new int[]{0, 0};
        }
    }

    private Instant parseCaptureTime(String value, Path imagePath) {
        if (value == null || value.isBlank()) {
            return null;
        }
        try {
            return LocalDateTime.parse(value.trim(), EXIF_DATE_TIME).atZone(ZoneId.systemDefault()).toInstant();
        } catch (DateTimeParseException e) {
            logger.debug("Unparseable DateTimeOriginal '{}' in {}", value, imagePath);
            return null;
        }
    }

    private String rationalText(Directory directory, int tag) {
        Rational rational = directory.getRational(tag);
        return rational != null ? rational.toSimpleString(true) : null;
    }

    private String trimToNull(String value) {
        if (value == null) {
            return null;
        }
        String trimmed = value.trim();
        return trimmed.isEmpty() ? null : trimmed;
    }
}
