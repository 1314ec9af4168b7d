package com.picframe.cache.model;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.Getter;
import lombok.Setter;

/**
 * Extracted image metadata, at most one row per {@link ImageFile}.
 * Width and height are already corrected for the EXIF orientation.
 */
@Setter
@Getter
@Entity
@Table(name = "meta")
public class ImageMeta {

    @Id
    @Column(name = "file_id", nullable = false)
    private Long fileId;

    @Column(name = "orientation", nullable = false)
    private int orientation = 1;

    // capture time in epoch seconds; falls back to the file mtime
    @Column(name = "exif_datetime", nullable = false)
    private double captureTime;

    @Column(name = "f_number")
    private Double fNumber;

    @Column(name = "exposure_time")
    private String exposureTime;

    @Column(name = "iso")
    private Double iso;

    @Column(name = "focal_length")
    private String focalLength;

    @Column(name = "make")
    private String make;

    @Column(name = "model")
    private String model;

    @Column(name = "lens")
    private String lens;

    @Column(name = "rating")
    private Integer rating;

    @Column(name = "latitude")
    private Double latitude;

    @Column(name = "longitude")
    private Double longitude;

    @Column(name = "width", nullable = false)
    private int width;

    @Column(name = "height", nullable = false)
    private int height;

    public ImageMeta() {
    }
}
