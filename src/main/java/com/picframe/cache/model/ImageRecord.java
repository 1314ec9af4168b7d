package com.picframe.cache.model;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.Getter;
import org.hibernate.annotations.Immutable;

/**
 * Read-only row of the {@code all_data} view: file, folder, metadata and cached location joined.
 * Metadata columns are null until the file has been through a metadata update.
 */
@Getter
@Entity
@Immutable
@Table(name = "all_data")
public class ImageRecord {

    @Id
    @Column(name = "file_id")
    private Long fileId;

    @Column(name = "fname")
    private String fname;

    @Column(name = "last_modified")
    private Long lastModified;

    @Column(name = "orientation")
    private Integer orientation;

    @Column(name = "exif_datetime")
    private Double captureTime;

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

    @Column(name = "width")
    private Integer width;

    @Column(name = "height")
    private Integer height;

    @Column(name = "is_portrait")
    private Boolean portrait;

    @Column(name = "location")
    private String location;

    protected ImageRecord() {
    }

    /**
     * True when the record has coordinates but no cached place description yet.
     */
    public boolean needsLocation() {
        return latitude != null && longitude != null && location == null;
    }
}
