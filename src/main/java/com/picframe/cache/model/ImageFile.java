package com.picframe.cache.model;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.Getter;
import lombok.Setter;

/**
 * One supported image file inside a {@link Folder}. Unique per (folder, basename, extension).
 */
@Setter
@Getter
@Entity
@Table(name = "file")
public class ImageFile {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "file_id", updatable = false, nullable = false)
    private Long id;

    @Column(name = "folder_id", nullable = false)
    private Long folderId;

    @Column(name = "basename", nullable = false)
    private String basename;

    // stored without the leading dot, original case preserved
    @Column(name = "extension", nullable = false)
    private String extension;

    @Column(name = "last_modified", nullable = false)
    private long lastModified;

    public ImageFile() {
    }

    /**
     * Name of the file inside its folder, e.g. {@code IMG_0001.jpg}.
     */
    public String getFileName() {
        return basename + "." + extension;
    }
}
