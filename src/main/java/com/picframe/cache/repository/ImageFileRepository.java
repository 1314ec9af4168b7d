package com.picframe.cache.repository;

import com.picframe.cache.model.ImageFile;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface ImageFileRepository extends JpaRepository<ImageFile, Long> {
    /**
     * Loads every file row stored for a folder.
     */
    List<ImageFile> findAllByFolderId(Long folderId);

    long countByFolderId(Long folderId);
}
