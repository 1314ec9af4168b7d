package com.picframe.cache.repository;

import com.picframe.cache.model.Folder;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;

@Repository
public interface FolderRepository extends JpaRepository<Folder, Long> {
    /**
     * Finds a folder by its absolute path.
     */
    Optional<Folder> findByName(String name);
}
