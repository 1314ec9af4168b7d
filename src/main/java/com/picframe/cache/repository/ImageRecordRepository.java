package com.picframe.cache.repository;

import com.picframe.cache.model.ImageRecord;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface ImageRecordRepository extends JpaRepository<ImageRecord, Long>, ImageRecordRepositoryCustom {

    Optional<ImageRecord> findByFname(String fname);

    /**
     * Id and full path of every indexed file, used to detect files gone from disk.
     */
    @Query("select r.fileId as fileId, r.fname as fname from ImageRecord r")
    List<StoredPath> findAllStoredPaths();

    interface StoredPath {
        Long getFileId();

        String getFname();
    }
}
