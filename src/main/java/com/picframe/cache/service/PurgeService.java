package com.picframe.cache.service;

import com.picframe.cache.model.Folder;
import com.picframe.cache.model.PurgeResult;
import com.picframe.cache.repository.FolderRepository;
import com.picframe.cache.repository.ImageFileRepository;
import com.picframe.cache.repository.ImageRecordRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.nio.file.Files;
import java.nio.file.Paths;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Drops folder and file rows whose path no longer exists on disk.
 * Deleting a folder cascades to its files and their metadata; deleting a file cascades to its metadata.
 * Cached locations are kept.
 */
@Service
public class PurgeService {

    private static final Logger logger = LoggerFactory.getLogger(PurgeService.class);

    private final FolderRepository folderRepository;
    private final ImageFileRepository imageFileRepository;
    private final ImageRecordRepository imageRecordRepository;

    public PurgeService(FolderRepository folderRepository,
                        ImageFileRepository imageFileRepository,
                        ImageRecordRepository imageRecordRepository) {
        this.folderRepository = folderRepository;
        this.imageFileRepository = imageFileRepository;
        this.imageRecordRepository = imageRecordRepository;
    }

    public PurgeResult purgeMissingFilesAndFolders() {
        List<Long> missingFolders = folderRepository.findAll().stream()
                .filter(folder -> !Files.exists(Paths.get(folder.getName())))
                .map(Folder::getId)
                .collect(Collectors.toList());
        if (!missingFolders.isEmpty()) {
            folderRepository.deleteAllByIdInBatch(missingFolders);
            logger.info("Purged {} folders no longer on disk", missingFolders.size());
        }

        List<Long> missingFiles = imageRecordRepository.findAllStoredPaths().stream()
                .filter(stored -> !Files.exists(Paths.get(stored.getFname())))
                .map(ImageRecordRepository.StoredPath::getFileId)
                .collect(Collectors.toList());
        if (!missingFiles.isEmpty()) {
            imageFileRepository.deleteAllByIdInBatch(missingFiles);
            logger.info("Purged {} files no longer on disk", missingFiles.size());
        }

        return new PurgeResult(missingFolders.size(), missingFiles.size());
    }
}
