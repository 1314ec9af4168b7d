package com.picframe.cache.service;

import com.picframe.cache.model.Folder;
import com.picframe.cache.repository.FolderRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Walks the picture tree and records every directory whose mtime moved past the stored value.
 */
@Service
public class DirectoryScanner {

    private static final Logger logger = LoggerFactory.getLogger(DirectoryScanner.class);

    // An existing row matches on the name key and is rewritten in place, so folder_id survives repeated upserts.
    private static final String INSERT_IF_ABSENT =
            "MERGE INTO folder (name) KEY (name) VALUES (?)";
    private static final String UPDATE_LAST_MODIFIED =
            "UPDATE folder SET last_modified = ? WHERE name = ?";

    private final FolderRepository folderRepository;
    private final JdbcTemplate jdbcTemplate;

    public DirectoryScanner(FolderRepository folderRepository, JdbcTemplate jdbcTemplate) {
        this.folderRepository = folderRepository;
        this.jdbcTemplate = jdbcTemplate;
    }

    /**
     * Returns the new or changed folders under {@code root} (root included) and upserts every visited
     * folder whose stored mtime differs from the one on disk.
     *
     * @param stopAtFirstOutOfDate end the walk at the first out-of-date folder found
     */
    public List<String> updateModifiedFolders(Path root, boolean stopAtFirstOutOfDate) {
        Map<String, Long> stored = folderRepository.findAll().stream()
                .collect(Collectors.toMap(Folder::getName, Folder::getLastModified, (a, b) -> a));

        List<String> outOfDate = new ArrayList<>();
        List<Object[]> updates = new ArrayList<>();
        for (Path dir : listDirectories(root)) {
            long modified;
            try {
                modified = Files.getLastModifiedTime(dir).toMillis();
            } catch (IOException e) {
                logger.warn("Skipping folder {}: {}", dir, e.getMessage());
                continue;
            }
            String name = dir.toString();
            Long known = stored.get(name);
            if (known == null || known != modified) {
                // an mtime that moved backwards is stored too, but only a newer one triggers enumeration
                updates.add(new Object[]{modified, name});
            }
            if (known == null || known < modified) {
                logger.debug("Folder out of date: {}", name);
                outOfDate.add(name);
                if (stopAtFirstOutOfDate) {
                    break;
                }
            }
        }

        if (!updates.isEmpty()) {
            List<Object[]> names = updates.stream()
                    .map(row -> new Object[]{row[1]})
                    .collect(Collectors.toList());
            jdbcTemplate.batchUpdate(INSERT_IF_ABSENT, names);
            jdbcTemplate.batchUpdate(UPDATE_LAST_MODIFIED, updates);
        }
        return outOfDate;
    }

    /**
     * All directories under {@code root} at any depth, parents before children.
     * Directories that vanish or cannot be read mid-walk are skipped.
     */
    List<Path> listDirectories(Path root) {
        List<Path> dirs = new ArrayList<>();
        if (!Files.isDirectory(root)) {
            logger.warn("Picture directory {} does not exist", root);
            return dirs;
        }
        try {
            Files.walkFileTree(root, new SimpleFileVisitor<>() {
                @Override
                public FileVisitResult preVisitDirectory(Path dir, BasicFileAttributes attrs) {
                    dirs.add(dir);
                    return FileVisitResult.CONTINUE;
                }

                @Override
                public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) {
                    return FileVisitResult.CONTINUE;
                }

                @Override
                public FileVisitResult visitFileFailed(Path file, IOException e) {
                    logger.warn("Cannot read {} during scan: {}", file, e.getMessage());
                    return FileVisitResult.CONTINUE;
                }
            });
        } catch (IOException e) {
            logger.warn("Scan of {} ended early: {}", root, e.getMessage());
        }
        return dirs;
    }
}
