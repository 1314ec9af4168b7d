package com.picframe.cache.service;

import com.picframe.cache.model.Folder;
import com.picframe.cache.model.ImageFile;
import com.picframe.cache.repository.FolderRepository;
import com.picframe.cache.repository.ImageFileRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.DirectoryIteratorException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Lists the images in changed folders and records the ones that are new or have a newer mtime.
 */
@Service
public class FileEnumerator {

    private static final Logger logger = LoggerFactory.getLogger(FileEnumerator.class);

    public static final Set<String> SUPPORTED_EXTENSIONS = Set.of("png", "jpg", "jpeg", "heif", "heic");

    private static final String APPLE_SIDECAR_DIR = ".AppleDouble";

    private static final String INSERT_IF_ABSENT =
            "MERGE INTO file (folder_id, basename, extension) KEY (folder_id, basename, extension) " +
            "VALUES ((SELECT folder_id FROM folder WHERE name = ?), ?, ?)";
    private static final String UPDATE_LAST_MODIFIED =
            "UPDATE file SET last_modified = ? " +
            "WHERE folder_id = (SELECT folder_id FROM folder WHERE name = ?) AND basename = ? AND extension = ?";

    private final FolderRepository folderRepository;
    private final ImageFileRepository imageFileRepository;
    private final JdbcTemplate jdbcTemplate;

    public FileEnumerator(FolderRepository folderRepository,
                          ImageFileRepository imageFileRepository,
                          JdbcTemplate jdbcTemplate) {
        this.folderRepository = folderRepository;
        this.imageFileRepository = imageFileRepository;
        this.jdbcTemplate = jdbcTemplate;
    }

    /**
     * Returns full paths of files needing a metadata refresh and upserts their file rows in one batch.
     */
    public List<String> updateModifiedFiles(List<String> modifiedFolders) {
        List<String> outOfDate = new ArrayList<>();
        List<Object[]> keys = new ArrayList<>();
        List<Object[]> updates = new ArrayList<>();

        for (String folder : modifiedFolders) {
            Map<String, Long> known = storedFiles(folder);
            for (Path entry : listEntries(folder)) {
                String fileName = entry.getFileName().toString();
                if (!isSupported(folder, fileName) || !Files.isRegularFile(entry)) {
                    continue;
                }
                long modified;
                try {
                    modified = Files.getLastModifiedTime(entry).toMillis();
                } catch (IOException e) {
                    logger.warn("Skipping file {}: {}", entry, e.getMessage());
                    continue;
                }
                Long stored = known.get(fileName);
                if (stored == null || stored < modified) {
                    int dot = fileName.lastIndexOf('.');
                    String basename = fileName.substring(0, dot);
                    String extension = fileName.substring(dot + 1);
                    outOfDate.add(fullName(folder, basename, extension));
                    keys.add(new Object[]{folder, basename, extension});
                    updates.add(new Object[]{modified, folder, basename, extension});
                }
            }
        }

        if (!keys.isEmpty()) {
            jdbcTemplate.batchUpdate(INSERT_IF_ABSENT, keys);
            jdbcTemplate.batchUpdate(UPDATE_LAST_MODIFIED, updates);
            logger.debug("Upserted {} file rows", keys.size());
        }
        return outOfDate;
    }

    /**
     * Path of a file as the {@code all_data} view spells it.
     */
    public static String fullName(String folder, String basename, String extension) {
        return folder + "/" + basename + "." + extension;
    }

    /**
     * Supported extension, not hidden, and not inside an Apple sidecar directory.
     */
    static boolean isSupported(String folder, String fileName) {
        if (fileName.startsWith(".") || folder.contains(APPLE_SIDECAR_DIR)) {
            return false;
        }
        int dot = fileName.lastIndexOf('.');
        if (dot <= 0 || dot == fileName.length() - 1) {
            return false;
        }
        return SUPPORTED_EXTENSIONS.contains(fileName.substring(dot + 1).toLowerCase(Locale.ROOT));
    }

    private Map<String, Long> storedFiles(String folder) {
        return folderRepository.findByName(folder)
                .map(Folder::getId)
                .map(imageFileRepository::findAllByFolderId)
                .orElse(Collections.emptyList())
                .stream()
                .collect(Collectors.toMap(ImageFile::getFileName, ImageFile::getLastModified, (a, b) -> a));
    }

    private List<Path> listEntries(String folder) {
        List<Path> entries = new ArrayList<>();
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(Paths.get(folder))) {
            for (Path entry : stream) {
                entries.add(entry);
            }
        } catch (IOException | DirectoryIteratorException e) {
            logger.warn("Cannot list folder {}: {}", folder, e.getMessage());
        }
        return entries;
    }
}
