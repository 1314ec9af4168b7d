package com.picframe.cache.service;

import com.picframe.cache.model.CacheUpdateReport;
import com.picframe.cache.model.MetadataUpdateResult;
import com.picframe.cache.model.PurgeResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * One full cache update cycle: scan folders, enumerate files, refresh metadata, purge, commit.
 * Only the cache writer thread calls {@link #updateCache()}, so writes never contend with each other.
 */
@Service
public class IndexUpdateService {

    private static final Logger logger = LoggerFactory.getLogger(IndexUpdateService.class);

    private final DirectoryScanner directoryScanner;
    private final FileEnumerator fileEnumerator;
    private final MetadataUpdater metadataUpdater;
    private final PurgeService purgeService;
    private final JdbcTemplate jdbcTemplate;
    private final Path pictureDir;
    private final boolean fastFirstScan;
    private final AtomicBoolean firstRun = new AtomicBoolean(true);

    public IndexUpdateService(DirectoryScanner directoryScanner,
                              FileEnumerator fileEnumerator,
                              MetadataUpdater metadataUpdater,
                              PurgeService purgeService,
                              JdbcTemplate jdbcTemplate,
                              @Value("${app.picframe.picture-dir}") String pictureDir,
                              @Value("${app.picframe.cache.fast-first-scan:true}") boolean fastFirstScan) {
        this.directoryScanner = directoryScanner;
        this.fileEnumerator = fileEnumerator;
        this.metadataUpdater = metadataUpdater;
        this.purgeService = purgeService;
        this.jdbcTemplate = jdbcTemplate;
        this.pictureDir = Paths.get(pictureDir).toAbsolutePath().normalize();
        this.fastFirstScan = fastFirstScan;
    }

    /**
     * Runs the cycle inside one transaction, so readers see the index either before or after it.
     * The first cycle after startup may stop scanning at the first out-of-date folder to get a
     * small index serving quickly; later cycles walk the whole tree.
     */
    @Transactional
    public CacheUpdateReport updateCache() {
        long start = System.currentTimeMillis();
        boolean stopAtFirstOutOfDate = firstRun.getAndSet(false) && fastFirstScan;

        List<String> modifiedFolders = directoryScanner.updateModifiedFolders(pictureDir, stopAtFirstOutOfDate);
        List<String> modifiedFiles = fileEnumerator.updateModifiedFiles(modifiedFolders);
        MetadataUpdateResult metadata = metadataUpdater.updateMetadata(modifiedFiles);
        PurgeResult purged = purgeService.purgeMissingFilesAndFolders();

        CacheUpdateReport report = CacheUpdateReport.builder()
                .modifiedFolders(modifiedFolders.size())
                .modifiedFiles(modifiedFiles.size())
                .metadataWritten(metadata.written())
                .extractionFailures(metadata.failed())
                .purgedFolders(purged.folders())
                .purgedFiles(purged.files())
                .elapsedMillis(System.currentTimeMillis() - start)
                .build();
        if (report.isUnchanged()) {
            logger.debug("Cache cycle found no changes ({} ms)", report.getElapsedMillis());
        } else {
            logger.info("Cache cycle: {} folders, {} files, {} metadata rows, {} failures, purged {} folders / {} files in {} ms",
                    report.getModifiedFolders(), report.getModifiedFiles(), report.getMetadataWritten(),
                    report.getExtractionFailures(), report.getPurgedFolders(), report.getPurgedFiles(),
                    report.getElapsedMillis());
        }
        return report;
    }

    /**
     * Forces committed data out to the store file; called once when the writer stops.
     */
    public void flushStore() {
        jdbcTemplate.execute("CHECKPOINT SYNC");
        logger.info("Image cache store flushed");
    }

    public Path getPictureDir() {
        return pictureDir;
    }
}
