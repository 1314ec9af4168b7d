package com.picframe.cache.service;

import com.picframe.cache.model.CacheUpdateReport;
import com.picframe.cache.model.MetadataUpdateResult;
import com.picframe.cache.model.PurgeResult;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;
import org.springframework.jdbc.core.JdbcTemplate;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class IndexUpdateServiceTest {

    @Mock
    private DirectoryScanner directoryScanner;

    @Mock
    private FileEnumerator fileEnumerator;

    @Mock
    private MetadataUpdater metadataUpdater;

    @Mock
    private PurgeService purgeService;

    @Mock
    private JdbcTemplate jdbcTemplate;

    @BeforeEach
    void setUp() {
        when(directoryScanner.updateModifiedFolders(any(), anyBoolean())).thenReturn(List.of("/pics/a"));
        when(fileEnumerator.updateModifiedFiles(anyList())).thenReturn(List.of("/pics/a/1.jpg", "/pics/a/2.jpg"));
        when(metadataUpdater.updateMetadata(anyList())).thenReturn(new MetadataUpdateResult(1, 1));
        when(purgeService.purgeMissingFilesAndFolders()).thenReturn(new PurgeResult(0, 3));
    }

    @Test
    void fastFirstScanAppliesToTheFirstCycleOnly() {
        IndexUpdateService service = service(true);

        service.updateCache();
        service.updateCache();
        service.updateCache();

        InOrder inOrder = inOrder(directoryScanner);
        inOrder.verify(directoryScanner).updateModifiedFolders(service.getPictureDir(), true);
        inOrder.verify(directoryScanner, times(2)).updateModifiedFolders(service.getPictureDir(), false);
    }

    @Test
    void everyCycleWalksTheWholeTreeWhenFastFirstScanIsOff() {
        IndexUpdateService service = service(false);

        service.updateCache();
        service.updateCache();

        verify(directoryScanner, times(2)).updateModifiedFolders(any(), eq(false));
        verify(directoryScanner, never()).updateModifiedFolders(any(), eq(true));
    }

    @Test
    void cycleFeedsEachStageAndReportsCounts() {
        IndexUpdateService service = service(false);

        CacheUpdateReport report = service.updateCache();

        InOrder inOrder = inOrder(directoryScanner, fileEnumerator, metadataUpdater, purgeService);
        inOrder.verify(directoryScanner).updateModifiedFolders(any(), eq(false));
        inOrder.verify(fileEnumerator).updateModifiedFiles(List.of("/pics/a"));
        inOrder.verify(metadataUpdater).updateMetadata(List.of("/pics/a/1.jpg", "/pics/a/2.jpg"));
        inOrder.verify(purgeService).purgeMissingFilesAndFolders();
        assertThat(report.getModifiedFolders()).isEqualTo(1);
        assertThat(report.getModifiedFiles()).isEqualTo(2);
        assertThat(report.getMetadataWritten()).isEqualTo(1);
        assertThat(report.getExtractionFailures()).isEqualTo(1);
        assertThat(report.getPurgedFiles()).isEqualTo(3);
    }

    @Test
    void flushIssuesACheckpoint() {
        service(false).flushStore();

        verify(jdbcTemplate).execute("CHECKPOINT SYNC");
    }

    private IndexUpdateService service(boolean fastFirstScan) {
        return new IndexUpdateService(directoryScanner, fileEnumerator, metadataUpdater, purgeService,
                jdbcTemplate, "/pics", fastFirstScan);
    }
}
