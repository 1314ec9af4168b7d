package com.picframe.cache.service;

import com.picframe.cache.dto.ImageSlot;
import com.picframe.cache.model.CacheUpdateReport;
import com.picframe.cache.model.ExtractedMetadata;
import com.picframe.cache.model.ImageMeta;
import com.picframe.cache.model.ImageRecord;
import com.picframe.cache.model.Location;
import com.picframe.cache.repository.FolderRepository;
import com.picframe.cache.repository.ImageFileRepository;
import com.picframe.cache.repository.ImageMetaRepository;
import com.picframe.cache.repository.ImageRecordRepository;
import com.picframe.cache.repository.LocationRepository;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.util.FileSystemUtils;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.FileTime;
import java.time.Instant;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyDouble;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

/**
 * Runs real update cycles against the in-memory store and a scratch picture tree.
 * Every directory touched by a test gets an explicit, increasing mtime so change detection
 * never depends on the filesystem's timestamp resolution.
 */
@SpringBootTest
class IndexingCycleIntegrationTest {

    private static final long BASE_MILLIS = 1_600_000_000_000L;

    @Autowired
    private IndexUpdateService indexUpdateService;

    @Autowired
    private ImageQueryService imageQueryService;

    @Autowired
    private ImageRecordRepository imageRecordRepository;

    @Autowired
    private FolderRepository folderRepository;

    @Autowired
    private ImageFileRepository imageFileRepository;

    @Autowired
    private ImageMetaRepository imageMetaRepository;

    @Autowired
    private LocationRepository locationRepository;

    @Autowired
    private JdbcTemplate jdbcTemplate;

    @MockBean
    private ImageMetadataExtractor metadataExtractor;

    @MockBean
    private GeoReverser geoReverser;

    private final Map<String, ExtractedMetadata> metadataByName = new HashMap<>();
    private Path root;
    private long stamp = BASE_MILLIS;

    @BeforeEach
    void setUp() throws IOException {
        jdbcTemplate.update("DELETE FROM folder");
        jdbcTemplate.update("DELETE FROM location");
        root = indexUpdateService.getPictureDir();
        FileSystemUtils.deleteRecursively(root);
        Files.createDirectories(root);
        touch(root);

        when(metadataExtractor.extract(any(Path.class))).thenAnswer(invocation -> {
            Path path = invocation.getArgument(0);
            return metadataByName.getOrDefault(path.getFileName().toString(),
                    ExtractedMetadata.builder().width(40).height(30).build());
        });
        when(geoReverser.resolve(anyDouble(), anyDouble())).thenReturn(Optional.empty());
    }

    @AfterEach
    void tearDown() {
        imageQueryService.setPortraitPairs(false);
    }

    @Test
    void secondCycleWithoutChangesIsANoOp() throws IOException {
        Path album = folder("2021");
        image(album, "one.jpg");
        image(album, "two.png");

        CacheUpdateReport first = indexUpdateService.updateCache();
        List<Map<String, Object>> before = jdbcTemplate.queryForList("SELECT * FROM all_data ORDER BY file_id");
        CacheUpdateReport second = indexUpdateService.updateCache();

        assertThat(first.getModifiedFiles()).isEqualTo(2);
        assertThat(first.getMetadataWritten()).isEqualTo(2);
        assertThat(second.getModifiedFolders()).isZero();
        assertThat(second.getModifiedFiles()).isZero();
        assertThat(second.isUnchanged()).isTrue();
        assertThat(jdbcTemplate.queryForList("SELECT * FROM all_data ORDER BY file_id")).isEqualTo(before);
    }

    @Test
    void newFileAppearsAfterEarlierCaptures() throws IOException {
        Path album = folder("trip");
        dated("old.jpg", 1_500_000_000L);
        image(album, "old.jpg");
        indexUpdateService.updateCache();
        long oldId = idOf(album.resolve("old.jpg"));

        dated("new.jpg", 1_700_000_000L);
        image(album, "new.jpg");
        CacheUpdateReport report = indexUpdateService.updateCache();
        long newId = idOf(album.resolve("new.jpg"));

        assertThat(report.getModifiedFiles()).isEqualTo(1);
        assertThat(imageQueryService.query("true", "captureTime asc"))
                .containsExactly(ImageSlot.of(oldId), ImageSlot.of(newId));
    }

    @Test
    void deletedFileLosesOnlyItsOwnRows() throws IOException {
        Path album = folder("album");
        image(album, "keep.jpg");
        Path gone = image(album, "gone.jpg");
        indexUpdateService.updateCache();
        long keepId = idOf(album.resolve("keep.jpg"));
        long goneId = idOf(gone);

        Files.delete(gone);
        touch(album);
        CacheUpdateReport report = indexUpdateService.updateCache();

        assertThat(report.getPurgedFiles()).isEqualTo(1);
        assertThat(imageFileRepository.existsById(goneId)).isFalse();
        assertThat(imageMetaRepository.existsById(goneId)).isFalse();
        assertThat(imageMetaRepository.existsById(keepId)).isTrue();
        long folderId = folderRepository.findByName(album.toString()).orElseThrow().getId();
        assertThat(imageFileRepository.countByFolderId(folderId)).isEqualTo(1);
    }

    @Test
    void removedFolderTakesItsFilesWithIt() throws IOException {
        Path a = folder("a");
        Path b = folder("b");
        image(a, "x.jpg");
        image(a, "y.jpg");
        image(b, "z.jpg");
        indexUpdateService.updateCache();
        long zId = idOf(b.resolve("z.jpg"));

        FileSystemUtils.deleteRecursively(a);
        touch(root);
        CacheUpdateReport report = indexUpdateService.updateCache();

        assertThat(report.getPurgedFolders()).isEqualTo(1);
        assertThat(jdbcTemplate.queryForObject("SELECT COUNT(*) FROM folder WHERE name = ?", Integer.class, a.toString()))
                .isZero();
        assertThat(jdbcTemplate.queryForObject("SELECT COUNT(*) FROM file", Integer.class)).isEqualTo(1);
        assertThat(jdbcTemplate.queryForObject("SELECT COUNT(*) FROM meta", Integer.class)).isEqualTo(1);
        assertThat(countWhere("meta", zId)).isEqualTo(1);
    }

    @Test
    void consecutivePortraitsShareASlotWhenPairingIsOn() throws IOException {
        Path album = folder("mixed");
        metadataByName.put("l1.jpg", landscape(1_000L));
        metadataByName.put("p1.jpg", portrait(2_000L));
        metadataByName.put("p2.jpg", portrait(3_000L));
        metadataByName.put("l2.jpg", landscape(4_000L));
        for (String name : List.of("l1.jpg", "p1.jpg", "p2.jpg", "l2.jpg")) {
            image(album, name);
        }
        indexUpdateService.updateCache();
        long l1 = idOf(album.resolve("l1.jpg"));
        long p1 = idOf(album.resolve("p1.jpg"));
        long p2 = idOf(album.resolve("p2.jpg"));
        long l2 = idOf(album.resolve("l2.jpg"));

        imageQueryService.setPortraitPairs(true);

        assertThat(imageQueryService.query(null, "captureTime ASC"))
                .containsExactly(ImageSlot.of(l1), ImageSlot.of(p1, p2), ImageSlot.of(l2));
        assertThat(imageQueryService.query("NOT isPortrait", "captureTime DESC"))
                .containsExactly(ImageSlot.of(l2), ImageSlot.of(l1));
    }

    @Test
    void filterValuesAreBoundAgainstTheView() throws IOException {
        Path album = folder("cams");
        metadataByName.put("canon.jpg", ExtractedMetadata.builder().width(40).height(30).make("Canon").rating(5).build());
        metadataByName.put("nikon.jpg", ExtractedMetadata.builder().width(40).height(30).make("Nikon").rating(2).build());
        image(album, "canon.jpg");
        image(album, "nikon.jpg");
        indexUpdateService.updateCache();

        assertThat(imageQueryService.queryIds("make LIKE 'Can%' AND rating >= 4", "fname"))
                .containsExactly(idOf(album.resolve("canon.jpg")));
        assertThat(imageQueryService.queryIds("make = 'x'' OR 1=1 --'", null)).isEmpty();
    }

    @Test
    void locationIsResolvedOnceAndThenServedFromCache() throws IOException {
        Path album = folder("london");
        metadataByName.put("eye.jpg", ExtractedMetadata.builder()
                .width(40).height(30).latitude(51.50123456).longitude(-0.12783210).build());
        image(album, "eye.jpg");
        indexUpdateService.updateCache();
        long id = idOf(album.resolve("eye.jpg"));
        when(geoReverser.resolve(anyDouble(), anyDouble())).thenReturn(Optional.of("Westminster, England, United Kingdom"));

        Optional<ImageRecord> first = imageQueryService.getFileInfo(id);
        Optional<ImageRecord> second = imageQueryService.getFileInfo(id);

        assertThat(first).map(ImageRecord::getLocation).contains("Westminster, England, United Kingdom");
        assertThat(second).map(ImageRecord::getLocation).contains("Westminster, England, United Kingdom");
        verify(geoReverser, times(1)).resolve(eq(51.5012), eq(-0.1278));
        assertThat(locationRepository.findByLatitudeAndLongitude(51.5012, -0.1278))
                .map(Location::getDescription)
                .contains("Westminster, England, United Kingdom");
    }

    @Test
    void emptyGeocodeIsAskedAgainOnEveryRead() throws IOException {
        Path album = folder("nowhere");
        metadataByName.put("sea.jpg", ExtractedMetadata.builder()
                .width(40).height(30).latitude(0.5).longitude(-30.25).build());
        image(album, "sea.jpg");
        indexUpdateService.updateCache();
        long id = idOf(album.resolve("sea.jpg"));

        assertThat(imageQueryService.getFileInfo(id)).map(ImageRecord::getLocation).isEmpty();
        assertThat(imageQueryService.getFileInfo(id)).map(ImageRecord::getLocation).isEmpty();

        verify(geoReverser, times(2)).resolve(0.5, -30.25);
        assertThat(jdbcTemplate.queryForObject("SELECT COUNT(*) FROM location", Integer.class)).isZero();
    }

    @Test
    void oneBadFileDoesNotSpoilTheCycle() throws IOException {
        Path album = folder("damaged");
        image(album, "fine.jpg");
        Path broken = image(album, "broken.jpg");
        when(metadataExtractor.extract(broken)).thenThrow(new IllegalStateException("truncated"));

        CacheUpdateReport report = indexUpdateService.updateCache();

        assertThat(report.getExtractionFailures()).isEqualTo(1);
        assertThat(report.getMetadataWritten()).isEqualTo(1);
        assertThat(countWhere("meta", idOf(album.resolve("fine.jpg")))).isEqualTo(1);
        assertThat(countWhere("meta", idOf(broken))).isZero();
        assertThat(imageQueryService.queryIds("NOT isPortrait", null))
                .containsExactlyInAnyOrder(idOf(album.resolve("fine.jpg")), idOf(broken));
        assertThat(imageQueryService.queryIds("isPortrait", null)).isEmpty();
    }

    @Test
    void hiddenAndUnsupportedFilesAreIgnored() throws IOException {
        Path album = folder("misc");
        image(album, "photo.jpeg");
        image(album, ".secret.jpg");
        image(album, "notes.txt");
        Path sidecar = folder("misc/.AppleDouble");
        image(sidecar, "photo.jpeg");

        indexUpdateService.updateCache();

        assertThat(imageRecordRepository.findAll())
                .extracting(ImageRecord::getFname)
                .containsExactly(album.resolve("photo.jpeg").toString());
    }

    @Test
    void changedFileKeepsItsId() throws IOException {
        Path album = folder("edits");
        Path photo = image(album, "portrait.jpg");
        indexUpdateService.updateCache();
        long id = idOf(photo);

        metadataByName.put("portrait.jpg", ExtractedMetadata.builder().width(30).height(40).build());
        touch(photo);
        touch(album);
        CacheUpdateReport report = indexUpdateService.updateCache();

        assertThat(report.getModifiedFiles()).isEqualTo(1);
        assertThat(idOf(photo)).isEqualTo(id);
        assertThat(imageRecordRepository.findById(id)).map(ImageRecord::getPortrait).contains(true);
        ImageMeta meta = imageMetaRepository.findById(id).orElseThrow();
        assertThat(meta.getWidth()).isEqualTo(30);
        assertThat(meta.getHeight()).isEqualTo(40);
    }

    private Path folder(String relative) throws IOException {
        Path dir = Files.createDirectories(root.resolve(relative));
        touch(dir);
        touch(dir.getParent());
        return dir;
    }

    private Path image(Path dir, String name) throws IOException {
        Path file = Files.write(dir.resolve(name), new byte[]{1, 2, 3});
        touch(file);
        touch(dir);
        return file;
    }

    private void touch(Path path) throws IOException {
        stamp += 10_000L;
        Files.setLastModifiedTime(path, FileTime.fromMillis(stamp));
    }

    private void dated(String name, long epochSecond) {
        metadataByName.put(name, ExtractedMetadata.builder()
                .width(40).height(30).captureTime(Instant.ofEpochSecond(epochSecond)).build());
    }

    private ExtractedMetadata landscape(long epochSecond) {
        return ExtractedMetadata.builder().width(40).height(30).captureTime(Instant.ofEpochSecond(epochSecond)).build();
    }

    private ExtractedMetadata portrait(long epochSecond) {
        return ExtractedMetadata.builder().width(30).height(40).captureTime(Instant.ofEpochSecond(epochSecond)).build();
    }

    private long idOf(Path file) {
        return imageRecordRepository.findByFname(file.toString())
                .map(ImageRecord::getFileId)
                .orElseThrow(() -> new AssertionError("not indexed: " + file));
    }

    private int countWhere(String table, long fileId) {
        return jdbcTemplate.queryForObject("SELECT COUNT(*) FROM " + table + " WHERE file_id = ?", Integer.class, fileId);
    }
}
