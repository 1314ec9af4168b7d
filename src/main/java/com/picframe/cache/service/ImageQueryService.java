package com.picframe.cache.service;

import com.picframe.cache.dto.ImageSlot;
import com.picframe.cache.model.ImageRecord;
import com.picframe.cache.model.SqlCondition;
import com.picframe.cache.repository.ImageRecordRepository;
import com.picframe.cache.repository.ImageRecordRepositoryCustom;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Isolation;
import org.springframework.transaction.annotation.Transactional;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.stream.Collectors;

/**
 * Read side of the image cache. Safe to call from any thread while the cache writer is running.
 */
@Service
public class ImageQueryService {

    private static final Logger logger = LoggerFactory.getLogger(ImageQueryService.class);

    private final ImageRecordRepository imageRecordRepository;
    private final QueryExpressionTranslator translator;
    private final GeoLocationService geoLocationService;
    private final AtomicBoolean portraitPairs;

    public ImageQueryService(ImageRecordRepository imageRecordRepository,
                             QueryExpressionTranslator translator,
                             GeoLocationService geoLocationService,
                             @Value("${app.picframe.portrait-pairs:false}") boolean portraitPairs) {
        this.imageRecordRepository = imageRecordRepository;
        this.translator = translator;
        this.geoLocationService = geoLocationService;
        this.portraitPairs = new AtomicBoolean(portraitPairs);
    }

    /**
     * Returns the matching files as slideshow slots in sort order. With portrait pairing on,
     * consecutive portrait images are combined two to a slot; otherwise every slot holds one id.
     *
     * @throws InvalidQueryExpressionException if the filter or sort is rejected
     */
    @Transactional(readOnly = true, isolation = Isolation.REPEATABLE_READ)
    public List<ImageSlot> query(String filter, String sort) {
        SqlCondition condition = translator.translateFilter(filter);
        String orderBy = translator.translateSort(sort);

        if (!portraitPairs.get()) {
            return imageRecordRepository.findFileIds(condition, orderBy).stream()
                    .map(ImageSlot::of)
                    .collect(Collectors.toList());
        }
        List<Long> full = imageRecordRepository.findFileIdsMaskingPortraits(condition, orderBy);
        List<Long> portraits = imageRecordRepository.findPortraitFileIds(condition, orderBy);
        List<ImageSlot> slots = pairPortraits(full, portraits);
        logger.debug("Paired {} rows ({} portrait) into {} slots", full.size(), portraits.size(), slots.size());
        return slots;
    }

    /**
     * Matching file ids in sort order, ignoring portrait pairing.
     */
    @Transactional(readOnly = true)
    public List<Long> queryIds(String filter, String sort) {
        return imageRecordRepository.findFileIds(translator.translateFilter(filter), translator.translateSort(sort));
    }

    /**
     * Walks the full sequence; a landscape id becomes its own slot and each portrait placeholder takes
     * the next one or two ids from the portrait sequence. Placeholders left after the portraits run out
     * produce nothing.
     */
    static List<ImageSlot> pairPortraits(List<Long> full, List<Long> portraits) {
        Deque<Long> remaining = new ArrayDeque<>(portraits);
        List<ImageSlot> slots = new ArrayList<>();
        for (Long id : full) {
            if (id != ImageRecordRepositoryCustom.PORTRAIT_SLOT) {
                slots.add(ImageSlot.of(id));
            } else if (!remaining.isEmpty()) {
                Long first = remaining.poll();
                slots.add(remaining.isEmpty() ? ImageSlot.of(first) : ImageSlot.of(first, remaining.poll()));
            }
        }
        return slots;
    }

    /**
     * Loads one record. When it has coordinates but no cached place yet, the geocoder is asked and,
     * on an answer, the record is read again to pick up the new location.
     */
    public Optional<ImageRecord> getFileInfo(long fileId) {
        Optional<ImageRecord> record = imageRecordRepository.findById(fileId);
        if (record.isPresent() && record.get().needsLocation()) {
            ImageRecord found = record.get();
            if (geoLocationService.resolveAndCache(found.getLatitude(), found.getLongitude())) {
                return imageRecordRepository.findById(fileId);
            }
        }
        return record;
    }

    public boolean isPortraitPairs() {
        return portraitPairs.get();
    }

    public void setPortraitPairs(boolean enabled) {
        boolean previous = portraitPairs.getAndSet(enabled);
        if (previous != enabled) {
            logger.info("Portrait pairing {}", enabled ? "enabled" : "disabled");
        }
    }
}
