package com.picframe.cache.dto;

import io.swagger.v3.oas.annotations.media.Schema;

import java.util.List;

/**
 * One slideshow slide: a single image, or two portrait images shown side by side.
 */
@Schema(description = "One slide holding one file id, or two when portrait images are paired")
public record ImageSlot(List<Long> fileIds) {

    public ImageSlot {
        fileIds = List.copyOf(fileIds);
    }

    public static ImageSlot of(Long... fileIds) {
        return new ImageSlot(List.of(fileIds));
    }

    public boolean isPair() {
        return fileIds.size() == 2;
    }
}
