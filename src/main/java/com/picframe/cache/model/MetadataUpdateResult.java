package com.picframe.cache.model;

public record MetadataUpdateResult(int written, int failed) {
}
