package com.picframe.cache.model;

public record PurgeResult(int folders, int files) {
}
