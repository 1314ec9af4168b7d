package com.picframe.cache.model;

import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

/**
 * Counters for one completed cache update cycle.
 */
@Getter
@Builder
@ToString
public class CacheUpdateReport {
    private final int modifiedFolders;
    private final int modifiedFiles;
    private final int metadataWritten;
    private final int extractionFailures;
    private final int purgedFolders;
    private final int purgedFiles;
    private final long elapsedMillis;

    public boolean isUnchanged() {
        return modifiedFolders == 0 && modifiedFiles == 0 && purgedFolders == 0 && purgedFiles == 0;
    }
}
