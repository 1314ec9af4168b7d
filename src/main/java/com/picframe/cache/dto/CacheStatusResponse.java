package com.picframe.cache.dto;

import com.picframe.cache.model.CacheUpdateReport;
import com.picframe.cache.model.SchedulerState;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Data;

@Data
@Schema(description = "Current state of the cache writer and the last completed cycle")
public class CacheStatusResponse {
    @Schema(description = "Writer loop state", example = "RUNNING")
    private SchedulerState state;

    @Schema(description = "Whether query results pair consecutive portrait images")
    private boolean portraitPairs;

    @Schema(description = "Counters from the most recent cycle, absent before the first one")
    private CacheUpdateReport lastReport;
}
