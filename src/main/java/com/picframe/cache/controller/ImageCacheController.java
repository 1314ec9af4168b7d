package com.picframe.cache.controller;

import com.picframe.cache.dto.CacheStatusResponse;
import com.picframe.cache.dto.ImageSlot;
import com.picframe.cache.model.CacheUpdateReport;
import com.picframe.cache.model.ImageRecord;
import com.picframe.cache.service.CacheScheduler;
import com.picframe.cache.service.ImageQueryService;
import com.picframe.cache.service.InvalidQueryExpressionException;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

@RestController
@RequestMapping("/api")
@Tag(name = "Image Cache", description = "Slideshow image queries and cache writer control")
public class ImageCacheController {

    private static final Logger logger = LoggerFactory.getLogger(ImageCacheController.class);

    private final CacheScheduler cacheScheduler;
    private final ImageQueryService imageQueryService;
    private final long updateTimeoutMs;

    public ImageCacheController(CacheScheduler cacheScheduler,
                                ImageQueryService imageQueryService,
                                @Value("${app.picframe.cache.update-timeout-ms:300000}") long updateTimeoutMs) {
        this.cacheScheduler = cacheScheduler;
        this.imageQueryService = imageQueryService;
        this.updateTimeoutMs = updateTimeoutMs;
    }

    @Operation(
            summary = "Query slideshow images",
            description = "Returns matching images in order as slots. A slot holds two ids when portrait " +
                    "pairing is on and two portrait images follow each other."
    )
    @ApiResponses(value = {
            @ApiResponse(responseCode = "200", description = "Ordered slots",
                    content = @Content(mediaType = "application/json",
                            schema = @Schema(implementation = ImageSlot.class))),
            @ApiResponse(responseCode = "400", description = "Filter or sort expression rejected", content = @Content)
    })
    @GetMapping("/images")
    public ResponseEntity<?> queryImages(
            @Parameter(description = "Filter expression, e.g. rating >= 3 AND make LIKE 'Canon%'")
            @RequestParam(defaultValue = "TRUE") String filter,
            @Parameter(description = "Sort expression, e.g. captureTime DESC")
            @RequestParam(defaultValue = "captureTime ASC") String sort) {
        try {
            List<ImageSlot> slots = imageQueryService.query(filter, sort);
            return ResponseEntity.ok(slots);
        } catch (InvalidQueryExpressionException e) {
            logger.warn("Rejected image query filter='{}' sort='{}': {}", filter, sort, e.getMessage());
            return ResponseEntity.badRequest().body(Map.of("error", e.getMessage()));
        }
    }

    @Operation(summary = "Get image details", description = "Full metadata of one image, resolving its place name on first access.")
    @ApiResponses(value = {
            @ApiResponse(responseCode = "200", description = "Image found",
                    content = @Content(mediaType = "application/json",
                            schema = @Schema(implementation = ImageRecord.class))),
            @ApiResponse(responseCode = "404", description = "No image with that id", content = @Content)
    })
    @GetMapping("/images/{fileId}")
    public ResponseEntity<ImageRecord> getImage(
            @Parameter(description = "File id returned by the image query", required = true)
            @PathVariable long fileId) {
        return imageQueryService.getFileInfo(fileId)
                .map(ResponseEntity::ok)
                .orElseGet(() -> ResponseEntity.notFound().build());
    }

    @Operation(summary = "Run a cache update now", description = "Runs one update cycle on the cache writer and returns its counters.")
    @ApiResponses(value = {
            @ApiResponse(responseCode = "200", description = "Cycle completed",
                    content = @Content(mediaType = "application/json",
                            schema = @Schema(implementation = CacheUpdateReport.class))),
            @ApiResponse(responseCode = "409", description = "Cache writer is not running", content = @Content),
            @ApiResponse(responseCode = "500", description = "Cycle failed and was rolled back", content = @Content),
            @ApiResponse(responseCode = "504", description = "Cycle did not finish in time", content = @Content)
    })
    @PostMapping("/cache/update")
    public ResponseEntity<?> updateCache() {
        try {
            return ResponseEntity.ok(cacheScheduler.requestUpdate().get(updateTimeoutMs, TimeUnit.MILLISECONDS));
        } catch (TimeoutException e) {
            logger.warn("Requested cache update still running after {} ms", updateTimeoutMs);
            return ResponseEntity.status(HttpStatus.GATEWAY_TIMEOUT)
                    .body(Map.of("error", "Cache update did not finish within " + updateTimeoutMs + " ms"));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).body(Map.of("error", "Interrupted"));
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof IllegalStateException) {
                return ResponseEntity.status(HttpStatus.CONFLICT).body(Map.of("error", cause.getMessage()));
            }
            logger.error("Requested cache update failed: {}", cause.getMessage(), cause);
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(Map.of("error", String.valueOf(cause.getMessage())));
        }
    }

    @Operation(summary = "Cache writer status")
    @GetMapping("/cache/status")
    public CacheStatusResponse status() {
        CacheStatusResponse response = new CacheStatusResponse();
        response.setState(cacheScheduler.getState());
        response.setPortraitPairs(imageQueryService.isPortraitPairs());
        response.setLastReport(cacheScheduler.getLastReport());
        return response;
    }

    @Operation(summary = "Pause or resume the cache writer", description = "Takes effect after the cycle in progress.")
    @PostMapping("/cache/pause")
    public CacheStatusResponse pause(@RequestParam boolean value) {
        cacheScheduler.pauseLooping(value);
        return status();
    }

    @Operation(summary = "Stop the cache writer", description = "Waits for the cycle in progress, flushes the store and stops. Cannot be restarted.")
    @PostMapping("/cache/stop")
    public CacheStatusResponse stop() {
        cacheScheduler.stop();
        return status();
    }

    @Operation(summary = "Turn portrait pairing on or off")
    @PostMapping("/cache/portrait-pairs")
    public CacheStatusResponse portraitPairs(@RequestParam boolean value) {
        imageQueryService.setPortraitPairs(value);
        return status();
    }
}
