package com.picframe.cache.controller;

import com.picframe.cache.model.CacheUpdateReport;
import com.picframe.cache.service.CacheScheduler;
import com.picframe.cache.service.ImageQueryService;
import com.picframe.cache.service.InvalidQueryExpressionException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

import java.util.concurrent.CompletableFuture;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ImageCacheControllerTest {

    @Mock
    private CacheScheduler cacheScheduler;

    @Mock
    private ImageQueryService imageQueryService;

    private ImageCacheController controller;

    @BeforeEach
    void setUp() {
        controller = new ImageCacheController(cacheScheduler, imageQueryService, 50);
    }

    @Test
    void updateThatNeverFinishesTimesOut() {
        when(cacheScheduler.requestUpdate()).thenReturn(new CompletableFuture<>());

        ResponseEntity<?> response = controller.updateCache();

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.GATEWAY_TIMEOUT);
    }

    @Test
    void updateReturnsTheCycleReport() {
        CacheUpdateReport report = CacheUpdateReport.builder().modifiedFiles(2).build();
        when(cacheScheduler.requestUpdate()).thenReturn(CompletableFuture.completedFuture(report));

        ResponseEntity<?> response = controller.updateCache();

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.OK);
        assertThat(response.getBody()).isSameAs(report);
    }

    @Test
    void stoppedWriterIsAConflict() {
        when(cacheScheduler.requestUpdate())
                .thenReturn(CompletableFuture.failedFuture(new IllegalStateException("Cache writer stopped")));

        assertThat(controller.updateCache().getStatusCode()).isEqualTo(HttpStatus.CONFLICT);
    }

    @Test
    void rejectedExpressionIsABadRequest() {
        when(imageQueryService.query("rating >", "captureTime ASC"))
                .thenThrow(new InvalidQueryExpressionException("Expected a value at position 8"));

        assertThat(controller.queryImages("rating >", "captureTime ASC").getStatusCode())
                .isEqualTo(HttpStatus.BAD_REQUEST);
    }
}
