package com.picframe.cache.service;

import com.picframe.cache.model.CacheUpdateReport;
import com.picframe.cache.model.SchedulerState;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.task.TaskExecutor;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Owns the single cache writer thread.
 * <p>
 * While RUNNING the loop runs {@link IndexUpdateService#updateCache()} and then idles for the cycle
 * interval. While PAUSED it only waits for commands. Callers never touch the loop state directly;
 * they post commands that the writer thread applies between cycles, so a cycle in progress is never
 * interrupted. STOPPED is terminal: the loop flushes the store and exits.
 */
@Service
public class CacheScheduler {

    private static final Logger logger = LoggerFactory.getLogger(CacheScheduler.class);

    private enum CommandType { PAUSE, RESUME, UPDATE_NOW, STOP }

    private record Command(CommandType type, CompletableFuture<CacheUpdateReport> result) {
        static Command of(CommandType type) {
            return new Command(type, null);
        }
    }

    private final IndexUpdateService indexUpdateService;
    private final TaskExecutor cacheWriterExecutor;
    private final long cycleIntervalMs;
    private final long pausePollMs;
    private final long stopTimeoutMs;
    private final boolean enabled;

    private final BlockingQueue<Command> commands = new LinkedBlockingQueue<>();
    private final AtomicReference<SchedulerState> state = new AtomicReference<>(SchedulerState.STOPPED);
    private final AtomicBoolean started = new AtomicBoolean(false);
    private final AtomicBoolean stopping = new AtomicBoolean(false);
    private final CompletableFuture<Void> terminated = new CompletableFuture<>();
    private volatile CacheUpdateReport lastReport;

    public CacheScheduler(IndexUpdateService indexUpdateService,
                          @Qualifier("cacheWriterExecutor") TaskExecutor cacheWriterExecutor,
                          @Value("${app.picframe.cache.cycle-interval-ms:2000}") long cycleIntervalMs,
                          @Value("${app.picframe.cache.pause-poll-ms:10}") long pausePollMs,
                          @Value("${app.picframe.cache.stop-timeout-ms:30000}") long stopTimeoutMs,
                          @Value("${app.picframe.cache.enabled:true}") boolean enabled) {
        this.indexUpdateService = indexUpdateService;
        this.cacheWriterExecutor = cacheWriterExecutor;
        this.cycleIntervalMs = Math.max(0, cycleIntervalMs);
        this.pausePollMs = Math.max(1, pausePollMs);
        this.stopTimeoutMs = Math.max(0, stopTimeoutMs);
        this.enabled = enabled;
    }

    @PostConstruct
    void startIfEnabled() {
        if (enabled) {
            start();
        } else {
            logger.info("Cache writer disabled; the image index will not be refreshed automatically");
        }
    }

    /**
     * Starts the writer loop in the RUNNING state. A scheduler can be started once.
     */
    public void start() {
        if (!started.compareAndSet(false, true)) {
            logger.warn("Cache writer already started; ignoring start request");
            return;
        }
        state.set(SchedulerState.RUNNING);
        cacheWriterExecutor.execute(this::runLoop);
    }

    /**
     * Requests PAUSED ({@code true}) or RUNNING ({@code false}). Applied by the writer thread after any
     * cycle in progress completes.
     */
    public void pauseLooping(boolean pause) {
        if (!isLoopActive()) {
            logger.debug("Cache writer not running; ignoring pause={}", pause);
            return;
        }
        commands.offer(Command.of(pause ? CommandType.PAUSE : CommandType.RESUME));
    }

    /**
     * Asks the writer thread to run a cycle now, whether or not it is paused. The future fails with
     * {@link IllegalStateException} when the writer is not running.
     */
    public CompletableFuture<CacheUpdateReport> requestUpdate() {
        CompletableFuture<CacheUpdateReport> result = new CompletableFuture<>();
        if (!isLoopActive()) {
            result.completeExceptionally(new IllegalStateException("Cache writer is not running"));
            return result;
        }
        commands.offer(new Command(CommandType.UPDATE_NOW, result));
        if (stopping.get()) {
            // the loop began shutting down after the check; its drain may already have run
            result.completeExceptionally(new IllegalStateException("Cache writer stopped"));
        }
        return result;
    }

    /**
     * Stops the writer after its current cycle and waits, up to the configured timeout, for the final
     * flush to complete.
     */
    public void stop() {
        if (!started.get() || terminated.isDone()) {
            return;
        }
        commands.offer(Command.of(CommandType.STOP));
        try {
            terminated.get(stopTimeoutMs, TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            logger.warn("Cache writer did not stop within {} ms", stopTimeoutMs);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            logger.warn("Interrupted while waiting for the cache writer to stop");
        } catch (ExecutionException e) {
            logger.error("Cache writer terminated abnormally: {}", e.getCause().getMessage(), e.getCause());
        }
    }

    @PreDestroy
    void shutdown() {
        stop();
    }

    public SchedulerState getState() {
        return state.get();
    }

    public CacheUpdateReport getLastReport() {
        return lastReport;
    }

    private boolean isLoopActive() {
        return started.get() && !stopping.get() && !terminated.isDone();
    }

    private void runLoop() {
        logger.info("Cache writer started for {}", indexUpdateService.getPictureDir());
        long nextCycleAt = 0;
        try {
            while (true) {
                if (state.get() == SchedulerState.RUNNING && System.currentTimeMillis() >= nextCycleAt) {
                    runCycle(null);
                    nextCycleAt = System.currentTimeMillis() + cycleIntervalMs;
                }
                long waitMs = state.get() == SchedulerState.RUNNING
                        ? Math.max(1, nextCycleAt - System.currentTimeMillis())
                        : pausePollMs;
                Command command = commands.poll(waitMs, TimeUnit.MILLISECONDS);
                if (command == null) {
                    continue;
                }
                switch (command.type()) {
                    case PAUSE -> transition(SchedulerState.PAUSED);
                    case RESUME -> transition(SchedulerState.RUNNING);
                    case UPDATE_NOW -> {
                        runCycle(command.result());
                        nextCycleAt = System.currentTimeMillis() + cycleIntervalMs;
                    }
                    case STOP -> {
                        return;
                    }
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            logger.warn("Cache writer interrupted");
        } finally {
            finishLoop();
        }
    }

    private void runCycle(CompletableFuture<CacheUpdateReport> result) {
        try {
            CacheUpdateReport report = indexUpdateService.updateCache();
            lastReport = report;
            if (result != null) {
                result.complete(report);
            }
        } catch (RuntimeException e) {
            logger.error("Cache update cycle failed and was rolled back: {}", e.getMessage(), e);
            if (result != null) {
                result.completeExceptionally(e);
            }
        }
    }

    private void transition(SchedulerState target) {
        SchedulerState previous = state.getAndSet(target);
        if (previous != target) {
            logger.info("Cache writer {} -> {}", previous, target);
        }
    }

    private void finishLoop() {
        // set before draining so requests that slip in afterwards fail on their own
        stopping.set(true);
        transition(SchedulerState.STOPPED);
        List<Command> pending = new ArrayList<>();
        commands.drainTo(pending);
        for (Command command : pending) {
            if (command.result() != null) {
                command.result().completeExceptionally(new IllegalStateException("Cache writer stopped"));
            }
        }
        try {
            indexUpdateService.flushStore();
        } catch (RuntimeException e) {
            logger.error("Final flush of the image cache failed: {}", e.getMessage(), e);
        } finally {
            terminated.complete(null);
            logger.info("Cache writer stopped");
        }
    }
}
