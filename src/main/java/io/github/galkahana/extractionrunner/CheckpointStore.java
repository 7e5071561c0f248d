package io.github.galkahana.extractionrunner;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;

/**
 * Durable record of which tasks are done, so that an interrupted run can resume without redoing them.
 * <p>
 * The state is loaded from {@code checkpointFile} on construction, written every {@code batchSize} completions
 * and once more by {@link #finalizeCheckpoint()}. Each write goes to a sibling {@code .tmp} file which then
 * replaces the record atomically, so a crash mid-write leaves the previous record readable.
 * <p>
 * Every operation is serialized on one lock. Writes are rare compared to task execution.
 * A failed write is logged and the run continues, at the cost of resumability for the unflushed completions.
 */
@Slf4j
public class CheckpointStore {

    public static final int DEFAULT_BATCH_SIZE = 100;

    private final Path checkpointFile;
    private final Path tempFile;
    private final int batchSize;
    private final Clock clock;
    private final ObjectMapper mapper = JsonSupport.mapper();

    private final Object lock = new Object();
    private final Set<String> processedIds = new LinkedHashSet<>();
    private final Map<String, String> failedIds = new LinkedHashMap<>();
    private int total, processed, success, partial, failed;
    private Instant startedAt, lastFlush;

    public CheckpointStore(Path checkpointFile) {
        this(checkpointFile, DEFAULT_BATCH_SIZE, Clock.systemUTC());
    }

    public CheckpointStore(Path checkpointFile, int batchSize) {
        this(checkpointFile, batchSize, Clock.systemUTC());
    }

    /**
     * @param checkpointFile Location of the durable record
     * @param batchSize Write the record every this many completions
     * @param clock Source of the start and flush timestamps
     */
    public CheckpointStore(Path checkpointFile, int batchSize, Clock clock) {
        if (batchSize < 1) throw new IllegalArgumentException("batchSize must be >= 1, got " + batchSize);
        this.checkpointFile = checkpointFile;
        this.tempFile = JsonSupport.tempFileOf(checkpointFile);
        this.batchSize = batchSize;
        this.clock = clock;
        load();
    }

    /**
     * @return false if the task was completed by this or a previous run
     */
    public boolean shouldProcess(String taskId) {
        synchronized (lock) {
            return !processedIds.contains(taskId);
        }
    }

    /**
     * Record a completed task. Flushes the record every {@code batchSize} completions.
     */
    public void markProcessed(String taskId, TaskStatus status) {
        synchronized (lock) {
            processedIds.add(taskId);
            processed++;
            switch (status) {
                case SUCCESS -> success++;
                case PARTIAL_SUCCESS -> partial++;
                case FAILED -> failed++;
            }
            if (processed % batchSize == 0) {
                flush();
            }
        }
    }

    /**
     * Record a task that ended in failure, keeping its error message for later inspection.
     */
    public void markFailed(String taskId, String message) {
        synchronized (lock) {
            failedIds.put(taskId, message);
            markProcessed(taskId, TaskStatus.FAILED);
        }
    }

    /**
     * Set the number of tasks in the run. Stamps the start time if this checkpoint has none yet.
     */
    public void setTotal(int total) {
        synchronized (lock) {
            this.total = total;
            if (startedAt == null) {
                startedAt = clock.instant();
            }
        }
    }

    public int remainingCount() {
        synchronized (lock) {
            return total - processed;
        }
    }

    public int processedCount() {
        synchronized (lock) {
            return processedIds.size();
        }
    }

    public CheckpointStats stats() {
        synchronized (lock) {
            return currentStats();
        }
    }

    /**
     * @return Copy of the failed task id to error message map
     */
    public Map<String, String> failedTasks() {
        synchronized (lock) {
            return new LinkedHashMap<>(failedIds);
        }
    }

    /**
     * Write the record unconditionally. Called once at the end of every run, cancelled runs included.
     */
    public void finalizeCheckpoint() {
        synchronized (lock) {
            flush();
        }
    }

    /**
     * Forget all progress and delete the durable record, to start a fresh run.
     */
    public void clear() {
        synchronized (lock) {
            processedIds.clear();
            failedIds.clear();
            total = processed = success = partial = failed = 0;
            startedAt = lastFlush = null;
            try {
                Files.deleteIfExists(checkpointFile);
                Files.deleteIfExists(tempFile);
                log.info("Cleared checkpoint {}", checkpointFile);
            } catch (IOException e) {
                log.warn("Could not delete checkpoint {}: {}", checkpointFile, e.getMessage());
            }
        }
    }

    /**
     * Write the failed tasks and their errors as a JSON object, for a later retry pass.
     *
     * @return Number of failed tasks written, 0 if there were none (no file is written then)
     * @throws IOException If the file cannot be written
     */
    public int exportFailedTasks(Path outputFile) throws IOException {
        Map<String, String> snapshot = failedTasks();
        if (snapshot.isEmpty()) {
            log.info("No failed tasks to export");
            return 0;
        }
        mapper.writeValue(outputFile.toFile(), snapshot);
        log.info("Exported {} failed tasks to {}", snapshot.size(), outputFile);
        return snapshot.size();
    }

    public Path checkpointFile() {
        return checkpointFile;
    }

    private CheckpointStats currentStats() {
        return new CheckpointStats(total, processed, success, partial, failed, startedAt, lastFlush);
    }

    // Caller holds the lock
    private void flush() {
        Instant now = clock.instant();
        CheckpointRecord record = new CheckpointRecord(
                new ArrayList<>(processedIds),
                new LinkedHashMap<>(failedIds),
                new CheckpointStats(total, processed, success, partial, failed, startedAt, now),
                now);
        try {
            JsonSupport.writeAtomically(checkpointFile, record);
            lastFlush = now;
            log.debug("Checkpoint written: {} processed, {} failed", processedIds.size(), failedIds.size());
        } catch (IOException e) {
            log.warn("Could not write checkpoint {}: {}", checkpointFile, e.getMessage());
        }
    }

    private void load() {
        if (!Files.exists(checkpointFile)) return;
        try {
            CheckpointRecord record = mapper.readValue(checkpointFile.toFile(), CheckpointRecord.class);
            if (record.processedIds() != null) processedIds.addAll(record.processedIds());
            if (record.failedIds() != null) {
                failedIds.putAll(record.failedIds());
                // A record written by hand or by an older version may miss failed ids in the processed list
                processedIds.addAll(record.failedIds().keySet());
            }
            CheckpointStats stats = record.stats() != null ? record.stats() : CheckpointStats.EMPTY;
            total = stats.total();
            processed = stats.processed();
            success = stats.success();
            partial = stats.partial();
            failed = stats.failed();
            startedAt = stats.startedAt();
            lastFlush = record.lastFlush() != null ? record.lastFlush() : stats.lastFlush();
            log.info("Loaded checkpoint {}: {} tasks already processed", checkpointFile, processedIds.size());
        } catch (IOException e) {
            log.warn("Could not load checkpoint {}, starting fresh: {}", checkpointFile, e.getMessage());
        }
    }
}
