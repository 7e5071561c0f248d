package io.github.galkahana.extractionrunner;

import java.io.IOException;
import java.nio.file.Path;
import java.util.function.BooleanSupplier;

import lombok.extern.slf4j.Slf4j;

/**
 * Handling of a single task, shared by every {@link TaskExecutor}.
 * <p>
 * pending → skipped, when the checkpoint already holds the task;
 * pending → fetching → extracting → completed or failed;
 * pending → cancelled, when the run was cancelled before the task started.
 * <p>
 * Fetch strictly precedes extraction, and both precede the checkpoint, progress and sink updates.
 */
@Slf4j
class TaskProcessor {

    private final ExecutionContext context;
    private final Path destination;
    private final Object sinkLock;
    private final BooleanSupplier cancelled;

    TaskProcessor(ExecutionContext context, Path destination, Object sinkLock, BooleanSupplier cancelled) {
        this.context = context;
        this.destination = destination;
        this.sinkLock = sinkLock;
        this.cancelled = cancelled;
    }

    TaskOutcome process(Task task) throws InterruptedException {
        if (cancelled.getAsBoolean()) {
            return TaskOutcome.CANCELLED;
        }
        CheckpointStore checkpoint = context.checkpoint();
        if (checkpoint != null && !checkpoint.shouldProcess(task.id())) {
            log.debug("Skipping {} ({}), already processed", task.displayName(), task.id());
            return TaskOutcome.SKIPPED;
        }

        TaskResult result = fetchAndExtract(task);
        record(task, result);
        return result.status() == TaskStatus.FAILED ? TaskOutcome.FAILED : TaskOutcome.COMPLETED;
    }

    private TaskResult fetchAndExtract(Task task) throws InterruptedException {
        RetryPolicy retry = context.retryPolicy();

        log.debug("Fetching {}", task.displayName());
        byte[] content;
        try {
            context.repositoryLimiter().acquire();
            content = retry.executeWithRetry(() -> context.repository().get().fetch(task), context.repositoryLimiter());
        } catch (InterruptedException e) {
            throw e;
        } catch (Exception e) {
            log.error("Fetch of {} failed after retries: {}", task.displayName(), e.getMessage());
            return TaskResult.failed(task, "fetch failed: " + messageOf(e));
        }
        if (content == null) {
            log.error("Fetch of {} returned no content", task.displayName());
            return TaskResult.failed(task, "fetch failed: no content returned");
        }

        log.debug("Extracting {} ({} bytes)", task.displayName(), content.length);
        TaskResult extracted;
        try {
            context.extractionLimiter().acquire();
            extracted = retry.executeWithRetry(
                    () -> context.extraction().get().extract(content, task.displayName()), context.extractionLimiter());
        } catch (InterruptedException e) {
            throw e;
        } catch (Exception e) {
            log.error("Extraction of {} failed after retries: {}", task.displayName(), e.getMessage());
            return TaskResult.failed(task, "extraction failed: " + messageOf(e));
        }
        if (extracted == null) {
            return TaskResult.failed(task, "extraction failed: no result returned");
        }
        return extracted.withTask(task);
    }

    private void record(Task task, TaskResult result) {
        CheckpointStore checkpoint = context.checkpoint();
        if (checkpoint != null) {
            if (result.status() == TaskStatus.FAILED) {
                checkpoint.markFailed(task.id(), result.note() != null ? result.note() : "failed");
            } else {
                checkpoint.markProcessed(task.id(), result.status());
            }
        }

        TaskResult.Usage usage = result.usageOrNone();
        context.progressTracker().update(result.status(), usage.inputUnits(), usage.outputUnits());

        synchronized (sinkLock) {
            try {
                context.resultSink().append(destination, result);
            } catch (IOException e) {
                log.error("Could not write result of {} to {}: {}", task.displayName(), destination, e.getMessage());
            }
        }

        log.debug("Completed {}: {}", task.displayName(), result.status().wireName());

        ProgressListener listener = context.progressListener();
        if (listener != null) {
            try {
                listener.onProgress(context.progressTracker().snapshot());
            } catch (RuntimeException e) {
                log.warn("Progress listener failed: {}", e.getMessage());
            }
        }
    }

    private static String messageOf(Exception e) {
        return e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
    }
}
