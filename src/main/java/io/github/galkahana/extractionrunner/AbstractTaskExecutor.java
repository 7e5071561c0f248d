package io.github.galkahana.extractionrunner;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;

import lombok.extern.slf4j.Slf4j;

/**
 * Run lifecycle shared by the sequential and parallel executors: destination and counter setup before the first
 * task, the final checkpoint write and the summary after the last one.
 */
@Slf4j
abstract class AbstractTaskExecutor implements TaskExecutor {

    protected final ExecutionContext context;
    protected final Object sinkLock = new Object();

    private final AtomicBoolean started = new AtomicBoolean(false);
    private volatile boolean cancelled = false;

    protected AbstractTaskExecutor(ExecutionContext context) {
        this.context = context;
    }

    /**
     * Counts of how the tasks of one run ended.
     */
    protected static final class Tally {
        int completed, failed, skipped, cancelled;

        void add(TaskOutcome outcome) {
            switch (outcome) {
                case COMPLETED -> completed++;
                case FAILED -> failed++;
                case SKIPPED -> skipped++;
                case CANCELLED -> cancelled++;
            }
        }
    }

    @Override
    public final RunSummary execute(List<Task> tasks, Path destination) {
        if (!started.compareAndSet(false, true)) {
            throw new IllegalStateException("Executor already used. Create a new executor for every run.");
        }
        prepare(tasks, destination);

        TaskProcessor processor = new TaskProcessor(context, destination, sinkLock, this::isCancelled);
        Tally tally = new Tally();
        try {
            runAll(tasks, processor, tally);
        } finally {
            if (context.checkpoint() != null) {
                context.checkpoint().finalizeCheckpoint();
            }
        }

        RunSummary summary = new RunSummary(tasks.size(), tally.skipped, tally.cancelled, isCancelled(),
                context.progressTracker().snapshot(), context.progressTracker().costEstimate(context.priceTable()));
        log.info("Run finished{}: {} processed ({} success, {} partial, {} failed), {} skipped, {} cancelled, cost {}",
                summary.wasCancelled() ? " (cancelled)" : "",
                summary.processed(), summary.success(), summary.partial(), summary.failed(),
                summary.skipped(), summary.cancelled(), summary.cost());
        return summary;
    }

    /**
     * Process {@code tasks} and record every outcome in {@code tally}. Tasks that are never handed to the
     * processor because of cancellation must be counted as cancelled.
     */
    protected abstract void runAll(List<Task> tasks, TaskProcessor processor, Tally tally);

    @Override
    public void cancel() {
        if (!cancelled) log.info("Cancellation requested");
        cancelled = true;
    }

    @Override
    public boolean isCancelled() {
        return cancelled;
    }

    private void prepare(List<Task> tasks, Path destination) {
        try {
            context.resultSink().initialize(destination);
        } catch (IOException e) {
            throw new BatchSetupException("Cannot initialize result destination " + destination, e);
        }

        CheckpointStore checkpoint = context.checkpoint();
        int pending = tasks.size();
        if (checkpoint != null) {
            checkpoint.setTotal(tasks.size());
            pending = (int) tasks.stream().filter(t -> checkpoint.shouldProcess(t.id())).count();
        }
        context.progressTracker().setTotal(pending);
        log.info("Starting run of {} tasks ({} already processed)", tasks.size(), tasks.size() - pending);
    }
}
