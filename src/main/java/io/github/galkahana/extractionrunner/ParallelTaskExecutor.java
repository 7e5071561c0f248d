package io.github.galkahana.extractionrunner;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.*;
import java.util.concurrent.atomic.AtomicInteger;

import lombok.extern.slf4j.Slf4j;

/**
 * Fixed-size worker pool over the task list.
 * <p>
 * Every task is submitted up front; {@code maxWorkers} threads draw from the queue, so completion order has no
 * relation to list order. Each worker updates the checkpoint, the progress tracker and the result sink itself, while
 * the calling thread collects the outcomes and blocks until every submitted task is accounted for.
 * <p>
 * {@link #cancel()} is cooperative: queued tasks are drained and counted as cancelled, a task picked up after the
 * flag is set returns without doing anything, and tasks already in flight finish their current download or
 * extraction normally.
 */
@Slf4j
public class ParallelTaskExecutor extends AbstractTaskExecutor {

    public static final int DEFAULT_MAX_WORKERS = 10;
    public static final int MIN_WORKERS = 1;
    public static final int MAX_WORKERS_LIMIT = 50;

    private static final long COLLECT_POLL_MILLIS = 50;

    private final int numWorkers;

    public ParallelTaskExecutor(ExecutionContext context) {
        this(context, DEFAULT_MAX_WORKERS);
    }

    /**
     * @param context Collaborators of the run
     * @param maxWorkers Number of worker threads, clamped to [{@value #MIN_WORKERS}, {@value #MAX_WORKERS_LIMIT}]
     */
    public ParallelTaskExecutor(ExecutionContext context, int maxWorkers) {
        super(context);
        this.numWorkers = clampWorkers(maxWorkers);
    }

    static int clampWorkers(int requested) {
        int clamped = Math.max(MIN_WORKERS, Math.min(MAX_WORKERS_LIMIT, requested));
        if (clamped != requested) {
            log.warn("Requested {} workers, using {} (allowed range {}..{})",
                    requested, clamped, MIN_WORKERS, MAX_WORKERS_LIMIT);
        }
        return clamped;
    }

    public int numWorkers() {
        return numWorkers;
    }

    @Override
    protected void runAll(List<Task> tasks, TaskProcessor processor, Tally tally) {
        ThreadPoolExecutor executor = new ThreadPoolExecutor(numWorkers, numWorkers, 0L, TimeUnit.MILLISECONDS,
                new LinkedBlockingQueue<>(), new WorkerThreadFactory());
        CompletionService<TaskOutcome> completionService = new ExecutorCompletionService<>(executor);
        log.info("Started executor with {} workers for {} tasks", numWorkers, tasks.size());

        int submitted = 0;
        for (Task task : tasks) {
            if (isCancelled()) break;
            completionService.submit(() -> processor.process(task));
            submitted++;
        }
        tally.cancelled += tasks.size() - submitted;

        int collected = 0, discarded = 0;
        boolean drained = false, interrupted = false;
        try {
            while (collected + discarded < submitted) {
                if (isCancelled() && !drained) {
                    discarded = executor.getQueue().drainTo(new ArrayList<>());
                    drained = true;
                    if (discarded > 0) log.info("Discarded {} pending tasks", discarded);
                    continue;
                }
                Future<TaskOutcome> future = completionService.poll(COLLECT_POLL_MILLIS, TimeUnit.MILLISECONDS);
                if (future == null) continue;
                collected++;
                tally.add(outcomeOf(future));
            }
        } catch (InterruptedException e) {
            // The flag stays cleared until the workers are stopped, so the wait below is not cut short
            log.warn("Interrupted while waiting for workers, cancelling run");
            interrupted = true;
            cancel();
            int pending = executor.shutdownNow().size();
            if (pending > 0) log.info("Discarded {} pending tasks", pending);
        } finally {
            stopExecutor(executor);
        }

        // Tasks in flight when the collection stopped have finished by now
        Future<TaskOutcome> future;
        while ((future = completionService.poll()) != null) {
            collected++;
            tally.add(outcomeOf(future));
        }
        tally.cancelled += submitted - collected;
        if (interrupted) Thread.currentThread().interrupt();
    }

    private TaskOutcome outcomeOf(Future<TaskOutcome> future) {
        try {
            return future.get();
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof InterruptedException) {
                return TaskOutcome.CANCELLED;
            }
            log.error("Unexpected error in worker", cause);
            return TaskOutcome.FAILED;
        } catch (CancellationException e) {
            return TaskOutcome.CANCELLED;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return TaskOutcome.CANCELLED;
        }
    }

    private void stopExecutor(ThreadPoolExecutor executor) {
        executor.shutdown();
        try {
            if (!executor.awaitTermination(1, TimeUnit.MINUTES)) {
                log.warn("Workers did not terminate in time");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        log.debug("All workers stopped");
    }

    private static final class WorkerThreadFactory implements ThreadFactory {
        private final AtomicInteger counter = new AtomicInteger();

        @Override
        public Thread newThread(Runnable runnable) {
            return new Thread(runnable, "extraction-worker-" + counter.incrementAndGet());
        }
    }
}
