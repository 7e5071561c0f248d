package io.github.galkahana.extractionrunner;

import java.nio.file.Path;
import java.util.List;
import java.util.function.Supplier;

import lombok.extern.slf4j.Slf4j;

/**
 * Entry point for drivers: builds the collaborators of a run from an {@link ExtractionRunnerConfig} and runs the
 * tasks through the matching {@link TaskExecutor}.
 * <p>
 * Rate limiters, retry policy, checkpoint and progress tracker are created fresh for every {@link #run}, so nothing
 * carries over between runs except what the checkpoint file holds.
 *
 * <h2>Usage</h2>
 * <pre>{@code
 * ExtractionRunnerConfig config = ExtractionRunnerConfig.builder()
 *         .maxWorkers(8)
 *         .checkpointFile(Path.of("work/checkpoint.json"))
 *         .build();
 *
 * ExtractionPipeline pipeline = new ExtractionPipeline(
 *         config,
 *         WorkerLocal.perWorker(() -> new DriveClient(credentials)),
 *         WorkerLocal.shared(extractionClient))
 *     .onProgress(snapshot -> log.info("{}/{}", snapshot.processed(), snapshot.total()));
 *
 * RunSummary summary = pipeline.run(tasks, Path.of("results.json"));
 * }</pre>
 */
@Slf4j
public class ExtractionPipeline {

    private final ExtractionRunnerConfig config;
    private final Supplier<? extends RepositoryClient> repository;
    private final Supplier<? extends ExtractionClient> extraction;
    private ProgressListener progressListener;

    private volatile TaskExecutor currentExecutor;
    private volatile CheckpointStore lastCheckpoint;
    private volatile boolean cancelRequested = false;

    /**
     * Share one thread-safe instance of each client between all workers.
     */
    public ExtractionPipeline(ExtractionRunnerConfig config, RepositoryClient repository, ExtractionClient extraction) {
        this(config, WorkerLocal.shared(repository), WorkerLocal.shared(extraction));
    }

    /**
     * @param config Settings of the runs
     * @param repository Supplies the repository client to each worker, see {@link WorkerLocal}
     * @param extraction Supplies the extraction client to each worker, see {@link WorkerLocal}
     */
    public ExtractionPipeline(ExtractionRunnerConfig config,
                              Supplier<? extends RepositoryClient> repository,
                              Supplier<? extends ExtractionClient> extraction) {
        this.config = config;
        this.repository = repository;
        this.extraction = extraction;
    }

    public ExtractionPipeline onProgress(ProgressListener listener) {
        this.progressListener = listener;
        return this;
    }

    /**
     * Process {@code tasks}, writing one result per completed task to {@code destination}.
     * Tasks recorded in the checkpoint file by an earlier run are skipped.
     *
     * @throws BatchSetupException If the configuration is invalid or the destination cannot be created
     */
    public RunSummary run(List<Task> tasks, Path destination) {
        List<String> errors = config.validate();
        if (!errors.isEmpty()) {
            throw new BatchSetupException("Invalid configuration: " + String.join("; ", errors));
        }

        ExecutionContext context = createContext();
        TaskExecutor executor = config.isParallel()
                ? new ParallelTaskExecutor(context, config.getMaxWorkers())
                : new SequentialTaskExecutor(context);
        currentExecutor = executor;
        lastCheckpoint = context.checkpoint();
        if (cancelRequested) executor.cancel();

        log.info("Running {} tasks {}", tasks.size(),
                config.isParallel() ? "in parallel" : "sequentially");
        try {
            return executor.execute(tasks, destination);
        } finally {
            cancelRequested = false;
        }
    }

    /**
     * Cancel the run in progress. Completed work stays in the checkpoint.
     */
    public void cancel() {
        cancelRequested = true;
        TaskExecutor executor = currentExecutor;
        if (executor != null) executor.cancel();
    }

    /**
     * Delete the checkpoint file so the next run starts from scratch.
     */
    public void clearCheckpoint() {
        if (config.getCheckpointFile() == null) return;
        new CheckpointStore(config.getCheckpointFile(), config.getCheckpointBatchSize()).clear();
    }

    /**
     * @return The checkpoint of the latest run, null before the first run or when checkpointing is disabled
     */
    public CheckpointStore lastCheckpoint() {
        return lastCheckpoint;
    }

    ExecutionContext createContext() {
        CheckpointStore checkpoint = config.isCheckpointing()
                ? new CheckpointStore(config.getCheckpointFile(), config.getCheckpointBatchSize())
                : null;

        return ExecutionContext.builder()
                .repository(repository)
                .extraction(extraction)
                .repositoryLimiter(new RateLimiter("repository", config.getRepositoryRateLimit(), config.getRateLimitWindow()))
                .extractionLimiter(new RateLimiter("extraction", config.getExtractionRateLimit(), config.getRateLimitWindow()))
                .retryPolicy(new RetryPolicy(config.getRetryAttempts(), config.getRetryBaseDelay(), config.getRetryMaxDelay()))
                .checkpoint(checkpoint)
                .progressTracker(new ProgressTracker())
                .resultSink(config.isAppendOnlyResults() ? new JsonLinesResultSink() : new JsonArrayResultSink())
                .progressListener(progressListener)
                .priceTable(config.getPriceTable())
                .build();
    }
}
