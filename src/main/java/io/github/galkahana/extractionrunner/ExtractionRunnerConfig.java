package io.github.galkahana.extractionrunner;

import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

import lombok.Builder;
import lombok.Value;

/**
 * Settings of a run. Every setting has a default, so {@code ExtractionRunnerConfig.builder().build()} is usable.
 */
@Value
@Builder(toBuilder = true)
public class ExtractionRunnerConfig {

    /** Process with {@link ParallelTaskExecutor}, otherwise with {@link SequentialTaskExecutor} */
    @Builder.Default boolean parallel = true;
    @Builder.Default int maxWorkers = ParallelTaskExecutor.DEFAULT_MAX_WORKERS;

    @Builder.Default boolean checkpointing = true;
    @Builder.Default Path checkpointFile = Path.of("processing_checkpoint.json");
    @Builder.Default int checkpointBatchSize = CheckpointStore.DEFAULT_BATCH_SIZE;

    @Builder.Default int retryAttempts = RetryPolicy.DEFAULT_MAX_ATTEMPTS;
    @Builder.Default Duration retryBaseDelay = RetryPolicy.DEFAULT_BASE_DELAY;
    @Builder.Default Duration retryMaxDelay = RetryPolicy.DEFAULT_MAX_DELAY;

    /** Repository calls admitted per {@link #rateLimitWindow} */
    @Builder.Default int repositoryRateLimit = 100;
    /** Extraction calls admitted per {@link #rateLimitWindow} */
    @Builder.Default int extractionRateLimit = 50;
    @Builder.Default Duration rateLimitWindow = RateLimiter.DEFAULT_WINDOW;

    @Builder.Default PriceTable priceTable = PriceTable.DEFAULT;

    /** Write results as JSON lines instead of rewriting one JSON array per result */
    @Builder.Default boolean appendOnlyResults = false;

    /**
     * @return One message per invalid setting, empty when the configuration is usable
     */
    public List<String> validate() {
        List<String> errors = new ArrayList<>();
        if (maxWorkers < ParallelTaskExecutor.MIN_WORKERS) {
            errors.add("maxWorkers (" + maxWorkers + ") must be >= " + ParallelTaskExecutor.MIN_WORKERS);
        }
        if (maxWorkers > ParallelTaskExecutor.MAX_WORKERS_LIMIT) {
            errors.add("maxWorkers (" + maxWorkers + ") exceeds limit (" + ParallelTaskExecutor.MAX_WORKERS_LIMIT + ")");
        }
        if (checkpointing && checkpointFile == null) errors.add("checkpointFile is required when checkpointing");
        if (checkpointBatchSize < 1) errors.add("checkpointBatchSize must be >= 1");
        if (retryAttempts < 1) errors.add("retryAttempts must be >= 1");
        if (isNegative(retryBaseDelay)) errors.add("retryBaseDelay must not be negative");
        if (isNegative(retryMaxDelay)) errors.add("retryMaxDelay must not be negative");
        if (repositoryRateLimit < 1) errors.add("repositoryRateLimit must be >= 1");
        if (extractionRateLimit < 1) errors.add("extractionRateLimit must be >= 1");
        if (rateLimitWindow == null || rateLimitWindow.isZero() || rateLimitWindow.isNegative()) {
            errors.add("rateLimitWindow must be positive");
        }
        if (priceTable == null) errors.add("priceTable is required");
        return errors;
    }

    private static boolean isNegative(Duration duration) {
        return duration == null || duration.isNegative();
    }
}
