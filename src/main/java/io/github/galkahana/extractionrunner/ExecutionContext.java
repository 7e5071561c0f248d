package io.github.galkahana.extractionrunner;

import java.util.Objects;
import java.util.function.Supplier;

import lombok.Builder;

/**
 * Collaborators of one run, handed to a {@link TaskExecutor}.
 *
 * @param repository Supplies the repository client to the calling worker
 * @param extraction Supplies the extraction client to the calling worker
 * @param repositoryLimiter Admission control for repository calls
 * @param extractionLimiter Admission control for extraction calls
 * @param retryPolicy Retries applied to both calls
 * @param checkpoint Checkpoint of the run, null when checkpointing is disabled
 * @param progressTracker Counters of the run
 * @param resultSink Destination of the results
 * @param progressListener Optional callback after every completion, may be null
 * @param priceTable Prices used for the final cost estimate
 */
@Builder
public record ExecutionContext(
        Supplier<? extends RepositoryClient> repository,
        Supplier<? extends ExtractionClient> extraction,
        RateLimiter repositoryLimiter,
        RateLimiter extractionLimiter,
        RetryPolicy retryPolicy,
        CheckpointStore checkpoint,
        ProgressTracker progressTracker,
        ResultSink resultSink,
        ProgressListener progressListener,
        PriceTable priceTable) {

    public ExecutionContext {
        Objects.requireNonNull(repository, "repository");
        Objects.requireNonNull(extraction, "extraction");
        Objects.requireNonNull(repositoryLimiter, "repositoryLimiter");
        Objects.requireNonNull(extractionLimiter, "extractionLimiter");
        if (retryPolicy == null) retryPolicy = new RetryPolicy();
        if (progressTracker == null) progressTracker = new ProgressTracker();
        if (resultSink == null) resultSink = new JsonArrayResultSink();
        if (priceTable == null) priceTable = PriceTable.DEFAULT;
    }
}
