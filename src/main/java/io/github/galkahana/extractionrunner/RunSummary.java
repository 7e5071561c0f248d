package io.github.galkahana.extractionrunner;

/**
 * Final statistics of a run, returned whether it completed, failed partially or was cancelled.
 *
 * @param taskCount Tasks handed to the executor
 * @param skipped Tasks skipped because a previous run already completed them
 * @param cancelled Tasks never started because of cancellation
 * @param wasCancelled Whether {@link TaskExecutor#cancel()} was called during the run
 * @param progress Counters, timings and throughput at the end of the run
 * @param cost Cost of the run
 */
public record RunSummary(int taskCount, int skipped, int cancelled, boolean wasCancelled,
                         ProgressSnapshot progress, CostEstimate cost) {

    public int processed() {
        return progress.processed();
    }

    public int success() {
        return progress.success();
    }

    public int partial() {
        return progress.partial();
    }

    public int failed() {
        return progress.failed();
    }
}
