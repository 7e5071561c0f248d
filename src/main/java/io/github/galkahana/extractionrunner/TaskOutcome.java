package io.github.galkahana.extractionrunner;

/**
 * How a submitted task left the executor.
 */
public enum TaskOutcome {
    /** Already completed according to the checkpoint, nothing was emitted */
    SKIPPED,
    /** Completed with a success or partial success result */
    COMPLETED,
    /** Completed with a failed result, retries exhausted or extraction rejected the document */
    FAILED,
    /** Never started because the run was cancelled first */
    CANCELLED
}
