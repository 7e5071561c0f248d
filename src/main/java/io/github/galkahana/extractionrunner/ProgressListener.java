package io.github.galkahana.extractionrunner;

/**
 * Optional callback invoked on the worker thread after every completed task.
 * Implementations must return quickly, a slow listener stalls the worker that calls it.
 */
@FunctionalInterface
public interface ProgressListener {
    void onProgress(ProgressSnapshot snapshot);
}
