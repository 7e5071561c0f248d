package io.github.galkahana.extractionrunner;

import java.nio.file.Path;
import java.util.List;

/**
 * Runs a fixed list of tasks through fetch and extraction, persisting one result per completed task.
 * An executor runs once: create a new one, with fresh collaborators, for every run.
 */
public interface TaskExecutor {

    /**
     * Process every task and block until all are done or the run is cancelled.
     * Per-task failures never abort the run.
     *
     * @param tasks Tasks of the run
     * @param destination Where results are written. Truncated first
     * @return Final statistics
     * @throws BatchSetupException If the destination cannot be initialized. No task is attempted then
     */
    RunSummary execute(List<Task> tasks, Path destination);

    /**
     * Stop dispatching tasks. Tasks already started run to completion.
     */
    void cancel();

    boolean isCancelled();
}
