package io.github.galkahana.extractionrunner;

import java.util.List;

import lombok.extern.slf4j.Slf4j;

/**
 * Processes the tasks one after the other on the calling thread, in list order.
 * Same per-task handling as {@link ParallelTaskExecutor}, without concurrency.
 */
@Slf4j
public class SequentialTaskExecutor extends AbstractTaskExecutor {

    public SequentialTaskExecutor(ExecutionContext context) {
        super(context);
    }

    @Override
    protected void runAll(List<Task> tasks, TaskProcessor processor, Tally tally) {
        for (int i = 0; i < tasks.size(); i++) {
            if (isCancelled()) {
                tally.cancelled += tasks.size() - i;
                return;
            }
            try {
                tally.add(processor.process(tasks.get(i)));
            } catch (InterruptedException e) {
                log.warn("Interrupted while processing {}", tasks.get(i).displayName());
                Thread.currentThread().interrupt();
                cancel();
                tally.cancelled += tasks.size() - i;
                return;
            }
        }
    }
}
