package io.github.galkahana.extractionrunner;

import java.time.Instant;

/**
 * Counters kept in a checkpoint.
 *
 * @param total Number of tasks in the run
 * @param processed Tasks completed in this and all resumed runs
 * @param success Tasks that completed with {@link TaskStatus#SUCCESS}
 * @param partial Tasks that completed with {@link TaskStatus#PARTIAL_SUCCESS}
 * @param failed Tasks that completed with {@link TaskStatus#FAILED}
 * @param startedAt When the first run of this checkpoint started, null until a total is set
 * @param lastFlush When the checkpoint was last written, null if never
 */
public record CheckpointStats(int total, int processed, int success, int partial, int failed,
                              Instant startedAt, Instant lastFlush) {

    public static final CheckpointStats EMPTY = new CheckpointStats(0, 0, 0, 0, 0, null, null);
}
