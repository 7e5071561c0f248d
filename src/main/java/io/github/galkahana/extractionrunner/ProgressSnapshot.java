package io.github.galkahana.extractionrunner;

import java.time.Duration;
import java.util.Optional;

/**
 * Immutable view of a {@link ProgressTracker} at one point in time.
 *
 * @param total Tasks expected in this run
 * @param processed Tasks completed so far
 * @param success Completed with {@link TaskStatus#SUCCESS}
 * @param partial Completed with {@link TaskStatus#PARTIAL_SUCCESS}
 * @param failed Completed with {@link TaskStatus#FAILED}
 * @param completionPercentage {@code processed / total * 100}, 0 when total is 0
 * @param elapsed Time since the tracker started
 * @param currentThroughput Tasks per minute over the most recent completions
 * @param averageThroughput Tasks per minute since the start
 * @param eta Estimated time left, empty when no throughput is known yet
 * @param inputUnits Input units consumed so far
 * @param outputUnits Output units consumed so far
 */
public record ProgressSnapshot(int total, int processed, int success, int partial, int failed,
                               double completionPercentage, Duration elapsed,
                               double currentThroughput, double averageThroughput, Optional<Duration> eta,
                               long inputUnits, long outputUnits) {

    public int remaining() {
        return Math.max(0, total - processed);
    }

    public long totalUnits() {
        return inputUnits + outputUnits;
    }
}
