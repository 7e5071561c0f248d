package io.github.galkahana.extractionrunner;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Locale;
import java.util.Optional;

/**
 * Thread-safe counters of a run, with throughput, ETA and cost derived on read.
 * <p>
 * Current throughput is computed over the last {@value #RECENT_WINDOW} completions, average throughput over the
 * whole elapsed time. Throughput values are tasks per minute.
 */
public class ProgressTracker {

    static final int RECENT_WINDOW = 100;

    private final Clock clock;
    private final Object lock = new Object();

    private final Instant startTime;
    private final Deque<Instant> recentCompletions = new ArrayDeque<>(RECENT_WINDOW);
    private int total;
    private int processed, success, partial, failed;
    private long inputUnits, outputUnits;

    public ProgressTracker() {
        this(0, Clock.systemUTC());
    }

    public ProgressTracker(int total, Clock clock) {
        this.total = total;
        this.clock = clock;
        this.startTime = clock.instant();
    }

    public void setTotal(int total) {
        synchronized (lock) {
            this.total = total;
        }
    }

    public void update(TaskStatus status) {
        update(status, 0, 0);
    }

    /**
     * Record one completed task.
     */
    public void update(TaskStatus status, long inputUnits, long outputUnits) {
        Instant now = clock.instant();
        synchronized (lock) {
            processed++;
            if (recentCompletions.size() == RECENT_WINDOW) recentCompletions.removeFirst();
            recentCompletions.addLast(now);

            switch (status) {
                case SUCCESS -> success++;
                case PARTIAL_SUCCESS -> partial++;
                case FAILED -> failed++;
            }
            this.inputUnits += inputUnits;
            this.outputUnits += outputUnits;
        }
    }

    public ProgressSnapshot snapshot() {
        Instant now = clock.instant();
        synchronized (lock) {
            Duration elapsed = Duration.between(startTime, now);
            double current = currentThroughput();
            double average = averageThroughput(elapsed);
            return new ProgressSnapshot(total, processed, success, partial, failed,
                    total == 0 ? 0.0 : processed * 100.0 / total,
                    elapsed, current, average, eta(current, average),
                    inputUnits, outputUnits);
        }
    }

    public CostEstimate costEstimate() {
        return costEstimate(PriceTable.DEFAULT);
    }

    /**
     * Price the usage so far and extrapolate it linearly to the whole run.
     */
    public CostEstimate costEstimate(PriceTable prices) {
        synchronized (lock) {
            double inputCost = inputUnits / 1_000_000.0 * prices.inputPerMillion();
            double outputCost = outputUnits / 1_000_000.0 * prices.outputPerMillion();
            double currentCost = inputCost + outputCost;
            double estimatedTotal = processed > 0 ? currentCost * total / processed : 0.0;
            return new CostEstimate(inputCost, outputCost, currentCost, estimatedTotal, inputUnits, outputUnits);
        }
    }

    /**
     * Multi-line human readable summary of the snapshot and cost.
     */
    public String formatSummary(PriceTable prices) {
        ProgressSnapshot s = snapshot();
        CostEstimate cost = costEstimate(prices);
        return String.join(System.lineSeparator(),
                "Progress Summary:",
                "================",
                String.format(Locale.ROOT, "Tasks: %d/%d (%.1f%%)", s.processed(), s.total(), s.completionPercentage()),
                String.format(Locale.ROOT, "Success: %d | Partial: %d | Failed: %d", s.success(), s.partial(), s.failed()),
                "",
                "Performance:",
                "-----------",
                "Elapsed: " + formatDuration(s.elapsed()),
                "ETA: " + s.eta().map(ProgressTracker::formatDuration).orElse("unknown"),
                String.format(Locale.ROOT, "Throughput: %.2f tasks/min (current)", s.currentThroughput()),
                String.format(Locale.ROOT, "Average: %.2f tasks/min", s.averageThroughput()),
                "",
                "API Usage:",
                "----------",
                String.format(Locale.ROOT, "Units: %,d (%,d in, %,d out)", s.totalUnits(), s.inputUnits(), s.outputUnits()),
                "Cost: " + cost);
    }

    static String formatDuration(Duration duration) {
        long seconds = duration.getSeconds();
        return String.format(Locale.ROOT, "%d:%02d:%02d", seconds / 3600, (seconds % 3600) / 60, seconds % 60);
    }

    // Caller holds the lock
    private double currentThroughput() {
        if (recentCompletions.size() < 2) return 0.0;
        long spanNanos = Duration.between(recentCompletions.peekFirst(), recentCompletions.peekLast()).toNanos();
        if (spanNanos <= 0) return 0.0;
        return (recentCompletions.size() - 1) * 60_000_000_000.0 / spanNanos;
    }

    private double averageThroughput(Duration elapsed) {
        long elapsedNanos = elapsed.toNanos();
        if (elapsedNanos <= 0 || processed == 0) return 0.0;
        return processed * 60_000_000_000.0 / elapsedNanos;
    }

    private Optional<Duration> eta(double current, double average) {
        int remaining = total - processed;
        if (remaining <= 0) return Optional.of(Duration.ZERO);
        double throughput = current > 0 ? current : average;
        if (throughput <= 0) return Optional.empty();
        return Optional.of(Duration.ofMillis(Math.round(remaining / throughput * 60_000.0)));
    }
}
