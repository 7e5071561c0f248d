package io.github.galkahana.extractionrunner;

import java.time.Duration;
import java.util.ArrayDeque;
import java.util.Deque;

import lombok.extern.slf4j.Slf4j;

/**
 * Sliding-window admission control for one external dependency.
 * <p>
 * Admits at most {@code maxPerWindow} operations in any trailing window of {@code window} length. A backoff set with
 * {@link #setBackoff} blocks every subsequent {@link #acquire} until it has elapsed. The limiter never sleeps while
 * holding its lock, so a worker that reports throttling is not stuck behind a worker that is waiting for admission.
 * <p>
 * Create one instance per dependency and per run, so that throttling one provider does not block the other.
 */
@Slf4j
public class RateLimiter {

    public static final Duration DEFAULT_WINDOW = Duration.ofSeconds(60);

    /**
     * Time source and sleep primitive. Replaced in tests.
     */
    public interface Ticker {
        long nanoTime();

        void sleepNanos(long nanos) throws InterruptedException;

        Ticker SYSTEM = new Ticker() {
            @Override
            public long nanoTime() {
                return System.nanoTime();
            }

            @Override
            public void sleepNanos(long nanos) throws InterruptedException {
                Thread.sleep(nanos / 1_000_000L, (int) (nanos % 1_000_000L));
            }
        };
    }

    private final String name;
    private final int maxPerWindow;
    private final long windowNanos;
    private final Ticker ticker;

    private final Object lock = new Object();
    private final Deque<Long> admissions = new ArrayDeque<>();
    private long backoffUntil;
    private boolean backoffActive;

    public RateLimiter(String name, int maxPerWindow) {
        this(name, maxPerWindow, DEFAULT_WINDOW, Ticker.SYSTEM);
    }

    public RateLimiter(String name, int maxPerWindow, Duration window) {
        this(name, maxPerWindow, window, Ticker.SYSTEM);
    }

    /**
     * @param name Dependency name, used in log messages
     * @param maxPerWindow Maximum admissions within one window
     * @param window Length of the trailing window
     * @param ticker Time source
     */
    public RateLimiter(String name, int maxPerWindow, Duration window, Ticker ticker) {
        if (maxPerWindow < 1) throw new IllegalArgumentException("maxPerWindow must be >= 1, got " + maxPerWindow);
        if (window.isZero() || window.isNegative()) throw new IllegalArgumentException("window must be positive");
        this.name = name;
        this.maxPerWindow = maxPerWindow;
        this.windowNanos = window.toNanos();
        this.ticker = ticker;
    }

    /**
     * Block until one more operation may run, then record its admission.
     *
     * @throws InterruptedException If interrupted while waiting
     */
    public void acquire() throws InterruptedException {
        while (true) {
            long waitNanos;
            synchronized (lock) {
                long now = ticker.nanoTime();
                waitNanos = backoffRemaining(now);
                if (waitNanos <= 0) {
                    evictExpired(now);
                    if (admissions.size() < maxPerWindow) {
                        admissions.addLast(now);
                        return;
                    }
                    // Window is full: wait exactly until the oldest admission leaves it
                    waitNanos = admissions.peekFirst() + windowNanos - now;
                }
            }
            log.debug("Rate limiter '{}' waiting {} ms", name, waitNanos / 1_000_000L);
            ticker.sleepNanos(waitNanos);
        }
    }

    /**
     * Block all acquirers until {@code duration} from now. A shorter backoff never cuts an active longer one.
     */
    public void setBackoff(Duration duration) {
        synchronized (lock) {
            long until = ticker.nanoTime() + duration.toNanos();
            if (!backoffActive || until - backoffUntil > 0) {
                backoffUntil = until;
                backoffActive = true;
            }
        }
        log.info("Rate limiter '{}' backing off for {} ms", name, duration.toMillis());
    }

    public void clearBackoff() {
        synchronized (lock) {
            backoffActive = false;
        }
    }

    /**
     * Number of admissions recorded within the current window.
     */
    public int currentWindowCount() {
        synchronized (lock) {
            evictExpired(ticker.nanoTime());
            return admissions.size();
        }
    }

    public String name() {
        return name;
    }

    public int maxPerWindow() {
        return maxPerWindow;
    }

    private long backoffRemaining(long now) {
        if (!backoffActive) return 0;
        long remaining = backoffUntil - now;
        if (remaining <= 0) {
            backoffActive = false;
            return 0;
        }
        return remaining;
    }

    private void evictExpired(long now) {
        while (!admissions.isEmpty() && now - admissions.peekFirst() >= windowNanos) {
            admissions.removeFirst();
        }
    }
}
