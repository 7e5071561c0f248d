package io.github.galkahana.extractionrunner;

import java.time.Duration;
import java.util.Locale;
import java.util.concurrent.atomic.AtomicInteger;

import io.github.resilience4j.core.IntervalBiFunction;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import lombok.extern.slf4j.Slf4j;

/**
 * Bounded retries with exponential backoff.
 * <p>
 * The delay before attempt {@code k} (0-indexed, {@code k >= 1}) is {@code min(baseDelay * 2^(k-1), maxDelay)}.
 * When the failure looks like provider throttling the delay is doubled, still capped at {@code maxDelay}.
 * After {@code maxAttempts} failures the last error is rethrown unchanged. Interruptions are never retried.
 * <p>
 * Holds no per-call state: the underlying Resilience4j {@link Retry} keeps its attempt counters in a
 * context created for each call, so one policy can be shared by all workers.
 */
@Slf4j
public class RetryPolicy {

    public static final int DEFAULT_MAX_ATTEMPTS = 3;
    public static final Duration DEFAULT_BASE_DELAY = Duration.ofSeconds(1);
    public static final Duration DEFAULT_MAX_DELAY = Duration.ofSeconds(60);

    private static final String[] THROTTLING_MARKERS = {"rate limit", "429", "too many requests"};

    private final int maxAttempts;
    private final Duration baseDelay;
    private final Duration maxDelay;
    private final Retry retry;

    public RetryPolicy() {
        this(DEFAULT_MAX_ATTEMPTS, DEFAULT_BASE_DELAY, DEFAULT_MAX_DELAY);
    }

    /**
     * @param maxAttempts Total number of invocations, including the first one
     * @param baseDelay Delay before the first retry
     * @param maxDelay Upper bound for any single delay
     */
    public RetryPolicy(int maxAttempts, Duration baseDelay, Duration maxDelay) {
        if (maxAttempts < 1) throw new IllegalArgumentException("maxAttempts must be >= 1, got " + maxAttempts);
        this.maxAttempts = maxAttempts;
        this.baseDelay = baseDelay;
        this.maxDelay = maxDelay;

        IntervalBiFunction<Object> interval = (attempt, outcome) ->
                delayBeforeAttempt(attempt, outcome.isLeft() ? outcome.getLeft() : null).toMillis();

        RetryConfig config = RetryConfig.custom()
                .maxAttempts(maxAttempts)
                .intervalBiFunction(interval)
                .retryOnException(e -> !(e instanceof InterruptedException))
                .build();
        this.retry = Retry.of("extraction-runner-retry", config);
        this.retry.getEventPublisher().onRetry(event -> log.debug("Attempt {} failed ({}), retrying in {} ms",
                event.getNumberOfRetryAttempts(), messageOf(event.getLastThrowable()), event.getWaitInterval().toMillis()));
    }

    /**
     * Run {@code operation} until it succeeds or {@code maxAttempts} invocations have failed.
     *
     * @return The first successful result
     * @throws InterruptedException If the thread was interrupted, including while waiting between attempts
     * @throws Exception The error of the last attempt
     */
    public <T> T executeWithRetry(ThrowingSupplier<T> operation) throws Exception {
        try {
            return retry.executeCallable(operation::get);
        } catch (InterruptedException e) {
            throw e;
        } catch (Exception e) {
            // Resilience4j answers an interrupted wait with the last error and the interrupt flag set
            if (Thread.interrupted()) {
                InterruptedException interrupted = new InterruptedException("Interrupted while retrying: " + e.getMessage());
                interrupted.addSuppressed(e);
                throw interrupted;
            }
            throw e;
        }
    }

    /**
     * Same as {@link #executeWithRetry(ThrowingSupplier)}, and in addition every throttling failure puts
     * {@code limiter} into backoff for the upcoming delay, so other workers calling the same provider pause too.
     */
    public <T> T executeWithRetry(ThrowingSupplier<T> operation, RateLimiter limiter) throws Exception {
        AtomicInteger failures = new AtomicInteger();
        return executeWithRetry(() -> {
            try {
                return operation.get();
            } catch (Exception e) {
                int failed = failures.incrementAndGet();
                if (failed < maxAttempts && isThrottling(e)) {
                    limiter.setBackoff(delayBeforeAttempt(failed, e));
                }
                throw e;
            }
        });
    }

    /**
     * Delay to wait before attempt {@code attempt} (0-indexed, so the first retry is attempt 1).
     *
     * @param attempt Attempt about to be made, {@code >= 1}
     * @param cause Failure of the previous attempt, may be null
     */
    public Duration delayBeforeAttempt(int attempt, Throwable cause) {
        int exponent = Math.max(0, attempt - 1);
        long delay = exponent >= 62 ? Long.MAX_VALUE : saturatedShift(baseDelay.toMillis(), exponent);
        delay = Math.min(delay, maxDelay.toMillis());
        if (isThrottling(cause)) {
            delay = Math.min(delay > Long.MAX_VALUE / 2 ? Long.MAX_VALUE : delay * 2, maxDelay.toMillis());
        }
        return Duration.ofMillis(delay);
    }

    /**
     * Case-insensitive match of the error message against the known throttling phrases.
     */
    public static boolean isThrottling(Throwable error) {
        if (error == null || error.getMessage() == null) return false;
        String message = error.getMessage().toLowerCase(Locale.ROOT);
        for (String marker : THROTTLING_MARKERS) {
            if (message.contains(marker)) return true;
        }
        return false;
    }

    public int maxAttempts() {
        return maxAttempts;
    }

    Retry retry() {
        return retry;
    }

    private static long saturatedShift(long value, int shift) {
        if (value == 0) return 0;
        return value > (Long.MAX_VALUE >> shift) ? Long.MAX_VALUE : value << shift;
    }

    private static String messageOf(Throwable error) {
        return error == null ? "no error" : error.getMessage();
    }
}
