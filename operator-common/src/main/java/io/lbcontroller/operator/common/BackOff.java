/*
 * Copyright lb-controller authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.lbcontroller.operator.common;

/**
 * <p>Computes delays for an exponential back-off used when a failed reconciliation is re-queued.
 * The {@link #delayMs()} method returns an increasing delay for every consecutive failure.</p>
 * <pre>  delayMs(n) = scaleMs * base ^ n</pre>
 * <p>The delay after the first failure is {@code scaleMs}, after the second one {@code scaleMs * base} and so on.
 * Once {@code maxAttempts} delays were handed out, {@link #delayMs()} throws {@link MaxAttemptsExceededException}.</p>
 */
public class BackOff {
    private static final long DEFAULT_SCALE_MS = 200L;
    private static final int DEFAULT_BASE = 2;
    private static final int DEFAULT_MAX_ATTEMPTS = 6;

    private final long scaleMs;
    private final int base;
    private final int maxAttempts;
    private int attempt = 0;

    /**
     * Computes delays according to {@code 200 * 2^attempt} with a maximum of 6 attempts.
     */
    public BackOff() {
        this(DEFAULT_SCALE_MS, DEFAULT_BASE, DEFAULT_MAX_ATTEMPTS);
    }

    /**
     * Computes delays according to {@code 200 * 2^attempt} with the given maximum number of attempts.
     *
     * @param maxAttempts The maximum number of attempts.
     */
    public BackOff(int maxAttempts) {
        this(DEFAULT_SCALE_MS, DEFAULT_BASE, maxAttempts);
    }

    /**
     * Computes delays according to {@code scaleMs * base^attempt} with the given maximum number of attempts.
     *
     * @param scaleMs       The scale.
     * @param base          The base.
     * @param maxAttempts   The maximum number of delays handed out before {@code MaxAttemptsExceededException} is thrown.
     */
    public BackOff(long scaleMs, int base, int maxAttempts) {
        if (scaleMs <= 0) {
            throw new IllegalArgumentException("scaleMs must be positive");
        }
        if (base <= 0) {
            throw new IllegalArgumentException("base must be positive");
        }
        if (maxAttempts <= 0) {
            throw new IllegalArgumentException("maxAttempts must be positive");
        }
        this.scaleMs = scaleMs;
        this.base = base;
        this.maxAttempts = maxAttempts;
    }

    /**
     * @return The maximum number of attempts.
     */
    public int maxAttempts() {
        return maxAttempts;
    }

    /**
     * @return The number of delays handed out so far.
     */
    public int attempts() {
        return attempt;
    }

    /**
     * Return the next delay to use, in milliseconds.
     *
     * @return Return the next delay to use, in milliseconds.
     *
     * @throws MaxAttemptsExceededException if the next attempt would exceed the configured number of attempts.
     */
    public long delayMs() {
        if (attempt == maxAttempts) {
            throw new MaxAttemptsExceededException();
        }
        return delay(attempt++);
    }

    /**
     * @return Whether the next call to {@link #delayMs()} will throw MaxAttemptsExceededException.
     */
    public boolean done() {
        return attempt >= maxAttempts;
    }

    private long delay(int n) {
        long delay = scaleMs;
        while (n-- > 0) {
            delay *= base;
        }
        return delay;
    }
}
