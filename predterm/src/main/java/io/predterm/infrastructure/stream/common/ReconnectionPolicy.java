package io.predterm.infrastructure.stream.common;

import java.time.Duration;

/**
 * Exponential backoff for stream reconnects.
 *
 * The delay before reconnect attempt {@code n} (0-based) is
 * {@code baseDelay * multiplier^n} with no upper bound; the attempt limit
 * is what ends the backoff. Once {@code maxAttempts} attempts have been made
 * without an intervening success the policy is exhausted until
 * {@link #reset()} or {@link #recordSuccess()}.
 *
 * Usage:
 * <pre>
 * if (!policy.isExhausted()) {
 *     loop.schedule(() -> {
 *         policy.recordAttempt();
 *         connect();
 *     }, policy.nextDelay());
 * }
 * </pre>
 */
public class ReconnectionPolicy {

    private final Duration baseDelay;
    private final double multiplier;
    private final int maxAttempts;

    private int attemptCount = 0;

    private ReconnectionPolicy(Duration baseDelay, double multiplier, int maxAttempts) {
        this.baseDelay = baseDelay;
        this.multiplier = multiplier;
        this.maxAttempts = maxAttempts;
    }

    /**
     * @return true once maxAttempts attempts were made since the last success
     */
    public synchronized boolean isExhausted() {
        return attemptCount >= maxAttempts;
    }

    /**
     * Delay to wait before the next attempt.
     */
    public synchronized Duration nextDelay() {
        return delayFor(attemptCount);
    }

    /**
     * Delay before the attempt with the given 0-based index.
     */
    public Duration delayFor(int attempt) {
        // the cast saturates at Long.MAX_VALUE
        return Duration.ofMillis((long) (baseDelay.toMillis() * Math.pow(multiplier, attempt)));
    }

    /**
     * Count a reconnect attempt. Called when the backoff timer fires.
     */
    public synchronized void recordAttempt() {
        attemptCount++;
    }

    /**
     * Connection established: start counting from zero again.
     */
    public synchronized void recordSuccess() {
        attemptCount = 0;
    }

    /**
     * Manual reset after exhaustion.
     */
    public synchronized void reset() {
        recordSuccess();
    }

    public synchronized int getAttemptCount() {
        return attemptCount;
    }

    public int getMaxAttempts() {
        return maxAttempts;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private Duration baseDelay = Duration.ofSeconds(1);
        private double multiplier = 2.0;
        private int maxAttempts = 5;

        public Builder baseDelay(Duration baseDelay) {
            if (baseDelay.isNegative() || baseDelay.isZero()) {
                throw new IllegalArgumentException("Base delay must be positive");
            }
            this.baseDelay = baseDelay;
            return this;
        }

        public Builder multiplier(double multiplier) {
            if (multiplier < 1.0) {
                throw new IllegalArgumentException("Multiplier must be at least 1.0");
            }
            this.multiplier = multiplier;
            return this;
        }

        public Builder maxAttempts(int maxAttempts) {
            if (maxAttempts <= 0) {
                throw new IllegalArgumentException("Max attempts must be positive");
            }
            this.maxAttempts = maxAttempts;
            return this;
        }

        public ReconnectionPolicy build() {
            return new ReconnectionPolicy(baseDelay, multiplier, maxAttempts);
        }
    }
}
