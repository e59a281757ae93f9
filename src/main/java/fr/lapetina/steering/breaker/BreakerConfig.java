package fr.lapetina.steering.breaker;

import java.time.Duration;
import java.util.Objects;

/**
 * Immutable settings of one circuit breaker.
 *
 * <ul>
 *   <li>{@code failureThreshold} - consecutive failures that trip a closed breaker</li>
 *   <li>{@code successThreshold} - consecutive half-open successes that close it again</li>
 *   <li>{@code timeout} - how long the breaker stays open before probing</li>
 *   <li>{@code maxRequests} - probes allowed outstanding at once while half-open</li>
 *   <li>{@code interval} - closed-state window after which counts reset, zero disables</li>
 *   <li>{@code minRequests} - sample size required before the failure ratio is considered</li>
 *   <li>{@code failureRatio} - failures/requests ratio that trips a closed breaker</li>
 * </ul>
 */
public final class BreakerConfig {

    private static final BreakerConfig DEFAULTS = builder().build();

    private final int failureThreshold;
    private final int successThreshold;
    private final Duration timeout;
    private final int maxRequests;
    private final Duration interval;
    private final int minRequests;
    private final double failureRatio;

    private BreakerConfig(Builder builder) {
        this.failureThreshold = atLeastOne(builder.failureThreshold, "failureThreshold");
        this.successThreshold = atLeastOne(builder.successThreshold, "successThreshold");
        this.maxRequests = atLeastOne(builder.maxRequests, "maxRequests");
        this.timeout = nonNegative(builder.timeout, "timeout");
        this.interval = nonNegative(builder.interval, "interval");
        if (builder.minRequests < 0) {
            throw new IllegalArgumentException("minRequests must be >= 0: " + builder.minRequests);
        }
        this.minRequests = builder.minRequests;
        if (!(builder.failureRatio > 0.0 && builder.failureRatio <= 1.0)) {
            throw new IllegalArgumentException("failureRatio must be in (0, 1]: " + builder.failureRatio);
        }
        this.failureRatio = builder.failureRatio;
    }

    private static int atLeastOne(int value, String field) {
        if (value < 1) {
            throw new IllegalArgumentException(field + " must be >= 1: " + value);
        }
        return value;
    }

    private static Duration nonNegative(Duration value, String field) {
        Objects.requireNonNull(value, field);
        if (value.isNegative()) {
            throw new IllegalArgumentException(field + " must not be negative: " + value);
        }
        return value;
    }

    /**
     * 5 failures, 3 successes, 60s timeout, 1 probe, 60s window, 3 min requests, 0.6 ratio.
     */
    public static BreakerConfig defaults() {
        return DEFAULTS;
    }

    public int getFailureThreshold() {
        return failureThreshold;
    }

    public int getSuccessThreshold() {
        return successThreshold;
    }

    public Duration getTimeout() {
        return timeout;
    }

    public int getMaxRequests() {
        return maxRequests;
    }

    public Duration getInterval() {
        return interval;
    }

    public int getMinRequests() {
        return minRequests;
    }

    public double getFailureRatio() {
        return failureRatio;
    }

    /**
     * Trip rule of a closed breaker. The ratio branch is gated on {@code minRequests}.
     */
    boolean readyToTrip(Counts counts) {
        if (counts.consecutiveFailures() >= failureThreshold) {
            return true;
        }
        return counts.requests() >= minRequests
                && counts.requests() > 0
                && counts.failureRatio() >= failureRatio;
    }

    public Builder toBuilder() {
        return new Builder()
                .failureThreshold(failureThreshold)
                .successThreshold(successThreshold)
                .timeout(timeout)
                .maxRequests(maxRequests)
                .interval(interval)
                .minRequests(minRequests)
                .failureRatio(failureRatio);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        BreakerConfig that = (BreakerConfig) o;
        return failureThreshold == that.failureThreshold
                && successThreshold == that.successThreshold
                && maxRequests == that.maxRequests
                && minRequests == that.minRequests
                && Double.compare(that.failureRatio, failureRatio) == 0
                && timeout.equals(that.timeout)
                && interval.equals(that.interval);
    }

    @Override
    public int hashCode() {
        return Objects.hash(failureThreshold, successThreshold, timeout, maxRequests, interval, minRequests, failureRatio);
    }

    @Override
    public String toString() {
        return "BreakerConfig{" +
                "failureThreshold=" + failureThreshold +
                ", successThreshold=" + successThreshold +
                ", timeout=" + timeout +
                ", maxRequests=" + maxRequests +
                ", interval=" + interval +
                ", minRequests=" + minRequests +
                ", failureRatio=" + failureRatio +
                '}';
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private int failureThreshold = 5;
        private int successThreshold = 3;
        private Duration timeout = Duration.ofSeconds(60);
        private int maxRequests = 1;
        private Duration interval = Duration.ofSeconds(60);
        private int minRequests = 3;
        private double failureRatio = 0.6;

        public Builder failureThreshold(int failureThreshold) {
            this.failureThreshold = failureThreshold;
            return this;
        }

        public Builder successThreshold(int successThreshold) {
            this.successThreshold = successThreshold;
            return this;
        }

        public Builder timeout(Duration timeout) {
            this.timeout = timeout;
            return this;
        }

        public Builder maxRequests(int maxRequests) {
            this.maxRequests = maxRequests;
            return this;
        }

        public Builder interval(Duration interval) {
            this.interval = interval;
            return this;
        }

        public Builder minRequests(int minRequests) {
            this.minRequests = minRequests;
            return this;
        }

        public Builder failureRatio(double failureRatio) {
            this.failureRatio = failureRatio;
            return this;
        }

        public BreakerConfig build() {
            return new BreakerConfig(this);
        }
    }
}
