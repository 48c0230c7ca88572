package com.ivamare.exchange.policy;

import java.util.Random;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Exponential backoff with optional jitter.
 *
 * @param baseDelaySeconds Delay for the first retry, also the floor when jitter is on
 * @param maxDelaySeconds Upper bound applied before jitter
 * @param multiplier Growth factor per attempt
 * @param jitter Whether to spread the delay by up to 25% either way
 */
public record BackoffPolicy(
    int baseDelaySeconds,
    int maxDelaySeconds,
    double multiplier,
    boolean jitter
) {
    private static final double JITTER_RATIO = 0.25;

    public BackoffPolicy {
        if (baseDelaySeconds < 0) {
            throw new IllegalArgumentException("baseDelaySeconds must be >= 0");
        }
        if (maxDelaySeconds < baseDelaySeconds) {
            throw new IllegalArgumentException("maxDelaySeconds must be >= baseDelaySeconds");
        }
        if (multiplier < 1.0) {
            throw new IllegalArgumentException("multiplier must be >= 1.0");
        }
    }

    /**
     * Default policy: 1s base, 300s cap, doubling, with jitter.
     *
     * @return Default backoff policy
     */
    public static BackoffPolicy defaultPolicy() {
        return new BackoffPolicy(1, 300, 2.0, true);
    }

    /**
     * Same policy with a different base delay.
     */
    public BackoffPolicy withBaseDelay(int baseDelaySeconds) {
        return new BackoffPolicy(baseDelaySeconds, Math.max(baseDelaySeconds, maxDelaySeconds), multiplier, jitter);
    }

    /**
     * Delay before the retry following the given attempt.
     *
     * @param attempt Zero-based retry attempt
     * @return Delay in whole seconds
     */
    public int computeBackoff(int attempt) {
        return computeBackoff(attempt, ThreadLocalRandom.current());
    }

    public int computeBackoff(int attempt, Random random) {
        return computeBackoff(attempt, baseDelaySeconds, maxDelaySeconds, multiplier, jitter, random);
    }

    /**
     * Stateless form of {@link #computeBackoff(int)}.
     *
     * <p>Negative attempts return the base delay. Without jitter the result is
     * {@code min(base * multiplier^attempt, max)}. With jitter, uniform noise in
     * [-25%, +25%] of that value is added and the result never drops below base.
     */
    public static int computeBackoff(int attempt, int baseDelaySeconds, int maxDelaySeconds,
                                     double multiplier, boolean jitter, Random random) {
        if (attempt < 0) {
            return baseDelaySeconds;
        }

        double delay = Math.min(baseDelaySeconds * Math.pow(multiplier, attempt), maxDelaySeconds);

        if (!jitter) {
            return (int) delay;
        }

        double range = delay * JITTER_RATIO;
        double noise = (random.nextDouble() * 2.0 - 1.0) * range;
        return Math.max((int) (delay + noise), baseDelaySeconds);
    }
}
