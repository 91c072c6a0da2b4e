package com.rostersync.broker;

import java.time.Duration;
import java.util.Random;

/**
 * Exponential backoff with a cap and additive jitter.
 *
 * delay(n) = min(base * multiplier^(n-1), max) + uniform(0, jitter * that)
 *
 * With base 1s, multiplier 2, max 8s and no jitter, attempts 1..5 wait
 * 1s, 2s, 4s, 8s, 8s.
 */
public class BackoffPolicy {

    private final long baseMillis;
    private final double multiplier;
    private final long maxMillis;
    private final double jitter;
    private final Random random;

    public BackoffPolicy(Duration base, double multiplier, Duration max, double jitter, Random random) {
        this.baseMillis = base.toMillis();
        this.multiplier = multiplier;
        this.maxMillis = max.toMillis();
        this.jitter = jitter;
        this.random = random;
    }

    public static BackoffPolicy from(BrokerConfig config) {
        return new BackoffPolicy(config.getBackoffBase(), config.getBackoffMultiplier(),
                config.getBackoffMax(), config.getBackoffJitter(), new Random());
    }

    /**
     * Delay before the given retry attempt (1-based).
     */
    public Duration delayFor(int attempt) {
        if (attempt < 1) {
            throw new IllegalArgumentException("attempt is 1-based: " + attempt);
        }
        double raw = baseMillis * Math.pow(multiplier, attempt - 1);
        long capped = (long) Math.min(raw, maxMillis);
        long extra = jitter > 0 ? (long) (random.nextDouble() * jitter * capped) : 0;
        return Duration.ofMillis(capped + extra);
    }
}
