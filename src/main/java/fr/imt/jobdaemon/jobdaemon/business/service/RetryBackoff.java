package fr.imt.jobdaemon.jobdaemon.business.service;

import java.time.Duration;

/**
 * Exponential delay between two attempts of a failing job, capped at {@code maxBackoff}.
 */
public class RetryBackoff {

    private final Duration initialBackoff;
    private final double multiplier;
    private final Duration maxBackoff;

    public RetryBackoff(Duration initialBackoff, double multiplier, Duration maxBackoff) {
        if (multiplier < 1.0) {
            throw new IllegalArgumentException("Backoff multiplier must be at least 1, got " + multiplier);
        }
        this.initialBackoff = initialBackoff;
        this.multiplier = multiplier;
        this.maxBackoff = maxBackoff;
    }

    /**
     * @param attempt number of failed attempts so far minus one, 0 for the first retry
     */
    public Duration delayFor(int attempt) {
        double millis = initialBackoff.toMillis() * Math.pow(multiplier, Math.max(0, attempt));
        if (Double.isInfinite(millis) || millis >= maxBackoff.toMillis()) {
            return maxBackoff;
        }
        return Duration.ofMillis((long) millis);
    }
}
