package fr.imt.jobdaemon.jobdaemon.business.service;

import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class RetryBackoffTest {

    @Test
    void growsExponentiallyUpToTheCeiling() {
        RetryBackoff backoff = new RetryBackoff(Duration.ofSeconds(1), 2.0, Duration.ofSeconds(10));

        assertEquals(Duration.ofSeconds(1), backoff.delayFor(0));
        assertEquals(Duration.ofSeconds(2), backoff.delayFor(1));
        assertEquals(Duration.ofSeconds(8), backoff.delayFor(3));
        assertEquals(Duration.ofSeconds(10), backoff.delayFor(4));
        assertEquals(Duration.ofSeconds(10), backoff.delayFor(5000));
    }

    @Test
    void rejectsShrinkingMultiplier() {
        assertThrows(IllegalArgumentException.class,
                () -> new RetryBackoff(Duration.ofSeconds(1), 0.5, Duration.ofSeconds(10)));
    }
}
