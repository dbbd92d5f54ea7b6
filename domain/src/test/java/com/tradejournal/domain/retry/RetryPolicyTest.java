package com.tradejournal.domain.retry;

import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class RetryPolicyTest {

    @Test
    void testDelayAfterAttempt_GrowsGeometrically() {
        RetryPolicy connect = RetryPolicy.of(6, Duration.ofSeconds(1), 2.0);

        assertEquals(Duration.ofSeconds(1), connect.delayAfterAttempt(1));
        assertEquals(Duration.ofSeconds(2), connect.delayAfterAttempt(2));
        assertEquals(Duration.ofSeconds(16), connect.delayAfterAttempt(5));
        assertEquals(Duration.ofSeconds(31), connect.totalBackoff());
    }

    @Test
    void testTotalBackoff_ThreeAttemptPolicy() {
        RetryPolicy publish = RetryPolicy.of(3, Duration.ofMillis(500), 2.0);

        assertEquals(Duration.ofMillis(1500), publish.totalBackoff());
    }

    @Test
    void testOf_RejectsInvalidValues() {
        assertThrows(IllegalArgumentException.class, () -> RetryPolicy.of(0, Duration.ofMillis(1), 2.0));
        assertThrows(IllegalArgumentException.class, () -> RetryPolicy.of(3, Duration.ofMillis(-1), 2.0));
        assertThrows(IllegalArgumentException.class, () -> RetryPolicy.of(3, Duration.ZERO, 2.0));
        assertThrows(IllegalArgumentException.class, () -> RetryPolicy.of(3, Duration.ofMillis(1), 0.5));
    }
}
