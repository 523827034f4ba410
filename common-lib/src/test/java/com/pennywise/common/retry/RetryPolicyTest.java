package com.pennywise.common.retry;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class RetryPolicyTest {

    @Test
    @DisplayName("default policy: 3 retries, 1 s base")
    void defaults() {
        assertEquals(3, RetryPolicy.DEFAULT.maxAttempts());
        assertEquals(Duration.ofSeconds(1), RetryPolicy.DEFAULT.baseDelay());
        assertEquals(4, RetryPolicy.DEFAULT.totalAttempts());
    }

    @Test
    @DisplayName("delayBefore doubles from the base")
    void doubling() {
        RetryPolicy policy = RetryPolicy.of(5, Duration.ofMillis(250));
        assertEquals(Duration.ZERO, policy.delayBefore(0));
        assertEquals(Duration.ofMillis(250), policy.delayBefore(1));
        assertEquals(Duration.ofMillis(500), policy.delayBefore(2));
        assertEquals(Duration.ofMillis(4000), policy.delayBefore(5));
    }

    @Test
    @DisplayName("negative values are rejected")
    void rejectsNegative() {
        assertThrows(IllegalArgumentException.class, () -> RetryPolicy.of(-1, Duration.ZERO));
        assertThrows(IllegalArgumentException.class, () -> RetryPolicy.of(1, Duration.ofMillis(-1)));
        assertThrows(IllegalArgumentException.class, () -> RetryPolicy.of(1, null));
    }
}
