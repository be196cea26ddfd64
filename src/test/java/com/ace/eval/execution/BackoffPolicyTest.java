package com.ace.eval.execution;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

class BackoffPolicyTest {
    private final BackoffPolicy policy = new BackoffPolicy(Duration.ofMillis(500), Duration.ofSeconds(30), new Random(42));

    @Test
    @DisplayName("ceiling doubles per attempt until the cap")
    void ceilingDoublesUntilCap() {
        assertEquals(Duration.ofMillis(500), policy.ceiling(1));
        assertEquals(Duration.ofMillis(1000), policy.ceiling(2));
        assertEquals(Duration.ofMillis(4000), policy.ceiling(4));
        assertEquals(Duration.ofSeconds(30), policy.ceiling(7));
        assertEquals(Duration.ofSeconds(30), policy.ceiling(100));
    }

    @Test
    @DisplayName("jittered delay stays within half the ceiling and the ceiling")
    void delayWithinBounds() {
        for (int attempt = 1; attempt <= 12; attempt++) {
            long ceiling = policy.ceiling(attempt).toMillis();
            for (int i = 0; i < 200; i++) {
                long delay = policy.delayFor(attempt).toMillis();
                assertTrue(delay >= ceiling / 2 && delay <= ceiling, "attempt " + attempt + " gave " + delay);
            }
        }
    }

    @Test
    @DisplayName("same seed gives the same delays")
    void seededIsReproducible() {
        BackoffPolicy a = new BackoffPolicy(Duration.ofMillis(100), Duration.ofSeconds(5), new Random(7));
        BackoffPolicy b = new BackoffPolicy(Duration.ofMillis(100), Duration.ofSeconds(5), new Random(7));
        for (int attempt = 1; attempt <= 8; attempt++) {
            assertEquals(a.delayFor(attempt), b.delayFor(attempt));
        }
    }

    @Test
    void rejectsBadInput() {
        assertThrows(IllegalArgumentException.class, () -> policy.ceiling(0));
        assertThrows(IllegalArgumentException.class,
                () -> new BackoffPolicy(Duration.ZERO, Duration.ofSeconds(1), new Random()));
        assertThrows(IllegalArgumentException.class,
                () -> new BackoffPolicy(Duration.ofSeconds(2), Duration.ofSeconds(1), new Random()));
    }
}
