package com.syncrecovery.core.model;

import org.junit.jupiter.api.Test;
import java.time.Duration;
import static org.junit.jupiter.api.Assertions.*;

class BackoffPolicyTest {

    @Test
    void defaultPolicy_shouldHaveReasonableDefaults() {
        BackoffPolicy policy = BackoffPolicy.defaultPolicy();
        
        assertEquals(Duration.ofSeconds(1), policy.initialDelay());
        assertEquals(Duration.ofSeconds(30), policy.maxDelay());
        assertEquals(2.0, policy.multiplier());
    }

    @Test
    void computeDelay_shouldIncreaseExponentially() {
        BackoffPolicy policy = BackoffPolicy.builder()
            .initialDelay(Duration.ofSeconds(1))
            .maxDelay(Duration.ofMinutes(10))
            .multiplier(2.0)
            .build();
        
        // No attempts yet: base delay
        assertEquals(Duration.ofSeconds(1), policy.computeDelay(0));
        assertEquals(Duration.ofSeconds(2), policy.computeDelay(1));
        assertEquals(Duration.ofSeconds(4), policy.computeDelay(2));
    }

    @Test
    void computeDelay_shouldRespectCap() {
        BackoffPolicy policy = BackoffPolicy.defaultPolicy();
        
        // 2^5 = 32s, capped at 30s
        assertEquals(Duration.ofSeconds(30), policy.computeDelay(5));
        assertEquals(Duration.ofSeconds(30), policy.computeDelay(20));
    }

    @Test
    void computeDelay_shouldBeNonDecreasingUntilCap() {
        BackoffPolicy policy = BackoffPolicy.builder()
            .initialDelay(Duration.ofMillis(250))
            .maxDelay(Duration.ofSeconds(20))
            .multiplier(3.0)
            .build();

        Duration previous = Duration.ZERO;
        for (int attempt = 0; attempt < 15; attempt++) {
            Duration delay = policy.computeDelay(attempt);
            double expected = Math.min(250 * Math.pow(3.0, attempt), 20_000);
            
            assertEquals((long) expected, delay.toMillis());
            assertTrue(delay.compareTo(previous) >= 0);
            previous = delay;
        }
    }

    @Test
    void fixed_shouldNotGrow() {
        BackoffPolicy policy = BackoffPolicy.fixed(Duration.ofMillis(500));
        
        assertEquals(Duration.ofMillis(500), policy.computeDelay(0));
        assertEquals(Duration.ofMillis(500), policy.computeDelay(7));
    }

    @Test
    void computeDelay_withNegativeAttempt_shouldThrow() {
        BackoffPolicy policy = BackoffPolicy.defaultPolicy();
        
        assertThrows(IllegalArgumentException.class, () -> policy.computeDelay(-1));
    }

    @Test
    void constructor_shouldRejectInvalidValues() {
        assertThrows(IllegalArgumentException.class,
            () -> new BackoffPolicy(Duration.ofSeconds(5), Duration.ofSeconds(1), 2.0));
        assertThrows(IllegalArgumentException.class,
            () -> new BackoffPolicy(Duration.ofSeconds(1), Duration.ofSeconds(5), 0.5));
    }
}
