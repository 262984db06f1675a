package io.resolvemesh.scheduler;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

final class RetryPolicyTest {

    @Test
    void backoffGrowsAndStaysBounded() {
        RetryPolicy policy = new RetryPolicy(5, 1_000L, 30_000L);
        for (int round = 0; round < 50; round++) {
            long previous = 0L;
            for (int failures = 1; failures <= 12; failures++) {
                long delay = policy.backoffMs(failures);
                Assertions.assertTrue(delay >= previous, "delay shrank at failure " + failures);
                Assertions.assertTrue(delay <= 30_000L, "delay above cap: " + delay);
                previous = delay;
            }
            Assertions.assertEquals(30_000L, policy.backoffMs(40));
        }
    }

    @Test
    void firstDelayIsBaseWithBoundedJitter() {
        RetryPolicy policy = new RetryPolicy(3, 1_000L, 60_000L);
        for (int i = 0; i < 100; i++) {
            long delay = policy.backoffMs(1);
            Assertions.assertTrue(delay >= 1_000L && delay <= 1_250L, "unexpected first delay " + delay);
            long second = policy.backoffMs(2);
            Assertions.assertTrue(second >= 2_000L && second <= 2_250L, "unexpected second delay " + second);
        }
    }

    @Test
    void clampsNonsenseInputsAndCountsAttempts() {
        RetryPolicy policy = new RetryPolicy(0, -5L, -10L);
        Assertions.assertEquals(1, policy.maxAttempts());
        Assertions.assertEquals(1L, policy.baseBackoffMs());
        Assertions.assertEquals(1L, policy.maxBackoffMs());
        Assertions.assertEquals(1L, policy.backoffMs(3));

        RetryPolicy three = new RetryPolicy(3, 100L, 1_000L);
        Assertions.assertFalse(three.exhausted(2));
        Assertions.assertTrue(three.exhausted(3));
        Assertions.assertTrue(three.exhausted(4));
    }
}
