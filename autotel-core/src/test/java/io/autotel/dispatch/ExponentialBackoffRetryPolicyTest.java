package io.autotel.dispatch;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ExponentialBackoffRetryPolicyTest {

  @Test
  void withoutJitterDelayDoublesPerRound() {
    ExponentialBackoffRetryPolicy policy = new ExponentialBackoffRetryPolicy(1000, 4000, false);

    assertEquals(1000, policy.computeDelayMs(1));
    assertEquals(2000, policy.computeDelayMs(2));
    assertEquals(4000, policy.computeDelayMs(3));
    assertEquals(4000, policy.computeDelayMs(4));
  }

  @Test
  void jitterStaysWithinBounds() {
    ExponentialBackoffRetryPolicy policy = new ExponentialBackoffRetryPolicy(100, 100000);

    for (int i = 0; i < 50; i++) {
      long delay = policy.computeDelayMs(2);
      // 200 * [0.5, 1.5)
      assertTrue(delay >= 100 && delay < 300, "delay out of range: " + delay);
    }
  }

  @Test
  void jitteredDelayNeverExceedsMax() {
    ExponentialBackoffRetryPolicy policy = new ExponentialBackoffRetryPolicy(100, 500);

    for (int i = 0; i < 50; i++) {
      assertTrue(policy.computeDelayMs(10) <= 500);
    }
  }

  @Test
  void handlesRoundsAtOverflowBoundary() {
    ExponentialBackoffRetryPolicy policy = new ExponentialBackoffRetryPolicy(100, 60000, false);

    assertEquals(60000, policy.computeDelayMs(31));
    assertEquals(60000, policy.computeDelayMs(63));
    assertEquals(60000, policy.computeDelayMs(1000));
  }

  @Test
  void zeroBaseDelayOrRoundReturnsZero() {
    assertEquals(0L, new ExponentialBackoffRetryPolicy(0, 1000).computeDelayMs(3));
    assertEquals(0L, new ExponentialBackoffRetryPolicy(100, 1000).computeDelayMs(0));
    assertEquals(0L, new ExponentialBackoffRetryPolicy(100, 1000).computeDelayMs(-1));
  }

  @Test
  void immediatePolicyNeverWaits() {
    assertEquals(0L, RetryPolicy.IMMEDIATE.computeDelayMs(5));
  }

  @Test
  void negativeDelaysRejected() {
    assertThrows(IllegalArgumentException.class, () -> new ExponentialBackoffRetryPolicy(-1, 100));
    assertThrows(IllegalArgumentException.class, () -> new ExponentialBackoffRetryPolicy(100, -1));
  }
}
