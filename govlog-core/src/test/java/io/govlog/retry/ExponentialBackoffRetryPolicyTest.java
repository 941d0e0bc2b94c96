package io.govlog.retry;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ExponentialBackoffRetryPolicyTest {

  @Test
  void defaultsMatchDocumentedValues() {
    ExponentialBackoffRetryPolicy policy = ExponentialBackoffRetryPolicy.defaults();

    assertEquals(3, policy.maxAttempts());
    assertEquals(100L, policy.baseDelayMs());
    assertEquals(2.0, policy.multiplier());
    assertEquals(1000L, policy.maxDelayMs());
    assertEquals(5000L, policy.maxTotalDelayMs());
    assertFalse(policy.jitter());
  }

  @Test
  void delayIncreasesExponentiallyWithoutJitter() {
    ExponentialBackoffRetryPolicy policy = ExponentialBackoffRetryPolicy.builder()
        .baseDelayMs(100)
        .maxDelayMs(100_000)
        .build();

    assertEquals(100L, policy.computeDelayMs(1));
    assertEquals(200L, policy.computeDelayMs(2));
    assertEquals(400L, policy.computeDelayMs(3));
  }

  @Test
  void customMultiplier() {
    ExponentialBackoffRetryPolicy policy = ExponentialBackoffRetryPolicy.builder()
        .baseDelayMs(10)
        .multiplier(3.0)
        .maxDelayMs(10_000)
        .build();

    assertEquals(10L, policy.computeDelayMs(1));
    assertEquals(30L, policy.computeDelayMs(2));
    assertEquals(90L, policy.computeDelayMs(3));
  }

  @Test
  void delayIsCappedAtMaxDelay() {
    ExponentialBackoffRetryPolicy policy = ExponentialBackoffRetryPolicy.defaults();

    assertEquals(1000L, policy.computeDelayMs(5));
    assertEquals(1000L, policy.computeDelayMs(10));
  }

  @Test
  void jitterStaysWithinRange() {
    ExponentialBackoffRetryPolicy policy = ExponentialBackoffRetryPolicy.builder()
        .baseDelayMs(1000)
        .maxDelayMs(100_000)
        .jitter(true)
        .build();

    for (int i = 0; i < 50; i++) {
      long delay = policy.computeDelayMs(1);
      assertTrue(delay >= 500 && delay < 1500, "Expected delay between 500-1500, got: " + delay);
    }
  }

  @Test
  void jitterNeverExceedsMaxDelay() {
    ExponentialBackoffRetryPolicy policy = ExponentialBackoffRetryPolicy.builder()
        .baseDelayMs(100)
        .maxDelayMs(500)
        .jitter(true)
        .build();

    for (int i = 0; i < 50; i++) {
      assertTrue(policy.computeDelayMs(10) <= 500);
    }
  }

  @Test
  void handlesAttemptCountAtOverflowBoundary() {
    ExponentialBackoffRetryPolicy policy = ExponentialBackoffRetryPolicy.builder()
        .baseDelayMs(100)
        .maxDelayMs(60_000)
        .build();

    assertEquals(60_000L, policy.computeDelayMs(31));
    assertEquals(60_000L, policy.computeDelayMs(64));
    assertEquals(60_000L, policy.computeDelayMs(Integer.MAX_VALUE));
  }

  @Test
  void zeroAndNegativeAttemptsReturnZero() {
    ExponentialBackoffRetryPolicy policy = ExponentialBackoffRetryPolicy.defaults();

    assertEquals(0L, policy.computeDelayMs(0));
    assertEquals(0L, policy.computeDelayMs(-1));
  }

  // ── Builder validation ──────────────────────────────────────────

  @Test
  void rejectsZeroMaxAttempts() {
    IllegalArgumentException ex = assertThrows(IllegalArgumentException.class,
        () -> ExponentialBackoffRetryPolicy.builder().maxAttempts(0).build());
    assertTrue(ex.getMessage().contains("maxAttempts"));
  }

  @Test
  void rejectsNonPositiveBaseDelay() {
    assertThrows(IllegalArgumentException.class,
        () -> ExponentialBackoffRetryPolicy.builder().baseDelayMs(0).build());
  }

  @Test
  void rejectsMultiplierBelowOne() {
    assertThrows(IllegalArgumentException.class,
        () -> ExponentialBackoffRetryPolicy.builder().multiplier(0.5).build());
    assertThrows(IllegalArgumentException.class,
        () -> ExponentialBackoffRetryPolicy.builder().multiplier(Double.NaN).build());
  }

  @Test
  void rejectsMaxDelayBelowBase() {
    assertThrows(IllegalArgumentException.class,
        () -> ExponentialBackoffRetryPolicy.builder().baseDelayMs(200).maxDelayMs(100).build());
  }

  @Test
  void rejectsNegativeBudget() {
    assertThrows(IllegalArgumentException.class,
        () -> ExponentialBackoffRetryPolicy.builder().maxTotalDelayMs(-1).build());
  }
}
