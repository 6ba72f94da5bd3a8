package br.rio.confere.application.extraction;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import br.rio.confere.application.error.ExtractionRateLimitedException;
import br.rio.confere.application.error.ExtractionUnavailableException;
import java.time.Duration;
import java.util.Optional;
import org.junit.jupiter.api.Test;

class RetryPolicyTest {
  private final RetryPolicy policy = RetryPolicy.rateLimited(4, Duration.ofSeconds(1), 2.0, 0.25);

  @Test
  void backoffGrowsExponentially() {
    assertEquals(Duration.ofMillis(1000), policy.backoff(1, () -> 0.5));
    assertEquals(Duration.ofMillis(2000), policy.backoff(2, () -> 0.5));
    assertEquals(Duration.ofMillis(4000), policy.backoff(3, () -> 0.5));
  }

  @Test
  void jitterStaysWithinItsBand() {
    assertEquals(Duration.ofMillis(750), policy.backoff(1, () -> 0.0));
    assertEquals(Duration.ofMillis(1250), policy.backoff(1, () -> 1.0));
  }

  @Test
  void backoffNeverExceedsTheMaximumDelay() {
    RetryPolicy capped = RetryPolicy.rateLimited(10, Duration.ofSeconds(1), 2.0, 0.0, Duration.ofSeconds(5));

    assertEquals(Duration.ofSeconds(4), capped.backoff(3, () -> 0.5));
    assertEquals(Duration.ofSeconds(5), capped.backoff(4, () -> 0.5));
    assertEquals(Duration.ofSeconds(5), capped.backoff(9, () -> 0.5));
  }

  @Test
  void serverRequestedDelayIsHonouredUpToTheCap() {
    RetryPolicy capped = RetryPolicy.rateLimited(4, Duration.ofSeconds(1), 2.0, 0.0, Duration.ofSeconds(20));

    assertEquals(Duration.ofSeconds(7), capped.delayAfter(1, Optional.of(Duration.ofSeconds(7)), () -> 0.5));
    assertEquals(Duration.ofSeconds(20), capped.delayAfter(1, Optional.of(Duration.ofDays(2)), () -> 0.5));
    assertEquals(Duration.ofSeconds(2), capped.delayAfter(2, Optional.of(Duration.ofMillis(10)), () -> 0.5));
    assertEquals(Duration.ofSeconds(1), capped.delayAfter(1, Optional.empty(), () -> 0.5));
  }

  @Test
  void attemptBudgetCountsTheFirstCall() {
    assertTrue(policy.allowsRetryAfter(3));
    assertFalse(policy.allowsRetryAfter(4));
  }

  @Test
  void onlyRateLimitedFailuresAreRetryable() {
    assertTrue(policy.retryable().test(new ExtractionRateLimitedException("429")));
    assertFalse(policy.retryable().test(new ExtractionUnavailableException("503")));
  }

  @Test
  void invalidSettingsAreRejected() {
    assertThrows(IllegalArgumentException.class, () -> RetryPolicy.rateLimited(0, Duration.ZERO, 2.0, 0.0));
    assertThrows(IllegalArgumentException.class, () -> RetryPolicy.rateLimited(3, Duration.ZERO, 0.5, 0.0));
    assertThrows(IllegalArgumentException.class, () -> RetryPolicy.rateLimited(3, Duration.ZERO, 2.0, 1.0));
    assertThrows(IllegalArgumentException.class,
        () -> RetryPolicy.rateLimited(3, Duration.ZERO, 2.0, 0.0, Duration.ZERO));
  }
}
