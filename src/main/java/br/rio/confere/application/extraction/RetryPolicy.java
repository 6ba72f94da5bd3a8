package br.rio.confere.application.extraction;

import br.rio.confere.application.error.ExtractionRateLimitedException;
import java.time.Duration;
import java.util.Objects;
import java.util.Optional;
import java.util.function.DoubleSupplier;
import java.util.function.Predicate;

/**
 * <strong>What:</strong> Retry budget and exponential backoff schedule for extraction calls.
 * <p><strong>Role:</strong> Explicit policy handed to {@link ExtractionService}; adapters never retry on their own.</p>
 * <p><strong>Thread-safety:</strong> Immutable.</p>
 *
 * <p>The wait before attempt {@code n + 1} is {@code baseDelay · multiplier^(n-1)}, scaled by a random factor in
 * {@code [1 - jitter, 1 + jitter]}. A server-requested wait overrides a shorter backoff; either is capped at
 * {@code maxDelay}.</p>
 *
 * @param maxAttempts total attempts including the first, at least 1
 * @param baseDelay wait before the second attempt
 * @param multiplier growth factor per attempt, at least 1
 * @param jitter relative jitter in {@code [0, 1)}
 * @param retryable failures that may be retried
 * @param maxDelay longest single wait, whatever the server asks for
 */
public record RetryPolicy(
    int maxAttempts,
    Duration baseDelay,
    double multiplier,
    double jitter,
    Predicate<RuntimeException> retryable,
    Duration maxDelay) {

  /** Default number of attempts for rate-limited calls. */
  public static final int DEFAULT_MAX_ATTEMPTS = 5;
  /** Default cap on a single wait. */
  public static final Duration DEFAULT_MAX_DELAY = Duration.ofSeconds(60);

  public RetryPolicy {
    if (maxAttempts < 1) {
      throw new IllegalArgumentException("maxAttempts must be >= 1");
    }
    Objects.requireNonNull(baseDelay, "baseDelay");
    if (baseDelay.isNegative()) {
      throw new IllegalArgumentException("baseDelay must not be negative");
    }
    if (multiplier < 1.0) {
      throw new IllegalArgumentException("multiplier must be >= 1");
    }
    if (jitter < 0.0 || jitter >= 1.0) {
      throw new IllegalArgumentException("jitter must be within [0, 1)");
    }
    Objects.requireNonNull(retryable, "retryable");
    Objects.requireNonNull(maxDelay, "maxDelay");
    if (maxDelay.isZero() || maxDelay.isNegative()) {
      throw new IllegalArgumentException("maxDelay must be positive");
    }
  }

  /**
   * Policy that retries only rate-limited failures.
   *
   * @param maxAttempts total attempts
   * @param baseDelay first backoff
   * @param multiplier growth factor
   * @param jitter relative jitter
   * @return rate-limit policy
   */
  public static RetryPolicy rateLimited(int maxAttempts, Duration baseDelay, double multiplier, double jitter) {
    return rateLimited(maxAttempts, baseDelay, multiplier, jitter, DEFAULT_MAX_DELAY);
  }

  /**
   * Policy that retries only rate-limited failures and never waits longer than {@code maxDelay}.
   *
   * @param maxAttempts total attempts
   * @param baseDelay first backoff
   * @param multiplier growth factor
   * @param jitter relative jitter
   * @param maxDelay cap on a single wait
   * @return rate-limit policy
   */
  public static RetryPolicy rateLimited(
      int maxAttempts, Duration baseDelay, double multiplier, double jitter, Duration maxDelay) {
    return new RetryPolicy(
        maxAttempts, baseDelay, multiplier, jitter, ex -> ex instanceof ExtractionRateLimitedException, maxDelay);
  }

  /**
   * Computes the wait after a failed attempt.
   *
   * @param failedAttempt 1-based number of the attempt that just failed
   * @param random uniform source in {@code [0, 1)}
   * @return wait before the next attempt
   */
  public Duration backoff(int failedAttempt, DoubleSupplier random) {
    if (failedAttempt < 1) {
      throw new IllegalArgumentException("failedAttempt must be >= 1");
    }
    double exponential = baseDelay.toMillis() * Math.pow(multiplier, failedAttempt - 1);
    double factor = 1.0 + jitter * (2.0 * random.getAsDouble() - 1.0);
    long millis = Math.max(0L, Math.round(exponential * factor));
    return cap(Duration.ofMillis(millis));
  }

  /**
   * Computes the wait after a failed attempt, honouring a server-requested delay up to {@code maxDelay}.
   *
   * @param failedAttempt 1-based number of the attempt that just failed
   * @param retryAfter delay requested by the server, if any
   * @param random uniform source in {@code [0, 1)}
   * @return wait before the next attempt, never above {@code maxDelay}
   */
  public Duration delayAfter(int failedAttempt, Optional<Duration> retryAfter, DoubleSupplier random) {
    Duration wait = backoff(failedAttempt, random);
    if (retryAfter.isPresent() && retryAfter.get().compareTo(wait) > 0) {
      wait = cap(retryAfter.get());
    }
    return wait;
  }

  private Duration cap(Duration wait) {
    return wait.compareTo(maxDelay) > 0 ? maxDelay : wait;
  }

  /** Returns {@code true} when another attempt is allowed after {@code failedAttempt} failures. */
  public boolean allowsRetryAfter(int failedAttempt) {
    return failedAttempt < maxAttempts;
  }
}
