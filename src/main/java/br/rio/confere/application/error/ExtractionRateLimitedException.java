package br.rio.confere.application.error;

import java.time.Duration;
import java.util.Optional;

/** The extraction service asked the caller to slow down. */
public class ExtractionRateLimitedException extends ConfereException {
  private final Duration retryAfter;

  public ExtractionRateLimitedException(String message) {
    this(message, null);
  }

  public ExtractionRateLimitedException(String message, Duration retryAfter) {
    super(message);
    this.retryAfter = retryAfter;
  }

  /** Server-suggested wait, when provided. */
  public Optional<Duration> retryAfter() {
    return Optional.ofNullable(retryAfter);
  }
}
