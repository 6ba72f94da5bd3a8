package br.rio.confere.application.port;

import java.time.Duration;

/**
 * <strong>What:</strong> Time source and sleeper for waits, polling, and retry backoff.
 * <p><strong>Why:</strong> Render waits, CAPTCHA waits, and backoff all suspend the single pipeline worker;
 * routing them through a port lets tests advance time without sleeping.</p>
 * <p><strong>Thread-safety:</strong> Implementations must be thread-safe.</p>
 *
 * @see br.rio.confere.infrastructure.time.SystemClockAdapter
 */
public interface ClockPort {
  /**
   * Returns the current epoch time in milliseconds.
   *
   * @return milliseconds since 1970-01-01T00:00:00Z
   */
  long nowMillis();

  /**
   * Suspends the caller for {@code duration}.
   *
   * @param duration time to wait; zero or negative returns immediately
   * @throws InterruptedException when the worker is interrupted while waiting
   */
  void sleep(Duration duration) throws InterruptedException;
}
