package br.rio.confere.application.port;

import java.time.Duration;

/**
 * Suspension point that waits for a human to clear a CAPTCHA.
 */
public interface ManualCaptchaSignal {
  /**
   * Blocks until the challenge is resolved or {@code timeout} elapses.
   *
   * @param timeout upper bound on the wait
   * @return {@code true} when the challenge was resolved in time
   * @throws InterruptedException when the wait is cancelled
   */
  boolean awaitResolution(Duration timeout) throws InterruptedException;
}
