package br.rio.confere.infrastructure.web;

import br.rio.confere.application.port.ClockPort;
import br.rio.confere.application.port.ManualCaptchaSignal;
import java.time.Duration;
import java.util.Objects;
import java.util.function.BooleanSupplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Waits for an operator to solve the CAPTCHA in the visible browser window.
 *
 * <p>Polls the page instead of reading the console, so it works in unattended terminals too; in headless mode
 * nobody can answer and the wait simply times out.</p>
 */
public final class BrowserManualCaptchaSignal implements ManualCaptchaSignal {
  private static final Logger log = LoggerFactory.getLogger(BrowserManualCaptchaSignal.class);

  private final BooleanSupplier blocked;
  private final ClockPort clock;
  private final Duration poll;

  /**
   * @param blocked reports whether the challenge is still shown
   * @param clock time source
   * @param poll interval between checks
   */
  public BrowserManualCaptchaSignal(BooleanSupplier blocked, ClockPort clock, Duration poll) {
    this.blocked = Objects.requireNonNull(blocked, "blocked");
    this.clock = Objects.requireNonNull(clock, "clock");
    this.poll = Objects.requireNonNull(poll, "poll");
  }

  @Override
  public boolean awaitResolution(Duration timeout) throws InterruptedException {
    log.warn("MANUAL INTERVENTION REQUIRED: resolve the CAPTCHA in the browser window (waiting up to {} s)",
        timeout.toSeconds());
    long deadline = clock.nowMillis() + timeout.toMillis();
    while (clock.nowMillis() < deadline) {
      if (!blocked.getAsBoolean()) {
        return true;
      }
      clock.sleep(poll);
    }
    return !blocked.getAsBoolean();
  }
}
