package br.rio.confere.application.publication;

import br.rio.confere.application.error.CaptchaUnresolvedException;
import br.rio.confere.application.port.CaptchaSolver;
import br.rio.confere.application.port.GazettePort;
import br.rio.confere.application.port.ManualCaptchaSignal;
import br.rio.confere.application.port.MetricsPort;
import java.time.Duration;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Semi-automated CAPTCHA gate in front of the gazette results.
 * <p><strong>Flow:</strong> when blocked, the automated solver gets a bounded number of attempts; if the challenge
 * persists the search suspends on the manual signal for a bounded time, then fails the unit.</p>
 * <p><strong>Observability:</strong> increments {@code search.captcha.blocked}, {@code search.captcha.auto} and
 * {@code search.captcha.manual}.</p>
 */
public final class CaptchaGate {
  private static final Logger log = LoggerFactory.getLogger(CaptchaGate.class);

  private final GazettePort gazette;
  private final CaptchaSolver solver;
  private final ManualCaptchaSignal manual;
  private final MetricsPort metrics;
  private final int autoAttempts;
  private final Duration manualTimeout;

  public CaptchaGate(
      GazettePort gazette,
      CaptchaSolver solver,
      ManualCaptchaSignal manual,
      MetricsPort metrics,
      int autoAttempts,
      Duration manualTimeout) {
    this.gazette = Objects.requireNonNull(gazette, "gazette");
    this.solver = Objects.requireNonNull(solver, "solver");
    this.manual = Objects.requireNonNull(manual, "manual");
    this.metrics = metrics == null ? MetricsPort.NO_OP : metrics;
    if (autoAttempts < 0) {
      throw new IllegalArgumentException("autoAttempts must be >= 0");
    }
    this.autoAttempts = autoAttempts;
    this.manualTimeout = Objects.requireNonNull(manualTimeout, "manualTimeout");
  }

  /**
   * Returns once the results are not blocked by a CAPTCHA.
   *
   * @param processo processo being searched, for diagnostics
   * @return {@code true} when a challenge had to be cleared
   * @throws CaptchaUnresolvedException when neither the solver nor an operator cleared it in time
   * @throws InterruptedException when the wait is cancelled
   */
  public boolean clear(String processo) throws InterruptedException {
    return clear(processo, () -> { });
  }

  /**
   * Same as {@link #clear(String)}, running {@code onBlocked} as soon as a challenge is detected.
   *
   * @param processo processo being searched, for diagnostics
   * @param onBlocked runs once, before any solving attempt, when the results are blocked
   * @return {@code true} when a challenge had to be cleared
   * @throws CaptchaUnresolvedException when neither the solver nor an operator cleared it in time
   * @throws InterruptedException when the wait is cancelled
   */
  public boolean clear(String processo, Runnable onBlocked) throws InterruptedException {
    Objects.requireNonNull(onBlocked, "onBlocked");
    if (!gazette.captchaPresent()) {
      return false;
    }
    onBlocked.run();
    metrics.increment("search.captcha.blocked");
    for (int attempt = 1; attempt <= autoAttempts; attempt++) {
      solver.attempt();
      if (!gazette.captchaPresent()) {
        metrics.increment("search.captcha.auto");
        log.info("CAPTCHA cleared automatically on attempt {}", attempt);
        return true;
      }
    }
    metrics.increment("search.captcha.manual");
    log.warn("CAPTCHA still blocking search for {}; waiting up to {} s for manual resolution",
        processo, manualTimeout.toSeconds());
    boolean resolved = manual.awaitResolution(manualTimeout);
    if (!resolved || gazette.captchaPresent()) {
      throw new CaptchaUnresolvedException(
          "CAPTCHA not resolved within " + manualTimeout.toSeconds() + " s for " + processo);
    }
    log.info("CAPTCHA resolved manually");
    return true;
  }
}
