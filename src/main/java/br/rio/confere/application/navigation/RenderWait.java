package br.rio.confere.application.navigation;

import br.rio.confere.application.error.NavigationTimeoutException;
import br.rio.confere.application.port.ClockPort;
import br.rio.confere.domain.navigation.NavigationState;
import java.time.Duration;
import java.util.Objects;
import java.util.function.BooleanSupplier;

/**
 * Waits for a dynamically rendered page to settle: a minimum settle time, then bounded polling of a
 * readiness check.
 */
public final class RenderWait {
  private final ClockPort clock;
  private final Duration settle;
  private final Duration poll;
  private final Duration timeout;

  /**
   * Creates a wait strategy.
   *
   * @param clock time source and sleeper
   * @param settle minimum wait after every interaction
   * @param poll interval between readiness checks
   * @param timeout upper bound on polling after the settle time
   */
  public RenderWait(ClockPort clock, Duration settle, Duration poll, Duration timeout) {
    this.clock = Objects.requireNonNull(clock, "clock");
    this.settle = Objects.requireNonNull(settle, "settle");
    this.poll = Objects.requireNonNull(poll, "poll");
    this.timeout = Objects.requireNonNull(timeout, "timeout");
    if (poll.isZero() || poll.isNegative()) {
      throw new IllegalArgumentException("poll must be positive");
    }
  }

  /**
   * Blocks until {@code settled} reports {@code true}.
   *
   * @param target state being entered, reported on timeout
   * @param settled readiness check
   * @throws NavigationTimeoutException when the check is still false after the timeout
   * @throws InterruptedException when the worker is interrupted
   */
  public void await(NavigationState target, BooleanSupplier settled) throws InterruptedException {
    clock.sleep(settle);
    long deadline = clock.nowMillis() + timeout.toMillis();
    while (!settled.getAsBoolean()) {
      if (clock.nowMillis() >= deadline) {
        throw new NavigationTimeoutException(
            target, "portal did not settle within " + timeout.toMillis() + " ms entering " + target);
      }
      clock.sleep(poll);
    }
  }
}
