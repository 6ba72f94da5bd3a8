package br.rio.confere.infrastructure.web;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import br.rio.confere.testing.ManualClock;
import java.time.Duration;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.Test;

class BrowserManualCaptchaSignalTest {

  @Test
  void resolvesOnceThePageNoLongerShowsTheChallenge() throws InterruptedException {
    ManualClock clock = new ManualClock();
    AtomicInteger checks = new AtomicInteger();
    BrowserManualCaptchaSignal signal =
        new BrowserManualCaptchaSignal(() -> checks.incrementAndGet() < 3, clock, Duration.ofSeconds(1));

    assertTrue(signal.awaitResolution(Duration.ofSeconds(30)));
    assertEquals(2, clock.sleeps().size());
  }

  @Test
  void timesOutWhileChallengeStaysVisible() throws InterruptedException {
    ManualClock clock = new ManualClock();
    BrowserManualCaptchaSignal signal = new BrowserManualCaptchaSignal(() -> true, clock, Duration.ofSeconds(1));

    assertFalse(signal.awaitResolution(Duration.ofSeconds(5)));
    assertEquals(5, clock.sleeps().size());
  }
}
