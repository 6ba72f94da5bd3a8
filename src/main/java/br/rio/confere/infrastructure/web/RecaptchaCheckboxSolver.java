package br.rio.confere.infrastructure.web;

import br.rio.confere.application.port.CaptchaSolver;
import br.rio.confere.application.port.ClockPort;
import java.time.Duration;
import java.util.List;
import java.util.Objects;
import org.openqa.selenium.By;
import org.openqa.selenium.WebDriver;
import org.openqa.selenium.WebDriverException;
import org.openqa.selenium.WebElement;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Clicks the reCAPTCHA "I'm not a robot" checkbox inside its anchor frame.
 *
 * <p>Only the checkbox is attempted; image challenges are left to the operator.</p>
 */
public final class RecaptchaCheckboxSolver implements CaptchaSolver {
  private static final Logger log = LoggerFactory.getLogger(RecaptchaCheckboxSolver.class);
  private static final By ANCHOR_FRAME = By.cssSelector("iframe[src*='recaptcha'][src*='anchor']");
  private static final By CHECKBOX = By.cssSelector("#recaptcha-anchor, .recaptcha-checkbox-border");
  private static final Duration REACTION = Duration.ofSeconds(3);

  private final SeleniumSession session;
  private final ClockPort clock;

  public RecaptchaCheckboxSolver(SeleniumSession session, ClockPort clock) {
    this.session = Objects.requireNonNull(session, "session");
    this.clock = Objects.requireNonNull(clock, "clock");
  }

  @Override
  public void attempt() throws InterruptedException {
    WebDriver driver = session.driver();
    List<WebElement> frames = session.findAll(ANCHOR_FRAME);
    if (frames.isEmpty()) {
      log.debug("No reCAPTCHA anchor frame present");
      return;
    }
    try {
      driver.switchTo().frame(frames.get(0));
      List<WebElement> boxes = driver.findElements(CHECKBOX);
      if (boxes.isEmpty()) {
        log.debug("reCAPTCHA frame has no checkbox");
        return;
      }
      boxes.get(0).click();
      log.info("Clicked reCAPTCHA checkbox");
    } catch (WebDriverException ex) {
      log.warn("reCAPTCHA checkbox click failed: {}", ex.getMessage());
    } finally {
      driver.switchTo().defaultContent();
    }
    clock.sleep(REACTION);
  }
}
