package br.rio.confere.infrastructure.web;

import br.rio.confere.application.error.NavigationTimeoutException;
import br.rio.confere.application.error.PageLoadException;
import br.rio.confere.application.error.PortalUnavailableException;
import java.time.Duration;
import java.util.List;
import java.util.Objects;
import org.openqa.selenium.By;
import org.openqa.selenium.JavascriptExecutor;
import org.openqa.selenium.WebDriver;
import org.openqa.selenium.WebDriverException;
import org.openqa.selenium.WebElement;
import org.openqa.selenium.chrome.ChromeDriver;
import org.openqa.selenium.chrome.ChromeOptions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> One Chrome browser session, started on first use.
 * <p><strong>Role:</strong> Shared plumbing for the portal and gazette adapters: driver lifecycle, script
 * execution, and page text.</p>
 * <p><strong>Thread-safety:</strong> Not thread-safe; a session belongs to the single pipeline worker.</p>
 */
public final class SeleniumSession implements AutoCloseable {
  private static final Logger log = LoggerFactory.getLogger(SeleniumSession.class);

  private final String name;
  private final boolean headless;
  private final Duration pageLoadTimeout;
  private WebDriver driver;

  public SeleniumSession(String name, boolean headless, Duration pageLoadTimeout) {
    this.name = Objects.requireNonNull(name, "name");
    this.headless = headless;
    this.pageLoadTimeout = Objects.requireNonNull(pageLoadTimeout, "pageLoadTimeout");
  }

  /**
   * Returns the live driver, starting the browser when needed.
   *
   * @return web driver
   * @throws PortalUnavailableException when the browser cannot be started
   */
  public WebDriver driver() {
    if (driver == null) {
      try {
        ChromeDriver started = new ChromeDriver(options());
        started.manage().timeouts().pageLoadTimeout(pageLoadTimeout.multipliedBy(3));
        driver = started;
        log.info("Started {} browser session (headless={})", name, headless);
      } catch (WebDriverException ex) {
        throw new PortalUnavailableException("unable to start " + name + " browser: " + ex.getMessage(), ex);
      }
    }
    return driver;
  }

  /**
   * Navigates to a URL.
   *
   * @param url target
   * @throws PageLoadException when the page cannot be loaded
   */
  public void open(String url) {
    WebDriver live = driver();
    try {
      live.get(url);
    } catch (WebDriverException ex) {
      throw new PageLoadException(url, ex);
    }
  }

  /**
   * Runs a script in the current page.
   *
   * @throws NavigationTimeoutException when the browser rejects the call, for example on a stale element
   */
  public Object script(String script, Object... args) {
    WebDriver live = driver();
    try {
      return ((JavascriptExecutor) live).executeScript(script, args);
    } catch (WebDriverException ex) {
      throw browserFailure("script", ex);
    }
  }

  public List<WebElement> findAll(By locator) {
    WebDriver live = driver();
    try {
      return live.findElements(locator);
    } catch (WebDriverException ex) {
      throw browserFailure("lookup of " + locator, ex);
    }
  }

  /** Visible text of the page body, empty while the body is missing. */
  public String bodyText() {
    List<WebElement> bodies = findAll(By.tagName("body"));
    try {
      return bodies.isEmpty() ? "" : bodies.get(0).getText();
    } catch (WebDriverException ex) {
      throw browserFailure("body text", ex);
    }
  }

  /** Clicks through JavaScript, which also reaches elements hidden under Vaadin overlays. */
  public void click(WebElement element) {
    script("arguments[0].scrollIntoView({block: 'center'}); arguments[0].click();", element);
  }

  /** Whether the document finished loading. */
  public boolean documentReady() {
    Object state = script("return document.readyState;");
    return "complete".equals(state);
  }

  @Override
  public void close() {
    if (driver == null) {
      return;
    }
    try {
      driver.quit();
      log.info("Closed {} browser session", name);
    } catch (WebDriverException ex) {
      log.warn("Failed to close {} browser session cleanly", name, ex);
    } finally {
      driver = null;
    }
  }

  private NavigationTimeoutException browserFailure(String action, WebDriverException ex) {
    // Selenium appends build and driver details on later lines
    String detail = ex.getMessage() == null
        ? ex.getClass().getSimpleName()
        : ex.getMessage().lines().findFirst().orElse(ex.getClass().getSimpleName());
    return new NavigationTimeoutException(null, name + " browser " + action + " failed: " + detail, ex);
  }

  private ChromeOptions options() {
    ChromeOptions options = new ChromeOptions();
    if (headless) {
      options.addArguments("--headless=new");
    }
    options.addArguments("--window-size=1366,900");
    options.addArguments("--disable-blink-features=AutomationControlled");
    options.addArguments("--disable-dev-shm-usage");
    options.addArguments("--no-sandbox");
    options.addArguments("--lang=pt-BR");
    return options;
  }
}
