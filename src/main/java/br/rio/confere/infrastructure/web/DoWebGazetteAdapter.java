package br.rio.confere.infrastructure.web;

import br.rio.confere.application.error.NavigationTimeoutException;
import br.rio.confere.application.port.GazettePort;
import br.rio.confere.domain.publication.SearchResultItem;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import org.openqa.selenium.By;
import org.openqa.selenium.StaleElementReferenceException;
import org.openqa.selenium.TimeoutException;
import org.openqa.selenium.WebDriverException;
import org.openqa.selenium.WebElement;
import org.openqa.selenium.support.ui.WebDriverWait;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> {@link GazettePort} for the Rio official gazette search (DoWeb).
 * <p><strong>Why:</strong> The search page is an Angular application whose result cards only exist after
 * scripts run, and a reCAPTCHA may be interposed at any time.</p>
 * <p><strong>Rendering:</strong> {@link #submitSearch(String)} returns once the page shows a result count,
 * "nenhum resultado", a result card, or a CAPTCHA.</p>
 * <p><strong>Thread-safety:</strong> Not thread-safe; owns one browser session.</p>
 */
public final class DoWebGazetteAdapter implements GazettePort {
  private static final Logger log = LoggerFactory.getLogger(DoWebGazetteAdapter.class);
  public static final String DEFAULT_DOWNLOAD_TEMPLATE =
      "https://doweb.rio.rj.gov.br/portal/edicoes/download/{edition}/{page}";
  private static final By RECAPTCHA = By.cssSelector("iframe[src*='recaptcha'], div.g-recaptcha");

  private final SeleniumSession session;
  private final String searchTemplate;
  private final DoWebResultParser parser;
  private final HttpDocumentDownloader downloader;
  private final Duration timeout;

  public DoWebGazetteAdapter(
      SeleniumSession session,
      String searchTemplate,
      String downloadTemplate,
      HttpDocumentDownloader downloader,
      Duration timeout) {
    this.session = Objects.requireNonNull(session, "session");
    this.searchTemplate = Objects.requireNonNull(searchTemplate, "searchTemplate");
    this.parser = new DoWebResultParser(Objects.requireNonNull(downloadTemplate, "downloadTemplate"));
    this.downloader = Objects.requireNonNull(downloader, "downloader");
    this.timeout = Objects.requireNonNull(timeout, "timeout");
  }

  @Override
  public void submitSearch(String processo) {
    String url = searchTemplate.replace("{processo}", URLEncoder.encode(processo, StandardCharsets.UTF_8));
    log.info("Searching gazette: {}", url);
    session.open(url);
    try {
      new WebDriverWait(session.driver(), timeout.multipliedBy(2)).until(driver -> rendered());
    } catch (TimeoutException ex) {
      throw new NavigationTimeoutException(null, "gazette results did not render for " + processo);
    }
  }

  @Override
  public boolean captchaPresent() {
    return session.findAll(RECAPTCHA).stream().anyMatch(DoWebGazetteAdapter::blocking);
  }

  @Override
  public List<SearchResultItem> readResults() {
    String body = session.bodyText();
    List<SearchResultItem> items = parser.parse(body);
    int announced = DoWebResultParser.announcedCount(body);
    if (announced > items.size()) {
      log.debug("Gazette announced {} results, {} rendered on the first page", announced, items.size());
    }
    return items;
  }

  @Override
  public String documentUrl(SearchResultItem item) {
    if (item.downloadLink() != null) {
      return item.downloadLink();
    }
    return parser.downloadUrl(item.editionNumber(), item.pageNumber());
  }

  @Override
  public Path download(SearchResultItem item, Path directory) {
    return downloader.download(documentUrl(item), directory,
        "doweb-" + item.editionNumber() + "-" + item.pageNumber() + "-");
  }

  private static boolean blocking(WebElement frame) {
    try {
      String src = frame.getAttribute("src");
      // the invisible badge iframe is always present; only the anchor or challenge frames block
      return frame.isDisplayed() && (src == null || !src.contains("size=invisible"));
    } catch (StaleElementReferenceException ex) {
      // the widget was replaced while reading; the next check sees the new frame
      return false;
    } catch (WebDriverException ex) {
      throw new NavigationTimeoutException(null, "gazette CAPTCHA frame could not be inspected", ex);
    }
  }

  private boolean rendered() {
    String body = session.bodyText();
    String lower = body.toLowerCase(Locale.ROOT);
    return DoWebResultParser.announcedCount(body) >= 0
        || lower.contains("publicado em")
        || captchaPresent();
  }
}
