package br.rio.confere.application.port;

import br.rio.confere.domain.publication.SearchResultItem;
import java.nio.file.Path;
import java.util.List;

/**
 * Search and download operations on the official gazette (DoWeb).
 *
 * <p>Not thread-safe; one adapter drives one browser session.</p>
 */
public interface GazettePort {

  /** Submits a search for the canonical processo text. */
  void submitSearch(String processo);

  /** Returns {@code true} while a CAPTCHA challenge blocks the results. */
  boolean captchaPresent();

  /** Reads the rendered result rows in page order. */
  List<SearchResultItem> readResults();

  /** URL of the document behind a result row. */
  String documentUrl(SearchResultItem item);

  /**
   * Downloads the document behind a result row into {@code directory}.
   *
   * @param item result row
   * @param directory scratch directory
   * @return path of the downloaded file; the caller owns and deletes it
   * @throws br.rio.confere.application.error.ParsingException when the download fails or is empty
   */
  Path download(SearchResultItem item, Path directory);
}
