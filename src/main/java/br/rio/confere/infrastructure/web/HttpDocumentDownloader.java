package br.rio.confere.infrastructure.web;

import br.rio.confere.application.error.ParsingException;
import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Downloads documents over plain HTTP into a scratch directory.
 *
 * <p>Gazette pages and contract files are served without session state, so no browser is needed.</p>
 */
public final class HttpDocumentDownloader {
  private static final Logger log = LoggerFactory.getLogger(HttpDocumentDownloader.class);

  private final HttpClient client;
  private final Duration timeout;

  public HttpDocumentDownloader(Duration timeout) {
    this(HttpClient.newBuilder()
        .followRedirects(HttpClient.Redirect.NORMAL)
        .connectTimeout(timeout)
        .build(), timeout);
  }

  HttpDocumentDownloader(HttpClient client, Duration timeout) {
    this.client = Objects.requireNonNull(client, "client");
    this.timeout = Objects.requireNonNull(timeout, "timeout");
  }

  /**
   * Downloads {@code url} into a new file in {@code directory}.
   *
   * @param url document URL
   * @param directory scratch directory, created when missing
   * @param prefix file name prefix
   * @return downloaded file; the caller deletes it
   * @throws ParsingException when the download fails or yields no bytes
   */
  public Path download(String url, Path directory, String prefix) {
    Path target = null;
    try {
      Files.createDirectories(directory);
      target = Files.createTempFile(directory, prefix, ".download");
      HttpRequest request = HttpRequest.newBuilder(URI.create(url)).timeout(timeout.multipliedBy(6)).GET().build();
      HttpResponse<Path> response = client.send(request, HttpResponse.BodyHandlers.ofFile(target));
      if (response.statusCode() != 200) {
        throw new ParsingException("download of " + url + " answered HTTP " + response.statusCode());
      }
      if (Files.size(target) == 0) {
        throw new ParsingException("download of " + url + " is empty");
      }
      log.debug("Downloaded {} ({} bytes)", url, Files.size(target));
      return target;
    } catch (IOException | IllegalArgumentException ex) {
      deleteQuietly(target);
      throw new ParsingException("unable to download " + url + ": " + ex.getMessage(), ex);
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      deleteQuietly(target);
      throw new ParsingException("download of " + url + " interrupted", ex);
    } catch (ParsingException ex) {
      deleteQuietly(target);
      throw ex;
    }
  }

  private static void deleteQuietly(Path file) {
    if (file == null) {
      return;
    }
    try {
      Files.deleteIfExists(file);
    } catch (IOException ex) {
      log.warn("Unable to delete partial download {}", file, ex);
    }
  }
}
