package br.rio.confere.infrastructure.web;

import br.rio.confere.application.error.ParsingException;
import br.rio.confere.application.port.ContractSource;
import br.rio.confere.application.port.DocumentTextExtractor;
import br.rio.confere.domain.processo.ProcessoLink;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link ContractSource} that downloads the document linked from the portal and extracts its text.
 */
public final class HttpContractSource implements ContractSource {
  private static final Logger log = LoggerFactory.getLogger(HttpContractSource.class);

  private final HttpDocumentDownloader downloader;
  private final DocumentTextExtractor textExtractor;
  private final Path tempDirectory;

  public HttpContractSource(
      HttpDocumentDownloader downloader, DocumentTextExtractor textExtractor, Path tempDirectory) {
    this.downloader = Objects.requireNonNull(downloader, "downloader");
    this.textExtractor = Objects.requireNonNull(textExtractor, "textExtractor");
    this.tempDirectory = Objects.requireNonNull(tempDirectory, "tempDirectory");
  }

  @Override
  public String contractText(ProcessoLink link) {
    if (link.url() == null || link.url().isBlank()) {
      throw new ParsingException("processo " + link.processo() + " has no document link");
    }
    Path file = downloader.download(link.url(), tempDirectory, "contract-");
    try {
      return textExtractor.extractText(file);
    } finally {
      try {
        Files.deleteIfExists(file);
      } catch (IOException ex) {
        log.warn("Unable to delete contract download {}", file, ex);
      }
    }
  }
}
