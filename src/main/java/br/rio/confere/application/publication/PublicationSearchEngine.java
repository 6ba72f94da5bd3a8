package br.rio.confere.application.publication;

import br.rio.confere.application.error.ParsingException;
import br.rio.confere.application.extraction.ExtractionService;
import br.rio.confere.application.port.DocumentTextExtractor;
import br.rio.confere.application.port.GazettePort;
import br.rio.confere.application.port.MetricsPort;
import br.rio.confere.domain.contract.ContractRecord;
import br.rio.confere.domain.processo.ProcessoId;
import br.rio.confere.domain.publication.PublicationResult;
import br.rio.confere.domain.publication.SearchResultItem;
import br.rio.confere.logging.Logs;
import java.nio.file.Path;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/**
 * <strong>What:</strong> Locates the gazette publication of one processo and extracts its fields.
 * <p><strong>Flow:</strong> submit the canonical processo, clear the CAPTCHA gate, rank the results, then try the
 * best candidates one at a time: download, extract text, confirm the text mentions the processo, extract fields.
 * The downloaded file is deleted before the next candidate is touched.</p>
 * <p><strong>Outcomes:</strong> a confirmed match yields a located {@link PublicationResult}; no qualifying
 * candidate, or none whose document mentions the processo, yields {@link PublicationResult#notLocated}. Neither
 * is an error.</p>
 * <p><strong>Observability:</strong> the step is published under the MDC key {@code state};
 * counters {@code search.located}, {@code search.not_located}, {@code search.candidate.rejected}.</p>
 * <p><strong>Thread-safety:</strong> Not thread-safe; drives one gazette session.</p>
 */
public final class PublicationSearchEngine {
  private static final Logger log = LoggerFactory.getLogger(PublicationSearchEngine.class);
  private static final int LOG_TEXT_BYTES = 256;

  private final GazettePort gazette;
  private final CaptchaGate captchaGate;
  private final CandidateRanker ranker;
  private final DocumentTextExtractor textExtractor;
  private final ExtractionService extraction;
  private final MetricsPort metrics;
  private final Path tempDirectory;
  private final int maxCandidates;

  public PublicationSearchEngine(
      GazettePort gazette,
      CaptchaGate captchaGate,
      CandidateRanker ranker,
      DocumentTextExtractor textExtractor,
      ExtractionService extraction,
      MetricsPort metrics,
      Path tempDirectory,
      int maxCandidates) {
    this.gazette = Objects.requireNonNull(gazette, "gazette");
    this.captchaGate = Objects.requireNonNull(captchaGate, "captchaGate");
    this.ranker = Objects.requireNonNull(ranker, "ranker");
    this.textExtractor = Objects.requireNonNull(textExtractor, "textExtractor");
    this.extraction = Objects.requireNonNull(extraction, "extraction");
    this.metrics = metrics == null ? MetricsPort.NO_OP : metrics;
    this.tempDirectory = Objects.requireNonNull(tempDirectory, "tempDirectory");
    if (maxCandidates < 1) {
      throw new IllegalArgumentException("maxCandidates must be >= 1");
    }
    this.maxCandidates = maxCandidates;
  }

  /**
   * Searches the gazette for a processo.
   *
   * @param rawProcesso processo in any accepted layout
   * @return located or not-located result
   * @throws br.rio.confere.application.error.CaptchaUnresolvedException when the CAPTCHA gate fails
   * @throws ParsingException when every downloaded candidate was unreadable
   * @throws InterruptedException when cancelled while waiting
   */
  public PublicationResult search(String rawProcesso) throws InterruptedException {
    String processo = ProcessoId.normalize(rawProcesso);
    enter(SearchState.SEARCH_SUBMITTED);
    gazette.submitSearch(processo);

    enter(SearchState.CAPTCHA_CHECK);
    boolean challenged = captchaGate.clear(processo, () -> enter(SearchState.CAPTCHA_BLOCKED));
    enter(SearchState.CAPTCHA_CLEAR);
    if (challenged) {
      log.info("Gazette search for {} continues after a CAPTCHA", processo);
    }

    List<SearchResultItem> results = gazette.readResults();
    enter(SearchState.RESULTS_RENDERED);
    CandidateRanker.Ranking ranking = ranker.rank(processo, results);
    log.info("Gazette returned {} results for {}, {} mention it",
        results.size(), processo, ranking.qualifying().size());

    ParsingException lastParseFailure = null;
    int tried = 0;
    int unreadable = 0;
    for (SearchResultItem candidate : ranking.qualifying()) {
      if (tried >= maxCandidates) {
        break;
      }
      tried++;
      enter(SearchState.MATCH_SELECTED);
      try {
        Optional<PublicationResult> confirmed = tryCandidate(processo, candidate, ranking.classified());
        if (confirmed.isPresent()) {
          metrics.increment("search.located");
          enter(SearchState.DONE);
          return confirmed.get();
        }
        metrics.increment("search.candidate.rejected");
      } catch (ParsingException ex) {
        log.warn("Candidate {} for {} could not be read: {}", candidate.index(), processo, ex.getMessage());
        metrics.increment("search.candidate.rejected");
        lastParseFailure = ex;
        unreadable++;
      }
    }

    if (lastParseFailure != null && unreadable == tried) {
      throw lastParseFailure;
    }
    enter(SearchState.NO_MATCH);
    metrics.increment("search.not_located");
    log.info("No confirmed publication located for {} after {} candidates", processo, tried);
    enter(SearchState.DONE);
    return PublicationResult.notLocated(processo, ranking.classified());
  }

  private Optional<PublicationResult> tryCandidate(
      String processo, SearchResultItem candidate, List<SearchResultItem> classified)
      throws InterruptedException {
    enter(SearchState.DOWNLOADING);
    Path file = gazette.download(candidate, tempDirectory);
    try (TemporaryDocument document = new TemporaryDocument(file)) {
      enter(SearchState.EXTRACTING);
      String text = textExtractor.extractText(document.path());
      if (!CandidateRanker.mentions(processo, text)) {
        log.info("Candidate {} (edition {}) does not mention {}; trying next",
            candidate.index(), candidate.editionNumber(), processo);
        log.debug("Rejected candidate text: {}", Logs.truncate(text, LOG_TEXT_BYTES));
        return Optional.empty();
      }
      ContractRecord fields = extraction.extractPublication(text, processo);
      String tipo = CandidateRanker.extratoType(text)
          .or(() -> CandidateRanker.extratoType(candidate.previewText()))
          .orElse(null);
      return Optional.of(PublicationResult.located(
          processo, candidate, gazette.documentUrl(candidate), tipo, fields, classified));
    } finally {
      enter(SearchState.CLEANUP);
    }
  }

  private static void enter(SearchState state) {
    MDC.put("state", state.name());
  }
}
