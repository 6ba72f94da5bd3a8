package br.rio.confere.application.extraction;

import br.rio.confere.application.error.ExtractionMalformedResponseException;
import br.rio.confere.application.error.ExtractionRateLimitedException;
import br.rio.confere.application.port.ClockPort;
import br.rio.confere.application.port.ExtractionPort;
import br.rio.confere.application.port.MetricsPort;
import br.rio.confere.domain.contract.ContractRecord;
import java.time.Duration;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.DoubleSupplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Calls the extraction port under the retry policy.
 * <p><strong>Retry rules:</strong> rate-limited calls back off exponentially up to the policy's attempt budget;
 * a malformed answer is retried once with the strict schema hint; every other failure propagates at once.</p>
 * <p><strong>Observability:</strong> increments {@code extraction.retry} per retry and observes
 * {@code extraction.latency.ms} per successful call.</p>
 * <p><strong>Thread-safety:</strong> Thread-safe when the port and clock are.</p>
 */
public final class ExtractionService {
  private static final Logger log = LoggerFactory.getLogger(ExtractionService.class);

  private final ExtractionPort port;
  private final RetryPolicy policy;
  private final ClockPort clock;
  private final MetricsPort metrics;
  private final DoubleSupplier random;

  public ExtractionService(ExtractionPort port, RetryPolicy policy, ClockPort clock, MetricsPort metrics) {
    this(port, policy, clock, metrics, () -> ThreadLocalRandom.current().nextDouble());
  }

  ExtractionService(
      ExtractionPort port, RetryPolicy policy, ClockPort clock, MetricsPort metrics, DoubleSupplier random) {
    this.port = Objects.requireNonNull(port, "port");
    this.policy = Objects.requireNonNull(policy, "policy");
    this.clock = Objects.requireNonNull(clock, "clock");
    this.metrics = metrics == null ? MetricsPort.NO_OP : metrics;
    this.random = Objects.requireNonNull(random, "random");
  }

  /**
   * Extracts fields from document text.
   *
   * @param text document text
   * @param schema fields to extract
   * @return extracted fields
   * @throws ExtractionRateLimitedException when the attempt budget is exhausted
   * @throws ExtractionMalformedResponseException when the strict retry is also malformed
   * @throws br.rio.confere.application.error.ExtractionUnavailableException when the service fails
   * @throws InterruptedException when interrupted during backoff
   */
  public Map<String, String> extract(String text, ExtractionSchema schema) throws InterruptedException {
    boolean strict = false;
    int rateLimitedFailures = 0;
    while (true) {
      long started = clock.nowMillis();
      try {
        Map<String, String> fields = port.extract(new ExtractionRequest(text, schema, strict));
        metrics.observe("extraction.latency.ms", clock.nowMillis() - started);
        return fields;
      } catch (ExtractionRateLimitedException ex) {
        rateLimitedFailures++;
        if (!policy.retryable().test(ex) || !policy.allowsRetryAfter(rateLimitedFailures)) {
          log.warn("Extraction still rate limited after {} attempts", rateLimitedFailures);
          throw ex;
        }
        Duration wait = policy.delayAfter(rateLimitedFailures, ex.retryAfter(), random);
        metrics.increment("extraction.retry");
        log.info("Extraction rate limited (attempt {}/{}); backing off {} ms",
            rateLimitedFailures, policy.maxAttempts(), wait.toMillis());
        clock.sleep(wait);
      } catch (ExtractionMalformedResponseException ex) {
        if (strict) {
          throw ex;
        }
        strict = true;
        metrics.increment("extraction.retry");
        log.info("Malformed extraction answer ({}); retrying with strict schema", ex.getMessage());
      }
    }
  }

  /**
   * Extracts contract fields from the signed contract text.
   *
   * @param text contract text
   * @param processo processo to use when the document does not state one
   * @return contract record
   * @throws InterruptedException when interrupted during backoff
   */
  public ContractRecord extractContract(String text, String processo) throws InterruptedException {
    return ContractRecord.fromFields(extract(text, ExtractionSchema.CONTRACT), processo);
  }

  /**
   * Extracts contract fields from a gazette extract.
   *
   * @param text publication text
   * @param processo processo to use when the extract does not state one
   * @return publication fields as a contract record
   * @throws InterruptedException when interrupted during backoff
   */
  public ContractRecord extractPublication(String text, String processo) throws InterruptedException {
    return ContractRecord.fromFields(extract(text, ExtractionSchema.PUBLICATION), processo);
  }
}
