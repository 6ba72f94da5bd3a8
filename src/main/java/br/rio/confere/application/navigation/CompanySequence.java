package br.rio.confere.application.navigation;

import br.rio.confere.domain.company.CompanyRecord;
import java.util.List;
import java.util.Objects;

/**
 * Lazy, finite, restartable sequence of companies.
 *
 * <p>Nothing is collected until {@link #records()} is first called; the result is cached until
 * {@link #restart()}.</p>
 */
public final class CompanySequence {

  /** Collection step behind the sequence. */
  @FunctionalInterface
  public interface Loader {
    List<CompanyRecord> load() throws InterruptedException;
  }

  private final Loader loader;
  private List<CompanyRecord> cached;

  public CompanySequence(Loader loader) {
    this.loader = Objects.requireNonNull(loader, "loader");
  }

  /** Fixed sequence, e.g. read from a seed file. */
  public static CompanySequence of(List<CompanyRecord> records) {
    List<CompanyRecord> copy = List.copyOf(records);
    return new CompanySequence(() -> copy);
  }

  /**
   * Returns the companies, collecting them on first use.
   *
   * @return companies in listing order without duplicates
   * @throws InterruptedException when collection is interrupted
   */
  public synchronized List<CompanyRecord> records() throws InterruptedException {
    if (cached == null) {
      cached = List.copyOf(loader.load());
    }
    return cached;
  }

  /** Discards any collected companies so the next call collects afresh. */
  public synchronized void restart() {
    cached = null;
  }

  /** Returns {@code true} once the sequence has been collected. */
  public synchronized boolean loaded() {
    return cached != null;
  }
}
