package br.rio.confere.application.port;

import br.rio.confere.domain.conformity.ConformityPair;
import java.util.List;

/** Supplies pre-extracted contract/publication pairs for conformity-only runs. */
public interface ConformityPairSource {
  /** Names of the available pairs in a stable order. */
  List<String> names();

  /**
   * Reads one pair.
   *
   * @param name pair name as listed by {@link #names()}
   * @return parsed pair
   * @throws br.rio.confere.application.error.ParsingException when the document is not a valid pair
   */
  ConformityPair read(String name);
}
