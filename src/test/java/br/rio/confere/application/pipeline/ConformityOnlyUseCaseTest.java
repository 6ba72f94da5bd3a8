package br.rio.confere.application.pipeline;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import br.rio.confere.application.error.ParsingException;
import br.rio.confere.application.port.ConformityPairSource;
import br.rio.confere.domain.conformity.ConformityEngine;
import br.rio.confere.domain.conformity.ConformityPair;
import br.rio.confere.domain.conformity.OverallStatus;
import br.rio.confere.domain.contract.ContractRecord;
import br.rio.confere.domain.publication.PublicationResult;
import br.rio.confere.domain.publication.SearchResultItem;
import br.rio.confere.testing.InMemoryResults;
import br.rio.confere.testing.ManualClock;
import br.rio.confere.testing.RecordingMetrics;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class ConformityOnlyUseCaseTest {
  private static final String PROCESSO = "SMS-PRO-2025/01234";

  private final InMemoryResults results = new InMemoryResults();
  private final RecordingMetrics metrics = new RecordingMetrics();

  @Test
  void evaluatesEveryStoredPairAndSkipsUnreadableOnes() {
    MapPairSource pairs = new MapPairSource()
        .put("a", locatedPair("001/2025"))
        .put("b", null)
        .put("c", new ConformityPair(contract("001/2025"), PublicationResult.notLocated(PROCESSO, List.of())));

    RunSummary summary = useCase(pairs).run(new CancellationToken());

    assertEquals(new RunSummary.Processed(1, 0, 1, 1), summary.processed());
    assertEquals(1, summary.skipped().parseError());
    assertEquals("b", summary.skippedUnits().get(0).processo());
    assertEquals(OverallStatus.CONFORME, results.conformity().get(0).overallStatus());
    assertEquals(1, results.summaries().size());
    assertEquals(1, metrics.count("pipeline.unit.skipped"));
  }

  @Test
  void cancellationStopsBeforeTheNextPair() {
    CancellationToken cancellation = new CancellationToken();
    cancellation.cancel();

    RunSummary summary = useCase(new MapPairSource().put("a", locatedPair("001/2025"))).run(cancellation);

    assertTrue(summary.cancelled());
    assertTrue(results.conformity().isEmpty());
  }

  private ConformityOnlyUseCase useCase(ConformityPairSource pairs) {
    return new ConformityOnlyUseCase("offline-1", pairs, new ConformityEngine(), results, metrics, new ManualClock());
  }

  private static ConformityPair locatedPair(String numero) {
    SearchResultItem match = new SearchResultItem(0, "05/03/2025", "120", "7", "EXTRATO " + PROCESSO, "/d/0", true, true);
    return new ConformityPair(contract(numero),
        PublicationResult.located(PROCESSO, match, "https://doweb.test/d/0", "EXTRATO DO CONTRATO",
            contract(numero), List.of(match)));
  }

  private static ContractRecord contract(String numero) {
    return ContractRecord.fromFields(Map.of(
        "numero_contrato", numero,
        "valor_contrato", "R$ 5.000,00",
        "data_assinatura", "01/03/2025"), PROCESSO);
  }

  private static final class MapPairSource implements ConformityPairSource {
    private final Map<String, ConformityPair> pairs = new LinkedHashMap<>();

    MapPairSource put(String name, ConformityPair pair) {
      pairs.put(name, pair);
      return this;
    }

    @Override
    public List<String> names() {
      return List.copyOf(pairs.keySet());
    }

    @Override
    public ConformityPair read(String name) {
      ConformityPair pair = pairs.get(name);
      if (pair == null) {
        throw new ParsingException("pair " + name + " is not valid JSON");
      }
      return pair;
    }
  }
}
