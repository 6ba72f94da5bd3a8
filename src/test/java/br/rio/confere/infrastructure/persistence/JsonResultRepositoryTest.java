package br.rio.confere.infrastructure.persistence;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import br.rio.confere.application.error.PersistenceException;
import br.rio.confere.application.pipeline.RunSummary;
import br.rio.confere.application.pipeline.SkipReason;
import br.rio.confere.domain.company.CompanyRecord;
import br.rio.confere.domain.conformity.ConformityResult;
import br.rio.confere.domain.contract.ContractRecord;
import br.rio.confere.domain.publication.PublicationResult;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class JsonResultRepositoryTest {
  private static final String PROCESSO = "SMS-PRO-2025/00001";

  @TempDir Path tempDir;

  @Test
  void writesOneFilePerProcessoAndKind() throws IOException {
    JsonResultRepository repository = new JsonResultRepository(tempDir);
    ContractRecord contract = new ContractRecord(PROCESSO, "045/2025", "R$ 1.000,00", "01/03/2025",
        "Aquisição de insumos", new ContractRecord.Partes("SMS", "ACME"), null);

    repository.saveContract(PROCESSO, contract);
    repository.savePublication(PublicationResult.notLocated(PROCESSO, List.of()));

    Path contractFile = tempDir.resolve("contracts").resolve("SMS-PRO-2025_00001.json");
    JsonNode json = new ObjectMapper().readTree(contractFile.toFile());
    assertEquals("045/2025", json.get("numero_contrato").asText());
    assertEquals("ACME", json.path("partes").path("contratada").asText());
    assertTrue(Files.exists(tempDir.resolve("publications").resolve("SMS-PRO-2025_00001.json")));
    ContractRecord reloaded = JsonMappers.artifacts().readValue(contractFile.toFile(), ContractRecord.class);
    assertEquals(contract, reloaded);
  }

  @Test
  void conformityResultsAppendSummaryRowsWithSingleHeader() throws IOException {
    JsonResultRepository repository = new JsonResultRepository(tempDir);
    CompanyRecord company = new CompanyRecord("11.111.111/0001-11", "ACME LTDA");

    repository.saveConformity(ConformityResult.notLocated(PROCESSO), company);
    repository.saveConformity(ConformityResult.notLocated("SMS-PRO-2025/00002"), null);

    List<String> lines = Files.readAllLines(tempDir.resolve(JsonResultRepository.SUMMARY_CSV), StandardCharsets.UTF_8);
    assertEquals(3, lines.size());
    assertEquals("processo,company_id,company_name,overall_status,conformity_score,publication_located,"
        + "timely,days_difference", lines.get(0));
    assertTrue(lines.get(1).startsWith("SMS-PRO-2025/00001,11.111.111/0001-11,"));
    assertTrue(lines.get(1).contains("ACME LTDA"));
    assertTrue(lines.get(1).contains("NAO_CONFORME,0,false"));
    assertTrue(lines.get(2).startsWith("SMS-PRO-2025/00002,"));
    assertTrue(Files.exists(tempDir.resolve("conformity").resolve("SMS-PRO-2025_00002.json")));
  }

  @Test
  void writesRunSummary() throws IOException {
    JsonResultRepository repository = new JsonResultRepository(tempDir.resolve("audit-1"));
    Instant started = Instant.parse("2025-03-01T10:00:00Z");
    RunSummary summary = new RunSummary("audit-1", started, started.plusSeconds(90), false, 2, 2, 0, 3, 0,
        new RunSummary.Processed(1, 0, 1, 1), new RunSummary.Skipped(1, 0, 0, 0),
        List.of(new RunSummary.SkippedUnit("SMS-PRO-2025/00003", "22.222.222/0001-22",
            SkipReason.CAPTCHA, "captcha not resolved")));

    repository.saveRunSummary(summary);

    JsonNode json = new ObjectMapper().readTree(
        tempDir.resolve("audit-1").resolve(JsonResultRepository.RUN_SUMMARY).toFile());
    assertEquals("2025-03-01T10:00:00Z", json.get("started_at").asText());
    assertEquals(1, json.path("processed").path("not_located").asInt());
    assertEquals("CAPTCHA", json.path("skipped_units").path(0).path("reason").asText());
  }

  @Test
  void unwritableDirectoryIsAPersistenceError() throws IOException {
    Path blocker = Files.writeString(tempDir.resolve("blocker"), "file");
    JsonResultRepository repository = new JsonResultRepository(blocker);

    assertThrows(PersistenceException.class,
        () -> repository.savePublication(PublicationResult.notLocated(PROCESSO, List.of())));
  }
}
