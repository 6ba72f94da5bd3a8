package br.rio.confere.infrastructure.persistence;

import br.rio.confere.application.error.PersistenceException;
import br.rio.confere.application.pipeline.RunSummary;
import br.rio.confere.application.port.ResultRepository;
import br.rio.confere.domain.company.CompanyRecord;
import br.rio.confere.domain.conformity.ConformityResult;
import br.rio.confere.domain.contract.ContractRecord;
import br.rio.confere.domain.publication.PublicationResult;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SequenceWriter;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> {@link ResultRepository} writing one JSON file per processo and artifact kind under
 * the run directory, plus a tabular {@code summary.csv} and {@code run-summary.json}.
 * <p><strong>Layout:</strong> {@code contracts/<processo>.json}, {@code publications/<processo>.json},
 * {@code conformity/<processo>.json}; processo separators become {@code _} in file names.</p>
 * <p><strong>Thread-safety:</strong> Not thread-safe; driven by the single pipeline worker.</p>
 */
public final class JsonResultRepository implements ResultRepository {
  private static final Logger log = LoggerFactory.getLogger(JsonResultRepository.class);
  static final String SUMMARY_CSV = "summary.csv";
  static final String RUN_SUMMARY = "run-summary.json";

  private final Path runDirectory;
  private final ObjectMapper mapper;
  private final CsvMapper csvMapper = new CsvMapper();
  private final CsvSchema rowSchema;

  public JsonResultRepository(Path runDirectory) {
    this.runDirectory = Objects.requireNonNull(runDirectory, "runDirectory");
    this.mapper = JsonMappers.artifacts();
    this.rowSchema = csvMapper.schemaFor(SummaryRow.class);
  }

  @Override
  public void saveContract(String processo, ContractRecord contract) {
    write(runDirectory.resolve("contracts"), processo, contract);
  }

  @Override
  public void savePublication(PublicationResult publication) {
    write(runDirectory.resolve("publications"), publication.processo(), publication);
  }

  @Override
  public void saveConformity(ConformityResult result, CompanyRecord company) {
    write(runDirectory.resolve("conformity"), result.processo(), result);
    appendRow(SummaryRow.of(result, company));
  }

  @Override
  public void saveRunSummary(RunSummary summary) {
    Path target = runDirectory.resolve(RUN_SUMMARY);
    try {
      Files.createDirectories(runDirectory);
      mapper.writeValue(target.toFile(), summary);
      log.info("Run summary written to {}", target);
    } catch (IOException ex) {
      throw new PersistenceException("unable to write run summary " + target, ex);
    }
  }

  private void write(Path directory, String processo, Object value) {
    Path target = directory.resolve(JsonMappers.fileStem(processo) + ".json");
    try {
      Files.createDirectories(directory);
      mapper.writeValue(target.toFile(), value);
      log.debug("Wrote {}", target);
    } catch (IOException ex) {
      throw new PersistenceException("unable to write " + target, ex);
    }
  }

  private void appendRow(SummaryRow row) {
    Path target = runDirectory.resolve(SUMMARY_CSV);
    try {
      Files.createDirectories(runDirectory);
      boolean fresh = !Files.exists(target) || Files.size(target) == 0;
      CsvSchema schema = fresh ? rowSchema.withHeader() : rowSchema.withoutHeader();
      try (OutputStream out = Files.newOutputStream(target,
              StandardOpenOption.CREATE, StandardOpenOption.APPEND);
          SequenceWriter writer = csvMapper.writer(schema).writeValues(out)) {
        writer.write(row);
      }
    } catch (IOException ex) {
      throw new PersistenceException("unable to append to " + target, ex);
    }
  }

  @JsonPropertyOrder({"processo", "company_id", "company_name", "overall_status", "conformity_score",
      "publication_located", "timely", "days_difference"})
  record SummaryRow(
      @JsonProperty("processo") String processo,
      @JsonProperty("company_id") String companyId,
      @JsonProperty("company_name") String companyName,
      @JsonProperty("overall_status") String overallStatus,
      @JsonProperty("conformity_score") int conformityScore,
      @JsonProperty("publication_located") boolean publicationLocated,
      @JsonProperty("timely") Boolean timely,
      @JsonProperty("days_difference") Integer daysDifference) {

    static SummaryRow of(ConformityResult result, CompanyRecord company) {
      return new SummaryRow(
          result.processo(),
          company == null ? "" : company.companyId(),
          company == null ? "" : company.name(),
          result.overallStatus().name(),
          result.conformityScore(),
          result.publicationLocated(),
          result.timely(),
          result.daysDifference());
    }
  }
}
