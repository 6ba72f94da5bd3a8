package br.rio.confere.infrastructure.persistence;

import br.rio.confere.application.error.ParsingException;
import br.rio.confere.domain.company.CompanyRecord;
import br.rio.confere.domain.company.CompanyRowParser;
import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvParser;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reads the company listing from a CSV export instead of scraping the portal grid.
 *
 * <p>Files with {@code company_id} and {@code name} header columns are read directly. Any other layout is
 * treated as an export of the portal grid: each row's cells are joined and parsed as a grid row, so the
 * portal's own {@code "ID - NAME  R$ ..."} rows are accepted. Duplicate ids keep their first occurrence.</p>
 */
public final class CsvCompanySeed {
  private static final Logger log = LoggerFactory.getLogger(CsvCompanySeed.class);

  private final Path file;
  private final CompanyRowParser rowParser;

  public CsvCompanySeed(Path file, CompanyRowParser rowParser) {
    this.file = Objects.requireNonNull(file, "file");
    this.rowParser = Objects.requireNonNull(rowParser, "rowParser");
  }

  /**
   * Loads the companies in file order.
   *
   * @return distinct companies
   * @throws ParsingException when the file cannot be read or holds no company
   */
  public List<CompanyRecord> load() {
    CsvMapper mapper = new CsvMapper();
    mapper.enable(CsvParser.Feature.TRIM_SPACES);
    mapper.enable(CsvParser.Feature.SKIP_EMPTY_LINES);
    CsvSchema schema = CsvSchema.emptySchema().withHeader();
    Map<String, CompanyRecord> companies = new LinkedHashMap<>();
    int rejected = 0;
    try (Reader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8);
        MappingIterator<Map<String, String>> rows =
            mapper.readerForMapOf(String.class).with(schema).readValues(reader)) {
      while (rows.hasNext()) {
        Optional<CompanyRecord> company = toCompany(rows.next());
        if (company.isPresent()) {
          companies.putIfAbsent(company.get().companyId(), company.get());
        } else {
          rejected++;
        }
      }
    } catch (IOException | RuntimeException ex) {
      throw new ParsingException("unable to read company seed " + file, ex);
    }
    if (companies.isEmpty()) {
      throw new ParsingException("company seed " + file + " contains no company rows");
    }
    log.info("Loaded {} companies from {} ({} rows ignored)", companies.size(), file, rejected);
    return List.copyOf(companies.values());
  }

  private Optional<CompanyRecord> toCompany(Map<String, String> row) {
    Map<String, String> normalized = new LinkedHashMap<>();
    row.forEach((key, value) -> normalized.put(key.trim().toLowerCase(Locale.ROOT), value));
    String id = normalized.get("company_id");
    String name = normalized.get("name");
    if (id != null && name != null) {
      if (id.isBlank() || name.isBlank()) {
        return Optional.empty();
      }
      return Optional.of(new CompanyRecord(id.trim(), name.trim()));
    }
    List<String> cells = new ArrayList<>();
    for (String value : row.values()) {
      if (value != null && !value.isBlank()) {
        cells.add(value.trim());
      }
    }
    return rowParser.parse(String.join(" ", cells));
  }
}
