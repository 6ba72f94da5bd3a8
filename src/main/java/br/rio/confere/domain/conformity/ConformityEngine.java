package br.rio.confere.domain.conformity;

import br.rio.confere.domain.contract.ContractRecord;
import br.rio.confere.domain.publication.PublicationResult;
import br.rio.confere.domain.text.DateValues;
import br.rio.confere.domain.text.MoneyValues;
import br.rio.confere.domain.text.SequenceRatio;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;

/**
 * <strong>What:</strong> Reconciles a contract with its gazette publication into a {@link ConformityResult}.
 * <p><strong>Why:</strong> Auditors need a deterministic, explainable verdict per processo: which fields agree,
 * by how much, and whether the publication met the deadline.</p>
 * <p><strong>Role:</strong> Pure domain service; no I/O.</p>
 * <p><strong>Thread-safety:</strong> Stateless and thread-safe.</p>
 *
 * <p>Aggregation rules:</p>
 * <ul>
 *   <li>{@code CONFORME} when the publication was located, was timely, and every field is at least ALTO.</li>
 *   <li>{@code NAO_CONFORME} when not located; when any field is BAIXO or NENHUM and the contract number
 *       and value do not both agree at ALTO or better; or when late with any field below ALTO.</li>
 *   <li>{@code PARCIAL} otherwise.</li>
 * </ul>
 */
public final class ConformityEngine {

  /**
   * Compares a contract with a publication.
   *
   * @param contract contract fields
   * @param publication gazette search outcome
   * @return conformity verdict
   */
  public ConformityResult evaluate(ContractRecord contract, PublicationResult publication) {
    Objects.requireNonNull(contract, "contract");
    Objects.requireNonNull(publication, "publication");
    if (!publication.publicationFound()) {
      return ConformityResult.notLocated(publication.processo());
    }
    ContractRecord published = publication.extractedFields();

    List<FieldCheck> checks = compareFields(contract, published);
    String signed = contract.dataAssinatura() != null
        ? contract.dataAssinatura()
        : published.dataAssinatura();
    Timeliness timeliness = Timeliness.evaluate(signed, publication.publicationDate());

    return new ConformityResult(
        publication.processo(),
        aggregate(checks, timeliness.timely()),
        score(checks),
        timeliness.timely(),
        timeliness.daysDifference(),
        true,
        checks);
  }

  /**
   * Compares every field present on at least one side.
   *
   * @param contract contract side
   * @param publication publication side
   * @return checks in field order; fields absent on both sides are omitted
   */
  public List<FieldCheck> compareFields(ContractRecord contract, ContractRecord publication) {
    List<FieldCheck> checks = new ArrayList<>();
    for (ComparableField field : ComparableField.values()) {
      compare(field, contract, publication).ifPresent(checks::add);
    }
    return List.copyOf(checks);
  }

  static OverallStatus aggregate(List<FieldCheck> checks, Boolean timely) {
    boolean allStrong = !checks.isEmpty() && checks.stream().allMatch(c -> c.matchLevel().atLeastAlto());
    if (Boolean.TRUE.equals(timely) && allStrong) {
      return OverallStatus.CONFORME;
    }
    boolean anyWeak = checks.stream().anyMatch(c -> c.matchLevel().weak());
    if (anyWeak && !countervailing(checks)) {
      return OverallStatus.NAO_CONFORME;
    }
    if (Boolean.FALSE.equals(timely) && !allStrong) {
      return OverallStatus.NAO_CONFORME;
    }
    return OverallStatus.PARCIAL;
  }

  static int score(List<FieldCheck> checks) {
    if (checks.isEmpty()) {
      return 0;
    }
    double mean = checks.stream().mapToDouble(FieldCheck::similarityScore).average().orElse(0.0);
    return (int) Math.round(mean * 100.0);
  }

  private static boolean countervailing(List<FieldCheck> checks) {
    return strong(checks, ComparableField.NUMERO_CONTRATO) && strong(checks, ComparableField.VALOR_CONTRATO);
  }

  private static boolean strong(List<FieldCheck> checks, ComparableField field) {
    return checks.stream()
        .anyMatch(c -> c.fieldName().equals(field.fieldName()) && c.matchLevel().atLeastAlto());
  }

  private Optional<FieldCheck> compare(ComparableField field, ContractRecord contract, ContractRecord publication) {
    if (field == ComparableField.PRAZO) {
      return comparePrazo(contract.prazo(), publication.prazo());
    }
    String left = field.read(contract);
    String right = field.read(publication);
    if (left == null && right == null) {
      return Optional.empty();
    }
    if (left == null || right == null) {
      return Optional.of(FieldCheck.of(field.fieldName(), left, right, 0.0));
    }
    double ratio = switch (field.kind()) {
      case MONEY -> money(left, right);
      case DATE -> date(left, right);
      case IDENTIFIER -> identifier(left, right);
      default -> SequenceRatio.similarity(left, right);
    };
    return Optional.of(FieldCheck.of(field.fieldName(), left, right, ratio));
  }

  private Optional<FieldCheck> comparePrazo(ContractRecord.Prazo left, ContractRecord.Prazo right) {
    String name = ComparableField.PRAZO.fieldName();
    if (left.empty() && right.empty()) {
      return Optional.empty();
    }
    if (left.empty() || right.empty()) {
      return Optional.of(FieldCheck.of(name, left.describe(), right.describe(), 0.0));
    }
    List<Double> bounds = new ArrayList<>(2);
    boolean parsed = true;
    for (String[] pair : new String[][] {
        {left.dataInicio(), right.dataInicio()}, {left.dataFim(), right.dataFim()}}) {
      if (pair[0] == null && pair[1] == null) {
        continue;
      }
      if (pair[0] == null || pair[1] == null) {
        bounds.add(0.0);
        continue;
      }
      Optional<LocalDate> a = DateValues.parse(pair[0]);
      Optional<LocalDate> b = DateValues.parse(pair[1]);
      if (a.isEmpty() || b.isEmpty()) {
        parsed = false;
        break;
      }
      bounds.add(a.get().equals(b.get()) ? 1.0 : 0.0);
    }
    double ratio = parsed
        ? bounds.stream().mapToDouble(Double::doubleValue).average().orElse(0.0)
        : SequenceRatio.similarity(left.describe(), right.describe());
    return Optional.of(FieldCheck.of(name, left.describe(), right.describe(), ratio));
  }

  private static double money(String left, String right) {
    Optional<BigDecimal> a = MoneyValues.parse(left);
    Optional<BigDecimal> b = MoneyValues.parse(right);
    if (a.isPresent() && b.isPresent()) {
      return MoneyValues.similarity(a.get(), b.get());
    }
    return SequenceRatio.similarity(left, right);
  }

  private static double date(String left, String right) {
    Optional<LocalDate> a = DateValues.parse(left);
    Optional<LocalDate> b = DateValues.parse(right);
    if (a.isPresent() && b.isPresent()) {
      return a.get().equals(b.get()) ? 1.0 : 0.0;
    }
    return SequenceRatio.similarity(left, right);
  }

  private static double identifier(String left, String right) {
    if (canonicalIdentifier(left).equals(canonicalIdentifier(right))) {
      return 1.0;
    }
    return SequenceRatio.similarity(left, right);
  }

  // "Contrato nº 001/2025" and "1/2025" name the same instrument.
  private static String canonicalIdentifier(String value) {
    String upper = value.toUpperCase(Locale.ROOT).replaceAll("^\\D*?(?=\\d)", "");
    StringBuilder out = new StringBuilder();
    for (String group : upper.split("[^A-Z0-9]+")) {
      if (group.isEmpty()) {
        continue;
      }
      String trimmed = group.replaceFirst("^0+(?=\\d)", "");
      if (out.length() > 0) {
        out.append('/');
      }
      out.append(trimmed);
    }
    return out.toString();
  }
}
