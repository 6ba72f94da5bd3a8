package br.rio.confere.domain.navigation;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Ordered node labels from a company down to the level where processo links were collected.
 *
 * <p>{@code organ}, {@code unit}, and {@code object} are {@code null} when the hierarchy ended
 * above that level.</p>
 *
 * @param companyId owning company
 * @param organ organ label, if selected
 * @param unit unit label, if selected
 * @param object contract object label, if selected
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record NavigationPath(
    @JsonProperty("company_id") String companyId,
    @JsonProperty("organ") String organ,
    @JsonProperty("unit") String unit,
    @JsonProperty("object") String object) {

  public NavigationPath {
    Objects.requireNonNull(companyId, "companyId");
    if (unit != null && organ == null) {
      throw new IllegalArgumentException("unit requires an organ");
    }
    if (object != null && unit == null) {
      throw new IllegalArgumentException("object requires a unit");
    }
  }

  public static NavigationPath company(String companyId) {
    return new NavigationPath(companyId, null, null, null);
  }

  public NavigationPath withOrgan(String label) {
    return new NavigationPath(companyId, Objects.requireNonNull(label, "label"), null, null);
  }

  public NavigationPath withUnit(String label) {
    return new NavigationPath(companyId, organ, Objects.requireNonNull(label, "label"), null);
  }

  public NavigationPath withObject(String label) {
    return new NavigationPath(companyId, organ, unit, Objects.requireNonNull(label, "label"));
  }

  /** Labels below the company, root first. */
  public List<String> labels() {
    List<String> labels = new ArrayList<>(3);
    if (organ != null) {
      labels.add(organ);
    }
    if (unit != null) {
      labels.add(unit);
    }
    if (object != null) {
      labels.add(object);
    }
    return List.copyOf(labels);
  }

  /** Deepest state reached when walking this path. */
  public NavigationState depth() {
    if (unit != null) {
      return NavigationState.UNIT_SELECTED;
    }
    if (organ != null) {
      return NavigationState.ORGAN_SELECTED;
    }
    return NavigationState.COMPANY_SELECTED;
  }

  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder(companyId);
    for (String label : labels()) {
      sb.append(" > ").append(label);
    }
    return sb.toString();
  }
}
