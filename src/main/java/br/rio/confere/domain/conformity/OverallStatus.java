package br.rio.confere.domain.conformity;

/** Verdict reported to auditors for one processo. */
public enum OverallStatus {
  CONFORME,
  PARCIAL,
  NAO_CONFORME
}
