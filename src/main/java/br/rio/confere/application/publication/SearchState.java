package br.rio.confere.application.publication;

/**
 * Steps of one gazette search. Published under the MDC key {@code state} while the search runs.
 */
public enum SearchState {
  SEARCH_SUBMITTED,
  CAPTCHA_CHECK,
  CAPTCHA_CLEAR,
  CAPTCHA_BLOCKED,
  RESULTS_RENDERED,
  MATCH_SELECTED,
  NO_MATCH,
  DOWNLOADING,
  EXTRACTING,
  CLEANUP,
  DONE
}
