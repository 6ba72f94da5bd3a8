package br.rio.confere.application.pipeline;

import br.rio.confere.application.error.CaptchaUnresolvedException;
import br.rio.confere.application.error.ConfereException;
import br.rio.confere.application.error.ExtractionMalformedResponseException;
import br.rio.confere.application.error.ExtractionRateLimitedException;
import br.rio.confere.application.error.ExtractionUnavailableException;
import br.rio.confere.application.error.NavigationTimeoutException;

/**
 * Category recorded when a unit ends without a verdict.
 */
public enum SkipReason {
  CAPTCHA,
  TIMEOUT,
  PARSE_ERROR,
  EXTRACTION;

  /**
   * Classifies a unit-level failure.
   *
   * @param failure non-fatal pipeline failure
   * @return skip category
   */
  public static SkipReason of(ConfereException failure) {
    if (failure instanceof CaptchaUnresolvedException) {
      return CAPTCHA;
    }
    if (failure instanceof NavigationTimeoutException) {
      return TIMEOUT;
    }
    if (failure instanceof ExtractionRateLimitedException
        || failure instanceof ExtractionMalformedResponseException
        || failure instanceof ExtractionUnavailableException) {
      return EXTRACTION;
    }
    return PARSE_ERROR;
  }
}
