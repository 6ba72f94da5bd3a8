package br.rio.confere.application.error;

/** Neither the automated solver nor an operator cleared the CAPTCHA in time. */
public class CaptchaUnresolvedException extends ConfereException {
  public CaptchaUnresolvedException(String message) {
    super(message);
  }
}
