package br.rio.confere.application.port;

/** Automated attempt at clearing a CAPTCHA challenge. */
public interface CaptchaSolver {
  /**
   * Makes one attempt.
   *
   * @throws InterruptedException when interrupted while waiting for the challenge to react
   */
  void attempt() throws InterruptedException;
}
