package br.rio.confere.application.error;

/**
 * Base type for failures raised by the conformity pipeline.
 *
 * <p>Subtypes are classified as unit-level (the pipeline records a skip and moves on) or fatal
 * (the run stops and the CLI reports a setup failure) via {@link #fatal()}.</p>
 */
public class ConfereException extends RuntimeException {
  public ConfereException(String message) {
    super(message);
  }

  public ConfereException(String message, Throwable cause) {
    super(message, cause);
  }

  /** Returns {@code true} when the failure must stop the whole run. */
  public boolean fatal() {
    return false;
  }
}
