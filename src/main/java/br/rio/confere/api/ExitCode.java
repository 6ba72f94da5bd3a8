package br.rio.confere.api;

/**
 * <strong>What:</strong> Process exit codes shared by the CONFERE command-line tools.
 * <p><strong>Why:</strong> Schedulers and wrapper scripts distinguish a run that finished (possibly with skipped
 * units) from one that could not start.</p>
 * <p><strong>Thread-safety:</strong> Enum constants are immutable and thread-safe.</p>
 */
public enum ExitCode {
  /** Run completed, including runs that skipped some units. */
  SUCCESS(0),
  /** Unrecoverable setup failure: portal unreachable, company listing failed, or persistence failed. */
  SETUP_FAILURE(1),
  /** Arguments or configuration were invalid. */
  INVALID_CONFIG(2),
  /** Process was interrupted (e.g., SIGINT) after flushing its checkpoint. */
  INTERRUPTED(130);

  private final int code;

  ExitCode(int code) {
    this.code = code;
  }

  /**
   * Returns the numeric value encoded by this exit code.
   *
   * @return numeric exit code
   */
  public int code() {
    return code;
  }
}
