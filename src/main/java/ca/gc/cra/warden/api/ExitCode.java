package ca.gc.cra.warden.api;

/**
 * <strong>What:</strong> Process exit codes returned by WARDEN commands.
 * <p>An inquiry that is absent (no capability, no open claim, unknown subject) is still a
 * {@link #SUCCESS}; only failures to produce an answer map to other codes.</p>
 *
 * @since 0.1.0
 */
public enum ExitCode {
  /** Command completed, whether or not an inquiry was found. */
  SUCCESS(0),
  /** Command-line arguments were invalid. */
  INVALID_ARGS(2),
  /** A file could not be read. */
  IO_ERROR(3),
  /** Configuration or snapshot content was invalid, or the moderator is unknown. */
  CONFIG_ERROR(4),
  /** A data source failed while the inquiry was assembled. */
  RUNTIME_FAILURE(5),
  /** Process was interrupted (e.g., SIGINT). */
  INTERRUPTED(130);

  private final int code;

  ExitCode(int code) {
    this.code = code;
  }

  /**
   * Returns the numeric process status.
   *
   * @return exit status
   */
  public int code() {
    return code;
  }
}
