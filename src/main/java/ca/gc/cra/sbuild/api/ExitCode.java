package ca.gc.cra.sbuild.api;

/**
 * Process exit statuses returned by the CLI.
 */
public enum ExitCode {
  SUCCESS(0),
  VALIDATION_FAILED(1),
  INVALID_ARGS(2),
  IO_ERROR(3),
  CONFIG_ERROR(4),
  RUNTIME_FAILURE(5),
  INTERRUPTED(130);

  private final int code;

  ExitCode(int code) {
    this.code = code;
  }

  /** @return process exit status */
  public int code() {
    return code;
  }
}
