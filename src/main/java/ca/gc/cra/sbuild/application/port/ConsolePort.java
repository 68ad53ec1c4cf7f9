package ca.gc.cra.sbuild.application.port;

/**
 * User-facing line output. Implementations are called from a single thread.
 *
 * @since 0.1.0
 */
public interface ConsolePort {
  /**
   * Writes a line to standard output.
   *
   * @param line text without trailing newline
   */
  void out(String line);

  /**
   * Writes a line to standard error.
   *
   * @param line text without trailing newline
   */
  void err(String line);
}
