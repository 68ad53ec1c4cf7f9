package ca.gc.cra.sbuild.application.port;

/**
 * <strong>What:</strong> Send-only handle for user-facing lint output.
 * <p><strong>Role:</strong> Lint jobs write through this port; the log aggregator serializes the
 * messages of all concurrently running jobs onto the console.</p>
 * <p><strong>Thread-safety:</strong> Implementations must accept calls from any thread without blocking
 * on console I/O.</p>
 *
 * @since 0.1.0
 */
public interface LintLogger {
  /**
   * Plain progress line.
   *
   * @param message text
   */
  void info(String message);

  /**
   * Success line.
   *
   * @param message text
   */
  void success(String message);

  /**
   * Non-blocking problem.
   *
   * @param message text
   */
  void warn(String message);

  /**
   * Blocking problem.
   *
   * @param message text
   */
  void error(String message);

  /**
   * Unprefixed error-stream line, used for source excerpts and tool output.
   *
   * @param message text
   */
  void raw(String message);
}
