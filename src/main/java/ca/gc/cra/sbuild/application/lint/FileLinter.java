package ca.gc.cra.sbuild.application.lint;

import ca.gc.cra.sbuild.application.port.LintLogger;
import java.nio.file.Path;

/**
 * Lints a single descriptor file. Implementations report every problem through the supplied logger and
 * never throw for content problems.
 *
 * @since 0.1.0
 */
@FunctionalInterface
public interface FileLinter {
  /**
   * Lints one file.
   *
   * @param file descriptor path
   * @param logger per-run output handle
   * @return pass or fail
   * @throws InterruptedException if the job is cancelled while waiting on an external process
   */
  LintOutcome lint(Path file, LintLogger logger) throws InterruptedException;
}
