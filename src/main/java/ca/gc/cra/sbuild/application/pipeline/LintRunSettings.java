package ca.gc.cra.sbuild.application.pipeline;

import java.time.Duration;
import java.util.Objects;
import java.util.Optional;

/**
 * Concurrency settings for one run.
 *
 * @param parallelism maximum jobs in flight; 1 runs files one after another
 * @param parallelMode whether per-file output is suppressed
 * @param jobTimeout per-file budget, when set
 * @since 0.1.0
 */
public record LintRunSettings(int parallelism, boolean parallelMode, Optional<Duration> jobTimeout) {
  /** One file at a time, full output, no time budget. */
  public static final LintRunSettings SEQUENTIAL = new LintRunSettings(1, false, Optional.empty());

  public LintRunSettings {
    if (parallelism < 1) {
      throw new IllegalArgumentException("parallelism must be >= 1");
    }
    jobTimeout = Objects.requireNonNullElse(jobTimeout, Optional.empty());
  }
}
