package ca.gc.cra.sbuild.application.pipeline;

import java.time.Duration;
import java.util.Locale;
import java.util.Objects;

/**
 * Tallies of one lint run.
 *
 * @param passed files that passed validation
 * @param failed files that failed, including timeouts
 * @param submitted files handed to the run
 * @param elapsed wall-clock duration
 * @since 0.1.0
 */
public record LintSummary(int passed, int failed, int submitted, Duration elapsed) {

  public LintSummary {
    Objects.requireNonNull(elapsed, "elapsed");
  }

  /** @return files with a recorded outcome */
  public int evaluated() {
    return passed + failed;
  }

  /** @return whether every submitted file passed */
  public boolean allPassed() {
    return failed == 0;
  }

  /**
   * Renders the elapsed time the way the run summary prints it.
   *
   * @return e.g. {@code 1.204s} or {@code 2m 3.500s}
   */
  public String elapsedText() {
    long millis = elapsed.toMillis();
    long minutes = millis / 60_000;
    String seconds = String.format(Locale.ROOT, "%d.%03ds", (millis / 1000) % 60, millis % 1000);
    return minutes > 0 ? minutes + "m " + seconds : seconds;
  }
}
