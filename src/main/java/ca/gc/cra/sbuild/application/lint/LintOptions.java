package ca.gc.cra.sbuild.application.lint;

import java.time.Duration;
import java.util.Objects;

/**
 * Per-file behaviour switches.
 *
 * @param checkVersion run {@code x_exec.pkgver} and write {@code <file>.pkgver}
 * @param inPlace overwrite the original file with the validated descriptor
 * @param probeTimeout budget handed to the version probe
 * @since 0.1.0
 */
public record LintOptions(boolean checkVersion, boolean inPlace, Duration probeTimeout) {
  /** Plain validation with {@code <file>.validated} output. */
  public static final LintOptions DEFAULTS = new LintOptions(false, false, Duration.ofSeconds(30));

  public LintOptions {
    Objects.requireNonNull(probeTimeout, "probeTimeout");
    if (probeTimeout.isNegative() || probeTimeout.isZero()) {
      throw new IllegalArgumentException("probeTimeout must be positive");
    }
  }
}
