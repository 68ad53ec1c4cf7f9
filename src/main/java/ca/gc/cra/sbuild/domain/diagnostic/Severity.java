package ca.gc.cra.sbuild.domain.diagnostic;

/**
 * Classification of a lint diagnostic.
 *
 * @since 0.1.0
 */
public enum Severity {
  /** Blocking problem; the descriptor fails validation. */
  ERROR,
  /** Informational problem; reported but the descriptor may still pass. */
  WARN;

  /**
   * Indicates whether a diagnostic of this severity blocks success.
   *
   * @return {@code true} for {@link #ERROR}
   */
  public boolean isFatal() {
    return this == ERROR;
  }
}
