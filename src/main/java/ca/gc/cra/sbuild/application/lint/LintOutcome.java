package ca.gc.cra.sbuild.application.lint;

/**
 * Result of linting one file.
 *
 * @since 0.1.0
 */
public enum LintOutcome {
  PASSED,
  FAILED;

  /** @return whether the file passed */
  public boolean passed() {
    return this == PASSED;
  }
}
