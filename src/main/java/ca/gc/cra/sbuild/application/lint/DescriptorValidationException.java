package ca.gc.cra.sbuild.application.lint;

import ca.gc.cra.sbuild.domain.diagnostic.Diagnostic;
import java.util.List;

/**
 * Aggregate failure raised when a descriptor carries at least one error diagnostic.
 *
 * @since 0.1.0
 */
public final class DescriptorValidationException extends Exception {
  private static final long serialVersionUID = 1L;

  private final int errorCount;
  private final int warningCount;
  private final transient List<Diagnostic> diagnostics;

  /**
   * Creates the exception with counts and the full diagnostic set.
   *
   * @param errorCount number of error diagnostics
   * @param warningCount number of warning diagnostics
   * @param diagnostics diagnostics in discovery order
   */
  public DescriptorValidationException(int errorCount, int warningCount, List<Diagnostic> diagnostics) {
    super(summary(errorCount, warningCount));
    this.errorCount = errorCount;
    this.warningCount = warningCount;
    this.diagnostics = List.copyOf(diagnostics);
  }

  /** @return number of error diagnostics in the failed document */
  public int errorCount() {
    return errorCount;
  }

  /** @return number of warning diagnostics in the failed document */
  public int warningCount() {
    return warningCount;
  }

  /** @return every diagnostic in field order */
  public List<Diagnostic> diagnostics() {
    return diagnostics;
  }

  static String summary(int errors, int warnings) {
    StringBuilder sb = new StringBuilder().append(errors).append(" error(s)");
    if (warnings > 0) {
      sb.append(" & ").append(warnings).append(" warning(s)");
    }
    return sb.append(" found during deserialization.").toString();
  }
}
