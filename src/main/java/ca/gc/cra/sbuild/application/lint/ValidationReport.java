package ca.gc.cra.sbuild.application.lint;

import ca.gc.cra.sbuild.domain.descriptor.BuildDescriptor;
import ca.gc.cra.sbuild.domain.diagnostic.Diagnostic;
import java.util.List;
import java.util.Objects;

/**
 * Outcome of one document walk before the pass/fail decision.
 *
 * @param descriptor fields that passed their shape checks
 * @param diagnostics diagnostics in discovery order
 * @param errorCount number of error diagnostics
 * @param warningCount number of warning diagnostics
 * @since 0.1.0
 */
public record ValidationReport(
    BuildDescriptor descriptor, List<Diagnostic> diagnostics, int errorCount, int warningCount) {

  public ValidationReport {
    Objects.requireNonNull(descriptor, "descriptor");
    diagnostics = List.copyOf(diagnostics);
  }

  /** @return whether no error diagnostic was recorded */
  public boolean passed() {
    return errorCount == 0;
  }
}
