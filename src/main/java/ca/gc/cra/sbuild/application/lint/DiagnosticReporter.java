package ca.gc.cra.sbuild.application.lint;

import ca.gc.cra.sbuild.domain.diagnostic.Diagnostic;

/**
 * Receives diagnostics once a document walk has been decided.
 *
 * @since 0.1.0
 */
public interface DiagnosticReporter {
  /**
   * Renders one diagnostic.
   *
   * @param diagnostic diagnostic to render
   * @param source full document text, used for excerpts
   */
  void report(Diagnostic diagnostic, String source);

  /**
   * Renders the closing line of a document that passed with warnings.
   *
   * @param message summary text
   */
  void summary(String message);

  /** Reporter that discards everything. */
  DiagnosticReporter SILENT = new DiagnosticReporter() {
    @Override public void report(Diagnostic diagnostic, String source) {}

    @Override public void summary(String message) {}
  };
}
