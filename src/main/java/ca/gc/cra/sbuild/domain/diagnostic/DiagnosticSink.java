package ca.gc.cra.sbuild.domain.diagnostic;

/**
 * Receives diagnostics produced while a descriptor is validated.
 *
 * @since 0.1.0
 */
@FunctionalInterface
public interface DiagnosticSink {
  /**
   * Records a problem for a field.
   *
   * @param field field name or dotted path
   * @param message human-readable message
   * @param line 1-based source line, {@code 0} when unknown
   * @param severity blocking or informational classification
   */
  void record(String field, String message, int line, Severity severity);
}
