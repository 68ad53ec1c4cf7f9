package ca.gc.cra.sbuild.domain.diagnostic;

import java.util.Objects;

/**
 * <strong>What:</strong> A single problem found while validating one descriptor field.
 * <p><strong>Role:</strong> Value object accumulated by {@link DiagnosticStore} and rendered by the lint
 * reporter once the walk over a document completes.</p>
 * <p><strong>Thread-safety:</strong> Immutable record.</p>
 *
 * @param field field name or dotted path the diagnostic is keyed on
 * @param message human-readable description of the problem
 * @param line 1-based source line, or {@code 0} when the location is unknown
 * @param severity blocking or informational classification
 * @since 0.1.0
 */
public record Diagnostic(String field, String message, int line, Severity severity) {

  /**
   * Validates components.
   *
   * @throws IllegalArgumentException if {@code line} is negative
   */
  public Diagnostic {
    Objects.requireNonNull(field, "field");
    Objects.requireNonNull(message, "message");
    Objects.requireNonNull(severity, "severity");
    if (line < 0) {
      throw new IllegalArgumentException("line must be >= 0 (was " + line + ")");
    }
  }

  /**
   * Returns a copy of this diagnostic pointing at another source line.
   *
   * @param newLine refreshed 1-based line or {@code 0}
   * @return diagnostic with the same field, message and severity
   */
  public Diagnostic withLine(int newLine) {
    return new Diagnostic(field, message, newLine, severity);
  }

  /**
   * Indicates whether the source location is known.
   *
   * @return {@code true} when {@link #line()} is non-zero
   */
  public boolean hasLocation() {
    return line != 0;
  }
}
