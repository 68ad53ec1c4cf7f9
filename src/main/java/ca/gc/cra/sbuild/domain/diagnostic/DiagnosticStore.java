package ca.gc.cra.sbuild.domain.diagnostic;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * <strong>What:</strong> Field-keyed collection of diagnostics for one validation pass.
 * <p><strong>Merge rule:</strong> at most one diagnostic exists per field. Recording a field that is
 * already present refreshes its line only; the first message and severity are kept. New fields are
 * appended in first-occurrence order. Entries are never removed.</p>
 * <p><strong>Thread-safety:</strong> Not thread-safe; owned by a single document walk.</p>
 *
 * @since 0.1.0
 */
public final class DiagnosticStore implements DiagnosticSink {
  private final Map<String, Diagnostic> byField = new LinkedHashMap<>();

  @Override
  public void record(String field, String message, int line, Severity severity) {
    Objects.requireNonNull(field, "field");
    Diagnostic existing = byField.get(field);
    if (existing != null) {
      byField.put(field, existing.withLine(line));
      return;
    }
    byField.put(field, new Diagnostic(field, message, line, severity));
  }

  /**
   * Reports whether any stored diagnostic blocks success.
   *
   * @return {@code true} when at least one {@link Severity#ERROR} diagnostic exists
   */
  public boolean hasFatal() {
    for (Diagnostic diagnostic : byField.values()) {
      if (diagnostic.severity().isFatal()) {
        return true;
      }
    }
    return false;
  }

  /**
   * Counts blocking diagnostics.
   *
   * @return number of {@link Severity#ERROR} entries
   */
  public int errorCount() {
    return count(Severity.ERROR);
  }

  /**
   * Counts informational diagnostics.
   *
   * @return number of {@link Severity#WARN} entries
   */
  public int warningCount() {
    return count(Severity.WARN);
  }

  /**
   * Indicates whether nothing was recorded.
   *
   * @return {@code true} when the store holds no diagnostics
   */
  public boolean isEmpty() {
    return byField.isEmpty();
  }

  /**
   * Returns the diagnostic stored for a field, if any.
   *
   * @param field field name or dotted path
   * @return stored diagnostic or {@code null}
   */
  public Diagnostic get(String field) {
    return byField.get(field);
  }

  /**
   * Returns a snapshot of all diagnostics in discovery order.
   *
   * @return immutable list of diagnostics
   */
  public List<Diagnostic> diagnostics() {
    return List.copyOf(byField.values());
  }

  private int count(Severity severity) {
    int count = 0;
    for (Diagnostic diagnostic : byField.values()) {
      if (diagnostic.severity() == severity) {
        count++;
      }
    }
    return count;
  }
}
