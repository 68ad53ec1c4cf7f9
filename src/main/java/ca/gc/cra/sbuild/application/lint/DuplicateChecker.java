package ca.gc.cra.sbuild.application.lint;

import ca.gc.cra.sbuild.domain.descriptor.DistroPkg;
import ca.gc.cra.sbuild.domain.diagnostic.DiagnosticSink;
import ca.gc.cra.sbuild.domain.diagnostic.Severity;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * <strong>What:</strong> Detects repeated values in flat lists and repeated paths in the nested
 * {@code distro_pkg} tree.
 * <p>Nested paths are compared by their dotted form ({@code debian.bookworm}), so a key repeated at the
 * same nesting level is reported once and its second occurrence is not descended into.</p>
 * <p><strong>Thread-safety:</strong> Not thread-safe; create one per document walk.</p>
 *
 * @since 0.1.0
 */
public final class DuplicateChecker {
  private final DiagnosticSink sink;

  /**
   * Creates a checker reporting into the given sink.
   *
   * @param sink receiver for duplicate diagnostics
   */
  public DuplicateChecker(DiagnosticSink sink) {
    this.sink = Objects.requireNonNull(sink, "sink");
  }

  /**
   * Reports every element that repeats an earlier element of the list.
   *
   * @param values list to scan
   * @param fieldPath field name or dotted path used as diagnostic key
   * @param line source line reported for each duplicate
   * @param <T> element type compared by {@link Object#equals(Object)}
   */
  public <T> void checkDuplicateValues(List<T> values, String fieldPath, int line) {
    Set<T> seen = new HashSet<>();
    for (T value : values) {
      if (!seen.add(value)) {
        sink.record(
            fieldPath,
            "Duplicate value '" + value + "' found in " + fieldPath,
            line,
            Severity.ERROR);
      }
    }
  }

  /**
   * Walks a {@code distro_pkg} tree reporting repeated paths and repeated package names.
   *
   * @param node tree root
   * @param fieldPath path prefix; empty at the root
   * @param line source line of the {@code distro_pkg} key
   */
  public void checkDistroPkgDuplicates(DistroPkg node, String fieldPath, int line) {
    walk(node, fieldPath, line, new HashSet<>());
  }

  private void walk(DistroPkg node, String fieldPath, int line, Set<String> visited) {
    if (node instanceof DistroPkg.PackageList list) {
      checkDuplicateValues(list.packages(), fieldPath, line);
      return;
    }
    DistroPkg.InnerNode inner = (DistroPkg.InnerNode) node;
    for (DistroPkg.Child child : inner.children()) {
      String path = fieldPath.isEmpty() ? child.key() : fieldPath + '.' + child.key();
      if (!visited.add(path)) {
        sink.record(path, "'" + path + "' field is duplicated", line, Severity.ERROR);
        continue;
      }
      if (child.value() instanceof DistroPkg.PackageList list) {
        checkDuplicateValues(list.packages(), path, line);
      } else {
        walk(child.value(), path, line, visited);
      }
    }
  }
}
