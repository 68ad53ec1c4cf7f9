package ca.gc.cra.sbuild.domain.descriptor;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * <strong>What:</strong> Validated SBUILD descriptor, keyed by field name in source order.
 * <p><strong>Role:</strong> Result of a successful descriptor walk; only fields accepted by the field
 * registry are present. A field that failed shape checks on an otherwise passing document is absent.</p>
 * <p><strong>Thread-safety:</strong> Immutable once constructed.</p>
 *
 * @since 0.1.0
 */
public final class BuildDescriptor {
  /** Field carrying the build/execution block. */
  public static final String X_EXEC = "x_exec";

  private final Map<String, Object> fields;

  /**
   * Creates a descriptor from validated values.
   *
   * @param fields validated values in source order; copied
   */
  public BuildDescriptor(Map<String, Object> fields) {
    Objects.requireNonNull(fields, "fields");
    this.fields = Collections.unmodifiableMap(new LinkedHashMap<>(fields));
  }

  /**
   * Returns all validated fields in source order.
   *
   * @return unmodifiable ordered map
   */
  public Map<String, Object> fields() {
    return fields;
  }

  /**
   * Returns the validated value of a field.
   *
   * @param name field name
   * @return value, or {@code null} when the field is absent
   */
  public Object get(String name) {
    return fields.get(name);
  }

  /**
   * Reports whether a field was accepted.
   *
   * @param name field name
   * @return {@code true} when present
   */
  public boolean contains(String name) {
    return fields.containsKey(name);
  }

  /**
   * Returns a string-valued field.
   *
   * @param name field name
   * @return value when present and textual
   */
  public Optional<String> string(String name) {
    Object value = fields.get(name);
    return value instanceof String text ? Optional.of(text) : Optional.empty();
  }

  /**
   * Returns a list-of-strings field.
   *
   * @param name field name
   * @return values, or an empty list when absent or not a list
   */
  public List<String> stringList(String name) {
    Object value = fields.get(name);
    if (!(value instanceof List<?> list)) {
      return List.of();
    }
    List<String> values = new ArrayList<>(list.size());
    for (Object item : list) {
      if (item instanceof String text) {
        values.add(text);
      }
    }
    return List.copyOf(values);
  }

  /**
   * Returns the execution block when present.
   *
   * @return typed view of {@code x_exec}
   */
  public Optional<ExecSpec> execSpec() {
    if (!(fields.get(X_EXEC) instanceof Map<?, ?> exec)) {
      return Optional.empty();
    }
    Object shell = exec.get("shell");
    Object run = exec.get("run");
    if (!(shell instanceof String shellText) || !(run instanceof String runText)) {
      return Optional.empty();
    }
    Object pkgver = exec.get("pkgver");
    List<String> hosts = new ArrayList<>();
    if (exec.get("host") instanceof List<?> hostList) {
      for (Object host : hostList) {
        hosts.add(String.valueOf(host));
      }
    }
    return Optional.of(new ExecSpec(
        shellText,
        runText,
        pkgver instanceof String pkgverText ? Optional.of(pkgverText) : Optional.empty(),
        hosts));
  }

  /**
   * Converts the descriptor into plain collections suitable for YAML serialization.
   *
   * @return mutable ordered map
   */
  public Map<String, Object> toPlainMap() {
    Map<String, Object> plain = new LinkedHashMap<>();
    for (Map.Entry<String, Object> entry : fields.entrySet()) {
      Object value = entry.getValue();
      if (value instanceof DistroPkg distroPkg) {
        plain.put(entry.getKey(), distroPkg.toPlain());
      } else {
        plain.put(entry.getKey(), RawMapping.toPlain(value));
      }
    }
    return plain;
  }

  @Override
  public boolean equals(Object other) {
    if (this == other) {
      return true;
    }
    return other instanceof BuildDescriptor that && fields.equals(that.fields);
  }

  @Override
  public int hashCode() {
    return fields.hashCode();
  }

  @Override
  public String toString() {
    return "BuildDescriptor" + fields.keySet();
  }

  /**
   * Typed view of the {@code x_exec} block.
   *
   * @param shell interpreter name, e.g. {@code bash}
   * @param run build script fragment
   * @param pkgver optional version probe fragment
   * @param hosts host triplets the script supports; empty when unrestricted
   */
  public record ExecSpec(String shell, String run, Optional<String> pkgver, List<String> hosts) {
    /**
     * Validates components.
     */
    public ExecSpec {
      Objects.requireNonNull(shell, "shell");
      Objects.requireNonNull(run, "run");
      pkgver = Objects.requireNonNullElse(pkgver, Optional.empty());
      hosts = List.copyOf(Objects.requireNonNullElse(hosts, List.of()));
    }
  }
}
