package ca.gc.cra.sbuild.application.lint;

import ca.gc.cra.sbuild.domain.descriptor.DistroPkg;
import ca.gc.cra.sbuild.domain.descriptor.RawMapping;
import ca.gc.cra.sbuild.domain.diagnostic.DiagnosticSink;
import ca.gc.cra.sbuild.domain.diagnostic.Severity;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Shape checks shared by the field registry. Each check returns the plain validated value (String,
 * Boolean, List or LinkedHashMap) or records a diagnostic and returns empty. Shape problems are errors
 * on required fields and warnings on optional ones.
 */
final class ValueShapes {
  private static final Set<String> RESOURCE_KEYS = Set.of("url", "file", "dir");
  private static final Set<String> LICENSE_KEYS = Set.of("id", "file", "url");
  private static final Set<String> ASSET_KEYS = Set.of("url", "out");

  private ValueShapes() {
    // Utility
  }

  static Optional<Object> bool(String field, Object raw, DiagnosticSink sink, int line, boolean required) {
    if (raw instanceof Boolean value) {
      return Optional.of(value);
    }
    return fail(field, "'" + field + "' must be a boolean (true or false)", sink, line, required);
  }

  static Optional<Object> text(String field, Object raw, DiagnosticSink sink, int line, boolean required) {
    if (isText(raw)) {
      return Optional.of(((String) raw).trim());
    }
    return fail(field, "'" + field + "' must be a non-empty string", sink, line, required);
  }

  /** Accepts strings and plain numbers, as in {@code pkgver: 1.2}. */
  static Optional<Object> scalar(String field, Object raw, DiagnosticSink sink, int line, boolean required) {
    if (raw instanceof Number number) {
      return Optional.of(String.valueOf(number));
    }
    return text(field, raw, sink, line, required);
  }

  static Optional<Object> textList(String field, Object raw, DiagnosticSink sink, int line, boolean required) {
    Optional<List<String>> values = strings(raw);
    if (values.isEmpty()) {
      return fail(field, "'" + field + "' must be a non-empty list of strings", sink, line, required);
    }
    new DuplicateChecker(sink).checkDuplicateValues(values.get(), field, line);
    return Optional.of(values.get());
  }

  /** Free-form lines where repeats are allowed. */
  static Optional<Object> lines(String field, Object raw, DiagnosticSink sink, int line, boolean required) {
    Optional<List<String>> values = strings(raw);
    if (values.isEmpty()) {
      return fail(field, "'" + field + "' must be a non-empty list of strings", sink, line, required);
    }
    return Optional.of(values.get());
  }

  /** A single string, or a mapping of locale or topic keys to strings. */
  static Optional<Object> textOrTextMap(
      String field, Object raw, DiagnosticSink sink, int line, boolean required) {
    if (isText(raw)) {
      return Optional.of(((String) raw).trim());
    }
    if (raw instanceof RawMapping mapping && !mapping.isEmpty()) {
      Map<String, Object> values = new LinkedHashMap<>();
      for (RawMapping.Entry entry : mapping.entries()) {
        if (!isText(entry.value())) {
          return fail(field, "'" + field + "." + entry.key() + "' must be a non-empty string", sink, line,
              required);
        }
        values.putIfAbsent(entry.key(), ((String) entry.value()).trim());
      }
      return Optional.of(values);
    }
    return fail(field, "'" + field + "' must be a string or a mapping of strings", sink, line, required);
  }

  /** Exactly one of {@code url}, {@code file} or {@code dir}. */
  static Optional<Object> resource(String field, Object raw, DiagnosticSink sink, int line, boolean required) {
    if (!(raw instanceof RawMapping mapping) || mapping.size() != 1) {
      return fail(field, "'" + field + "' must declare exactly one of url, file or dir", sink, line,
          required);
    }
    RawMapping.Entry entry = mapping.entries().get(0);
    if (!RESOURCE_KEYS.contains(entry.key()) || !isText(entry.value())) {
      return fail(field, "'" + field + "' must declare exactly one of url, file or dir", sink, line,
          required);
    }
    Map<String, Object> value = new LinkedHashMap<>();
    value.put(entry.key(), ((String) entry.value()).trim());
    return Optional.of(value);
  }

  static Optional<Object> assets(String field, Object raw, DiagnosticSink sink, int line, boolean required) {
    if (!(raw instanceof List<?> list) || list.isEmpty()) {
      return fail(field, "'" + field + "' must be a non-empty list of {url, out} entries", sink, line,
          required);
    }
    List<Object> assets = new ArrayList<>(list.size());
    for (Object item : list) {
      if (!(item instanceof RawMapping mapping)
          || !isText(mapping.get("url"))
          || !isText(mapping.get("out"))
          || !ASSET_KEYS.containsAll(mapping.keys())) {
        return fail(field, "'" + field + "' entries must contain exactly url and out", sink, line,
            required);
      }
      assets.add(mapping.toPlainMap());
    }
    return Optional.of(assets);
  }

  /** SPDX identifiers, or entries carrying an {@code id} with optional {@code file} and {@code url}. */
  static Optional<Object> licenses(String field, Object raw, DiagnosticSink sink, int line, boolean required) {
    if (!(raw instanceof List<?> list) || list.isEmpty()) {
      return fail(field, "'" + field + "' must be a non-empty list", sink, line, required);
    }
    List<Object> licenses = new ArrayList<>(list.size());
    List<String> ids = new ArrayList<>(list.size());
    for (Object item : list) {
      if (isText(item)) {
        String id = ((String) item).trim();
        licenses.add(id);
        ids.add(id);
        continue;
      }
      if (item instanceof RawMapping mapping
          && isText(mapping.get("id"))
          && LICENSE_KEYS.containsAll(mapping.keys())
          && optionalText(mapping, "file")
          && optionalText(mapping, "url")) {
        licenses.add(mapping.toPlainMap());
        ids.add(((String) mapping.get("id")).trim());
        continue;
      }
      return fail(field, "'" + field + "' entries must be a string or a mapping with an id", sink, line,
          required);
    }
    new DuplicateChecker(sink).checkDuplicateValues(ids, field, line);
    return Optional.of(licenses);
  }

  /** Nested mapping whose leaves are package name lists. */
  static Optional<Object> distroPkg(String field, Object raw, DiagnosticSink sink, int line, boolean required) {
    Optional<DistroPkg> tree = DistroPkg.parse(raw);
    if (tree.isPresent() && tree.get() instanceof DistroPkg.InnerNode) {
      return Optional.of(tree.get());
    }
    return fail(field, "'" + field + "' must map distribution names to package lists", sink, line,
        required);
  }

  /**
   * The execution block: {@code shell} and {@code run} are required, {@code pkgver} and {@code host}
   * optional. Unknown keys are reported and dropped.
   */
  static Optional<Object> exec(String field, Object raw, DiagnosticSink sink, int line, boolean required) {
    if (!(raw instanceof RawMapping mapping)) {
      return fail(field, "'" + field + "' must be a mapping", sink, line, required);
    }
    Map<String, Object> exec = new LinkedHashMap<>();
    boolean valid = true;
    for (RawMapping.Entry entry : mapping.entries()) {
      String path = field + "." + entry.key();
      if (exec.containsKey(entry.key())) {
        sink.record(path, "'" + path + "' field is duplicated", line, Severity.ERROR);
        valid = false;
        continue;
      }
      switch (entry.key()) {
        case "shell", "run", "pkgver" -> {
          if (isText(entry.value())) {
            exec.put(entry.key(), entry.value());
          } else {
            sink.record(path, "'" + path + "' must be a non-empty string", line,
                "pkgver".equals(entry.key()) ? Severity.WARN : Severity.ERROR);
            valid &= "pkgver".equals(entry.key());
          }
        }
        case "host" -> {
          Optional<List<String>> hosts = strings(entry.value());
          if (hosts.isPresent()) {
            exec.put("host", hosts.get());
          } else {
            sink.record(path, "'" + path + "' must be a non-empty list of strings", line, Severity.WARN);
          }
        }
        default -> sink.record(path, "'" + path + "' is not a valid field.", line, Severity.WARN);
      }
    }
    for (String key : List.of("shell", "run")) {
      if (!exec.containsKey(key)) {
        String path = field + "." + key;
        sink.record(path, "Missing required field: " + path, line, Severity.ERROR);
        valid = false;
      }
    }
    return valid ? Optional.of(exec) : Optional.empty();
  }

  private static Optional<List<String>> strings(Object raw) {
    if (!(raw instanceof List<?> list) || list.isEmpty()) {
      return Optional.empty();
    }
    List<String> values = new ArrayList<>(list.size());
    for (Object item : list) {
      if (!isText(item)) {
        return Optional.empty();
      }
      values.add(((String) item).trim());
    }
    return Optional.of(values);
  }

  private static boolean optionalText(RawMapping mapping, String key) {
    return !mapping.containsKey(key) || isText(mapping.get(key));
  }

  private static boolean isText(Object raw) {
    return raw instanceof String text && !text.isBlank();
  }

  private static Optional<Object> fail(
      String field, String message, DiagnosticSink sink, int line, boolean required) {
    sink.record(field, message, line, required ? Severity.ERROR : Severity.WARN);
    return Optional.empty();
  }
}
