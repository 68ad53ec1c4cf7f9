package ca.gc.cra.sbuild.application.lint;

import ca.gc.cra.sbuild.domain.descriptor.BuildDescriptor;
import ca.gc.cra.sbuild.domain.descriptor.DistroPkg;
import ca.gc.cra.sbuild.domain.descriptor.RawDocument;
import ca.gc.cra.sbuild.domain.descriptor.RawMapping;
import ca.gc.cra.sbuild.domain.diagnostic.Diagnostic;
import ca.gc.cra.sbuild.domain.diagnostic.DiagnosticStore;
import ca.gc.cra.sbuild.domain.diagnostic.Severity;
import ca.gc.cra.sbuild.validation.Categories;
import ca.gc.cra.sbuild.validation.PackageTypes;
import ca.gc.cra.sbuild.validation.Strings;
import ca.gc.cra.sbuild.validation.Urls;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * <strong>What:</strong> Walks a raw descriptor document in source order, collecting diagnostics and
 * building a {@link BuildDescriptor} from the fields that pass their shape checks.
 * <p><strong>Why:</strong> Every problem in a file is reported in one pass instead of stopping at the
 * first one.</p>
 * <p><strong>Thread-safety:</strong> Stateless between calls; each call owns its own store and visited
 * set, so one instance may be shared by concurrent jobs.</p>
 *
 * @since 0.1.0
 */
public final class DocumentValidator {
  private final FieldRegistry registry;

  /** Creates a validator for the SBUILD schema. */
  public DocumentValidator() {
    this(FieldRegistry.SBUILD);
  }

  /**
   * Creates a validator for a custom schema.
   *
   * @param registry known fields
   */
  public DocumentValidator(FieldRegistry registry) {
    this.registry = Objects.requireNonNull(registry, "registry");
  }

  /**
   * Validates a document and decides pass or fail.
   *
   * @param document parsed document
   * @param reporter receives every diagnostic when there is any
   * @return the validated descriptor
   * @throws DescriptorValidationException when at least one error diagnostic was recorded
   */
  public BuildDescriptor validate(RawDocument document, DiagnosticReporter reporter)
      throws DescriptorValidationException {
    Objects.requireNonNull(reporter, "reporter");
    ValidationReport report = inspect(document);
    for (Diagnostic diagnostic : report.diagnostics()) {
      reporter.report(diagnostic, document.source());
    }
    if (!report.passed()) {
      throw new DescriptorValidationException(
          report.errorCount(), report.warningCount(), report.diagnostics());
    }
    if (report.warningCount() > 0) {
      reporter.summary(report.warningCount() + " warning(s) found during deserialization");
    }
    return report.descriptor();
  }

  /**
   * Walks a document without deciding or reporting.
   *
   * @param document parsed document
   * @return descriptor candidate and diagnostics
   */
  public ValidationReport inspect(RawDocument document) {
    Objects.requireNonNull(document, "document");
    DiagnosticStore store = new DiagnosticStore();
    SourceLines lines = new SourceLines(document.source());
    Set<String> visited = new HashSet<>();
    Map<String, Object> fields = new LinkedHashMap<>();

    for (RawMapping.Entry entry : document.fields().entries()) {
      String key = entry.key();
      int line = lines.next(key);
      if (visited.contains(key)) {
        store.record(key, "'" + key + "' field is duplicated", line, Severity.ERROR);
        continue;
      }
      Optional<FieldValidator> validator = registry.find(key);
      if (validator.isEmpty()) {
        store.record(key, "'" + key + "' is not a valid field.", line, Severity.WARN);
        continue;
      }
      visited.add(key);
      Optional<Object> value = validator.get().validate(entry.value(), store, line);
      if (value.isPresent()) {
        postCheck(key, value.get(), line, store);
        fields.put(key, value.get());
      }
    }

    for (FieldValidator required : registry.required()) {
      if (!visited.contains(required.name())) {
        store.record(required.name(), "Missing required field: " + required.name(), 0, Severity.ERROR);
      }
    }
    return new ValidationReport(
        new BuildDescriptor(fields), store.diagnostics(), store.errorCount(), store.warningCount());
  }

  private static void postCheck(String key, Object value, int line, DiagnosticStore store) {
    switch (key) {
      case "distro_pkg" -> new DuplicateChecker(store).checkDistroPkgDuplicates((DistroPkg) value, "", line);
      case "pkg", "pkg_id", "app_id" -> {
        String text = (String) value;
        if (!Strings.isPackageIdentifier(text)) {
          store.record(key, "Invalid '" + key + "': '" + text
              + "'. Value should only contain alphanumeric, +, -, _, .", line, Severity.ERROR);
        }
      }
      case "category" -> {
        for (String category : textItems(value)) {
          if (!Categories.isKnown(category)) {
            store.record(key, "Invalid '" + key + "': '" + category + "' is not a valid category.", line,
                Severity.ERROR);
          }
        }
      }
      case "pkg_type" -> {
        String type = (String) value;
        if (!PackageTypes.isKnown(type)) {
          store.record(key, "Invalid '" + key + "': '" + type + "'. Valid values are: "
              + PackageTypes.VALID, line, Severity.ERROR);
        }
      }
      case "homepage", "src_url" -> {
        for (String url : textItems(value)) {
          if (!Urls.isValid(url)) {
            store.record(key, "Invalid '" + key + "': '" + url + "' is not a valid URL.", line,
                Severity.ERROR);
          }
        }
      }
      default -> {
        // shape check is sufficient
      }
    }
  }

  @SuppressWarnings("unchecked")
  private static List<String> textItems(Object value) {
    return (List<String>) value;
  }
}
