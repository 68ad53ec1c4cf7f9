package ca.gc.cra.sbuild.application.lint;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.sbuild.application.port.DescriptorFormatException;
import ca.gc.cra.sbuild.domain.descriptor.BuildDescriptor;
import ca.gc.cra.sbuild.domain.descriptor.RawDocument;
import ca.gc.cra.sbuild.domain.diagnostic.Diagnostic;
import ca.gc.cra.sbuild.domain.diagnostic.Severity;
import ca.gc.cra.sbuild.infrastructure.yaml.YamlDescriptorCodec;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.Test;

class DocumentValidatorTest {
  static final String VALID = String.join("\n",
      "#!/SBUILD",
      "_disabled: false",
      "pkg: demo",
      "description: \"Demo\"",
      "src_url:",
      "  - https://github.com/demo/demo",
      "x_exec:",
      "  shell: sh",
      "  run: echo hi",
      "");

  private final YamlDescriptorCodec codec = new YamlDescriptorCodec();
  private final DocumentValidator validator = new DocumentValidator();

  @Test
  void validDocumentPassesWithoutDiagnostics() throws Exception {
    RecordingLintLogger logger = new RecordingLintLogger();

    BuildDescriptor descriptor = validator.validate(parse(VALID), new ExcerptReporter(logger));

    assertEquals(Optional.of("demo"), descriptor.string("pkg"));
    assertEquals(Boolean.FALSE, descriptor.get("_disabled"));
    assertEquals("echo hi", descriptor.execSpec().orElseThrow().run());
    assertTrue(logger.lines().isEmpty());
  }

  @Test
  void duplicatedFieldIsOneErrorAtSecondOccurrence() throws Exception {
    String source = VALID + "pkg: demo2\n";

    ValidationReport report = validator.inspect(parse(source));

    assertFalse(report.passed());
    assertEquals(1, report.errorCount());
    Diagnostic diagnostic = report.diagnostics().get(0);
    assertEquals("pkg", diagnostic.field());
    assertEquals("'pkg' field is duplicated", diagnostic.message());
    assertEquals(10, diagnostic.line());
    assertEquals("demo", report.descriptor().string("pkg").orElseThrow());
  }

  @Test
  void duplicateFailsValidationWithAggregateSummary() throws Exception {
    RecordingLintLogger logger = new RecordingLintLogger();
    RawDocument document = parse(VALID + "pkg: demo2\n");

    DescriptorValidationException ex = assertThrows(DescriptorValidationException.class,
        () -> validator.validate(document, new ExcerptReporter(logger)));

    assertEquals("1 error(s) found during deserialization.", ex.getMessage());
    assertEquals("ERROR pkg -> 'pkg' field is duplicated", logger.lines().get(0));
    assertTrue(logger.contains("RAW > 10 | pkg: demo2"));
  }

  @Test
  void invalidCategoryIsAnError() throws Exception {
    String source = VALID + "category:\n  - Utility\n  - Bogus\n";

    ValidationReport report = validator.inspect(parse(source));

    assertFalse(report.passed());
    Diagnostic diagnostic = single(report, "category");
    assertEquals("Invalid 'category': 'Bogus' is not a valid category.", diagnostic.message());
    assertEquals(10, diagnostic.line());
    assertEquals(Severity.ERROR, diagnostic.severity());
  }

  @Test
  void unknownFieldWarnsButPasses() throws Exception {
    RecordingLintLogger logger = new RecordingLintLogger();

    BuildDescriptor descriptor = validator.validate(parse(VALID + "foobar: 1\n"), new ExcerptReporter(logger));

    assertFalse(descriptor.contains("foobar"));
    assertEquals("WARN foobar -> 'foobar' is not a valid field.", logger.lines().get(0));
    assertEquals("WARN 1 warning(s) found during deserialization", logger.lines().get(logger.lines().size() - 1));
  }

  @Test
  void missingRequiredFieldIsReportedOnceWithoutLocation() throws Exception {
    String source = VALID.replace("pkg: demo\n", "");

    ValidationReport report = validator.inspect(parse(source));

    assertFalse(report.passed());
    assertEquals(1, report.diagnostics().size());
    Diagnostic diagnostic = report.diagnostics().get(0);
    assertEquals("Missing required field: pkg", diagnostic.message());
    assertEquals(0, diagnostic.line());
  }

  @Test
  void onlyUnknownFieldsPassWhenNothingIsRequired() throws Exception {
    FieldRegistry registry = new FieldRegistry(List.of(
        new FieldValidator("name", false, (field, raw, sink, line, required) -> Optional.of(raw))));
    RawDocument document = parse("alpha: 1\nbeta: two\n");

    ValidationReport report = new DocumentValidator(registry).inspect(document);

    assertTrue(report.passed());
    assertEquals(2, report.warningCount());
    assertTrue(report.diagnostics().stream().allMatch(d -> d.severity() == Severity.WARN));
  }

  @Test
  void repeatedRunsAreIdentical() throws Exception {
    RawDocument document = parse(VALID + "pkg: again\nfoobar: x\ncategory: [Bogus]\n");

    ValidationReport first = validator.inspect(document);
    ValidationReport second = validator.inspect(document);

    assertEquals(first.diagnostics(), second.diagnostics());
    assertEquals(first.descriptor(), second.descriptor());
  }

  @Test
  void semanticChecksCoverIdentifiersTypesAndUrls() throws Exception {
    String source = VALID.replace("pkg: demo", "pkg: \"demo pkg\"")
        + "pkg_type: tarball\n"
        + "homepage:\n  - not a url\n";

    ValidationReport report = validator.inspect(parse(source));

    assertEquals("Invalid 'pkg': 'demo pkg'. Value should only contain alphanumeric, +, -, _, .",
        single(report, "pkg").message());
    assertTrue(single(report, "pkg_type").message().startsWith("Invalid 'pkg_type': 'tarball'. Valid values are: ["));
    assertEquals("Invalid 'homepage': 'not a url' is not a valid URL.", single(report, "homepage").message());
    assertEquals(3, report.errorCount());
  }

  @Test
  void shapeProblemSeverityFollowsRequiredness() throws Exception {
    String source = VALID.replace("_disabled: false", "_disabled: maybe") + "tag: just-a-string\n";

    ValidationReport report = validator.inspect(parse(source));

    assertEquals(Severity.ERROR, single(report, "_disabled").severity());
    assertEquals("'_disabled' must be a boolean (true or false)", single(report, "_disabled").message());
    assertEquals(Severity.WARN, single(report, "tag").severity());
    assertFalse(report.descriptor().contains("tag"));
  }

  @Test
  void execBlockReportsMissingRunAndUnknownKeys() throws Exception {
    String source = VALID.replace("  run: echo hi\n", "  entrypoint: demo\n");

    ValidationReport report = validator.inspect(parse(source));

    assertEquals("Missing required field: x_exec.run", single(report, "x_exec.run").message());
    assertEquals(7, single(report, "x_exec.run").line());
    assertEquals(Severity.WARN, single(report, "x_exec.entrypoint").severity());
    assertFalse(report.descriptor().contains("x_exec"));
  }

  @Test
  void distroPkgDuplicatesAreStructuralErrors() throws Exception {
    String source = VALID + String.join("\n",
        "distro_pkg:",
        "  alpine:",
        "    - curl",
        "    - curl",
        "  debian:",
        "    bookworm:",
        "      - curl",
        "");

    ValidationReport report = validator.inspect(parse(source));

    assertEquals("Duplicate value 'curl' found in alpine", single(report, "alpine").message());
    assertEquals(10, single(report, "alpine").line());
    assertEquals(1, report.errorCount());
    assertEquals(Map.of("alpine", List.of("curl", "curl"), "debian", Map.of("bookworm", List.of("curl"))),
        report.descriptor().toPlainMap().get("distro_pkg"));
  }

  private RawDocument parse(String source) throws DescriptorFormatException {
    return codec.parse(source);
  }

  private static Diagnostic single(ValidationReport report, String field) {
    List<Diagnostic> matches = report.diagnostics().stream().filter(d -> d.field().equals(field)).toList();
    assertEquals(1, matches.size(), "diagnostics for " + field + ": " + report.diagnostics());
    return matches.get(0);
  }
}
