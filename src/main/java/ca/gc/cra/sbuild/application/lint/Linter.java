package ca.gc.cra.sbuild.application.lint;

import ca.gc.cra.sbuild.application.port.DescriptorCodec;
import ca.gc.cra.sbuild.application.port.DescriptorFormatException;
import ca.gc.cra.sbuild.application.port.LintLogger;
import ca.gc.cra.sbuild.application.port.ShellCheckPort;
import ca.gc.cra.sbuild.application.port.VersionProbePort;
import ca.gc.cra.sbuild.domain.descriptor.BuildDescriptor;
import ca.gc.cra.sbuild.domain.descriptor.BuildDescriptor.ExecSpec;
import ca.gc.cra.sbuild.domain.descriptor.RawDocument;
import ca.gc.cra.sbuild.logging.Logs;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Lints one descriptor file end to end.
 * <p><strong>Steps:</strong>
 * <ol>
 *   <li>Read the file as UTF-8 and parse it with the {@link DescriptorCodec}.</li>
 *   <li>Validate the document, reporting diagnostics with source excerpts.</li>
 *   <li>Run static analysis on the {@code x_exec.run} script.</li>
 *   <li>In version-check mode, run {@code x_exec.pkgver} and write {@code <file>.pkgver}.</li>
 *   <li>Write the validated descriptor to {@code <file>.validated} or over the original.</li>
 * </ol>
 * <p><strong>Thread-safety:</strong> Thread-safe when its ports are; one instance serves every job.</p>
 *
 * @since 0.1.0
 */
public final class Linter implements FileLinter {
  private static final Logger log = LoggerFactory.getLogger(Linter.class);

  private final DescriptorCodec codec;
  private final DocumentValidator validator;
  private final ShellCheckPort shellCheck;
  private final VersionProbePort versionProbe;
  private final LintOptions options;

  /**
   * Creates a linter.
   *
   * @param codec YAML reader and writer
   * @param validator document validator
   * @param shellCheck static analysis for {@code x_exec.run}; {@link ShellCheckPort#DISABLED} to skip
   * @param versionProbe runner for {@code x_exec.pkgver}
   * @param options per-file switches
   */
  public Linter(
      DescriptorCodec codec,
      DocumentValidator validator,
      ShellCheckPort shellCheck,
      VersionProbePort versionProbe,
      LintOptions options) {
    this.codec = Objects.requireNonNull(codec, "codec");
    this.validator = Objects.requireNonNull(validator, "validator");
    this.shellCheck = Objects.requireNonNull(shellCheck, "shellCheck");
    this.versionProbe = Objects.requireNonNull(versionProbe, "versionProbe");
    this.options = Objects.requireNonNull(options, "options");
  }

  @Override
  public LintOutcome lint(Path file, LintLogger logger) throws InterruptedException {
    Objects.requireNonNull(file, "file");
    Objects.requireNonNull(logger, "logger");

    String source;
    try {
      source = Files.readString(file, StandardCharsets.UTF_8);
    } catch (IOException ex) {
      log.warn("Failed to read {}", file, ex);
      logger.error("Failed to read '" + file + "': " + ex.getMessage());
      return LintOutcome.FAILED;
    }

    RawDocument document;
    try {
      document = codec.parse(source);
    } catch (DescriptorFormatException ex) {
      logger.error("'" + file + "' is not a valid descriptor: " + ex.getMessage());
      return LintOutcome.FAILED;
    }

    BuildDescriptor descriptor;
    try {
      descriptor = validator.validate(document, new ExcerptReporter(logger));
    } catch (DescriptorValidationException ex) {
      logger.error(ex.getMessage());
      return LintOutcome.FAILED;
    }

    Optional<ExecSpec> exec = descriptor.execSpec();
    if (exec.isEmpty()) {
      logger.error("'" + file + "' has no usable x_exec block");
      return LintOutcome.FAILED;
    }

    try {
      if (!runShellCheck(file, exec.get(), logger)) {
        return LintOutcome.FAILED;
      }
      if (options.checkVersion() && !checkVersion(file, exec.get(), logger)) {
        return LintOutcome.FAILED;
      }
      writeValidated(file, descriptor);
    } catch (IOException ex) {
      log.warn("I/O failure while linting {}", file, ex);
      logger.error("'" + file + "': " + ex.getMessage());
      return LintOutcome.FAILED;
    }

    logger.success("'" + file + "' passed validation.");
    return LintOutcome.PASSED;
  }

  private boolean runShellCheck(Path file, ExecSpec exec, LintLogger logger)
      throws IOException, InterruptedException {
    ShellCheckPort.Result result = shellCheck.check(exec.shell(), exec.run());
    if (result.passed()) {
      return true;
    }
    log.debug("shellcheck rejected {}: {}", file, Logs.truncate(result.output(), 512));
    logger.error("shellcheck found problems in x_exec.run of '" + file + "'");
    if (!result.output().isBlank()) {
      logger.raw(result.output().stripTrailing());
    }
    return false;
  }

  private boolean checkVersion(Path file, ExecSpec exec, LintLogger logger)
      throws IOException, InterruptedException {
    if (exec.pkgver().isEmpty()) {
      logger.info("'" + file + "' defines no x_exec.pkgver; skipping version check");
      return true;
    }
    Optional<String> version = versionProbe.probe(exec.shell(), exec.pkgver().get(), options.probeTimeout());
    if (version.isEmpty()) {
      logger.error("x_exec.pkgver of '" + file + "' did not produce a version");
      return false;
    }
    Path target = sibling(file, ".pkgver");
    Files.writeString(target, version.get() + System.lineSeparator(), StandardCharsets.UTF_8);
    logger.info("'" + file + "' version " + version.get() + " written to " + target.getFileName());
    return true;
  }

  private void writeValidated(Path file, BuildDescriptor descriptor) throws IOException {
    Path target = options.inPlace() ? file : sibling(file, ".validated");
    Files.writeString(target, codec.write(descriptor), StandardCharsets.UTF_8);
    log.debug("Wrote validated descriptor to {}", target);
  }

  private static Path sibling(Path file, String suffix) {
    return file.resolveSibling(file.getFileName().toString() + suffix);
  }
}
