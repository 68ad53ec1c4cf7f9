package ca.gc.cra.sbuild.api;

import ca.gc.cra.sbuild.application.pipeline.LintSummary;
import ca.gc.cra.sbuild.application.port.ConsolePort;
import ca.gc.cra.sbuild.application.port.MetricsPort;
import ca.gc.cra.sbuild.application.port.ResultListPort;
import ca.gc.cra.sbuild.config.CompositionRoot;
import ca.gc.cra.sbuild.config.ConfigMerger;
import ca.gc.cra.sbuild.config.LintConfig;
import ca.gc.cra.sbuild.config.YamlConfigLoader;
import ca.gc.cra.sbuild.infrastructure.metrics.OpenTelemetryMetricsAdapter;
import ca.gc.cra.sbuild.infrastructure.persistence.ResultListWriter;
import ca.gc.cra.sbuild.infrastructure.shell.ShellcheckProcessAdapter;
import ca.gc.cra.sbuild.logging.LoggingConfigurator;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.BooleanSupplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Command-line entry point that lints SBUILD descriptor files.
 * <p><strong>Flow:</strong> parse arguments, merge CLI, YAML and defaults into a {@link LintConfig},
 * check that shellcheck is installed unless disabled, run every file through the orchestrator and
 * print the tallies.</p>
 * <p><strong>Exit status:</strong> {@link ExitCode#SUCCESS} when every file passed,
 * {@link ExitCode#VALIDATION_FAILED} when any failed; argument, configuration and I/O problems map to
 * their own codes.</p>
 *
 * @since 0.1.0
 */
public final class LintCli {
  private static final Logger log = LoggerFactory.getLogger(LintCli.class);
  private static final String SUMMARY_USAGE =
      "usage: sbuild-linter [--pkgver] [--no-shellcheck] [--inplace] [parallel=N] [timeout=SECONDS] "
          + "[success=PATH] [fail=PATH] [config=PATH] FILE...";
  private static final String HELP_TEXT = """
      sbuild-linter: validates SBUILD package descriptors

      Usage:
        sbuild-linter [options] FILE...

      Options:
        --pkgver, -p             Run x_exec.pkgver and write <file>.pkgver
        --no-shellcheck          Skip shellcheck on x_exec.run
        --inplace, -i            Replace the original file on success
        parallel=N               Run N jobs in parallel (1-256); --parallel alone uses 4
        timeout=SECONDS          Per-file budget in pkgver mode (default 30)
        success=PATH             Append passing files to PATH
        fail=PATH                Append failing files to PATH
        config=PATH              YAML file with common: and lint: sections
        --verbose                Enable DEBUG logging
        --help, -h               Show this message

      Without --inplace the validated descriptor is written to <file>.validated.
      """;

  private static final String SUMMARY_MARK = "[+] ";

  private LintCli() {}

  static ExitCode run(String[] args) {
    return run(args, ShellcheckProcessAdapter::isAvailable, new OpenTelemetryMetricsAdapter(), CliConsole.INSTANCE);
  }

  static ExitCode run(
      String[] args, BooleanSupplier shellcheckAvailable, MetricsPort metrics, ConsolePort console) {
    CliInput input;
    try {
      input = CliInput.parse(args);
    } catch (IllegalArgumentException ex) {
      log.error("Invalid argument: {}", ex.getMessage());
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }
    if (input.help()) {
      CliPrinter.println(HELP_TEXT.stripTrailing());
      return ExitCode.SUCCESS;
    }
    if (input.verbose()) {
      LoggingConfigurator.enableVerboseLogging();
      log.debug("Verbose logging enabled for sbuild-linter");
    }

    Map<String, String> kv;
    try {
      kv = new LinkedHashMap<>(CliArgsParser.toMap(input.keyValueArgs()));
      ConfigCliUtils.applyFlags(input, kv);
    } catch (IllegalArgumentException ex) {
      log.error("Invalid argument: {}", ex.getMessage());
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }

    String configPath = ConfigCliUtils.extractConfigPath(kv);
    Optional<Map<String, String>> yamlConfig = Optional.empty();
    if (configPath != null) {
      Path yamlPath = Path.of(configPath);
      if (!Files.exists(yamlPath)) {
        log.error("Configuration file does not exist: {}", yamlPath);
        CliPrinter.println(SUMMARY_USAGE);
        return ExitCode.INVALID_ARGS;
      }
      try {
        yamlConfig = YamlConfigLoader.load(yamlPath, YamlConfigLoader.LINT_SECTION);
      } catch (IllegalArgumentException ex) {
        log.error("Invalid YAML configuration: {}", ex.getMessage());
        CliPrinter.println(SUMMARY_USAGE);
        return ExitCode.INVALID_ARGS;
      } catch (IOException ex) {
        log.error("Unable to read configuration file {}", yamlPath, ex);
        return ExitCode.IO_ERROR;
      }
    }

    LintConfig config;
    try {
      Map<String, String> effective = ConfigMerger.buildEffectiveConfig(
          yamlConfig, kv, LintConfig.defaultsAsFlatMap(), log::warn);
      config = LintConfig.fromMap(effective);
    } catch (IllegalArgumentException ex) {
      log.error("Invalid lint arguments: {}", ex.getMessage());
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }

    List<Path> files = input.files();
    if (files.isEmpty()) {
      log.error("No descriptor files given");
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }

    if (config.shellcheck() && !shellcheckAvailable.getAsBoolean()) {
      log.error("shellcheck was not found on PATH; install it or pass --no-shellcheck");
      return ExitCode.CONFIG_ERROR;
    }

    CliPrinter.println("sbuild-linter v" + BuildInfo.version());
    log.info("Linting {} file(s): parallel={}, pkgver={}, shellcheck={}, inplace={}",
        files.size(), config.parallel().map(String::valueOf).orElse("off"),
        config.checkVersion(), config.shellcheck(), config.inPlace());

    ResultListWriter successWriter = null;
    ResultListWriter failWriter = null;
    try {
      successWriter = openList(config.successList());
      failWriter = openList(config.failList());
      ResultListPort success = successWriter == null ? ResultListPort.NONE : successWriter;
      ResultListPort fail = failWriter == null ? ResultListPort.NONE : failWriter;

      CompositionRoot root = new CompositionRoot(config, metrics);
      LintSummary summary = root.orchestrator(console, success, fail).run(files);
      printSummary(summary);
      return summary.allPassed() ? ExitCode.SUCCESS : ExitCode.VALIDATION_FAILED;
    } catch (IllegalArgumentException ex) {
      log.error("Invalid result list path: {}", ex.getMessage());
      return ExitCode.INVALID_ARGS;
    } catch (IOException ex) {
      log.error("Unable to open result list", ex);
      return ExitCode.IO_ERROR;
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      log.error("Lint run interrupted; shutting down", ex);
      return ExitCode.INTERRUPTED;
    } catch (RuntimeException ex) {
      log.error("Unexpected runtime failure in lint run", ex);
      return ExitCode.RUNTIME_FAILURE;
    } finally {
      closeQuietly(successWriter);
      closeQuietly(failWriter);
    }
  }

  private static ResultListWriter openList(Optional<Path> path) throws IOException {
    return path.isPresent() ? ResultListWriter.open(path.get()) : null;
  }

  private static void printSummary(LintSummary summary) {
    CliPrinter.printLines(
        "",
        SUMMARY_MARK + summary.passed() + " files validated successfully",
        SUMMARY_MARK + summary.failed() + " files failed to pass validation",
        SUMMARY_MARK + "Evaluated " + summary.evaluated() + "/" + summary.submitted()
            + " file(s) in " + summary.elapsedText());
  }

  private static void closeQuietly(ResultListWriter writer) {
    if (writer == null) {
      return;
    }
    try {
      writer.close();
    } catch (IOException ex) {
      log.warn("Failed to close result list {}", writer.target(), ex);
    }
  }
}
