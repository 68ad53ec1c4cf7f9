package ca.gc.cra.sbuild.config;

import ca.gc.cra.sbuild.application.lint.DocumentValidator;
import ca.gc.cra.sbuild.application.lint.FileLinter;
import ca.gc.cra.sbuild.application.lint.Linter;
import ca.gc.cra.sbuild.application.pipeline.LintOrchestrator;
import ca.gc.cra.sbuild.application.port.ConsolePort;
import ca.gc.cra.sbuild.application.port.DescriptorCodec;
import ca.gc.cra.sbuild.application.port.MetricsPort;
import ca.gc.cra.sbuild.application.port.ResultListPort;
import ca.gc.cra.sbuild.application.port.ShellCheckPort;
import ca.gc.cra.sbuild.application.port.VersionProbePort;
import ca.gc.cra.sbuild.infrastructure.metrics.OpenTelemetryMetricsAdapter;
import ca.gc.cra.sbuild.infrastructure.shell.ShellVersionProbe;
import ca.gc.cra.sbuild.infrastructure.shell.ShellcheckProcessAdapter;
import ca.gc.cra.sbuild.infrastructure.yaml.YamlDescriptorCodec;
import java.util.Objects;

/**
 * <strong>What:</strong> Wires the lint use cases to their adapters for one {@link LintConfig}.
 * <p><strong>Thread-safety:</strong> Factory methods allocate new graphs and are not synchronized;
 * call from the CLI thread.</p>
 *
 * @since 0.1.0
 */
public final class CompositionRoot {
  private final LintConfig config;
  private final MetricsPort metrics;

  /**
   * Wires adapters for the given configuration.
   *
   * @param config validated configuration
   */
  public CompositionRoot(LintConfig config) {
    this(config, new OpenTelemetryMetricsAdapter());
  }

  /**
   * Creates a composition root with an explicit metrics sink.
   *
   * @param config effective configuration
   * @param metrics metrics sink shared by every job
   */
  public CompositionRoot(LintConfig config, MetricsPort metrics) {
    this.config = Objects.requireNonNull(config, "config");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
  }

  /** @return the YAML descriptor codec */
  public DescriptorCodec codec() {
    return new YamlDescriptorCodec();
  }

  /**
   * Returns the static analysis port, or {@link ShellCheckPort#DISABLED} when shellcheck is off.
   *
   * @return shellcheck port
   */
  public ShellCheckPort shellCheck() {
    return config.shellcheck() ? new ShellcheckProcessAdapter() : ShellCheckPort.DISABLED;
  }

  /** @return the shell-backed {@code pkgver} probe */
  public VersionProbePort versionProbe() {
    return new ShellVersionProbe();
  }

  /** @return a per-file linter honouring the configured options */
  public FileLinter linter() {
    return new Linter(codec(), new DocumentValidator(), shellCheck(), versionProbe(), config.lintOptions());
  }

  /**
   * Builds the multi-file orchestrator.
   *
   * @param console destination for per-file output
   * @param successList receives passing files
   * @param failList receives failing files
   * @return orchestrator ready to run
   */
  public LintOrchestrator orchestrator(ConsolePort console, ResultListPort successList, ResultListPort failList) {
    return new LintOrchestrator(linter(), config.runSettings(), console, successList, failList, metrics);
  }

  /** @return the metrics sink; {@link MetricsPort#NO_OP} when metrics are disabled */
  public MetricsPort metrics() {
    return metrics;
  }
}
