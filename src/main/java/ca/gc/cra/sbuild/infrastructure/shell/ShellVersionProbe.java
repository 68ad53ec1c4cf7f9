package ca.gc.cra.sbuild.infrastructure.shell;

import ca.gc.cra.sbuild.application.port.VersionProbePort;
import ca.gc.cra.sbuild.infrastructure.exec.ProcessRunner;
import ca.gc.cra.sbuild.logging.Logs;
import java.io.IOException;
import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs an {@code x_exec.pkgver} script through {@code <shell> -c} and returns the first non-blank
 * line of its output. Unknown shells fall back to {@code sh}. A non-zero exit, a timeout or empty
 * output yield no version.
 *
 * @since 0.1.0
 */
public final class ShellVersionProbe implements VersionProbePort {
  private static final Logger log = LoggerFactory.getLogger(ShellVersionProbe.class);

  private final ProcessRunner runner;

  /** Creates a probe backed by a fresh {@link ProcessRunner}. */
  public ShellVersionProbe() {
    this(new ProcessRunner());
  }

  ShellVersionProbe(ProcessRunner runner) {
    this.runner = Objects.requireNonNull(runner, "runner");
  }

  @Override
  public Optional<String> probe(String shell, String script, Duration timeout)
      throws IOException, InterruptedException {
    Objects.requireNonNull(script, "script");
    String interpreter = ShellDialect.resolve(shell).map(ShellDialect::command).orElse("sh");
    ProcessRunner.Result result = runner.run(List.of(interpreter, "-c", script), timeout);
    if (result.timedOut()) {
      log.warn("pkgver script exceeded {} ms", timeout.toMillis());
      return Optional.empty();
    }
    if (result.exitCode() != 0) {
      log.debug("pkgver script exited with {}: {}", result.exitCode(),
          Logs.truncate(Logs.singleLine(result.stderr()), 256));
      return Optional.empty();
    }
    return firstLine(result.stdout());
  }

  static Optional<String> firstLine(String output) {
    for (String line : output.split("\\R")) {
      if (!line.isBlank()) {
        return Optional.of(line.trim());
      }
    }
    return Optional.empty();
  }
}
