package ca.gc.cra.sbuild.infrastructure.shell;

import ca.gc.cra.sbuild.application.port.ShellCheckPort;
import ca.gc.cra.sbuild.infrastructure.exec.ProcessRunner;
import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Runs the {@code shellcheck} binary over an {@code x_exec.run} script.
 * <p>The script is written to a temporary file behind a shebang for the declared shell; when the
 * shell is one shellcheck knows, it is also passed as {@code --shell}. Any non-zero exit counts as a
 * failure and the tool output is returned with the temporary file name replaced by
 * {@code x_exec.run}.</p>
 *
 * @since 0.1.0
 */
public final class ShellcheckProcessAdapter implements ShellCheckPort {
  private static final Logger log = LoggerFactory.getLogger(ShellcheckProcessAdapter.class);

  static final String PROGRAM = "shellcheck";

  private final ProcessRunner runner;
  private final String program;

  /** Creates an adapter invoking {@code shellcheck} from {@code PATH}. */
  public ShellcheckProcessAdapter() {
    this(new ProcessRunner(), PROGRAM);
  }

  ShellcheckProcessAdapter(ProcessRunner runner, String program) {
    this.runner = Objects.requireNonNull(runner, "runner");
    this.program = Objects.requireNonNull(program, "program");
  }

  @Override
  public Result check(String shell, String script) throws IOException, InterruptedException {
    Objects.requireNonNull(script, "script");
    Path file = Files.createTempFile("x_exec-", ".sh");
    try {
      Optional<ShellDialect> dialect = ShellDialect.resolve(shell);
      String interpreter = dialect.map(ShellDialect::command).orElse("sh");
      Files.writeString(file, "#!/usr/bin/env " + interpreter + "\n" + script, StandardCharsets.UTF_8);

      List<String> command = new ArrayList<>();
      command.add(program);
      dialect.ifPresent(d -> command.add("--shell=" + d.command()));
      command.add(file.toString());

      ProcessRunner.Result result = runner.run(command, null);
      if (result.succeeded()) {
        return Result.clean();
      }
      log.debug("{} exited with {}", program, result.exitCode());
      String output = (result.stdout() + result.stderr()).replace(file.toString(), "x_exec.run");
      return new Result(false, output);
    } finally {
      Files.deleteIfExists(file);
    }
  }

  /**
   * Reports whether {@code shellcheck} can be found on {@code PATH}.
   *
   * @return {@code true} when an executable named {@code shellcheck} exists on the search path
   */
  public static boolean isAvailable() {
    return onPath(PROGRAM, System.getenv("PATH"));
  }

  static boolean onPath(String program, String searchPath) {
    if (searchPath == null || searchPath.isBlank()) {
      return false;
    }
    for (String dir : searchPath.split(File.pathSeparator)) {
      if (dir.isBlank()) {
        continue;
      }
      Path candidate = Path.of(dir, program);
      if (Files.isRegularFile(candidate) && Files.isExecutable(candidate)) {
        return true;
      }
    }
    return false;
  }
}
