package ca.gc.cra.sbuild.infrastructure.exec;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs external commands with output captured to temporary files and an optional time limit. The child
 * is killed when the limit expires or the calling thread is interrupted.
 *
 * @since 0.1.0
 */
public final class ProcessRunner {
  private static final Logger log = LoggerFactory.getLogger(ProcessRunner.class);

  /**
   * Captured result of a finished command.
   *
   * @param exitCode process exit status; -1 when killed on timeout
   * @param stdout captured standard output
   * @param stderr captured standard error
   * @param timedOut whether the time limit expired
   */
  public record Result(int exitCode, String stdout, String stderr, boolean timedOut) {
    /** @return whether the process exited with status 0 in time */
    public boolean succeeded() {
      return !timedOut && exitCode == 0;
    }
  }

  /**
   * Runs a command to completion.
   *
   * @param command program and arguments
   * @param timeout time limit; {@code null} waits indefinitely
   * @return captured result
   * @throws IOException if the process cannot be started or its output cannot be read
   * @throws InterruptedException if interrupted while waiting; the child is killed first
   */
  public Result run(List<String> command, Duration timeout) throws IOException, InterruptedException {
    Objects.requireNonNull(command, "command");
    Path stdout = Files.createTempFile("sbuild-lint-", ".out");
    Path stderr = Files.createTempFile("sbuild-lint-", ".err");
    try {
      Process process = new ProcessBuilder(command)
          .redirectOutput(stdout.toFile())
          .redirectError(stderr.toFile())
          .redirectInput(ProcessBuilder.Redirect.from(nullDevice()))
          .start();
      boolean finished;
      try {
        if (timeout == null) {
          process.waitFor();
          finished = true;
        } else {
          finished = process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS);
        }
      } catch (InterruptedException ex) {
        process.destroyForcibly();
        throw ex;
      }
      if (!finished) {
        log.debug("{} exceeded {} ms; killing", command.get(0), timeout.toMillis());
        process.destroyForcibly().waitFor(5, TimeUnit.SECONDS);
        return new Result(-1, read(stdout), read(stderr), true);
      }
      return new Result(process.exitValue(), read(stdout), read(stderr), false);
    } finally {
      deleteQuietly(stdout);
      deleteQuietly(stderr);
    }
  }

  private static String read(Path file) throws IOException {
    return Files.readString(file, StandardCharsets.UTF_8);
  }

  private static File nullDevice() {
    boolean windows = System.getProperty("os.name", "").toLowerCase(Locale.ROOT).startsWith("windows");
    return new File(windows ? "NUL" : "/dev/null");
  }

  private static void deleteQuietly(Path file) {
    try {
      Files.deleteIfExists(file);
    } catch (IOException ex) {
      log.debug("Unable to delete temporary file {}", file, ex);
    }
  }
}
