package ca.gc.cra.sbuild.application.port;

import java.io.IOException;
import java.util.Objects;

/**
 * <strong>What:</strong> Port for static analysis of the build script embedded in {@code x_exec.run}.
 * <p><strong>Thread-safety:</strong> Implementations must tolerate concurrent calls from lint workers.</p>
 *
 * @since 0.1.0
 */
public interface ShellCheckPort {
  /**
   * Analyzes a script fragment.
   *
   * @param shell interpreter declared in {@code x_exec.shell}
   * @param script script body
   * @return analysis verdict and tool output
   * @throws IOException when the analyzer cannot be started
   * @throws InterruptedException when the calling job is cancelled
   */
  Result check(String shell, String script) throws IOException, InterruptedException;

  /**
   * Analyzer that accepts every script; used when static analysis is disabled.
   */
  ShellCheckPort DISABLED = (shell, script) -> Result.clean();

  /**
   * Analysis verdict.
   *
   * @param passed {@code true} when no findings blocked the script
   * @param output analyzer output, possibly empty
   */
  record Result(boolean passed, String output) {
    /**
     * Normalizes the output.
     */
    public Result {
      output = Objects.requireNonNullElse(output, "");
    }

    /**
     * Returns a passing verdict without output.
     *
     * @return clean result
     */
    public static Result clean() {
      return new Result(true, "");
    }
  }
}
