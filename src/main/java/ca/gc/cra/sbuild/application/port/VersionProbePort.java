package ca.gc.cra.sbuild.application.port;

import java.io.IOException;
import java.time.Duration;
import java.util.Optional;

/**
 * <strong>What:</strong> Port resolving the upstream version by running the {@code x_exec.pkgver}
 * fragment.
 * <p><strong>Concurrency:</strong> Implementations must honour thread interruption so a timed-out lint job
 * can be cancelled.</p>
 *
 * @since 0.1.0
 */
public interface VersionProbePort {
  /**
   * Runs the version fragment.
   *
   * @param shell interpreter declared in {@code x_exec.shell}
   * @param script version fragment
   * @param timeout upper bound for the probe
   * @return first non-blank output line, or empty when the probe failed or printed nothing
   * @throws IOException when the interpreter cannot be started
   * @throws InterruptedException when the calling job is cancelled
   */
  Optional<String> probe(String shell, String script, Duration timeout)
      throws IOException, InterruptedException;
}
