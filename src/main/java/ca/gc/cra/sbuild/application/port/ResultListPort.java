package ca.gc.cra.sbuild.application.port;

import java.nio.file.Path;

/**
 * Append-only list of descriptor paths (the success and fail lists).
 *
 * <p>Implementations must be safe for uncoordinated concurrent appends.</p>
 *
 * @since 0.1.0
 */
@FunctionalInterface
public interface ResultListPort {
  /**
   * Appends one path as a line.
   *
   * @param file descriptor path as given on the command line
   */
  void append(Path file);

  /** List that discards every entry. */
  ResultListPort NONE = file -> {};
}
