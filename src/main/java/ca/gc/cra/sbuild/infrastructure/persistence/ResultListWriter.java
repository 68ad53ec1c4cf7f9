package ca.gc.cra.sbuild.infrastructure.persistence;

import ca.gc.cra.sbuild.application.port.ResultListPort;
import ca.gc.cra.sbuild.validation.Paths;
import java.io.BufferedWriter;
import java.io.Closeable;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Append-only list of file paths, one per line.
 * <p>Lines are flushed as they are written so a killed run still leaves a usable list. Write failures
 * are logged and do not fail the lint job that produced them.</p>
 * <p><strong>Thread-safety:</strong> {@link #append(Path)} is synchronized; workers share one
 * instance.</p>
 *
 * @since 0.1.0
 */
public final class ResultListWriter implements ResultListPort, Closeable {
  private static final Logger log = LoggerFactory.getLogger(ResultListWriter.class);

  private final Path target;
  private final BufferedWriter writer;

  private ResultListWriter(Path target, BufferedWriter writer) {
    this.target = target;
    this.writer = writer;
  }

  /**
   * Opens a list file for appending, creating it when missing.
   *
   * @param target list file
   * @return open writer
   * @throws IOException if the file cannot be opened
   * @throws IllegalArgumentException if the path is a directory or its parent directory is missing
   */
  public static ResultListWriter open(Path target) throws IOException {
    Path validated = Paths.validateAppendableFile(Objects.requireNonNull(target, "target"));
    BufferedWriter writer = Files.newBufferedWriter(
        validated,
        StandardCharsets.UTF_8,
        StandardOpenOption.CREATE,
        StandardOpenOption.APPEND,
        StandardOpenOption.WRITE);
    return new ResultListWriter(validated, writer);
  }

  @Override
  public synchronized void append(Path file) {
    try {
      writer.write(file.toString());
      writer.newLine();
      writer.flush();
    } catch (IOException ex) {
      log.warn("Failed to append {} to {}", file, target, ex);
    }
  }

  /** @return the list file being appended to */
  public Path target() {
    return target;
  }

  @Override
  public synchronized void close() throws IOException {
    writer.close();
  }
}
