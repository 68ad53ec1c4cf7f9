package ca.gc.cra.sbuild.application.lint;

import ca.gc.cra.sbuild.application.port.LintLogger;
import java.util.ArrayList;
import java.util.List;

/** Captures lint output as "LEVEL text" lines. */
final class RecordingLintLogger implements LintLogger {
  private final List<String> lines = new ArrayList<>();

  @Override
  public synchronized void info(String message) {
    lines.add("INFO " + message);
  }

  @Override
  public synchronized void success(String message) {
    lines.add("SUCCESS " + message);
  }

  @Override
  public synchronized void warn(String message) {
    lines.add("WARN " + message);
  }

  @Override
  public synchronized void error(String message) {
    lines.add("ERROR " + message);
  }

  @Override
  public synchronized void raw(String message) {
    lines.add("RAW " + message);
  }

  synchronized List<String> lines() {
    return List.copyOf(lines);
  }

  synchronized boolean contains(String line) {
    return lines.contains(line);
  }
}
