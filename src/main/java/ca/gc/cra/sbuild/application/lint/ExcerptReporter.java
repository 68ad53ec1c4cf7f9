package ca.gc.cra.sbuild.application.lint;

import ca.gc.cra.sbuild.application.port.LintLogger;
import ca.gc.cra.sbuild.domain.diagnostic.Diagnostic;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Renders diagnostics to a {@link LintLogger}: the field and message, followed by a three-line source
 * excerpt with the offending line marked when the diagnostic has a location.
 *
 * @since 0.1.0
 */
public final class ExcerptReporter implements DiagnosticReporter {
  private final LintLogger logger;

  /**
   * Creates a reporter writing through the given per-file logger.
   *
   * @param logger destination for diagnostic lines and excerpts
   */
  public ExcerptReporter(LintLogger logger) {
    this.logger = Objects.requireNonNull(logger, "logger");
  }

  @Override
  public void report(Diagnostic diagnostic, String source) {
    String headline = diagnostic.field() + " -> " + diagnostic.message();
    if (diagnostic.severity().isFatal()) {
      logger.error(headline);
    } else {
      logger.warn(headline);
    }
    if (diagnostic.hasLocation()) {
      for (String line : excerpt(source, diagnostic.line())) {
        logger.raw(line);
      }
    }
  }

  @Override
  public void summary(String message) {
    logger.warn(message);
  }

  /**
   * Builds the excerpt around a 1-based line: previous line, marked line, next line.
   *
   * @param source document text
   * @param line 1-based line number
   * @return rendered lines; empty when the line is outside the document
   */
  static List<String> excerpt(String source, int line) {
    String[] lines = source.split("\\R", -1);
    if (line < 1 || line > lines.length) {
      return List.of();
    }
    int width = String.valueOf(Math.min(line + 1, lines.length)).length();
    List<String> rendered = new ArrayList<>(3);
    for (int current = Math.max(1, line - 1); current <= Math.min(lines.length, line + 1); current++) {
      String marker = current == line ? "> " : "  ";
      rendered.add(marker + pad(current, width) + " | " + lines[current - 1]);
    }
    return rendered;
  }

  private static String pad(int number, int width) {
    StringBuilder sb = new StringBuilder(String.valueOf(number));
    while (sb.length() < width) {
      sb.insert(0, ' ');
    }
    return sb.toString();
  }
}
