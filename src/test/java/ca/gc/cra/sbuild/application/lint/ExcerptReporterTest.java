package ca.gc.cra.sbuild.application.lint;

import static org.junit.jupiter.api.Assertions.assertEquals;

import ca.gc.cra.sbuild.domain.diagnostic.Diagnostic;
import ca.gc.cra.sbuild.domain.diagnostic.Severity;
import java.util.List;
import org.junit.jupiter.api.Test;

class ExcerptReporterTest {
  private static final String SOURCE = String.join("\n",
      "a: 1", "b: 2", "c: 3", "d: 4", "e: 5", "f: 6", "g: 7", "h: 8", "i: 9", "j: 10");

  @Test
  void marksOffendingLineBetweenNeighbours() {
    assertEquals(List.of("  1 | a: 1", "> 2 | b: 2", "  3 | c: 3"), ExcerptReporter.excerpt(SOURCE, 2));
  }

  @Test
  void padsLineNumbersToWidestShown() {
    assertEquals(List.of("   9 | i: 9", "> 10 | j: 10"), ExcerptReporter.excerpt(SOURCE, 10));
    assertEquals(List.of("> 1 | a: 1", "  2 | b: 2"), ExcerptReporter.excerpt(SOURCE, 1));
  }

  @Test
  void outOfRangeLineHasNoExcerpt() {
    assertEquals(List.of(), ExcerptReporter.excerpt(SOURCE, 0));
    assertEquals(List.of(), ExcerptReporter.excerpt(SOURCE, 11));
  }

  @Test
  void routesBySeverityAndSkipsExcerptWithoutLocation() {
    RecordingLintLogger logger = new RecordingLintLogger();
    ExcerptReporter reporter = new ExcerptReporter(logger);

    reporter.report(new Diagnostic("pkg", "Missing required field: pkg", 0, Severity.ERROR), SOURCE);
    reporter.report(new Diagnostic("foobar", "'foobar' is not a valid field.", 1, Severity.WARN), SOURCE);

    assertEquals(List.of(
        "ERROR pkg -> Missing required field: pkg",
        "WARN foobar -> 'foobar' is not a valid field.",
        "RAW > 1 | a: 1",
        "RAW   2 | b: 2"), logger.lines());
  }
}
