package ca.gc.cra.sbuild.application.pipeline;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.sbuild.application.port.LintLogger;
import java.util.List;
import org.junit.jupiter.api.Test;

class LogAggregatorTest {

  @Test
  void rendersMessagesInPostOrderWithPrefixes() throws Exception {
    RecordingConsole console = new RecordingConsole();
    LogAggregator aggregator = new LogAggregator(console, true);
    aggregator.start();
    LintLogger logger = aggregator.handle();

    logger.info("checking");
    logger.warn("'foobar' is not a valid field.");
    logger.error("1 error(s) found during deserialization.");
    logger.raw("> 3 | pkg: x");
    logger.success("'a.yaml' passed validation.");
    aggregator.shutdown();

    assertEquals(List.of(
        "checking",
        "[⚠] 'foobar' is not a valid field.",
        "[〤] 1 error(s) found during deserialization.",
        "> 3 | pkg: x",
        "[✔] 'a.yaml' passed validation."), console.all());
    assertEquals(List.of(
        "[⚠] 'foobar' is not a valid field.",
        "[〤] 1 error(s) found during deserialization.",
        "> 3 | pkg: x"), console.err());
    assertEquals(List.of("checking", "[✔] 'a.yaml' passed validation."), console.out());
  }

  @Test
  void suppressesDetailWhenAskedTo() throws Exception {
    RecordingConsole console = new RecordingConsole();
    LogAggregator aggregator = new LogAggregator(console, false);
    aggregator.start();

    aggregator.handle().error("boom");
    aggregator.handle().success("fine");
    aggregator.shutdown();

    assertTrue(console.all().isEmpty());
  }

  @Test
  void messagesAfterShutdownAreDropped() throws Exception {
    RecordingConsole console = new RecordingConsole();
    LogAggregator aggregator = new LogAggregator(console, true);
    aggregator.start();
    aggregator.shutdown();

    aggregator.handle().info("late");
    aggregator.shutdown();

    assertTrue(console.all().isEmpty());
  }

  @Test
  void startsOnlyOnce() throws Exception {
    LogAggregator aggregator = new LogAggregator(new RecordingConsole(), true);
    aggregator.start();

    assertThrows(IllegalStateException.class, aggregator::start);
    aggregator.shutdown();
  }
}
