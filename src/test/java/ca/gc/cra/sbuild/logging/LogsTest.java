package ca.gc.cra.sbuild.logging;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

class LogsTest {

  @Test
  void shortValuesAreUntouched() {
    assertEquals("echo hi", Logs.truncate("echo hi", 64));
    assertEquals("<null>", Logs.truncate(null, 64));
  }

  @Test
  void longValuesKeepPrefixAndReportSize() {
    String truncated = Logs.truncate("abcdefghij", 4);
    assertEquals("abcd... (truncated, 4 of 10 bytes)", truncated);
  }

  @Test
  void truncationNeverSplitsMultibyteCharacters() {
    String truncated = Logs.truncate("ééé", 3);
    assertTrue(truncated.startsWith("é..."), truncated);
  }

  @Test
  void rejectsNonPositiveLimit() {
    assertThrows(IllegalArgumentException.class, () -> Logs.truncate("x", 0));
  }

  @Test
  void singleLineJoinsLineBreaks() {
    assertEquals("In x_exec.run line 1: | SC2086", Logs.singleLine("In x_exec.run line 1:\r\nSC2086\n"));
    assertEquals("<null>", Logs.singleLine(null));
  }
}
