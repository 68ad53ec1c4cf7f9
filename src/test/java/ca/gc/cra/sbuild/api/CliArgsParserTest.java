package ca.gc.cra.sbuild.api;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Map;
import org.junit.jupiter.api.Test;

class CliArgsParserTest {

  @Test
  void parsesTrimmedPairs() {
    Map<String, String> map = CliArgsParser.toMap(new String[] {"parallel=4", " timeout = 12 ", ""});

    assertEquals(Map.of("parallel", "4", "timeout", "12"), map);
  }

  @Test
  void nullInputIsEmpty() {
    assertTrue(CliArgsParser.toMap(null).isEmpty());
  }

  @Test
  void rejectsMalformedPairs() {
    assertThrows(IllegalArgumentException.class, () -> CliArgsParser.toMap(new String[] {"parallel"}));
    assertThrows(IllegalArgumentException.class, () -> CliArgsParser.toMap(new String[] {"parallel="}));
    assertThrows(IllegalArgumentException.class, () -> CliArgsParser.toMap(new String[] {"=4"}));
    assertThrows(IllegalArgumentException.class, () -> CliArgsParser.toMap(new String[] {"bad key=1"}));
  }
}
