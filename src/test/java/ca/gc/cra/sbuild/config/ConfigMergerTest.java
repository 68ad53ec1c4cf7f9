package ca.gc.cra.sbuild.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.Test;

class ConfigMergerTest {

  @Test
  void cliOverridesYamlOverridesDefaults() {
    List<String> warnings = new ArrayList<>();

    Map<String, String> merged = ConfigMerger.buildEffectiveConfig(
        Optional.of(Map.of("timeout", "60", "parallel", "8")),
        Map.of("parallel", "2"),
        LintConfig.defaultsAsFlatMap(),
        warnings::add);

    assertEquals("60", merged.get("timeout"));
    assertEquals("2", merged.get("parallel"));
    assertEquals("true", merged.get("shellcheck"));
    assertEquals(List.of("CLI overrides YAML for key: parallel"), warnings);
  }

  @Test
  void unknownYamlKeysAreWarnedAndDropped() {
    List<String> warnings = new ArrayList<>();

    Map<String, String> merged = ConfigMerger.buildEffectiveConfig(
        Optional.of(Map.of("colour", "always")), Map.of(), Map.of(), warnings::add);

    assertEquals(Map.of(), merged);
    assertEquals(List.of("Ignoring unknown YAML key: colour"), warnings);
  }

  @Test
  void unknownCliKeysAreRejected() {
    IllegalArgumentException ex = assertThrows(IllegalArgumentException.class,
        () -> ConfigMerger.buildEffectiveConfig(Optional.empty(), Map.of("workers", "3"), Map.of(), null));
    assertEquals("unknown option: workers", ex.getMessage());
  }
}
