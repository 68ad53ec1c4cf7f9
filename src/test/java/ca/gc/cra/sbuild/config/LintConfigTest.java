package ca.gc.cra.sbuild.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.sbuild.application.pipeline.LintRunSettings;
import java.nio.file.Path;
import java.time.Duration;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.Test;

class LintConfigTest {

  @Test
  void defaultsRunSequentiallyWithShellcheck() {
    LintConfig config = LintConfig.fromMap(LintConfig.defaultsAsFlatMap());

    assertEquals(LintConfig.defaults(), config);
    LintRunSettings settings = config.runSettings();
    assertEquals(1, settings.parallelism());
    assertFalse(settings.parallelMode());
    assertEquals(Optional.empty(), settings.jobTimeout());
    assertTrue(config.shellcheck());
  }

  @Test
  void blankParallelMeansFourJobs() {
    Map<String, String> options = new HashMap<>(LintConfig.defaultsAsFlatMap());
    options.put("parallel", "");

    LintRunSettings settings = LintConfig.fromMap(options).runSettings();

    assertEquals(LintConfig.DEFAULT_PARALLEL, settings.parallelism());
    assertTrue(settings.parallelMode());
  }

  @Test
  void timeoutAppliesOnlyInVersionMode() {
    Map<String, String> options = new HashMap<>(LintConfig.defaultsAsFlatMap());
    options.put("timeout", "12");
    options.put("pkgver", "yes");

    LintConfig config = LintConfig.fromMap(options);

    assertEquals(Optional.of(Duration.ofSeconds(12)), config.runSettings().jobTimeout());
    assertEquals(Duration.ofSeconds(12), config.lintOptions().probeTimeout());
    assertTrue(config.lintOptions().checkVersion());
  }

  @Test
  void readsResultListsAndSwitches() {
    LintConfig config = LintConfig.fromMap(Map.of(
        "success", "ok.txt", "fail", "bad.txt", "shellcheck", "off", "inplace", "1"));

    assertEquals(Optional.of(Path.of("ok.txt")), config.successList());
    assertEquals(Optional.of(Path.of("bad.txt")), config.failList());
    assertFalse(config.shellcheck());
    assertTrue(config.inPlace());
  }

  @Test
  void rejectsInvalidValues() {
    assertThrows(IllegalArgumentException.class, () -> LintConfig.fromMap(Map.of("parallel", "0")));
    assertThrows(IllegalArgumentException.class, () -> LintConfig.fromMap(Map.of("parallel", "many")));
    assertThrows(IllegalArgumentException.class, () -> LintConfig.fromMap(Map.of("timeout", "0")));
    assertThrows(IllegalArgumentException.class, () -> LintConfig.fromMap(Map.of("pkgver", "maybe")));
    assertThrows(IllegalArgumentException.class,
        () -> LintConfig.fromMap(Map.of("success", "same.txt", "fail", "./same.txt")));
  }
}
