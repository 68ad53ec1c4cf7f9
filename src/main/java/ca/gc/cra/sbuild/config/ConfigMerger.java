package ca.gc.cra.sbuild.config;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.function.Consumer;

/**
 * Merges configuration from defaults, YAML, and CLI sources with precedence CLI > YAML > defaults.
 */
public final class ConfigMerger {
  static final Set<String> KNOWN_KEYS =
      Set.of("parallel", "timeout", "success", "fail", "pkgver", "shellcheck", "inplace");

  private ConfigMerger() {}

  /**
   * Builds an effective configuration map.
   *
   * @param yaml optional YAML-derived settings
   * @param cli CLI key/value overrides (may be empty)
   * @param defaults embedded defaults
   * @param warn consumer invoked when a CLI key overrides a YAML key or YAML carries an unknown key
   * @return immutable merged configuration map
   * @throws IllegalArgumentException when a CLI key is not a known option
   */
  public static Map<String, String> buildEffectiveConfig(
      Optional<Map<String, String>> yaml,
      Map<String, String> cli,
      Map<String, String> defaults,
      Consumer<String> warn) {
    Objects.requireNonNull(yaml, "yaml");
    Map<String, String> defaultsCopy = defaults == null ? Map.of() : defaults;
    Map<String, String> yamlCopy = yaml.orElse(Map.of());
    Map<String, String> cliCopy = cli == null ? Map.of() : cli;
    Consumer<String> effectiveWarn = warn == null ? message -> {} : warn;

    Map<String, String> merged = new LinkedHashMap<>(defaultsCopy);
    for (Map.Entry<String, String> entry : yamlCopy.entrySet()) {
      if (!KNOWN_KEYS.contains(entry.getKey())) {
        effectiveWarn.accept("Ignoring unknown YAML key: " + entry.getKey());
        continue;
      }
      merged.put(entry.getKey(), entry.getValue());
    }

    for (Map.Entry<String, String> entry : cliCopy.entrySet()) {
      String key = entry.getKey();
      if (key == null) {
        continue;
      }
      if (!KNOWN_KEYS.contains(key)) {
        throw new IllegalArgumentException("unknown option: " + key);
      }
      if (yamlCopy.containsKey(key)) {
        effectiveWarn.accept("CLI overrides YAML for key: " + key);
      }
      if (entry.getValue() != null) {
        merged.put(key, entry.getValue());
      }
    }
    return Map.copyOf(merged);
  }
}
