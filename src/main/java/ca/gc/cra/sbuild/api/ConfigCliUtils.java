package ca.gc.cra.sbuild.api;

import java.util.Map;
import java.util.Set;

/**
 * Shared helpers for mixing CLI switches with map-based configuration.
 */
final class ConfigCliUtils {
  static final Set<String> KNOWN_FLAGS =
      Set.of("--help", "--verbose", "--pkgver", "--inplace", "--no-shellcheck", "--parallel");

  private ConfigCliUtils() {}

  static String extractConfigPath(Map<String, String> args) {
    if (args == null || args.isEmpty()) {
      return null;
    }
    for (String key : new String[] {"config", "--config"}) {
      String value = args.remove(key);
      if (value != null && !value.isBlank()) {
        return value.trim();
      }
    }
    return null;
  }

  /**
   * Translates switches into option keys so they take CLI precedence in the merge.
   *
   * @param input parsed CLI input
   * @param args option map to update
   * @throws IllegalArgumentException if an unknown switch was given
   */
  static void applyFlags(CliInput input, Map<String, String> args) {
    for (String flag : input.flags()) {
      if (!KNOWN_FLAGS.contains(flag)) {
        throw new IllegalArgumentException("unknown flag: " + flag);
      }
    }
    if (input.hasFlag("--pkgver")) {
      args.put("pkgver", "true");
    }
    if (input.hasFlag("--inplace")) {
      args.put("inplace", "true");
    }
    if (input.hasFlag("--no-shellcheck")) {
      args.put("shellcheck", "false");
    }
    if (input.hasFlag("--parallel")) {
      args.putIfAbsent("parallel", "");
    }
  }
}
