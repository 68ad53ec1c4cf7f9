package ca.gc.cra.sbuild.config;

import ca.gc.cra.sbuild.application.lint.LintOptions;
import ca.gc.cra.sbuild.application.pipeline.LintRunSettings;
import ca.gc.cra.sbuild.validation.Numbers;
import ca.gc.cra.sbuild.validation.Strings;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * <strong>What:</strong> Effective settings of one lint run after CLI, YAML and defaults are merged.
 * <p><strong>Thread-safety:</strong> Immutable record.</p>
 *
 * @param parallel job count when parallel mode is on; empty runs files one after another with full
 *     output
 * @param timeout per-file budget, applied in version-check mode
 * @param successList optional list receiving files that passed
 * @param failList optional list receiving files that failed
 * @param checkVersion whether {@code x_exec.pkgver} is run
 * @param shellcheck whether {@code x_exec.run} is checked with shellcheck
 * @param inPlace whether validated output replaces the original file
 * @since 0.1.0
 * @see ConfigMerger
 */
public record LintConfig(
    Optional<Integer> parallel,
    Duration timeout,
    Optional<Path> successList,
    Optional<Path> failList,
    boolean checkVersion,
    boolean shellcheck,
    boolean inPlace) {

  /** Jobs run at once when {@code --parallel} has no value. */
  public static final int DEFAULT_PARALLEL = 4;
  /** Upper bound for {@code parallel}. */
  public static final int MAX_PARALLEL = 256;
  /** Per-job budget in {@code --pkgver} mode. */
  public static final int DEFAULT_TIMEOUT_SECONDS = 30;
  /** Upper bound for {@code timeout}. */
  public static final int MAX_TIMEOUT_SECONDS = 3600;

  /**
   * Validates components.
   *
   * @throws IllegalArgumentException if a value is out of range or both lists name the same file
   */
  public LintConfig {
    parallel = Objects.requireNonNullElse(parallel, Optional.empty());
    parallel.ifPresent(count -> Numbers.requireRange("parallel", count, 1, MAX_PARALLEL));
    Objects.requireNonNull(timeout, "timeout");
    Numbers.requireRange("timeout", timeout.toSeconds(), 1, MAX_TIMEOUT_SECONDS);
    successList = Objects.requireNonNullElse(successList, Optional.empty());
    failList = Objects.requireNonNullElse(failList, Optional.empty());
    if (successList.isPresent() && failList.isPresent()
        && successList.get().toAbsolutePath().normalize().equals(failList.get().toAbsolutePath().normalize())) {
      throw new IllegalArgumentException("success and fail must name different files");
    }
  }

  /**
   * Returns the sequential, shellcheck-enabled defaults.
   *
   * @return default configuration
   */
  public static LintConfig defaults() {
    return new LintConfig(
        Optional.empty(),
        Duration.ofSeconds(DEFAULT_TIMEOUT_SECONDS),
        Optional.empty(),
        Optional.empty(),
        false,
        true,
        false);
  }

  /**
   * Defaults as the flat key/value map {@link ConfigMerger} layers under YAML and CLI values.
   *
   * @return mutable map of default values
   */
  public static Map<String, String> defaultsAsFlatMap() {
    Map<String, String> map = new LinkedHashMap<>();
    map.put("timeout", Integer.toString(DEFAULT_TIMEOUT_SECONDS));
    map.put("pkgver", "false");
    map.put("shellcheck", "true");
    map.put("inplace", "false");
    return map;
  }

  /**
   * Creates a configuration from merged key/value pairs.
   *
   * @param options keys {@code parallel}, {@code timeout}, {@code success}, {@code fail},
   *     {@code pkgver}, {@code shellcheck}, {@code inplace}
   * @return populated configuration
   * @throws IllegalArgumentException when a value is malformed or out of range
   */
  public static LintConfig fromMap(Map<String, String> options) {
    Objects.requireNonNull(options, "options");
    LintConfig defaults = defaults();

    Optional<Integer> parallel = Optional.empty();
    if (options.containsKey("parallel")) {
      String raw = options.get("parallel");
      parallel = Optional.of(raw == null || raw.isBlank()
          ? DEFAULT_PARALLEL
          : Numbers.parseInt("parallel", raw, 1, MAX_PARALLEL));
    }

    Duration timeout = defaults.timeout();
    String timeoutRaw = options.get("timeout");
    if (timeoutRaw != null && !timeoutRaw.isBlank()) {
      timeout = Duration.ofSeconds(Numbers.parseInt("timeout", timeoutRaw, 1, MAX_TIMEOUT_SECONDS));
    }

    return new LintConfig(
        parallel,
        timeout,
        optionalPath("success", options.get("success")),
        optionalPath("fail", options.get("fail")),
        parseBoolean("pkgver", options.get("pkgver"), defaults.checkVersion()),
        parseBoolean("shellcheck", options.get("shellcheck"), defaults.shellcheck()),
        parseBoolean("inplace", options.get("inplace"), defaults.inPlace()));
  }

  /**
   * Concurrency settings derived from this configuration. The time budget applies only in
   * version-check mode.
   *
   * @return run settings
   */
  public LintRunSettings runSettings() {
    return new LintRunSettings(
        parallel.orElse(1),
        parallel.isPresent(),
        checkVersion ? Optional.of(timeout) : Optional.empty());
  }

  /** @return per-file options derived from this configuration */
  public LintOptions lintOptions() {
    return new LintOptions(checkVersion, inPlace, timeout);
  }

  private static Optional<Path> optionalPath(String name, String raw) {
    if (raw == null || raw.isBlank()) {
      return Optional.empty();
    }
    String sanitized = Strings.requireNonBlank(name, raw);
    try {
      return Optional.of(Path.of(sanitized));
    } catch (InvalidPathException ex) {
      throw new IllegalArgumentException(name + " is not a valid path: " + sanitized, ex);
    }
  }

  private static boolean parseBoolean(String name, String raw, boolean defaultValue) {
    if (raw == null || raw.isBlank()) {
      return defaultValue;
    }
    String normalized = raw.trim().toLowerCase(Locale.ROOT);
    return switch (normalized) {
      case "true", "yes", "on", "1" -> true;
      case "false", "no", "off", "0" -> false;
      default -> throw new IllegalArgumentException(name + " must be true or false (was " + raw + ")");
    };
  }
}
