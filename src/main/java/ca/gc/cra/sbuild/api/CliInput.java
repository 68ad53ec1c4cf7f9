package ca.gc.cra.sbuild.api;

import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Splits raw arguments into switches, {@code key=value} options and descriptor files.
 * <p>The original flag syntax is accepted as well: {@code --parallel [N]}, {@code --timeout N},
 * {@code --success PATH} and {@code --fail PATH} become the matching {@code key=value} options.
 * Repeated files are kept once, in first-seen order.</p>
 */
public final class CliInput {
  private static final Set<String> HELP_FLAGS = Set.of("--help", "-h", "help");
  private static final Set<String> VERBOSE_FLAGS = Set.of("--verbose", "-v", "--debug");
  private static final Map<String, String> ALIASES = Map.of("-p", "--pkgver", "-i", "--inplace");
  private static final Set<String> VALUE_FLAGS = Set.of("--timeout", "--success", "--fail");

  private final String[] keyValueArgs;
  private final Set<String> flags;
  private final List<Path> files;
  private final boolean help;
  private final boolean verbose;

  private CliInput(String[] keyValueArgs, Set<String> flags, List<Path> files, boolean help, boolean verbose) {
    this.keyValueArgs = keyValueArgs;
    this.flags = flags;
    this.files = files;
    this.help = help;
    this.verbose = verbose;
  }

  /**
   * Parses raw arguments.
   *
   * @param args process arguments; {@code null} is treated as empty
   * @return parsed input
   * @throws IllegalArgumentException if a value flag lacks its value or a file path is malformed
   */
  public static CliInput parse(String[] args) {
    if (args == null || args.length == 0) {
      return new CliInput(new String[0], Set.of(), List.of(), false, false);
    }

    List<String> kv = new ArrayList<>();
    Set<String> flags = new LinkedHashSet<>();
    Set<Path> files = new LinkedHashSet<>();
    boolean help = false;
    boolean verbose = false;
    for (int i = 0; i < args.length; i++) {
      if (args[i] == null) {
        continue;
      }
      String arg = args[i].trim();
      if (arg.isEmpty()) {
        continue;
      }
      String lower = ALIASES.getOrDefault(arg.toLowerCase(Locale.ROOT), arg.toLowerCase(Locale.ROOT));
      if (HELP_FLAGS.contains(lower)) {
        help = true;
        flags.add("--help");
        continue;
      }
      if (VERBOSE_FLAGS.contains(lower)) {
        verbose = true;
        flags.add("--verbose");
        continue;
      }
      if (lower.equals("--parallel")) {
        String next = i + 1 < args.length ? args[i + 1] : null;
        if (next != null && next.trim().matches("\\d+")) {
          kv.add("parallel=" + next.trim());
          i++;
        } else {
          flags.add(lower);
        }
        continue;
      }
      if (VALUE_FLAGS.contains(lower)) {
        String next = i + 1 < args.length ? args[i + 1] : null;
        if (next == null || next.isBlank() || next.trim().startsWith("-")) {
          throw new IllegalArgumentException(lower + " requires a value");
        }
        kv.add(lower.substring(2) + "=" + next.trim());
        i++;
        continue;
      }
      if (arg.startsWith("-") && !arg.contains("=")) {
        flags.add(lower);
        continue;
      }
      if (arg.contains("=")) {
        kv.add(arg);
        continue;
      }
      try {
        files.add(Path.of(arg));
      } catch (InvalidPathException ex) {
        throw new IllegalArgumentException("invalid file path: " + arg, ex);
      }
    }
    return new CliInput(kv.toArray(String[]::new), Set.copyOf(flags), List.copyOf(files), help, verbose);
  }

  /** @return {@code key=value} pairs, flags with values already folded in */
  public String[] keyValueArgs() {
    return Arrays.copyOf(keyValueArgs, keyValueArgs.length);
  }

  /** @return descriptor paths in the order given */
  public List<Path> files() {
    return files;
  }

  /** @return whether usage was requested */
  public boolean help() {
    return help;
  }

  /** @return whether debug logging was requested */
  public boolean verbose() {
    return verbose;
  }

  /**
   * Tests for a boolean flag such as {@code --inplace}.
   *
   * @param flag long flag name including the leading dashes
   * @return whether the flag was present
   */
  public boolean hasFlag(String flag) {
    if (flag == null || flag.isBlank()) {
      return false;
    }
    String normalized = flag.trim().toLowerCase(Locale.ROOT);
    return flags.contains(ALIASES.getOrDefault(normalized, normalized));
  }

  /** @return the boolean flags that were present, lower-cased */
  public Set<String> flags() {
    return flags;
  }
}
