package ca.gc.cra.sbuild.infrastructure.shell;

import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.Locale;
import java.util.Optional;

/**
 * Shells understood by shellcheck, resolved from an {@code x_exec.shell} value such as {@code bash} or
 * {@code /usr/bin/env sh}.
 */
enum ShellDialect {
  SH,
  BASH,
  DASH,
  KSH;

  String command() {
    return name().toLowerCase(Locale.ROOT);
  }

  static Optional<ShellDialect> resolve(String shell) {
    if (shell == null || shell.isBlank()) {
      return Optional.empty();
    }
    String[] words = shell.trim().split("\\s+");
    String program = words[words.length - 1];
    Path name;
    try {
      name = Path.of(program).getFileName();
    } catch (InvalidPathException ex) {
      return Optional.empty();
    }
    if (name == null) {
      return Optional.empty();
    }
    for (ShellDialect dialect : values()) {
      if (dialect.command().equals(name.toString().toLowerCase(Locale.ROOT))) {
        return Optional.of(dialect);
      }
    }
    return Optional.empty();
  }
}
