package ca.gc.cra.sbuild.api;

import java.io.FileDescriptor;
import java.io.FileOutputStream;
import java.io.OutputStreamWriter;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;

/**
 * UTF-8 writers for user-facing CLI output. Tests may swap either stream.
 */
public final class CliPrinter {
  private static final PrintWriter STDOUT = new PrintWriter(
      new OutputStreamWriter(new FileOutputStream(FileDescriptor.out), StandardCharsets.UTF_8), true);
  private static final PrintWriter STDERR = new PrintWriter(
      new OutputStreamWriter(new FileOutputStream(FileDescriptor.err), StandardCharsets.UTF_8), true);
  private static volatile PrintWriter outOverride;
  private static volatile PrintWriter errOverride;

  private CliPrinter() {
    // Utility
  }

  /**
   * Writes one line to standard output.
   *
   * @param message line text
   */
  public static void println(String message) {
    out().println(message);
  }

  /**
   * Writes each line to standard output.
   *
   * @param lines line texts
   */
  public static void printLines(String... lines) {
    if (lines == null) {
      return;
    }
    PrintWriter writer = out();
    for (String line : lines) {
      writer.println(line);
    }
  }

  /**
   * Writes one line to standard error.
   *
   * @param message line text
   */
  public static void errln(String message) {
    err().println(message);
  }

  static void setWritersForTesting(PrintWriter out, PrintWriter err) {
    outOverride = out;
    errOverride = err;
  }

  static void clearTestWriters() {
    outOverride = null;
    errOverride = null;
  }

  private static PrintWriter out() {
    PrintWriter override = outOverride;
    return override != null ? override : STDOUT;
  }

  private static PrintWriter err() {
    PrintWriter override = errOverride;
    return override != null ? override : STDERR;
  }
}
