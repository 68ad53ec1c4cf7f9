package ca.gc.cra.sbuild.api;

import ca.gc.cra.sbuild.application.port.ConsolePort;

/**
 * {@link ConsolePort} backed by {@link CliPrinter}.
 */
final class CliConsole implements ConsolePort {
  static final CliConsole INSTANCE = new CliConsole();

  private CliConsole() {}

  @Override
  public void out(String line) {
    CliPrinter.println(line);
  }

  @Override
  public void err(String line) {
    CliPrinter.errln(line);
  }
}
