package ca.gc.cra.sbuild.api;

/**
 * Process entry point for {@code sbuild-linter}.
 */
public final class Main {

  private Main() {}

  /**
   * Runs the linter and exits with its status.
   *
   * @param args command line arguments
   */
  public static void main(String[] args) {
    ExitCode exit = LintCli.run(args);
    System.exit(exit.code());
  }
}
