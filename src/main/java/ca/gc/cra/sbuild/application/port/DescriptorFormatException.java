package ca.gc.cra.sbuild.application.port;

/**
 * Raised when descriptor text cannot be parsed into a mapping document.
 *
 * @since 0.1.0
 */
public final class DescriptorFormatException extends Exception {
  private static final long serialVersionUID = 1L;

  /**
   * Creates an exception with a message.
   *
   * @param message description of the syntax problem
   */
  public DescriptorFormatException(String message) {
    super(message);
  }

  /**
   * Creates an exception wrapping the parser failure.
   *
   * @param message description of the syntax problem
   * @param cause underlying parser exception
   */
  public DescriptorFormatException(String message, Throwable cause) {
    super(message, cause);
  }
}
