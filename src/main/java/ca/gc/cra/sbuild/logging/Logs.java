package ca.gc.cra.sbuild.logging;

import java.nio.ByteBuffer;
import java.nio.CharBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;

/**
 * <strong>What:</strong> Helpers for echoing untrusted text (external tool output, descriptor values)
 * into operator logs.
 * <p><strong>Thread-safety:</strong> Stateless.</p>
 *
 * @since 0.1.0
 * @see LoggingConfigurator
 */
public final class Logs {
  private static final String NULL_PLACEHOLDER = "<null>";

  private Logs() {
    // Utility
  }

  /**
   * Bounds a string to a UTF-8 byte budget, noting the original size when it was cut.
   *
   * @param value text to bound; {@code null} yields {@code "<null>"}
   * @param maxBytes byte budget; must be positive
   * @return the original text when it fits, otherwise a prefix followed by {@code "... (truncated, X of Y bytes)"}
   * @throws IllegalArgumentException if {@code maxBytes} is not positive
   */
  public static String truncate(String value, int maxBytes) {
    if (value == null) {
      return NULL_PLACEHOLDER;
    }
    if (maxBytes <= 0) {
      throw new IllegalArgumentException("maxBytes must be positive");
    }
    byte[] bytes = value.getBytes(StandardCharsets.UTF_8);
    if (bytes.length <= maxBytes) {
      return value;
    }
    CharsetDecoder decoder = StandardCharsets.UTF_8.newDecoder()
        .onMalformedInput(CodingErrorAction.IGNORE)
        .onUnmappableCharacter(CodingErrorAction.IGNORE);
    String suffix = "... (truncated, " + maxBytes + " of " + bytes.length + " bytes)";
    try {
      CharBuffer prefix = decoder.decode(ByteBuffer.wrap(bytes, 0, maxBytes));
      return prefix + suffix;
    } catch (CharacterCodingException ex) {
      return new String(bytes, 0, maxBytes, StandardCharsets.UTF_8) + suffix;
    }
  }

  /**
   * Collapses line breaks so multi-line tool output stays on one log line.
   *
   * @param value text; {@code null} yields {@code "<null>"}
   * @return text with each line break replaced by {@code " | "}
   */
  public static String singleLine(String value) {
    if (value == null) {
      return NULL_PLACEHOLDER;
    }
    return value.strip().replaceAll("\\R+", " | ");
  }
}
