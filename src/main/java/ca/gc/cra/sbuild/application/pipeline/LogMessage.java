package ca.gc.cra.sbuild.application.pipeline;

import java.util.Objects;

/**
 * One queued console line.
 *
 * @param kind rendering category
 * @param text line text
 * @since 0.1.0
 */
public record LogMessage(Kind kind, String text) {
  /** Sentinel that stops the aggregator after everything queued before it has been written. */
  static final LogMessage DONE = new LogMessage(Kind.DONE, "");

  public LogMessage {
    Objects.requireNonNull(kind, "kind");
    text = Objects.requireNonNullElse(text, "");
  }

  /** Rendering categories. */
  public enum Kind {
    INFO,
    SUCCESS,
    WARN,
    ERROR,
    RAW,
    DONE
  }
}
