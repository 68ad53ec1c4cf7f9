package ca.gc.cra.sbuild.domain.descriptor;

import java.util.Objects;

/**
 * Parsed but unvalidated descriptor: top-level fields in source order plus the original text used for
 * line lookups.
 *
 * @param fields top-level entries, repeated keys preserved
 * @param source original document text
 * @since 0.1.0
 */
public record RawDocument(RawMapping fields, String source) {

  /**
   * Validates components.
   */
  public RawDocument {
    Objects.requireNonNull(fields, "fields");
    Objects.requireNonNull(source, "source");
  }
}
