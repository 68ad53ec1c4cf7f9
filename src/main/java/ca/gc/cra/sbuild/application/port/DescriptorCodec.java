package ca.gc.cra.sbuild.application.port;

import ca.gc.cra.sbuild.domain.descriptor.BuildDescriptor;
import ca.gc.cra.sbuild.domain.descriptor.RawDocument;

/**
 * <strong>What:</strong> Port translating descriptor text to and from the linter's document model.
 * <p><strong>Role:</strong> Implemented by the YAML adapter; the lint use case never touches the YAML
 * library directly.</p>
 * <p><strong>Thread-safety:</strong> Implementations must be safe for concurrent use by lint workers.</p>
 *
 * @since 0.1.0
 */
public interface DescriptorCodec {
  /**
   * Parses descriptor text into an ordered raw document, keeping repeated keys.
   *
   * @param source full descriptor text
   * @return raw document referencing {@code source}
   * @throws DescriptorFormatException when the text is not a well-formed mapping document
   */
  RawDocument parse(String source) throws DescriptorFormatException;

  /**
   * Serializes a validated descriptor.
   *
   * @param descriptor validated descriptor
   * @return descriptor text
   */
  String write(BuildDescriptor descriptor);
}
