package ca.gc.cra.sbuild.application.lint;

import ca.gc.cra.sbuild.domain.diagnostic.DiagnosticSink;
import java.util.Objects;
import java.util.Optional;

/**
 * Registry entry: a named descriptor field, whether it is required, and the shape check applied to its
 * raw value.
 *
 * @param name exact field name
 * @param required whether the field must be present
 * @param validator shape check
 * @since 0.1.0
 */
public record FieldValidator(String name, boolean required, ValueValidator validator) {

  /**
   * Validates components.
   */
  public FieldValidator {
    Objects.requireNonNull(name, "name");
    Objects.requireNonNull(validator, "validator");
  }

  /**
   * Runs the shape check for this field.
   *
   * @param raw raw YAML value
   * @param sink receiver for problems found
   * @param line 1-based line of the field key
   * @return validated value, or empty when the value must not be inserted
   */
  public Optional<Object> validate(Object raw, DiagnosticSink sink, int line) {
    return validator.validate(name, raw, sink, line, required);
  }

  /**
   * Shape check for one field. Returns the validated value, or records diagnostics and returns empty.
   */
  @FunctionalInterface
  public interface ValueValidator {
    /**
     * Validates a raw value.
     *
     * @param field field name used in messages
     * @param raw raw YAML value
     * @param sink receiver for problems found
     * @param line 1-based line of the field key
     * @param required whether the field is required; shape problems on required fields are errors
     * @return validated value or empty
     */
    Optional<Object> validate(String field, Object raw, DiagnosticSink sink, int line, boolean required);
  }
}
