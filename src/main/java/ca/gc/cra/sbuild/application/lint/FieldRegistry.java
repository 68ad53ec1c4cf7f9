package ca.gc.cra.sbuild.application.lint;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * <strong>What:</strong> Fixed table of known descriptor fields queried by exact name.
 * <p>{@link #SBUILD} holds the SBUILD schema in its canonical field order; other registries can be
 * built for tests.</p>
 * <p><strong>Thread-safety:</strong> Immutable.</p>
 *
 * @since 0.1.0
 */
public final class FieldRegistry {
  /** SBUILD descriptor schema. */
  public static final FieldRegistry SBUILD = new FieldRegistry(List.of(
      new FieldValidator("_disabled", true, ValueShapes::bool),
      new FieldValidator("_disabled_reason", false, ValueShapes::textOrTextMap),
      new FieldValidator("pkg", true, ValueShapes::text),
      new FieldValidator("pkg_id", false, ValueShapes::text),
      new FieldValidator("pkg_type", false, ValueShapes::text),
      new FieldValidator("pkgver", false, ValueShapes::scalar),
      new FieldValidator("app_id", false, ValueShapes::text),
      new FieldValidator("build_util", false, ValueShapes::textList),
      new FieldValidator("build_asset", false, ValueShapes::assets),
      new FieldValidator("category", false, ValueShapes::textList),
      new FieldValidator("description", true, ValueShapes::textOrTextMap),
      new FieldValidator("desktop", false, ValueShapes::resource),
      new FieldValidator("distro_pkg", false, ValueShapes::distroPkg),
      new FieldValidator("homepage", false, ValueShapes::textList),
      new FieldValidator("icon", false, ValueShapes::resource),
      new FieldValidator("license", false, ValueShapes::licenses),
      new FieldValidator("maintainer", false, ValueShapes::textList),
      new FieldValidator("note", false, ValueShapes::lines),
      new FieldValidator("provides", false, ValueShapes::textList),
      new FieldValidator("repology", false, ValueShapes::textList),
      new FieldValidator("src_url", true, ValueShapes::textList),
      new FieldValidator("tag", false, ValueShapes::textList),
      new FieldValidator("x_exec", true, ValueShapes::exec)));

  private final Map<String, FieldValidator> byName;

  /**
   * Builds a registry from validators in declaration order.
   *
   * @param validators field validators; names must be unique
   * @throws IllegalArgumentException if two validators share a name
   */
  public FieldRegistry(List<FieldValidator> validators) {
    Objects.requireNonNull(validators, "validators");
    Map<String, FieldValidator> map = new LinkedHashMap<>();
    for (FieldValidator validator : validators) {
      if (map.putIfAbsent(validator.name(), validator) != null) {
        throw new IllegalArgumentException("duplicate field validator: " + validator.name());
      }
    }
    this.byName = map;
  }

  /**
   * Looks up the validator for a top-level field.
   *
   * @param name field name as written in the descriptor
   * @return the validator, or empty when the field is unknown
   */
  public Optional<FieldValidator> find(String name) {
    return Optional.ofNullable(byName.get(name));
  }

  /**
   * Returns the required fields in declaration order.
   *
   * @return required validators
   */
  public List<FieldValidator> required() {
    List<FieldValidator> required = new ArrayList<>();
    for (FieldValidator validator : byName.values()) {
      if (validator.required()) {
        required.add(validator);
      }
    }
    return List.copyOf(required);
  }
}
