package ca.gc.cra.sbuild.validation;

import java.util.List;

/**
 * Closed set of values accepted by the {@code pkg_type} field.
 */
public final class PackageTypes {
  /** Valid package types in documentation order. */
  public static final List<String> VALID = List.of(
      "appbundle",
      "appimage",
      "archive",
      "dynamic",
      "flatimage",
      "gameimage",
      "nixappimage",
      "runimage",
      "static");

  private PackageTypes() {
    // Utility
  }

  /**
   * Checks membership in {@link #VALID}; matching is exact.
   *
   * @param type candidate type
   * @return {@code true} when the type is valid
   */
  public static boolean isKnown(String type) {
    return type != null && VALID.contains(type);
  }
}
