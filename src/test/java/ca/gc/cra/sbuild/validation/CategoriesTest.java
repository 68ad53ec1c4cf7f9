package ca.gc.cra.sbuild.validation;

import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

class CategoriesTest {

  @Test
  void knowsFreedesktopCategories() {
    assertTrue(Categories.isKnown("Utility"));
    assertTrue(Categories.isKnown("TerminalEmulator"));
  }

  @Test
  void matchesConsoleCategoriesCaseInsensitively() {
    assertTrue(Categories.isKnown("cli"));
    assertTrue(Categories.isKnown("TUI"));
  }

  @Test
  void rejectsUnknownCategory() {
    assertFalse(Categories.isKnown("InvalidCat"));
    assertFalse(Categories.isKnown(null));
  }

  @Test
  void packageTypesAreExact() {
    assertTrue(PackageTypes.isKnown("static"));
    assertFalse(PackageTypes.isKnown("Static"));
    assertFalse(PackageTypes.isKnown("deb"));
  }
}
