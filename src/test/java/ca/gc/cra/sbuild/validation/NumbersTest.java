package ca.gc.cra.sbuild.validation;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.Test;

class NumbersTest {

  @Test
  void requireRangeReturnsValueWithinBounds() {
    assertEquals(10, Numbers.requireRange("parallel", 10, 1, 256));
  }

  @Test
  void requireRangeRejectsValuesOutsideBounds() {
    assertThrows(IllegalArgumentException.class, () -> Numbers.requireRange("parallel", 0, 1, 256));
    assertThrows(IllegalArgumentException.class, () -> Numbers.requireRange("parallel", 257, 1, 256));
  }

  @Test
  void parseIntRejectsNonNumeric() {
    assertThrows(IllegalArgumentException.class, () -> Numbers.parseInt("timeout", "soon", 1, 60));
  }

  @Test
  void parseIntTrimsInput() {
    assertEquals(45, Numbers.parseInt("timeout", " 45 ", 1, 60));
  }
}
