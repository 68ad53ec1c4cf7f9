package ca.gc.cra.sbuild.domain.descriptor;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.Test;

class DistroPkgTest {

  @Test
  void parsesNestedMappingsWithPackageLeaves() {
    RawMapping raw = new RawMapping(List.of(
        new RawMapping.Entry("alpine", List.of("curl")),
        new RawMapping.Entry("debian", new RawMapping(List.of(
            new RawMapping.Entry("bookworm", List.of("curl", "libcurl4")))))));

    DistroPkg parsed = DistroPkg.parse(raw).orElseThrow();

    DistroPkg.InnerNode root = assertInstanceOf(DistroPkg.InnerNode.class, parsed);
    assertEquals(2, root.children().size());
    assertEquals("debian", root.children().get(1).key());
    assertInstanceOf(DistroPkg.InnerNode.class, root.children().get(1).value());
  }

  @Test
  void rejectsNonStringLeaves() {
    assertEquals(Optional.empty(), DistroPkg.parse(List.of("curl", 42)));
    assertEquals(Optional.empty(), DistroPkg.parse("curl"));
  }

  @Test
  void plainFormKeepsFirstOfRepeatedKeys() {
    RawMapping raw = new RawMapping(List.of(
        new RawMapping.Entry("fedora", List.of("a")),
        new RawMapping.Entry("fedora", List.of("b"))));

    Object plain = DistroPkg.parse(raw).orElseThrow().toPlain();

    assertEquals(Map.of("fedora", List.of("a")), plain);
  }

  @Test
  void rawMappingPreservesDuplicates() {
    RawMapping raw = new RawMapping(List.of(
        new RawMapping.Entry("pkg", "a"),
        new RawMapping.Entry("pkg", "b")));

    assertEquals(List.of("pkg", "pkg"), raw.keys());
    assertEquals("a", raw.get("pkg"));
    assertTrue(raw.containsKey("pkg"));
  }
}
