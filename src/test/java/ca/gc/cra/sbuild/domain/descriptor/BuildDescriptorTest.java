package ca.gc.cra.sbuild.domain.descriptor;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.Test;

class BuildDescriptorTest {

  @Test
  void execSpecReadsShellRunPkgverAndHosts() {
    Map<String, Object> raw = new LinkedHashMap<>();
    raw.put("shell", "bash");
    raw.put("pkgver", "echo 1.0");
    raw.put("run", "make");
    raw.put("host", List.of("x86_64-Linux"));
    BuildDescriptor descriptor = new BuildDescriptor(Map.of("x_exec", raw));

    BuildDescriptor.ExecSpec exec = descriptor.execSpec().orElseThrow();

    assertEquals("bash", exec.shell());
    assertEquals("make", exec.run());
    assertEquals(Optional.of("echo 1.0"), exec.pkgver());
    assertEquals(List.of("x86_64-Linux"), exec.hosts());
  }

  @Test
  void execSpecIsEmptyWithoutRun() {
    BuildDescriptor descriptor = new BuildDescriptor(Map.of("x_exec", Map.of("shell", "sh")));
    assertTrue(descriptor.execSpec().isEmpty());
  }

  @Test
  void stringAccessorsIgnoreOtherShapes() {
    BuildDescriptor descriptor = new BuildDescriptor(Map.of("pkg", "demo", "tag", List.of("a", "b")));

    assertEquals(Optional.of("demo"), descriptor.string("pkg"));
    assertEquals(Optional.empty(), descriptor.string("tag"));
    assertEquals(List.of("a", "b"), descriptor.stringList("tag"));
    assertEquals(List.of(), descriptor.stringList("pkg"));
  }
}
