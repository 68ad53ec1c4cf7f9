package ca.gc.cra.sbuild.infrastructure.persistence;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class ResultListWriterTest {
  @TempDir
  Path tempDir;

  @Test
  void appendsOneLinePerFileAcrossReopens() throws Exception {
    Path target = tempDir.resolve("success.txt");

    try (ResultListWriter writer = ResultListWriter.open(target)) {
      writer.append(Path.of("a.yaml"));
      writer.append(Path.of("dir/b.yaml"));
    }
    try (ResultListWriter writer = ResultListWriter.open(target)) {
      writer.append(Path.of("c.yaml"));
    }

    assertEquals(List.of("a.yaml", Path.of("dir/b.yaml").toString(), "c.yaml"),
        Files.readAllLines(target, StandardCharsets.UTF_8));
  }

  @Test
  void missingParentDirectoryIsRejected() {
    assertThrows(IllegalArgumentException.class,
        () -> ResultListWriter.open(tempDir.resolve("missing").resolve("fail.txt")));
  }
}
