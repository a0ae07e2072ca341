package ca.gc.dfo.tides.validation;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class PathsTest {
  @TempDir Path tempDir;

  @Test
  void acceptsExistingSources() throws IOException {
    Path file = Files.writeString(tempDir.resolve("station.txt"), "x");

    assertEquals(tempDir.toAbsolutePath().normalize(), Paths.validateReadableSource(tempDir));
    assertEquals(file.toAbsolutePath().normalize(), Paths.validateReadableSource(file));
  }

  @Test
  void rejectsMissingSource() {
    assertThrows(IllegalArgumentException.class, () -> Paths.validateReadableSource(tempDir.resolve("absent")));
    assertThrows(IllegalArgumentException.class, () -> Paths.validateReadableSource(null));
  }

  @Test
  void outputMustBeAFileInAnExistingDirectory() {
    Path report = tempDir.resolve("report.txt");
    assertEquals(report.toAbsolutePath().normalize(), Paths.validateWritableFile(report));

    assertThrows(IllegalArgumentException.class, () -> Paths.validateWritableFile(tempDir));
    assertThrows(IllegalArgumentException.class,
        () -> Paths.validateWritableFile(tempDir.resolve("missing").resolve("report.txt")));
  }
}
