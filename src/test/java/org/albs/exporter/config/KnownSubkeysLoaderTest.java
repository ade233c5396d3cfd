package org.albs.exporter.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.fasterxml.jackson.databind.ObjectMapper;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Set;
import org.albs.exporter.application.signature.KnownSubkeys;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class KnownSubkeysLoaderTest {
  private final ObjectMapper mapper = new ObjectMapper();

  @TempDir
  Path dir;

  @Test
  void loadsDelegation() throws Exception {
    Path file = Files.writeString(dir.resolve("known_subkeys.json"),
        "{\"51d6647ec21ad6ea\": [\"d36cb86cb86b3716\", \"3abb34f8\"]}");

    KnownSubkeys subkeys = KnownSubkeysLoader.load(file, mapper);

    assertEquals(1, subkeys.size());
    assertTrue(subkeys.delegates(Set.of("51d6647ec21ad6ea"), "d36cb86cb86b3716"));
    assertFalse(subkeys.delegates(Set.of("51d6647ec21ad6ea"), "0000000000000000"));
  }

  @Test
  void missingFileDisablesDelegation() throws Exception {
    assertTrue(KnownSubkeysLoader.load(dir.resolve("absent.json"), mapper).isEmpty());
  }

  @Test
  void malformedFileIsRejected() throws Exception {
    Path file = Files.writeString(dir.resolve("known_subkeys.json"), "[\"not\", \"a map\"]");

    IllegalArgumentException ex =
        assertThrows(IllegalArgumentException.class, () -> KnownSubkeysLoader.load(file, mapper));
    assertTrue(ex.getMessage().startsWith("known subkeys file is malformed"));
  }
}
