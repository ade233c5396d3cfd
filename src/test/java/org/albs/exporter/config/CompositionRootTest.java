package org.albs.exporter.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.Map;
import org.albs.exporter.application.port.MetricsPort;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class CompositionRootTest {
  @TempDir
  Path dir;

  private ExporterConfig config(String signUrl) throws Exception {
    Path catalog = Files.writeString(dir.resolve("catalog.json"),
        "{\"platforms\": [], \"releases\": [], \"distributions\": []}");
    Map<String, String> args = new HashMap<>(DefaultsForMode.asFlatMap(DefaultsForMode.EXPORT));
    args.put("pulp.host", "http://127.0.0.1:1");
    args.put("pulp.user", "admin");
    args.put("sign.url", signUrl);
    args.put("catalog.path", catalog.toString());
    args.put("export.root", dir.resolve("exports").toString());
    args.put("export.errorLog", dir.resolve("export.err").toString());
    args.put("export.knownSubkeys", dir.resolve("known_subkeys.json").toString());
    args.put("owner.operator", "builder");
    return ExporterConfig.fromMap(args);
  }

  @Test
  void wiresUseCasesWithoutContactingServices() throws Exception {
    try (CompositionRoot root = new CompositionRoot(config("http://127.0.0.1:2"), MetricsPort.NO_OP)) {
      assertNotNull(root.exportUseCase());
      assertNotNull(root.distributionNoarchUseCase());
      assertSame(root.catalog(), root.catalog());
      assertEquals(0, root.catalog().platforms().size());
    }
  }

  @Test
  void exportNeedsSigningService() throws Exception {
    try (CompositionRoot root = new CompositionRoot(config(""), MetricsPort.NO_OP)) {
      IllegalArgumentException ex = assertThrows(IllegalArgumentException.class, root::exportUseCase);
      assertEquals("sign.url is required for export", ex.getMessage());
      assertNotNull(root.distributionNoarchUseCase());
    }
  }
}
