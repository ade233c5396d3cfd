package org.albs.exporter.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.Test;

class ConfigMergerTest {

  @Test
  void cliOverridesYamlAndWarns() {
    List<String> warnings = new ArrayList<>();
    Map<String, String> effective = ConfigMerger.buildEffectiveConfig(
        DefaultsForMode.EXPORT,
        Optional.of(Map.of("platforms", "AlmaLinux-8", "export.workers", "8")),
        Map.of("platforms", "AlmaLinux-9"),
        DefaultsForMode.asFlatMap(DefaultsForMode.EXPORT),
        warnings::add);

    assertEquals("AlmaLinux-9", effective.get("platforms"));
    assertEquals("8", effective.get("export.workers"));
    assertEquals("COPY", effective.get("noarch.mode"));
    assertEquals(List.of("CLI overrides YAML for key: platforms"), warnings);
  }

  @Test
  void yamlOverridesDefaultsSilently() {
    List<String> warnings = new ArrayList<>();
    Map<String, String> effective = ConfigMerger.buildEffectiveConfig(
        DefaultsForMode.NOARCH,
        Optional.of(Map.of("distribution", "almalinux-9-devel", "noarch.mode", "COPY")),
        Map.of(),
        DefaultsForMode.asFlatMap(DefaultsForMode.NOARCH),
        warnings::add);

    assertEquals("COPY", effective.get("noarch.mode"));
    assertEquals(List.of(), warnings);
  }

  @Test
  void noarchCommandRequiresDistribution() {
    IllegalArgumentException ex = assertThrows(IllegalArgumentException.class,
        () -> ConfigMerger.buildEffectiveConfig(DefaultsForMode.NOARCH, Optional.empty(), Map.of(),
            DefaultsForMode.asFlatMap(DefaultsForMode.NOARCH), null));

    assertEquals("distribution is required for the noarch command", ex.getMessage());
  }

  @Test
  void noarchCommandRejectsOffMode() {
    assertThrows(IllegalArgumentException.class,
        () -> ConfigMerger.buildEffectiveConfig(DefaultsForMode.NOARCH, Optional.empty(),
            Map.of("distribution", "almalinux-9-devel", "noarch.mode", "OFF"),
            DefaultsForMode.asFlatMap(DefaultsForMode.NOARCH), null));
  }

  @Test
  void archesNeedRepos() {
    IllegalArgumentException ex = assertThrows(IllegalArgumentException.class,
        () -> ConfigMerger.buildEffectiveConfig(DefaultsForMode.EXPORT, Optional.empty(),
            Map.of("platforms", "AlmaLinux-9", "arches", "ppc64le"),
            DefaultsForMode.asFlatMap(DefaultsForMode.EXPORT), null));

    assertEquals("arches can only be combined with repos", ex.getMessage());
  }

  @Test
  void invalidNoarchModeIsRejected() {
    assertThrows(IllegalArgumentException.class,
        () -> ConfigMerger.buildEffectiveConfig(DefaultsForMode.EXPORT, Optional.empty(),
            Map.of("noarch.mode", "sometimes"), DefaultsForMode.asFlatMap(DefaultsForMode.EXPORT), null));
  }
}
