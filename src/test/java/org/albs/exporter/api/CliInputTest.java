package org.albs.exporter.api;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import org.junit.jupiter.api.Test;

class CliInputTest {

  @Test
  void separatesSwitchesFromArguments() {
    CliInput input = CliInput.parse(new String[] {"--DRY-RUN", "platforms=AlmaLinux-9", "-v", " ", "release=100"});

    assertTrue(input.dryRun());
    assertTrue(input.verbose());
    assertFalse(input.help());
    assertArrayEquals(new String[] {"platforms=AlmaLinux-9", "release=100"}, input.keyValueArgs());
    assertEquals(List.of(), input.unknownFlags());
  }

  @Test
  void recognisesHelp() {
    assertTrue(CliInput.parse(new String[] {"-h"}).help());
    assertTrue(CliInput.parse(new String[] {"help"}).help());
  }

  @Test
  void keepsUnknownFlags() {
    CliInput input = CliInput.parse(new String[] {"--dryrun", "--config=x.yaml"});

    assertEquals(List.of("--dryrun"), input.unknownFlags());
    assertFalse(input.dryRun());
    assertArrayEquals(new String[] {"--config=x.yaml"}, input.keyValueArgs());
  }

  @Test
  void emptyInput() {
    CliInput input = CliInput.parse(null);

    assertFalse(input.help());
    assertFalse(input.dryRun());
    assertArrayEquals(new String[0], input.keyValueArgs());
  }
}
