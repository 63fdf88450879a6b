package ca.gc.cra.haplotree.api;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import org.junit.jupiter.api.Test;

class CliInputTest {

  @Test
  void splitsSwitchesFromSettings() {
    CliInput input = CliInput.parse(new String[] {"-V", "source=ftdna-ytree", " ", null, "--Dry-Run", "out=r"});

    assertTrue(input.verbose());
    assertFalse(input.help());
    assertEquals(List.of("source=ftdna-ytree", "out=r"), input.settings());
    assertEquals(List.of("--dry-run"), input.unknownFlags());
  }

  @Test
  void dashedKeyValueIsASetting() {
    CliInput input = CliInput.parse(new String[] {"--config=haplotree.yaml", "help"});

    assertTrue(input.help());
    assertEquals(List.of("--config=haplotree.yaml"), input.settings());
  }

  @Test
  void nullArgumentsYieldEmptyInput() {
    CliInput input = CliInput.parse(null);

    assertEquals(0, input.keyValueArgs().length);
    assertTrue(input.unknownFlags().isEmpty());
  }
}
