package ca.gc.cra.rendezvous.api;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import java.util.Set;
import org.junit.jupiter.api.Test;

class CliInputTest {

  @Test
  void separatesFlagsFromKeyValues() {
    CliInput input = CliInput.parse(new String[] {"listen=0.0.0.0:8765", "--DRY-RUN", "-v", "path=/"});

    assertArrayEquals(new String[] {"listen=0.0.0.0:8765", "path=/"}, input.keyValueArgs());
    assertTrue(input.hasFlag("--dry-run"));
    assertTrue(input.verbose());
    assertFalse(input.help());
  }

  @Test
  void recognisesHelpSpellings() {
    assertTrue(CliInput.parse(new String[] {"help"}).help());
    assertTrue(CliInput.parse(new String[] {"-h"}).help());
    assertTrue(CliInput.parse(new String[] {"--HELP"}).help());
  }

  @Test
  void dashedKeyValueIsNotAFlag() {
    CliInput input = CliInput.parse(new String[] {"--listen=0.0.0.0:1"});

    assertEquals(1, input.keyValueArgs().length);
    assertFalse(input.hasFlag("--listen=0.0.0.0:1"));
  }

  @Test
  void unknownFlagsExcludeHelpVerboseAndKnown() {
    CliInput input = CliInput.parse(new String[] {"--help", "--debug", "--dry-run", "--fast"});

    assertEquals(List.of("--fast"), input.unknownFlags(Set.of("--dry-run")));
  }

  @Test
  void emptyInput() {
    CliInput input = CliInput.parse(null);

    assertEquals(0, input.keyValueArgs().length);
    assertFalse(input.hasFlag(" "));
  }
}
