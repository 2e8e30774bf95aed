package ca.gc.cra.netsim.api;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Set;
import org.junit.jupiter.api.Test;

class CliInputTest {

  @Test
  void separatesFlagsFromKeyValueArgs() {
    CliInput input = CliInput.parse(new String[] {"routers=2", "--VERBOSE", " seconds=30 ", "--dry-run", ""});

    assertTrue(input.verbose());
    assertFalse(input.help());
    assertEquals(Set.of("--verbose", "--dry-run"), input.flags());
    assertArrayEquals(new String[] {"routers=2", "seconds=30"}, input.keyValueArgs());
  }

  @Test
  void recognisesHelpAliases() {
    assertTrue(CliInput.parse(new String[] {"-h"}).help());
    assertTrue(CliInput.parse(new String[] {"help"}).help());
    assertFalse(CliInput.parse(null).help());
    assertTrue(CliInput.parse(new String[0]).flags().isEmpty());
  }
}
