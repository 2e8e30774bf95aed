package ca.gc.cra.netsim.domain.l2;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.netsim.domain.net.MacAddress;
import java.util.Optional;
import org.junit.jupiter.api.Test;

class MacTableTest {
  private static final MacAddress A = MacAddress.parse("00:00:00:00:00:0a");
  private static final MacAddress B = MacAddress.parse("00:00:00:00:00:0b");
  private static final MacAddress C = MacAddress.parse("00:00:00:00:00:0c");

  @Test
  void learnsPerVlan() {
    MacTable table = new MacTable(300, 16);
    table.learn(10, A, "Fa0/1", 0);

    assertEquals(Optional.of("Fa0/1"), table.lookup(10, A, 1_000));
    assertEquals(Optional.empty(), table.lookup(20, A, 1_000));
  }

  @Test
  void ignoresGroupSources() {
    MacTable table = new MacTable(300, 16);
    assertFalse(table.learn(1, MacAddress.BROADCAST, "Fa0/1", 0));
    assertEquals(0, table.size());
  }

  @Test
  void countsStationMoves() {
    MacTable table = new MacTable(300, 16);
    table.learn(1, A, "Fa0/1", 0);
    table.learn(1, A, "Fa0/2", 10);

    assertEquals(Optional.of("Fa0/2"), table.lookup(1, A, 20));
    assertEquals(1, table.statistics().moves());
  }

  @Test
  void dynamicEntriesAgeOutButStaticOnesDoNot() {
    MacTable table = new MacTable(10, 16);
    table.learn(1, A, "Fa0/1", 0);
    table.addStatic(1, B, "Fa0/2");

    assertEquals(Optional.of("Fa0/1"), table.lookup(1, A, 9_999));
    assertEquals(Optional.empty(), table.lookup(1, A, 10_000));
    assertEquals(Optional.of("Fa0/2"), table.lookup(1, B, 1_000_000));
    assertEquals(1, table.size());
  }

  @Test
  void staticEntriesAreNotOverwrittenByLearning() {
    MacTable table = new MacTable(300, 16);
    table.addStatic(1, A, "Fa0/1");

    assertFalse(table.learn(1, A, "Fa0/9", 0));
    assertEquals(Optional.of("Fa0/1"), table.lookup(1, A, 0));
  }

  @Test
  void evictsOldestDynamicEntryAtCapacity() {
    MacTable table = new MacTable(300, 2);
    table.learn(1, A, "Fa0/1", 0);
    table.learn(1, B, "Fa0/2", 5);
    table.learn(1, C, "Fa0/3", 10);

    assertEquals(2, table.size());
    assertEquals(Optional.empty(), table.lookup(1, A, 10));
    assertEquals(1, table.statistics().evictions());
  }

  @Test
  void removesByPortAndVlan() {
    MacTable table = new MacTable(300, 16);
    table.learn(1, A, "Fa0/1", 0);
    table.learn(1, B, "Fa0/1", 0);
    table.learn(2, C, "Fa0/2", 0);

    assertEquals(2, table.removePort("Fa0/1"));
    assertEquals(1, table.removeVlan(2));
    assertEquals(0, table.size());
  }

  @Test
  void cleanExpiredAndClearDynamicKeepStatics() {
    MacTable table = new MacTable(10, 16);
    table.learn(1, A, "Fa0/1", 0);
    table.learn(1, B, "Fa0/2", 8_000);
    table.addStatic(1, C, "Fa0/3");

    assertEquals(1, table.cleanExpired(12_000));
    table.clearDynamic();
    assertEquals(1, table.size());
    assertTrue(table.entries().stream().allMatch(e -> e.type() == MacEntryType.STATIC));
  }
}
