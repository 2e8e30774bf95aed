package ca.gc.cra.netsim.application.sim;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.netsim.application.device.Host;
import ca.gc.cra.netsim.application.device.Router;
import ca.gc.cra.netsim.domain.net.MacAddress;
import ca.gc.cra.netsim.testutil.SimFixtures;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class SimulationContextTest {
  private SimulationContext context;

  @BeforeEach
  void setUp() {
    context = SimFixtures.sim().context();
  }

  @Test
  void registersDevicesByUniqueName() {
    Router r1 = context.register(new Router("R1", context));

    assertEquals(r1, context.device("R1").orElseThrow());
    assertEquals(r1, context.device("R1", Router.class));
    assertThrows(IllegalArgumentException.class, () -> context.device("R1", Host.class));
    IllegalArgumentException ex = assertThrows(IllegalArgumentException.class,
        () -> context.register(new Router("R1", context)));
    assertTrue(ex.getMessage().contains("already in use"));
  }

  @Test
  void rejectsDeviceBuiltForAnotherContext() {
    SimulationContext other = SimFixtures.sim().context();

    assertThrows(IllegalArgumentException.class, () -> context.register(new Host("h", other)));
  }

  @Test
  void connectValidatesBothEnds() {
    context.register(new Host("a", context));
    context.register(new Host("b", context));
    context.register(new Host("c", context));

    assertThrows(IllegalArgumentException.class, () -> context.connect("a", Host.NIC, "ghost", Host.NIC));
    assertThrows(IllegalArgumentException.class, () -> context.connect("a", "eth9", "b", Host.NIC));
    assertThrows(IllegalArgumentException.class, () -> context.connect("a", Host.NIC, "a", Host.NIC));

    context.connect("a", Host.NIC, "b", Host.NIC);
    IllegalArgumentException ex = assertThrows(IllegalArgumentException.class,
        () -> context.connect("c", Host.NIC, "b", Host.NIC));
    assertTrue(ex.getMessage().contains("already cabled"));
  }

  @Test
  void disconnectRemovesCableAndLink() {
    Host a = context.register(new Host("a", context));
    Host b = context.register(new Host("b", context));
    Cable cable = context.connect("a", Host.NIC, "b", Host.NIC);
    assertTrue(a.isConnected(Host.NIC));
    assertEquals("b", cable.peerOf("a", Host.NIC).device());

    assertTrue(context.disconnect("b", Host.NIC));

    assertFalse(cable.isConnected());
    assertFalse(a.isConnected(Host.NIC));
    assertFalse(b.isConnected(Host.NIC));
    assertTrue(context.cableAt("a", Host.NIC).isEmpty());
    assertTrue(context.cables().isEmpty());
    assertFalse(context.disconnect("b", Host.NIC));
  }

  @Test
  void allocatesLocallyAdministeredUnicastMacs() {
    MacAddress first = context.allocateMac();
    MacAddress second = context.allocateMac();

    assertTrue(first.isUnicast());
    assertNotEquals(first, second);
    assertEquals(MacAddress.parse("02:00:00:00:00:01"), first);
  }

  @Test
  void publishedEventsCarrySimulationTime() {
    SimFixtures.Sim sim = SimFixtures.sim();
    sim.clock().advanceBy(1_500);

    sim.context().publish("R1", "test", "hello");

    assertEquals(1_500, sim.context().events().events().get(0).timestampMillis());
    assertEquals("hello", sim.context().events().events().get(0).message());
  }
}
