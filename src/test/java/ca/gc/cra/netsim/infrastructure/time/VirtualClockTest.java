package ca.gc.cra.netsim.infrastructure.time;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.netsim.application.port.Cancellable;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Test;

class VirtualClockTest {

  @Test
  void runsDueTasksInTimeThenSchedulingOrder() {
    VirtualClock clock = new VirtualClock();
    List<String> ran = new ArrayList<>();
    clock.schedule(200, () -> ran.add("late"));
    clock.schedule(100, () -> ran.add("first"));
    clock.schedule(100, () -> ran.add("second"));

    clock.advanceBy(150);
    assertEquals(List.of("first", "second"), ran);
    assertEquals(150, clock.nowMillis());

    clock.advanceBy(50);
    assertEquals(List.of("first", "second", "late"), ran);
  }

  @Test
  void taskSeesItsDueTime() {
    VirtualClock clock = new VirtualClock(1_000);
    List<Long> seen = new ArrayList<>();
    clock.schedule(250, () -> seen.add(clock.nowMillis()));

    clock.advanceBy(10_000);

    assertEquals(List.of(1_250L), seen);
    assertEquals(11_000, clock.nowMillis());
  }

  @Test
  void fixedRateTaskRepeatsUntilCancelled() {
    VirtualClock clock = new VirtualClock();
    List<Long> ticks = new ArrayList<>();
    Cancellable handle = clock.scheduleAtFixedRate(0, 1_000, () -> ticks.add(clock.nowMillis()));

    clock.advanceBy(3_000);
    handle.cancel();
    clock.advanceBy(5_000);

    assertEquals(List.of(0L, 1_000L, 2_000L, 3_000L), ticks);
    assertTrue(handle.isCancelled());
    assertEquals(0, clock.pendingTasks());
  }

  @Test
  void tasksScheduledByTasksRunInTheSameAdvance() {
    VirtualClock clock = new VirtualClock();
    List<String> ran = new ArrayList<>();
    clock.schedule(10, () -> clock.schedule(10, () -> ran.add("chained")));

    clock.advanceBy(25);

    assertEquals(List.of("chained"), ran);
  }

  @Test
  void failingTaskDoesNotStopTheClock() {
    VirtualClock clock = new VirtualClock();
    List<String> ran = new ArrayList<>();
    clock.schedule(1, () -> {
      throw new IllegalStateException("boom");
    });
    clock.schedule(2, () -> ran.add("after"));

    clock.advanceBy(5);

    assertEquals(List.of("after"), ran);
  }

  @Test
  void rejectsMovingBackwards() {
    VirtualClock clock = new VirtualClock(500);

    assertThrows(IllegalArgumentException.class, () -> clock.advanceTo(100));
    assertThrows(IllegalArgumentException.class, () -> clock.advanceBy(-1));
    assertThrows(IllegalArgumentException.class, () -> clock.scheduleAtFixedRate(0, 0, () -> {}));
  }
}
