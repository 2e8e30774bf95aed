package ca.gc.cra.netsim.infrastructure.events;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.netsim.domain.sim.SimulationEvent;
import ca.gc.cra.netsim.testutil.RecordingMetricsPort;
import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

class LoggingSimulationEventSinkTest {

  @Test
  void publishLogsEventAndCountsIt() {
    RecordingMetricsPort metrics = new RecordingMetricsPort();
    LoggingSimulationEventSink sink = new LoggingSimulationEventSink(metrics, "lab.events");

    Logger logger = (Logger) LoggerFactory.getLogger(LoggingSimulationEventSink.class);
    ListAppender<ILoggingEvent> appender = new ListAppender<>();
    Level originalLevel = logger.getLevel();
    boolean originalAdditive = logger.isAdditive();
    logger.setLevel(Level.INFO);
    logger.setAdditive(false);
    appender.start();
    logger.addAppender(appender);

    try {
      sink.publish(new SimulationEvent(1_500, "R1", "ospf", "Neighbor 2.2.2.2 (Gi0/1): Loading -> Full"));
    } finally {
      logger.detachAppender(appender);
      logger.setAdditive(originalAdditive);
      logger.setLevel(originalLevel);
      appender.stop();
    }

    assertEquals(1, metrics.count("lab.events.published"));
    List<ILoggingEvent> events = appender.list;
    assertEquals(1, events.size());
    String message = events.get(0).getFormattedMessage();
    assertTrue(message.startsWith("sim.event t=1500ms device=R1 category=ospf"), message);
    assertTrue(message.endsWith("Loading -> Full"), message);
  }

  @Test
  void historyDropsOldestBeyondCapacity() {
    LoggingSimulationEventSink sink = new LoggingSimulationEventSink(null, null, 2);

    sink.publish(new SimulationEvent(1, "R1", "a", "one"));
    sink.publish(new SimulationEvent(2, "R1", "a", "two"));
    sink.publish(new SimulationEvent(3, "R1", "a", "three"));

    assertEquals(List.of("two", "three"), sink.events().stream().map(SimulationEvent::message).toList());
  }

  @Test
  void rejectsNullEventAndBadCapacity() {
    LoggingSimulationEventSink sink = new LoggingSimulationEventSink();

    assertThrows(NullPointerException.class, () -> sink.publish(null));
    assertThrows(IllegalArgumentException.class, () -> new LoggingSimulationEventSink(null, "x", 0));
  }
}
