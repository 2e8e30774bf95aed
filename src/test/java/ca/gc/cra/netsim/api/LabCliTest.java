package ca.gc.cra.netsim.api;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.slf4j.LoggerFactory;

class LabCliTest {
  @TempDir Path tempDir;

  private ListAppender<ILoggingEvent> appender;
  private Logger logger;
  private StringWriter buffer;

  @BeforeEach
  void setUp() {
    logger = (Logger) LoggerFactory.getLogger(LabCli.class);
    appender = new ListAppender<>();
    appender.start();
    logger.addAppender(appender);
    buffer = new StringWriter();
    CliPrinter.setWriterForTesting(new PrintWriter(buffer));
  }

  @AfterEach
  void tearDown() {
    if (logger != null && appender != null) {
      logger.detachAppender(appender);
    }
    CliPrinter.clearTestWriter();
    System.clearProperty("otel.metrics.exporter");
  }

  @Test
  void helpPrintsUsage() {
    ExitCode code = LabCli.run(new String[] {"--help"});

    assertEquals(ExitCode.SUCCESS, code);
    assertTrue(buffer.toString().contains("NETSIM lab runner"));
    assertTrue(buffer.toString().contains("clock=virtual|wall"));
  }

  @Test
  void convergedLabPrintsTextReport() {
    ExitCode code = LabCli.run(new String[] {"routers=3", "seconds=60"});

    assertEquals(ExitCode.SUCCESS, code);
    String out = buffer.toString();
    assertTrue(out.contains("Lab: 3 router(s), 60 s simulated, converged"), out);
    assertTrue(out.contains("reply from 192.168.2.10 ttl=61"), out);
    assertTrue(out.contains("R2:"), out);
  }

  @Test
  void jsonFormatRendersDocument() {
    ExitCode code = LabCli.run(new String[] {"routers=2", "seconds=60", "format=json", "metricsExporter=none"});

    assertEquals(ExitCode.SUCCESS, code);
    String out = buffer.toString();
    assertTrue(out.contains("\"converged\" : true"), out);
    assertTrue(out.contains("\"replyTtl\" : 62"), out);
    assertTrue(out.contains("\"state\" : \"Full\""), out);
  }

  @Test
  void tooShortRunReportsFailure() {
    ExitCode code = LabCli.run(new String[] {"routers=3", "seconds=1"});

    assertEquals(ExitCode.LAB_FAILED, code);
    assertTrue(buffer.toString().contains("NOT converged"));
    assertTrue(appender.list.stream()
        .anyMatch(event -> event.getLevel() == Level.WARN
            && event.getFormattedMessage().contains("Lab did not succeed")));
  }

  @Test
  void yamlProfileShortensTimers() throws Exception {
    Path config = tempDir.resolve("lab.yaml");
    Files.writeString(config, """
        common:
          ospf:
            helloIntervalSeconds: 2
            deadIntervalSeconds: 8
        lab:
          routers: 2
          seconds: 15
        """);

    ExitCode code = LabCli.run(new String[] {"config=" + config});

    assertEquals(ExitCode.SUCCESS, code);
    assertTrue(buffer.toString().contains("Lab: 2 router(s), 15 s simulated, converged"), buffer.toString());
  }

  @Test
  void invalidArgumentsReturnInvalidArgs() {
    assertEquals(ExitCode.INVALID_ARGS, LabCli.run(new String[] {"routers=0"}));
    assertEquals(ExitCode.INVALID_ARGS, LabCli.run(new String[] {"format=xml"}));
    assertEquals(ExitCode.INVALID_ARGS, LabCli.run(new String[] {"clock=sundial"}));
    assertEquals(ExitCode.INVALID_ARGS, LabCli.run(new String[] {"ospf.deadIntervalSeconds=5"}));
    assertEquals(ExitCode.INVALID_ARGS, LabCli.run(new String[] {"routers"}));
    assertEquals(ExitCode.INVALID_ARGS, LabCli.run(new String[] {"routers=2", "--dry-run"}));
    assertTrue(buffer.toString().contains("usage: lab"));
    assertTrue(appender.list.stream().anyMatch(event -> event.getLevel() == Level.ERROR));
  }

  @Test
  void missingConfigFileIsRejected() {
    ExitCode code = LabCli.run(new String[] {"config=" + tempDir.resolve("absent.yaml")});

    assertEquals(ExitCode.INVALID_ARGS, code);
  }

  @Test
  void malformedYamlIsConfigError() throws Exception {
    Path config = Files.writeString(tempDir.resolve("bad.yaml"), "common: [oops\n");

    assertEquals(ExitCode.CONFIG_ERROR, LabCli.run(new String[] {"config=" + config}));
  }

  @Test
  void wallClockModeRunsOnTimerThread() {
    ExitCode code = LabCli.run(new String[] {"routers=1", "seconds=1", "clock=wall"});

    assertEquals(ExitCode.SUCCESS, code);
    assertTrue(buffer.toString().contains("reply from 192.168.2.10 ttl=63"), buffer.toString());
  }
}
