package ca.gc.cra.netsim.api;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.PrintWriter;
import java.io.StringWriter;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class MainTest {
  private StringWriter buffer;

  @BeforeEach
  void setUp() {
    buffer = new StringWriter();
    CliPrinter.setWriterForTesting(new PrintWriter(buffer));
  }

  @AfterEach
  void tearDown() {
    CliPrinter.clearTestWriter();
  }

  @Test
  void helpListsCommands() {
    assertEquals(ExitCode.SUCCESS, Main.run(new String[] {"--help"}));
    assertTrue(buffer.toString().contains("lab "));
  }

  @Test
  void missingCommandIsInvalid() {
    assertEquals(ExitCode.INVALID_ARGS, Main.run(new String[0]));
    assertTrue(buffer.toString().contains("usage: netsim"));
  }

  @Test
  void unknownCommandIsInvalid() {
    assertEquals(ExitCode.INVALID_ARGS, Main.run(new String[] {"capture"}));
  }

  @Test
  void dispatchesToLab() {
    assertEquals(ExitCode.SUCCESS, Main.run(new String[] {"LAB", "routers=1", "seconds=1"}));
    assertTrue(buffer.toString().contains("Lab: 1 router(s)"));
  }

  @Test
  void dispatchesLabHelp() {
    assertEquals(ExitCode.SUCCESS, Main.run(new String[] {"lab", "--help"}));
    assertTrue(buffer.toString().contains("NETSIM lab runner"));
  }
}
