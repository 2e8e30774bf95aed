package ca.gc.cra.netsim.api;

import java.io.FileDescriptor;
import java.io.FileOutputStream;
import java.io.OutputStreamWriter;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;

/**
 * Console output helper for usage text and lab reports.
 *
 * <p>Writes to the native stdout descriptor so report output stays separate from Logback's console appender
 * configuration.</p>
 */
public final class CliPrinter {
  private static final PrintWriter STDOUT = new PrintWriter(
      new OutputStreamWriter(new FileOutputStream(FileDescriptor.out), StandardCharsets.UTF_8), true);
  private static volatile PrintWriter override;

  private CliPrinter() {
    // Utility
  }

  /**
   * Prints a single line to stdout.
   *
   * @param message line to emit
   */
  public static void println(String message) {
    writer().println(message);
  }

  /**
   * Prints lines to stdout.
   *
   * @param lines lines to emit; {@code null} prints nothing
   */
  public static void printLines(Iterable<String> lines) {
    if (lines == null) {
      return;
    }
    PrintWriter writer = writer();
    for (String line : lines) {
      writer.println(line);
    }
    writer.flush();
  }

  static void setWriterForTesting(PrintWriter writer) {
    override = writer;
  }

  static void clearTestWriter() {
    override = null;
  }

  private static PrintWriter writer() {
    return override != null ? override : STDOUT;
  }
}
