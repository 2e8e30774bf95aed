package ca.gc.cra.netsim.api;

import ca.gc.cra.netsim.logging.LoggingConfigurator;
import java.util.Arrays;
import java.util.Locale;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * NETSIM CLI dispatcher that routes to subcommands.
 *
 * @since 0.1.0
 */
public final class Main {
  private static final Logger log = LoggerFactory.getLogger(Main.class);
  private static final String SUMMARY_USAGE = "usage: netsim <lab> [options]";
  private static final String HELP_TEXT = """
      NETSIM command dispatcher

      Usage:
        netsim <command> [options]

      Commands:
        lab         Build an OSPF router chain, converge it and ping end to end (lab --help for details)

      Global flags:
        --help      Show this message
        --verbose   Enable DEBUG logging before dispatching to subcommand
      """;

  private Main() {}

  /**
   * Entry point invoked by the JVM.
   *
   * @param args raw CLI arguments
   */
  public static void main(String[] args) {
    ExitCode exit = run(args);
    System.exit(exit.code());
  }

  /**
   * Dispatches a subcommand and returns its exit code without terminating the JVM.
   *
   * @param args dispatcher arguments (first token is the subcommand)
   * @return exit code reported by the delegated CLI
   */
  static ExitCode run(String[] args) {
    String[] safeArgs = args == null ? new String[0] : args;
    if (safeArgs.length > 0 && safeArgs[0] != null && !safeArgs[0].startsWith("-")
        && !safeArgs[0].equalsIgnoreCase("help")) {
      return dispatch(safeArgs[0].trim().toLowerCase(Locale.ROOT),
          Arrays.copyOfRange(safeArgs, 1, safeArgs.length));
    }
    CliInput input = CliInput.parse(safeArgs);
    if (input.help()) {
      CliPrinter.println(HELP_TEXT.stripTrailing());
      return ExitCode.SUCCESS;
    }
    if (input.verbose()) {
      LoggingConfigurator.enableVerboseLogging();
      log.debug("Verbose logging enabled for dispatcher");
    }
    String[] remainder = input.keyValueArgs();
    if (remainder.length == 0) {
      log.error("Missing command");
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }
    return dispatch(remainder[0].toLowerCase(Locale.ROOT), Arrays.copyOfRange(remainder, 1, remainder.length));
  }

  private static ExitCode dispatch(String command, String[] delegateArgs) {
    return switch (command) {
      case "lab" -> LabCli.run(delegateArgs);
      default -> {
        log.error("Unknown command: {}", command);
        CliPrinter.println(SUMMARY_USAGE);
        yield ExitCode.INVALID_ARGS;
      }
    };
  }
}
