package ca.gc.cra.rendezvous.api;

import ca.gc.cra.rendezvous.logging.LoggingConfigurator;
import java.util.Arrays;
import java.util.Locale;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Rendezvous CLI dispatcher that routes to subcommands.
 *
 * @since 0.1.0
 */
public final class Main {
  private static final Logger log = LoggerFactory.getLogger(Main.class);
  private static final String SUMMARY_USAGE = "usage: rendezvous <serve> [options]";
  private static final String HELP_TEXT = """
      Rendezvous command dispatcher

      Usage:
        rendezvous <command> [options]

      Commands:
        serve       WebSocket signaling server (serve --help for details)

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
    int commandIndex = firstCommandIndex(safeArgs);
    if (commandIndex < 0) {
      CliInput input = CliInput.parse(safeArgs);
      if (input.help()) {
        CliPrinter.println(HELP_TEXT.stripTrailing());
        return ExitCode.SUCCESS;
      }
      log.error("Missing command");
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }

    String command = safeArgs[commandIndex].trim().toLowerCase(Locale.ROOT);
    CliInput global = CliInput.parse(Arrays.copyOfRange(safeArgs, 0, commandIndex));
    if (global.help()) {
      CliPrinter.println(HELP_TEXT.stripTrailing());
      return ExitCode.SUCCESS;
    }
    if (global.verbose()) {
      LoggingConfigurator.enableVerboseLogging();
      log.debug("Verbose logging enabled for dispatcher");
    }
    String[] delegateArgs = Arrays.copyOfRange(safeArgs, commandIndex + 1, safeArgs.length);

    return switch (command) {
      case "serve" -> ServeCli.run(delegateArgs);
      default -> {
        log.error("Unknown command: {}", command);
        CliPrinter.println(SUMMARY_USAGE);
        yield ExitCode.INVALID_ARGS;
      }
    };
  }

  private static int firstCommandIndex(String[] args) {
    for (int i = 0; i < args.length; i++) {
      String arg = args[i] == null ? "" : args[i].trim();
      if (!arg.isEmpty() && !arg.startsWith("-") && !arg.contains("=") && !arg.equalsIgnoreCase("help")) {
        return i;
      }
    }
    return -1;
  }
}
