package br.rio.confere.api;

import br.rio.confere.logging.LoggingConfigurator;
import java.util.Arrays;
import java.util.Locale;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * CONFERE CLI dispatcher that routes to subcommands.
 */
public final class Main {
  private static final Logger log = LoggerFactory.getLogger(Main.class);
  private static final String SUMMARY_USAGE = "usage: confere <run|resume|conformity> [options]";
  private static final String HELP_TEXT = """
      CONFERE: conformity of Rio de Janeiro contracts with their Diario Oficial publications

      Usage:
        confere <command> [options]

      Commands:
        run         Walk the contracts portal, locate publications, and evaluate conformity
        resume      Continue an interrupted run from its checkpoint (resume runId=ID)
        conformity  Evaluate stored contract/publication pairs offline

      Global flags:
        --help      Show this message (or <command> --help)
        --verbose   Enable DEBUG logging before dispatching to the subcommand
      """;

  private Main() {}

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
    if (args == null || args.length == 0) {
      log.error("Missing command");
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_CONFIG;
    }
    String command = args[0] == null ? "" : args[0].trim().toLowerCase(Locale.ROOT);
    String[] delegateArgs = Arrays.copyOfRange(args, 1, args.length);

    if (command.equals("--help") || command.equals("-h") || command.equals("help")) {
      CliPrinter.println(HELP_TEXT.stripTrailing());
      return ExitCode.SUCCESS;
    }
    if (command.equals("--verbose") || command.equals("-v")) {
      LoggingConfigurator.enableVerboseLogging();
      log.debug("Verbose logging enabled for dispatcher");
      return run(delegateArgs);
    }

    return switch (command) {
      case "run" -> RunCli.run(delegateArgs, false);
      case "resume" -> RunCli.run(delegateArgs, true);
      case "conformity" -> ConformityCli.run(delegateArgs);
      default -> {
        log.error("Unknown command: {}", command);
        CliPrinter.println(SUMMARY_USAGE);
        yield ExitCode.INVALID_CONFIG;
      }
    };
  }
}
