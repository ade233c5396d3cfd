package org.albs.exporter.api;

import java.util.Arrays;
import java.util.Locale;
import org.albs.exporter.logging.LoggingConfigurator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Command dispatcher of {@code packages-exporter}.
 *
 * @since 0.1.0
 */
public final class Main {
  private static final Logger log = LoggerFactory.getLogger(Main.class);
  private static final String SUMMARY_USAGE = "usage: packages-exporter <export|noarch> [options]";
  private static final String HELP_TEXT = """
      Packages exporter

      Usage:
        packages-exporter <command> [options]

      Commands:
        export      Export, verify and sign repositories (export --help for details)
        noarch      Reconcile noarch packages of a distribution (noarch --help for details)

      Global flags:
        --help      Show this message
        --verbose   Enable DEBUG logging before dispatching to the command
      """;

  private Main() {}

  public static void main(String[] args) {
    ExitCode exit = run(args);
    System.exit(exit.code());
  }

  /**
   * Dispatches a command and returns its exit code without terminating the JVM.
   *
   * @param args dispatcher arguments; the first non-flag token is the command
   * @return exit code reported by the command
   */
  static ExitCode run(String[] args) {
    String[] tokens = args == null ? new String[0] : args;
    int commandIndex = -1;
    for (int i = 0; i < tokens.length; i++) {
      if (tokens[i] != null && !tokens[i].isBlank() && !tokens[i].trim().startsWith("-")) {
        commandIndex = i;
        break;
      }
    }
    if (commandIndex < 0) {
      CliInput input = CliInput.parse(tokens);
      if (input.help()) {
        CliPrinter.println(HELP_TEXT.stripTrailing());
        return ExitCode.SUCCESS;
      }
      log.error("Missing command");
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }

    String command = tokens[commandIndex].trim().toLowerCase(Locale.ROOT);
    String[] delegateArgs = new String[tokens.length - 1];
    System.arraycopy(tokens, 0, delegateArgs, 0, commandIndex);
    System.arraycopy(tokens, commandIndex + 1, delegateArgs, commandIndex, tokens.length - commandIndex - 1);
    if (CliInput.parse(Arrays.copyOf(tokens, commandIndex)).verbose()) {
      LoggingConfigurator.enableVerboseLogging();
      log.debug("Verbose logging enabled for dispatcher");
    }

    return switch (command) {
      case "export" -> ExportCli.run(delegateArgs);
      case "noarch" -> NoarchCli.run(delegateArgs);
      default -> {
        log.error("Unknown command: {}", command);
        CliPrinter.println(SUMMARY_USAGE);
        yield ExitCode.INVALID_ARGS;
      }
    };
  }
}
