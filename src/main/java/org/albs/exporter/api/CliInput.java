package org.albs.exporter.api;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Command-line arguments of an exporter command: the {@code --help}, {@code --verbose} and
 * {@code --dry-run} switches, and the ordered {@code key=value} tokens.
 *
 * <p>Switches are matched case-insensitively. Any other dash-prefixed token without {@code =} is kept as an
 * unknown flag so the command can reject it instead of silently ignoring a typo such as
 * {@code --dryrun}.</p>
 */
public final class CliInput {
  private static final List<String> HELP_FLAGS = List.of("--help", "-h", "help");
  private static final List<String> VERBOSE_FLAGS = List.of("--verbose", "-v", "--debug");
  private static final List<String> DRY_RUN_FLAGS = List.of("--dry-run", "-n");

  private final List<String> keyValueArgs;
  private final List<String> unknownFlags;
  private final boolean help;
  private final boolean verbose;
  private final boolean dryRun;

  private CliInput(List<String> keyValueArgs, List<String> unknownFlags, boolean help, boolean verbose,
      boolean dryRun) {
    this.keyValueArgs = List.copyOf(keyValueArgs);
    this.unknownFlags = List.copyOf(unknownFlags);
    this.help = help;
    this.verbose = verbose;
    this.dryRun = dryRun;
  }

  /**
   * Splits raw arguments into switches and {@code key=value} tokens.
   *
   * @param args raw CLI arguments (may be {@code null})
   * @return parsed arguments; blank tokens are dropped
   */
  public static CliInput parse(String[] args) {
    List<String> kv = new ArrayList<>();
    List<String> unknown = new ArrayList<>();
    boolean help = false;
    boolean verbose = false;
    boolean dryRun = false;
    if (args != null) {
      for (String raw : args) {
        String arg = raw == null ? "" : raw.trim();
        if (arg.isEmpty()) {
          continue;
        }
        String lower = arg.toLowerCase(Locale.ROOT);
        if (HELP_FLAGS.contains(lower)) {
          help = true;
        } else if (VERBOSE_FLAGS.contains(lower)) {
          verbose = true;
        } else if (DRY_RUN_FLAGS.contains(lower)) {
          dryRun = true;
        } else if (arg.startsWith("-") && !arg.contains("=")) {
          unknown.add(arg);
        } else {
          kv.add(arg);
        }
      }
    }
    return new CliInput(kv, unknown, help, verbose, dryRun);
  }

  public String[] keyValueArgs() {
    return keyValueArgs.toArray(String[]::new);
  }

  public List<String> unknownFlags() {
    return unknownFlags;
  }

  public boolean help() {
    return help;
  }

  public boolean verbose() {
    return verbose;
  }

  public boolean dryRun() {
    return dryRun;
  }
}
