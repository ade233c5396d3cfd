package org.albs.exporter.api;

import java.io.IOException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.albs.exporter.application.noarch.ReconciliationPair;
import org.albs.exporter.application.noarch.ReconciliationPairPlanner;
import org.albs.exporter.application.pipeline.ExportReport;
import org.albs.exporter.application.pipeline.ScopeResolutionException;
import org.albs.exporter.application.port.MetricsPort;
import org.albs.exporter.application.task.UnitOutcome;
import org.albs.exporter.config.CompositionRoot;
import org.albs.exporter.config.DefaultsForMode;
import org.albs.exporter.config.ExporterConfig;
import org.albs.exporter.domain.Architectures;
import org.albs.exporter.domain.Distribution;
import org.albs.exporter.logging.LoggingConfigurator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry point of {@code packages-exporter noarch}: reconciles noarch packages across the architectures of
 * one distribution without exporting anything.
 *
 * @since 0.1.0
 */
public final class NoarchCli {
  private static final Logger log = LoggerFactory.getLogger(NoarchCli.class);
  static final String SUMMARY_USAGE =
      "usage: noarch distribution=NAME [noarch.mode=CHECK|COPY] [noarch.differOnly=true] "
          + "[config=PATH] [--dry-run] [--verbose]";
  private static final String HELP_TEXT = """
      Compare or copy noarch packages between the x86_64 repositories of a distribution and the
      repositories of every other architecture

      Usage:
        noarch distribution=NAME [options]

      Options:
        noarch.mode=CHECK|COPY    CHECK only logs what would change (default), COPY applies it
        noarch.differOnly=true    Only report packages present on both sides with different content
        config=PATH               YAML configuration (common + noarch sections)
        --dry-run                 Print the repository pairs only
        --verbose                 Enable DEBUG logging
        --help                    Show this message
      """;

  private NoarchCli() {}

  public static void main(String[] args) {
    System.exit(run(args).code());
  }

  static ExitCode run(String[] args) {
    CliInput input = CliInput.parse(args);
    if (input.help()) {
      CliPrinter.println(HELP_TEXT.stripTrailing());
      return ExitCode.SUCCESS;
    }
    if (input.verbose()) {
      LoggingConfigurator.enableVerboseLogging();
      log.debug("Verbose logging enabled for noarch CLI");
    }
    if (!input.unknownFlags().isEmpty()) {
      log.error("Unknown noarch flags: {}", input.unknownFlags());
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }

    Map<String, String> effective;
    try {
      Map<String, String> kv = new LinkedHashMap<>(CliArgsParser.toMap(input.keyValueArgs()));
      effective = ConfigCliUtils.effectiveConfig(DefaultsForMode.NOARCH, kv, log::warn);
      TelemetryConfigurator.configureMetrics(effective);
    } catch (IllegalArgumentException ex) {
      log.error("Invalid noarch arguments: {}", ex.getMessage());
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    } catch (IOException ex) {
      log.error("Unable to read configuration file", ex);
      return ExitCode.IO_ERROR;
    }
    boolean dryRun = input.dryRun() || ConfigCliUtils.parseBoolean(effective, "dryRun");
    String distribution = effective.get("distribution").trim();

    ExporterConfig config;
    try {
      config = ExporterConfig.fromMap(effective);
    } catch (IllegalArgumentException ex) {
      log.error("Invalid noarch configuration: {}", ex.getMessage());
      return ExitCode.CONFIG_ERROR;
    }

    try (CompositionRoot root = dryRun
        ? new CompositionRoot(config, MetricsPort.NO_OP)
        : new CompositionRoot(config)) {
      if (dryRun) {
        Distribution resolved = root.catalog().distribution(distribution)
            .orElseThrow(() -> new ScopeResolutionException("unknown distribution: " + distribution));
        printDryRunPlan(resolved, config);
        return ExitCode.SUCCESS;
      }
      ExportReport report = root.distributionNoarchUseCase()
          .run(distribution, config.noarchMode().options(config.differOnly()));
      printSummary(distribution, report);
      return report.state() == ExportReport.State.SUCCEEDED ? ExitCode.SUCCESS : ExitCode.PARTIAL_FAILURE;
    } catch (ScopeResolutionException ex) {
      log.error("Noarch selection rejected: {}", ex.getMessage());
      return ExitCode.CONFIG_ERROR;
    } catch (IOException ex) {
      log.error("Noarch I/O failure", ex);
      return ExitCode.IO_ERROR;
    } catch (IllegalArgumentException ex) {
      log.error("Noarch configuration error: {}", ex.getMessage(), ex);
      return ExitCode.CONFIG_ERROR;
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      log.error("Noarch reconciliation interrupted; shutting down", ex);
      return ExitCode.INTERRUPTED;
    } catch (RuntimeException ex) {
      log.error("Unexpected runtime failure in noarch reconciliation", ex);
      return ExitCode.RUNTIME_FAILURE;
    }
  }

  private static void printDryRunPlan(Distribution distribution, ExporterConfig config) {
    List<ReconciliationPair> pairs = ReconciliationPairPlanner.plan(distribution.repositories().stream()
        .filter(repo -> !repo.isArch(Architectures.SRC))
        .toList());
    List<String> lines = new ArrayList<>();
    lines.add("Noarch dry-run for " + distribution.name() + ": nothing will be compared.");
    lines.add(" Mode             : " + config.noarchMode() + (config.differOnly() ? " (differ only)" : ""));
    pairs.forEach(pair -> lines.add("   " + pair));
    lines.add(" " + pairs.size() + " pairs planned.");
    CliPrinter.printLines(lines);
  }

  private static void printSummary(String distribution, ExportReport report) {
    List<String> lines = new ArrayList<>();
    lines.add("Noarch " + report.state() + " for " + distribution + ": "
        + report.outcomes().size() + " pairs");
    for (UnitOutcome failure : report.failures()) {
      lines.add(" FAILED " + failure.subject() + ": " + failure.detail());
    }
    CliPrinter.printLines(lines);
  }
}
