package org.albs.exporter.api;

import java.io.IOException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.albs.exporter.application.pipeline.ExportLayout;
import org.albs.exporter.application.pipeline.ExportReport;
import org.albs.exporter.application.pipeline.ExportScope;
import org.albs.exporter.application.pipeline.ExportSelection;
import org.albs.exporter.application.pipeline.PlatformScope;
import org.albs.exporter.application.pipeline.ScopeResolutionException;
import org.albs.exporter.application.port.MetricsPort;
import org.albs.exporter.application.task.UnitOutcome;
import org.albs.exporter.config.CompositionRoot;
import org.albs.exporter.config.DefaultsForMode;
import org.albs.exporter.config.ExporterConfig;
import org.albs.exporter.domain.Repository;
import org.albs.exporter.domain.ViolationReport;
import org.albs.exporter.logging.LoggingConfigurator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry point of {@code packages-exporter export}.
 *
 * @since 0.1.0
 */
public final class ExportCli {
  private static final Logger log = LoggerFactory.getLogger(ExportCli.class);
  static final String SUMMARY_USAGE =
      "usage: export (platforms=NAME[,NAME]|repos=ID[,ID] [arches=ARCH[,ARCH]]|release=ID) "
          + "[config=PATH] [key=value ...] [--dry-run] [--verbose]";
  private static final String HELP_TEXT = """
      Export repositories to the filesystem, verify package signatures and sign repository metadata

      Usage:
        export <selection> [options]

      Selection (exactly one):
        platforms=NAME[,NAME]     Every production repository of the named platforms
        repos=ID[,ID]             Repositories by id
          arches=ARCH[,ARCH]      Only export these architectures of the selected repositories
        release=ID                Production repositories referenced by a release plan

      Options:
        config=PATH               YAML configuration (common + export sections)
        pulp.host=URL             Repository service base URL
        sign.url=URL              Signing service base URL
        export.root=PATH          Root directory exports are written under
        export.workers=N          Concurrent repositories (default 4)
        noarch.mode=COPY|CHECK|OFF  Noarch reconciliation before hardening (default COPY)
        metricsExporter=otlp|none   Metrics exporter (default otlp)
        --dry-run                 Print the resolved repositories and export paths only
        --verbose                 Enable DEBUG logging
        --help                    Show this message

      Exit codes:
        0 success, 1 finished with failures or signature violations, 2 invalid arguments,
        3 I/O error, 4 configuration or selection rejected, 130 interrupted
      """;

  private ExportCli() {}

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
      log.debug("Verbose logging enabled for export CLI");
    }
    if (!input.unknownFlags().isEmpty()) {
      log.error("Unknown export flags: {}", input.unknownFlags());
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }

    Map<String, String> effective;
    ExportSelection selection;
    try {
      Map<String, String> kv = new LinkedHashMap<>(CliArgsParser.toMap(input.keyValueArgs()));
      effective = ConfigCliUtils.effectiveConfig(DefaultsForMode.EXPORT, kv, log::warn);
      TelemetryConfigurator.configureMetrics(effective);
      selection = selection(effective);
    } catch (IllegalArgumentException ex) {
      log.error("Invalid export arguments: {}", ex.getMessage());
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    } catch (IOException ex) {
      log.error("Unable to read configuration file", ex);
      return ExitCode.IO_ERROR;
    }
    boolean dryRun = input.dryRun() || ConfigCliUtils.parseBoolean(effective, "dryRun");

    ExporterConfig config;
    try {
      config = ExporterConfig.fromMap(effective);
    } catch (IllegalArgumentException ex) {
      log.error("Invalid export configuration: {}", ex.getMessage());
      return ExitCode.CONFIG_ERROR;
    }

    try (CompositionRoot root = dryRun
        ? new CompositionRoot(config, MetricsPort.NO_OP)
        : new CompositionRoot(config)) {
      if (dryRun) {
        ExportScope scope = root.scopeResolver().resolve(selection);
        printDryRunPlan(scope, new ExportLayout(config.exportRoot()), config);
        return ExitCode.SUCCESS;
      }
      log.info("Starting export of {}", describe(selection));
      ExportReport report = root.exportUseCase().run(selection);
      printSummary(report, config);
      return report.state() == ExportReport.State.SUCCEEDED ? ExitCode.SUCCESS : ExitCode.PARTIAL_FAILURE;
    } catch (ScopeResolutionException ex) {
      log.error("Export selection rejected: {}", ex.getMessage());
      return ExitCode.CONFIG_ERROR;
    } catch (IOException ex) {
      log.error("Export I/O failure", ex);
      return ExitCode.IO_ERROR;
    } catch (IllegalArgumentException ex) {
      log.error("Export configuration error: {}", ex.getMessage(), ex);
      return ExitCode.CONFIG_ERROR;
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      log.error("Export interrupted; shutting down", ex);
      return ExitCode.INTERRUPTED;
    } catch (RuntimeException ex) {
      log.error("Unexpected runtime failure in export", ex);
      return ExitCode.RUNTIME_FAILURE;
    }
  }

  static ExportSelection selection(Map<String, String> settings) {
    List<String> platforms = CliArgsParser.splitList(settings.get("platforms"));
    List<Long> repos = CliArgsParser.splitIds("repos", settings.get("repos"));
    List<String> arches = CliArgsParser.splitList(settings.get("arches"));
    List<Long> releases = CliArgsParser.splitIds("release", settings.get("release"));
    if (releases.size() > 1) {
      throw new IllegalArgumentException("release takes a single id");
    }
    Optional<Long> release = releases.stream().findFirst();
    return new ExportSelection(platforms, repos, arches, release);
  }

  private static String describe(ExportSelection selection) {
    if (!selection.platformNames().isEmpty()) {
      return "platforms " + selection.platformNames();
    }
    if (!selection.repositoryIds().isEmpty()) {
      return "repositories " + selection.repositoryIds()
          + (selection.arches().isEmpty() ? "" : " limited to " + selection.arches());
    }
    return selection.releaseId().map(id -> "release " + id).orElse("nothing");
  }

  private static void printDryRunPlan(ExportScope scope, ExportLayout layout, ExporterConfig config) {
    List<String> lines = new ArrayList<>();
    lines.add("Export dry-run: nothing will be exported.");
    lines.add(" Export root      : " + config.exportRoot());
    lines.add(" Noarch mode      : " + config.noarchMode());
    lines.add(" Workers          : " + config.workers());
    for (PlatformScope platform : scope.platforms()) {
      lines.add(" Platform " + platform.platform().name()
          + " (keys " + String.join(",", platform.authorizedKeys()) + ")");
      for (Repository repo : platform.exportable()) {
        lines.add("   " + repo.exporterName() + " -> " + layout.packagesDirectory(repo));
      }
    }
    lines.add(" " + scope.exportable().size() + " repositories selected. Re-run without --dry-run to export.");
    CliPrinter.printLines(lines);
  }

  private static void printSummary(ExportReport report, ExporterConfig config) {
    List<String> lines = new ArrayList<>();
    lines.add("Export " + report.state() + ": " + report.exportedPaths().size() + " directories exported");
    for (UnitOutcome failure : report.failures()) {
      lines.add(" FAILED [" + failure.stage() + "] " + failure.subject() + ": " + failure.detail());
    }
    for (ViolationReport violations : report.violations()) {
      lines.add(" VIOLATIONS " + violations.directory() + ": " + violations.violationCount()
          + " packages, details in " + config.errorLog());
    }
    CliPrinter.printLines(lines);
  }
}
