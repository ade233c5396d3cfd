package org.albs.exporter.application.pipeline;

import java.nio.file.Path;
import java.util.List;
import org.albs.exporter.application.task.UnitOutcome;
import org.albs.exporter.domain.ViolationReport;

/**
 * Aggregate result of an export or reconciliation run.
 *
 * @param outcomes per-unit outcomes of every stage
 * @param violations non-empty signature violation reports
 * @param exportedPaths directories materialized by this run
 * @since 0.1.0
 */
public record ExportReport(List<UnitOutcome> outcomes, List<ViolationReport> violations, List<Path> exportedPaths) {

  /** Terminal state of a run. */
  public enum State {
    SUCCEEDED,
    PARTIAL_FAILURE
  }

  public ExportReport {
    outcomes = List.copyOf(outcomes);
    violations = violations.stream().filter(report -> !report.isEmpty()).toList();
    exportedPaths = List.copyOf(exportedPaths);
  }

  public static ExportReport empty() {
    return new ExportReport(List.of(), List.of(), List.of());
  }

  public List<UnitOutcome> failures() {
    return outcomes.stream().filter(outcome -> !outcome.succeeded()).toList();
  }

  /**
   * Derives the terminal state.
   *
   * @return {@link State#PARTIAL_FAILURE} when any unit failed or any violation was found
   */
  public State state() {
    return failures().isEmpty() && violations.isEmpty() ? State.SUCCEEDED : State.PARTIAL_FAILURE;
  }
}
