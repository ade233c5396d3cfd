package org.albs.exporter.application.pipeline;

import static org.junit.jupiter.api.Assertions.assertEquals;

import java.nio.file.Path;
import java.util.List;
import java.util.Set;
import org.albs.exporter.application.task.UnitOutcome;
import org.albs.exporter.domain.ViolationReport;
import org.junit.jupiter.api.Test;

class ExportReportTest {
  private final Path dir = Path.of("/srv/exports/BaseOS/x86_64/os/Packages");

  @Test
  void emptyReportSucceeds() {
    assertEquals(ExportReport.State.SUCCEEDED, ExportReport.empty().state());
  }

  @Test
  void cleanViolationReportsAreDropped() {
    ExportReport report = new ExportReport(
        List.of(UnitOutcome.ok("export", "BaseOS-x86_64")), List.of(new ViolationReport(dir, Set.of())), List.of(dir));

    assertEquals(List.of(), report.violations());
    assertEquals(ExportReport.State.SUCCEEDED, report.state());
  }

  @Test
  void anyFailureOrViolationIsPartial() {
    ViolationReport violations = new ViolationReport(dir, Set.of());
    violations.unsigned(dir.resolve("a.rpm"));

    ExportReport failed = new ExportReport(
        List.of(UnitOutcome.failed("export", "BaseOS-x86_64", "boom")), List.of(), List.of());
    ExportReport violated = new ExportReport(List.of(), List.of(violations), List.of(dir));

    assertEquals(ExportReport.State.PARTIAL_FAILURE, failed.state());
    assertEquals(1, failed.failures().size());
    assertEquals(ExportReport.State.PARTIAL_FAILURE, violated.state());
  }
}
