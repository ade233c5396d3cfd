package org.albs.exporter.application.task;

import java.util.Objects;

/**
 * Outcome of one unit of work within a pipeline stage.
 *
 * @param stage stage name, e.g. {@code export} or {@code harden}
 * @param subject unit identity, usually a repository or directory name
 * @param succeeded whether the unit completed without error
 * @param detail failure description; empty on success
 * @since 0.1.0
 */
public record UnitOutcome(String stage, String subject, boolean succeeded, String detail) {

  public UnitOutcome {
    Objects.requireNonNull(stage, "stage");
    Objects.requireNonNull(subject, "subject");
    detail = Objects.requireNonNullElse(detail, "");
  }

  public static UnitOutcome ok(String stage, String subject) {
    return new UnitOutcome(stage, subject, true, "");
  }

  public static UnitOutcome failed(String stage, String subject, String detail) {
    return new UnitOutcome(stage, subject, false, detail);
  }

  public static UnitOutcome failed(String stage, String subject, Throwable cause) {
    String message = cause.getMessage();
    return failed(stage, subject, cause.getClass().getSimpleName() + (message == null ? "" : ": " + message));
  }
}
