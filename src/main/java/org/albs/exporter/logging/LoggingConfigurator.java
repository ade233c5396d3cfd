package org.albs.exporter.logging;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import java.util.List;
import org.slf4j.ILoggerFactory;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Adjusts runtime logging for CLI-driven runs.
 * <p><strong>Why:</strong> {@code --verbose} lets operators follow every exporter, tool invocation and
 * reconciliation decision without editing {@code logback.xml}. Only the exporter's own loggers are raised;
 * the telemetry exporter and the JDK HTTP client stay at {@code WARN} so Pulp polling does not drown the
 * run log.</p>
 * <p><strong>Thread-safety:</strong> Intended for the single CLI bootstrap thread.</p>
 *
 * @implNote Tailored for Logback; other SLF4J bindings keep their defaults and a warning is logged.
 * @since 0.1.0
 */
public final class LoggingConfigurator {
  private static final org.slf4j.Logger log = LoggerFactory.getLogger(LoggingConfigurator.class);

  /** Parent logger of every exporter component. */
  public static final String EXPORTER_LOGGER = "org.albs.exporter";

  static final List<String> QUIET_LOGGERS = List.of("io.opentelemetry", "jdk.internal.httpclient");

  private LoggingConfigurator() {
    // Utility
  }

  /**
   * Raises the exporter loggers to DEBUG and pins the third-party loggers at WARN.
   *
   * @return {@code true} when the backend accepted the change
   */
  public static boolean enableVerboseLogging() {
    ILoggerFactory factory = LoggerFactory.getILoggerFactory();
    if (factory instanceof LoggerContext context) {
      Logger exporter = context.getLogger(EXPORTER_LOGGER);
      if (!Level.DEBUG.equals(exporter.getLevel())) {
        exporter.setLevel(Level.DEBUG);
      }
      for (String name : QUIET_LOGGERS) {
        Logger quiet = context.getLogger(name);
        if (quiet.getLevel() == null) {
          quiet.setLevel(Level.WARN);
        }
      }
      log.debug("Verbose logging enabled for {}", EXPORTER_LOGGER);
      return true;
    }
    log.warn("Verbose logging requested but backend {} does not support dynamic level updates",
        factory.getClass().getName());
    return false;
  }
}
