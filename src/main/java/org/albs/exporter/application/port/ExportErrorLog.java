package org.albs.exporter.application.port;

import java.io.IOException;
import org.albs.exporter.domain.ViolationReport;

/**
 * Append-only log of signature violations shared by concurrent workers and successive runs.
 *
 * @since 0.1.0
 */
public interface ExportErrorLog {

  /**
   * Appends a non-empty report; empty reports are ignored.
   *
   * @param report violations of one directory
   * @throws IOException when the log cannot be written
   */
  void append(ViolationReport report) throws IOException;
}
