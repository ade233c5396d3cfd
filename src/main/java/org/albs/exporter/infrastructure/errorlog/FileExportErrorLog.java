package org.albs.exporter.infrastructure.errorlog;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.channels.FileLock;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Clock;
import java.time.format.DateTimeFormatter;
import java.util.Objects;
import org.albs.exporter.application.port.ExportErrorLog;
import org.albs.exporter.domain.ViolationReport;

/**
 * <strong>What:</strong> Plaintext {@link ExportErrorLog} accumulated across runs.
 * <p>Each report is written as one block: a {@code # timestamp directory} header followed by the
 * report's sections, terminated by a blank line.</p>
 * <p><strong>Thread-safety:</strong> Appends are serialized within the JVM by a monitor and across
 * processes by an exclusive file lock.</p>
 *
 * @since 0.1.0
 */
public final class FileExportErrorLog implements ExportErrorLog {
  private final Path file;
  private final Clock clock;
  private final Object monitor = new Object();

  public FileExportErrorLog(Path file, Clock clock) {
    this.file = Objects.requireNonNull(file, "file");
    this.clock = Objects.requireNonNull(clock, "clock");
  }

  public Path file() {
    return file;
  }

  @Override
  public void append(ViolationReport report) throws IOException {
    Objects.requireNonNull(report, "report");
    if (report.isEmpty()) {
      return;
    }
    StringBuilder block = new StringBuilder()
        .append("# ")
        .append(DateTimeFormatter.ISO_INSTANT.format(clock.instant()))
        .append(' ')
        .append(report.directory())
        .append('\n');
    for (String line : report.toLogLines()) {
      block.append(line).append('\n');
    }
    block.append('\n');
    ByteBuffer bytes = ByteBuffer.wrap(block.toString().getBytes(StandardCharsets.UTF_8));

    synchronized (monitor) {
      Path parent = file.toAbsolutePath().getParent();
      if (parent != null) {
        Files.createDirectories(parent);
      }
      try (FileChannel channel = FileChannel.open(
              file, StandardOpenOption.CREATE, StandardOpenOption.WRITE, StandardOpenOption.APPEND);
          FileLock lock = channel.lock()) {
        while (bytes.hasRemaining()) {
          channel.write(bytes);
        }
        channel.force(false);
      }
    }
  }
}
