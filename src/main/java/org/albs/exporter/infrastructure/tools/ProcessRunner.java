package org.albs.exporter.infrastructure.tools;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.TimeUnit;
import org.albs.exporter.application.port.ToolInvocationException;
import org.albs.exporter.application.port.ToolResult;
import org.albs.exporter.logging.Logs;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> {@link CommandRunner} on top of {@link ProcessBuilder}.
 * <p>Output is redirected to temporary files so a chatty tool never blocks on a full pipe. A process
 * that outlives the timeout, or whose caller is interrupted, is destroyed forcibly.</p>
 * <p><strong>Thread-safety:</strong> Stateless; safe for concurrent use.</p>
 *
 * @since 0.1.0
 */
public final class ProcessRunner implements CommandRunner {
  private static final Logger log = LoggerFactory.getLogger(ProcessRunner.class);
  private static final long DESTROY_GRACE_SECONDS = 5;
  private static final int MAX_DETAIL_BYTES = 2048;

  private final Duration timeout;

  public ProcessRunner(Duration timeout) {
    this.timeout = Objects.requireNonNull(timeout, "timeout");
    if (timeout.isNegative() || timeout.isZero()) {
      throw new IllegalArgumentException("timeout must be positive");
    }
  }

  @Override
  public ToolResult run(List<String> command) throws IOException, InterruptedException {
    if (command == null || command.isEmpty()) {
      throw new IllegalArgumentException("command must not be empty");
    }
    Path stdout = Files.createTempFile("exporter-tool", ".out");
    Path stderr = Files.createTempFile("exporter-tool", ".err");
    try {
      Process process;
      try {
        process = new ProcessBuilder(command)
            .redirectOutput(stdout.toFile())
            .redirectError(stderr.toFile())
            .start();
      } catch (IOException ex) {
        throw new ToolInvocationException(command, "cannot start", ex);
      }
      process.getOutputStream().close();
      log.debug("Started {}", command);
      try {
        if (!process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
          destroy(process);
          throw new ToolInvocationException(command, "timed out after " + timeout, null);
        }
      } catch (InterruptedException ex) {
        destroy(process);
        throw ex;
      }
      return new ToolResult(
          process.exitValue(),
          decode(stdout),
          decode(stderr));
    } finally {
      Files.deleteIfExists(stdout);
      Files.deleteIfExists(stderr);
    }
  }

  /**
   * Runs {@code command} and fails on a non-zero exit status.
   *
   * @param runner runner to use
   * @param command program and arguments
   * @return captured output of a successful run
   * @throws ToolInvocationException on a non-zero exit status
   */
  static ToolResult runChecked(CommandRunner runner, List<String> command)
      throws IOException, InterruptedException {
    ToolResult result = runner.run(command);
    if (!result.succeeded()) {
      String detail = result.stderr().isBlank() ? result.stdout() : result.stderr();
      throw new ToolInvocationException(command, result.exitCode(), Logs.excerpt(detail, MAX_DETAIL_BYTES));
    }
    return result;
  }

  private static void destroy(Process process) throws InterruptedException {
    process.destroyForcibly();
    process.waitFor(DESTROY_GRACE_SECONDS, TimeUnit.SECONDS);
  }

  // package descriptions are not always UTF-8; malformed bytes become U+FFFD
  private static String decode(Path capture) throws IOException {
    return new String(Files.readAllBytes(capture), StandardCharsets.UTF_8);
  }
}
