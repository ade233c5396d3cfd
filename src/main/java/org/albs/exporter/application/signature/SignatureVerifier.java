package org.albs.exporter.application.signature;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import org.albs.exporter.application.port.MetricsPort;
import org.albs.exporter.application.port.PackageInspectorPort;
import org.albs.exporter.application.port.ToolResult;
import org.albs.exporter.domain.ViolationReport;
import org.albs.exporter.logging.Logs;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Classifies every package of an exported directory by its signature.
 * <p><strong>Why:</strong> Packages signed with an unexpected key or not signed at all must never reach a
 * mirror unnoticed.</p>
 * <p><strong>Classification:</strong>
 * <ul>
 *   <li>Header query failed, or no parsable {@code Signature} line: inspection failed.</li>
 *   <li>Key identifier {@code none}: unsigned.</li>
 *   <li>Key identifier authorized directly or as a known subkey of an authorized key: accepted.</li>
 *   <li>Any other key identifier: wrong key.</li>
 * </ul>
 * <p>Every file is evaluated; violations are collected, never thrown.</p>
 * <p><strong>Thread-safety:</strong> Stateless apart from its collaborators; directories may be verified
 * concurrently.</p>
 *
 * @since 0.1.0
 */
public final class SignatureVerifier {
  private static final Logger log = LoggerFactory.getLogger(SignatureVerifier.class);
  private static final String PACKAGE_SUFFIX = ".rpm";
  private static final int MAX_STDERR_BYTES = 512;

  private final PackageInspectorPort inspector;
  private final MetricsPort metrics;

  public SignatureVerifier(PackageInspectorPort inspector, MetricsPort metrics) {
    this.inspector = Objects.requireNonNull(inspector, "inspector");
    this.metrics = Objects.requireNonNullElse(metrics, MetricsPort.NO_OP);
  }

  /**
   * Verifies one directory.
   *
   * @param directory directory holding package files (not traversed recursively)
   * @param authorizedKeys keys authorized for the owning platform
   * @param subkeys known subkey delegation
   * @return violations found in the directory
   * @throws IOException when the directory cannot be listed
   * @throws InterruptedException when the worker is interrupted
   */
  public ViolationReport verify(Path directory, Set<String> authorizedKeys, KnownSubkeys subkeys)
      throws IOException, InterruptedException {
    Objects.requireNonNull(directory, "directory");
    Set<String> authorized = authorizedKeys.stream()
        .map(key -> key.trim().toLowerCase(Locale.ROOT))
        .collect(Collectors.toUnmodifiableSet());
    KnownSubkeys delegation = Objects.requireNonNullElse(subkeys, KnownSubkeys.empty());
    ViolationReport report = new ViolationReport(directory, authorized);

    List<Path> files;
    try (Stream<Path> stream = Files.list(directory)) {
      files = stream.sorted().collect(Collectors.toList());
    }
    for (Path file : files) {
      if (!Files.isRegularFile(file) || !file.getFileName().toString().endsWith(PACKAGE_SUFFIX)) {
        log.debug("Skipping {}: not a package file", file);
        continue;
      }
      metrics.increment("signature.files.scanned");
      classify(file, authorized, delegation, report);
    }
    if (!report.isEmpty()) {
      for (int i = 0; i < report.violationCount(); i++) {
        metrics.increment("signature.violations");
      }
      log.warn("{} signature violations in {}", report.violationCount(), directory);
    }
    return report;
  }

  private void classify(Path file, Set<String> authorized, KnownSubkeys delegation, ViolationReport report)
      throws InterruptedException {
    ToolResult result;
    try {
      result = inspector.inspect(file);
    } catch (IOException ex) {
      log.warn("Cannot inspect {}: {}", file, ex.getMessage());
      report.inspectionFailed(file);
      return;
    }
    if (!result.succeeded()) {
      log.warn("Header query failed for {} with exit {}: {}", file, result.exitCode(),
          Logs.excerpt(result.stderr(), MAX_STDERR_BYTES));
      report.inspectionFailed(file);
      return;
    }
    Optional<String> keyId = SignatureLineParser.signatureLine(result.stdout())
        .flatMap(SignatureLineParser::keyId);
    if (keyId.isEmpty()) {
      log.warn("No signature information for {}", file);
      report.inspectionFailed(file);
      return;
    }
    String key = keyId.get();
    if (SignatureLineParser.UNSIGNED.equals(key)) {
      report.unsigned(file);
    } else if (!authorized.contains(key) && !delegation.delegates(authorized, key)) {
      report.wrongKey(file, key);
    } else {
      log.debug("{} signed with {}", file, key);
    }
  }
}
