package org.albs.exporter.application.pipeline;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;
import java.util.Optional;
import org.albs.exporter.application.port.MetricsPort;
import org.albs.exporter.application.port.SigningPort;
import org.albs.exporter.application.port.SigningPort.SignResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Produces {@code repodata/repomd.xml.asc} through the signing service.
 *
 * <p>Failures are logged and reported as {@link SigningStatus#FAILED}; the repository stays unsigned.</p>
 *
 * @since 0.1.0
 */
public final class RepomdSigner {
  private static final Logger log = LoggerFactory.getLogger(RepomdSigner.class);

  private final SigningPort signing;
  private final MetricsPort metrics;

  public RepomdSigner(SigningPort signing, MetricsPort metrics) {
    this.signing = Objects.requireNonNull(signing, "signing");
    this.metrics = Objects.requireNonNullElse(metrics, MetricsPort.NO_OP);
  }

  /**
   * Signs the manifest of one repository.
   *
   * @param repodata {@code repodata} directory
   * @param keyId signing key, empty to skip
   * @return signing outcome
   * @throws InterruptedException when interrupted while waiting for the service
   */
  public SigningStatus sign(Path repodata, Optional<String> keyId) throws InterruptedException {
    if (keyId.isEmpty()) {
      log.warn("No sign key for {}, leaving repository unsigned", repodata);
      metrics.increment("signing.skipped");
      return SigningStatus.SKIPPED;
    }
    Path repomd = repodata.resolve(ExportLayout.REPOMD);
    try {
      String content = Files.readString(repomd, StandardCharsets.UTF_8);
      SignResult result = signing.sign(content, keyId.get());
      if (!result.succeeded()) {
        log.error("Signing {} with {} failed: {}", repomd, keyId.get(), result.error().orElse(""));
        metrics.increment("signing.failed");
        return SigningStatus.FAILED;
      }
      Files.writeString(repodata.resolve(ExportLayout.REPOMD_SIGNATURE), result.signature().get(),
          StandardCharsets.UTF_8);
      log.info("Signed {} with {}", repomd, keyId.get());
      metrics.increment("signing.signed");
      return SigningStatus.SIGNED;
    } catch (IOException ex) {
      log.error("Signing {} failed: {}", repomd, ex.getMessage(), ex);
      metrics.increment("signing.failed");
      return SigningStatus.FAILED;
    }
  }
}
