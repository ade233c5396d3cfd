package org.albs.exporter.application.pipeline;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;
import org.albs.exporter.application.pipeline.PipelineFakes.FakeSigning;
import org.albs.exporter.testutil.RecordingMetricsPort;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class RepomdSignerTest {
  @TempDir
  Path repodata;

  private final FakeSigning signing = new FakeSigning();
  private final RecordingMetricsPort metrics = new RecordingMetricsPort();
  private final RepomdSigner signer = new RepomdSigner(signing, metrics);

  @BeforeEach
  void writeManifest() throws Exception {
    Files.writeString(repodata.resolve(ExportLayout.REPOMD), "<repomd/>");
  }

  @Test
  void writesDetachedSignatureNextToManifest() throws Exception {
    SigningStatus status = signer.sign(repodata, Optional.of("51d6647ec21ad6ea"));

    assertEquals(SigningStatus.SIGNED, status);
    String signature = Files.readString(repodata.resolve(ExportLayout.REPOMD_SIGNATURE));
    assertTrue(signature.startsWith("-----BEGIN PGP SIGNATURE-----"));
    assertEquals(List.of("51d6647ec21ad6ea"), signing.signedWith);
    assertEquals(1, metrics.count("signing.signed"));
  }

  @Test
  void serviceErrorLeavesRepositoryUnsigned() throws Exception {
    signing.error = "key not found";

    assertEquals(SigningStatus.FAILED, signer.sign(repodata, Optional.of("51d6647ec21ad6ea")));
    assertFalse(Files.exists(repodata.resolve(ExportLayout.REPOMD_SIGNATURE)));
    assertEquals(1, metrics.count("signing.failed"));
  }

  @Test
  void missingManifestIsAFailure() throws Exception {
    Files.delete(repodata.resolve(ExportLayout.REPOMD));

    assertEquals(SigningStatus.FAILED, signer.sign(repodata, Optional.of("51d6647ec21ad6ea")));
    assertTrue(signing.signedWith.isEmpty());
  }

  @Test
  void noKeySkipsSigning() throws Exception {
    assertEquals(SigningStatus.SKIPPED, signer.sign(repodata, Optional.empty()));
    assertTrue(signing.signedWith.isEmpty());
    assertEquals(1, metrics.count("signing.skipped"));
  }
}
