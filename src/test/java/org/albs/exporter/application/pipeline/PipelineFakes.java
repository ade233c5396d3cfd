package org.albs.exporter.application.pipeline;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import org.albs.exporter.application.port.ErrataMergePort;
import org.albs.exporter.application.port.ExportErrorLog;
import org.albs.exporter.application.port.MetadataToolPort;
import org.albs.exporter.application.port.OwnershipPort;
import org.albs.exporter.application.port.PackageInspectorPort;
import org.albs.exporter.application.port.SigningPort;
import org.albs.exporter.application.port.ToolInvocationException;
import org.albs.exporter.application.port.ToolResult;
import org.albs.exporter.domain.SignKey;
import org.albs.exporter.domain.ViolationReport;

/**
 * Hand-written doubles for the post-export ports.
 */
final class PipelineFakes {
  static final String OPERATOR = "builder";
  static final String SERVICE_OWNER = "pulp";

  private PipelineFakes() {}

  /** Records ownership transfers; optionally fails transfers to one owner. */
  static final class RecordingOwnership implements OwnershipPort {
    final List<String> calls = Collections.synchronizedList(new ArrayList<>());
    volatile String failFor;

    @Override
    public void chown(Path path, String owner, boolean recursive) throws IOException {
      calls.add(owner + " " + path.getFileName());
      if (owner.equals(failFor)) {
        throw new ToolInvocationException(List.of("chown", owner, path.toString()), 1, "operation not permitted");
      }
    }
  }

  /** Writes a minimal manifest on regeneration and records patches. */
  static class FakeMetadataTool implements MetadataToolPort {
    final List<Path> regenerated = Collections.synchronizedList(new ArrayList<>());
    final List<String> patched = Collections.synchronizedList(new ArrayList<>());

    @Override
    public void regenerate(Path repositoryDirectory, boolean keepAllMetadata) throws IOException {
      Path repodata = Files.createDirectories(repositoryDirectory.resolve("repodata"));
      Files.writeString(repodata.resolve("repomd.xml"), "<repomd/>", StandardCharsets.UTF_8);
      regenerated.add(repositoryDirectory);
    }

    @Override
    public void patch(String mdType, Path inputFile, Path repodata) {
      patched.add(mdType + " " + inputFile.getFileName() + " exists=" + Files.exists(inputFile));
    }
  }

  /** Writes a placeholder merged document. */
  static final class FakeErrata implements ErrataMergePort {
    final List<Path> sources = Collections.synchronizedList(new ArrayList<>());

    @Override
    public void merge(Path sourceUpdateInfo, Path targetRepodata, Path output) throws IOException {
      sources.add(sourceUpdateInfo);
      Files.writeString(output, "<updates/>", StandardCharsets.UTF_8);
    }
  }

  /** Keeps every appended report. */
  static final class RecordingErrorLog implements ExportErrorLog {
    final List<ViolationReport> reports = Collections.synchronizedList(new ArrayList<>());

    @Override
    public void append(ViolationReport report) {
      if (!report.isEmpty()) {
        reports.add(report);
      }
    }
  }

  /** Reports files containing "unsigned" as unsigned and everything else as signed by one key. */
  static final class KeyedInspector implements PackageInspectorPort {
    private final String keyId;

    KeyedInspector(String keyId) {
      this.keyId = keyId;
    }

    @Override
    public ToolResult inspect(Path file) {
      if (file.getFileName().toString().contains("unsigned")) {
        return new ToolResult(0, "Signature   : (none)\n", "");
      }
      return new ToolResult(0, "Signature   : RSA/SHA256, Tue 08 Nov 2022, Key ID " + keyId + "\n", "");
    }
  }

  /** Signing service double. */
  static final class FakeSigning implements SigningPort {
    final List<String> signedWith = Collections.synchronizedList(new ArrayList<>());
    volatile List<SignKey> keys = List.of();
    volatile boolean keysUnavailable;
    volatile String error;
    volatile int keyListings;

    @Override
    public SignResult sign(String content, String keyId) {
      signedWith.add(keyId);
      if (error != null) {
        return SignResult.failed(error);
      }
      return SignResult.signed("-----BEGIN PGP SIGNATURE-----\n" + keyId + "\n-----END PGP SIGNATURE-----\n");
    }

    @Override
    public synchronized List<SignKey> listSignKeys() throws IOException {
      keyListings++;
      if (keysUnavailable) {
        throw new IOException("sign service unavailable");
      }
      return keys;
    }
  }
}
