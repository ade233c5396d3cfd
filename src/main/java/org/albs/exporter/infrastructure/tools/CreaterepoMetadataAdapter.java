package org.albs.exporter.infrastructure.tools;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import org.albs.exporter.application.port.MetadataToolPort;

/**
 * {@link MetadataToolPort} running {@code createrepo_c} and {@code modifyrepo_c}.
 *
 * @since 0.1.0
 */
public final class CreaterepoMetadataAdapter implements MetadataToolPort {
  private final CommandRunner runner;

  public CreaterepoMetadataAdapter(CommandRunner runner) {
    this.runner = Objects.requireNonNull(runner, "runner");
  }

  @Override
  public void regenerate(Path repositoryDirectory, boolean keepAllMetadata)
      throws IOException, InterruptedException {
    List<String> command = new ArrayList<>(List.of("createrepo_c", "--update"));
    if (keepAllMetadata) {
      command.add("--keep-all-metadata");
    }
    command.add(repositoryDirectory.toString());
    ProcessRunner.runChecked(runner, command);
  }

  @Override
  public void patch(String mdType, Path inputFile, Path repodata) throws IOException, InterruptedException {
    ProcessRunner.runChecked(runner, List.of(
        "modifyrepo_c", "--mdtype=" + mdType, inputFile.toString(), repodata.toString()));
  }
}
