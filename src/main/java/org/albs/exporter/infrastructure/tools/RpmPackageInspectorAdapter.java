package org.albs.exporter.infrastructure.tools;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Objects;
import org.albs.exporter.application.port.PackageInspectorPort;
import org.albs.exporter.application.port.ToolResult;

/**
 * {@link PackageInspectorPort} running {@code rpm -qip}.
 *
 * @since 0.1.0
 */
public final class RpmPackageInspectorAdapter implements PackageInspectorPort {
  private final CommandRunner runner;
  private final Privilege privilege;

  public RpmPackageInspectorAdapter(CommandRunner runner, Privilege privilege) {
    this.runner = Objects.requireNonNull(runner, "runner");
    this.privilege = Objects.requireNonNull(privilege, "privilege");
  }

  @Override
  public ToolResult inspect(Path file) throws IOException, InterruptedException {
    return runner.run(privilege.wrap(List.of("rpm", "-qip", file.toString())));
  }
}
