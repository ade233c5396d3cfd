package org.albs.exporter.infrastructure.tools;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import org.albs.exporter.application.port.OwnershipPort;
import org.albs.exporter.validation.Strings;

/**
 * {@link OwnershipPort} running {@code chown owner:owner}, through {@code sudo} unless disabled.
 *
 * @since 0.1.0
 */
public final class SudoOwnershipAdapter implements OwnershipPort {
  private final CommandRunner runner;
  private final Privilege privilege;

  public SudoOwnershipAdapter(CommandRunner runner, Privilege privilege) {
    this.runner = Objects.requireNonNull(runner, "runner");
    this.privilege = Objects.requireNonNull(privilege, "privilege");
  }

  @Override
  public void chown(Path path, String owner, boolean recursive) throws IOException, InterruptedException {
    String user = Strings.requireAccountName("owner", owner);
    List<String> command = new ArrayList<>();
    command.add("chown");
    if (recursive) {
      command.add("-R");
    }
    command.add(user + ':' + user);
    command.add(path.toString());
    ProcessRunner.runChecked(runner, privilege.wrap(command));
  }
}
