package org.albs.exporter.infrastructure.tools;

import java.util.ArrayList;
import java.util.List;

/**
 * Prefixes commands that need elevated privileges.
 *
 * @since 0.1.0
 */
public enum Privilege {
  /** Run through {@code sudo}. */
  SUDO,
  /** Run as the current user. */
  NONE;

  List<String> wrap(List<String> command) {
    if (this == NONE) {
      return List.copyOf(command);
    }
    List<String> wrapped = new ArrayList<>(command.size() + 1);
    wrapped.add("sudo");
    wrapped.addAll(command);
    return List.copyOf(wrapped);
  }
}
