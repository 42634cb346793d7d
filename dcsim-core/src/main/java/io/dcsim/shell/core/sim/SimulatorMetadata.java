package io.dcsim.shell.core.sim;

import java.util.List;

/**
 * @param name simulator name
 * @param version version string shown by {@code --version}
 * @param description one line summary
 * @param commands base command names the simulator handles
 */
public record SimulatorMetadata(
    String name, String version, String description, List<String> commands) {
  public SimulatorMetadata {
    commands = List.copyOf(commands);
  }
}
