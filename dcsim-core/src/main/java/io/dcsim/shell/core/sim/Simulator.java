package io.dcsim.shell.core.sim;

import io.dcsim.shell.core.parse.ParsedCommand;

/**
 * Service Provider Interface for simulated tools. Each simulator handles one or more base commands
 * and turns a parsed invocation into output, reading and writing the cluster that the context
 * resolves to.
 *
 * <p>Simulators are discovered via {@link java.util.ServiceLoader}. They must not throw for user
 * mistakes: bad arguments, unknown targets and invalid subcommands are reported through the exit
 * code of the returned {@link CommandResult}.
 */
public interface Simulator {

  SimulatorMetadata getMetadata();

  CommandResult execute(ParsedCommand parsed, CommandContext context);

  /**
   * Returns the priority of this simulator. When two simulators claim the same command the one
   * with the higher priority is registered last and wins.
   *
   * @return priority value (default 0)
   */
  default int getPriority() {
    return 0;
  }

  /** Called once after discovery. */
  default void initialize() {}

  /** Called when the shell is shutting down. */
  default void shutdown() {}
}
