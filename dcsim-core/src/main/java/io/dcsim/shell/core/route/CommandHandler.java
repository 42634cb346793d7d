package io.dcsim.shell.core.route;

import io.dcsim.shell.core.parse.ParsedCommand;
import io.dcsim.shell.core.sim.CommandContext;
import io.dcsim.shell.core.sim.CommandResult;

/** Executes one routed command. A {@link io.dcsim.shell.core.sim.Simulator} is adapted to this. */
@FunctionalInterface
public interface CommandHandler {
  CommandResult handle(ParsedCommand parsed, CommandContext context);
}
