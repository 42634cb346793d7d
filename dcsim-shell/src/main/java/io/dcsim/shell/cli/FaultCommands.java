package io.dcsim.shell.cli;

import io.dcsim.shell.core.parse.ParsedCommand;
import io.dcsim.shell.core.route.CommandHandler;
import io.dcsim.shell.core.sim.CommandContext;
import io.dcsim.shell.core.sim.CommandResult;
import io.dcsim.shell.core.sim.StateSource;
import io.dcsim.shell.core.state.FaultInjection;
import io.dcsim.shell.core.state.FaultInjector;
import io.dcsim.shell.core.state.FaultType;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * The {@code fault} built-in: {@code fault <type> <node> <gpu> [--param value]...} injects one
 * fault into the active scenario, or into the global cluster when no scenario is active.
 * {@code fault list} prints the fault types and their parameters.
 */
final class FaultCommands implements CommandHandler {
  private static final Logger LOG = LoggerFactory.getLogger(FaultCommands.class);

  static final String NAME = "fault";

  private static final String USAGE = "usage: fault <type> <node> <gpu> [--param value]...";

  private static final Map<FaultType, String> PARAMETERS =
      Map.of(
          FaultType.XID_ERROR, "--xid <code> (default 79)",
          FaultType.THERMAL, "--targetTemp <celsius> (default 95)",
          FaultType.MEMORY_FULL, "",
          FaultType.ECC_ERROR, "--singleBit <n> --doubleBit <n>",
          FaultType.NVLINK_FAILURE, "--link <id> (default 0)",
          FaultType.GPU_HANG, "",
          FaultType.POWER, "--powerDraw <watts> (default limit + 10%)");

  @Override
  public CommandResult handle(ParsedCommand parsed, CommandContext context) {
    List<String> args = parsed.positionalArgs();
    if (args.size() == 1 && args.get(0).equals("list")) {
      return list();
    }
    if (args.size() < 3) {
      return CommandResult.error(USAGE, CommandResult.USAGE);
    }
    Optional<FaultType> type = FaultType.fromName(args.get(0));
    if (type.isEmpty()) {
      return CommandResult.error(
          "fault: unknown fault type '" + args.get(0) + "'. Run 'fault list'.",
          CommandResult.USAGE);
    }
    int gpuId;
    try {
      gpuId = Integer.parseInt(args.get(2));
    } catch (NumberFormatException e) {
      return CommandResult.error(
          "fault: invalid GPU index '" + args.get(2) + "'", CommandResult.USAGE);
    }

    FaultInjection fault = FaultInjection.of(args.get(1), gpuId, type.get());
    for (Map.Entry<String, Object> flag : parsed.flags().entrySet()) {
      if (!(flag.getValue() instanceof String)) {
        return CommandResult.error(
            "fault: parameter --" + flag.getKey() + " needs a value", CommandResult.USAGE);
      }
      fault = fault.with(flag.getKey(), flag.getValue());
    }

    StateSource.WritableSource sink = StateSource.forWrites(context);
    boolean applied;
    try {
      applied =
          FaultInjector.apply(fault, sink.cluster(), sink.mutator(), parsed.baseCommand());
    } catch (NumberFormatException e) {
      return CommandResult.error("fault: " + e.getMessage(), CommandResult.USAGE);
    }
    if (!applied) {
      return CommandResult.error(
          "fault: could not inject into "
              + fault.nodeId()
              + " gpu "
              + gpuId
              + " (unknown target or readonly scenario)");
    }
    String where =
        sink instanceof StateSource.Scenario s
            ? "scenario '" + s.context().getId() + "'"
            : "global";
    LOG.info(
        "Injected {} into {} gpu {} ({})", type.get().faultName(), fault.nodeId(), gpuId, where);
    return CommandResult.success(
        "Injected "
            + type.get().faultName()
            + " on "
            + fault.nodeId()
            + " GPU "
            + gpuId
            + " ["
            + where
            + "]");
  }

  private static CommandResult list() {
    StringBuilder sb = new StringBuilder("Fault types:\n");
    for (FaultType type : FaultType.values()) {
      String line = String.format("  %-16s %s", type.faultName(), PARAMETERS.get(type));
      sb.append(line.stripTrailing()).append('\n');
    }
    return CommandResult.success(sb.toString());
  }
}
