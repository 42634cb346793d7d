package io.dcsim.shell.core.sim;

import io.dcsim.shell.core.model.ClusterConfig;
import io.dcsim.shell.core.model.DgxNode;
import io.dcsim.shell.core.state.StateMutator;
import java.util.List;
import java.util.Optional;

/**
 * Shared behaviour of the simulated tools. The state resolution helpers are final so every tool
 * reads and writes through the same priority chain (see {@link StateSource}).
 */
public abstract class BaseSimulator implements Simulator {

  /** Cluster to read: explicit override, then active scenario, then global store. */
  protected final ClusterConfig resolveCluster(CommandContext context) {
    return StateSource.forReads(context).cluster();
  }

  /** Finds a node by id or hostname in the resolved cluster. */
  protected final Optional<DgxNode> resolveNode(CommandContext context, String nodeId) {
    return resolveCluster(context).findNode(nodeId);
  }

  /** The node the user is on: the context's current node, else the first node. */
  protected final Optional<DgxNode> resolveCurrentNode(CommandContext context) {
    ClusterConfig cluster = resolveCluster(context);
    if (context.currentNode() != null) {
      return cluster.findNode(context.currentNode());
    }
    return cluster.getNodes().isEmpty()
        ? Optional.empty()
        : Optional.of(cluster.getNodes().get(0));
  }

  protected final List<DgxNode> resolveAllNodes(CommandContext context) {
    return resolveCluster(context).getNodes();
  }

  /** The single write sink: the active scenario if present, otherwise the global store. */
  protected final StateMutator resolveMutator(CommandContext context) {
    return StateSource.forWrites(context).mutator();
  }

  protected String name() {
    return getMetadata().name();
  }

  protected CommandResult createSuccess(String output) {
    return CommandResult.success(output);
  }

  protected CommandResult createError(String message) {
    return CommandResult.error(message);
  }

  protected CommandResult createError(String message, int exitCode) {
    return CommandResult.error(message, exitCode);
  }

  protected CommandResult usageError(String message) {
    return CommandResult.error(message, CommandResult.USAGE);
  }

  protected CommandResult versionResult() {
    SimulatorMetadata meta = getMetadata();
    return createSuccess(meta.name() + " version " + meta.version());
  }

  protected static Optional<Integer> parseInt(String text) {
    if (text == null) {
      return Optional.empty();
    }
    try {
      return Optional.of(Integer.parseInt(text.trim()));
    } catch (NumberFormatException e) {
      return Optional.empty();
    }
  }

  protected static Optional<Double> parseDouble(String text) {
    if (text == null) {
      return Optional.empty();
    }
    try {
      return Optional.of(Double.parseDouble(text.trim()));
    } catch (NumberFormatException e) {
      return Optional.empty();
    }
  }
}
