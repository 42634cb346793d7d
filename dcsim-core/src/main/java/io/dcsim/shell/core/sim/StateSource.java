package io.dcsim.shell.core.sim;

import io.dcsim.shell.core.model.ClusterConfig;
import io.dcsim.shell.core.state.ClusterStore;
import io.dcsim.shell.core.state.ScenarioContext;
import io.dcsim.shell.core.state.StateMutator;

/**
 * Where one invocation reads its cluster from. Reads resolve explicit cluster, then active
 * scenario, then global store. Writes never target an explicit cluster: they go to the scenario
 * when one is present and to the global store otherwise.
 */
public sealed interface StateSource permits StateSource.Explicit, StateSource.WritableSource {

  ClusterConfig cluster();

  /** A cluster supplied by the caller for this invocation only. */
  record Explicit(ClusterConfig cluster) implements StateSource {}

  /** A source that also accepts writes. */
  sealed interface WritableSource extends StateSource
      permits StateSource.Scenario, StateSource.Global {
    StateMutator mutator();
  }

  record Scenario(ScenarioContext context) implements WritableSource {
    @Override
    public ClusterConfig cluster() {
      return context.getCluster();
    }

    @Override
    public StateMutator mutator() {
      return context;
    }
  }

  record Global(ClusterStore store) implements WritableSource {
    @Override
    public ClusterConfig cluster() {
      return store.getCluster();
    }

    @Override
    public StateMutator mutator() {
      return store;
    }
  }

  /** Resolves the read source for {@code context}. */
  static StateSource forReads(CommandContext context) {
    if (context.explicitCluster().isPresent()) {
      return new Explicit(context.explicitCluster().get());
    }
    return forWrites(context);
  }

  /** Resolves the single write sink for {@code context}. */
  static WritableSource forWrites(CommandContext context) {
    if (context.scenarioContext().isPresent()) {
      return new Scenario(context.scenarioContext().get());
    }
    return new Global(context.globalStore());
  }
}
