package io.dcsim.shell.cli;

import io.dcsim.shell.core.model.ClusterConfig;
import io.dcsim.shell.core.model.ClusterFactory;
import io.dcsim.shell.core.registry.CommandDefinitionException;
import io.dcsim.shell.core.registry.CommandDefinitionRegistry;
import io.dcsim.shell.core.route.CommandRouter;
import io.dcsim.shell.core.sim.Simulator;
import io.dcsim.shell.core.state.ClusterStore;
import io.dcsim.shell.core.state.ScenarioContextManager;
import java.util.List;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Everything one shell needs, wired together: catalogue, global cluster, scenario manager,
 * router with simulators and built-ins, session and dispatcher. Used by both the interactive
 * shell and script mode.
 */
public final class ShellRuntime implements AutoCloseable {
  private static final Logger LOG = LoggerFactory.getLogger(ShellRuntime.class);

  private final CommandDefinitionRegistry registry;
  private final ClusterStore store;
  private final ScenarioContextManager scenarios;
  private final CommandRouter router;
  private final List<Simulator> simulators;
  private final CommandDispatcher dispatcher;

  private ShellRuntime(
      CommandDefinitionRegistry registry,
      ClusterStore store,
      ScenarioContextManager scenarios,
      CommandRouter router,
      List<Simulator> simulators,
      CommandDispatcher dispatcher) {
    this.registry = registry;
    this.store = store;
    this.scenarios = scenarios;
    this.router = router;
    this.simulators = simulators;
    this.dispatcher = dispatcher;
  }

  /**
   * Builds a runtime from {@code config}.
   *
   * @throws CommandDefinitionException if the command catalogue cannot be loaded
   */
  public static ShellRuntime create(ShellConfig config, CommandDispatcher.IO io)
      throws CommandDefinitionException {
    CommandDefinitionRegistry registry = new CommandDefinitionRegistry(config.catalogueLoader());
    registry.initialize();

    Supplier<ClusterConfig> freshCluster =
        () -> ClusterFactory.create(config.nodes(), config.gpusPerNode());
    ClusterStore store = new ClusterStore(freshCluster.get());
    ScenarioContextManager scenarios = new ScenarioContextManager();
    CommandRouter router = new CommandRouter();

    List<Simulator> simulators = SimulatorLoader.load(ShellRuntime.class.getClassLoader());
    SimulatorLoader.registerAll(simulators, router);

    String startNode = config.startNode();
    if (startNode != null && store.getCluster().findNode(startNode).isEmpty()) {
      LOG.warn("Start node {} not in cluster, using the first node", startNode);
      startNode = null;
    }
    ShellSession session = new ShellSession(startNode, config.root());

    new BuiltinCommands(registry, router, session).registerAll();
    router.register(ScenarioCommands.NAME, new ScenarioCommands(scenarios, freshCluster));
    router.register(FaultCommands.NAME, new FaultCommands());
    router.register(ExplainCommand.NAME, new ExplainCommand(registry));

    CommandDispatcher dispatcher =
        new CommandDispatcher(registry, router, store, scenarios, session, io);
    LOG.info(
        "Shell runtime ready: {} commands, {} nodes",
        router.names().size(),
        store.getCluster().getNodes().size());
    return new ShellRuntime(registry, store, scenarios, router, simulators, dispatcher);
  }

  public CommandDispatcher dispatcher() {
    return dispatcher;
  }

  public CommandDefinitionRegistry registry() {
    return registry;
  }

  public ClusterStore store() {
    return store;
  }

  public ScenarioContextManager scenarios() {
    return scenarios;
  }

  public CommandRouter router() {
    return router;
  }

  @Override
  public void close() {
    for (Simulator simulator : simulators) {
      try {
        simulator.shutdown();
      } catch (RuntimeException e) {
        LOG.warn("Simulator {} failed to shut down", simulator.getMetadata().name(), e);
      }
    }
  }
}
