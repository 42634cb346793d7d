package io.dcsim.shell.cli;

import io.dcsim.shell.core.route.CommandRouter;
import io.dcsim.shell.core.sim.Simulator;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.ServiceLoader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Discovers {@link Simulator}s with {@link ServiceLoader} and registers them in a router. */
final class SimulatorLoader {
  private static final Logger LOG = LoggerFactory.getLogger(SimulatorLoader.class);

  private SimulatorLoader() {}

  /**
   * Loads and initializes every simulator on the class path. A simulator whose initialization
   * fails is logged and left out.
   *
   * @return simulators in ascending priority order
   */
  static List<Simulator> load(ClassLoader classLoader) {
    List<Simulator> loaded = new ArrayList<>();
    for (Simulator simulator : ServiceLoader.load(Simulator.class, classLoader)) {
      try {
        simulator.initialize();
        loaded.add(simulator);
        LOG.info(
            "Loaded simulator: {} {}",
            simulator.getMetadata().name(),
            simulator.getMetadata().commands());
      } catch (Exception e) {
        LOG.error("Failed to initialize simulator: {}", simulator.getClass().getName(), e);
      }
    }
    loaded.sort(Comparator.comparingInt(Simulator::getPriority));
    return loaded;
  }

  /** Registers in ascending priority so the highest priority claim on a command wins. */
  static void registerAll(List<Simulator> simulators, CommandRouter router) {
    for (Simulator simulator : simulators) {
      router.register(simulator);
    }
  }
}
