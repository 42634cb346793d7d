package io.dcsim.shell.core.route;

import io.dcsim.shell.core.sim.Simulator;
import java.util.Collection;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Maps base command names to handlers. Lookups are exact; a later registration for the same name
 * replaces the earlier one.
 */
public final class CommandRouter {
  private static final Logger LOG = LoggerFactory.getLogger(CommandRouter.class);

  private final ConcurrentHashMap<String, CommandHandler> handlers = new ConcurrentHashMap<>();

  public void register(String name, CommandHandler handler) {
    Objects.requireNonNull(name, "name");
    Objects.requireNonNull(handler, "handler");
    if (handlers.put(name, handler) != null) {
      LOG.debug("Handler for '{}' replaced", name);
    }
  }

  public void registerMany(Collection<String> names, CommandHandler handler) {
    for (String name : names) {
      register(name, handler);
    }
  }

  /** Registers {@code simulator} under every command its metadata lists. */
  public void register(Simulator simulator) {
    registerMany(simulator.getMetadata().commands(), simulator::execute);
  }

  public Optional<CommandHandler> resolve(String name) {
    return name == null ? Optional.empty() : Optional.ofNullable(handlers.get(name));
  }

  public boolean has(String name) {
    return name != null && handlers.containsKey(name);
  }

  /** Registered names in alphabetical order. */
  public Set<String> names() {
    return new TreeSet<>(handlers.keySet());
  }
}
