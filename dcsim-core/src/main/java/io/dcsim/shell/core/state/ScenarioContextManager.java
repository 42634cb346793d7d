package io.dcsim.shell.core.state;

import io.dcsim.shell.core.model.ClusterConfig;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Registry of scenario contexts with at most one active context. Contexts are always built from
 * an externally supplied base cluster, never from another context's live graph.
 */
public final class ScenarioContextManager {
  private static final Logger LOG = LoggerFactory.getLogger(ScenarioContextManager.class);

  private final Map<String, ScenarioContext> byId = new LinkedHashMap<>();
  private String activeId;

  /**
   * Creates a context, replacing any existing context with the same id.
   *
   * @param id context id
   * @param baseCluster cluster to copy; not retained
   * @return the new context
   */
  public synchronized ScenarioContext createContext(String id, ClusterConfig baseCluster) {
    ScenarioContext context = new ScenarioContext(id, baseCluster);
    ScenarioContext previous = byId.put(id, context);
    LOG.debug("Scenario context {} {}", id, previous == null ? "created" : "recreated");
    return context;
  }

  /** Returns the context for {@code id}, creating it from {@code baseCluster} if absent. */
  public synchronized ScenarioContext getOrCreateContext(String id, ClusterConfig baseCluster) {
    ScenarioContext existing = byId.get(id);
    return existing != null ? existing : createContext(id, baseCluster);
  }

  public synchronized Optional<ScenarioContext> getContext(String id) {
    return Optional.ofNullable(byId.get(id));
  }

  /**
   * Deletes a context. Deleting the active context leaves no context active.
   *
   * @return true if a context was removed
   */
  public synchronized boolean deleteContext(String id) {
    if (byId.remove(id) == null) {
      return false;
    }
    if (Objects.equals(activeId, id)) {
      activeId = null;
    }
    LOG.debug("Scenario context {} deleted", id);
    return true;
  }

  /**
   * Makes {@code id} the active context, or clears the active context when {@code id} is null.
   *
   * @return false if {@code id} names no context; the active context is then unchanged
   */
  public synchronized boolean setActiveContext(String id) {
    if (id != null && !byId.containsKey(id)) {
      return false;
    }
    activeId = id;
    LOG.debug("Active scenario context: {}", id);
    return true;
  }

  public synchronized Optional<ScenarioContext> getActiveContext() {
    return activeId == null ? Optional.empty() : Optional.ofNullable(byId.get(activeId));
  }

  public synchronized Optional<String> getActiveContextId() {
    return Optional.ofNullable(activeId);
  }

  public synchronized List<String> getContextIds() {
    return new ArrayList<>(byId.keySet());
  }

  public synchronized int size() {
    return byId.size();
  }

  /** Drops every context and clears the active id. */
  public synchronized void clearAll() {
    byId.clear();
    activeId = null;
    LOG.debug("All scenario contexts cleared");
  }
}
