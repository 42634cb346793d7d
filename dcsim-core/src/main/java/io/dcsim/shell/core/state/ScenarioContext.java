package io.dcsim.shell.core.state;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import io.dcsim.shell.core.model.ClusterConfig;
import io.dcsim.shell.core.model.DgxNode;
import io.dcsim.shell.core.model.Gpu;
import io.dcsim.shell.core.model.GpuUpdate;
import io.dcsim.shell.core.model.HealthStatus;
import io.dcsim.shell.core.model.XidError;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * An isolated copy of the cluster owned by one training scenario.
 *
 * <p>The base cluster handed to the constructor is deep copied twice: once for the working graph
 * and once as the private baseline that {@link #reset()} restores. Neither copy is ever exposed
 * to another context or to the global store.
 *
 * <p>Every applied mutation increments {@link #getMutationCount()} by exactly one. Mutations that
 * target an unknown node or GPU, and any mutation while the context is readonly, are ignored and
 * do not count.
 */
public final class ScenarioContext implements StateMutator {
  private static final Logger LOG = LoggerFactory.getLogger(ScenarioContext.class);
  private static final Gson GSON = new GsonBuilder().serializeNulls().setPrettyPrinting().create();

  private final String id;
  private final ClusterConfig baseline;
  private final long createdAt;
  private ClusterConfig cluster;
  private final List<ScenarioMutation> mutations = new ArrayList<>();
  private int mutationCount;
  private boolean readonly;

  public ScenarioContext(String id, ClusterConfig baseCluster) {
    this.id = Objects.requireNonNull(id, "id");
    Objects.requireNonNull(baseCluster, "baseCluster");
    this.baseline = baseCluster.copy();
    this.cluster = baseline.copy();
    this.createdAt = System.currentTimeMillis();
  }

  public String getId() {
    return id;
  }

  public synchronized ClusterConfig getCluster() {
    return cluster;
  }

  public synchronized Optional<DgxNode> getNode(String nodeId) {
    return cluster.findNode(nodeId);
  }

  public synchronized Optional<Gpu> getGpu(String nodeId, int gpuId) {
    return cluster.findGpu(nodeId, gpuId);
  }

  @Override
  public synchronized boolean updateGpu(
      String nodeId, int gpuId, GpuUpdate update, String command) {
    if (rejectWrite("gpu update")) {
      return false;
    }
    return record(
        ClusterMutations.updateGpu(cluster, nodeId, gpuId, update),
        ScenarioMutation.Type.GPU_UPDATE,
        nodeId,
        gpuId,
        update.describe(),
        command);
  }

  @Override
  public synchronized boolean addXidError(
      String nodeId, int gpuId, XidError error, String command) {
    if (rejectWrite("xid error")) {
      return false;
    }
    Map<String, Object> data = new LinkedHashMap<>();
    data.put("xid", error.code());
    data.put("description", error.description());
    return record(
        ClusterMutations.addXidError(cluster, nodeId, gpuId, error),
        ScenarioMutation.Type.XID_ERROR,
        nodeId,
        gpuId,
        data,
        command);
  }

  @Override
  public synchronized boolean updateNodeHealth(
      String nodeId, HealthStatus status, String command) {
    if (rejectWrite("node health")) {
      return false;
    }
    return record(
        ClusterMutations.updateNodeHealth(cluster, nodeId, status),
        ScenarioMutation.Type.NODE_HEALTH,
        nodeId,
        null,
        Map.of("healthStatus", status.label()),
        command);
  }

  @Override
  public synchronized boolean setMigMode(
      String nodeId, int gpuId, boolean enabled, String command) {
    if (rejectWrite("mig mode")) {
      return false;
    }
    return record(
        ClusterMutations.setMigMode(cluster, nodeId, gpuId, enabled),
        ScenarioMutation.Type.MIG_MODE,
        nodeId,
        gpuId,
        Map.of("enabled", enabled),
        command);
  }

  @Override
  public synchronized boolean setSlurmState(
      String nodeId, String state, String reason, String command) {
    if (rejectWrite("slurm state")) {
      return false;
    }
    Map<String, Object> data = new LinkedHashMap<>();
    data.put("state", state);
    data.put("reason", reason);
    return record(
        ClusterMutations.setSlurmState(cluster, nodeId, state, reason),
        ScenarioMutation.Type.SLURM_STATE,
        nodeId,
        null,
        data,
        command);
  }

  public synchronized int getMutationCount() {
    return mutationCount;
  }

  /** Returns a copy of the mutation log in application order. */
  public synchronized List<ScenarioMutation> getMutations() {
    return new ArrayList<>(mutations);
  }

  /** Changes relative to the baseline; the same list as {@link #getMutations()}. */
  public List<ScenarioMutation> getDiff() {
    return getMutations();
  }

  /**
   * Restores the baseline captured at construction and zeroes the counter.
   *
   * @return false if the context is readonly and nothing was reset
   */
  public synchronized boolean reset() {
    if (rejectWrite("reset")) {
      return false;
    }
    cluster = baseline.copy();
    mutations.clear();
    mutationCount = 0;
    LOG.debug("Scenario context {} reset", id);
    return true;
  }

  public synchronized boolean isReadonly() {
    return readonly;
  }

  public synchronized void setReadonly(boolean readonly) {
    this.readonly = readonly;
  }

  /** Returns a deep copy of the working cluster. */
  public synchronized ClusterConfig snapshot() {
    return cluster.copy();
  }

  public long getRuntimeMs() {
    return Math.max(0L, System.currentTimeMillis() - createdAt);
  }

  /** Serializes the working cluster and mutation log as JSON. */
  public synchronized String export() {
    return GSON.toJson(new Export(id, cluster, new ArrayList<>(mutations), getRuntimeMs()));
  }

  private boolean rejectWrite(String what) {
    if (readonly) {
      LOG.debug("Scenario context {} is readonly, rejecting {}", id, what);
      return true;
    }
    return false;
  }

  private boolean record(
      boolean applied,
      ScenarioMutation.Type type,
      String nodeId,
      Integer gpuId,
      Map<String, Object> data,
      String command) {
    if (!applied) {
      LOG.debug("Ignoring {} on {}: unknown node {} or gpu {}", type.label(), id, nodeId, gpuId);
      return false;
    }
    mutations.add(
        new ScenarioMutation(
            type, nodeId, gpuId, data, command, System.currentTimeMillis()));
    mutationCount++;
    return true;
  }

  private record Export(
      String scenarioId, ClusterConfig cluster, List<ScenarioMutation> mutations, long runtime) {}
}
