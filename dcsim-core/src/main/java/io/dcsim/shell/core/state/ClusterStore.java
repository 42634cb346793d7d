package io.dcsim.shell.core.state;

import io.dcsim.shell.core.model.ClusterConfig;
import io.dcsim.shell.core.model.GpuUpdate;
import io.dcsim.shell.core.model.HealthStatus;
import io.dcsim.shell.core.model.XidError;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * The shared baseline world. Commands executed outside any scenario read and write this store.
 * Scenario contexts are created from {@link #snapshot()} and never see the live graph.
 */
public class ClusterStore implements StateMutator {
  private static final Logger LOG = LoggerFactory.getLogger(ClusterStore.class);

  private ClusterConfig cluster;

  public ClusterStore(ClusterConfig cluster) {
    this.cluster = Objects.requireNonNull(cluster, "cluster").copy();
  }

  /** Returns the live cluster. Callers must not hand it to another owner without copying. */
  public synchronized ClusterConfig getCluster() {
    return cluster;
  }

  /** Returns a deep copy of the current cluster. */
  public synchronized ClusterConfig snapshot() {
    return cluster.copy();
  }

  /** Installs a deep copy of {@code replacement} as the new baseline. */
  public synchronized void replaceCluster(ClusterConfig replacement) {
    this.cluster = Objects.requireNonNull(replacement, "replacement").copy();
    LOG.debug("Global cluster replaced: {} nodes", cluster.getNodes().size());
  }

  @Override
  public synchronized boolean updateGpu(
      String nodeId, int gpuId, GpuUpdate update, String command) {
    return logged(
        ClusterMutations.updateGpu(cluster, nodeId, gpuId, update), "gpu", nodeId, command);
  }

  @Override
  public synchronized boolean addXidError(
      String nodeId, int gpuId, XidError error, String command) {
    return logged(
        ClusterMutations.addXidError(cluster, nodeId, gpuId, error), "xid", nodeId, command);
  }

  @Override
  public synchronized boolean updateNodeHealth(
      String nodeId, HealthStatus status, String command) {
    return logged(
        ClusterMutations.updateNodeHealth(cluster, nodeId, status), "health", nodeId, command);
  }

  @Override
  public synchronized boolean setMigMode(
      String nodeId, int gpuId, boolean enabled, String command) {
    return logged(
        ClusterMutations.setMigMode(cluster, nodeId, gpuId, enabled), "mig", nodeId, command);
  }

  @Override
  public synchronized boolean setSlurmState(
      String nodeId, String state, String reason, String command) {
    return logged(
        ClusterMutations.setSlurmState(cluster, nodeId, state, reason), "slurm", nodeId, command);
  }

  private static boolean logged(boolean applied, String kind, String nodeId, String command) {
    if (applied) {
      LOG.debug("Applied {} mutation on {} from {}", kind, nodeId, command);
    } else {
      LOG.debug("Ignoring {} mutation on global store: unknown target {}", kind, nodeId);
    }
    return applied;
  }
}
