package io.dcsim.shell.core.state;

import io.dcsim.shell.core.model.ClusterConfig;
import io.dcsim.shell.core.model.DgxNode;
import io.dcsim.shell.core.model.Gpu;
import io.dcsim.shell.core.model.GpuUpdate;
import io.dcsim.shell.core.model.HealthStatus;
import io.dcsim.shell.core.model.XidError;
import java.util.Objects;
import java.util.Optional;

/** Mutation primitives shared by the global store and scenario contexts. */
final class ClusterMutations {
  private ClusterMutations() {}

  static boolean updateGpu(ClusterConfig cluster, String nodeId, int gpuId, GpuUpdate update) {
    Objects.requireNonNull(update, "update");
    Optional<Gpu> gpu = cluster.findGpu(nodeId, gpuId);
    gpu.ifPresent(update::applyTo);
    return gpu.isPresent();
  }

  static boolean addXidError(ClusterConfig cluster, String nodeId, int gpuId, XidError error) {
    Objects.requireNonNull(error, "error");
    Optional<Gpu> gpu = cluster.findGpu(nodeId, gpuId);
    gpu.ifPresent(g -> g.getXidErrors().add(error));
    return gpu.isPresent();
  }

  static boolean updateNodeHealth(ClusterConfig cluster, String nodeId, HealthStatus status) {
    Objects.requireNonNull(status, "status");
    Optional<DgxNode> node = cluster.findNode(nodeId);
    node.ifPresent(n -> n.setHealthStatus(status));
    return node.isPresent();
  }

  static boolean setMigMode(ClusterConfig cluster, String nodeId, int gpuId, boolean enabled) {
    Optional<Gpu> gpu = cluster.findGpu(nodeId, gpuId);
    gpu.ifPresent(
        g -> {
          g.setMigMode(enabled);
          g.getMigInstances().clear();
        });
    return gpu.isPresent();
  }

  static boolean setSlurmState(ClusterConfig cluster, String nodeId, String state, String reason) {
    Objects.requireNonNull(state, "state");
    Optional<DgxNode> node = cluster.findNode(nodeId);
    node.ifPresent(
        n -> {
          n.setSlurmState(state);
          n.setSlurmReason(reason);
        });
    return node.isPresent();
  }
}
