package io.dcsim.shell.core.state;

import io.dcsim.shell.core.model.GpuUpdate;
import io.dcsim.shell.core.model.HealthStatus;
import io.dcsim.shell.core.model.XidError;

/**
 * Write sink for simulated hardware state. Implemented by the shared {@link ClusterStore} and by
 * every {@link ScenarioContext}; a simulator receives exactly one of them per invocation.
 *
 * <p>Every method returns {@code false} and leaves state untouched when the target node or GPU
 * does not exist or the sink refuses writes. The {@code command} argument names the tool that
 * caused the write (for example {@code nvidia-smi}) and may be null.
 */
public interface StateMutator {

  boolean updateGpu(String nodeId, int gpuId, GpuUpdate update, String command);

  boolean addXidError(String nodeId, int gpuId, XidError error, String command);

  boolean updateNodeHealth(String nodeId, HealthStatus status, String command);

  /** Enables or disables MIG mode. Either way the GPU's MIG instances are dropped. */
  boolean setMigMode(String nodeId, int gpuId, boolean enabled, String command);

  boolean setSlurmState(String nodeId, String state, String reason, String command);

  default boolean updateGpu(String nodeId, int gpuId, GpuUpdate update) {
    return updateGpu(nodeId, gpuId, update, null);
  }

  default boolean addXidError(String nodeId, int gpuId, XidError error) {
    return addXidError(nodeId, gpuId, error, null);
  }

  default boolean updateNodeHealth(String nodeId, HealthStatus status) {
    return updateNodeHealth(nodeId, status, null);
  }

  default boolean setMigMode(String nodeId, int gpuId, boolean enabled) {
    return setMigMode(nodeId, gpuId, enabled, null);
  }

  default boolean setSlurmState(String nodeId, String state, String reason) {
    return setSlurmState(nodeId, state, reason, null);
  }
}
