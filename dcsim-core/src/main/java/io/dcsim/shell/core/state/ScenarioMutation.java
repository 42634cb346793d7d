package io.dcsim.shell.core.state;

import com.google.gson.annotations.SerializedName;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One recorded change to a scenario's cluster.
 *
 * @param type what kind of change was made
 * @param nodeId target node
 * @param gpuId target GPU, or {@code null} for node level changes
 * @param data the values that were written
 * @param command the tool that made the change, or {@code null} when it was made directly
 * @param timestamp epoch millis when the change was applied
 */
public record ScenarioMutation(
    Type type,
    String nodeId,
    Integer gpuId,
    Map<String, Object> data,
    String command,
    long timestamp) {

  public ScenarioMutation {
    data = data == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(data));
  }

  /** Mutation kinds, serialized with their hyphenated names. */
  public enum Type {
    @SerializedName("gpu-update")
    GPU_UPDATE("gpu-update"),
    @SerializedName("xid-error")
    XID_ERROR("xid-error"),
    @SerializedName("node-health")
    NODE_HEALTH("node-health"),
    @SerializedName("mig-mode")
    MIG_MODE("mig-mode"),
    @SerializedName("slurm-state")
    SLURM_STATE("slurm-state");

    private final String label;

    Type(String label) {
      this.label = label;
    }

    public String label() {
      return label;
    }
  }
}
