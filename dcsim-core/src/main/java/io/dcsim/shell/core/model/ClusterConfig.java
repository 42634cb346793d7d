package io.dcsim.shell.core.model;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Root of the simulated hardware tree. Instances are never shared between the global store and
 * scenario contexts; use {@link #copy()} to hand one to another owner.
 */
public final class ClusterConfig {
  private String name;
  private List<DgxNode> nodes = new ArrayList<>();
  private String fabricTopology;
  private BcmHaState bcmHa;
  private SlurmConfig slurmConfig;

  public ClusterConfig() {}

  public ClusterConfig(String name) {
    this.name = name;
  }

  public String getName() {
    return name;
  }

  public void setName(String name) {
    this.name = name;
  }

  public List<DgxNode> getNodes() {
    return nodes;
  }

  public Optional<DgxNode> findNode(String nodeId) {
    if (nodeId == null) {
      return Optional.empty();
    }
    for (DgxNode node : nodes) {
      if (nodeId.equals(node.getId()) || nodeId.equals(node.getHostname())) {
        return Optional.of(node);
      }
    }
    return Optional.empty();
  }

  public Optional<Gpu> findGpu(String nodeId, int gpuId) {
    return findNode(nodeId).flatMap(n -> n.findGpu(gpuId));
  }

  public String getFabricTopology() {
    return fabricTopology;
  }

  public void setFabricTopology(String fabricTopology) {
    this.fabricTopology = fabricTopology;
  }

  public BcmHaState getBcmHa() {
    return bcmHa;
  }

  public void setBcmHa(BcmHaState bcmHa) {
    this.bcmHa = bcmHa;
  }

  public SlurmConfig getSlurmConfig() {
    return slurmConfig;
  }

  public void setSlurmConfig(SlurmConfig slurmConfig) {
    this.slurmConfig = slurmConfig;
  }

  public ClusterConfig copy() {
    ClusterConfig copy = new ClusterConfig(name);
    for (DgxNode node : nodes) {
      copy.nodes.add(node.copy());
    }
    copy.fabricTopology = fabricTopology;
    copy.bcmHa = bcmHa;
    copy.slurmConfig = slurmConfig;
    return copy;
  }
}
