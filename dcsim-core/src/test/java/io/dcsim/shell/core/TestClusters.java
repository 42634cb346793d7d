package io.dcsim.shell.core;

import io.dcsim.shell.core.model.ClusterConfig;
import io.dcsim.shell.core.model.ClusterFactory;
import io.dcsim.shell.core.model.Gpu;

/** Small clusters for tests: nodes dgx-00 and dgx-01 with two GPUs each at 45 C. */
public final class TestClusters {
  private TestClusters() {}

  public static ClusterConfig small() {
    ClusterConfig cluster = ClusterFactory.create(2, 2);
    cluster.getNodes().forEach(n -> n.getGpus().forEach(TestClusters::warm));
    return cluster;
  }

  private static void warm(Gpu gpu) {
    gpu.setTemperature(45);
    gpu.setUtilization(50);
    gpu.setPowerDraw(300);
  }
}
