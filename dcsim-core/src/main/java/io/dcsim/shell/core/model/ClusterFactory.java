package io.dcsim.shell.core.model;

import java.util.List;

/** Builds deterministic DGX H100 clusters. */
public final class ClusterFactory {
  public static final int DEFAULT_NODES = 8;
  public static final int DEFAULT_GPUS_PER_NODE = 8;
  public static final int NVLINKS_PER_GPU = 18;
  public static final int H100_MEMORY_MIB = 81920;

  private ClusterFactory() {}

  public static ClusterConfig createDefault() {
    return create(DEFAULT_NODES, DEFAULT_GPUS_PER_NODE);
  }

  /**
   * Creates a cluster of identical nodes named {@code dgx-00}, {@code dgx-01}, ...
   *
   * @param nodeCount number of nodes, at least 1
   * @param gpusPerNode GPUs per node, at least 1
   */
  public static ClusterConfig create(int nodeCount, int gpusPerNode) {
    if (nodeCount < 1 || gpusPerNode < 1) {
      throw new IllegalArgumentException(
          "nodeCount and gpusPerNode must be positive: " + nodeCount + ", " + gpusPerNode);
    }
    ClusterConfig cluster = new ClusterConfig("dgx-superpod");
    for (int n = 0; n < nodeCount; n++) {
      cluster.getNodes().add(createNode(n, gpusPerNode));
    }
    cluster.setFabricTopology("FatTree");
    cluster.setBcmHa(new BcmHaState(true, "bcm-01", "bcm-02", "Active"));
    cluster.setSlurmConfig(new SlurmConfig("slurm-ctrl", List.of("gpu", "debug")));
    return cluster;
  }

  static DgxNode createNode(int index, int gpusPerNode) {
    String id = String.format("dgx-%02d", index);
    DgxNode node = new DgxNode(id, id, "DGX-H100");
    for (int g = 0; g < gpusPerNode; g++) {
      node.getGpus().add(createGpu(index, g));
    }
    for (int h = 0; h < 8; h++) {
      HostChannelAdapter hca = new HostChannelAdapter("mlx5_" + h, "MT4129", "28.39.1002");
      hca.getPorts()
          .add(
              new InfiniBandPort(
                  1,
                  "Active",
                  "LinkUp",
                  400,
                  index * 8 + h + 1,
                  String.format("0x%016x", 0xb8cef60300000000L + index * 0x100L + h)));
      node.getHcas().add(hca);
    }
    node.setBmc(
        new BmcInfo(
            String.format("10.0.0.%d", 100 + index),
            String.format("b8:ce:f6:00:%02x:01", index),
            "24.01.08",
            "NVIDIA",
            "On"));
    node.setCpuModel("Intel Xeon Platinum 8480C");
    node.setCpuCount(2);
    node.setRamTotal(2048);
    node.setRamUsed(128);
    node.setOsVersion("Ubuntu 22.04.4 LTS");
    node.setKernelVersion("5.15.0-1042-nvidia");
    node.setNvidiaDriverVersion("535.129.03");
    node.setCudaVersion("12.2");
    return node;
  }

  static Gpu createGpu(int nodeIndex, int gpuIndex) {
    String uuid =
        String.format(
            "GPU-%08x-%04x-0000-0000-%012x", nodeIndex, gpuIndex, nodeIndex * 16L + gpuIndex);
    Gpu gpu = new Gpu(gpuIndex, uuid, "NVIDIA H100 80GB HBM3");
    gpu.setType("H100-SXM");
    gpu.setPciAddress(String.format("00000000:%02X:00.0", 0x18 + gpuIndex * 0x10));
    gpu.setTemperature(35);
    gpu.setPowerDraw(72);
    gpu.setPowerLimit(700);
    gpu.setMemoryTotal(H100_MEMORY_MIB);
    gpu.setMemoryUsed(0);
    gpu.setUtilization(0);
    gpu.setClocksSm(1980);
    gpu.setClocksMem(2619);
    gpu.setPersistenceMode(true);
    for (int l = 0; l < NVLINKS_PER_GPU; l++) {
      gpu.getNvlinks().add(new NvLink(l, NvLink.ACTIVE, 25));
    }
    return gpu;
  }
}
