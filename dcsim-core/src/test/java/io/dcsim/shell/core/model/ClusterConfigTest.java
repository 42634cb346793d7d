package io.dcsim.shell.core.model;

import static org.junit.jupiter.api.Assertions.*;

import io.dcsim.shell.core.TestClusters;
import java.util.List;
import org.junit.jupiter.api.Test;

class ClusterConfigTest {

  @Test
  void factoryBuildsRequestedShape() {
    ClusterConfig cluster = ClusterFactory.createDefault();
    assertEquals(8, cluster.getNodes().size());
    DgxNode first = cluster.getNodes().get(0);
    assertEquals("dgx-00", first.getId());
    assertEquals(8, first.getGpus().size());
    assertEquals(ClusterFactory.NVLINKS_PER_GPU, first.getGpus().get(0).getNvlinks().size());
    assertEquals(81920, first.getGpus().get(0).getMemoryTotal());
    assertEquals("dgx-07", cluster.getNodes().get(7).getId());
  }

  @Test
  void factoryRejectsEmptyCluster() {
    assertThrows(IllegalArgumentException.class, () -> ClusterFactory.create(0, 8));
  }

  @Test
  void copySharesNoMutableState() {
    ClusterConfig original = TestClusters.small();
    ClusterConfig copy = original.copy();

    Gpu copied = copy.findGpu("dgx-00", 0).orElseThrow();
    copied.setTemperature(99);
    copied.getEccErrors().setDoubleBit(3);
    copied.getNvlinks().get(0).setStatus(NvLink.DOWN);
    copied.getXidErrors().add(new XidError(79, 0L, "gone", HealthStatus.CRITICAL));
    copy.findNode("dgx-00").orElseThrow().getHcas().get(0).getPorts().get(0).setState("Down");
    copy.getNodes().remove(1);

    Gpu untouched = original.findGpu("dgx-00", 0).orElseThrow();
    assertEquals(45, untouched.getTemperature());
    assertEquals(0, untouched.getEccErrors().getDoubleBit());
    assertTrue(untouched.getNvlinks().get(0).isActive());
    assertTrue(untouched.getXidErrors().isEmpty());
    assertEquals(
        "Active",
        original.findNode("dgx-00").orElseThrow().getHcas().get(0).getPorts().get(0).getState());
    assertEquals(2, original.getNodes().size());
  }

  @Test
  void copiesShareImmutableRecordsUntilReassigned() {
    ClusterConfig original = TestClusters.small();
    Gpu gpu = original.findGpu("dgx-00", 0).orElseThrow();
    gpu.getXidErrors().add(new XidError(48, 0L, "dbe", HealthStatus.CRITICAL));
    ClusterConfig copy = original.copy();

    assertSame(original.getSlurmConfig(), copy.getSlurmConfig());
    assertSame(original.getBcmHa(), copy.getBcmHa());
    DgxNode node = copy.findNode("dgx-00").orElseThrow();
    assertSame(original.findNode("dgx-00").orElseThrow().getBmc(), node.getBmc());
    assertSame(gpu.getXidErrors().get(0), node.getGpus().get(0).getXidErrors().get(0));
    assertThrows(
        UnsupportedOperationException.class,
        () -> copy.getSlurmConfig().partitions().add("batch"));

    node.setBmc(new BmcInfo("10.0.0.1", "00:00:00:00:00:01", "25.01", "NVIDIA", "Off"));
    copy.setSlurmConfig(new SlurmConfig("other-ctrl", List.of("batch")));
    assertEquals("On", original.findNode("dgx-00").orElseThrow().getBmc().powerState());
    assertEquals(List.of("gpu", "debug"), original.getSlurmConfig().partitions());
  }

  @Test
  void findsNodesByIdOrHostname() {
    ClusterConfig cluster = TestClusters.small();
    cluster.getNodes().get(1).setHostname("gpu-node-1");
    assertTrue(cluster.findNode("dgx-01").isPresent());
    assertTrue(cluster.findNode("gpu-node-1").isPresent());
    assertTrue(cluster.findNode("nope").isEmpty());
    assertTrue(cluster.findNode(null).isEmpty());
    assertTrue(cluster.findGpu("dgx-00", 7).isEmpty());
  }

  @Test
  void gpuUpdateAppliesOnlySetFields() {
    Gpu gpu = TestClusters.small().findGpu("dgx-00", 1).orElseThrow();
    GpuUpdate.builder().temperature(80).linkStatus(2, NvLink.DOWN).build().applyTo(gpu);

    assertEquals(80, gpu.getTemperature());
    assertEquals(50, gpu.getUtilization());
    assertEquals(HealthStatus.OK, gpu.getHealthStatus());
    assertEquals(NvLink.DOWN, gpu.getNvlinks().get(2).getStatus());
    assertEquals(NvLink.ACTIVE, gpu.getNvlinks().get(1).getStatus());
  }

  @Test
  void healthStatusParsesLabelsIgnoringCase() {
    assertEquals(HealthStatus.WARNING, HealthStatus.fromLabel("warning").orElseThrow());
    assertEquals(HealthStatus.CRITICAL, HealthStatus.fromLabel(" Critical ").orElseThrow());
    assertTrue(HealthStatus.fromLabel("broken").isEmpty());
  }

  @Test
  void xidCatalogKnowsFallenOffTheBus() {
    assertEquals(HealthStatus.CRITICAL, XidCatalog.severityOf(79));
    assertTrue(XidCatalog.describe(79).contains("fallen off the bus"));
    assertTrue(XidCatalog.describe(12345).contains("Unknown"));
  }
}
