package io.dcsim.shell.core.state;

import static org.junit.jupiter.api.Assertions.*;

import com.google.gson.JsonObject;
import com.google.gson.JsonParser;
import io.dcsim.shell.core.TestClusters;
import io.dcsim.shell.core.model.ClusterConfig;
import io.dcsim.shell.core.model.GpuUpdate;
import io.dcsim.shell.core.model.HealthStatus;
import io.dcsim.shell.core.model.MigInstance;
import io.dcsim.shell.core.model.XidError;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class ScenarioContextTest {

  private ClusterConfig base;
  private ScenarioContext context;

  @BeforeEach
  void setUp() {
    base = TestClusters.small();
    context = new ScenarioContext("scenario-1", base);
  }

  @Test
  void constructionDeepCopiesBase() {
    assertNotSame(base, context.getCluster());
    base.findGpu("dgx-00", 0).orElseThrow().setTemperature(10);
    assertEquals(45, context.getGpu("dgx-00", 0).orElseThrow().getTemperature());
  }

  @Test
  void updateGpuChangesOnlyThisContext() {
    assertTrue(context.updateGpu("dgx-00", 0, GpuUpdate.builder().temperature(90).build()));

    assertEquals(90, context.getGpu("dgx-00", 0).orElseThrow().getTemperature());
    assertEquals(45, base.findGpu("dgx-00", 0).orElseThrow().getTemperature());
    assertEquals(1, context.getMutationCount());
  }

  @Test
  void mutationsRecordTheCommandThatMadeThem() {
    context.updateGpu("dgx-00", 0, GpuUpdate.builder().powerLimit(500).build(), "nvidia-smi");
    context.updateNodeHealth("dgx-01", HealthStatus.WARNING, "ipmitool sensor");
    context.setSlurmState("dgx-01", "drain", "bad gpu", "scontrol");
    context.setMigMode("dgx-00", 1, true);

    List<ScenarioMutation> mutations = context.getMutations();
    assertEquals("nvidia-smi", mutations.get(0).command());
    assertEquals("ipmitool sensor", mutations.get(1).command());
    assertEquals("scontrol", mutations.get(2).command());
    assertNull(mutations.get(3).command());
  }

  @Test
  void everyMutationKindCountsOnce() {
    context.updateGpu("dgx-00", 0, GpuUpdate.builder().utilization(0).build());
    context.addXidError("dgx-00", 0, new XidError(43, 1L, "stopped", HealthStatus.WARNING));
    context.updateNodeHealth("dgx-01", HealthStatus.CRITICAL);
    context.setMigMode("dgx-00", 1, true);
    context.setSlurmState("dgx-01", "drain", "maintenance");

    assertEquals(5, context.getMutationCount());
    List<ScenarioMutation> log = context.getMutations();
    assertEquals(ScenarioMutation.Type.GPU_UPDATE, log.get(0).type());
    assertEquals(ScenarioMutation.Type.XID_ERROR, log.get(1).type());
    assertEquals(ScenarioMutation.Type.NODE_HEALTH, log.get(2).type());
    assertNull(log.get(2).gpuId());
    assertEquals(ScenarioMutation.Type.MIG_MODE, log.get(3).type());
    assertEquals(1, log.get(3).gpuId());
    assertEquals(ScenarioMutation.Type.SLURM_STATE, log.get(4).type());
    assertEquals("drain", log.get(4).data().get("state"));
    assertEquals("dgx-01", log.get(4).nodeId());
  }

  @Test
  void readsDoNotCount() {
    context.getGpu("dgx-00", 0);
    context.getNode("dgx-01");
    context.getCluster();
    context.snapshot();
    context.getMutations();
    assertEquals(0, context.getMutationCount());
  }

  @Test
  void unknownTargetsAreIgnored() {
    assertFalse(context.updateGpu("nope", 0, GpuUpdate.builder().temperature(1).build()));
    assertFalse(context.updateGpu("dgx-00", 42, GpuUpdate.builder().temperature(1).build()));
    assertFalse(context.updateNodeHealth("nope", HealthStatus.CRITICAL));
    assertFalse(context.setSlurmState("nope", "down", null));
    assertEquals(0, context.getMutationCount());
    assertTrue(context.getMutations().isEmpty());
  }

  @Test
  void migModeClearsInstances() {
    context
        .getGpu("dgx-00", 0)
        .orElseThrow()
        .getMigInstances()
        .add(new MigInstance(1, "1g.10gb", 9856));
    context.setMigMode("dgx-00", 0, true);
    assertTrue(context.getGpu("dgx-00", 0).orElseThrow().isMigMode());
    assertTrue(context.getGpu("dgx-00", 0).orElseThrow().getMigInstances().isEmpty());
  }

  @Test
  void slurmStateSetsStateAndReason() {
    context.setSlurmState("dgx-01", "drain", "bad gpu");
    assertEquals("drain", context.getNode("dgx-01").orElseThrow().getSlurmState());
    assertEquals("bad gpu", context.getNode("dgx-01").orElseThrow().getSlurmReason());
  }

  @Test
  void resetRestoresBaselineAndZeroesCounter() {
    context.updateGpu("dgx-00", 0, GpuUpdate.builder().temperature(95).build());
    context.updateNodeHealth("dgx-00", HealthStatus.CRITICAL);
    base.findGpu("dgx-00", 0).orElseThrow().setTemperature(60);

    assertTrue(context.reset());

    assertEquals(0, context.getMutationCount());
    assertTrue(context.getMutations().isEmpty());
    assertEquals(45, context.getGpu("dgx-00", 0).orElseThrow().getTemperature());
    assertEquals(HealthStatus.OK, context.getNode("dgx-00").orElseThrow().getHealthStatus());
  }

  @Test
  void readonlyRejectsMutationsAndReset() {
    context.updateGpu("dgx-00", 0, GpuUpdate.builder().temperature(70).build());
    context.setReadonly(true);

    assertFalse(context.updateGpu("dgx-00", 0, GpuUpdate.builder().temperature(99).build()));
    assertFalse(context.addXidError("dgx-00", 0, new XidError(79, 1L, "x", HealthStatus.CRITICAL)));
    assertFalse(context.reset());

    assertEquals(70, context.getGpu("dgx-00", 0).orElseThrow().getTemperature());
    assertEquals(1, context.getMutationCount());

    context.setReadonly(false);
    assertTrue(context.reset());
  }

  @Test
  void mutationLogIsADefensiveCopy() {
    context.updateNodeHealth("dgx-00", HealthStatus.WARNING);
    List<ScenarioMutation> log = context.getMutations();
    log.clear();
    assertEquals(1, context.getMutations().size());
    assertEquals(context.getMutations(), context.getDiff());
  }

  @Test
  void snapshotIsIndependent() {
    ClusterConfig snap = context.snapshot();
    snap.findGpu("dgx-00", 0).orElseThrow().setTemperature(1);
    assertEquals(45, context.getGpu("dgx-00", 0).orElseThrow().getTemperature());
  }

  @Test
  void exportContainsClusterAndMutations() {
    context.addXidError(
        "dgx-00", 1, new XidError(79, 5L, "gone", HealthStatus.CRITICAL), "fault");

    JsonObject json = JsonParser.parseString(context.export()).getAsJsonObject();

    assertEquals("scenario-1", json.get("scenarioId").getAsString());
    assertTrue(json.has("cluster"));
    assertEquals(2, json.getAsJsonObject("cluster").getAsJsonArray("nodes").size());
    assertEquals(1, json.getAsJsonArray("mutations").size());
    JsonObject mutation = json.getAsJsonArray("mutations").get(0).getAsJsonObject();
    assertEquals("xid-error", mutation.get("type").getAsString());
    assertEquals("fault", mutation.get("command").getAsString());
    assertTrue(json.get("runtime").getAsLong() >= 0);
  }

  @Test
  void runtimeIsNeverNegative() {
    assertTrue(context.getRuntimeMs() >= 0);
  }

  @Test
  void rejectsNullIdOrCluster() {
    assertThrows(NullPointerException.class, () -> new ScenarioContext(null, base));
    assertThrows(NullPointerException.class, () -> new ScenarioContext("x", null));
  }
}
