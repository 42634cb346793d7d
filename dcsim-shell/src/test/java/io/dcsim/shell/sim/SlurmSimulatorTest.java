package io.dcsim.shell.sim;

import static org.junit.jupiter.api.Assertions.*;

import io.dcsim.shell.cli.BufferIO;
import io.dcsim.shell.cli.ShellConfig;
import io.dcsim.shell.cli.ShellRuntime;
import io.dcsim.shell.core.model.DgxNode;
import io.dcsim.shell.core.sim.CommandResult;
import java.util.List;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class SlurmSimulatorTest {
  private static final String DRAIN_03 =
      "sudo scontrol update NodeName=dgx-03 State=DRAIN Reason=\"bad gpu\"";

  private ShellRuntime runtime;

  @BeforeEach
  void setUp() throws Exception {
    runtime = ShellRuntime.create(ShellConfig.defaults(), new BufferIO());
  }

  @AfterEach
  void tearDown() {
    runtime.close();
  }

  private CommandResult run(String line) {
    return runtime.dispatcher().execute(line);
  }

  private DgxNode node(String id) {
    return runtime.store().getCluster().findNode(id).orElseThrow();
  }

  private static String[] lines(String out) {
    return out.split("\n");
  }

  private static List<String> cells(String line) {
    return List.of(line.trim().split("\\s+"));
  }

  @Test
  void sinfoGroupsIdleNodesPerPartition() {
    String[] lines = lines(run("sinfo").output());
    assertEquals(3, lines.length);
    assertEquals(
        List.of("PARTITION", "AVAIL", "TIMELIMIT", "NODES", "STATE", "NODELIST"),
        cells(lines[0]));
    assertEquals(List.of("gpu*", "up", "infinite", "8", "idle", "dgx-[00-07]"), cells(lines[1]));
    assertEquals(List.of("debug", "up", "infinite", "8", "idle", "dgx-[00-07]"), cells(lines[2]));
  }

  @Test
  void drainedNodeGetsItsOwnRowAndReason() {
    CommandResult update = run(DRAIN_03);
    assertTrue(update.isSuccess(), update.output());
    assertEquals("", update.output());
    assertEquals("drain", node("dgx-03").getSlurmState());
    assertEquals("bad gpu", node("dgx-03").getSlurmReason());

    String[] lines = lines(run("sinfo -p gpu").output());
    assertEquals(3, lines.length);
    assertEquals(List.of("gpu*", "up", "infinite", "7", "idle", "dgx-[00-02,04-07]"),
        cells(lines[1]));
    assertEquals(List.of("gpu*", "up", "infinite", "1", "drain", "dgx-03"), cells(lines[2]));

    String reasons = run("sinfo -R").output();
    assertTrue(reasons.startsWith("REASON"));
    assertTrue(reasons.contains("bad gpu"));
    assertTrue(reasons.contains("dgx-03"));
  }

  @Test
  void updateNeedsRoot() {
    CommandResult result = run("scontrol update NodeName=dgx-03 State=DRAIN Reason=x");
    assertEquals(CommandResult.FAILURE, result.exitCode());
    assertEquals("slurm_update error: Access/permission denied", result.output());
    assertNull(node("dgx-03").getSlurmReason());
  }

  @Test
  void drainNeedsReason() {
    CommandResult result = run("sudo scontrol update NodeName=dgx-03 State=DRAIN");
    assertEquals(CommandResult.FAILURE, result.exitCode());
    assertTrue(result.output().startsWith("You must specify a reason"));
  }

  @Test
  void updateRejectsUnknownStateAndNode() {
    CommandResult state = run("sudo scontrol update NodeName=dgx-03 State=FOO");
    assertTrue(state.output().startsWith("Invalid input: State=FOO"));

    CommandResult node = run("sudo scontrol update NodeName=dgx-42 State=RESUME");
    assertEquals("Invalid node name specified: dgx-42", node.output());

    CommandResult entity = run("sudo scontrol update State=RESUME");
    assertTrue(entity.output().startsWith("No valid entity in update command"));
  }

  @Test
  void resumeClearsDrain() {
    run(DRAIN_03);
    assertTrue(run("sudo scontrol update NodeName=dgx-03 State=RESUME").isSuccess());
    assertEquals("idle", node("dgx-03").getSlurmState());
    assertNull(node("dgx-03").getSlurmReason());
    assertEquals(3, lines(run("sinfo").output()).length);
  }

  @Test
  void nodeOrientedWithoutHeader() {
    String[] lines = lines(run("sinfo -N -h").output());
    assertEquals(16, lines.length);
    assertEquals(List.of("dgx-00", "1", "gpu*", "idle"), cells(lines[0]));
    assertEquals(List.of("dgx-07", "1", "debug", "idle"), cells(lines[15]));
  }

  @Test
  void partitionFilter() {
    String[] lines = lines(run("sinfo -p debug").output());
    assertEquals(2, lines.length);
    assertEquals("debug", cells(lines[1]).get(0));
  }

  @Test
  void customFormat() {
    String out = run("sinfo -o \"%P %D %t\"").output();
    assertEquals("PARTITION NODES STATE\ngpu* 8 idle\ndebug 8 idle\n", out);
  }

  @Test
  void squeueListsJobsFromGpuAllocations() {
    String empty = run("squeue").output();
    assertEquals(1, lines(empty).length);
    assertTrue(empty.startsWith("JOBID"));

    node("dgx-01").findGpu(0).orElseThrow().setAllocatedJobId("1001");
    node("dgx-01").findGpu(1).orElseThrow().setAllocatedJobId("1001");

    String[] lines = lines(run("squeue").output());
    assertEquals(2, lines.length);
    assertEquals(
        List.of("1001", "gpu", "train-1001", "admin", "R", "1:02:03", "1", "dgx-01"),
        cells(lines[1]));
    assertEquals(1, lines(run("squeue -u bob").output()).length);
    assertEquals(1, lines(run("squeue -h -j 1001").output()).length);

    String[] sinfo = lines(run("sinfo -p gpu").output());
    assertEquals(List.of("gpu*", "up", "infinite", "7", "idle", "dgx-[00,02-07]"),
        cells(sinfo[1]));
    assertEquals(List.of("gpu*", "up", "infinite", "1", "mix", "dgx-01"), cells(sinfo[2]));
  }

  @Test
  void showNodeRecord() {
    run(DRAIN_03);
    CommandResult result = run("scontrol show node dgx-03");
    assertTrue(result.isSuccess(), result.output());
    String out = result.output();
    assertTrue(out.startsWith("NodeName=dgx-03 Arch=x86_64"));
    assertTrue(out.contains("\n   CPUAlloc=0 CPUEfctv=224 CPUTot=224"));
    assertTrue(out.contains("\n   State=IDLE+DRAIN ThreadsPerCore=2"));
    assertTrue(out.contains("\n   Reason=bad gpu [root]"));

    CommandResult missing = run("scontrol show node dgx-99");
    assertEquals(CommandResult.FAILURE, missing.exitCode());
    assertEquals("Node dgx-99 not found", missing.output());
  }

  @Test
  void oneLinerJoinsRecord() {
    String out = run("scontrol -o show node dgx-00").output();
    assertEquals(1, lines(out).length);
    assertTrue(out.contains("Arch=x86_64 CoresPerSocket=56 CPUAlloc=0"));

    assertEquals(8, lines(run("scontrol -o show nodes").output()).length);
  }

  @Test
  void showPartitionRecord() {
    String out = run("scontrol show partition debug").output();
    assertTrue(out.startsWith("PartitionName=debug\n"));
    assertTrue(out.contains("Default=NO"));
    assertTrue(out.contains("Nodes=dgx-[00-07]"));
    assertTrue(out.contains("TotalCPUs=1792 TotalNodes=8"));

    assertEquals("Partition batch not found", run("scontrol show partition batch").output());
    assertEquals(
        "invalid entity:jobs for keyword:show", run("scontrol show jobs").output());
  }

  @Test
  void scenarioDrainDoesNotTouchGlobalState() {
    run("scenario create maintenance");
    assertTrue(run(DRAIN_03).isSuccess());
    assertTrue(run("sinfo").output().contains("drain"));
    assertNull(node("dgx-03").getSlurmReason());

    run("scenario use none");
    assertFalse(run("sinfo").output().contains("drain"));
  }

  @Test
  void versionFlag() {
    assertEquals("slurm 23.02.6", run("sinfo -V").output());
  }
}
