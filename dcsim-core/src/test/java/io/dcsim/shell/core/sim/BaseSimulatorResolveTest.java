package io.dcsim.shell.core.sim;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

import io.dcsim.shell.core.TestClusters;
import io.dcsim.shell.core.model.ClusterConfig;
import io.dcsim.shell.core.model.DgxNode;
import io.dcsim.shell.core.model.GpuUpdate;
import io.dcsim.shell.core.parse.ParsedCommand;
import io.dcsim.shell.core.state.ClusterStore;
import io.dcsim.shell.core.state.ScenarioContext;
import io.dcsim.shell.core.state.StateMutator;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class BaseSimulatorResolveTest {

  /** Exposes the resolution helpers. */
  static final class RecordingSimulator extends BaseSimulator {
    @Override
    public SimulatorMetadata getMetadata() {
      return new SimulatorMetadata("recorder", "1.0", "test simulator", List.of("recorder"));
    }

    @Override
    public CommandResult execute(ParsedCommand parsed, CommandContext context) {
      return createSuccess(resolveCluster(context).getName());
    }

    ClusterConfig cluster(CommandContext context) {
      return resolveCluster(context);
    }

    StateMutator mutator(CommandContext context) {
      return resolveMutator(context);
    }

    DgxNode current(CommandContext context) {
      return resolveCurrentNode(context).orElseThrow();
    }
  }

  private final RecordingSimulator simulator = new RecordingSimulator();
  private ClusterStore store;
  private ScenarioContext scenario;
  private ClusterConfig explicit;

  @BeforeEach
  void setUp() {
    ClusterConfig global = TestClusters.small();
    global.setName("global");
    store = spy(new ClusterStore(global));
    ClusterConfig scenarioBase = TestClusters.small();
    scenarioBase.setName("scenario");
    scenario = new ScenarioContext("s1", scenarioBase);
    explicit = TestClusters.small();
    explicit.setName("explicit");
  }

  @Test
  void explicitClusterWinsForReads() {
    CommandContext context =
        CommandContext.builder(store).scenarioContext(scenario).cluster(explicit).build();
    assertSame(explicit, simulator.cluster(context));
    assertEquals("explicit", simulator.execute(null, context).output());
  }

  @Test
  void scenarioBeatsGlobalStore() {
    CommandContext context = CommandContext.builder(store).scenarioContext(scenario).build();
    assertEquals("scenario", simulator.cluster(context).getName());
  }

  @Test
  void globalStoreIsTheFallback() {
    CommandContext context = CommandContext.builder(store).build();
    assertEquals("global", simulator.cluster(context).getName());
  }

  @Test
  void writesGoToScenarioAndNeverToStore() {
    CommandContext context =
        CommandContext.builder(store).scenarioContext(scenario).cluster(explicit).build();
    StateMutator mutator = simulator.mutator(context);

    assertSame(scenario, mutator);
    assertTrue(mutator.updateGpu("dgx-00", 0, GpuUpdate.builder().temperature(90).build()));

    verify(store, never()).updateGpu(anyString(), anyInt(), any());
    assertEquals(45, store.getCluster().findGpu("dgx-00", 0).orElseThrow().getTemperature());
    assertEquals(45, explicit.findGpu("dgx-00", 0).orElseThrow().getTemperature());
    assertEquals(1, scenario.getMutationCount());
  }

  @Test
  void writesReachStoreWithoutScenario() {
    CommandContext context = CommandContext.builder(store).build();
    simulator.mutator(context).updateGpu("dgx-01", 1, GpuUpdate.builder().temperature(80).build());

    verify(store).updateGpu(eq("dgx-01"), eq(1), any());
    assertEquals(80, store.getCluster().findGpu("dgx-01", 1).orElseThrow().getTemperature());
  }

  @Test
  void currentNodeDefaultsToFirst() {
    CommandContext context = CommandContext.builder(store).build();
    assertEquals("dgx-00", simulator.current(context).getId());
    CommandContext onSecond = context.toBuilder().currentNode("dgx-01").build();
    assertEquals("dgx-01", simulator.current(onSecond).getId());
  }

  @Test
  void sudoContextKeepsEverythingElse() {
    CommandContext context =
        CommandContext.builder(store).currentNode("dgx-01").scenarioContext(scenario).build();
    CommandContext sudo = context.toBuilder().root(true).build();

    assertTrue(sudo.isRoot());
    assertFalse(context.isRoot());
    assertEquals("dgx-01", sudo.currentNode());
    assertSame(scenario, sudo.scenarioContext().orElseThrow());
    assertEquals("/root", sudo.currentPath());
  }
}
