package io.dcsim.shell.core.state;

import static org.junit.jupiter.api.Assertions.*;

import io.dcsim.shell.core.TestClusters;
import io.dcsim.shell.core.model.ClusterConfig;
import io.dcsim.shell.core.model.GpuUpdate;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class ScenarioContextManagerTest {

  private ScenarioContextManager manager;
  private ClusterConfig base;

  @BeforeEach
  void setUp() {
    manager = new ScenarioContextManager();
    base = TestClusters.small();
  }

  @Test
  void createAndLookUp() {
    ScenarioContext a = manager.createContext("a", base);
    assertSame(a, manager.getContext("a").orElseThrow());
    assertTrue(manager.getContext("b").isEmpty());
    assertEquals(1, manager.size());
  }

  @Test
  void createOverwritesExistingId() {
    ScenarioContext first = manager.createContext("a", base);
    first.updateGpu("dgx-00", 0, GpuUpdate.builder().temperature(90).build());

    ScenarioContext second = manager.createContext("a", base);

    assertNotSame(first, second);
    assertEquals(45, second.getGpu("dgx-00", 0).orElseThrow().getTemperature());
    assertEquals(1, manager.size());
  }

  @Test
  void getOrCreateReusesExisting() {
    ScenarioContext a = manager.getOrCreateContext("a", base);
    assertSame(a, manager.getOrCreateContext("a", TestClusters.small()));
  }

  @Test
  void contextsFromTheSameBaseAreIsolated() {
    ScenarioContext a = manager.createContext("a", base);
    ScenarioContext b = manager.createContext("b", base);

    a.updateGpu("dgx-00", 0, GpuUpdate.builder().temperature(95).build());

    assertEquals(45, b.getGpu("dgx-00", 0).orElseThrow().getTemperature());
    assertNotSame(a.getCluster(), b.getCluster());
  }

  @Test
  void onlyOneActiveContext() {
    manager.createContext("a", base);
    manager.createContext("b", base);

    assertTrue(manager.setActiveContext("a"));
    assertTrue(manager.setActiveContext("b"));
    assertEquals("b", manager.getActiveContext().orElseThrow().getId());

    assertFalse(manager.setActiveContext("missing"));
    assertEquals("b", manager.getActiveContextId().orElseThrow());

    assertTrue(manager.setActiveContext(null));
    assertTrue(manager.getActiveContext().isEmpty());
  }

  @Test
  void deletingActiveContextLeavesNoneActive() {
    manager.createContext("a", base);
    manager.createContext("b", base);
    manager.setActiveContext("a");

    assertTrue(manager.deleteContext("a"));

    assertTrue(manager.getActiveContext().isEmpty());
    assertEquals(1, manager.size());
    assertFalse(manager.deleteContext("a"));
  }

  @Test
  void deletingInactiveContextKeepsActive() {
    manager.createContext("a", base);
    manager.createContext("b", base);
    manager.setActiveContext("a");
    manager.deleteContext("b");
    assertEquals("a", manager.getActiveContext().orElseThrow().getId());
  }

  @Test
  void clearAllDropsEverything() {
    manager.createContext("a", base);
    manager.createContext("b", base);
    manager.setActiveContext("b");

    manager.clearAll();

    assertEquals(0, manager.size());
    assertTrue(manager.getContextIds().isEmpty());
    assertTrue(manager.getActiveContext().isEmpty());
  }

  @Test
  void contextIdsKeepCreationOrder() {
    manager.createContext("z", base);
    manager.createContext("a", base);
    assertEquals(java.util.List.of("z", "a"), manager.getContextIds());
  }
}
