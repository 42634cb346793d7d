package io.dcsim.shell.sim;

import static org.junit.jupiter.api.Assertions.*;

import io.dcsim.shell.cli.BufferIO;
import io.dcsim.shell.cli.ShellConfig;
import io.dcsim.shell.cli.ShellRuntime;
import io.dcsim.shell.core.sim.CommandResult;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class IbstatSimulatorTest {

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

  @Test
  void fullListingDescribesEveryAdapter() {
    String out = run("ibstat").output();
    assertTrue(
        out.startsWith(
            "CA 'mlx5_0'\n"
                + "\tCA type: MT4129\n"
                + "\tNumber of ports: 1\n"
                + "\tFirmware version: 28.39.1002\n"
                + "\tHardware version: 0\n"
                + "\tPort 1:\n"
                + "\t\tState: Active\n"
                + "\t\tPhysical state: LinkUp\n"
                + "\t\tRate: 400\n"));
    assertTrue(out.contains("\t\tPort GUID: 0xb8cef60300000000\n"));
    assertTrue(out.contains("CA 'mlx5_7'"));
  }

  @Test
  void listOfCas() {
    String[] lines = run("ibstat -l").output().split("\n");
    assertEquals(8, lines.length);
    assertEquals("mlx5_0", lines[0]);
    assertEquals("mlx5_7", lines[7]);
  }

  @Test
  void singleAdapter() {
    String out = run("ibstat mlx5_3").output();
    assertTrue(out.startsWith("CA 'mlx5_3'"));
    assertFalse(out.contains("mlx5_0"));
  }

  @Test
  void unknownAdapterFails() {
    CommandResult result = run("ibstat mlx5_9");
    assertEquals(CommandResult.FAILURE, result.exitCode());
    assertEquals("ibstat: CA 'mlx5_9' not found", result.output());
  }

  @Test
  void shortOutputStopsAtRate() {
    String out = run("ibstat -s mlx5_0").output();
    assertTrue(out.startsWith("CA 'mlx5_0'"));
    assertTrue(out.contains("\t\tRate: 400\n"));
    assertFalse(out.contains("Firmware version"));
    assertFalse(out.contains("Port GUID"));
    assertFalse(out.contains("mlx5_1"));
  }

  @Test
  void portFilter() {
    String out = run("ibstat mlx5_0 1").output();
    assertTrue(out.startsWith("Port 1:\nState: Active\n"));
    assertFalse(out.contains("CA 'mlx5_0'"));

    CommandResult missing = run("ibstat mlx5_0 2");
    assertEquals("ibstat: port 2 not found on mlx5_0", missing.output());
  }

  @Test
  void portGuids() {
    String[] lines = run("ibstat -p").output().split("\n");
    assertEquals(8, lines.length);
    assertEquals("0xb8cef60300000000", lines[0]);
    assertEquals("0xb8cef60300000007", lines[7]);
  }

  @Test
  void portsFollowTheCurrentNode() {
    run("ssh dgx-01");
    assertTrue(run("ibstat -p").output().startsWith("0xb8cef60300000100\n"));
  }
}
