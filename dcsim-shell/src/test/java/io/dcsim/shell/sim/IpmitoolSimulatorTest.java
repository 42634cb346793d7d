package io.dcsim.shell.sim;

import static org.junit.jupiter.api.Assertions.*;

import io.dcsim.shell.cli.BufferIO;
import io.dcsim.shell.cli.ShellConfig;
import io.dcsim.shell.cli.ShellRuntime;
import io.dcsim.shell.core.model.HealthStatus;
import io.dcsim.shell.core.sim.CommandResult;
import io.dcsim.shell.core.state.ScenarioContext;
import io.dcsim.shell.core.state.ScenarioMutation;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class IpmitoolSimulatorTest {

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

  private HealthStatus nodeHealth(String node) {
    return runtime.store().getCluster().findNode(node).orElseThrow().getHealthStatus();
  }

  private static String tempRow(String sensor, String reading, String status) {
    return String.format("%-16s | %-10s | %-10s | %-6s", sensor, reading, "degrees C", status);
  }

  @Test
  void sensorListShowsGpuTemperatures() {
    CommandResult result = run("ipmitool sensor list");
    assertTrue(result.isSuccess());
    assertTrue(result.output().contains(tempRow("GPU0 Temp", "35.000", "ok")));
    assertTrue(result.output().contains("| 85.000    | 90.000    | 95.000"));
    assertTrue(result.output().contains("PSU5 Power"));
    assertEquals(HealthStatus.OK, nodeHealth("dgx-00"));
  }

  @Test
  void criticalGpuTemperatureWarnsTheNode() {
    run("fault thermal dgx-00 4 --targetTemp 91");

    String out = run("ipmitool sensor").output();
    assertTrue(out.contains(tempRow("GPU4 Temp", "91.000", "cr")));
    assertEquals(HealthStatus.WARNING, nodeHealth("dgx-00"));
  }

  @Test
  void nonRecoverableTemperatureInScenarioIsAttributedToTheSensorRead() {
    run("scenario create overheat");
    run("fault thermal dgx-00 1 --targetTemp 96");

    run("ipmitool sensor");

    ScenarioContext scenario = runtime.scenarios().getActiveContext().orElseThrow();
    assertEquals(HealthStatus.CRITICAL, scenario.getNode("dgx-00").orElseThrow().getHealthStatus());
    ScenarioMutation last = scenario.getMutations().get(scenario.getMutations().size() - 1);
    assertEquals(IpmitoolSimulator.SENSOR_COMMAND, last.command());
    assertEquals(HealthStatus.OK, nodeHealth("dgx-00"));
  }

  @Test
  void sensorReadNeverImprovesNodeHealth() {
    runtime.store().updateNodeHealth("dgx-00", HealthStatus.CRITICAL);
    run("fault thermal dgx-00 0 --targetTemp 91");

    run("ipmitool sensor");
    assertEquals(HealthStatus.CRITICAL, nodeHealth("dgx-00"));
  }

  @Test
  void sensorGetByName() {
    CommandResult result = run("ipmitool sensor get \"GPU2 Temp\"");
    assertTrue(result.isSuccess(), result.output());
    assertTrue(result.output().contains("Sensor ID              : GPU2 Temp"));
    assertTrue(result.output().contains("Upper critical        : 90.000"));

    CommandResult missing = run("ipmitool sensor get \"GPU9 Temp\"");
    assertEquals(IpmitoolSimulator.EXIT_FAILURE, missing.exitCode());
    assertEquals("Sensor data record \"GPU9 Temp\" not found!", missing.output());
  }

  @Test
  void selListsBootAndXidEvents() {
    run("fault xid-error dgx-00 0 --xid 79");

    String[] lines = run("ipmitool sel list").output().split("\n");
    assertEquals(2, lines.length);
    assertEquals(
        "   1 | 01/15/2024 | 08:00:00 | System Event #0x01 | Timestamp Clock Sync | Asserted",
        lines[0]);
    assertTrue(
        lines[1].endsWith(
            "| Critical Interrupt GPU0 | Xid 79: GPU has fallen off the bus | Asserted"));
    assertTrue(run("ipmitool sel info").output().contains("Entries          : 2"));
  }

  @Test
  void mcInfoReportsBmcFirmware() {
    String out = run("ipmitool mc info").output();
    assertTrue(out.contains("Firmware Revision         : 24.01.08"));
    assertTrue(out.contains("Manufacturer Name         : NVIDIA"));
    assertTrue(out.contains("Product Name              : DGX-H100 BMC"));
  }

  @Test
  void remoteHostByBmcAddressOrNodeId() {
    String out = run("ipmitool -I lanplus -H 10.0.0.103 -U admin -P admin lan print").output();
    assertTrue(out.contains("IP Address              : 10.0.0.103"));
    assertTrue(out.contains("MAC Address             : b8:ce:f6:00:03:01"));
    assertTrue(out.contains("Default Gateway IP      : 10.0.0.1"));

    assertTrue(run("ipmitool -H dgx-02 lan print").output().contains("10.0.0.102"));

    CommandResult unknown = run("ipmitool -I lanplus -H 10.9.9.9 chassis status");
    assertEquals(IpmitoolSimulator.EXIT_FAILURE, unknown.exitCode());
    assertEquals("Error: Unable to establish IPMI v2 / RMCP+ session", unknown.output());
  }

  @Test
  void chassisStatusFlagsPowerOverload() {
    assertTrue(run("ipmitool chassis status").output().contains("Power Overload       : false"));
    assertEquals("Chassis Power is on", run("ipmitool chassis power status").output());

    run("fault power dgx-00 0");
    String out = run("ipmitool chassis status").output();
    assertTrue(out.startsWith("System Power         : on\n"));
    assertTrue(out.contains("Power Overload       : true"));
  }

  @Test
  void versionHelpAndUsage() {
    assertEquals("ipmitool version 1.8.18", run("ipmitool -V").output());
    assertTrue(run("ipmitool -h").output().contains("usage: ipmitool [options...] <command>"));
    assertEquals(CommandResult.USAGE, run("ipmitool").exitCode());
    assertEquals(CommandResult.USAGE, run("ipmitool sel clear").exitCode());
  }
}
