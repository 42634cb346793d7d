package io.dcsim.shell.cli;

import static org.junit.jupiter.api.Assertions.*;

import io.dcsim.shell.core.sim.CommandResult;
import io.dcsim.shell.core.state.ScenarioContext;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class ScriptRunnerTest {

  private BufferIO io;
  private ShellRuntime runtime;

  @BeforeEach
  void setUp() throws Exception {
    io = new BufferIO();
    runtime = ShellRuntime.create(ShellConfig.defaults(), io);
  }

  @AfterEach
  void tearDown() {
    runtime.close();
  }

  private ScriptRunner runner(Map<String, String> arguments) {
    return new ScriptRunner(runtime, arguments);
  }

  @Test
  void drillFileWithArgumentsAndComments(@TempDir Path dir) throws IOException {
    Path drill = dir.resolve("login.dcs");
    Files.writeString(
        drill,
        """
        # log into the node under test

        ssh ${target}
        hostname
        """);

    ScriptRunner.Outcome outcome = runner(Map.of("target", "dgx-05")).run(drill);

    assertEquals(2, outcome.passed());
    assertFalse(outcome.failed());
    assertEquals(CommandResult.SUCCESS, outcome.exitCode());
    assertEquals("dgx-05\n", io.text());
  }

  @Test
  void undefinedVariableFailsWithUsageCode() {
    ScriptRunner.Outcome outcome = runner(Map.of()).run(List.of("ssh ${missing}"));

    ScriptRunner.LineFailure failure = outcome.failures().get(0);
    assertEquals(CommandResult.USAGE, failure.exitCode());
    assertTrue(failure.message().contains("Undefined variable: missing"));
    assertTrue(failure.message().contains("--var missing=value"));
    assertTrue(outcome.stopped());
  }

  @Test
  void stopsAtFirstNonZeroExitByDefault() {
    ScriptRunner.Outcome outcome =
        runner(Map.of()).run(List.of("hostname", "nvidia-smi -pl 300", "whoami"));

    assertTrue(outcome.stopped());
    assertEquals(1, outcome.passed());
    ScriptRunner.LineFailure failure = outcome.failures().get(0);
    assertEquals(2, failure.lineNumber());
    assertEquals(CommandResult.FAILURE, failure.exitCode());
    assertEquals("exit code 1", failure.message());
    assertEquals(CommandResult.FAILURE, outcome.exitCode());
    assertFalse(io.text().contains("admin"));
  }

  @Test
  void setPlusEKeepsGoingAndSetMinusEStopsAgain() {
    ScriptRunner.Outcome outcome =
        runner(Map.of())
            .run(
                List.of(
                    "set +e",
                    "nvidia-smi --bogus",
                    "bogus-command",
                    "set -e",
                    "sinfo --nope",
                    "whoami"));

    assertTrue(outcome.stopped());
    assertEquals(2, outcome.passed());
    assertEquals(3, outcome.failures().size());
    assertEquals(CommandResult.USAGE, outcome.failures().get(0).exitCode());
    assertEquals(CommandResult.NOT_FOUND, outcome.failures().get(1).exitCode());
    assertEquals(5, outcome.failures().get(2).lineNumber());
    assertFalse(io.text().contains("admin"));
  }

  @Test
  void continueFromTheCommandLineStartsWithSetPlusE() {
    ScriptRunner runner = runner(Map.of());
    runner.setStopOnFailure(false);
    ScriptRunner.Outcome outcome = runner.run(List.of("bogus-command", "whoami"));

    assertFalse(outcome.stopped());
    assertEquals(1, outcome.passed());
    assertEquals(CommandResult.NOT_FOUND, outcome.exitCode());
    assertTrue(io.text().endsWith("admin\n"));
  }

  @Test
  void expectMatchesTheGivenExitCode() {
    ScriptRunner.Outcome outcome =
        runner(Map.of())
            .run(List.of("expect 1 nvidia-smi -pl 300", "expect 127 nvsmi", "expect 1 hostname"));

    assertEquals(2, outcome.passed());
    ScriptRunner.LineFailure failure = outcome.failures().get(0);
    assertEquals(3, failure.lineNumber());
    assertEquals("expected exit code 1, got 0", failure.message());
    assertEquals(CommandResult.FAILURE, failure.exitCode());
  }

  @Test
  void lastExitCodeIsAVariable() {
    ScriptRunner.Outcome outcome =
        runner(Map.of()).run(List.of("set +e", "sinfo --nope", "expect ${?} squeue --nope"));

    assertEquals(1, outcome.failures().size());
    assertEquals(CommandResult.USAGE, outcome.failures().get(0).exitCode());
    assertEquals(2, outcome.passed());
  }

  @Test
  void sessionVariablesFollowTheShell() {
    ScriptRunner.Outcome outcome =
        runner(Map.of())
            .run(
                List.of(
                    "ssh dgx-02",
                    "fault thermal ${node} 0 --targetTemp 90",
                    "scenario create drill",
                    "expect 0 scenario info ${scenario}"));

    assertFalse(outcome.failed(), () -> outcome.failures().toString());
    assertEquals(
        90, runtime.store().getCluster().findGpu("dgx-02", 0).orElseThrow().getTemperature());
    assertTrue(io.text().contains("Scenario:  drill (active)"));
  }

  @Test
  void variablesSetInsideAScenarioStayWithIt() {
    ScriptRunner.Outcome outcome =
        runner(Map.of("gpu", "0"))
            .run(
                List.of(
                    "set gpu=1",
                    "scenario create a",
                    "set gpu=3",
                    "fault thermal dgx-00 ${gpu} --targetTemp 91",
                    "scenario create b",
                    "fault thermal dgx-00 ${gpu} --targetTemp 92",
                    "scenario delete a",
                    "scenario create a",
                    "fault thermal dgx-00 ${gpu} --targetTemp 93"));

    assertFalse(outcome.failed(), () -> outcome.failures().toString());
    ScenarioContext b = runtime.scenarios().getContext("b").orElseThrow();
    ScenarioContext a = runtime.scenarios().getContext("a").orElseThrow();
    assertEquals(92, b.getGpu("dgx-00", 1).orElseThrow().getTemperature());
    assertEquals(93, a.getGpu("dgx-00", 1).orElseThrow().getTemperature());
  }

  @Test
  void trainingDrillEndToEnd() {
    ScriptRunner.Outcome outcome =
        runner(Map.of())
            .run(
                List.of(
                    "scenario create drill",
                    "set gpu=1",
                    "fault thermal ${node} ${gpu} --targetTemp 91",
                    "nvidia-smi -q -d TEMPERATURE -i ${gpu}",
                    "verify \"nvidia-smi -q -d TEMPERATURE\"",
                    "expect 1 nvidia-smi -pl 300",
                    "scenario reset",
                    "scenario delete ${scenario}"));

    assertFalse(outcome.failed(), () -> outcome.failures().toString());
    assertEquals(8, outcome.passed());
    assertTrue(io.text().contains("PASS: nvidia-smi -q -d TEMPERATURE -i 1"));
    assertEquals(0, runtime.scenarios().size());
  }

  @Test
  void failureRendersLineAndMessage() {
    ScriptRunner.LineFailure failure =
        new ScriptRunner.LineFailure(3, "sinfo -x", 2, "exit code 2");
    assertEquals("line 3 (exit 2): sinfo -x\n  exit code 2", failure.toString());
  }
}
