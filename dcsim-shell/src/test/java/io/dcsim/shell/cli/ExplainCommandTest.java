package io.dcsim.shell.cli;

import static org.junit.jupiter.api.Assertions.*;

import io.dcsim.shell.core.sim.CommandResult;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class ExplainCommandTest {

  private ShellRuntime runtime;

  @BeforeEach
  void setUp() throws Exception {
    runtime = ShellRuntime.create(ShellConfig.defaults(), new BufferIO());
  }

  @AfterEach
  void tearDown() {
    runtime.close();
  }

  private CommandResult explain(String args) {
    return runtime.dispatcher().execute("explain " + args);
  }

  @Test
  void toolOverviewListsSections() {
    CommandResult result = explain("nvidia-smi");
    assertTrue(result.isSuccess());
    String out = result.output();
    assertTrue(out.startsWith("nvidia-smi ("));
    assertTrue(out.contains("Synopsis:\n  nvidia-smi [OPTION1 [ARG1]]"));
    assertTrue(out.contains("Options:"));
    assertTrue(out.contains("-pl, --power-limit"));
    assertTrue(out.contains("Subcommands:"));
    assertTrue(out.contains("\"No devices were found\""));
    assertTrue(out.contains("Fix: List valid indices with nvidia-smi -L."));
    assertTrue(out.contains("Exit codes:"));
  }

  @Test
  void optionDetailKeepsCompoundShortFlagsWhole() {
    String out = explain("nvidia-smi -pl").output();
    assertTrue(out.startsWith("nvidia-smi -pl, --power-limit"));
    assertTrue(out.contains("Argument: WATTS (number)"));
    assertTrue(out.contains("Default:  700"));
    assertTrue(out.contains("Example:  sudo nvidia-smi -i 0 -pl 500"));
    assertTrue(out.contains("Warning:  requires root privileges; run with sudo"));
  }

  @Test
  void readOnlyOptionHasNoWarning() {
    String out = explain("nvidia-smi --query").output();
    assertTrue(out.contains("Display GPU or Unit info."));
    assertFalse(out.contains("Warning:"));
  }

  @Test
  void subcommandDetail() {
    CommandResult result = explain("scontrol show");
    assertTrue(result.isSuccess());
    assertTrue(result.output().startsWith("scontrol show\n"));
  }

  @Test
  void unknownTopicSuggestsNearestFlag() {
    CommandResult result = explain("nvidia-smi --querry");
    assertEquals(1, result.exitCode());
    assertTrue(result.output().startsWith("explain: '--querry' is not an option of nvidia-smi"));
    assertTrue(result.output().contains("Did you mean --query?"));
  }

  @Test
  void unknownTool() {
    CommandResult result = explain("kubectl");
    assertEquals(1, result.exitCode());
    assertEquals("explain: no documentation for 'kubectl'", result.output());
  }

  @Test
  void missingArgumentIsUsageError() {
    assertEquals(CommandResult.USAGE, runtime.dispatcher().execute("explain").exitCode());
  }
}
