package io.dcsim.shell;

import io.dcsim.shell.cli.CommandDispatcher;
import io.dcsim.shell.cli.ScriptRunner;
import io.dcsim.shell.cli.ShellConfig;
import io.dcsim.shell.cli.ShellRuntime;
import io.dcsim.shell.core.registry.CommandDefinitionException;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.Callable;
import picocli.CommandLine;

@CommandLine.Command(
    name = "dcsim-shell",
    description = "Simulated DGX cluster shell for operator training",
    version = "0.3.0",
    mixinStandardHelpOptions = true)
public class Main implements Callable<Integer> {
  @CommandLine.Option(
      names = {"-s", "--script"},
      description = "Run a script file non-interactively")
  private String script;

  @CommandLine.Option(
      names = {"--var"},
      description = "Script variable as key=value (repeatable)")
  private Map<String, String> variables = new HashMap<>();

  @CommandLine.Option(
      names = {"--continue-on-error"},
      description = "Start scripts with 'set +e': keep going after a failed line")
  private boolean continueOnError;

  @CommandLine.Option(names = {"--root"}, description = "Start as root")
  private boolean root;

  @CommandLine.Option(
      names = {"-n", "--node"},
      description = "Node to log into (default: first node)")
  private String node;

  @CommandLine.Option(names = {"--nodes"}, description = "Number of nodes in the cluster")
  private Integer nodes;

  @CommandLine.Option(names = {"--gpus"}, description = "GPUs per node")
  private Integer gpus;

  @CommandLine.Option(
      names = {"--commands-dir"},
      description = "Directory of command definition files (default: bundled)")
  private String commandsDir;

  @CommandLine.Option(
      names = {"-q", "--quiet"},
      description = "Suppress banner")
  private boolean quiet;

  public static void main(String[] args) {
    int exitCode = new CommandLine(new Main()).execute(args);
    System.exit(exitCode);
  }

  @Override
  public Integer call() throws Exception {
    ShellConfig.Builder builder = ShellConfig.builder().root(root).node(node);
    if (nodes != null) {
      builder.nodes(nodes);
    }
    if (gpus != null) {
      builder.gpusPerNode(gpus);
    }
    if (commandsDir != null) {
      builder.commandsDir(Paths.get(commandsDir));
    }
    ShellConfig config = builder.build();

    if (script != null) {
      return runScript(config);
    }
    try (Shell shell = new Shell(config)) {
      shell.run(quiet);
      return 0;
    }
  }

  private Integer runScript(ShellConfig config) throws IOException {
    Path path = Paths.get(script);
    if (!Files.exists(path)) {
      System.err.println("Error: Script file not found: " + script);
      return 1;
    }
    try (ShellRuntime runtime = ShellRuntime.create(config, new ConsoleIO())) {
      ScriptRunner runner = new ScriptRunner(runtime, variables);
      runner.setStopOnFailure(!continueOnError);
      ScriptRunner.Outcome outcome = runner.run(path);

      if (outcome.failed()) {
        System.err.println(
            outcome.stopped() ? "\nDrill stopped:" : "\nDrill finished with failures:");
        for (ScriptRunner.LineFailure failure : outcome.failures()) {
          System.err.println(failure);
        }
        System.err.println(
            String.format(
                "\n%d of %d lines passed.",
                outcome.passed(), outcome.passed() + outcome.failures().size()));
      }
      return outcome.exitCode();
    } catch (CommandDefinitionException e) {
      System.err.println("Error: " + e.getMessage());
      return 1;
    }
  }

  private static final class ConsoleIO implements CommandDispatcher.IO {
    @Override
    public void println(String s) {
      System.out.println(s);
    }

    @Override
    public void error(String s) {
      System.err.println(s);
    }
  }
}
