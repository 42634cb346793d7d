package io.dcsim.shell.cli;

import io.dcsim.shell.core.sim.CommandResult;
import io.dcsim.shell.core.state.ScenarioContext;
import io.dcsim.shell.core.state.ScenarioContextManager;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs a training drill line by line through the dispatcher.
 *
 * <p>Every line is judged by its exit code. A plain command passes on exit code 0; {@code expect N
 * command} passes only when the command exits with {@code N}, which lets a drill assert that a
 * tool refuses something. {@code set -e} (the default) stops the drill at the first failing line
 * and {@code set +e} keeps going.
 *
 * <p>{@code set NAME=value} defines a drill variable. Variables defined while a scenario is active
 * belong to that scenario: they are visible only while it is active and are dropped once it is
 * deleted. {@code ${NAME}} resolves, in order, the active scenario's variables, variables set
 * outside any scenario, the variables passed to the constructor and finally {@code ${node}},
 * {@code ${scenario}} and {@code ${?}} (exit code of the previous line).
 *
 * <pre>
 * scenario create drill
 * set gpu=3
 * fault thermal ${node} ${gpu} --targetTemp 92
 * expect 1 nvidia-smi -pl 300
 * verify "nvidia-smi -q -d TEMPERATURE"
 * </pre>
 */
public class ScriptRunner {
  private static final Logger LOG = LoggerFactory.getLogger(ScriptRunner.class);

  private static final Pattern REFERENCE = Pattern.compile("\\$\\{([^}]+)\\}");
  private static final Pattern ASSIGNMENT = Pattern.compile("set\\s+([A-Za-z_][\\w.-]*)=(.*)");
  private static final Pattern EXPECT = Pattern.compile("expect\\s+(\\d+)\\s+(.+)");

  private final CommandDispatcher dispatcher;
  private final ScenarioContextManager scenarios;
  private final Map<String, String> arguments;
  private final Map<ScenarioContext, Map<String, String>> scenarioScopes = new IdentityHashMap<>();
  private final Map<String, String> unscoped = new HashMap<>();
  private boolean stopOnFailure = true;
  private int lastExitCode = CommandResult.SUCCESS;

  public ScriptRunner(ShellRuntime runtime, Map<String, String> arguments) {
    this.dispatcher = runtime.dispatcher();
    this.scenarios = runtime.scenarios();
    this.arguments = Map.copyOf(arguments);
  }

  /** Initial {@code set -e} state; a drill may still toggle it. */
  public void setStopOnFailure(boolean stopOnFailure) {
    this.stopOnFailure = stopOnFailure;
  }

  /**
   * Reads and runs a drill file.
   *
   * @throws IOException if the file cannot be read
   */
  public Outcome run(Path drill) throws IOException {
    return run(Files.readAllLines(drill));
  }

  public Outcome run(List<String> lines) {
    int passed = 0;
    List<LineFailure> failures = new ArrayList<>();
    for (int n = 1; n <= lines.size(); n++) {
      String line = lines.get(n - 1).trim();
      if (line.isEmpty() || line.startsWith("#")) {
        continue;
      }
      Optional<LineFailure> failure = runLine(n, line);
      if (failure.isEmpty()) {
        passed++;
        continue;
      }
      failures.add(failure.get());
      if (stopOnFailure) {
        LOG.debug("Drill stopped at line {}", n);
        return new Outcome(passed, failures, true);
      }
    }
    return new Outcome(passed, failures, false);
  }

  private Optional<LineFailure> runLine(int n, String line) {
    if (line.equals("set -e") || line.equals("set +e")) {
      stopOnFailure = line.equals("set -e");
      return Optional.empty();
    }
    String expanded;
    try {
      expanded = expand(line);
    } catch (IllegalArgumentException e) {
      lastExitCode = CommandResult.USAGE;
      return Optional.of(new LineFailure(n, line, CommandResult.USAGE, e.getMessage()));
    }

    Matcher assignment = ASSIGNMENT.matcher(expanded);
    if (assignment.matches()) {
      scope().put(assignment.group(1), assignment.group(2).trim());
      lastExitCode = CommandResult.SUCCESS;
      return Optional.empty();
    }

    int expected = CommandResult.SUCCESS;
    String command = expanded;
    Matcher expect = EXPECT.matcher(expanded);
    if (expect.matches()) {
      expected = Integer.parseInt(expect.group(1));
      command = expect.group(2);
    }
    lastExitCode = dispatcher.dispatch(command).exitCode();
    if (lastExitCode == expected) {
      return Optional.empty();
    }
    if (expected == CommandResult.SUCCESS) {
      return Optional.of(new LineFailure(n, line, lastExitCode, "exit code " + lastExitCode));
    }
    // A failed line never reports exit code 0.
    int code = lastExitCode == CommandResult.SUCCESS ? CommandResult.FAILURE : lastExitCode;
    return Optional.of(
        new LineFailure(
            n, line, code, "expected exit code " + expected + ", got " + lastExitCode));
  }

  /**
   * @throws IllegalArgumentException if a referenced variable is undefined
   */
  private String expand(String line) {
    Matcher matcher = REFERENCE.matcher(line);
    StringBuilder out = new StringBuilder();
    while (matcher.find()) {
      String name = matcher.group(1);
      String value =
          lookup(name)
              .orElseThrow(
                  () ->
                      new IllegalArgumentException(
                          "Undefined variable: "
                              + name
                              + ". Define with --var "
                              + name
                              + "=value or 'set "
                              + name
                              + "=value'"));
      matcher.appendReplacement(out, Matcher.quoteReplacement(value));
    }
    matcher.appendTail(out);
    return out.toString();
  }

  private Optional<String> lookup(String name) {
    Map<String, String> scoped = scope();
    if (scoped != unscoped && scoped.containsKey(name)) {
      return Optional.of(scoped.get(name));
    }
    if (unscoped.containsKey(name)) {
      return Optional.of(unscoped.get(name));
    }
    if (arguments.containsKey(name)) {
      return Optional.of(arguments.get(name));
    }
    return switch (name) {
      case "node" -> dispatcher.currentNodeId();
      case "scenario" -> scenarios.getActiveContextId();
      case "?" -> Optional.of(String.valueOf(lastExitCode));
      default -> Optional.empty();
    };
  }

  /** Variables of the active scenario, or the unscoped ones when none is active. */
  private Map<String, String> scope() {
    // A deleted or recreated scenario starts without variables.
    scenarioScopes
        .keySet()
        .removeIf(ctx -> scenarios.getContext(ctx.getId()).filter(c -> c == ctx).isEmpty());
    return scenarios
        .getActiveContext()
        .map(ctx -> scenarioScopes.computeIfAbsent(ctx, c -> new HashMap<>()))
        .orElse(unscoped);
  }

  /**
   * What a drill run amounted to.
   *
   * @param passed lines that passed
   * @param failures failing lines in order
   * @param stopped whether {@code set -e} cut the drill short
   */
  public record Outcome(int passed, List<LineFailure> failures, boolean stopped) {
    public Outcome {
      failures = List.copyOf(failures);
    }

    public boolean failed() {
      return !failures.isEmpty();
    }

    /** Exit code of the last failure, or 0. */
    public int exitCode() {
      return failed() ? failures.get(failures.size() - 1).exitCode() : CommandResult.SUCCESS;
    }
  }

  /** A drill line that did not pass. */
  public record LineFailure(int lineNumber, String line, int exitCode, String message) {
    @Override
    public String toString() {
      return "line " + lineNumber + " (exit " + exitCode + "): " + line + "\n  " + message;
    }
  }
}
