package io.dcsim.shell.cli;

import io.dcsim.shell.core.model.ClusterConfig;
import io.dcsim.shell.core.model.DgxNode;
import io.dcsim.shell.core.registry.CommandDefinitionRegistry;
import io.dcsim.shell.core.route.CommandRouter;
import io.dcsim.shell.core.state.ClusterStore;
import io.dcsim.shell.core.state.FaultType;
import io.dcsim.shell.core.state.ScenarioContext;
import io.dcsim.shell.core.state.ScenarioContextManager;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;
import org.jline.reader.Candidate;
import org.jline.reader.Completer;
import org.jline.reader.LineReader;
import org.jline.reader.ParsedLine;

/**
 * Tab completion for the simulator shell: command names, catalogue flags and subcommands,
 * scenario ids, node ids and fault types. A leading {@code sudo} is skipped.
 */
public final class ShellCompleter implements Completer {
  private static final List<String> SHELL_KEYWORDS = List.of("exit", "quit", "sudo");
  private static final Set<String> SCENARIO_ID_COMMANDS =
      Set.of("use", "info", "reset", "delete", "export", "readonly");

  private final CommandDefinitionRegistry registry;
  private final CommandRouter router;
  private final ScenarioContextManager scenarios;
  private final ClusterStore store;

  public ShellCompleter(
      CommandDefinitionRegistry registry,
      CommandRouter router,
      ScenarioContextManager scenarios,
      ClusterStore store) {
    this.registry = registry;
    this.router = router;
    this.scenarios = scenarios;
    this.store = store;
  }

  @Override
  public void complete(LineReader reader, ParsedLine line, List<Candidate> candidates) {
    List<String> words = line.words();
    int wordIndex = line.wordIndex();
    int first = 0;
    if (words.size() > 1 && words.get(0).equals(CommandDispatcher.SUDO)) {
      first = 1;
    }
    int position = wordIndex - first;
    String partial = line.word();

    if (position == 0) {
      completeCommands(partial, candidates);
      return;
    }
    String cmd = words.get(first);
    switch (cmd) {
      case ScenarioCommands.NAME -> completeScenario(words, first, position, partial, candidates);
      case BuiltinCommands.SSH -> {
        if (position == 1) {
          completeNodes(partial, candidates);
        }
      }
      case FaultCommands.NAME -> completeFault(position, partial, candidates);
      case ExplainCommand.NAME -> {
        if (position == 1) {
          for (String tool : registry.getCommandNames()) {
            add(candidates, tool, partial, "tools", null);
          }
        } else if (position == 2) {
          completeToolWords(words.get(first + 1), partial, candidates);
        }
      }
      default -> {
        if (registry.has(cmd)) {
          completeToolWords(cmd, partial, candidates);
        }
      }
    }
  }

  private void completeCommands(String partial, List<Candidate> candidates) {
    for (String name : router.names()) {
      String descr =
          registry.getDefinition(name).map(def -> def.category()).orElse("shell");
      add(candidates, name, partial, "commands", descr);
    }
    for (String keyword : SHELL_KEYWORDS) {
      add(candidates, keyword, partial, "commands", "shell");
    }
  }

  private void completeScenario(
      List<String> words, int first, int position, String partial, List<Candidate> candidates) {
    if (position == 1) {
      for (String sub : ScenarioCommands.SUBCOMMANDS) {
        add(candidates, sub, partial, "scenario", null);
      }
      return;
    }
    String sub = words.get(first + 1);
    if (position == 2 && SCENARIO_ID_COMMANDS.contains(sub)) {
      for (String id : scenarios.getContextIds()) {
        add(candidates, id, partial, "scenarios", null);
      }
      if (sub.equals("use")) {
        add(candidates, "none", partial, "scenarios", "global cluster");
      }
    } else if (position == 3 && sub.equals("readonly")) {
      add(candidates, "on", partial, null, null);
      add(candidates, "off", partial, null, null);
    } else if (sub.equals("create") && partial.startsWith("-")) {
      add(candidates, "--from", partial, null, "global|default");
    }
  }

  private void completeFault(int position, String partial, List<Candidate> candidates) {
    if (position == 1) {
      add(candidates, "list", partial, "faults", null);
      for (FaultType type : FaultType.values()) {
        add(candidates, type.faultName(), partial, "faults", null);
      }
    } else if (position == 2) {
      completeNodes(partial, candidates);
    }
  }

  private void completeNodes(String partial, List<Candidate> candidates) {
    ClusterConfig cluster =
        scenarios.getActiveContext().map(ScenarioContext::getCluster).orElse(store.getCluster());
    for (DgxNode node : cluster.getNodes()) {
      add(candidates, node.getId(), partial, "nodes", node.getSlurmState());
    }
  }

  /** Flags render as {@code -x} for single letters and compound shorts, else {@code --name}. */
  private void completeToolWords(String tool, String partial, List<Candidate> candidates) {
    if (partial.startsWith("-")) {
      Set<String> rendered = new TreeSet<>();
      for (String flag : registry.getFlagNames(tool)) {
        boolean shortForm = flag.length() == 1 || registry.isCompoundShortFlag(tool, flag);
        rendered.add((shortForm ? "-" : "--") + flag);
      }
      for (String flag : rendered) {
        String descr =
            registry.findOption(tool, flag).map(opt -> opt.description()).orElse(null);
        add(candidates, flag, partial, "options", descr);
      }
      return;
    }
    for (String sub : registry.getSubcommandNames(tool)) {
      add(candidates, sub, partial, "subcommands", null);
    }
  }

  private static void add(
      List<Candidate> candidates, String value, String partial, String group, String descr) {
    if (value.startsWith(partial)) {
      candidates.add(new Candidate(value, value, group, descr, null, null, true));
    }
  }
}
