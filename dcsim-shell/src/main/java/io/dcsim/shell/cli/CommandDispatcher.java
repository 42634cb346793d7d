package io.dcsim.shell.cli;

import io.dcsim.shell.core.model.ClusterConfig;
import io.dcsim.shell.core.model.DgxNode;
import io.dcsim.shell.core.parse.CommandParser;
import io.dcsim.shell.core.parse.ParsedCommand;
import io.dcsim.shell.core.privilege.StateEngine;
import io.dcsim.shell.core.registry.CommandDefinitionRegistry;
import io.dcsim.shell.core.route.CommandHandler;
import io.dcsim.shell.core.route.CommandRouter;
import io.dcsim.shell.core.sim.CommandContext;
import io.dcsim.shell.core.sim.CommandResult;
import io.dcsim.shell.core.sim.StateSource;
import io.dcsim.shell.core.state.ClusterStore;
import io.dcsim.shell.core.state.ScenarioContextManager;
import io.dcsim.shell.core.suggest.CommandInterceptor;
import io.dcsim.shell.core.suggest.EditDistance;
import io.dcsim.shell.core.suggest.SuggestionResult;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs one command line end to end: {@code sudo} handling, parsing, routing, flag and subcommand
 * validation against the catalogue, the privilege gate, the handler itself and any pipe filters.
 */
public class CommandDispatcher {
  private static final Logger LOG = LoggerFactory.getLogger(CommandDispatcher.class);

  static final String SUDO = "sudo";
  private static final int MAX_COMMAND_DISTANCE = 2;

  /** Output sink of the dispatcher. */
  public interface IO {
    void println(String s);

    void error(String s);
  }

  private final CommandDefinitionRegistry registry;
  private final CommandRouter router;
  private final ClusterStore store;
  private final ScenarioContextManager scenarios;
  private final ShellSession session;
  private final IO io;
  private final CommandParser parser;
  private final StateEngine stateEngine;

  public CommandDispatcher(
      CommandDefinitionRegistry registry,
      CommandRouter router,
      ClusterStore store,
      ScenarioContextManager scenarios,
      ShellSession session,
      IO io) {
    this.registry = Objects.requireNonNull(registry, "registry");
    this.router = Objects.requireNonNull(router, "router");
    this.store = Objects.requireNonNull(store, "store");
    this.scenarios = Objects.requireNonNull(scenarios, "scenarios");
    this.session = Objects.requireNonNull(session, "session");
    this.io = Objects.requireNonNull(io, "io");
    this.parser = new CommandParser(registry);
    this.stateEngine = new StateEngine(registry);
  }

  /**
   * Executes {@code line} and prints its output. Successful output goes to {@link IO#println},
   * failures to {@link IO#error}.
   *
   * @return the result that was printed
   */
  public CommandResult dispatch(String line) {
    CommandResult result = execute(line);
    String out = stripTrailingNewline(result.output());
    if (!out.isEmpty()) {
      if (result.isSuccess()) {
        io.println(out);
      } else {
        io.error(out);
      }
    }
    return result;
  }

  /** Executes {@code line} without printing anything. */
  public CommandResult execute(String line) {
    String trimmed = line == null ? "" : line.trim();
    if (trimmed.isEmpty()) {
      return CommandResult.success("");
    }
    session.recordHistory(trimmed);

    boolean elevated = false;
    String commandLine = trimmed;
    if (commandLine.equals(SUDO)) {
      return CommandResult.error(
          "usage: sudo command [arg ...]", CommandResult.USAGE);
    }
    if (commandLine.startsWith(SUDO + " ")) {
      elevated = true;
      commandLine = commandLine.substring(SUDO.length()).trim();
    }

    ParsedCommand parsed = parser.parse(commandLine);
    String base = parsed.baseCommand();
    Optional<CommandHandler> handler = router.resolve(base);
    if (handler.isEmpty()) {
      return commandNotFound(base);
    }

    if (registry.has(base)) {
      Optional<CommandResult> invalid = checkAgainstCatalogue(base, parsed);
      if (invalid.isPresent()) {
        return invalid.get();
      }
      if (parsed.hasFlag("help")) {
        return CommandResult.success(registry.getCommandHelp(base).orElse(""));
      }
    }

    CommandContext context = buildContext(elevated);
    Optional<String> denied =
        stateEngine.getPrerequisiteError(base, parsed.flags().keySet(), context);
    if (denied.isPresent()) {
      return CommandResult.error(denied.get());
    }

    CommandResult result;
    try {
      result = handler.get().handle(parsed, context);
    } catch (RuntimeException e) {
      LOG.warn("Command '{}' failed", commandLine, e);
      result = CommandResult.error(base + ": internal error: " + e.getMessage());
    }
    if (!BuiltinCommands.VERIFY.equals(base)) {
      session.setLastCommand(commandLine);
    }
    if (parsed.isPiped() && result.isSuccess()) {
      List<String> segments = parsed.pipedSegments();
      result = PipeFilters.apply(segments.subList(1, segments.size()), result);
    }
    return result;
  }

  private Optional<CommandResult> checkAgainstCatalogue(String base, ParsedCommand parsed) {
    CommandInterceptor interceptor = registry.interceptor();
    for (String flag : parsed.flags().keySet()) {
      SuggestionResult check = interceptor.validateFlag(base, flag);
      if (!check.exactMatch()) {
        StringBuilder sb = new StringBuilder();
        sb.append(base)
            .append(": unrecognized option '")
            .append(flag.length() == 1 ? "-" : "--")
            .append(flag)
            .append("'\n");
        String hint = interceptor.formatSuggestion(base, check, true);
        if (!hint.isEmpty()) {
          sb.append(hint).append('\n');
        }
        sb.append("Try '").append(base).append(" --help' for more information.");
        return Optional.of(CommandResult.error(sb.toString(), CommandResult.USAGE));
      }
    }
    Optional<String> sub = parsed.subcommand(0);
    if (sub.isPresent() && !registry.getSubcommandNames(base).isEmpty()) {
      SuggestionResult check = interceptor.validateSubcommand(base, sub.get());
      if (!check.exactMatch()) {
        StringBuilder sb = new StringBuilder();
        sb.append(base).append(": invalid command '").append(sub.get()).append("'\n");
        String hint = interceptor.formatSuggestion(base, check, false);
        if (!hint.isEmpty()) {
          sb.append(hint).append('\n');
        }
        sb.append("Try '").append(base).append(" --help' for more information.");
        return Optional.of(CommandResult.error(sb.toString(), CommandResult.USAGE));
      }
    }
    return Optional.empty();
  }

  private CommandResult commandNotFound(String base) {
    String message = base + ": command not found";
    String nearest = null;
    int best = MAX_COMMAND_DISTANCE + 1;
    for (String name : router.names()) {
      int distance = EditDistance.between(base, name);
      if (distance < best) {
        best = distance;
        nearest = name;
      }
    }
    if (nearest != null && best >= 1) {
      message += "\nDid you mean '" + nearest + "'?";
    }
    return CommandResult.error(message, CommandResult.NOT_FOUND);
  }

  CommandContext buildContext(boolean elevated) {
    boolean root = session.isRoot() || elevated;
    String user = session.user(elevated);
    Map<String, String> env = new LinkedHashMap<>();
    env.put("USER", user);
    env.put("HOME", root ? "/root" : "/home/" + user);
    return CommandContext.builder(store)
        .currentNode(session.currentNode())
        .currentPath(env.get("HOME"))
        .environment(env)
        .history(session.history())
        .root(root)
        .scenarioContext(scenarios.getActiveContext().orElse(null))
        .build();
  }

  /** Prompt for the session's user and node, {@code #} for root and {@code $} otherwise. */
  public String prompt() {
    CommandContext context = buildContext(false);
    ClusterConfig cluster = StateSource.forReads(context).cluster();
    String host = session.currentNode();
    if (host != null) {
      host = cluster.findNode(host).map(DgxNode::getHostname).orElse(host);
    } else if (!cluster.getNodes().isEmpty()) {
      host = cluster.getNodes().get(0).getHostname();
    } else {
      host = "localhost";
    }
    return session.user(false) + "@" + host + ":~" + (session.isRoot() ? "# " : "$ ");
  }

  /** Node commands run on: the session's node, else the first node of the visible cluster. */
  public Optional<String> currentNodeId() {
    if (session.currentNode() != null) {
      return Optional.of(session.currentNode());
    }
    ClusterConfig cluster = StateSource.forReads(buildContext(false)).cluster();
    return cluster.getNodes().stream().findFirst().map(DgxNode::getId);
  }

  /** Names a user can type: routed commands plus the shell's own keywords. */
  public List<String> commandNames() {
    List<String> names = new ArrayList<>(router.names());
    names.add(SUDO);
    return names;
  }

  public ShellSession session() {
    return session;
  }

  public IO io() {
    return io;
  }

  private static String stripTrailingNewline(String s) {
    return s.endsWith("\n") ? s.substring(0, s.length() - 1) : s;
  }
}
