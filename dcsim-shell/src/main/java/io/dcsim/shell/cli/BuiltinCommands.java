package io.dcsim.shell.cli;

import io.dcsim.shell.core.model.DgxNode;
import io.dcsim.shell.core.parse.ParsedCommand;
import io.dcsim.shell.core.registry.CommandDefinition;
import io.dcsim.shell.core.registry.CommandDefinitionRegistry;
import io.dcsim.shell.core.route.CommandRouter;
import io.dcsim.shell.core.sim.CommandContext;
import io.dcsim.shell.core.sim.CommandResult;
import io.dcsim.shell.core.sim.StateSource;
import io.dcsim.shell.core.validate.CommandValidator;
import java.util.List;
import java.util.Optional;

/** Shell commands that are not simulated tools: help, history, ssh and verify. */
final class BuiltinCommands {
  static final String HELP = "help";
  static final String HISTORY = "history";
  static final String SSH = "ssh";
  static final String VERIFY = "verify";

  private final CommandDefinitionRegistry registry;
  private final CommandRouter router;
  private final ShellSession session;
  private final CommandValidator validator;

  BuiltinCommands(CommandDefinitionRegistry registry, CommandRouter router, ShellSession session) {
    this.registry = registry;
    this.router = router;
    this.session = session;
    this.validator = new CommandValidator();
  }

  void registerAll() {
    router.register(HELP, this::help);
    router.register(HISTORY, this::history);
    router.register(SSH, this::ssh);
    router.register(VERIFY, this::verify);
  }

  CommandResult help(ParsedCommand parsed, CommandContext context) {
    Optional<String> topic = parsed.positional(0);
    if (topic.isPresent()) {
      return registry
          .getCommandHelp(topic.get())
          .map(CommandResult::success)
          .orElseGet(() -> CommandResult.error("help: no help topics match '" + topic.get() + "'"));
    }
    StringBuilder sb = new StringBuilder("Available commands:\n");
    for (String name : router.names()) {
      String description =
          registry.getDefinition(name).map(CommandDefinition::description).orElse("");
      sb.append(String.format("  %-14s %s%n", name, description).stripTrailing()).append('\n');
    }
    sb.append("\nPrefix a command with 'sudo' to run it as root. Type 'exit' to quit.");
    return CommandResult.success(sb.toString());
  }

  CommandResult history(ParsedCommand parsed, CommandContext context) {
    if (parsed.hasFlag("c")) {
      session.clearHistory();
      return CommandResult.success("");
    }
    List<String> lines = session.history();
    StringBuilder sb = new StringBuilder();
    for (int i = 0; i < lines.size(); i++) {
      sb.append(String.format("%5d  %s%n", i + 1, lines.get(i)));
    }
    return CommandResult.success(sb.toString());
  }

  CommandResult ssh(ParsedCommand parsed, CommandContext context) {
    Optional<String> target = parsed.positional(0);
    if (target.isEmpty()) {
      return CommandResult.error("usage: ssh <node>", CommandResult.USAGE);
    }
    String host = target.get();
    int at = host.indexOf('@');
    if (at >= 0) {
      host = host.substring(at + 1);
    }
    Optional<DgxNode> node = StateSource.forReads(context).cluster().findNode(host);
    if (node.isEmpty()) {
      return CommandResult.error(
          "ssh: Could not resolve hostname " + host + ": Name or service not known", 255);
    }
    session.setCurrentNode(node.get().getId());
    return CommandResult.success("");
  }

  /** Checks the previous command against the quoted expected command lines. */
  CommandResult verify(ParsedCommand parsed, CommandContext context) {
    List<String> expected = parsed.positionalArgs();
    if (expected.isEmpty()) {
      return CommandResult.error(
          "usage: verify \"<expected command>\" ...", CommandResult.USAGE);
    }
    String last = session.lastCommand();
    if (last == null) {
      return CommandResult.error("FAIL: no command has been run yet");
    }
    if (validator.validateCommandExecuted(last, expected)) {
      return CommandResult.success("PASS: " + last);
    }
    return CommandResult.error("FAIL: '" + last + "' does not match " + expected);
  }
}
