package io.dcsim.shell.cli;

import io.dcsim.shell.core.model.ClusterConfig;
import io.dcsim.shell.core.parse.ParsedCommand;
import io.dcsim.shell.core.route.CommandHandler;
import io.dcsim.shell.core.sim.CommandContext;
import io.dcsim.shell.core.sim.CommandResult;
import io.dcsim.shell.core.sim.TableFormatter;
import io.dcsim.shell.core.state.ScenarioContext;
import io.dcsim.shell.core.state.ScenarioContextManager;
import io.dcsim.shell.core.state.ScenarioMutation;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * The {@code scenario} built-in: lifecycle of isolated training contexts.
 *
 * <pre>
 * scenario create &lt;id&gt; [--from global|default]
 * scenario use &lt;id&gt;|none
 * scenario list
 * scenario info [id]
 * scenario reset [id]
 * scenario delete &lt;id&gt;
 * scenario clear
 * scenario export [id]
 * scenario readonly &lt;id&gt; on|off
 * </pre>
 *
 * A new context is built from a snapshot of the global cluster or from a freshly generated
 * default cluster, never from another context.
 */
final class ScenarioCommands implements CommandHandler {
  private static final Logger LOG = LoggerFactory.getLogger(ScenarioCommands.class);

  static final String NAME = "scenario";
  static final List<String> SUBCOMMANDS =
      List.of("create", "use", "list", "info", "reset", "delete", "clear", "export", "readonly");

  private static final String USAGE =
      "usage: scenario create|use|list|info|reset|delete|clear|export|readonly [args]";

  private final ScenarioContextManager scenarios;
  private final Supplier<ClusterConfig> defaultCluster;

  ScenarioCommands(ScenarioContextManager scenarios, Supplier<ClusterConfig> defaultCluster) {
    this.scenarios = Objects.requireNonNull(scenarios, "scenarios");
    this.defaultCluster = Objects.requireNonNull(defaultCluster, "defaultCluster");
  }

  @Override
  public CommandResult handle(ParsedCommand parsed, CommandContext context) {
    List<String> args = parsed.positionalArgs();
    if (args.isEmpty()) {
      return CommandResult.error(USAGE, CommandResult.USAGE);
    }
    String sub = args.get(0);
    Optional<String> id = args.size() > 1 ? Optional.of(args.get(1)) : Optional.empty();
    return switch (sub) {
      case "create" -> create(id, parsed.flagValue("from").orElse("global"), context);
      case "use" -> use(id);
      case "list" -> list();
      case "info" -> withContext(id, this::info);
      case "reset" -> withContext(id, this::reset);
      case "delete" -> delete(id);
      case "clear" -> clear();
      case "export" -> withContext(id, c -> CommandResult.success(c.export()));
      case "readonly" -> readonly(id, args.size() > 2 ? args.get(2) : null);
      default -> CommandResult.error(
          "scenario: unknown subcommand '" + sub + "'\n" + USAGE, CommandResult.USAGE);
    };
  }

  private CommandResult create(Optional<String> id, String from, CommandContext context) {
    if (id.isEmpty()) {
      return CommandResult.error(
          "usage: scenario create <id> [--from global|default]", CommandResult.USAGE);
    }
    ClusterConfig base;
    switch (from) {
      case "global" -> base = context.globalStore().snapshot();
      case "default" -> base = defaultCluster.get();
      default -> {
        return CommandResult.error(
            "scenario: --from must be 'global' or 'default', got '" + from + "'",
            CommandResult.USAGE);
      }
    }
    scenarios.createContext(id.get(), base);
    scenarios.setActiveContext(id.get());
    LOG.info("Scenario {} created from {} cluster", id.get(), from);
    return CommandResult.success("Created scenario '" + id.get() + "' from " + from + " (active)");
  }

  private CommandResult use(Optional<String> id) {
    if (id.isEmpty()) {
      return CommandResult.error("usage: scenario use <id>|none", CommandResult.USAGE);
    }
    if (id.get().equals("none")) {
      scenarios.setActiveContext(null);
      return CommandResult.success("No active scenario; commands use the global cluster");
    }
    if (!scenarios.setActiveContext(id.get())) {
      return CommandResult.error("scenario: no such scenario '" + id.get() + "'");
    }
    return CommandResult.success("Active scenario: " + id.get());
  }

  private CommandResult list() {
    String active = scenarios.getActiveContextId().orElse(null);
    List<List<String>> rows = new ArrayList<>();
    for (String id : scenarios.getContextIds()) {
      Optional<ScenarioContext> ctx = scenarios.getContext(id);
      if (ctx.isEmpty()) {
        continue;
      }
      rows.add(
          List.of(
              id.equals(active) ? "*" : "",
              id,
              String.valueOf(ctx.get().getMutationCount()),
              ctx.get().isReadonly() ? "yes" : "no"));
    }
    return CommandResult.success(
        TableFormatter.format(
            List.of("ACTIVE", "ID", "MUTATIONS", "READONLY"), rows, "No scenarios."));
  }

  private CommandResult info(ScenarioContext ctx) {
    StringBuilder sb = new StringBuilder();
    boolean active = scenarios.getActiveContextId().map(ctx.getId()::equals).orElse(false);
    sb.append("Scenario:  ").append(ctx.getId()).append(active ? " (active)" : "").append('\n');
    sb.append("Mutations: ").append(ctx.getMutationCount()).append('\n');
    sb.append("Readonly:  ").append(ctx.isReadonly() ? "yes" : "no").append('\n');
    sb.append("Runtime:   ").append(ctx.getRuntimeMs() / 1000).append("s\n");
    List<ScenarioMutation> diff = ctx.getDiff();
    if (!diff.isEmpty()) {
      sb.append("Changes:\n");
      for (ScenarioMutation m : diff) {
        sb.append("  ").append(m.type().label()).append(' ').append(m.nodeId());
        if (m.gpuId() != null) {
          sb.append(" gpu ").append(m.gpuId());
        }
        if (!m.data().isEmpty()) {
          sb.append(' ').append(m.data());
        }
        if (m.command() != null) {
          sb.append(" via ").append(m.command());
        }
        sb.append('\n');
      }
    }
    return CommandResult.success(sb.toString());
  }

  private CommandResult reset(ScenarioContext ctx) {
    if (!ctx.reset()) {
      return CommandResult.error("scenario: '" + ctx.getId() + "' is readonly");
    }
    return CommandResult.success("Scenario '" + ctx.getId() + "' reset to its baseline");
  }

  private CommandResult delete(Optional<String> id) {
    if (id.isEmpty()) {
      return CommandResult.error("usage: scenario delete <id>", CommandResult.USAGE);
    }
    if (!scenarios.deleteContext(id.get())) {
      return CommandResult.error("scenario: no such scenario '" + id.get() + "'");
    }
    return CommandResult.success("Deleted scenario '" + id.get() + "'");
  }

  private CommandResult clear() {
    int count = scenarios.size();
    scenarios.clearAll();
    return CommandResult.success("Cleared " + count + " scenario(s)");
  }

  private CommandResult readonly(Optional<String> id, String mode) {
    if (id.isEmpty() || mode == null || !(mode.equals("on") || mode.equals("off"))) {
      return CommandResult.error("usage: scenario readonly <id> on|off", CommandResult.USAGE);
    }
    Optional<ScenarioContext> ctx = scenarios.getContext(id.get());
    if (ctx.isEmpty()) {
      return CommandResult.error("scenario: no such scenario '" + id.get() + "'");
    }
    ctx.get().setReadonly(mode.equals("on"));
    return CommandResult.success("Scenario '" + id.get() + "' readonly " + mode);
  }

  /** Runs {@code action} on the named context, or the active one when no id is given. */
  private CommandResult withContext(
      Optional<String> id, Function<ScenarioContext, CommandResult> action) {
    Optional<ScenarioContext> ctx =
        id.isPresent() ? scenarios.getContext(id.get()) : scenarios.getActiveContext();
    if (ctx.isEmpty()) {
      return CommandResult.error(
          id.map(s -> "scenario: no such scenario '" + s + "'")
              .orElse("scenario: no active scenario"));
    }
    return action.apply(ctx.get());
  }
}
