package io.dcsim.shell.cli;

import io.dcsim.shell.core.parse.CommandParser;
import io.dcsim.shell.core.parse.ParsedCommand;
import io.dcsim.shell.core.registry.CommandDefinition;
import io.dcsim.shell.core.registry.CommandDefinition.CommandOption;
import io.dcsim.shell.core.registry.CommandDefinition.ErrorMessage;
import io.dcsim.shell.core.registry.CommandDefinition.ExitCode;
import io.dcsim.shell.core.registry.CommandDefinition.Subcommand;
import io.dcsim.shell.core.registry.CommandDefinition.UsagePattern;
import io.dcsim.shell.core.registry.CommandDefinitionRegistry;
import io.dcsim.shell.core.registry.ValidationResult;
import io.dcsim.shell.core.route.CommandHandler;
import io.dcsim.shell.core.sim.CommandContext;
import io.dcsim.shell.core.sim.CommandResult;
import io.dcsim.shell.core.suggest.CommandInterceptor;
import io.dcsim.shell.core.suggest.SuggestionResult;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/** {@code explain <tool> [flag|subcommand]}: catalogue backed documentation. */
final class ExplainCommand implements CommandHandler {
  static final String NAME = "explain";

  private final CommandDefinitionRegistry registry;

  ExplainCommand(CommandDefinitionRegistry registry) {
    this.registry = registry;
  }

  @Override
  public CommandResult handle(ParsedCommand parsed, CommandContext context) {
    // raw words: the parsed flags of "explain nvidia-smi -pl" would split -pl into -p -l
    List<String> words = CommandParser.tokenize(parsed.firstSegment());
    List<String> args = words.subList(Math.min(1, words.size()), words.size());
    if (args.isEmpty()) {
      return CommandResult.error(
          "usage: explain <command> [flag|subcommand]", CommandResult.USAGE);
    }
    String tool = args.get(0);
    Optional<CommandDefinition> def = registry.getDefinition(tool);
    if (def.isEmpty()) {
      return CommandResult.error("explain: no documentation for '" + tool + "'");
    }
    if (args.size() == 1) {
      return CommandResult.success(describeTool(def.get()));
    }
    String topic = args.get(1);
    Optional<Subcommand> sub = registry.findSubcommand(tool, topic);
    if (sub.isPresent()) {
      return CommandResult.success(describeSubcommand(tool, sub.get()));
    }
    Optional<CommandOption> option = registry.findOption(tool, topic);
    if (option.isPresent()) {
      return CommandResult.success(describeOption(tool, topic, option.get()));
    }
    return unknownTopic(tool, topic);
  }

  private CommandResult unknownTopic(String tool, String topic) {
    String name = CommandDefinitionRegistry.normalize(topic);
    StringBuilder sb = new StringBuilder();
    sb.append("explain: '").append(topic).append("' is not an option of ").append(tool);
    CommandInterceptor interceptor = registry.interceptor();
    SuggestionResult flagCheck = interceptor.validateFlag(tool, name);
    String hint = interceptor.formatSuggestion(tool, flagCheck, true);
    if (hint.isEmpty()) {
      ValidationResult subCheck = registry.validateSubcommand(tool, name);
      hint =
          interceptor.formatSuggestion(
              tool, new SuggestionResult(false, 0, subCheck.suggestions()), false);
    }
    if (!hint.isEmpty()) {
      sb.append('\n').append(hint);
    }
    return CommandResult.error(sb.toString());
  }

  static String describeTool(CommandDefinition def) {
    StringBuilder sb = new StringBuilder();
    sb.append(def.command()).append(" (").append(def.category()).append(")\n");
    sb.append("  ").append(def.description()).append("\n\n");
    sb.append("Synopsis:\n  ").append(def.synopsis()).append('\n');

    if (!def.commonUsagePatterns().isEmpty()) {
      sb.append("\nExamples:\n");
      for (UsagePattern p : def.commonUsagePatterns()) {
        sb.append("  $ ").append(p.command());
        if (p.isRootOnly()) {
          sb.append("    [requires root]");
        }
        sb.append('\n');
        if (p.description() != null) {
          sb.append("      ").append(p.description()).append('\n');
        }
      }
    }
    if (!def.globalOptions().isEmpty()) {
      sb.append("\nOptions:\n");
      for (CommandOption opt : def.globalOptions()) {
        sb.append(String.format("  %-28s %s", aliases(opt), opt.description()).stripTrailing());
        sb.append(opt.isRootOnly() ? " [root]\n" : "\n");
      }
    }
    if (!def.subcommands().isEmpty()) {
      sb.append("\nSubcommands:\n");
      for (Subcommand sub : def.subcommands()) {
        sb.append(String.format("  %-14s %s", sub.name(), sub.description()).stripTrailing());
        sb.append('\n');
      }
    }
    if (!def.errorMessages().isEmpty()) {
      sb.append("\nCommon errors:\n");
      for (ErrorMessage e : def.errorMessages()) {
        sb.append("  \"").append(e.message()).append("\"\n");
        if (e.meaning() != null) {
          sb.append("      Meaning: ").append(e.meaning()).append('\n');
        }
        if (e.resolution() != null) {
          sb.append("      Fix: ").append(e.resolution()).append('\n');
        }
      }
    }
    if (!def.exitCodes().isEmpty()) {
      sb.append("\nExit codes:\n");
      for (ExitCode code : def.exitCodes()) {
        sb.append(String.format("  %3d  %s%n", code.code(), code.meaning()));
      }
    }
    List<String> related = def.interoperability().relatedCommands();
    if (!related.isEmpty()) {
      sb.append("\nRelated: ").append(String.join(", ", related)).append('\n');
    }
    return sb.toString();
  }

  private static String describeSubcommand(String tool, Subcommand sub) {
    StringBuilder sb = new StringBuilder();
    sb.append(tool).append(' ').append(sub.name()).append('\n');
    sb.append("  ").append(sub.description()).append('\n');
    if (sub.synopsis() != null) {
      sb.append("\nSynopsis:\n  ").append(sub.synopsis()).append('\n');
    }
    if (!sub.options().isEmpty()) {
      sb.append("\nOptions:\n");
      for (CommandOption opt : sub.options()) {
        sb.append(String.format("  %-28s %s", aliases(opt), opt.description()).stripTrailing());
        sb.append('\n');
      }
    }
    return sb.toString();
  }

  private String describeOption(String tool, String topic, CommandOption opt) {
    StringBuilder sb = new StringBuilder();
    sb.append(tool).append(' ').append(aliases(opt)).append('\n');
    sb.append("  ").append(opt.description()).append('\n');
    if (opt.arguments() != null) {
      sb.append("  Argument: ").append(opt.arguments());
      if (opt.argumentType() != null) {
        sb.append(" (").append(opt.argumentType()).append(')');
      }
      sb.append('\n');
    }
    if (opt.defaultValue() != null) {
      sb.append("  Default:  ").append(opt.defaultValue()).append('\n');
    }
    if (opt.example() != null) {
      sb.append("  Example:  ").append(opt.example()).append('\n');
    }
    if (registry.requiresRoot(tool, topic)) {
      sb.append("  Warning:  requires root privileges; run with sudo\n");
    }
    return sb.toString();
  }

  private static String aliases(CommandOption opt) {
    List<String> parts = new ArrayList<>();
    if (opt.shortName() != null) {
      parts.add(dashed(opt.shortName(), "-"));
    }
    if (opt.longName() != null) {
      parts.add(dashed(opt.longName(), "--"));
    }
    if (parts.isEmpty() && opt.flag() != null) {
      parts.add(opt.flag());
    }
    return String.join(", ", parts);
  }

  private static String dashed(String alias, String prefix) {
    return alias.startsWith("-") ? alias : prefix + alias;
  }
}
