package io.dcsim.shell.core.registry;

import io.dcsim.shell.core.parse.ShortFlagVocabulary;
import io.dcsim.shell.core.registry.CommandDefinition.CommandOption;
import io.dcsim.shell.core.registry.CommandDefinition.StateInteraction;
import io.dcsim.shell.core.registry.CommandDefinition.StateWrite;
import io.dcsim.shell.core.registry.CommandDefinition.Subcommand;
import io.dcsim.shell.core.registry.CommandDefinition.UsagePattern;
import io.dcsim.shell.core.suggest.CommandInterceptor;
import io.dcsim.shell.core.suggest.FlagAliases;
import io.dcsim.shell.core.suggest.SuggestionResult;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * In-memory index of tool definitions keyed by tool name, then by flag alias and subcommand name.
 * Short and long aliases of a flag resolve to the same {@link CommandOption}.
 *
 * <p>Queries about tools that have no definition return empty or negative results. Querying
 * before {@link #initialize()} is a programming error.
 */
public class CommandDefinitionRegistry implements ShortFlagVocabulary {
  private static final Logger LOG = LoggerFactory.getLogger(CommandDefinitionRegistry.class);

  private final CommandDefinitionLoader loader;
  private volatile Map<String, ToolIndex> tools;
  private volatile CommandInterceptor interceptor;

  public CommandDefinitionRegistry(CommandDefinitionLoader loader) {
    this.loader = Objects.requireNonNull(loader, "loader");
  }

  /** Creates an initialized registry over the given definitions. */
  public static CommandDefinitionRegistry of(Collection<CommandDefinition> definitions) {
    CommandDefinitionRegistry registry =
        new CommandDefinitionRegistry(CommandDefinitionLoader.bundled());
    Map<String, CommandDefinition> byName = new LinkedHashMap<>();
    for (CommandDefinition def : definitions) {
      byName.put(def.command(), def);
    }
    registry.index(byName);
    return registry;
  }

  /**
   * Loads the catalogue. Calling it again reloads.
   *
   * @throws CommandDefinitionException if the catalogue is missing or malformed
   */
  public synchronized void initialize() throws CommandDefinitionException {
    index(loader.loadAll());
    LOG.info("Command registry initialized with {} tools from {}", tools.size(), loader.describe());
  }

  /** Asynchronous form of {@link #initialize()}; failures complete the future exceptionally. */
  public CompletableFuture<Void> initializeAsync() {
    return CompletableFuture.runAsync(
        () -> {
          try {
            initialize();
          } catch (CommandDefinitionException e) {
            throw new CompletionException(e);
          }
        });
  }

  public boolean isInitialized() {
    return tools != null;
  }

  private synchronized void index(Map<String, CommandDefinition> definitions) {
    Map<String, ToolIndex> next = new LinkedHashMap<>();
    CommandInterceptor nextInterceptor = new CommandInterceptor();
    for (CommandDefinition def : definitions.values()) {
      ToolIndex index = ToolIndex.build(def);
      next.put(def.command(), index);
      nextInterceptor.registerFlags(def.command(), index.aliases);
      nextInterceptor.registerSubcommands(
          def.command(), new ArrayList<>(index.subcommands.keySet()));
    }
    this.interceptor = nextInterceptor;
    this.tools = next;
  }

  private Map<String, ToolIndex> tools() {
    Map<String, ToolIndex> current = tools;
    if (current == null) {
      throw new IllegalStateException("Command registry is not initialized");
    }
    return current;
  }

  /** Suggestion engine populated with every declared flag and subcommand. */
  public CommandInterceptor interceptor() {
    tools();
    return interceptor;
  }

  public Optional<CommandDefinition> getDefinition(String tool) {
    return Optional.ofNullable(tools().get(tool)).map(ToolIndex::definition);
  }

  public boolean has(String tool) {
    return tools().containsKey(tool);
  }

  public Set<String> getCommandNames() {
    return new LinkedHashSet<>(tools().keySet());
  }

  public int size() {
    return tools().size();
  }

  public List<CommandDefinition> getByCategory(String category) {
    List<CommandDefinition> out = new ArrayList<>();
    for (ToolIndex index : tools().values()) {
      if (index.definition.category().equals(category)) {
        out.add(index.definition);
      }
    }
    return out;
  }

  public Optional<StateInteraction> getStateInteractions(String tool) {
    return getDefinition(tool).map(CommandDefinition::stateInteractions);
  }

  /** Looks up a flag by any alias, with or without dashes. */
  public Optional<CommandOption> findOption(String tool, String flag) {
    ToolIndex index = tools().get(tool);
    return index == null
        ? Optional.empty()
        : Optional.ofNullable(index.options.get(normalize(flag)));
  }

  public Optional<Subcommand> findSubcommand(String tool, String name) {
    ToolIndex index = tools().get(tool);
    return index == null ? Optional.empty() : Optional.ofNullable(index.subcommands.get(name));
  }

  public List<String> getSubcommandNames(String tool) {
    ToolIndex index = tools().get(tool);
    return index == null ? List.of() : new ArrayList<>(index.subcommands.keySet());
  }

  /** Every declared alias without dashes. */
  public List<String> getFlagNames(String tool) {
    ToolIndex index = tools().get(tool);
    return index == null ? List.of() : new ArrayList<>(index.options.keySet());
  }

  public ValidationResult validateFlag(String tool, String flag) {
    if (!has(tool)) {
      return new ValidationResult(false, List.of());
    }
    return toValidation(interceptor.validateFlag(tool, normalize(flag)));
  }

  public ValidationResult validateSubcommand(String tool, String name) {
    if (!has(tool)) {
      return new ValidationResult(false, List.of());
    }
    return toValidation(interceptor.validateSubcommand(tool, name));
  }

  private static ValidationResult toValidation(SuggestionResult result) {
    return new ValidationResult(result.exactMatch(), result.suggestions());
  }

  /** Plain text help: description, usage, options and subcommands. */
  public Optional<String> getCommandHelp(String tool) {
    return getDefinition(tool).map(CommandDefinitionRegistry::renderHelp);
  }

  public Optional<String> getFlagHelp(String tool, String flag) {
    return findOption(tool, flag).map(opt -> renderAliases(opt) + "  " + opt.description());
  }

  public List<UsagePattern> getUsageExamples(String tool) {
    return getDefinition(tool).map(CommandDefinition::commonUsagePatterns).orElse(List.of());
  }

  public Optional<String> getExitCodeMeaning(String tool, int code) {
    return getDefinition(tool)
        .flatMap(
            def ->
                def.exitCodes().stream()
                    .filter(ec -> ec.code() == code)
                    .map(CommandDefinition.ExitCode::meaning)
                    .findFirst());
  }

  /**
   * Whether passing {@code flag} to {@code tool} needs root: the option is marked root-only, or a
   * root write interaction is gated by any alias of it.
   */
  public boolean requiresRoot(String tool, String flag) {
    ToolIndex index = tools().get(tool);
    if (index == null) {
      return false;
    }
    String name = normalize(flag);
    CommandOption option = index.options.get(name);
    if (option != null && option.isRootOnly()) {
      return true;
    }
    for (StateWrite write : index.definition.stateInteractions().writesTo()) {
      if (write.requiresRoot() && gates(index, write, name)) {
        return true;
      }
    }
    return false;
  }

  /** Whether {@code flag} is one of the flags that trigger {@code write}, by any alias. */
  public boolean isGatingFlag(String tool, StateWrite write, String flag) {
    ToolIndex index = tools().get(tool);
    return index != null && gates(index, write, normalize(flag));
  }

  private static boolean gates(ToolIndex index, StateWrite write, String flag) {
    CommandOption option = index.options.get(flag);
    for (String required : write.requiresFlags()) {
      String normalized = normalize(required);
      if (normalized.equals(flag)) {
        return true;
      }
      if (option != null && option == index.options.get(normalized)) {
        return true;
      }
    }
    return false;
  }

  @Override
  public boolean isCompoundShortFlag(String command, String name) {
    Map<String, ToolIndex> current = tools;
    if (current == null || name.length() < 2) {
      return false;
    }
    ToolIndex index = current.get(command);
    return index != null && index.compoundShorts.contains(name);
  }

  /** Strips leading dashes, an argument placeholder and a trailing {@code =}. */
  public static String normalize(String alias) {
    if (alias == null) {
      return "";
    }
    String s = alias.trim();
    int i = 0;
    while (i < s.length() && s.charAt(i) == '-') {
      i++;
    }
    s = s.substring(i);
    for (int j = 0; j < s.length(); j++) {
      char c = s.charAt(j);
      if (c == '=' || c == ' ' || c == '<' || c == '[') {
        return s.substring(0, j);
      }
    }
    return s;
  }

  static String renderAliases(CommandOption opt) {
    List<String> parts = new ArrayList<>();
    FlagAliases aliases = ToolIndex.aliasesOf(opt);
    if (aliases == null) {
      return "";
    }
    if (aliases.shortName() != null) {
      parts.add("-" + aliases.shortName());
    }
    if (aliases.longName() != null) {
      parts.add("--" + aliases.longName());
    }
    return String.join(", ", parts);
  }

  private static String renderHelp(CommandDefinition def) {
    StringBuilder sb = new StringBuilder();
    sb.append(def.command()).append(" - ").append(def.description()).append("\n\n");
    sb.append("Usage:\n  ").append(def.synopsis()).append("\n");
    if (!def.globalOptions().isEmpty()) {
      sb.append("\nOptions:\n");
      for (CommandOption opt : def.globalOptions()) {
        sb.append(String.format("  %-25s %s%n", renderAliases(opt), opt.description()));
      }
    }
    if (!def.subcommands().isEmpty()) {
      sb.append("\nSubcommands:\n");
      for (Subcommand sub : def.subcommands()) {
        sb.append(String.format("  %-15s %s%n", sub.name(), sub.description()));
      }
    }
    return sb.toString();
  }

  private record ToolIndex(
      CommandDefinition definition,
      Map<String, CommandOption> options,
      Map<String, Subcommand> subcommands,
      Set<String> compoundShorts,
      List<FlagAliases> aliases) {

    static ToolIndex build(CommandDefinition def) {
      Map<String, CommandOption> options = new LinkedHashMap<>();
      Set<String> compound = new LinkedHashSet<>();
      List<FlagAliases> aliases = new ArrayList<>();
      List<CommandOption> all = new ArrayList<>(def.globalOptions());
      Map<String, Subcommand> subs = new LinkedHashMap<>();
      for (Subcommand sub : def.subcommands()) {
        subs.put(sub.name(), sub);
        all.addAll(sub.options());
      }
      for (CommandOption opt : all) {
        FlagAliases a = aliasesOf(opt);
        if (a == null) {
          LOG.warn("{}: option without short or long name skipped", def.command());
          continue;
        }
        boolean added = false;
        if (a.shortName() != null && !options.containsKey(a.shortName())) {
          options.put(a.shortName(), opt);
          added = true;
          if (a.shortName().length() > 1) {
            compound.add(a.shortName());
          }
        }
        if (a.longName() != null && !options.containsKey(a.longName())) {
          options.put(a.longName(), opt);
          added = true;
        }
        if (added) {
          aliases.add(a);
        }
      }
      return new ToolIndex(def, options, subs, compound, aliases);
    }

    /** Reads aliases from short/long, falling back to the free-form {@code flag} field. */
    static FlagAliases aliasesOf(CommandOption opt) {
      String shortName = blankToNull(normalize(opt.shortName()));
      String longName = blankToNull(normalize(opt.longName()));
      if (opt.flag() != null && (shortName == null || longName == null)) {
        for (String token : opt.flag().split("[,\\s]+")) {
          if (token.startsWith("--")) {
            longName = longName == null ? blankToNull(normalize(token)) : longName;
          } else if (token.startsWith("-")) {
            shortName = shortName == null ? blankToNull(normalize(token)) : shortName;
          }
        }
      }
      if (shortName == null && longName == null) {
        return null;
      }
      return new FlagAliases(shortName, longName);
    }

    private static String blankToNull(String s) {
      return s == null || s.isEmpty() ? null : s;
    }
  }
}
