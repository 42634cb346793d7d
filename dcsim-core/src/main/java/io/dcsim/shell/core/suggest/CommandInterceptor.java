package io.dcsim.shell.core.suggest;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Checks flags and subcommands against the names registered for a tool and proposes corrections
 * ranked by edit distance.
 *
 * <p>A name is suggested when its distance to the candidate is at least 1 and at most {@code
 * min(2, length / 2)}, so one letter aliases are never suggested for typos. Ties are broken
 * alphabetically by canonical name. At most three suggestions are returned.
 */
public final class CommandInterceptor {
  static final int MAX_DISTANCE = 2;
  static final int MAX_SUGGESTIONS = 3;

  /** Alias to canonical name, per tool. */
  private final Map<String, Map<String, String>> flags = new LinkedHashMap<>();

  private final Map<String, Set<String>> subcommands = new LinkedHashMap<>();

  /** Adds flags to a tool. Registering the same alias again replaces its canonical name. */
  public synchronized void registerFlags(String tool, List<FlagAliases> aliases) {
    Map<String, String> index = flags.computeIfAbsent(tool, k -> new LinkedHashMap<>());
    for (FlagAliases alias : aliases) {
      String canonical = alias.canonical();
      if (alias.shortName() != null) {
        index.put(alias.shortName(), canonical);
      }
      if (alias.longName() != null) {
        index.put(alias.longName(), canonical);
      }
    }
  }

  public synchronized void registerSubcommands(String tool, List<String> names) {
    subcommands.computeIfAbsent(tool, k -> new LinkedHashSet<>()).addAll(names);
  }

  /** Every registered alias of the tool, short and long, in registration order. */
  public synchronized List<String> getRegisteredFlags(String tool) {
    Map<String, String> index = flags.get(tool);
    return index == null ? List.of() : new ArrayList<>(index.keySet());
  }

  public synchronized List<String> getRegisteredSubcommands(String tool) {
    Set<String> names = subcommands.get(tool);
    return names == null ? List.of() : new ArrayList<>(names);
  }

  public synchronized boolean hasTool(String tool) {
    return flags.containsKey(tool) || subcommands.containsKey(tool);
  }

  /**
   * @param tool tool name
   * @param candidate flag without leading dashes
   */
  public synchronized SuggestionResult validateFlag(String tool, String candidate) {
    Map<String, String> index = flags.get(tool);
    if (index == null || candidate == null) {
      return SuggestionResult.none();
    }
    if (index.containsKey(candidate)) {
      return SuggestionResult.exact();
    }
    return rank(candidate, index);
  }

  public synchronized SuggestionResult validateSubcommand(String tool, String candidate) {
    Set<String> names = subcommands.get(tool);
    if (names == null || candidate == null) {
      return SuggestionResult.none();
    }
    if (names.contains(candidate)) {
      return SuggestionResult.exact();
    }
    Map<String, String> identity = new LinkedHashMap<>();
    for (String name : names) {
      identity.put(name, name);
    }
    return rank(candidate, identity);
  }

  /**
   * Renders a correction hint.
   *
   * @param isFlag render names as flags ({@code --query}, {@code -q}) rather than quoted words
   * @return the hint, or an empty string when there is nothing to suggest
   */
  public String formatSuggestion(String tool, SuggestionResult result, boolean isFlag) {
    if (result.exactMatch() || !result.hasSuggestions()) {
      return "";
    }
    List<String> rendered = new ArrayList<>();
    for (String name : result.suggestions()) {
      rendered.add(isFlag ? renderFlag(name) : "'" + name + "'");
    }
    if (rendered.size() == 1) {
      return "Did you mean " + rendered.get(0) + "?";
    }
    return "Did you mean one of: " + String.join(", ", rendered) + "?";
  }

  /** Flag rendering by default. */
  public String formatSuggestion(String tool, SuggestionResult result) {
    return formatSuggestion(tool, result, true);
  }

  static String renderFlag(String name) {
    return (name.length() == 1 ? "-" : "--") + name;
  }

  private static SuggestionResult rank(String candidate, Map<String, String> aliasToCanonical) {
    Map<String, Integer> best = new LinkedHashMap<>();
    for (Map.Entry<String, String> e : aliasToCanonical.entrySet()) {
      String alias = e.getKey();
      int threshold = Math.min(MAX_DISTANCE, alias.length() / 2);
      int distance = EditDistance.between(candidate, alias);
      if (distance >= 1 && distance <= threshold) {
        best.merge(e.getValue(), distance, Math::min);
      }
    }
    if (best.isEmpty()) {
      return SuggestionResult.none();
    }
    List<Map.Entry<String, Integer>> ranked = new ArrayList<>(best.entrySet());
    ranked.sort(
        Map.Entry.<String, Integer>comparingByValue().thenComparing(Map.Entry.comparingByKey()));
    List<String> suggestions = new ArrayList<>();
    for (int i = 0; i < ranked.size() && i < MAX_SUGGESTIONS; i++) {
      suggestions.add(ranked.get(i).getKey());
    }
    int bestDistance = ranked.get(0).getValue();
    String bestAlias = closestAlias(candidate, ranked.get(0).getKey(), aliasToCanonical);
    double confidence =
        1.0 - (double) bestDistance / Math.max(candidate.length(), bestAlias.length());
    return new SuggestionResult(false, confidence, suggestions);
  }

  private static String closestAlias(
      String candidate, String canonical, Map<String, String> aliasToCanonical) {
    return aliasToCanonical.entrySet().stream()
        .filter(e -> e.getValue().equals(canonical))
        .map(Map.Entry::getKey)
        .min(Comparator.comparingInt((String a) -> EditDistance.between(candidate, a)))
        .orElse(canonical);
  }
}
