package io.dcsim.shell.core.suggest;

import java.util.List;

/**
 * Outcome of checking a flag or subcommand against a tool's known names.
 *
 * @param exactMatch whether the candidate is a registered name
 * @param confidence 1.0 on an exact match, otherwise the similarity of the best suggestion, or 0
 *     when there is none
 * @param suggestions canonical names of the nearest matches, best first
 */
public record SuggestionResult(boolean exactMatch, double confidence, List<String> suggestions) {

  private static final SuggestionResult EXACT = new SuggestionResult(true, 1.0, List.of());
  private static final SuggestionResult NONE = new SuggestionResult(false, 0.0, List.of());

  public SuggestionResult {
    suggestions = List.copyOf(suggestions);
  }

  public static SuggestionResult exact() {
    return EXACT;
  }

  public static SuggestionResult none() {
    return NONE;
  }

  public boolean hasSuggestions() {
    return !suggestions.isEmpty();
  }
}
