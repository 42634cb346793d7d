package io.dcsim.shell.core.registry;

import java.util.List;

/**
 * Whether a flag or subcommand is declared for a tool.
 *
 * @param valid true when declared
 * @param suggestions nearest declared names when not
 */
public record ValidationResult(boolean valid, List<String> suggestions) {
  public ValidationResult {
    suggestions = List.copyOf(suggestions);
  }
}
