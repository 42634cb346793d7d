package io.dcsim.shell.core.parse;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Result of parsing one command line. Flags are keyed by name without leading dashes; a value is
 * either {@link Boolean#TRUE} for a switch or the {@link String} argument the flag consumed.
 *
 * @param raw the trimmed input line
 * @param baseCommand first word of the first pipeline segment, empty for a blank line
 * @param subcommands bare words that appear before the first flag
 * @param flags flag name to value, in order of first appearance
 * @param positionalArgs every bare word after the base command that was not consumed as a value;
 *     {@code subcommands} is always a prefix of this list, so a leading bare word appears in both
 * @param isPiped whether the line contains an unquoted {@code |}
 * @param pipedSegments trimmed pipeline segments, empty when the line is not piped
 */
public record ParsedCommand(
    String raw,
    String baseCommand,
    List<String> subcommands,
    Map<String, Object> flags,
    List<String> positionalArgs,
    boolean isPiped,
    List<String> pipedSegments) {

  public ParsedCommand {
    subcommands = List.copyOf(subcommands);
    flags = Collections.unmodifiableMap(new LinkedHashMap<>(flags));
    positionalArgs = List.copyOf(positionalArgs);
    pipedSegments = List.copyOf(pipedSegments);
  }

  /** Returns true if any of {@code names} was given. */
  public boolean hasFlag(String... names) {
    for (String name : names) {
      if (flags.containsKey(name)) {
        return true;
      }
    }
    return false;
  }

  /** Returns the string value of the first of {@code names} that was given a value. */
  public Optional<String> flagValue(String... names) {
    for (String name : names) {
      if (flags.get(name) instanceof String value) {
        return Optional.of(value);
      }
    }
    return Optional.empty();
  }

  public Optional<String> subcommand(int index) {
    return index < subcommands.size() ? Optional.of(subcommands.get(index)) : Optional.empty();
  }

  public Optional<String> positional(int index) {
    return index < positionalArgs.size()
        ? Optional.of(positionalArgs.get(index))
        : Optional.empty();
  }

  /** The part of the line that the base command receives, before any pipe. */
  public String firstSegment() {
    return isPiped ? pipedSegments.get(0) : raw;
  }
}
