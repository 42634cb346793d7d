package io.dcsim.shell.cli;

import io.dcsim.shell.core.parse.CommandParser;
import io.dcsim.shell.core.sim.CommandResult;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Text filters that may follow a simulated command in a pipeline: {@code grep [-i] [-v] [-c]
 * PATTERN}, {@code head [-n N]}, {@code tail [-n N]} and {@code wc [-l]}.
 */
final class PipeFilters {
  private static final int DEFAULT_LINES = 10;

  private PipeFilters() {}

  /**
   * Feeds {@code input}'s output through each segment in turn. A failed command is returned as
   * is; a failing filter stops the pipeline with its own exit code.
   */
  static CommandResult apply(List<String> segments, CommandResult input) {
    if (!input.isSuccess()) {
      return input;
    }
    CommandResult current = input;
    for (String segment : segments) {
      current = filter(segment, current.output()).withPrompt(input.prompt());
      if (current.exitCode() != CommandResult.SUCCESS && current.exitCode() != 1) {
        return current;
      }
    }
    return current;
  }

  static CommandResult filter(String segment, String text) {
    List<String> tokens = CommandParser.tokenize(segment);
    if (tokens.isEmpty()) {
      return CommandResult.error("syntax error near unexpected token '|'", CommandResult.USAGE);
    }
    List<String> args = tokens.subList(1, tokens.size());
    List<String> lines = lines(text);
    return switch (tokens.get(0)) {
      case "grep" -> grep(args, lines);
      case "head" -> head(args, lines, true);
      case "tail" -> head(args, lines, false);
      case "wc" -> wc(args, text, lines);
      default -> CommandResult.error(
          tokens.get(0) + ": command not found", CommandResult.NOT_FOUND);
    };
  }

  private static CommandResult grep(List<String> args, List<String> lines) {
    boolean ignoreCase = false;
    boolean invert = false;
    boolean count = false;
    String pattern = null;
    for (String arg : args) {
      if (pattern == null && CommandParser.isFlagShaped(arg)) {
        for (char c : arg.substring(1).toCharArray()) {
          switch (c) {
            case 'i' -> ignoreCase = true;
            case 'v' -> invert = true;
            case 'c' -> count = true;
            case 'E' -> {}
            default -> {
              return CommandResult.error(
                  "grep: invalid option -- '" + c + "'", CommandResult.USAGE);
            }
          }
        }
      } else if (pattern == null) {
        pattern = arg;
      }
    }
    if (pattern == null) {
      return CommandResult.error("Usage: grep [OPTION]... PATTERNS", CommandResult.USAGE);
    }
    Pattern regex = compile(pattern, ignoreCase);
    List<String> matched = new ArrayList<>();
    for (String line : lines) {
      if (regex.matcher(line).find() != invert) {
        matched.add(line);
      }
    }
    String output = count ? String.valueOf(matched.size()) : String.join("\n", matched);
    return matched.isEmpty()
        ? new CommandResult(count ? "0" : "", CommandResult.FAILURE, null)
        : CommandResult.success(output);
  }

  private static Pattern compile(String pattern, boolean ignoreCase) {
    int flags = ignoreCase ? Pattern.CASE_INSENSITIVE : 0;
    try {
      return Pattern.compile(pattern, flags);
    } catch (PatternSyntaxException e) {
      return Pattern.compile(Pattern.quote(pattern), flags);
    }
  }

  private static CommandResult head(List<String> args, List<String> lines, boolean fromStart) {
    String name = fromStart ? "head" : "tail";
    int n = DEFAULT_LINES;
    for (int i = 0; i < args.size(); i++) {
      String arg = args.get(i);
      String value = null;
      if (arg.equals("-n") && i + 1 < args.size()) {
        value = args.get(++i);
      } else if (arg.startsWith("-n")) {
        value = arg.substring(2);
      } else if (arg.startsWith("-")) {
        value = arg.substring(1);
      }
      if (value != null) {
        try {
          n = Math.abs(Integer.parseInt(value));
        } catch (NumberFormatException e) {
          return CommandResult.error(
              name + ": invalid number of lines: '" + value + "'", CommandResult.FAILURE);
        }
      }
    }
    int size = lines.size();
    List<String> kept =
        fromStart
            ? lines.subList(0, Math.min(n, size))
            : lines.subList(Math.max(0, size - n), size);
    return CommandResult.success(String.join("\n", kept));
  }

  private static CommandResult wc(List<String> args, String text, List<String> lines) {
    if (args.contains("-l")) {
      return CommandResult.success(String.valueOf(lines.size()));
    }
    int words = 0;
    for (String line : lines) {
      String trimmed = line.trim();
      if (!trimmed.isEmpty()) {
        words += trimmed.split("\\s+").length;
      }
    }
    int chars = text.isEmpty() ? 0 : text.length() + (text.endsWith("\n") ? 0 : 1);
    return CommandResult.success(String.format("%7d %7d %7d", lines.size(), words, chars));
  }

  private static List<String> lines(String text) {
    if (text.isEmpty()) {
      return List.of();
    }
    String body = text.endsWith("\n") ? text.substring(0, text.length() - 1) : text;
    return List.of(body.split("\n", -1));
  }
}
