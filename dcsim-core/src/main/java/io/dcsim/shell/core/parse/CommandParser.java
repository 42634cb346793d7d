package io.dcsim.shell.core.parse;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Splits a command line into base command, subcommands, flags, positional arguments and pipeline
 * segments. Parsing never fails: shapes that are not recognized become positional arguments.
 *
 * <p>Grammar:
 *
 * <ul>
 *   <li>{@code --name=value} sets a value; {@code --name} consumes the next token as its value
 *       unless that token is itself flag shaped.
 *   <li>{@code -x} follows the same value rule.
 *   <li>{@code -xyz} expands to boolean {@code x}, {@code y}, {@code z}, unless the vocabulary
 *       declares {@code xyz} as a single flag, in which case it behaves like {@code -x}.
 *   <li>{@code --} ends option parsing.
 *   <li>Single and double quotes group words and are removed; an unquoted {@code |} separates
 *       pipeline segments. Only the first segment feeds the base command.
 * </ul>
 */
public final class CommandParser {
  private static final Pattern NEGATIVE_NUMBER = Pattern.compile("-\\d+(\\.\\d+)?");

  private final ShortFlagVocabulary vocabulary;

  public CommandParser() {
    this(ShortFlagVocabulary.none());
  }

  public CommandParser(ShortFlagVocabulary vocabulary) {
    this.vocabulary = Objects.requireNonNull(vocabulary, "vocabulary");
  }

  public ParsedCommand parse(String line) {
    String raw = line == null ? "" : line.trim();
    List<String> segments = splitPipeline(raw);
    boolean piped = segments.size() > 1;
    List<String> tokens = tokenize(segments.isEmpty() ? "" : segments.get(0));

    String base = tokens.isEmpty() ? "" : tokens.get(0);
    List<String> subcommands = new ArrayList<>();
    Map<String, Object> flags = new LinkedHashMap<>();
    List<String> positional = new ArrayList<>();
    boolean sawFlag = false;
    boolean optionsEnded = false;

    for (int i = 1; i < tokens.size(); i++) {
      String token = tokens.get(i);
      if (optionsEnded || !isFlagShaped(token)) {
        if (!sawFlag && !optionsEnded) {
          subcommands.add(token);
        }
        // Subcommands stay positional too; handlers index operands from the first bare word.
        positional.add(token);
        continue;
      }
      if (token.equals("--")) {
        optionsEnded = true;
        continue;
      }
      sawFlag = true;
      if (token.startsWith("--")) {
        String body = token.substring(2);
        int eq = body.indexOf('=');
        if (eq > 0) {
          flags.put(body.substring(0, eq), body.substring(eq + 1));
        } else {
          i = putWithOptionalValue(flags, body, tokens, i);
        }
        continue;
      }
      String body = token.substring(1);
      int eq = body.indexOf('=');
      if (eq > 0) {
        flags.put(body.substring(0, eq), body.substring(eq + 1));
      } else if (body.length() == 1 || vocabulary.isCompoundShortFlag(base, body)) {
        i = putWithOptionalValue(flags, body, tokens, i);
      } else {
        for (char c : body.toCharArray()) {
          flags.put(String.valueOf(c), Boolean.TRUE);
        }
      }
    }
    return new ParsedCommand(
        raw, base, subcommands, flags, positional, piped, piped ? segments : List.of());
  }

  /** Flag shaped: starts with a dash, is longer than one char and is not a negative number. */
  public static boolean isFlagShaped(String token) {
    return token.length() > 1
        && token.charAt(0) == '-'
        && !NEGATIVE_NUMBER.matcher(token).matches();
  }

  private static int putWithOptionalValue(
      Map<String, Object> flags, String name, List<String> tokens, int index) {
    int next = index + 1;
    if (next < tokens.size() && !isFlagShaped(tokens.get(next))) {
      flags.put(name, tokens.get(next));
      return next;
    }
    flags.put(name, Boolean.TRUE);
    return index;
  }

  /** Splits on unquoted {@code |}; returns trimmed non-empty segments. */
  public static List<String> splitPipeline(String line) {
    List<String> segments = new ArrayList<>();
    StringBuilder current = new StringBuilder();
    char quote = 0;
    for (int i = 0; i < line.length(); i++) {
      char c = line.charAt(i);
      if (quote != 0) {
        if (c == quote) {
          quote = 0;
        }
        current.append(c);
      } else if (c == '\'' || c == '"') {
        quote = c;
        current.append(c);
      } else if (c == '|') {
        addSegment(segments, current);
        current.setLength(0);
      } else {
        current.append(c);
      }
    }
    addSegment(segments, current);
    return segments;
  }

  private static void addSegment(List<String> segments, StringBuilder current) {
    String segment = current.toString().trim();
    if (!segment.isEmpty()) {
      segments.add(segment);
    }
  }

  /** Splits on whitespace outside quotes and removes the quotes. */
  public static List<String> tokenize(String text) {
    List<String> tokens = new ArrayList<>();
    StringBuilder current = new StringBuilder();
    boolean inToken = false;
    char quote = 0;
    for (int i = 0; i < text.length(); i++) {
      char c = text.charAt(i);
      if (quote != 0) {
        if (c == quote) {
          quote = 0;
        } else {
          current.append(c);
        }
      } else if (c == '\'' || c == '"') {
        quote = c;
        inToken = true;
      } else if (Character.isWhitespace(c)) {
        if (inToken) {
          tokens.add(current.toString());
          current.setLength(0);
          inToken = false;
        }
      } else {
        current.append(c);
        inToken = true;
      }
    }
    if (inToken) {
      tokens.add(current.toString());
    }
    return tokens;
  }
}
