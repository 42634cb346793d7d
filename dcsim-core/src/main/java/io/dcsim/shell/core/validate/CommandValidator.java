package io.dcsim.shell.core.validate;

import io.dcsim.shell.core.parse.CommandParser;
import io.dcsim.shell.core.parse.ParsedCommand;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Judges whether an executed command satisfies one of a training step's expected commands.
 *
 * <p>Both sides are lowercased, trimmed and have {@code $(...)} substitutions replaced by a fixed
 * token. Known-invalid invocations are rejected outright. Each expected template is then tried in
 * turn:
 *
 * <ol>
 *   <li>exact string equality;
 *   <li>when both are pipelines, the same number of segments, equal position by position (this
 *       decides the template);
 *   <li>same base command, with every templated flag present (valued flags with the same value)
 *       and templated positional arguments equal by position;
 *   <li>tool specific equivalences: any {@code sinfo} output format flag matches any other, and
 *       {@code scontrol show} targets match ignoring a trailing plural "s".
 * </ol>
 */
public final class CommandValidator {
  static final String SUBSTITUTION_TOKEN = "12345";

  private static final Pattern SUBSTITUTION = Pattern.compile("\\$\\([^)]+\\)");

  private static final List<Pattern> INVALID_PATTERNS =
      List.of(
          Pattern.compile("\\s-i\\s+-\\d+"),
          Pattern.compile("\\s--id\\s+-\\d+"),
          Pattern.compile("nvidia-smi.*\\s-gpu\\s"),
          Pattern.compile("sinfo\\s+help"),
          Pattern.compile("scontrol\\s+help(?!\\s)"));

  private final CommandParser parser;

  public CommandValidator() {
    this(new CommandParser());
  }

  public CommandValidator(CommandParser parser) {
    this.parser = Objects.requireNonNull(parser, "parser");
  }

  /**
   * @param executed the command line the user ran
   * @param expectedTemplates accepted command lines
   * @return true if any template matches
   */
  public boolean validateCommandExecuted(String executed, List<String> expectedTemplates) {
    if (executed == null) {
      return false;
    }
    String normalizedExecuted = normalize(executed);
    for (Pattern invalid : INVALID_PATTERNS) {
      if (invalid.matcher(normalizedExecuted).find()) {
        return false;
      }
    }
    ParsedCommand exec = parser.parse(normalizedExecuted);
    for (String template : expectedTemplates) {
      if (template != null && matches(normalizedExecuted, exec, normalize(template))) {
        return true;
      }
    }
    return false;
  }

  static String normalize(String command) {
    return SUBSTITUTION
        .matcher(command.trim().toLowerCase(Locale.ROOT))
        .replaceAll(SUBSTITUTION_TOKEN);
  }

  private boolean matches(
      String normalizedExecuted, ParsedCommand exec, String normalizedExpected) {
    if (normalizedExecuted.equals(normalizedExpected)) {
      return true;
    }
    ParsedCommand expected = parser.parse(normalizedExpected);

    if (exec.isPiped() && expected.isPiped()) {
      return exec.pipedSegments().equals(expected.pipedSegments());
    }

    if (exec.baseCommand().equals(expected.baseCommand())) {
      if (expected.flags().isEmpty() && expected.positionalArgs().isEmpty()) {
        return true;
      }
      if (flagsMatch(exec.flags(), expected.flags())) {
        if (expected.positionalArgs().isEmpty() || argsMatch(exec, expected)) {
          return true;
        }
      }
    }

    return toolEquivalent(exec, expected);
  }

  private static boolean flagsMatch(Map<String, Object> executed, Map<String, Object> expected) {
    for (Map.Entry<String, Object> e : expected.entrySet()) {
      if (!executed.containsKey(e.getKey())) {
        return false;
      }
      if (!Boolean.TRUE.equals(e.getValue()) && !e.getValue().equals(executed.get(e.getKey()))) {
        return false;
      }
    }
    return true;
  }

  private static boolean argsMatch(ParsedCommand exec, ParsedCommand expected) {
    List<String> want = expected.positionalArgs();
    List<String> got = exec.positionalArgs();
    for (int i = 0; i < want.size(); i++) {
      if (i >= got.size() || !want.get(i).equals(got.get(i))) {
        return false;
      }
    }
    return true;
  }

  private static boolean toolEquivalent(ParsedCommand exec, ParsedCommand expected) {
    String base = exec.baseCommand();
    if (!base.equals(expected.baseCommand())) {
      return false;
    }
    if (base.equals("sinfo")) {
      return exec.hasFlag("o", "output-format") && expected.hasFlag("o", "output-format");
    }
    if (base.equals("scontrol")) {
      String execVerb = exec.positional(0).orElse("");
      String expVerb = expected.positional(0).orElse("");
      if (execVerb.equals("show") && expVerb.equals("show")) {
        String execTarget = exec.positional(1).orElse("");
        String expTarget = expected.positional(1).orElse("");
        if (!execTarget.isEmpty() && !expTarget.isEmpty()) {
          return singular(execTarget).equals(singular(expTarget));
        }
      }
    }
    return false;
  }

  private static String singular(String noun) {
    return noun.endsWith("s") ? noun.substring(0, noun.length() - 1) : noun;
  }
}
