package io.dcsim.shell.core.sim;

import java.util.Objects;

/**
 * Output of one simulated command.
 *
 * @param output text shown to the user
 * @param exitCode 0 on success; user-facing failures are non-zero
 * @param prompt replacement shell prompt, or {@code null} to keep the current one
 */
public record CommandResult(String output, int exitCode, String prompt) {
  public static final int SUCCESS = 0;
  public static final int FAILURE = 1;
  public static final int USAGE = 2;
  public static final int NOT_FOUND = 127;

  public CommandResult {
    output = Objects.requireNonNullElse(output, "");
  }

  public static CommandResult success(String output) {
    return new CommandResult(output, SUCCESS, null);
  }

  public static CommandResult error(String output) {
    return new CommandResult(output, FAILURE, null);
  }

  public static CommandResult error(String output, int exitCode) {
    return new CommandResult(output, exitCode, null);
  }

  public boolean isSuccess() {
    return exitCode == SUCCESS;
  }

  public CommandResult withOutput(String newOutput) {
    return new CommandResult(newOutput, exitCode, prompt);
  }

  public CommandResult withPrompt(String newPrompt) {
    return new CommandResult(output, exitCode, newPrompt);
  }
}
