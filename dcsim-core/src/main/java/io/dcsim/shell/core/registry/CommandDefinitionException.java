package io.dcsim.shell.core.registry;

/** Thrown when the tool catalogue cannot be read or contains malformed definitions. */
public class CommandDefinitionException extends Exception {
  private final String source;

  public CommandDefinitionException(String source, String message) {
    super(source + ": " + message);
    this.source = source;
  }

  public CommandDefinitionException(String source, String message, Throwable cause) {
    super(source + ": " + message, cause);
    this.source = source;
  }

  /** The catalogue file or resource that failed. */
  public String getSource() {
    return source;
  }
}
