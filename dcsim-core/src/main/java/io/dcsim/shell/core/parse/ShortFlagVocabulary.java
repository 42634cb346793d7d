package io.dcsim.shell.core.parse;

/**
 * Tells the parser which multi-letter single-dash tokens a tool declares as one flag (for example
 * {@code nvidia-smi -pl}), so they are kept whole instead of being expanded per character.
 */
@FunctionalInterface
public interface ShortFlagVocabulary {

  /**
   * @param command base command of the line being parsed
   * @param name flag text without the leading dash
   * @return true if {@code name} is a single declared flag of {@code command}
   */
  boolean isCompoundShortFlag(String command, String name);

  /** A vocabulary that declares nothing: every cluster is expanded. */
  static ShortFlagVocabulary none() {
    return (command, name) -> false;
  }
}
