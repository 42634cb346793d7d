package io.dcsim.shell.core.suggest;

/**
 * Short and long spelling of one flag, without leading dashes. Either may be null.
 *
 * @param shortName e.g. {@code q}
 * @param longName e.g. {@code query}
 */
public record FlagAliases(String shortName, String longName) {

  public FlagAliases {
    if (shortName == null && longName == null) {
      throw new IllegalArgumentException("a flag needs a short or a long name");
    }
  }

  public static FlagAliases longOnly(String longName) {
    return new FlagAliases(null, longName);
  }

  /** The long name when there is one, otherwise the short name. */
  public String canonical() {
    return longName != null ? longName : shortName;
  }
}
