package io.dcsim.shell.core.registry;

import com.google.gson.annotations.SerializedName;
import java.util.List;

/**
 * Declarative description of one simulated tool, read from the JSON catalogue. Field names follow
 * the catalogue's snake_case keys. Missing lists are normalized to empty lists.
 *
 * @param command tool name, the registry key
 * @param category catalogue category (e.g. {@code gpu_management})
 * @param description one paragraph summary
 * @param synopsis usage line
 * @param globalOptions flags accepted anywhere on the command line
 * @param subcommands declared subcommands
 * @param exitCodes exit code meanings
 * @param commonUsagePatterns worked examples
 * @param errorMessages common errors with their meaning and resolution
 * @param interoperability related tools
 * @param stateInteractions simulated subsystems the tool reads and writes
 */
public record CommandDefinition(
    String command,
    String category,
    String description,
    String synopsis,
    List<CommandOption> globalOptions,
    List<Subcommand> subcommands,
    List<ExitCode> exitCodes,
    List<UsagePattern> commonUsagePatterns,
    List<ErrorMessage> errorMessages,
    Interoperability interoperability,
    StateInteraction stateInteractions) {

  public CommandDefinition {
    category = category == null ? "general" : category;
    description = description == null ? "" : description;
    synopsis = synopsis == null ? command : synopsis;
    globalOptions = listOrEmpty(globalOptions);
    subcommands = listOrEmpty(subcommands);
    exitCodes = listOrEmpty(exitCodes);
    commonUsagePatterns = listOrEmpty(commonUsagePatterns);
    errorMessages = listOrEmpty(errorMessages);
    if (interoperability == null) {
      interoperability = new Interoperability(null, null);
    }
    if (stateInteractions == null) {
      stateInteractions = new StateInteraction(null, null);
    }
  }

  static <T> List<T> listOrEmpty(List<T> list) {
    return list == null ? List.of() : List.copyOf(list);
  }

  /**
   * One flag. Aliases may be written with or without leading dashes; a long alias may end in
   * {@code =} to show that it takes a value.
   *
   * @param flag alternative spelling used by some catalogue entries
   * @param shortName short alias, e.g. {@code -q} or {@code -pl}
   * @param longName long alias, e.g. {@code --query}
   * @param description help text
   * @param arguments argument placeholder
   * @param argumentType argument type name
   * @param defaultValue default value shown in help
   * @param example example invocation
   * @param requiresRoot whether passing this flag needs root
   */
  public record CommandOption(
      String flag,
      @SerializedName("short") String shortName,
      @SerializedName("long") String longName,
      String description,
      String arguments,
      String argumentType,
      @SerializedName("default") String defaultValue,
      String example,
      Boolean requiresRoot) {

    public CommandOption {
      description = description == null ? "" : description;
    }

    public boolean isRootOnly() {
      return Boolean.TRUE.equals(requiresRoot);
    }
  }

  /**
   * @param name subcommand word
   * @param description help text
   * @param synopsis usage line
   * @param options subcommand specific flags
   */
  public record Subcommand(
      String name, String description, String synopsis, List<CommandOption> options) {
    public Subcommand {
      description = description == null ? "" : description;
      options = listOrEmpty(options);
    }
  }

  public record ExitCode(int code, String meaning) {}

  public record UsagePattern(
      String description, String command, String outputExample, Boolean requiresRoot) {
    public boolean isRootOnly() {
      return Boolean.TRUE.equals(requiresRoot);
    }
  }

  public record ErrorMessage(String message, String meaning, String resolution) {}

  public record Interoperability(List<String> relatedCommands, String notes) {
    public Interoperability {
      relatedCommands = listOrEmpty(relatedCommands);
    }
  }

  /**
   * @param readsFrom subsystems the tool reads
   * @param writesTo subsystems the tool changes, with their privilege requirements
   */
  public record StateInteraction(List<StateRead> readsFrom, List<StateWrite> writesTo) {
    public StateInteraction {
      readsFrom = listOrEmpty(readsFrom);
      writesTo = listOrEmpty(writesTo);
    }
  }

  public record StateRead(String stateDomain, List<String> fields, String description) {
    public StateRead {
      fields = listOrEmpty(fields);
    }
  }

  /**
   * A write interaction.
   *
   * @param stateDomain subsystem written
   * @param fields fields written
   * @param description help text
   * @param requiresFlags flags that trigger the write; empty means every invocation writes
   * @param requiresPrivilege {@code "root"} when the write needs root
   */
  public record StateWrite(
      String stateDomain,
      List<String> fields,
      String description,
      List<String> requiresFlags,
      String requiresPrivilege) {
    public StateWrite {
      fields = listOrEmpty(fields);
      requiresFlags = listOrEmpty(requiresFlags);
    }

    public boolean requiresRoot() {
      return "root".equalsIgnoreCase(requiresPrivilege);
    }
  }
}
