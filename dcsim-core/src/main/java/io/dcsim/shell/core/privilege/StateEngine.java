package io.dcsim.shell.core.privilege;

import io.dcsim.shell.core.registry.CommandDefinition;
import io.dcsim.shell.core.registry.CommandDefinition.StateInteraction;
import io.dcsim.shell.core.registry.CommandDefinition.StateWrite;
import io.dcsim.shell.core.registry.CommandDefinitionRegistry;
import java.util.Collection;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Decides from the declared state interactions whether an invocation needs root. Purely advisory:
 * callers decide whether to reject.
 *
 * <p>An invocation needs root when any of its flags is root-only, or when the tool declares a
 * root write that is either ungated or gated by at least one of the given flags.
 */
public final class StateEngine {
  private static final Logger LOG = LoggerFactory.getLogger(StateEngine.class);

  private final CommandDefinitionRegistry registry;

  public StateEngine(CommandDefinitionRegistry registry) {
    this.registry = Objects.requireNonNull(registry, "registry");
  }

  /**
   * @param command tool name
   * @param flags flag names without leading dashes
   */
  public boolean requiresRoot(String command, Collection<String> flags) {
    for (String flag : flags) {
      if (registry.requiresRoot(command, flag)) {
        return true;
      }
    }
    Optional<CommandDefinition> def = registry.getDefinition(command);
    if (def.isEmpty()) {
      return false;
    }
    for (StateWrite write : def.get().stateInteractions().writesTo()) {
      if (!write.requiresRoot()) {
        continue;
      }
      if (write.requiresFlags().isEmpty()) {
        return true;
      }
      for (String flag : flags) {
        if (registry.isGatingFlag(command, write, flag)) {
          return true;
        }
      }
    }
    return false;
  }

  public Optional<StateInteraction> getStateInteractions(String command) {
    return registry.getStateInteractions(command);
  }

  /** Returns the reason the invocation may not run, if any. */
  public Optional<String> getPrerequisiteError(
      String command, Collection<String> flags, PrivilegeContext context) {
    if (!context.isRoot() && requiresRoot(command, flags)) {
      LOG.debug("Denied {} {}: root required", command, flags);
      return Optional.of(command + ": Operation requires root privileges. Run with sudo.");
    }
    return Optional.empty();
  }

  public CanExecuteResult canExecute(
      String command, Collection<String> flags, PrivilegeContext context) {
    return getPrerequisiteError(command, flags, context)
        .map(CanExecuteResult::denied)
        .orElse(CanExecuteResult.ok());
  }
}
