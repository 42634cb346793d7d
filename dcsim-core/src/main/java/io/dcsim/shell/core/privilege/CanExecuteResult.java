package io.dcsim.shell.core.privilege;

/**
 * @param valid whether the command may run in the given context
 * @param reason why not, or {@code null} when valid
 */
public record CanExecuteResult(boolean valid, String reason) {
  private static final CanExecuteResult OK = new CanExecuteResult(true, null);

  public static CanExecuteResult ok() {
    return OK;
  }

  public static CanExecuteResult denied(String reason) {
    return new CanExecuteResult(false, reason);
  }
}
