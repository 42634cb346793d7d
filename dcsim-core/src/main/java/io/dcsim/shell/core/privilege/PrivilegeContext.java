package io.dcsim.shell.core.privilege;

/** The part of an execution context that privilege checks look at. */
@FunctionalInterface
public interface PrivilegeContext {
  boolean isRoot();

  static PrivilegeContext of(boolean root) {
    return () -> root;
  }
}
