package io.dcsim.shell.cli;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Mutable state of one interactive session: the node the user is logged into, whether the login
 * user is root, the command history and the last command that ran.
 */
public final class ShellSession {
  public static final String DEFAULT_USER = "admin";
  public static final String ROOT_USER = "root";

  private final boolean root;
  private final List<String> history = new ArrayList<>();
  private String currentNode;
  private String lastCommand;

  public ShellSession(String currentNode, boolean root) {
    this.currentNode = currentNode;
    this.root = root;
  }

  /** Node id, or null before the user picked one. */
  public String currentNode() {
    return currentNode;
  }

  public void setCurrentNode(String currentNode) {
    this.currentNode = currentNode;
  }

  public boolean isRoot() {
    return root;
  }

  public String user(boolean elevated) {
    return root || elevated ? ROOT_USER : DEFAULT_USER;
  }

  public void recordHistory(String line) {
    history.add(line);
  }

  public List<String> history() {
    return Collections.unmodifiableList(new ArrayList<>(history));
  }

  public void clearHistory() {
    history.clear();
  }

  /** The last command that ran, without a {@code sudo} prefix, or null. */
  public String lastCommand() {
    return lastCommand;
  }

  void setLastCommand(String lastCommand) {
    this.lastCommand = lastCommand;
  }
}
