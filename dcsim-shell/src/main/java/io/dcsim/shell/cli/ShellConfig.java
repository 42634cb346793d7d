package io.dcsim.shell.cli;

import io.dcsim.shell.core.model.ClusterFactory;
import io.dcsim.shell.core.registry.CommandDefinitionLoader;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Map;
import java.util.Properties;

/**
 * Startup settings of the shell. The command catalogue is looked up in the {@value
 * #COMMANDS_DIR_ENV} environment variable, then the {@value #COMMANDS_DIR_PROPERTY} system
 * property, then the command line; without any of them the bundled catalogue is used. The
 * starting node comes from the command line, then {@value #NODE_ENV}.
 */
public final class ShellConfig {
  public static final String COMMANDS_DIR_ENV = "DCSIM_COMMANDS_DIR";
  public static final String COMMANDS_DIR_PROPERTY = "dcsim.commands.dir";
  public static final String NODE_ENV = "DCSIM_NODE";

  private final Path commandsDir;
  private final String startNode;
  private final Path historyFile;
  private final int nodes;
  private final int gpusPerNode;
  private final boolean root;

  private ShellConfig(
      Path commandsDir,
      String startNode,
      Path historyFile,
      int nodes,
      int gpusPerNode,
      boolean root) {
    this.commandsDir = commandsDir;
    this.startNode = startNode;
    this.historyFile = historyFile;
    this.nodes = nodes;
    this.gpusPerNode = gpusPerNode;
    this.root = root;
  }

  public static Builder builder() {
    return new Builder();
  }

  /** Defaults only: bundled catalogue, default cluster, unprivileged user. */
  public static ShellConfig defaults() {
    return builder().build(Map.of(), new Properties());
  }

  /** Catalogue directory, or null for the bundled catalogue. */
  public Path commandsDir() {
    return commandsDir;
  }

  /** Node to log into at startup, or null for the first node. */
  public String startNode() {
    return startNode;
  }

  public Path historyFile() {
    return historyFile;
  }

  public int nodes() {
    return nodes;
  }

  public int gpusPerNode() {
    return gpusPerNode;
  }

  public boolean root() {
    return root;
  }

  public CommandDefinitionLoader catalogueLoader() {
    return commandsDir == null
        ? CommandDefinitionLoader.bundled()
        : CommandDefinitionLoader.fromDirectory(commandsDir);
  }

  public static final class Builder {
    private Path commandsDir;
    private String node;
    private Path historyFile;
    private int nodes = ClusterFactory.DEFAULT_NODES;
    private int gpusPerNode = ClusterFactory.DEFAULT_GPUS_PER_NODE;
    private boolean root;

    private Builder() {}

    public Builder commandsDir(Path commandsDir) {
      this.commandsDir = commandsDir;
      return this;
    }

    public Builder node(String node) {
      this.node = node;
      return this;
    }

    public Builder historyFile(Path historyFile) {
      this.historyFile = historyFile;
      return this;
    }

    public Builder nodes(int nodes) {
      this.nodes = nodes;
      return this;
    }

    public Builder gpusPerNode(int gpusPerNode) {
      this.gpusPerNode = gpusPerNode;
      return this;
    }

    public Builder root(boolean root) {
      this.root = root;
      return this;
    }

    /** Resolves against the process environment and system properties. */
    public ShellConfig build() {
      return build(System.getenv(), System.getProperties());
    }

    public ShellConfig build(Map<String, String> env, Properties properties) {
      Path dir = commandsDir;
      String property = properties.getProperty(COMMANDS_DIR_PROPERTY);
      if (property != null && !property.isBlank()) {
        dir = Paths.get(property);
      }
      String fromEnv = env.get(COMMANDS_DIR_ENV);
      if (fromEnv != null && !fromEnv.isBlank()) {
        dir = Paths.get(fromEnv);
      }

      String startNode = node;
      if (startNode == null || startNode.isBlank()) {
        String envNode = env.get(NODE_ENV);
        startNode = envNode == null || envNode.isBlank() ? null : envNode;
      }

      Path history = historyFile;
      if (history == null) {
        history = Paths.get(properties.getProperty("user.home", "."), ".dcsim", "history");
      }
      return new ShellConfig(dir, startNode, history, nodes, gpusPerNode, root);
    }
  }
}
