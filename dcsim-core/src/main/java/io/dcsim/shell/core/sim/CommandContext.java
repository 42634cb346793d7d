package io.dcsim.shell.core.sim;

import io.dcsim.shell.core.model.ClusterConfig;
import io.dcsim.shell.core.privilege.PrivilegeContext;
import io.dcsim.shell.core.state.ClusterStore;
import io.dcsim.shell.core.state.ScenarioContext;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Per-invocation execution context supplied by the caller. Immutable; use {@link #toBuilder()} to
 * derive a variant (for example a one-off root context for {@code sudo}).
 */
public final class CommandContext implements PrivilegeContext {
  private final String currentNode;
  private final String currentPath;
  private final Map<String, String> environment;
  private final List<String> history;
  private final boolean root;
  private final ClusterConfig cluster;
  private final ScenarioContext scenarioContext;
  private final ClusterStore globalStore;

  private CommandContext(Builder b) {
    this.currentNode = b.currentNode;
    this.currentPath = b.currentPath;
    this.environment = Map.copyOf(b.environment);
    this.history = List.copyOf(b.history);
    this.root = b.root;
    this.cluster = b.cluster;
    this.scenarioContext = b.scenarioContext;
    this.globalStore = Objects.requireNonNull(b.globalStore, "globalStore");
  }

  public static Builder builder(ClusterStore globalStore) {
    return new Builder().globalStore(globalStore);
  }

  public Builder toBuilder() {
    return new Builder()
        .currentNode(currentNode)
        .currentPath(currentPath)
        .environment(environment)
        .history(history)
        .root(root)
        .cluster(cluster)
        .scenarioContext(scenarioContext)
        .globalStore(globalStore);
  }

  /** Node the user is logged into, or null to mean the first node of the cluster. */
  public String currentNode() {
    return currentNode;
  }

  public String currentPath() {
    return currentPath;
  }

  public Map<String, String> environment() {
    return environment;
  }

  public List<String> history() {
    return history;
  }

  @Override
  public boolean isRoot() {
    return root;
  }

  /** A cluster supplied for this invocation only; overrides scenario and global state for reads. */
  public Optional<ClusterConfig> explicitCluster() {
    return Optional.ofNullable(cluster);
  }

  public Optional<ScenarioContext> scenarioContext() {
    return Optional.ofNullable(scenarioContext);
  }

  public ClusterStore globalStore() {
    return globalStore;
  }

  public static final class Builder {
    private String currentNode;
    private String currentPath = "/root";
    private Map<String, String> environment = new LinkedHashMap<>();
    private List<String> history = List.of();
    private boolean root;
    private ClusterConfig cluster;
    private ScenarioContext scenarioContext;
    private ClusterStore globalStore;

    private Builder() {}

    public Builder currentNode(String currentNode) {
      this.currentNode = currentNode;
      return this;
    }

    public Builder currentPath(String currentPath) {
      this.currentPath = Objects.requireNonNull(currentPath, "currentPath");
      return this;
    }

    public Builder environment(Map<String, String> environment) {
      this.environment = new LinkedHashMap<>(environment);
      return this;
    }

    public Builder history(List<String> history) {
      this.history = history;
      return this;
    }

    public Builder root(boolean root) {
      this.root = root;
      return this;
    }

    public Builder cluster(ClusterConfig cluster) {
      this.cluster = cluster;
      return this;
    }

    public Builder scenarioContext(ScenarioContext scenarioContext) {
      this.scenarioContext = scenarioContext;
      return this;
    }

    public Builder globalStore(ClusterStore globalStore) {
      this.globalStore = globalStore;
      return this;
    }

    public CommandContext build() {
      return new CommandContext(this);
    }
  }
}
