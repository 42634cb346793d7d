package io.dcsim.shell.sim;

import io.dcsim.shell.core.model.ClusterConfig;
import io.dcsim.shell.core.model.DgxNode;
import io.dcsim.shell.core.model.Gpu;
import io.dcsim.shell.core.model.SlurmConfig;
import io.dcsim.shell.core.parse.CommandParser;
import io.dcsim.shell.core.parse.ParsedCommand;
import io.dcsim.shell.core.sim.BaseSimulator;
import io.dcsim.shell.core.sim.CommandContext;
import io.dcsim.shell.core.sim.CommandResult;
import io.dcsim.shell.core.sim.SimulatorMetadata;
import io.dcsim.shell.core.sim.TableFormatter;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Slurm client tools over the resolved cluster: {@code sinfo}, {@code squeue} and {@code
 * scontrol}. Node states are the cluster's slurm states; a node with jobs on some or all of its
 * GPUs reports {@code mix} or {@code alloc} while its stored state is {@code idle}.
 */
public final class SlurmSimulator extends BaseSimulator {
  static final String VERSION = "23.02.6";

  private static final SimulatorMetadata METADATA =
      new SimulatorMetadata(
          "slurm",
          VERSION,
          "Slurm workload manager client",
          List.of("sinfo", "squeue", "scontrol"));

  private static final Pattern FORMAT_SPEC = Pattern.compile("%(\\.?)(\\d*)([A-Za-z])");
  private static final Set<String> UPDATE_STATES =
      Set.of("DOWN", "DRAIN", "RESUME", "IDLE", "UNDRAIN");

  private static final Map<Character, String> FORMAT_HEADERS = new LinkedHashMap<>();

  static {
    FORMAT_HEADERS.put('N', "NODELIST");
    FORMAT_HEADERS.put('T', "STATE");
    FORMAT_HEADERS.put('t', "STATE");
    FORMAT_HEADERS.put('P', "PARTITION");
    FORMAT_HEADERS.put('c', "CPUS");
    FORMAT_HEADERS.put('m', "MEMORY");
    FORMAT_HEADERS.put('E', "REASON");
    FORMAT_HEADERS.put('G', "GRES");
    FORMAT_HEADERS.put('D', "NODES");
    FORMAT_HEADERS.put('a', "AVAIL");
    FORMAT_HEADERS.put('l', "TIMELIMIT");
  }

  @Override
  public SimulatorMetadata getMetadata() {
    return METADATA;
  }

  @Override
  public CommandResult execute(ParsedCommand parsed, CommandContext context) {
    if (parsed.hasFlag("V", "version")) {
      return createSuccess("slurm " + VERSION);
    }
    return switch (parsed.baseCommand()) {
      case "sinfo" -> sinfo(parsed, context);
      case "squeue" -> squeue(parsed, context);
      case "scontrol" -> scontrol(parsed, context);
      default -> createError(parsed.baseCommand() + ": not a Slurm command", 127);
    };
  }

  // sinfo

  /** One output row: a partition and the nodes in it that share a state. */
  private record NodeGroup(String partition, boolean defaultPartition, String state,
      List<DgxNode> nodes) {}

  private CommandResult sinfo(ParsedCommand parsed, CommandContext context) {
    ClusterConfig cluster = resolveCluster(context);
    List<String> partitions = partitions(cluster);
    Optional<String> partitionFilter = parsed.flagValue("p", "partition");
    Optional<String> nodeFilter = parsed.flagValue("n", "nodes");
    boolean nodeOriented = parsed.hasFlag("N", "Node");
    boolean header = !parsed.hasFlag("h", "noheader");

    List<DgxNode> nodes = new ArrayList<>();
    Set<String> wanted =
        nodeFilter.map(f -> Set.copyOf(Arrays.asList(f.split(",")))).orElse(null);
    for (DgxNode node : cluster.getNodes()) {
      if (wanted == null || wanted.contains(node.getId()) || wanted.contains(node.getHostname())) {
        nodes.add(node);
      }
    }

    if (parsed.hasFlag("R", "list-reasons")) {
      return sinfoReasons(nodes, header);
    }

    List<NodeGroup> groups = new ArrayList<>();
    for (int i = 0; i < partitions.size(); i++) {
      String partition = partitions.get(i);
      if (partitionFilter.isPresent() && !partitionFilter.get().equals(partition)) {
        continue;
      }
      if (nodeOriented) {
        for (DgxNode node : nodes) {
          groups.add(new NodeGroup(partition, i == 0, effectiveState(node), List.of(node)));
        }
      } else {
        Map<String, List<DgxNode>> byState = new LinkedHashMap<>();
        for (DgxNode node : nodes) {
          byState.computeIfAbsent(effectiveState(node), k -> new ArrayList<>()).add(node);
        }
        for (Map.Entry<String, List<DgxNode>> e : byState.entrySet()) {
          groups.add(new NodeGroup(partition, i == 0, e.getKey(), e.getValue()));
        }
      }
    }

    Optional<String> format = parsed.flagValue("o", "format");
    if (format.isPresent()) {
      return createSuccess(formatGroups(format.get(), groups, header));
    }
    boolean longFormat = parsed.hasFlag("l", "long");
    List<String> columns;
    if (nodeOriented) {
      columns =
          longFormat
              ? List.of("NODELIST", "NODES", "PARTITION", "STATE", "CPUS", "MEMORY", "GRES",
                  "REASON")
              : List.of("NODELIST", "NODES", "PARTITION", "STATE");
    } else {
      columns =
          longFormat
              ? List.of("PARTITION", "AVAIL", "TIMELIMIT", "JOB_SIZE", "ROOT", "OVERSUBS",
                  "GROUPS", "NODES", "STATE", "NODELIST")
              : List.of("PARTITION", "AVAIL", "TIMELIMIT", "NODES", "STATE", "NODELIST");
    }
    List<List<String>> rows = new ArrayList<>();
    for (NodeGroup group : groups) {
      List<String> row = new ArrayList<>();
      for (String column : columns) {
        row.add(column(column, group, longFormat));
      }
      rows.add(row);
    }
    String table = TableFormatter.format(columns, rows);
    return createSuccess(header ? table : dropFirstLine(table));
  }

  private static String column(String name, NodeGroup group, boolean longFormat) {
    DgxNode first = group.nodes().get(0);
    return switch (name) {
      case "PARTITION" -> group.partition() + (group.defaultPartition() ? "*" : "");
      case "AVAIL" -> "up";
      case "TIMELIMIT" -> "infinite";
      case "JOB_SIZE" -> "1-infinite";
      case "ROOT" -> "no";
      case "OVERSUBS" -> "NO";
      case "GROUPS" -> "all";
      case "NODES" -> String.valueOf(group.nodes().size());
      case "STATE" -> longFormat ? longState(group.state()) : group.state();
      case "NODELIST" -> Hostlist.compress(ids(group.nodes()));
      case "CPUS" -> String.valueOf(cpus(first));
      case "MEMORY" -> String.valueOf(first.getRamTotal() * 1024);
      case "GRES" -> "gpu:h100:" + first.getGpus().size();
      case "REASON" -> first.getSlurmReason() == null ? "none" : first.getSlurmReason();
      default -> "";
    };
  }

  private CommandResult sinfoReasons(List<DgxNode> nodes, boolean header) {
    Map<String, List<String>> byReason = new LinkedHashMap<>();
    for (DgxNode node : nodes) {
      if (node.getSlurmReason() != null && !node.getSlurmReason().isEmpty()) {
        byReason.computeIfAbsent(node.getSlurmReason(), k -> new ArrayList<>()).add(node.getId());
      }
    }
    List<List<String>> rows = new ArrayList<>();
    for (Map.Entry<String, List<String>> e : byReason.entrySet()) {
      rows.add(List.of(e.getKey(), "root", "2024-01-15T10:00:00", Hostlist.compress(e.getValue())));
    }
    String table = TableFormatter.format(List.of("REASON", "USER", "TIMESTAMP", "NODELIST"), rows);
    return createSuccess(header ? table : dropFirstLine(table));
  }

  /** Renders {@code -o} format strings such as {@code "%N %T"} or {@code "%10P %.6t"}. */
  private static String formatGroups(String format, List<NodeGroup> groups, boolean header) {
    StringBuilder sb = new StringBuilder();
    if (header) {
      sb.append(render(format, spec -> FORMAT_HEADERS.getOrDefault(spec, "?"))).append('\n');
    }
    for (NodeGroup group : groups) {
      DgxNode first = group.nodes().get(0);
      sb.append(
              render(
                  format,
                  spec ->
                      switch (spec) {
                        case 'N' -> Hostlist.compress(ids(group.nodes()));
                        case 'T' -> longState(group.state());
                        case 't' -> group.state();
                        case 'P' -> group.partition() + (group.defaultPartition() ? "*" : "");
                        case 'c' -> String.valueOf(cpus(first));
                        case 'm' -> String.valueOf(first.getRamTotal() * 1024);
                        case 'E' -> first.getSlurmReason() == null
                            ? "none"
                            : first.getSlurmReason();
                        case 'G' -> "gpu:h100:" + first.getGpus().size();
                        case 'D' -> String.valueOf(group.nodes().size());
                        case 'a' -> "up";
                        case 'l' -> "infinite";
                        default -> "";
                      }))
          .append('\n');
    }
    return sb.toString();
  }

  private interface SpecValue {
    String of(char spec);
  }

  private static String render(String format, SpecValue values) {
    Matcher m = FORMAT_SPEC.matcher(format);
    StringBuilder sb = new StringBuilder();
    while (m.find()) {
      String value = values.of(m.group(3).charAt(0));
      if (!m.group(2).isEmpty()) {
        int width = Integer.parseInt(m.group(2));
        if (value.length() > width) {
          value = value.substring(0, width);
        }
        value =
            m.group(1).isEmpty()
                ? String.format("%-" + width + "s", value)
                : String.format("%" + width + "s", value);
      }
      m.appendReplacement(sb, Matcher.quoteReplacement(value));
    }
    m.appendTail(sb);
    return sb.toString().stripTrailing();
  }

  // squeue

  private record Job(String id, String partition, List<String> nodes, int gpus) {}

  private CommandResult squeue(ParsedCommand parsed, CommandContext context) {
    ClusterConfig cluster = resolveCluster(context);
    String partition = partitions(cluster).get(0);
    Map<String, Job> jobs = new LinkedHashMap<>();
    for (DgxNode node : cluster.getNodes()) {
      for (Gpu gpu : node.getGpus()) {
        String jobId = gpu.getAllocatedJobId();
        if (jobId == null || jobId.isEmpty()) {
          continue;
        }
        Job job = jobs.get(jobId);
        if (job == null) {
          job = new Job(jobId, partition, new ArrayList<>(), 0);
        }
        if (!job.nodes().contains(node.getId())) {
          job.nodes().add(node.getId());
        }
        jobs.put(jobId, new Job(jobId, partition, job.nodes(), job.gpus() + 1));
      }
    }
    Optional<String> user = parsed.flagValue("u", "user");
    Optional<String> partitionFilter = parsed.flagValue("p", "partition");
    Optional<String> jobFilter = parsed.flagValue("j", "jobs");
    boolean longFormat = parsed.hasFlag("l", "long");

    List<String> header =
        longFormat
            ? List.of("JOBID", "PARTITION", "NAME", "USER", "STATE", "TIME", "TIME_LIMI", "NODES",
                "NODELIST(REASON)")
            : List.of("JOBID", "PARTITION", "NAME", "USER", "ST", "TIME", "NODES",
                "NODELIST(REASON)");
    List<List<String>> rows = new ArrayList<>();
    for (Job job : jobs.values()) {
      if (user.isPresent() && !user.get().equals("admin")) {
        continue;
      }
      if (partitionFilter.isPresent() && !partitionFilter.get().equals(job.partition())) {
        continue;
      }
      if (jobFilter.isPresent() && !Arrays.asList(jobFilter.get().split(",")).contains(job.id())) {
        continue;
      }
      List<String> row = new ArrayList<>();
      row.add(job.id());
      row.add(job.partition());
      row.add("train-" + job.id());
      row.add("admin");
      row.add(longFormat ? "RUNNING" : "R");
      row.add("1:02:03");
      if (longFormat) {
        row.add("UNLIMITED");
      }
      row.add(String.valueOf(job.nodes().size()));
      row.add(Hostlist.compress(job.nodes()));
      rows.add(row);
    }
    String table = TableFormatter.format(header, rows);
    return createSuccess(parsed.hasFlag("h", "noheader") ? dropFirstLine(table) : table);
  }

  // scontrol

  private CommandResult scontrol(ParsedCommand parsed, CommandContext context) {
    // every scontrol option is a switch, so bare words are the command whatever the flag order
    List<String> args = new ArrayList<>();
    List<String> words = CommandParser.tokenize(parsed.firstSegment());
    for (String word : words.subList(Math.min(1, words.size()), words.size())) {
      if (!CommandParser.isFlagShaped(word)) {
        args.add(word);
      }
    }
    if (args.isEmpty()) {
      return usageError("scontrol: no command given. Use 'scontrol --help' for usage.");
    }
    boolean oneLiner = parsed.hasFlag("o", "oneliner");
    return switch (args.get(0).toLowerCase(Locale.ROOT)) {
      case "show" -> show(args.subList(1, args.size()), context, oneLiner);
      case "update" -> update(args.subList(1, args.size()), context);
      default -> createError("invalid keyword: " + args.get(0));
    };
  }

  private CommandResult show(List<String> args, CommandContext context, boolean oneLiner) {
    if (args.isEmpty()) {
      return createError("scontrol: show requires an entity: node, partition");
    }
    ClusterConfig cluster = resolveCluster(context);
    String entity = args.get(0).toLowerCase(Locale.ROOT);
    Optional<String> name = args.size() > 1 ? Optional.of(args.get(1)) : Optional.empty();
    List<String> records = new ArrayList<>();
    switch (entity) {
      case "node", "nodes" -> {
        if (name.isPresent()) {
          Optional<DgxNode> node = cluster.findNode(name.get());
          if (node.isEmpty()) {
            return createError("Node " + name.get() + " not found");
          }
          records.add(nodeRecord(node.get(), cluster));
        } else {
          for (DgxNode node : cluster.getNodes()) {
            records.add(nodeRecord(node, cluster));
          }
        }
      }
      case "partition", "partitions" -> {
        List<String> partitions = partitions(cluster);
        if (name.isPresent()) {
          if (!partitions.contains(name.get())) {
            return createError("Partition " + name.get() + " not found");
          }
          records.add(partitionRecord(name.get(), partitions.indexOf(name.get()) == 0, cluster));
        } else {
          for (int i = 0; i < partitions.size(); i++) {
            records.add(partitionRecord(partitions.get(i), i == 0, cluster));
          }
        }
      }
      default -> {
        return createError("invalid entity:" + args.get(0) + " for keyword:show");
      }
    }
    StringBuilder sb = new StringBuilder();
    for (String record : records) {
      sb.append(oneLiner ? record.replace("\n   ", " ") : record).append('\n');
    }
    return createSuccess(sb.toString());
  }

  private String nodeRecord(DgxNode node, ClusterConfig cluster) {
    int cpus = cpus(node);
    long allocGpus = node.getGpus().stream().filter(g -> g.getAllocatedJobId() != null).count();
    StringBuilder sb = new StringBuilder();
    sb.append("NodeName=").append(node.getId()).append(" Arch=x86_64 CoresPerSocket=56");
    sb.append("\n   CPUAlloc=").append(allocGpus * cpus / Math.max(1, node.getGpus().size()))
        .append(" CPUEfctv=").append(cpus).append(" CPUTot=").append(cpus)
        .append(" CPULoad=0.00");
    sb.append("\n   AvailableFeatures=").append(node.getSystemType().toLowerCase(Locale.ROOT));
    sb.append("\n   Gres=gpu:h100:").append(node.getGpus().size());
    sb.append("\n   NodeAddr=").append(node.getHostname())
        .append(" NodeHostName=").append(node.getHostname());
    sb.append("\n   OS=Linux ").append(node.getKernelVersion());
    sb.append("\n   RealMemory=").append(node.getRamTotal() * 1024)
        .append(" AllocMem=0 FreeMem=").append((node.getRamTotal() - node.getRamUsed()) * 1024);
    sb.append("\n   Partitions=").append(String.join(",", partitions(cluster)));
    sb.append("\n   State=").append(scontrolState(node)).append(" ThreadsPerCore=2");
    if (node.getSlurmReason() != null && !node.getSlurmReason().isEmpty()) {
      sb.append("\n   Reason=").append(node.getSlurmReason()).append(" [root]");
    }
    return sb.toString();
  }

  private String partitionRecord(String name, boolean isDefault, ClusterConfig cluster) {
    List<DgxNode> nodes = cluster.getNodes();
    int cpus = nodes.stream().mapToInt(SlurmSimulator::cpus).sum();
    return "PartitionName=" + name
        + "\n   AllowGroups=ALL Default=" + (isDefault ? "YES" : "NO")
        + "\n   MaxTime=UNLIMITED MinNodes=0"
        + "\n   Nodes=" + Hostlist.compress(ids(nodes))
        + "\n   State=UP TotalCPUs=" + cpus + " TotalNodes=" + nodes.size();
  }

  private CommandResult update(List<String> args, CommandContext context) {
    if (!context.isRoot()) {
      return createError("slurm_update error: Access/permission denied");
    }
    Map<String, String> settings = new LinkedHashMap<>();
    for (String arg : args) {
      int eq = arg.indexOf('=');
      if (eq <= 0) {
        return createError("Invalid input: " + arg + "\nRequest aborted");
      }
      settings.put(arg.substring(0, eq).toLowerCase(Locale.ROOT), arg.substring(eq + 1));
    }
    String nodeNames = settings.get("nodename");
    if (nodeNames == null || nodeNames.isEmpty()) {
      return createError("No valid entity in update command\nRequest aborted");
    }
    String state = settings.getOrDefault("state", "").toUpperCase(Locale.ROOT);
    if (!UPDATE_STATES.contains(state)) {
      return createError("Invalid input: State=" + settings.getOrDefault("state", "")
          + "\nRequest aborted\nValid states: DOWN DRAIN RESUME IDLE UNDRAIN");
    }
    String reason = settings.get("reason");
    boolean needsReason = state.equals("DOWN") || state.equals("DRAIN");
    if (needsReason && (reason == null || reason.isBlank())) {
      return createError(
          "You must specify a reason when DOWNING or DRAINING a node. Request denied");
    }

    ClusterConfig cluster = resolveCluster(context);
    Set<String> targets = new LinkedHashSet<>();
    for (String name : nodeNames.split(",")) {
      Optional<DgxNode> node = cluster.findNode(name);
      if (node.isEmpty()) {
        return createError("Invalid node name specified: " + name);
      }
      targets.add(node.get().getId());
    }
    String newState = needsReason ? state.toLowerCase(Locale.ROOT) : "idle";
    String newReason = needsReason ? reason : null;
    for (String nodeId : targets) {
      resolveMutator(context).setSlurmState(nodeId, newState, newReason, "scontrol");
    }
    return createSuccess("");
  }

  // helpers

  static List<String> partitions(ClusterConfig cluster) {
    SlurmConfig config = cluster.getSlurmConfig();
    if (config == null || config.partitions().isEmpty()) {
      return List.of("gpu");
    }
    return config.partitions();
  }

  /** Short state name; allocation of GPUs turns an idle node into {@code mix} or {@code alloc}. */
  static String effectiveState(DgxNode node) {
    String state = node.getSlurmState() == null ? "idle" : node.getSlurmState();
    if (!state.equals("idle")) {
      return state;
    }
    long allocated = node.getGpus().stream().filter(g -> g.getAllocatedJobId() != null).count();
    if (allocated == 0) {
      return "idle";
    }
    return allocated == node.getGpus().size() ? "alloc" : "mix";
  }

  private static String longState(String state) {
    return switch (state) {
      case "alloc" -> "allocated";
      case "mix" -> "mixed";
      case "drain" -> "drained";
      default -> state;
    };
  }

  private static String scontrolState(DgxNode node) {
    return switch (effectiveState(node)) {
      case "alloc" -> "ALLOCATED";
      case "mix" -> "MIXED";
      case "drain" -> "IDLE+DRAIN";
      case "down" -> "DOWN";
      default -> "IDLE";
    };
  }

  private static int cpus(DgxNode node) {
    return Math.max(1, node.getCpuCount()) * 112;
  }

  private static List<String> ids(List<DgxNode> nodes) {
    List<String> ids = new ArrayList<>(nodes.size());
    for (DgxNode node : nodes) {
      ids.add(node.getId());
    }
    return ids;
  }

  private static String dropFirstLine(String table) {
    int nl = table.indexOf('\n');
    return nl < 0 ? "" : table.substring(nl + 1);
  }
}
