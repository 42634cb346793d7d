package io.dcsim.shell.sim;

import io.dcsim.shell.core.model.DgxNode;
import io.dcsim.shell.core.model.EccErrors;
import io.dcsim.shell.core.model.Gpu;
import io.dcsim.shell.core.model.GpuUpdate;
import io.dcsim.shell.core.model.HealthStatus;
import io.dcsim.shell.core.model.MigInstance;
import io.dcsim.shell.core.model.NvLink;
import io.dcsim.shell.core.model.XidError;
import io.dcsim.shell.core.parse.ParsedCommand;
import io.dcsim.shell.core.sim.BaseSimulator;
import io.dcsim.shell.core.sim.CommandContext;
import io.dcsim.shell.core.sim.CommandResult;
import io.dcsim.shell.core.sim.SimulatorMetadata;
import io.dcsim.shell.core.sim.TableFormatter;
import io.dcsim.shell.core.state.StateMutator;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Function;

/**
 * {@code nvidia-smi} against the GPUs of the current node. Read modes: the summary table,
 * {@code -L}, {@code -q [-d ...]}, {@code --query-gpu}. Write modes: {@code -pl}, {@code -pm},
 * {@code -mig}, {@code -r}. Subcommands: {@code nvlink -s}, {@code topo -m}, {@code mig -lgi}.
 */
public final class NvidiaSmiSimulator extends BaseSimulator {
  static final int EXIT_INVALID_ARGUMENT = 2;
  static final int EXIT_NOT_FOUND = 6;
  static final int EXIT_DRIVER = 9;

  static final double MIN_POWER_LIMIT = 200;
  static final double MAX_POWER_LIMIT = 700;
  static final double SLOWDOWN_TEMP = 87;
  static final double SHUTDOWN_TEMP = 92;

  private static final SimulatorMetadata METADATA =
      new SimulatorMetadata(
          "nvidia-smi",
          "535.129.03",
          "NVIDIA System Management Interface",
          List.of("nvidia-smi"));

  private static final String SEPARATOR =
      "+-----------------------------------------+------------------------+"
          + "----------------------+";

  private static final DateTimeFormatter SUMMARY_TIME =
      DateTimeFormatter.ofPattern("EEE MMM d HH:mm:ss yyyy", Locale.ROOT);

  private static final Set<String> DISPLAY_SECTIONS =
      Set.of("MEMORY", "ECC", "TEMPERATURE", "POWER", "PERFORMANCE");

  /** Query field name to header unit and value renderer. */
  private static final Map<String, QueryField> QUERY_FIELDS = new LinkedHashMap<>();

  static {
    field("index", null, g -> String.valueOf(g.getId()));
    field("name", null, Gpu::getName);
    field("uuid", null, Gpu::getUuid);
    field("pci.bus_id", null, Gpu::getPciAddress);
    field("temperature.gpu", null, g -> String.format("%.0f", g.getTemperature()));
    field("power.draw", "W", g -> String.format("%.2f", g.getPowerDraw()));
    field("power.limit", "W", g -> String.format("%.2f", g.getPowerLimit()));
    field("memory.total", "MiB", g -> String.valueOf(g.getMemoryTotal()));
    field("memory.used", "MiB", g -> String.valueOf(g.getMemoryUsed()));
    field("memory.free", "MiB", g -> String.valueOf(g.getMemoryTotal() - g.getMemoryUsed()));
    field("utilization.gpu", "%", g -> String.format("%.0f", g.getUtilization()));
    field("clocks.sm", "MHz", g -> String.valueOf(g.getClocksSm()));
    field("clocks.mem", "MHz", g -> String.valueOf(g.getClocksMem()));
    field("persistence_mode", null, g -> g.isPersistenceMode() ? "Enabled" : "Disabled");
    field("mig.mode.current", null, g -> g.isMigMode() ? "Enabled" : "Disabled");
    field(
        "ecc.errors.corrected.volatile.total",
        null,
        g -> String.valueOf(ecc(g).getSingleBit()));
    field(
        "ecc.errors.uncorrected.volatile.total",
        null,
        g -> String.valueOf(ecc(g).getDoubleBit()));
    field("pstate", null, g -> performanceState(g));
  }

  private record QueryField(String unit, Function<Gpu, String> value) {}

  private static void field(String name, String unit, Function<Gpu, String> value) {
    QUERY_FIELDS.put(name, new QueryField(unit, value));
  }

  @Override
  public SimulatorMetadata getMetadata() {
    return METADATA;
  }

  @Override
  public CommandResult execute(ParsedCommand parsed, CommandContext context) {
    if (parsed.hasFlag("version")) {
      return createSuccess(
          "NVIDIA-SMI version  : " + METADATA.version() + "\nNVML version        : 12.535.129");
    }
    if (parsed.hasFlag("h")) {
      return createSuccess(
          "NVIDIA System Management Interface -- v"
              + METADATA.version()
              + "\n\nRun 'explain nvidia-smi' for the supported options.");
    }
    Optional<DgxNode> node = resolveCurrentNode(context);
    if (node.isEmpty()) {
      return createError(
          "NVIDIA-SMI has failed because it couldn't communicate with the NVIDIA driver. "
              + "Make sure that the latest NVIDIA driver is installed and running.",
          EXIT_DRIVER);
    }

    List<Gpu> targets;
    if (parsed.hasFlag("i", "id")) {
      Optional<String> ids = parsed.flagValue("i", "id");
      if (ids.isEmpty()) {
        return usageError("Option -i requires an argument.");
      }
      Optional<List<Gpu>> selected = selectGpus(node.get(), ids.get());
      if (selected.isEmpty()) {
        return createError("No devices were found", EXIT_NOT_FOUND);
      }
      targets = selected.get();
    } else {
      targets = node.get().getGpus();
    }

    Optional<String> sub = parsed.subcommand(0);
    if (sub.isPresent()) {
      return switch (sub.get()) {
        case "nvlink" -> nvlinkStatus(targets);
        case "topo" -> topology(node.get());
        case "mig" -> migInstances(targets);
        default -> usageError("Invalid combination of input arguments: " + sub.get());
      };
    }

    if (parsed.hasFlag("pl", "power-limit")) {
      return setPowerLimit(parsed, node.get(), targets, context);
    }
    if (parsed.hasFlag("pm", "persistence-mode")) {
      return setPersistenceMode(parsed, node.get(), targets, context);
    }
    if (parsed.hasFlag("mig", "multi-instance-gpu")) {
      return setMigMode(parsed, node.get(), targets, context);
    }
    if (parsed.hasFlag("r", "gpu-reset")) {
      return reset(node.get(), targets, context);
    }
    if (parsed.hasFlag("L", "list-gpus")) {
      return listGpus(targets);
    }
    if (parsed.hasFlag("query-gpu")) {
      return queryGpu(parsed, targets);
    }
    if (parsed.hasFlag("q", "query")) {
      return query(parsed, node.get(), targets);
    }
    return createSuccess(summary(node.get(), targets));
  }

  /** Parses a comma separated index list; empty if any index is not on the node. */
  private static Optional<List<Gpu>> selectGpus(DgxNode node, String ids) {
    List<Gpu> out = new ArrayList<>();
    for (String id : ids.split(",")) {
      Optional<Integer> index = parseInt(id);
      if (index.isEmpty()) {
        return Optional.empty();
      }
      Optional<Gpu> gpu = node.findGpu(index.get());
      if (gpu.isEmpty()) {
        return Optional.empty();
      }
      out.add(gpu.get());
    }
    return Optional.of(out);
  }

  String summary(DgxNode node, List<Gpu> gpus) {
    StringBuilder sb = new StringBuilder();
    sb.append(ZonedDateTime.now().format(SUMMARY_TIME)).append('\n');
    sb.append(SEPARATOR).append('\n');
    sb.append(
            String.format(
                "| NVIDIA-SMI %-21s Driver Version: %-12s CUDA Version: %-9s|",
                METADATA.version(),
                node.getNvidiaDriverVersion(),
                node.getCudaVersion()))
        .append('\n');
    sb.append("|-----------------------------------------+------------------------+")
        .append("----------------------+\n");
    sb.append("| GPU  Name                 Persistence-M | Bus-Id          Disp.A |")
        .append(" Volatile Uncorr. ECC |\n");
    sb.append("| Fan  Temp   Perf          Pwr:Usage/Cap |           Memory-Usage |")
        .append(" GPU-Util  Compute M. |\n");
    sb.append("|                                         |                        |")
        .append("               MIG M. |\n");
    sb.append("|=========================================+========================+")
        .append("======================|\n");
    for (Gpu gpu : gpus) {
      sb.append(
              String.format(
                  "| %3d  %-25s %4s  | %-16s   Off | %20s |",
                  gpu.getId(),
                  truncate(gpu.getName(), 25),
                  gpu.isPersistenceMode() ? "On" : "Off",
                  gpu.getPciAddress(),
                  ecc(gpu).getDoubleBit()))
          .append('\n');
      sb.append(
              String.format(
                  "| N/A  %3.0fC    %-4s %8.0fW / %4.0fW | %8dMiB / %7dMiB |"
                      + " %7.0f%%      Default |",
                  gpu.getTemperature(),
                  performanceState(gpu),
                  gpu.getPowerDraw(),
                  gpu.getPowerLimit(),
                  gpu.getMemoryUsed(),
                  gpu.getMemoryTotal(),
                  gpu.getUtilization()))
          .append('\n');
      sb.append(
              String.format(
                  "|                                         |                        | %20s |",
                  gpu.isMigMode() ? "Enabled" : "Disabled"))
          .append('\n');
      sb.append(SEPARATOR).append('\n');
    }
    sb.append('\n');
    sb.append("+-----------------------------------------------------------------------------")
        .append("----------+\n");
    sb.append("| Processes:                                                                   ")
        .append("          |\n");
    sb.append("|  No running processes found                                                  ")
        .append("          |\n");
    sb.append("+-----------------------------------------------------------------------------")
        .append("----------+\n");
    return sb.toString();
  }

  private CommandResult listGpus(List<Gpu> gpus) {
    StringBuilder sb = new StringBuilder();
    for (Gpu gpu : gpus) {
      sb.append(gpuLine(gpu)).append('\n');
    }
    return createSuccess(sb.toString());
  }

  private CommandResult queryGpu(ParsedCommand parsed, List<Gpu> gpus) {
    Optional<String> fields = parsed.flagValue("query-gpu");
    if (fields.isEmpty()) {
      return usageError("Option --query-gpu requires a comma separated list of fields.");
    }
    Optional<String> format = parsed.flagValue("format");
    if (format.isEmpty()) {
      return usageError("--format is required with --query-gpu, e.g. --format=csv");
    }
    Set<String> formatOptions = new LinkedHashSet<>(List.of(format.get().split(",")));
    if (!formatOptions.contains("csv")) {
      return usageError("Only csv output is supported: --format=csv[,noheader][,nounits]");
    }
    boolean header = !formatOptions.contains("noheader");
    boolean units = !formatOptions.contains("nounits");

    List<String> names = new ArrayList<>();
    for (String name : fields.get().split(",")) {
      String trimmed = name.trim();
      if (!QUERY_FIELDS.containsKey(trimmed)) {
        return usageError(
            "Field \"" + trimmed + "\" is not a valid field to query.\n\n"
                + "See 'nvidia-smi --help-query-gpu' for more information.");
      }
      names.add(trimmed);
    }

    StringBuilder sb = new StringBuilder();
    if (header) {
      List<String> cols = new ArrayList<>();
      for (String name : names) {
        String unit = QUERY_FIELDS.get(name).unit();
        cols.add(unit == null ? name : name + " [" + unit + "]");
      }
      sb.append(String.join(", ", cols)).append('\n');
    }
    for (Gpu gpu : gpus) {
      List<String> cells = new ArrayList<>();
      for (String name : names) {
        QueryField f = QUERY_FIELDS.get(name);
        String value = f.value().apply(gpu);
        cells.add(units && f.unit() != null ? value + " " + f.unit() : value);
      }
      sb.append(String.join(", ", cells)).append('\n');
    }
    return createSuccess(sb.toString());
  }

  private CommandResult query(ParsedCommand parsed, DgxNode node, List<Gpu> gpus) {
    Set<String> sections = new LinkedHashSet<>();
    Optional<String> display = parsed.flagValue("d", "display");
    if (display.isPresent()) {
      for (String s : display.get().split(",")) {
        String section = s.trim().toUpperCase(Locale.ROOT);
        if (!DISPLAY_SECTIONS.contains(section)) {
          return usageError("Invalid display type: " + s.trim());
        }
        sections.add(section);
      }
    } else if (parsed.hasFlag("d", "display")) {
      return usageError("Option -d requires an argument.");
    }
    boolean all = sections.isEmpty();

    StringBuilder sb = new StringBuilder();
    sb.append("\n==============NVSMI LOG==============\n\n");
    kv(sb, 0, "Timestamp", ZonedDateTime.now().format(DateTimeFormatter.RFC_1123_DATE_TIME));
    kv(sb, 0, "Driver Version", node.getNvidiaDriverVersion());
    kv(sb, 0, "CUDA Version", node.getCudaVersion());
    sb.append('\n');
    kv(sb, 0, "Attached GPUs", String.valueOf(node.getGpus().size()));
    for (Gpu gpu : gpus) {
      sb.append("GPU ").append(gpu.getPciAddress()).append('\n');
      if (all) {
        kv(sb, 1, "Product Name", gpu.getName());
        kv(sb, 1, "Persistence Mode", gpu.isPersistenceMode() ? "Enabled" : "Disabled");
        kv(sb, 1, "MIG Mode", "");
        kv(sb, 2, "Current", gpu.isMigMode() ? "Enabled" : "Disabled");
        kv(sb, 1, "GPU UUID", gpu.getUuid());
        kv(sb, 1, "Minor Number", String.valueOf(gpu.getId()));
        kv(sb, 1, "GPU Health", gpu.getHealthStatus().label());
        appendXids(sb, gpu);
        appendNvLinkSummary(sb, gpu);
      }
      if (all || sections.contains("PERFORMANCE")) {
        kv(sb, 1, "Performance State", performanceState(gpu));
        kv(sb, 1, "Clocks Event Reasons", "");
        kv(sb, 2, "Idle", gpu.getUtilization() == 0 ? "Active" : "Not Active");
        kv(sb, 2, "HW Thermal Slowdown", activeIf(gpu.getTemperature() >= SLOWDOWN_TEMP));
        kv(sb, 2, "HW Power Brake Slowdown", activeIf(gpu.getPowerDraw() > gpu.getPowerLimit()));
        kv(sb, 1, "Clocks", "");
        kv(sb, 2, "SM", gpu.getClocksSm() + " MHz");
        kv(sb, 2, "Memory", gpu.getClocksMem() + " MHz");
      }
      if (all || sections.contains("MEMORY")) {
        kv(sb, 1, "FB Memory Usage", "");
        kv(sb, 2, "Total", gpu.getMemoryTotal() + " MiB");
        kv(sb, 2, "Used", gpu.getMemoryUsed() + " MiB");
        kv(sb, 2, "Free", (gpu.getMemoryTotal() - gpu.getMemoryUsed()) + " MiB");
        kv(sb, 1, "Utilization", "");
        kv(sb, 2, "Gpu", String.format("%.0f %%", gpu.getUtilization()));
      }
      if (all || sections.contains("ECC")) {
        EccErrors ecc = ecc(gpu);
        kv(sb, 1, "ECC Mode", "");
        kv(sb, 2, "Current", gpu.isEccEnabled() ? "Enabled" : "Disabled");
        kv(sb, 1, "ECC Errors", "");
        kv(sb, 2, "Volatile", "");
        kv(sb, 3, "SRAM Correctable", String.valueOf(ecc.getSingleBit()));
        kv(sb, 3, "SRAM Uncorrectable", String.valueOf(ecc.getDoubleBit()));
        kv(sb, 2, "Aggregate", "");
        kv(sb, 3, "SRAM Correctable", String.valueOf(ecc.getAggregatedSingleBit()));
        kv(sb, 3, "SRAM Uncorrectable", String.valueOf(ecc.getAggregatedDoubleBit()));
      }
      if (all || sections.contains("TEMPERATURE")) {
        kv(sb, 1, "Temperature", "");
        kv(sb, 2, "GPU Current Temp", String.format("%.0f C", gpu.getTemperature()));
        kv(sb, 2, "GPU Shutdown Temp", String.format("%.0f C", SHUTDOWN_TEMP));
        kv(sb, 2, "GPU Slowdown Temp", String.format("%.0f C", SLOWDOWN_TEMP));
      }
      if (all || sections.contains("POWER")) {
        kv(sb, 1, "GPU Power Readings", "");
        kv(sb, 2, "Power Draw", String.format("%.2f W", gpu.getPowerDraw()));
        kv(sb, 2, "Current Power Limit", String.format("%.2f W", gpu.getPowerLimit()));
        kv(sb, 2, "Min Power Limit", String.format("%.2f W", MIN_POWER_LIMIT));
        kv(sb, 2, "Max Power Limit", String.format("%.2f W", MAX_POWER_LIMIT));
      }
      sb.append('\n');
    }
    return createSuccess(sb.toString());
  }

  private static void appendXids(StringBuilder sb, Gpu gpu) {
    if (gpu.getXidErrors().isEmpty()) {
      kv(sb, 1, "Xid Errors", "None");
      return;
    }
    kv(sb, 1, "Xid Errors", "");
    for (XidError xid : gpu.getXidErrors()) {
      kv(sb, 2, "Xid " + xid.code(), xid.description());
    }
  }

  private static void appendNvLinkSummary(StringBuilder sb, Gpu gpu) {
    long down = gpu.getNvlinks().stream().filter(l -> !l.isActive()).count();
    kv(sb, 1, "NVLink", gpu.getNvlinks().size() + " links, " + down + " down");
  }

  private static void kv(StringBuilder sb, int depth, String key, String value) {
    String indent = "    ".repeat(depth);
    String label = String.format("%-" + Math.max(1, 42 - indent.length()) + "s", key);
    sb.append(indent).append(label);
    if (!value.isEmpty()) {
      sb.append(": ").append(value);
    }
    sb.append('\n');
  }

  private CommandResult setPowerLimit(
      ParsedCommand parsed, DgxNode node, List<Gpu> gpus, CommandContext context) {
    Optional<Double> watts = parseDouble(parsed.flagValue("pl", "power-limit").orElse(null));
    if (watts.isEmpty()) {
      return usageError("Option -pl requires a power limit in watts.");
    }
    if (gpus.isEmpty()) {
      return createError("No devices were found", EXIT_NOT_FOUND);
    }
    if (watts.get() < MIN_POWER_LIMIT || watts.get() > MAX_POWER_LIMIT) {
      return createError(
          String.format(
              "Provided power limit %.2f W is not a valid power limit which should be between "
                  + "%.2f W and %.2f W for GPU %s%nTerminating early due to previous errors.",
              watts.get(),
              MIN_POWER_LIMIT,
              MAX_POWER_LIMIT,
              gpus.get(0).getPciAddress()),
          EXIT_INVALID_ARGUMENT);
    }
    StringBuilder sb = new StringBuilder();
    StateMutator mutator = resolveMutator(context);
    for (Gpu gpu : gpus) {
      double previous = gpu.getPowerLimit();
      mutator.updateGpu(
          node.getId(),
          gpu.getId(),
          GpuUpdate.builder().powerLimit(watts.get()).build(),
          METADATA.name());
      sb.append(
          String.format(
              "Power limit for GPU %s was set to %.2f W from %.2f W.%n",
              gpu.getPciAddress(), watts.get(), previous));
    }
    sb.append("All done.");
    return createSuccess(sb.toString());
  }

  private CommandResult setPersistenceMode(
      ParsedCommand parsed, DgxNode node, List<Gpu> gpus, CommandContext context) {
    Optional<Boolean> enabled = parseSwitch(parsed.flagValue("pm", "persistence-mode"));
    if (enabled.isEmpty()) {
      return usageError("Option -pm requires 0/DISABLED or 1/ENABLED.");
    }
    StateMutator mutator = resolveMutator(context);
    StringBuilder sb = new StringBuilder();
    for (Gpu gpu : gpus) {
      mutator.updateGpu(
          node.getId(),
          gpu.getId(),
          GpuUpdate.builder().persistenceMode(enabled.get()).build(),
          METADATA.name());
      sb.append(enabled.get() ? "Enabled" : "Disabled")
          .append(" persistence mode for GPU ")
          .append(gpu.getPciAddress())
          .append(".\n");
    }
    sb.append("All done.");
    return createSuccess(sb.toString());
  }

  private CommandResult setMigMode(
      ParsedCommand parsed, DgxNode node, List<Gpu> gpus, CommandContext context) {
    Optional<Boolean> enabled = parseSwitch(parsed.flagValue("mig", "multi-instance-gpu"));
    if (enabled.isEmpty()) {
      return usageError("Option -mig requires 0/DISABLED or 1/ENABLED.");
    }
    StateMutator mutator = resolveMutator(context);
    StringBuilder sb = new StringBuilder();
    for (Gpu gpu : gpus) {
      mutator.setMigMode(node.getId(), gpu.getId(), enabled.get(), METADATA.name());
      sb.append(enabled.get() ? "Enabled" : "Disabled")
          .append(" MIG Mode for GPU ")
          .append(gpu.getPciAddress())
          .append('\n');
    }
    sb.append("All done.");
    return createSuccess(sb.toString());
  }

  private CommandResult reset(DgxNode node, List<Gpu> gpus, CommandContext context) {
    StateMutator mutator = resolveMutator(context);
    StringBuilder sb = new StringBuilder();
    for (Gpu gpu : gpus) {
      mutator.updateGpu(
          node.getId(),
          gpu.getId(),
          GpuUpdate.builder()
              .clearXidErrors()
              .healthStatus(HealthStatus.OK)
              .utilization(0)
              .build(),
          METADATA.name());
      sb.append("GPU ").append(gpu.getPciAddress()).append(" was successfully reset.\n");
    }
    sb.append("All done.");
    return createSuccess(sb.toString());
  }

  private CommandResult nvlinkStatus(List<Gpu> gpus) {
    StringBuilder sb = new StringBuilder();
    for (Gpu gpu : gpus) {
      sb.append(gpuLine(gpu)).append('\n');
      for (NvLink link : gpu.getNvlinks()) {
        sb.append("\t Link ").append(link.getLinkId()).append(": ");
        sb.append(link.isActive() ? link.getSpeedGbps() + " GB/s" : "<inactive>").append('\n');
      }
    }
    return createSuccess(sb.toString());
  }

  private CommandResult topology(DgxNode node) {
    List<Gpu> gpus = node.getGpus();
    List<String> header = new ArrayList<>();
    header.add("");
    for (Gpu gpu : gpus) {
      header.add("GPU" + gpu.getId());
    }
    header.add("CPU Affinity");
    header.add("NUMA Affinity");
    List<List<String>> rows = new ArrayList<>();
    int half = Math.max(1, gpus.size() / 2);
    for (Gpu row : gpus) {
      List<String> cells = new ArrayList<>();
      cells.add("GPU" + row.getId());
      for (Gpu col : gpus) {
        cells.add(row.getId() == col.getId() ? "X" : "NV" + activeLinks(row));
      }
      boolean firstSocket = row.getId() < half;
      cells.add(firstSocket ? "0-55,112-167" : "56-111,168-223");
      cells.add(firstSocket ? "0" : "1");
      rows.add(cells);
    }
    String legend =
        "\nLegend:\n\n"
            + "  X    = Self\n"
            + "  SYS  = Connection traversing PCIe as well as the SMP interconnect between NUMA"
            + " nodes\n"
            + "  PIX  = Connection traversing at most a single PCIe bridge\n"
            + "  NV#  = Connection traversing a bonded set of # NVLinks\n";
    return createSuccess(TableFormatter.format(header, rows) + legend);
  }

  private static long activeLinks(Gpu gpu) {
    return gpu.getNvlinks().stream().filter(NvLink::isActive).count();
  }

  private CommandResult migInstances(List<Gpu> gpus) {
    List<List<String>> rows = new ArrayList<>();
    boolean anyMig = false;
    for (Gpu gpu : gpus) {
      if (!gpu.isMigMode()) {
        continue;
      }
      anyMig = true;
      for (MigInstance mi : gpu.getMigInstances()) {
        rows.add(
            List.of(
                String.valueOf(gpu.getId()),
                "MIG " + mi.profile(),
                String.valueOf(mi.gpuInstanceId()),
                mi.memoryMiB() + "MiB"));
      }
    }
    if (!anyMig) {
      return createError("No MIG-enabled devices found.", EXIT_NOT_FOUND);
    }
    return createSuccess(
        TableFormatter.format(
            List.of("GPU", "NAME", "INSTANCE ID", "MEMORY"), rows, "No GPU instances found."));
  }

  private static String gpuLine(Gpu gpu) {
    return String.format("GPU %d: %s (UUID: %s)", gpu.getId(), gpu.getName(), gpu.getUuid());
  }

  static String performanceState(Gpu gpu) {
    if (gpu.getHealthStatus() == HealthStatus.CRITICAL) {
      return "ERR!";
    }
    return gpu.getUtilization() > 0 || gpu.getTemperature() >= SLOWDOWN_TEMP ? "P2" : "P0";
  }

  private static EccErrors ecc(Gpu gpu) {
    return gpu.getEccErrors() == null ? new EccErrors() : gpu.getEccErrors();
  }

  private static String activeIf(boolean active) {
    return active ? "Active" : "Not Active";
  }

  private static Optional<Boolean> parseSwitch(Optional<String> value) {
    if (value.isEmpty()) {
      return Optional.empty();
    }
    return switch (value.get().toUpperCase(Locale.ROOT)) {
      case "1", "ENABLED" -> Optional.of(true);
      case "0", "DISABLED" -> Optional.of(false);
      default -> Optional.empty();
    };
  }

  private static String truncate(String s, int max) {
    return s.length() <= max ? s : s.substring(0, max);
  }
}
