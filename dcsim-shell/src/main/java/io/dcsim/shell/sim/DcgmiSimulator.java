package io.dcsim.shell.sim;

import io.dcsim.shell.core.model.DgxNode;
import io.dcsim.shell.core.model.EccErrors;
import io.dcsim.shell.core.model.Gpu;
import io.dcsim.shell.core.model.GpuUpdate;
import io.dcsim.shell.core.model.HealthStatus;
import io.dcsim.shell.core.model.XidError;
import io.dcsim.shell.core.parse.ParsedCommand;
import io.dcsim.shell.core.sim.BaseSimulator;
import io.dcsim.shell.core.sim.CommandContext;
import io.dcsim.shell.core.sim.CommandResult;
import io.dcsim.shell.core.sim.SimulatorMetadata;
import io.dcsim.shell.core.state.StateMutator;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * {@code dcgmi}: the DCGM command line client against the GPUs of the current node.
 *
 * <p>Only the default group 0 (every GPU on the node) exists. {@code diag} is the one writer: a
 * GPU that a diagnostic finds in a worse condition than its recorded health is marked with the
 * diagnosed status.
 */
public final class DcgmiSimulator extends BaseSimulator {
  static final int EXIT_FAILURE = 1;
  static final int DEFAULT_GROUP = 0;
  static final double MEMORY_FULL_RATIO = 0.95;

  private static final SimulatorMetadata METADATA =
      new SimulatorMetadata(
          "dcgmi", "3.1.8", "NVIDIA Data Center GPU Manager client", List.of("dcgmi"));

  private static final String USAGE =
      "Usage: dcgmi <subsystem>\n"
          + "Subsystems: discovery, health, diag, stats, dmon\n"
          + "Run 'dcgmi --help' for details.";

  private static final String DIAG_RULE =
      "+---------------------------+------------------------------------------------+";

  /** DCGM field id to column tag and renderer, in the order dmon prints them. */
  private static final Map<Integer, Field> FIELDS = new LinkedHashMap<>();

  private static final String DEFAULT_FIELDS = "150,155,203,252";
  private static final long ENERGY_WINDOW_SECONDS = 3600;

  static {
    FIELDS.put(150, new Field("TMPTR", g -> String.format("%.0f", g.getTemperature())));
    FIELDS.put(155, new Field("POWER", g -> String.format("%.3f", g.getPowerDraw())));
    FIELDS.put(
        156,
        new Field(
            "TOTEC",
            g -> String.valueOf(Math.round(g.getPowerDraw() * ENERGY_WINDOW_SECONDS * 1000))));
    FIELDS.put(203, new Field("GPUTL", g -> String.format("%.0f", g.getUtilization())));
    FIELDS.put(230, new Field("XIDER", DcgmiSimulator::lastXid));
    FIELDS.put(250, new Field("FBTTL", g -> String.valueOf(g.getMemoryTotal())));
    FIELDS.put(
        251, new Field("FBFRE", g -> String.valueOf(g.getMemoryTotal() - g.getMemoryUsed())));
    FIELDS.put(252, new Field("FBUSD", g -> String.valueOf(g.getMemoryUsed())));
  }

  private static final List<DiagTest> DIAG_TESTS =
      List.of(
          new DiagTest("Deployment", "Denylist", 1, g -> Verdict.PASS),
          new DiagTest("Deployment", "NVML Library", 1, g -> Verdict.PASS),
          new DiagTest("Deployment", "CUDA Main Library", 1, g -> Verdict.PASS),
          new DiagTest("Deployment", "Permissions and OS Blocks", 1, g -> Verdict.PASS),
          new DiagTest("Deployment", "Persistence Mode", 1, DcgmiSimulator::persistence),
          new DiagTest("Deployment", "Environment Variables", 1, g -> Verdict.PASS),
          new DiagTest("Deployment", "Page Retirement/Row Remap", 1, DcgmiSimulator::rowRemap),
          new DiagTest("Deployment", "Graphics Processes", 1, g -> Verdict.PASS),
          new DiagTest("Deployment", "Inforom", 1, g -> Verdict.PASS),
          new DiagTest("Integration", "PCIe", 2, DcgmiSimulator::pcie),
          new DiagTest("Integration", "NVLink", 2, DcgmiSimulator::nvlink),
          new DiagTest("Hardware", "GPU Memory", 2, DcgmiSimulator::gpuMemory),
          new DiagTest("Hardware", "Diagnostic", 3, DcgmiSimulator::diagnostic),
          new DiagTest("Stress", "Targeted Stress", 3, DcgmiSimulator::thermal),
          new DiagTest("Stress", "Targeted Power", 3, DcgmiSimulator::power),
          new DiagTest("Stress", "Memory Bandwidth", 3, DcgmiSimulator::bandwidth));

  private record Field(String tag, Function<Gpu, String> value) {}

  private record DiagTest(
      String category, String name, int level, Function<Gpu, Verdict> check) {}

  /** Outcome of one check on one GPU; {@code status} OK means pass. */
  record Verdict(HealthStatus status, String detail) {
    static final Verdict PASS = new Verdict(HealthStatus.OK, "");
  }

  /** A health watch finding on one GPU. */
  record Incident(String system, HealthStatus severity, String detail) {}

  @Override
  public SimulatorMetadata getMetadata() {
    return METADATA;
  }

  @Override
  public CommandResult execute(ParsedCommand parsed, CommandContext context) {
    if (parsed.hasFlag("version")) {
      return createSuccess("dcgmi version: " + METADATA.version());
    }
    Optional<String> sub = parsed.subcommand(0);
    if (sub.isEmpty()) {
      return usageError(USAGE);
    }
    Optional<DgxNode> node = resolveCurrentNode(context);
    if (node.isEmpty()) {
      return createError(
          "Error: unable to connect to host engine. Host engine connection invalid/disconnected.",
          EXIT_FAILURE);
    }
    Optional<Integer> group = parseInt(parsed.flagValue("g", "group", "group-id").orElse("0"));
    if (group.isEmpty() || group.get() != DEFAULT_GROUP) {
      return createError(
          "Error: group "
              + parsed.flagValue("g", "group", "group-id").orElse("")
              + " does not exist. Use group 0 for all GPUs.",
          EXIT_FAILURE);
    }
    List<Gpu> gpus = node.get().getGpus();
    return switch (sub.get()) {
      case "discovery" -> discovery(parsed, gpus);
      case "health" -> health(parsed, gpus);
      case "diag" -> diag(parsed, node.get(), context);
      case "stats" -> stats(parsed);
      case "dmon" -> dmon(parsed, gpus);
      default -> usageError("dcgmi: unknown subsystem '" + sub.get() + "'\n" + USAGE);
    };
  }

  private CommandResult discovery(ParsedCommand parsed, List<Gpu> gpus) {
    if (!parsed.hasFlag("l", "list")) {
      return usageError("Missing required flag: -l (list the GPUs on the host)");
    }
    String rule =
        "+--------+----------------------------------------------------------------------+";
    StringBuilder sb = new StringBuilder();
    sb.append(gpus.size()).append(" GPU(s) found.\n");
    sb.append(rule).append('\n');
    sb.append(String.format("| %-6s | %-68s |%n", "GPU ID", "Device Information"));
    sb.append(rule).append('\n');
    for (Gpu gpu : gpus) {
      sb.append(String.format("| %-6d | %-68s |%n", gpu.getId(), "Name: " + gpu.getName()));
      sb.append(String.format("| %-6s | %-68s |%n", "", "PCI Bus ID: " + gpu.getPciAddress()));
      sb.append(String.format("| %-6s | %-68s |%n", "", "Device UUID: " + gpu.getUuid()));
      sb.append(rule).append('\n');
    }
    return createSuccess(sb.toString());
  }

  private CommandResult health(ParsedCommand parsed, List<Gpu> gpus) {
    if (!parsed.hasFlag("c", "check")) {
      return usageError("Missing required flag: -c (check the health watches)");
    }
    HealthStatus overall = HealthStatus.OK;
    StringBuilder rows = new StringBuilder();
    for (Gpu gpu : gpus) {
      List<Incident> found = incidents(gpu);
      HealthStatus worst = HealthStatus.OK;
      for (Incident incident : found) {
        worst = worse(worst, incident.severity());
      }
      overall = worse(overall, worst);
      rows.append(healthRow("GPU " + gpu.getId() + ":", healthLabel(worst)));
      for (Incident incident : found) {
        rows.append(healthRow("  " + incident.system(), incident.detail()));
      }
    }
    StringBuilder sb = new StringBuilder();
    sb.append("Health monitoring report for group ").append(DEFAULT_GROUP).append('\n');
    sb.append(healthRow("Overall Health", healthLabel(overall)));
    sb.append(rows);
    return createSuccess(sb.toString());
  }

  private static String healthRow(String key, String value) {
    return String.format("| %-26s | %s%n", key, value);
  }

  static String healthLabel(HealthStatus status) {
    return switch (status) {
      case OK -> "Healthy";
      case WARNING -> "Warning";
      case CRITICAL -> "Failure";
      case UNKNOWN -> "Unknown";
    };
  }

  /** What the DCGM health watches report for one GPU, in a stable order. */
  static List<Incident> incidents(Gpu gpu) {
    List<Incident> out = new ArrayList<>();
    for (XidError xid : gpu.getXidErrors()) {
      HealthStatus severity =
          xid.severity() == HealthStatus.CRITICAL ? HealthStatus.CRITICAL : HealthStatus.WARNING;
      out.add(
          new Incident("Driver", severity, "Xid " + xid.code() + ": " + xid.description()));
    }
    EccErrors ecc = gpu.getEccErrors();
    if (ecc != null && ecc.getDoubleBit() > 0) {
      out.add(
          new Incident(
              "Memory",
              HealthStatus.CRITICAL,
              ecc.getDoubleBit() + " uncorrectable ECC error(s) detected"));
    } else if (ecc != null && ecc.getSingleBit() > 0) {
      out.add(
          new Incident(
              "Memory",
              HealthStatus.WARNING,
              ecc.getSingleBit() + " correctable ECC error(s) detected"));
    }
    long down = gpu.getNvlinks().stream().filter(l -> !l.isActive()).count();
    if (down > 0) {
      out.add(new Incident("NVLink", HealthStatus.WARNING, down + " NVLink link(s) down"));
    }
    if (gpu.getTemperature() >= NvidiaSmiSimulator.SHUTDOWN_TEMP) {
      out.add(
          new Incident(
              "Thermal",
              HealthStatus.CRITICAL,
              String.format("Temperature %.0f C at or above shutdown", gpu.getTemperature())));
    } else if (gpu.getTemperature() >= NvidiaSmiSimulator.SLOWDOWN_TEMP) {
      out.add(
          new Incident(
              "Thermal",
              HealthStatus.WARNING,
              String.format("Temperature %.0f C at or above slowdown", gpu.getTemperature())));
    }
    if (gpu.getPowerDraw() > gpu.getPowerLimit()) {
      out.add(
          new Incident(
              "Power",
              HealthStatus.WARNING,
              String.format(
                  "Power draw %.0f W exceeds limit %.0f W",
                  gpu.getPowerDraw(), gpu.getPowerLimit())));
    }
    boolean critical = out.stream().anyMatch(i -> i.severity() == HealthStatus.CRITICAL);
    if (gpu.getHealthStatus() == HealthStatus.CRITICAL && !critical) {
      out.add(new Incident("Driver", HealthStatus.CRITICAL, "GPU is not responding"));
    }
    return out;
  }

  private CommandResult diag(ParsedCommand parsed, DgxNode node, CommandContext context) {
    Optional<String> mode = parsed.flagValue("r", "run");
    if (mode.isEmpty()) {
      return usageError("Missing required flag: -r (diagnostic level 1, 2 or 3)");
    }
    Optional<Integer> level = parseInt(mode.get()).filter(l -> l >= 1 && l <= 3);
    if (level.isEmpty()) {
      return usageError(
          "Error: invalid diagnostic level '" + mode.get() + "': mode must be 1, 2 or 3.");
    }
    List<Gpu> gpus = node.getGpus();
    Map<Integer, HealthStatus> diagnosed = new LinkedHashMap<>();
    StringBuilder sb = new StringBuilder();
    sb.append(
        String.format(
            "Running level %d diagnostic on group %d (%d GPUs)%n",
            level.get(), DEFAULT_GROUP, gpus.size()));
    sb.append("Successfully ran diagnostic for group.\n");
    sb.append(DIAG_RULE).append('\n');
    sb.append(diagRow("Diagnostic", "Result"));
    sb.append(DIAG_RULE.replace('-', '=')).append('\n');
    sb.append(diagSection("Metadata"));
    sb.append(diagRow("DCGM Version", METADATA.version()));
    sb.append(diagRow("Driver Version Detected", node.getNvidiaDriverVersion()));
    sb.append(diagRow("Number of GPUs Detected", String.valueOf(gpus.size())));

    String category = "";
    for (DiagTest test : DIAG_TESTS) {
      if (test.level() > level.get()) {
        continue;
      }
      if (!test.category().equals(category)) {
        category = test.category();
        sb.append(diagSection(category));
      }
      Map<Gpu, Verdict> problems = new LinkedHashMap<>();
      for (Gpu gpu : gpus) {
        Verdict verdict = test.check().apply(gpu);
        if (verdict.status() != HealthStatus.OK) {
          problems.put(gpu, verdict);
          diagnosed.merge(gpu.getId(), verdict.status(), DcgmiSimulator::worse);
        }
      }
      if (problems.isEmpty()) {
        sb.append(diagRow(test.name(), "Pass"));
        continue;
      }
      appendProblems(sb, test.name(), problems);
    }
    sb.append(DIAG_RULE);

    StateMutator mutator = resolveMutator(context);
    for (Gpu gpu : gpus) {
      HealthStatus status = diagnosed.get(gpu.getId());
      if (status != null && rank(status) > rank(gpu.getHealthStatus())) {
        mutator.updateGpu(
            node.getId(),
            gpu.getId(),
            GpuUpdate.builder().healthStatus(status).build(),
            METADATA.name());
      }
    }
    return diagnosed.isEmpty()
        ? createSuccess(sb.toString())
        : createError(sb.toString(), EXIT_FAILURE);
  }

  private static void appendProblems(StringBuilder sb, String name, Map<Gpu, Verdict> problems) {
    String failed = ids(problems, HealthStatus.CRITICAL);
    String warned = ids(problems, HealthStatus.WARNING);
    String first = name;
    if (!failed.isEmpty()) {
      sb.append(diagRow(first, "Fail - GPU: " + failed));
      first = "";
    }
    if (!warned.isEmpty()) {
      sb.append(diagRow(first, "Warn - GPU: " + warned));
    }
    for (Map.Entry<Gpu, Verdict> entry : problems.entrySet()) {
      sb.append(diagRow("", "GPU " + entry.getKey().getId() + ": " + entry.getValue().detail()));
    }
  }

  private static String ids(Map<Gpu, Verdict> problems, HealthStatus status) {
    return problems.entrySet().stream()
        .filter(e -> e.getValue().status() == status)
        .map(e -> String.valueOf(e.getKey().getId()))
        .collect(Collectors.joining(", "));
  }

  private static String diagRow(String key, String value) {
    return String.format("| %-25s | %-46s |%n", key, value);
  }

  private static String diagSection(String name) {
    String label = "-----  " + name + "  ";
    return "|"
        + label
        + "-".repeat(Math.max(0, 27 - label.length()))
        + "+"
        + "-".repeat(48)
        + "|\n";
  }

  private static Verdict persistence(Gpu gpu) {
    return gpu.isPersistenceMode()
        ? Verdict.PASS
        : new Verdict(HealthStatus.WARNING, "persistence mode is disabled");
  }

  private static Verdict rowRemap(Gpu gpu) {
    EccErrors ecc = gpu.getEccErrors();
    return ecc != null && ecc.getDoubleBit() > 0
        ? new Verdict(HealthStatus.CRITICAL, "pending row remap after uncorrectable errors")
        : Verdict.PASS;
  }

  private static Verdict pcie(Gpu gpu) {
    return gpu.getXidErrors().stream().anyMatch(x -> x.code() == 79)
        ? new Verdict(HealthStatus.CRITICAL, "GPU has fallen off the bus (Xid 79)")
        : Verdict.PASS;
  }

  private static Verdict nvlink(Gpu gpu) {
    long down = gpu.getNvlinks().stream().filter(l -> !l.isActive()).count();
    return down == 0
        ? Verdict.PASS
        : new Verdict(HealthStatus.CRITICAL, down + " NVLink link(s) down");
  }

  private static Verdict gpuMemory(Gpu gpu) {
    EccErrors ecc = gpu.getEccErrors();
    if (ecc != null && ecc.getDoubleBit() > 0) {
      return new Verdict(HealthStatus.CRITICAL, ecc.getDoubleBit() + " uncorrectable ECC errors");
    }
    if (gpu.getMemoryUsed() >= gpu.getMemoryTotal() * MEMORY_FULL_RATIO) {
      return new Verdict(HealthStatus.WARNING, "not enough free framebuffer to test");
    }
    return Verdict.PASS;
  }

  private static Verdict diagnostic(Gpu gpu) {
    boolean criticalXid =
        gpu.getXidErrors().stream().anyMatch(x -> x.severity() == HealthStatus.CRITICAL);
    return criticalXid || gpu.getHealthStatus() == HealthStatus.CRITICAL
        ? new Verdict(HealthStatus.CRITICAL, "GPU failed the compute diagnostic")
        : Verdict.PASS;
  }

  private static Verdict thermal(Gpu gpu) {
    if (gpu.getTemperature() >= NvidiaSmiSimulator.SHUTDOWN_TEMP) {
      return new Verdict(
          HealthStatus.CRITICAL, String.format("temperature %.0f C", gpu.getTemperature()));
    }
    if (gpu.getTemperature() >= NvidiaSmiSimulator.SLOWDOWN_TEMP) {
      return new Verdict(
          HealthStatus.WARNING,
          String.format("thermal slowdown at %.0f C", gpu.getTemperature()));
    }
    return Verdict.PASS;
  }

  private static Verdict power(Gpu gpu) {
    return gpu.getPowerDraw() > gpu.getPowerLimit()
        ? new Verdict(
            HealthStatus.CRITICAL,
            String.format("power draw %.0f W over limit", gpu.getPowerDraw()))
        : Verdict.PASS;
  }

  private static Verdict bandwidth(Gpu gpu) {
    EccErrors ecc = gpu.getEccErrors();
    return ecc != null && ecc.getSingleBit() > 0
        ? new Verdict(HealthStatus.WARNING, "correctable ECC errors during copy")
        : Verdict.PASS;
  }

  private CommandResult stats(ParsedCommand parsed) {
    if (parsed.hasFlag("e", "enable")) {
      return createSuccess("Successfully started process watches on group " + DEFAULT_GROUP + ".");
    }
    if (parsed.hasFlag("d", "disable")) {
      return createSuccess("Successfully stopped process watches on group " + DEFAULT_GROUP + ".");
    }
    return usageError("Missing required flag: -e (enable) or -d (disable)");
  }

  private CommandResult dmon(ParsedCommand parsed, List<Gpu> gpus) {
    List<Integer> ids = new ArrayList<>();
    for (String id : parsed.flagValue("e", "field-id").orElse(DEFAULT_FIELDS).split(",")) {
      Optional<Integer> fieldId = parseInt(id).filter(FIELDS::containsKey);
      if (fieldId.isEmpty()) {
        return usageError("Error: unsupported field id '" + id.trim() + "'");
      }
      ids.add(fieldId.get());
    }
    Optional<Integer> count = parseInt(parsed.flagValue("c", "count").orElse("1"));
    if (count.isEmpty() || count.get() < 1) {
      return usageError("Error: -c needs a positive sample count");
    }
    StringBuilder sb = new StringBuilder();
    sb.append(String.format("%-10s", "#Entity"));
    for (int id : ids) {
      sb.append(String.format("%-12s", FIELDS.get(id).tag()));
    }
    sb.append('\n').append("ID\n");
    for (int sample = 0; sample < count.get(); sample++) {
      for (Gpu gpu : gpus) {
        sb.append(String.format("%-10s", "GPU " + gpu.getId()));
        for (int id : ids) {
          sb.append(String.format("%-12s", FIELDS.get(id).value().apply(gpu)));
        }
        sb.append('\n');
      }
    }
    return createSuccess(sb.toString().stripTrailing());
  }

  private static String lastXid(Gpu gpu) {
    List<XidError> xids = gpu.getXidErrors();
    return xids.isEmpty() ? "0" : String.valueOf(xids.get(xids.size() - 1).code());
  }

  static HealthStatus worse(HealthStatus a, HealthStatus b) {
    return rank(b) > rank(a) ? b : a;
  }

  private static int rank(HealthStatus status) {
    return switch (status) {
      case OK, UNKNOWN -> 0;
      case WARNING -> 1;
      case CRITICAL -> 2;
    };
  }
}
