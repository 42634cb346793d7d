package io.dcsim.shell.sim;

import io.dcsim.shell.core.model.BmcInfo;
import io.dcsim.shell.core.model.DgxNode;
import io.dcsim.shell.core.model.Gpu;
import io.dcsim.shell.core.model.HealthStatus;
import io.dcsim.shell.core.model.XidError;
import io.dcsim.shell.core.parse.ParsedCommand;
import io.dcsim.shell.core.sim.BaseSimulator;
import io.dcsim.shell.core.sim.CommandContext;
import io.dcsim.shell.core.sim.CommandResult;
import io.dcsim.shell.core.sim.SimulatorMetadata;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * {@code ipmitool}: the node's BMC as seen over IPMI.
 *
 * <p>Without {@code -H} the tool talks to the BMC of the current node; {@code -H} selects a node
 * by BMC address, node id or hostname. Reading the sensors also refreshes the BMC's view of node
 * health: a GPU past its upper critical threshold marks the node {@code WARNING}, past its
 * non-recoverable threshold {@code CRITICAL}. Nothing here ever improves node health.
 */
public final class IpmitoolSimulator extends BaseSimulator {
  static final int EXIT_FAILURE = 1;

  static final double GPU_UPPER_NON_CRITICAL = 85;
  static final double GPU_UPPER_CRITICAL = 90;
  static final double GPU_UPPER_NON_RECOVERABLE = 95;

  static final String SENSOR_COMMAND = "ipmitool sensor";

  private static final SimulatorMetadata METADATA =
      new SimulatorMetadata(
          "ipmitool",
          "1.8.18",
          "IPMI client for the baseboard management controller",
          List.of("ipmitool"));

  private static final String USAGE =
      "ipmitool version 1.8.18\n\n"
          + "usage: ipmitool [options...] <command>\n\n"
          + "       -h             This help\n"
          + "       -V             Show version information\n"
          + "       -I intf        Interface to use\n"
          + "       -H hostname    Remote host name for LAN interface\n"
          + "       -U username    Remote session username\n"
          + "       -P password    Remote session password\n\n"
          + "Commands:\n"
          + "\tsensor       Print detailed sensor information\n"
          + "\tsdr          Print Sensor Data Repository entries and readings\n"
          + "\tsel          Print System Event Log (SEL)\n"
          + "\tmc           Management Controller status and global enables\n"
          + "\tchassis      Get chassis status and set power state\n"
          + "\tlan          Configure LAN Channels";

  private static final Instant BOOT = Instant.parse("2024-01-15T08:00:00Z");
  private static final DateTimeFormatter SEL_DATE =
      DateTimeFormatter.ofPattern("MM/dd/yyyy", Locale.ROOT).withZone(ZoneOffset.UTC);
  private static final DateTimeFormatter SEL_TIME =
      DateTimeFormatter.ofPattern("HH:mm:ss", Locale.ROOT).withZone(ZoneOffset.UTC);

  private static final int FANS = 6;
  private static final int PSUS = 6;
  private static final double BASE_SYSTEM_WATTS = 1200;

  /** One threshold sensor; thresholds are null where the BMC has none. */
  record Sensor(String name, double value, String units, Double unc, Double ucr, Double unr) {
    String status() {
      if (unr != null && value >= unr) {
        return "nr";
      }
      if (ucr != null && value >= ucr) {
        return "cr";
      }
      if (unc != null && value >= unc) {
        return "nc";
      }
      return "ok";
    }
  }

  private record SelEntry(long millis, String sensor, String event) {}

  @Override
  public SimulatorMetadata getMetadata() {
    return METADATA;
  }

  @Override
  public CommandResult execute(ParsedCommand parsed, CommandContext context) {
    if (parsed.hasFlag("h")) {
      return createSuccess(USAGE);
    }
    if (parsed.hasFlag("V", "version")) {
      return createSuccess("ipmitool version " + METADATA.version());
    }
    // -I/-H/-U/-P come first, so the command words are positionals rather than subcommands.
    List<String> words = parsed.positionalArgs();
    if (words.isEmpty()) {
      return usageError(USAGE);
    }
    Optional<String> host = parsed.flagValue("H", "host");
    Optional<DgxNode> node =
        host.isPresent() ? findByHost(context, host.get()) : resolveCurrentNode(context);
    if (node.isEmpty() || node.get().getBmc() == null) {
      return host.isPresent()
          ? createError("Error: Unable to establish IPMI v2 / RMCP+ session", EXIT_FAILURE)
          : createError(
              "Could not open device at /dev/ipmi0 or /dev/ipmi/0 or /dev/ipmidev/0: "
                  + "No such file or directory",
              EXIT_FAILURE);
    }
    String action = words.size() > 1 ? words.get(1) : "";
    return switch (words.get(0)) {
      case "sensor" -> sensor(node.get(), action, words, context);
      case "sdr" -> sdr(node.get(), action);
      case "sel" -> sel(node.get(), action);
      case "mc" -> mc(node.get(), action);
      case "chassis" -> chassis(node.get(), words);
      case "lan" -> lan(node.get(), action);
      default -> usageError("Invalid command: " + words.get(0) + "\n\n" + USAGE);
    };
  }

  private Optional<DgxNode> findByHost(CommandContext context, String host) {
    return resolveAllNodes(context).stream()
        .filter(
            n ->
                host.equals(n.getId())
                    || host.equals(n.getHostname())
                    || (n.getBmc() != null && host.equals(n.getBmc().ipAddress())))
        .findFirst();
  }

  /** Threshold sensors of a node, derived from its GPUs. */
  static List<Sensor> sensors(DgxNode node) {
    List<Sensor> out = new ArrayList<>();
    double hottest = 0;
    double gpuWatts = 0;
    for (Gpu gpu : node.getGpus()) {
      hottest = Math.max(hottest, gpu.getTemperature());
      gpuWatts += gpu.getPowerDraw();
    }
    out.add(new Sensor("Inlet Temp", 24, "degrees C", 40.0, 45.0, 50.0));
    out.add(new Sensor("CPU0 Temp", 48, "degrees C", 90.0, 95.0, 100.0));
    out.add(new Sensor("CPU1 Temp", 47, "degrees C", 90.0, 95.0, 100.0));
    for (Gpu gpu : node.getGpus()) {
      out.add(
          new Sensor(
              "GPU" + gpu.getId() + " Temp",
              gpu.getTemperature(),
              "degrees C",
              GPU_UPPER_NON_CRITICAL,
              GPU_UPPER_CRITICAL,
              GPU_UPPER_NON_RECOVERABLE));
    }
    // Fans ramp with the hottest GPU.
    double rpm = Math.min(16000, 5000 + Math.max(0, hottest - 35) * 180);
    for (int i = 0; i < FANS; i++) {
      out.add(new Sensor("FAN" + i, Math.round(rpm), "RPM", null, null, null));
    }
    double psuWatts = (gpuWatts + BASE_SYSTEM_WATTS) / PSUS;
    for (int i = 0; i < PSUS; i++) {
      out.add(
          new Sensor("PSU" + i + " Power", Math.round(psuWatts), "Watts", 3000.0, 3300.0, null));
    }
    double total = Math.round(gpuWatts + BASE_SYSTEM_WATTS);
    out.add(new Sensor("Total Power", total, "Watts", null, null, null));
    return out;
  }

  private CommandResult sensor(
      DgxNode node, String action, List<String> words, CommandContext context) {
    List<Sensor> sensors = sensors(node);
    refreshNodeHealth(node, sensors, context);
    if (action.isEmpty() || action.equals("list")) {
      StringBuilder sb = new StringBuilder();
      for (Sensor sensor : sensors) {
        sb.append(sensorRow(sensor)).append('\n');
      }
      return createSuccess(sb.toString());
    }
    if (action.equals("get")) {
      if (words.size() < 3) {
        return usageError("usage: sensor get <id> ... [id]");
      }
      StringBuilder sb = new StringBuilder();
      for (String name : words.subList(2, words.size())) {
        Optional<Sensor> sensor =
            sensors.stream().filter(s -> s.name().equalsIgnoreCase(name)).findFirst();
        if (sensor.isEmpty()) {
          return createError("Sensor data record \"" + name + "\" not found!", EXIT_FAILURE);
        }
        Sensor s = sensor.get();
        sb.append("Locating sensor record...\n")
            .append("Sensor ID              : ").append(s.name()).append('\n')
            .append("Sensor Reading        : ").append(reading(s)).append(' ')
            .append(s.units()).append('\n')
            .append("Status                : ").append(s.status()).append('\n')
            .append("Upper non-critical    : ").append(threshold(s.unc())).append('\n')
            .append("Upper critical        : ").append(threshold(s.ucr())).append('\n')
            .append("Upper non-recoverable : ").append(threshold(s.unr())).append('\n');
      }
      return createSuccess(sb.toString());
    }
    return usageError("Invalid sensor command: " + action + "\nSensor Commands: list, get");
  }

  /** Raises node health to what the worst sensor implies. */
  private void refreshNodeHealth(DgxNode node, List<Sensor> sensors, CommandContext context) {
    HealthStatus implied = HealthStatus.OK;
    for (Sensor sensor : sensors) {
      if (sensor.status().equals("nr")) {
        implied = HealthStatus.CRITICAL;
      } else if (sensor.status().equals("cr") && implied != HealthStatus.CRITICAL) {
        implied = HealthStatus.WARNING;
      }
    }
    if (rank(implied) > rank(node.getHealthStatus())) {
      resolveMutator(context).updateNodeHealth(node.getId(), implied, SENSOR_COMMAND);
    }
  }

  private static int rank(HealthStatus status) {
    if (status == HealthStatus.CRITICAL) {
      return 2;
    }
    return status == HealthStatus.WARNING ? 1 : 0;
  }

  private static String sensorRow(Sensor s) {
    return String.format(
        "%-16s | %-10s | %-10s | %-6s | %-9s | %-9s | %-9s | %-9s | %-9s | %-9s",
        s.name(),
        reading(s),
        s.units(),
        s.status(),
        "na",
        "na",
        "na",
        threshold(s.unc()),
        threshold(s.ucr()),
        threshold(s.unr()));
  }

  private static String reading(Sensor s) {
    return String.format("%.3f", s.value());
  }

  private static String threshold(Double value) {
    return value == null ? "na" : String.format("%.3f", value);
  }

  private CommandResult sdr(DgxNode node, String action) {
    if (!action.isEmpty() && !action.equals("list")) {
      return usageError("Invalid sdr command: " + action + "\nSDR Commands: list");
    }
    StringBuilder sb = new StringBuilder();
    for (Sensor s : sensors(node)) {
      sb.append(
          String.format(
              "%-16s | %-17s | %s%n",
              s.name(), String.format("%.0f %s", s.value(), s.units()), s.status()));
    }
    return createSuccess(sb.toString());
  }

  /** SEL entries in time order: the boot event, then XIDs, then thermal assertions. */
  static List<String> selLines(DgxNode node) {
    List<SelEntry> entries = new ArrayList<>();
    entries.add(new SelEntry(BOOT.toEpochMilli(), "System Event #0x01", "Timestamp Clock Sync"));
    for (Gpu gpu : node.getGpus()) {
      for (XidError xid : gpu.getXidErrors()) {
        entries.add(
            new SelEntry(
                xid.timestampMillis(),
                "Critical Interrupt GPU" + gpu.getId(),
                "Xid " + xid.code() + ": " + xid.description()));
      }
    }
    entries.sort(Comparator.comparingLong(SelEntry::millis));
    long latest = entries.get(entries.size() - 1).millis();
    for (Gpu gpu : node.getGpus()) {
      if (gpu.getTemperature() >= GPU_UPPER_CRITICAL) {
        entries.add(
            new SelEntry(
                latest,
                "Temperature GPU" + gpu.getId() + " Temp",
                "Upper Critical going high"));
      }
    }
    List<String> lines = new ArrayList<>();
    for (int i = 0; i < entries.size(); i++) {
      SelEntry entry = entries.get(i);
      Instant at = Instant.ofEpochMilli(entry.millis());
      lines.add(
          String.format(
              "%4x | %s | %s | %s | %s | Asserted",
              i + 1, SEL_DATE.format(at), SEL_TIME.format(at), entry.sensor(), entry.event()));
    }
    return lines;
  }

  private CommandResult sel(DgxNode node, String action) {
    List<String> lines = selLines(node);
    return switch (action) {
      case "", "info" -> createSuccess(
          "SEL Information\n"
              + "Version          : 1.5 (v1.5, v2 compliant)\n"
              + "Entries          : " + lines.size() + "\n"
              + "Free Space       : " + (65535 - 16 * lines.size()) + " bytes\n"
              + "Percent Used     : 0%\n"
              + "Overflow         : false");
      case "list", "elist" -> createSuccess(String.join("\n", lines));
      default -> usageError("Invalid SEL command: " + action + "\nSEL Commands: info list elist");
    };
  }

  private CommandResult mc(DgxNode node, String action) {
    if (!action.equals("info")) {
      return usageError("MC Commands: info");
    }
    BmcInfo bmc = node.getBmc();
    return createSuccess(
        "Device ID                 : 32\n"
            + "Device Revision           : 1\n"
            + "Firmware Revision         : " + bmc.firmwareVersion() + "\n"
            + "IPMI Version              : 2.0\n"
            + "Manufacturer Name         : " + bmc.manufacturer() + "\n"
            + "Product Name              : " + node.getSystemType() + " BMC\n"
            + "Device Available          : yes\n"
            + "Provides Device SDRs      : yes");
  }

  private CommandResult chassis(DgxNode node, List<String> words) {
    String action = words.size() > 1 ? words.get(1) : "";
    String power = node.getBmc().powerState().toLowerCase(Locale.ROOT);
    if (action.equals("power")) {
      String op = words.size() > 2 ? words.get(2) : "";
      if (op.equals("status")) {
        return createSuccess("Chassis Power is " + power);
      }
      return usageError("chassis power Commands: status");
    }
    if (!action.equals("status")) {
      return usageError("Chassis Commands: status, power");
    }
    boolean overload =
        node.getGpus().stream().anyMatch(g -> g.getPowerDraw() > g.getPowerLimit());
    boolean cooling =
        node.getGpus().stream().anyMatch(g -> g.getTemperature() >= GPU_UPPER_NON_RECOVERABLE);
    return createSuccess(
        "System Power         : " + power + "\n"
            + "Power Overload       : " + overload + "\n"
            + "Power Interlock      : inactive\n"
            + "Main Power Fault     : false\n"
            + "Power Control Fault  : false\n"
            + "Power Restore Policy : always-on\n"
            + "Chassis Intrusion    : inactive\n"
            + "Front-Panel Lockout  : inactive\n"
            + "Drive Fault          : false\n"
            + "Cooling/Fan Fault    : " + cooling);
  }

  private CommandResult lan(DgxNode node, String action) {
    if (!action.equals("print")) {
      return usageError("LAN Commands: print");
    }
    BmcInfo bmc = node.getBmc();
    String ip = bmc.ipAddress();
    String gateway = ip.substring(0, ip.lastIndexOf('.') + 1) + "1";
    return createSuccess(
        "Set in Progress         : Set Complete\n"
            + "IP Address Source       : Static Address\n"
            + "IP Address              : " + ip + "\n"
            + "Subnet Mask             : 255.255.255.0\n"
            + "MAC Address             : " + bmc.macAddress() + "\n"
            + "Default Gateway IP      : " + gateway);
  }
}
