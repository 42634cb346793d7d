package io.dcsim.shell.sim;

import io.dcsim.shell.core.model.DgxNode;
import io.dcsim.shell.core.model.Gpu;
import io.dcsim.shell.core.model.HostChannelAdapter;
import io.dcsim.shell.core.model.InfiniBandPort;
import io.dcsim.shell.core.model.NvLink;
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

/** Node identity and kernel log: {@code hostname}, {@code whoami}, {@code uname}, {@code dmesg}. */
public final class BasicSystemSimulator extends BaseSimulator {
  static final String DOMAIN = "cluster.local";

  private static final SimulatorMetadata METADATA =
      new SimulatorMetadata(
          "basic-system",
          "8.32",
          "Host identity and kernel log",
          List.of("hostname", "whoami", "uname", "dmesg"));

  private static final String KERNEL_BUILD = "#48-Ubuntu SMP Tue Nov 14 18:57:07 UTC 2023";
  private static final Instant DEFAULT_BOOT = Instant.parse("2024-01-15T08:00:00Z");
  private static final long BOOT_LEAD_MILLIS = 600_000L;
  private static final DateTimeFormatter CTIME =
      DateTimeFormatter.ofPattern("EEE MMM d HH:mm:ss yyyy", Locale.ROOT)
          .withZone(ZoneOffset.UTC);

  @Override
  public SimulatorMetadata getMetadata() {
    return METADATA;
  }

  @Override
  public CommandResult execute(ParsedCommand parsed, CommandContext context) {
    String base = parsed.baseCommand();
    if (parsed.hasFlag("version") || (!base.equals("uname") && parsed.hasFlag("V"))) {
      return createSuccess(base + " (GNU coreutils) " + METADATA.version());
    }
    if (base.equals("whoami")) {
      return whoami(context);
    }
    Optional<DgxNode> node = resolveCurrentNode(context);
    if (node.isEmpty()) {
      return createError(base + ": no current node");
    }
    return switch (base) {
      case "hostname" -> hostname(parsed, node.get(), context);
      case "uname" -> uname(parsed, node.get());
      case "dmesg" -> dmesg(parsed, node.get());
      default -> createError(base + ": command not found", CommandResult.NOT_FOUND);
    };
  }

  private CommandResult whoami(CommandContext context) {
    if (context.isRoot()) {
      return createSuccess("root");
    }
    return createSuccess(context.environment().getOrDefault("USER", "admin"));
  }

  private CommandResult hostname(ParsedCommand parsed, DgxNode node, CommandContext context) {
    String host = node.getHostname();
    if (parsed.hasFlag("i", "ip-address")) {
      int index = resolveAllNodes(context).indexOf(node);
      return createSuccess("10.10.0." + (11 + Math.max(0, index)));
    }
    if (parsed.hasFlag("f", "fqdn")) {
      return createSuccess(host + "." + DOMAIN);
    }
    if (parsed.hasFlag("s", "short")) {
      int dot = host.indexOf('.');
      return createSuccess(dot < 0 ? host : host.substring(0, dot));
    }
    return createSuccess(host);
  }

  private CommandResult uname(ParsedCommand parsed, DgxNode node) {
    boolean all = parsed.hasFlag("a", "all");
    List<String> parts = new ArrayList<>();
    if (all || parsed.hasFlag("s", "kernel-name")) {
      parts.add("Linux");
    }
    if (all || parsed.hasFlag("n", "nodename")) {
      parts.add(node.getHostname());
    }
    if (all || parsed.hasFlag("r", "kernel-release")) {
      parts.add(node.getKernelVersion());
    }
    if (all || parsed.hasFlag("v", "kernel-version")) {
      parts.add(KERNEL_BUILD);
    }
    if (all || parsed.hasFlag("m", "machine")) {
      parts.add("x86_64");
    }
    if (all) {
      parts.add("x86_64");
      parts.add("x86_64");
    }
    if (all || parsed.hasFlag("o", "operating-system")) {
      parts.add("GNU/Linux");
    }
    if (parts.isEmpty()) {
      parts.add("Linux");
    }
    return createSuccess(String.join(" ", parts));
  }

  // dmesg

  private record LogLine(long millis, String text) {}

  private CommandResult dmesg(ParsedCommand parsed, DgxNode node) {
    List<LogLine> events = new ArrayList<>();
    for (Gpu gpu : node.getGpus()) {
      String pci = kernelPci(gpu.getPciAddress());
      for (XidError xid : gpu.getXidErrors()) {
        events.add(
            new LogLine(
                xid.timestampMillis(),
                String.format(
                    "NVRM: Xid (PCI:%s): %d, pid='<unknown>', name=<unknown>, %s",
                    pci, xid.code(), xid.description())));
      }
    }
    events.sort(Comparator.comparingLong(LogLine::millis));

    long boot =
        events.isEmpty()
            ? DEFAULT_BOOT.toEpochMilli()
            : Math.min(events.get(0).millis() - BOOT_LEAD_MILLIS, DEFAULT_BOOT.toEpochMilli());
    List<LogLine> lines = new ArrayList<>();
    lines.add(new LogLine(boot, "Linux version " + node.getKernelVersion()
        + " (buildd@lcy02-amd64-011) " + KERNEL_BUILD));
    lines.add(new LogLine(boot, "Command line: BOOT_IMAGE=/boot/vmlinuz-"
        + node.getKernelVersion() + " root=/dev/md0 ro"));
    lines.add(new LogLine(boot + 1_250, "DMI: NVIDIA " + node.getSystemType() + "/"
        + node.getSystemType() + ", BIOS 1.21 09/05/2023"));
    lines.add(new LogLine(boot + 14_800, "nvidia: loading out-of-tree module taints kernel."));
    lines.add(new LogLine(boot + 15_100, "NVRM: loading NVIDIA UNIX x86_64 Kernel Module  "
        + node.getNvidiaDriverVersion()));
    for (Gpu gpu : node.getGpus()) {
      for (NvLink link : gpu.getNvlinks()) {
        if (!link.isActive()) {
          lines.add(new LogLine(boot + 16_000, String.format(
              "NVRM: GPU %s: NVLink link %d is down", gpu.getPciAddress(), link.getLinkId())));
        }
      }
    }
    for (String hca : hcaLines(node)) {
      lines.add(new LogLine(boot + 17_500, hca));
    }
    lines.addAll(events);

    boolean ctime = parsed.hasFlag("T", "ctime");
    StringBuilder sb = new StringBuilder();
    for (LogLine line : lines) {
      if (ctime) {
        sb.append('[').append(CTIME.format(Instant.ofEpochMilli(line.millis()))).append("] ");
      } else {
        sb.append(String.format("[%12.6f] ", (line.millis() - boot) / 1000.0));
      }
      sb.append(line.text()).append('\n');
    }
    return createSuccess(sb.toString());
  }

  private static List<String> hcaLines(DgxNode node) {
    List<String> lines = new ArrayList<>();
    for (HostChannelAdapter hca : node.getHcas()) {
      for (InfiniBandPort port : hca.getPorts()) {
        lines.add(
            String.format(
                "mlx5_core %s: Port %d link %s",
                hca.getCaName(), port.getPortNumber(), port.getState().toLowerCase(Locale.ROOT)));
      }
    }
    return lines;
  }

  /** {@code 00000000:18:00.0} as the driver logs it: {@code 0000:18:00}. */
  static String kernelPci(String busId) {
    String pci = busId;
    if (pci.length() > 12 && pci.startsWith("0000")) {
      pci = pci.substring(4);
    }
    int dot = pci.lastIndexOf('.');
    return dot > 0 ? pci.substring(0, dot) : pci;
  }
}
