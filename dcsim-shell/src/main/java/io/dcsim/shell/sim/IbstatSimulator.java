package io.dcsim.shell.sim;

import io.dcsim.shell.core.model.DgxNode;
import io.dcsim.shell.core.model.HostChannelAdapter;
import io.dcsim.shell.core.model.InfiniBandPort;
import io.dcsim.shell.core.parse.CommandParser;
import io.dcsim.shell.core.parse.ParsedCommand;
import io.dcsim.shell.core.sim.BaseSimulator;
import io.dcsim.shell.core.sim.CommandContext;
import io.dcsim.shell.core.sim.CommandResult;
import io.dcsim.shell.core.sim.SimulatorMetadata;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/** {@code ibstat}: InfiniBand HCA and port status of the current node. */
public final class IbstatSimulator extends BaseSimulator {
  private static final SimulatorMetadata METADATA =
      new SimulatorMetadata("ibstat", "5.9", "InfiniBand device status", List.of("ibstat"));

  private static final String USAGE =
      "Usage: ibstat [OPTIONS] <ca_name> [portnum]\n"
          + "Options:\n"
          + "  --list_of_cas, -l    list all IB devices\n"
          + "  --short, -s          short output\n"
          + "  --port_list, -p      show port list\n"
          + "  --help, -h           help message\n"
          + "  --version, -V        show version";

  @Override
  public SimulatorMetadata getMetadata() {
    return METADATA;
  }

  @Override
  public CommandResult execute(ParsedCommand parsed, CommandContext context) {
    if (parsed.hasFlag("h", "help")) {
      return createSuccess(USAGE);
    }
    if (parsed.hasFlag("V", "version")) {
      return createSuccess("ibstat BUILD VERSION: " + METADATA.version());
    }
    Optional<DgxNode> node = resolveCurrentNode(context);
    if (node.isEmpty()) {
      return createError("ibstat: no current node");
    }
    List<HostChannelAdapter> hcas = node.get().getHcas();
    if (hcas.isEmpty()) {
      return createError("ibstat: no InfiniBand devices found");
    }
    if (parsed.hasFlag("l", "list_of_cas")) {
      StringBuilder sb = new StringBuilder();
      for (HostChannelAdapter hca : hcas) {
        sb.append(hca.getCaName()).append('\n');
      }
      return createSuccess(sb.toString());
    }

    // switches may have swallowed the CA name as a value, so read bare words from the raw line
    List<String> args = new ArrayList<>();
    List<String> words = CommandParser.tokenize(parsed.firstSegment());
    for (String word : words.subList(Math.min(1, words.size()), words.size())) {
      if (!CommandParser.isFlagShaped(word)) {
        args.add(word);
      }
    }
    List<HostChannelAdapter> selected = hcas;
    Optional<Integer> portFilter = Optional.empty();
    if (!args.isEmpty()) {
      String caName = args.get(0);
      Optional<HostChannelAdapter> hca =
          hcas.stream().filter(h -> h.getCaName().equals(caName)).findFirst();
      if (hca.isEmpty()) {
        return createError("ibstat: CA '" + caName + "' not found");
      }
      selected = List.of(hca.get());
      if (args.size() > 1) {
        Optional<Integer> port = parseInt(args.get(1));
        if (port.isEmpty()
            || hca.get().getPorts().stream().noneMatch(p -> p.getPortNumber() == port.get())) {
          return createError("ibstat: port " + args.get(1) + " not found on " + caName);
        }
        portFilter = port;
      }
    }

    boolean portList = parsed.hasFlag("p", "port_list");
    boolean brief = parsed.hasFlag("s", "short");
    StringBuilder sb = new StringBuilder();
    for (HostChannelAdapter hca : selected) {
      if (portList) {
        for (InfiniBandPort port : hca.getPorts()) {
          sb.append(port.getGuid()).append('\n');
        }
        continue;
      }
      if (portFilter.isEmpty()) {
        appendCa(sb, hca, brief);
      }
      for (InfiniBandPort port : hca.getPorts()) {
        if (portFilter.isEmpty() || portFilter.get() == port.getPortNumber()) {
          appendPort(sb, port, brief, portFilter.isEmpty() ? "\t\t" : "");
        }
      }
    }
    return createSuccess(sb.toString());
  }

  private static void appendCa(StringBuilder sb, HostChannelAdapter hca, boolean brief) {
    sb.append("CA '").append(hca.getCaName()).append("'\n");
    sb.append("\tCA type: ").append(hca.getCaType()).append('\n');
    sb.append("\tNumber of ports: ").append(hca.getPorts().size()).append('\n');
    if (!brief) {
      sb.append("\tFirmware version: ").append(hca.getFirmwareVersion()).append('\n');
      sb.append("\tHardware version: 0\n");
    }
  }

  private static void appendPort(
      StringBuilder sb, InfiniBandPort port, boolean brief, String indent) {
    String head = indent.isEmpty() ? "" : "\t";
    sb.append(head).append("Port ").append(port.getPortNumber()).append(":\n");
    sb.append(indent).append("State: ").append(port.getState()).append('\n');
    sb.append(indent).append("Physical state: ").append(port.getPhysicalState()).append('\n');
    sb.append(indent).append("Rate: ").append(port.getRateGbps()).append('\n');
    if (brief) {
      return;
    }
    sb.append(indent).append("Base lid: ").append(port.getLid()).append('\n');
    sb.append(indent).append("LMC: 0\n");
    sb.append(indent).append("SM lid: 1\n");
    sb.append(indent).append("Port GUID: ").append(port.getGuid()).append('\n');
    sb.append(indent).append("Link layer: InfiniBand\n");
  }
}
