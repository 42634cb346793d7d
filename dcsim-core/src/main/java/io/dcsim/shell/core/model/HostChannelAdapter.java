package io.dcsim.shell.core.model;

import java.util.ArrayList;
import java.util.List;

/** An InfiniBand HCA (ConnectX) installed in a node. */
public final class HostChannelAdapter {
  private String caName;
  private String caType;
  private String firmwareVersion;
  private List<InfiniBandPort> ports = new ArrayList<>();

  public HostChannelAdapter() {}

  public HostChannelAdapter(String caName, String caType, String firmwareVersion) {
    this.caName = caName;
    this.caType = caType;
    this.firmwareVersion = firmwareVersion;
  }

  public String getCaName() {
    return caName;
  }

  public String getCaType() {
    return caType;
  }

  public String getFirmwareVersion() {
    return firmwareVersion;
  }

  public List<InfiniBandPort> getPorts() {
    return ports;
  }

  public HostChannelAdapter copy() {
    HostChannelAdapter copy = new HostChannelAdapter(caName, caType, firmwareVersion);
    for (InfiniBandPort port : ports) {
      copy.ports.add(port.copy());
    }
    return copy;
  }
}
