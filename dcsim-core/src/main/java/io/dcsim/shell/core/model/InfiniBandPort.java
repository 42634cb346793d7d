package io.dcsim.shell.core.model;

/** One port of an InfiniBand host channel adapter. */
public final class InfiniBandPort {
  private int portNumber;
  private String state;
  private String physicalState;
  private int rateGbps;
  private int lid;
  private String guid;

  public InfiniBandPort() {}

  public InfiniBandPort(
      int portNumber, String state, String physicalState, int rateGbps, int lid, String guid) {
    this.portNumber = portNumber;
    this.state = state;
    this.physicalState = physicalState;
    this.rateGbps = rateGbps;
    this.lid = lid;
    this.guid = guid;
  }

  public int getPortNumber() {
    return portNumber;
  }

  public String getState() {
    return state;
  }

  public void setState(String state) {
    this.state = state;
  }

  public String getPhysicalState() {
    return physicalState;
  }

  public void setPhysicalState(String physicalState) {
    this.physicalState = physicalState;
  }

  public int getRateGbps() {
    return rateGbps;
  }

  public int getLid() {
    return lid;
  }

  public String getGuid() {
    return guid;
  }

  public InfiniBandPort copy() {
    return new InfiniBandPort(portNumber, state, physicalState, rateGbps, lid, guid);
  }
}
