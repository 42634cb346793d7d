package io.dcsim.shell.core.model;

/** One NVLink of a GPU. */
public final class NvLink {
  public static final String ACTIVE = "Active";
  public static final String DOWN = "Down";

  private int linkId;
  private String status;
  private int speedGbps;
  private long txErrors;
  private long rxErrors;
  private long replayErrors;

  public NvLink() {}

  public NvLink(int linkId, String status, int speedGbps) {
    this.linkId = linkId;
    this.status = status;
    this.speedGbps = speedGbps;
  }

  public int getLinkId() {
    return linkId;
  }

  public String getStatus() {
    return status;
  }

  public void setStatus(String status) {
    this.status = status;
  }

  public boolean isActive() {
    return ACTIVE.equalsIgnoreCase(status);
  }

  public int getSpeedGbps() {
    return speedGbps;
  }

  public long getTxErrors() {
    return txErrors;
  }

  public void setTxErrors(long txErrors) {
    this.txErrors = txErrors;
  }

  public long getRxErrors() {
    return rxErrors;
  }

  public void setRxErrors(long rxErrors) {
    this.rxErrors = rxErrors;
  }

  public long getReplayErrors() {
    return replayErrors;
  }

  public void setReplayErrors(long replayErrors) {
    this.replayErrors = replayErrors;
  }

  public NvLink copy() {
    NvLink copy = new NvLink(linkId, status, speedGbps);
    copy.txErrors = txErrors;
    copy.rxErrors = rxErrors;
    copy.replayErrors = replayErrors;
    return copy;
  }
}
