package io.dcsim.shell.core.state;

import java.util.Optional;

/** Hardware conditions that can be injected into a GPU. */
public enum FaultType {
  XID_ERROR("xid-error"),
  THERMAL("thermal"),
  MEMORY_FULL("memory-full"),
  ECC_ERROR("ecc-error"),
  NVLINK_FAILURE("nvlink-failure"),
  GPU_HANG("gpu-hang"),
  POWER("power");

  private final String faultName;

  FaultType(String faultName) {
    this.faultName = faultName;
  }

  public String faultName() {
    return faultName;
  }

  public static Optional<FaultType> fromName(String name) {
    for (FaultType type : values()) {
      if (type.faultName.equalsIgnoreCase(name)) {
        return Optional.of(type);
      }
    }
    return Optional.empty();
  }
}
