package io.dcsim.shell.core.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Typed partial update of a {@link Gpu}. Only the fields that were set on the builder are
 * applied; everything else on the target GPU is left untouched.
 */
public final class GpuUpdate {
  private final Double temperature;
  private final Double powerDraw;
  private final Double powerLimit;
  private final Integer memoryUsed;
  private final Double utilization;
  private final HealthStatus healthStatus;
  private final Boolean persistenceMode;
  private final EccErrors eccErrors;
  private final Boolean clearXidErrors;
  private final Map<Integer, String> linkStatus;

  private GpuUpdate(Builder b) {
    this.temperature = b.temperature;
    this.powerDraw = b.powerDraw;
    this.powerLimit = b.powerLimit;
    this.memoryUsed = b.memoryUsed;
    this.utilization = b.utilization;
    this.healthStatus = b.healthStatus;
    this.persistenceMode = b.persistenceMode;
    this.eccErrors = b.eccErrors == null ? null : b.eccErrors.copy();
    this.clearXidErrors = b.clearXidErrors;
    this.linkStatus = Collections.unmodifiableMap(new LinkedHashMap<>(b.linkStatus));
  }

  public static Builder builder() {
    return new Builder();
  }

  /** Applies the set fields to {@code gpu}. */
  public void applyTo(Gpu gpu) {
    if (temperature != null) {
      gpu.setTemperature(temperature);
    }
    if (powerDraw != null) {
      gpu.setPowerDraw(powerDraw);
    }
    if (powerLimit != null) {
      gpu.setPowerLimit(powerLimit);
    }
    if (memoryUsed != null) {
      gpu.setMemoryUsed(memoryUsed);
    }
    if (utilization != null) {
      gpu.setUtilization(utilization);
    }
    if (healthStatus != null) {
      gpu.setHealthStatus(healthStatus);
    }
    if (persistenceMode != null) {
      gpu.setPersistenceMode(persistenceMode);
    }
    if (eccErrors != null) {
      gpu.setEccErrors(eccErrors.copy());
    }
    if (Boolean.TRUE.equals(clearXidErrors)) {
      gpu.getXidErrors().clear();
    }
    for (Map.Entry<Integer, String> e : linkStatus.entrySet()) {
      for (NvLink link : gpu.getNvlinks()) {
        if (link.getLinkId() == e.getKey()) {
          link.setStatus(e.getValue());
        }
      }
    }
  }

  /** The set fields, keyed by field name, for mutation logs and exports. */
  public Map<String, Object> describe() {
    Map<String, Object> out = new LinkedHashMap<>();
    if (temperature != null) {
      out.put("temperature", temperature);
    }
    if (powerDraw != null) {
      out.put("powerDraw", powerDraw);
    }
    if (powerLimit != null) {
      out.put("powerLimit", powerLimit);
    }
    if (memoryUsed != null) {
      out.put("memoryUsed", memoryUsed);
    }
    if (utilization != null) {
      out.put("utilization", utilization);
    }
    if (healthStatus != null) {
      out.put("healthStatus", healthStatus.label());
    }
    if (persistenceMode != null) {
      out.put("persistenceMode", persistenceMode);
    }
    if (eccErrors != null) {
      out.put("eccSingleBit", eccErrors.getSingleBit());
      out.put("eccDoubleBit", eccErrors.getDoubleBit());
    }
    if (clearXidErrors != null) {
      out.put("clearXidErrors", clearXidErrors);
    }
    if (!linkStatus.isEmpty()) {
      out.put("nvlinks", new LinkedHashMap<>(linkStatus));
    }
    return out;
  }

  public boolean isEmpty() {
    return describe().isEmpty();
  }

  public static final class Builder {
    private Double temperature;
    private Double powerDraw;
    private Double powerLimit;
    private Integer memoryUsed;
    private Double utilization;
    private HealthStatus healthStatus;
    private Boolean persistenceMode;
    private EccErrors eccErrors;
    private Boolean clearXidErrors;
    private final Map<Integer, String> linkStatus = new LinkedHashMap<>();

    private Builder() {}

    public Builder temperature(double value) {
      this.temperature = value;
      return this;
    }

    public Builder powerDraw(double value) {
      this.powerDraw = value;
      return this;
    }

    public Builder powerLimit(double value) {
      this.powerLimit = value;
      return this;
    }

    public Builder memoryUsed(int value) {
      this.memoryUsed = value;
      return this;
    }

    public Builder utilization(double value) {
      this.utilization = value;
      return this;
    }

    public Builder healthStatus(HealthStatus value) {
      this.healthStatus = value;
      return this;
    }

    public Builder persistenceMode(boolean value) {
      this.persistenceMode = value;
      return this;
    }

    public Builder eccErrors(EccErrors value) {
      this.eccErrors = value;
      return this;
    }

    public Builder clearXidErrors() {
      this.clearXidErrors = Boolean.TRUE;
      return this;
    }

    public Builder linkStatus(int linkId, String status) {
      linkStatus.put(linkId, status);
      return this;
    }

    public GpuUpdate build() {
      return new GpuUpdate(this);
    }
  }
}
