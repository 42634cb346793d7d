package io.dcsim.shell.core.model;

import java.util.ArrayList;
import java.util.List;

/** Mutable state of one simulated GPU. Every level of the graph is copied by {@link #copy()}. */
public final class Gpu {
  private int id;
  private String uuid;
  private String name;
  private String type;
  private String pciAddress;
  private double temperature;
  private double powerDraw;
  private double powerLimit;
  private int memoryTotal;
  private int memoryUsed;
  private double utilization;
  private int clocksSm;
  private int clocksMem;
  private boolean eccEnabled = true;
  private EccErrors eccErrors = new EccErrors();
  private boolean migMode;
  private List<MigInstance> migInstances = new ArrayList<>();
  private List<NvLink> nvlinks = new ArrayList<>();
  private HealthStatus healthStatus = HealthStatus.OK;
  private List<XidError> xidErrors = new ArrayList<>();
  private boolean persistenceMode;
  private String allocatedJobId;

  public Gpu() {}

  public Gpu(int id, String uuid, String name) {
    this.id = id;
    this.uuid = uuid;
    this.name = name;
    this.type = name;
  }

  public int getId() {
    return id;
  }

  public void setId(int id) {
    this.id = id;
  }

  public String getUuid() {
    return uuid;
  }

  public void setUuid(String uuid) {
    this.uuid = uuid;
  }

  public String getName() {
    return name;
  }

  public void setName(String name) {
    this.name = name;
  }

  public String getType() {
    return type;
  }

  public void setType(String type) {
    this.type = type;
  }

  public String getPciAddress() {
    return pciAddress;
  }

  public void setPciAddress(String pciAddress) {
    this.pciAddress = pciAddress;
  }

  public double getTemperature() {
    return temperature;
  }

  public void setTemperature(double temperature) {
    this.temperature = temperature;
  }

  public double getPowerDraw() {
    return powerDraw;
  }

  public void setPowerDraw(double powerDraw) {
    this.powerDraw = powerDraw;
  }

  public double getPowerLimit() {
    return powerLimit;
  }

  public void setPowerLimit(double powerLimit) {
    this.powerLimit = powerLimit;
  }

  public int getMemoryTotal() {
    return memoryTotal;
  }

  public void setMemoryTotal(int memoryTotal) {
    this.memoryTotal = memoryTotal;
  }

  public int getMemoryUsed() {
    return memoryUsed;
  }

  public void setMemoryUsed(int memoryUsed) {
    this.memoryUsed = memoryUsed;
  }

  public double getUtilization() {
    return utilization;
  }

  public void setUtilization(double utilization) {
    this.utilization = utilization;
  }

  public int getClocksSm() {
    return clocksSm;
  }

  public void setClocksSm(int clocksSm) {
    this.clocksSm = clocksSm;
  }

  public int getClocksMem() {
    return clocksMem;
  }

  public void setClocksMem(int clocksMem) {
    this.clocksMem = clocksMem;
  }

  public boolean isEccEnabled() {
    return eccEnabled;
  }

  public void setEccEnabled(boolean eccEnabled) {
    this.eccEnabled = eccEnabled;
  }

  public EccErrors getEccErrors() {
    return eccErrors;
  }

  public void setEccErrors(EccErrors eccErrors) {
    this.eccErrors = eccErrors;
  }

  public boolean isMigMode() {
    return migMode;
  }

  public void setMigMode(boolean migMode) {
    this.migMode = migMode;
  }

  public List<MigInstance> getMigInstances() {
    return migInstances;
  }

  public List<NvLink> getNvlinks() {
    return nvlinks;
  }

  public HealthStatus getHealthStatus() {
    return healthStatus;
  }

  public void setHealthStatus(HealthStatus healthStatus) {
    this.healthStatus = healthStatus;
  }

  public List<XidError> getXidErrors() {
    return xidErrors;
  }

  public boolean isPersistenceMode() {
    return persistenceMode;
  }

  public void setPersistenceMode(boolean persistenceMode) {
    this.persistenceMode = persistenceMode;
  }

  public String getAllocatedJobId() {
    return allocatedJobId;
  }

  public void setAllocatedJobId(String allocatedJobId) {
    this.allocatedJobId = allocatedJobId;
  }

  public Gpu copy() {
    Gpu copy = new Gpu(id, uuid, name);
    copy.type = type;
    copy.pciAddress = pciAddress;
    copy.temperature = temperature;
    copy.powerDraw = powerDraw;
    copy.powerLimit = powerLimit;
    copy.memoryTotal = memoryTotal;
    copy.memoryUsed = memoryUsed;
    copy.utilization = utilization;
    copy.clocksSm = clocksSm;
    copy.clocksMem = clocksMem;
    copy.eccEnabled = eccEnabled;
    copy.eccErrors = eccErrors == null ? new EccErrors() : eccErrors.copy();
    copy.migMode = migMode;
    copy.migInstances = new ArrayList<>(migInstances);
    copy.nvlinks = new ArrayList<>(nvlinks.size());
    for (NvLink link : nvlinks) {
      copy.nvlinks.add(link.copy());
    }
    copy.healthStatus = healthStatus;
    copy.xidErrors = new ArrayList<>(xidErrors);
    copy.persistenceMode = persistenceMode;
    copy.allocatedJobId = allocatedJobId;
    return copy;
  }
}
