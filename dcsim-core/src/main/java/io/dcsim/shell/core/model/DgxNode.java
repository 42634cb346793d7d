package io.dcsim.shell.core.model;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/** A simulated GPU server with its accelerators, fabric adapters and scheduler state. */
public final class DgxNode {
  private String id;
  private String hostname;
  private String systemType;
  private List<Gpu> gpus = new ArrayList<>();
  private List<HostChannelAdapter> hcas = new ArrayList<>();
  private BmcInfo bmc;
  private String cpuModel;
  private int cpuCount;
  private int ramTotal;
  private int ramUsed;
  private String osVersion;
  private String kernelVersion;
  private String nvidiaDriverVersion;
  private String cudaVersion;
  private HealthStatus healthStatus = HealthStatus.OK;
  private String slurmState = "idle";
  private String slurmReason;

  public DgxNode() {}

  public DgxNode(String id, String hostname, String systemType) {
    this.id = id;
    this.hostname = hostname;
    this.systemType = systemType;
  }

  public String getId() {
    return id;
  }

  public String getHostname() {
    return hostname;
  }

  public void setHostname(String hostname) {
    this.hostname = hostname;
  }

  public String getSystemType() {
    return systemType;
  }

  public List<Gpu> getGpus() {
    return gpus;
  }

  /** Finds a GPU by its index on this node. */
  public Optional<Gpu> findGpu(int gpuId) {
    for (Gpu gpu : gpus) {
      if (gpu.getId() == gpuId) {
        return Optional.of(gpu);
      }
    }
    return Optional.empty();
  }

  public List<HostChannelAdapter> getHcas() {
    return hcas;
  }

  public BmcInfo getBmc() {
    return bmc;
  }

  public void setBmc(BmcInfo bmc) {
    this.bmc = bmc;
  }

  public String getCpuModel() {
    return cpuModel;
  }

  public void setCpuModel(String cpuModel) {
    this.cpuModel = cpuModel;
  }

  public int getCpuCount() {
    return cpuCount;
  }

  public void setCpuCount(int cpuCount) {
    this.cpuCount = cpuCount;
  }

  public int getRamTotal() {
    return ramTotal;
  }

  public void setRamTotal(int ramTotal) {
    this.ramTotal = ramTotal;
  }

  public int getRamUsed() {
    return ramUsed;
  }

  public void setRamUsed(int ramUsed) {
    this.ramUsed = ramUsed;
  }

  public String getOsVersion() {
    return osVersion;
  }

  public void setOsVersion(String osVersion) {
    this.osVersion = osVersion;
  }

  public String getKernelVersion() {
    return kernelVersion;
  }

  public void setKernelVersion(String kernelVersion) {
    this.kernelVersion = kernelVersion;
  }

  public String getNvidiaDriverVersion() {
    return nvidiaDriverVersion;
  }

  public void setNvidiaDriverVersion(String nvidiaDriverVersion) {
    this.nvidiaDriverVersion = nvidiaDriverVersion;
  }

  public String getCudaVersion() {
    return cudaVersion;
  }

  public void setCudaVersion(String cudaVersion) {
    this.cudaVersion = cudaVersion;
  }

  public HealthStatus getHealthStatus() {
    return healthStatus;
  }

  public void setHealthStatus(HealthStatus healthStatus) {
    this.healthStatus = healthStatus;
  }

  public String getSlurmState() {
    return slurmState;
  }

  public void setSlurmState(String slurmState) {
    this.slurmState = slurmState;
  }

  public String getSlurmReason() {
    return slurmReason;
  }

  public void setSlurmReason(String slurmReason) {
    this.slurmReason = slurmReason;
  }

  public DgxNode copy() {
    DgxNode copy = new DgxNode(id, hostname, systemType);
    for (Gpu gpu : gpus) {
      copy.gpus.add(gpu.copy());
    }
    for (HostChannelAdapter hca : hcas) {
      copy.hcas.add(hca.copy());
    }
    copy.bmc = bmc;
    copy.cpuModel = cpuModel;
    copy.cpuCount = cpuCount;
    copy.ramTotal = ramTotal;
    copy.ramUsed = ramUsed;
    copy.osVersion = osVersion;
    copy.kernelVersion = kernelVersion;
    copy.nvidiaDriverVersion = nvidiaDriverVersion;
    copy.cudaVersion = cudaVersion;
    copy.healthStatus = healthStatus;
    copy.slurmState = slurmState;
    copy.slurmReason = slurmReason;
    return copy;
  }
}
