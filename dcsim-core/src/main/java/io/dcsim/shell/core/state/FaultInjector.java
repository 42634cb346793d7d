package io.dcsim.shell.core.state;

import io.dcsim.shell.core.model.ClusterConfig;
import io.dcsim.shell.core.model.EccErrors;
import io.dcsim.shell.core.model.Gpu;
import io.dcsim.shell.core.model.GpuUpdate;
import io.dcsim.shell.core.model.HealthStatus;
import io.dcsim.shell.core.model.NvLink;
import io.dcsim.shell.core.model.XidCatalog;
import io.dcsim.shell.core.model.XidError;
import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Applies {@link FaultInjection}s through a {@link StateMutator}. Each fault is written as a single
 * mutation so a scenario's counter grows by one per applied fault.
 */
public final class FaultInjector {
  private static final Logger LOG = LoggerFactory.getLogger(FaultInjector.class);

  static final int DEFAULT_XID = 79;
  static final double DEFAULT_TARGET_TEMP = 95;
  static final double MEMORY_FULL_RATIO = 0.965;

  /** Command recorded on mutations when the caller does not name one. */
  public static final String DEFAULT_COMMAND = "fault";

  private FaultInjector() {}

  /**
   * Applies every fault to a scenario context.
   *
   * @return number of faults that were applied
   */
  public static int applyToContext(ScenarioContext context, List<FaultInjection> faults) {
    return apply(faults, context.getCluster(), context);
  }

  /**
   * Applies faults to {@code sink}, reading current GPU values from {@code view}. The view must be
   * the cluster that {@code sink} writes to.
   *
   * @return number of faults that were applied
   */
  public static int apply(List<FaultInjection> faults, ClusterConfig view, StateMutator sink) {
    int applied = 0;
    for (FaultInjection fault : faults) {
      if (apply(fault, view, sink)) {
        applied++;
      }
    }
    return applied;
  }

  /**
   * Applies one fault.
   *
   * @return false if the target GPU does not exist or the sink rejected the write
   * @throws NumberFormatException if a fault parameter is not numeric
   */
  public static boolean apply(FaultInjection fault, ClusterConfig view, StateMutator sink) {
    return apply(fault, view, sink, DEFAULT_COMMAND);
  }

  /**
   * Applies one fault, attributing the resulting mutation to {@code command}.
   *
   * @return false if the target GPU does not exist or the sink rejected the write
   * @throws NumberFormatException if a fault parameter is not numeric
   */
  public static boolean apply(
      FaultInjection fault, ClusterConfig view, StateMutator sink, String command) {
    Optional<Gpu> target = view.findGpu(fault.nodeId(), fault.gpuId());
    if (target.isEmpty()) {
      LOG.debug(
          "Skipping {} fault: no gpu {} on {}",
          fault.type().faultName(),
          fault.gpuId(),
          fault.nodeId());
      return false;
    }
    Gpu gpu = target.get();
    String node = fault.nodeId();
    int gpuId = fault.gpuId();
    return switch (fault.type()) {
      case XID_ERROR -> {
        int code = fault.intParameter("xid", DEFAULT_XID);
        XidError error =
            new XidError(
                code,
                System.currentTimeMillis(),
                XidCatalog.describe(code),
                XidCatalog.severityOf(code));
        yield sink.addXidError(node, gpuId, error, command);
      }
      case THERMAL -> sink.updateGpu(
          node,
          gpuId,
          GpuUpdate.builder()
              .temperature(fault.doubleParameter("targetTemp", DEFAULT_TARGET_TEMP))
              .healthStatus(HealthStatus.WARNING)
              .build(),
          command);
      case MEMORY_FULL -> {
        int used = (int) (gpu.getMemoryTotal() * MEMORY_FULL_RATIO) / 1000 * 1000;
        yield sink.updateGpu(
            node,
            gpuId,
            GpuUpdate.builder().memoryUsed(used).healthStatus(HealthStatus.WARNING).build(),
            command);
      }
      case ECC_ERROR -> {
        long single = fault.intParameter("singleBit", 0);
        long dbl = fault.intParameter("doubleBit", 0);
        yield sink.updateGpu(
            node,
            gpuId,
            GpuUpdate.builder()
                .eccErrors(new EccErrors(single, dbl, single, dbl))
                .healthStatus(dbl > 0 ? HealthStatus.CRITICAL : HealthStatus.WARNING)
                .build(),
            command);
      }
      case NVLINK_FAILURE -> sink.updateGpu(
          node,
          gpuId,
          GpuUpdate.builder()
              .linkStatus(fault.intParameter("link", 0), NvLink.DOWN)
              .healthStatus(HealthStatus.WARNING)
              .build(),
          command);
      case GPU_HANG -> sink.updateGpu(
          node,
          gpuId,
          GpuUpdate.builder().utilization(0).healthStatus(HealthStatus.CRITICAL).build(),
          command);
      case POWER -> sink.updateGpu(
          node,
          gpuId,
          GpuUpdate.builder()
              .powerDraw(fault.doubleParameter("powerDraw", gpu.getPowerLimit() * 1.1))
              .healthStatus(HealthStatus.WARNING)
              .build(),
          command);
    };
  }
}
