package io.dcsim.shell.core.model;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/** Well-known XID codes with the severity the simulator assigns them. */
public final class XidCatalog {

  /**
   * A catalogue entry.
   *
   * @param code XID code
   * @param name short name
   * @param severity health the GPU takes on when this XID is raised
   * @param description operator facing description
   */
  public record Entry(int code, String name, HealthStatus severity, String description) {}

  private static final Map<Integer, Entry> ENTRIES = new LinkedHashMap<>();

  static {
    add(13, "Graphics Engine Exception", HealthStatus.WARNING,
        "Graphics Engine Exception. Usually an application error (out-of-range access).");
    add(31, "GPU memory page fault", HealthStatus.WARNING,
        "GPU memory page fault. Illegal memory access by an application.");
    add(43, "GPU stopped processing", HealthStatus.WARNING,
        "GPU stopped processing. A user application hit a software induced fault.");
    add(48, "Double Bit ECC Error", HealthStatus.CRITICAL,
        "Double Bit ECC Error. Uncorrectable memory error, GPU reset required.");
    add(63, "ECC page retirement", HealthStatus.WARNING,
        "ECC page retirement or row remapping recording event.");
    add(64, "ECC page retirement failure", HealthStatus.CRITICAL,
        "ECC page retirement or row remapper recording failure.");
    add(74, "NVLink Error", HealthStatus.CRITICAL,
        "NVLink Error. A fatal error was detected on an NVLink connection.");
    add(79, "GPU has fallen off the bus", HealthStatus.CRITICAL,
        "GPU has fallen off the bus. The GPU is no longer reachable over PCIe.");
    add(92, "High single-bit ECC error rate", HealthStatus.WARNING,
        "High single-bit ECC error rate.");
    add(94, "Contained ECC error", HealthStatus.WARNING,
        "Contained ECC error. Affected applications must be restarted.");
    add(95, "Uncontained ECC error", HealthStatus.CRITICAL,
        "Uncontained ECC error. All applications on the GPU are affected, reset required.");
  }

  private XidCatalog() {}

  private static void add(int code, String name, HealthStatus severity, String description) {
    ENTRIES.put(code, new Entry(code, name, severity, description));
  }

  public static Optional<Entry> lookup(int code) {
    return Optional.ofNullable(ENTRIES.get(code));
  }

  public static String describe(int code) {
    return lookup(code).map(Entry::description).orElse("Unknown XID error " + code + ".");
  }

  public static HealthStatus severityOf(int code) {
    return lookup(code).map(Entry::severity).orElse(HealthStatus.WARNING);
  }

  public static Collection<Entry> entries() {
    return ENTRIES.values();
  }
}
