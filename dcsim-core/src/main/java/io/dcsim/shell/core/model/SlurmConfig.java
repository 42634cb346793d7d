package io.dcsim.shell.core.model;

import java.util.List;

/** Scheduler controller and partition names. Immutable; cluster copies share it. */
public record SlurmConfig(String controlMachine, List<String> partitions) {
  public SlurmConfig {
    partitions = partitions == null ? List.of() : List.copyOf(partitions);
  }
}
