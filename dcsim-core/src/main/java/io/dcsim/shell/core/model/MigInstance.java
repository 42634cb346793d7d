package io.dcsim.shell.core.model;

/**
 * A GPU instance carved out of a MIG enabled GPU. Immutable; GPU copies share it.
 *
 * @param gpuInstanceId GPU instance id
 * @param profile profile name (e.g. "1g.10gb")
 * @param memoryMiB memory assigned to the instance
 */
public record MigInstance(int gpuInstanceId, String profile, int memoryMiB) {}
