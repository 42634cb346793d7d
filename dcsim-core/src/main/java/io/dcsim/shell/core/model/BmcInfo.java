package io.dcsim.shell.core.model;

/** Baseboard management controller of a node. Immutable; node copies share it. */
public record BmcInfo(
    String ipAddress,
    String macAddress,
    String firmwareVersion,
    String manufacturer,
    String powerState) {}
