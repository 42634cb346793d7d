package io.dcsim.shell.core.model;

/** High availability pair of the cluster manager head nodes. Immutable; cluster copies share it. */
public record BcmHaState(boolean enabled, String primary, String secondary, String state) {}
