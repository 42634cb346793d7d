package io.dcsim.shell.core.model;

/**
 * A driver reported XID event on a GPU. Immutable; GPU copies share it.
 *
 * @param code XID code
 * @param timestampMillis epoch millis when the event was raised
 * @param description human readable description
 * @param severity severity of the event
 */
public record XidError(int code, long timestampMillis, String description, HealthStatus severity) {}
