package io.dcsim.shell.core.state;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * A fault to inject into one GPU.
 *
 * @param nodeId target node
 * @param gpuId target GPU index
 * @param type fault kind
 * @param severity free-form severity tag carried from scenario definitions
 * @param parameters fault specific values, either {@link Number}s or numeric strings
 */
public record FaultInjection(
    String nodeId, int gpuId, FaultType type, String severity, Map<String, Object> parameters) {

  public FaultInjection {
    Objects.requireNonNull(nodeId, "nodeId");
    Objects.requireNonNull(type, "type");
    parameters =
        parameters == null
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(parameters));
  }

  public static FaultInjection of(String nodeId, int gpuId, FaultType type) {
    return new FaultInjection(nodeId, gpuId, type, null, Map.of());
  }

  /** Returns a copy with {@code name} set to {@code value}. */
  public FaultInjection with(String name, Object value) {
    Map<String, Object> next = new LinkedHashMap<>(parameters);
    next.put(name, value);
    return new FaultInjection(nodeId, gpuId, type, severity, next);
  }

  public boolean hasParameter(String name) {
    return parameters.get(name) != null;
  }

  /**
   * Reads a numeric parameter.
   *
   * @throws NumberFormatException if the parameter is present but not numeric
   */
  public double doubleParameter(String name, double defaultValue) {
    Object value = parameters.get(name);
    if (value == null) {
      return defaultValue;
    }
    if (value instanceof Number number) {
      return number.doubleValue();
    }
    return Double.parseDouble(value.toString().trim());
  }

  /**
   * Reads an integral parameter.
   *
   * @throws NumberFormatException if the parameter is present but not an integer
   */
  public int intParameter(String name, int defaultValue) {
    Object value = parameters.get(name);
    if (value == null) {
      return defaultValue;
    }
    if (value instanceof Number number) {
      return number.intValue();
    }
    return Integer.parseInt(value.toString().trim());
  }
}
