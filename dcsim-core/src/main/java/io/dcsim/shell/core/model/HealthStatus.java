package io.dcsim.shell.core.model;

import com.google.gson.annotations.SerializedName;
import java.util.Locale;
import java.util.Optional;

/** Condition of a simulated GPU or node. */
public enum HealthStatus {
  @SerializedName("OK")
  OK("OK"),
  @SerializedName("Warning")
  WARNING("Warning"),
  @SerializedName("Critical")
  CRITICAL("Critical"),
  @SerializedName("Unknown")
  UNKNOWN("Unknown");

  private final String label;

  HealthStatus(String label) {
    this.label = label;
  }

  /** Display form used by the simulated tools (e.g. "Warning"). */
  public String label() {
    return label;
  }

  /**
   * Looks up a status by its label or constant name, ignoring case.
   *
   * @param text user supplied text
   * @return the status, or empty if the text names none
   */
  public static Optional<HealthStatus> fromLabel(String text) {
    if (text == null) {
      return Optional.empty();
    }
    String normalized = text.trim().toUpperCase(Locale.ROOT);
    for (HealthStatus status : values()) {
      if (status.name().equals(normalized)) {
        return Optional.of(status);
      }
    }
    return Optional.empty();
  }
}
