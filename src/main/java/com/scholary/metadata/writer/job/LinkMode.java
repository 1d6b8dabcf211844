package com.scholary.metadata.writer.job;

import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

/**
 * Caller-declared state of the source links used for Watch Next recommendations.
 *
 * <p>The wire value is the lower-case form sent by the upload form and passed verbatim to the
 * generation service.
 */
public enum LinkMode {
  NOT_PROVIDED("not_provided"),
  CHECKED_NO_LINKS("checked_no_links"),
  NOT_AVAILABLE("not_available"),
  PROVIDED("provided");

  private final String value;

  LinkMode(String value) {
    this.value = value;
  }

  @JsonValue
  public String value() {
    return value;
  }

  /**
   * Parse a wire value.
   *
   * @param value the submitted value, surrounding whitespace ignored
   * @return the matching mode
   * @throws IllegalArgumentException if the value is not one of the four known modes
   */
  public static LinkMode fromValue(String value) {
    String normalized = value == null ? "" : value.strip().toLowerCase(Locale.ROOT);
    for (LinkMode mode : values()) {
      if (mode.value.equals(normalized)) {
        return mode;
      }
    }
    throw new IllegalArgumentException("Unknown link mode: " + value);
  }

  @Override
  public String toString() {
    return value;
  }
}
