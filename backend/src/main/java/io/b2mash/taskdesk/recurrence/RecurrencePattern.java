package io.b2mash.taskdesk.recurrence;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import io.b2mash.taskdesk.exception.InvalidArgumentException;
import java.util.Arrays;

/** How often a recurring task repeats. Period lengths live in {@link RecurrenceRuleEngine}. */
public enum RecurrencePattern {
  MONTHLY("monthly"),
  QUARTERLY("quarterly"),
  HALF_YEARLY("half-yearly"),
  YEARLY("yearly");

  private final String value;

  RecurrencePattern(String value) {
    this.value = value;
  }

  @JsonValue
  public String value() {
    return value;
  }

  /**
   * Resolves the wire value ({@code "half-yearly"}) or the constant name ({@code "HALF_YEARLY"}).
   *
   * @throws InvalidArgumentException if the value names no pattern
   */
  @JsonCreator
  public static RecurrencePattern fromValue(String value) {
    if (value == null) {
      throw new InvalidArgumentException("recurrencePattern", "Recurrence pattern is required");
    }
    return Arrays.stream(values())
        .filter(p -> p.value.equalsIgnoreCase(value) || p.name().equalsIgnoreCase(value))
        .findFirst()
        .orElseThrow(
            () ->
                new InvalidArgumentException(
                    "recurrencePattern", "Unrecognized recurrence pattern: " + value));
  }
}
