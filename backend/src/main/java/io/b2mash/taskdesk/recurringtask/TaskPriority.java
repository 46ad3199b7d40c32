package io.b2mash.taskdesk.recurringtask;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import io.b2mash.taskdesk.exception.InvalidArgumentException;
import java.util.Locale;

public enum TaskPriority {
  LOW,
  MEDIUM,
  HIGH,
  URGENT;

  @JsonValue
  public String value() {
    return name().toLowerCase(Locale.ROOT);
  }

  @JsonCreator
  public static TaskPriority fromValue(String value) {
    if (value == null) {
      return MEDIUM;
    }
    try {
      return valueOf(value.toUpperCase(Locale.ROOT));
    } catch (IllegalArgumentException e) {
      throw new InvalidArgumentException("priority", "Unrecognized priority: " + value);
    }
  }
}
