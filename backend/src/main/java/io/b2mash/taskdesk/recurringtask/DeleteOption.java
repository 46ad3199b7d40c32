package io.b2mash.taskdesk.recurringtask;

import io.b2mash.taskdesk.exception.InvalidArgumentException;
import java.util.Locale;

/** How a recurring task is deleted. Callers must name one; there is no default. */
public enum DeleteOption {
  /** Status becomes STOPPED; the task and every completion row remain readable. */
  STOP,
  /** The task and all of its completion rows are removed. */
  ALL;

  public static DeleteOption fromValue(String value) {
    if (value == null || value.isBlank()) {
      throw new InvalidArgumentException(
          "option", "Delete option is required: choose 'stop' or 'all'");
    }
    try {
      return valueOf(value.strip().toUpperCase(Locale.ROOT));
    } catch (IllegalArgumentException e) {
      throw new InvalidArgumentException(
          "option", "Unrecognized delete option '" + value + "': choose 'stop' or 'all'");
    }
  }
}
