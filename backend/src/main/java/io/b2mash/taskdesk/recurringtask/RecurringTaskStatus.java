package io.b2mash.taskdesk.recurringtask;

import java.util.Map;
import java.util.Set;

/**
 * Generation status of a recurring task. PAUSED freezes the next occurrence and can resume;
 * STOPPED ends generation for good but keeps the task and its completion history.
 */
public enum RecurringTaskStatus {
  ACTIVE,
  PAUSED,
  STOPPED;

  private static final Map<RecurringTaskStatus, Set<RecurringTaskStatus>> ALLOWED_TRANSITIONS =
      Map.of(
          ACTIVE, Set.of(PAUSED, STOPPED),
          PAUSED, Set.of(ACTIVE, STOPPED),
          STOPPED, Set.of());

  public Set<RecurringTaskStatus> allowedTransitions() {
    return ALLOWED_TRANSITIONS.getOrDefault(this, Set.of());
  }

  public boolean canTransitionTo(RecurringTaskStatus target) {
    return allowedTransitions().contains(target);
  }

  public boolean isTerminal() {
    return this == STOPPED;
  }
}
