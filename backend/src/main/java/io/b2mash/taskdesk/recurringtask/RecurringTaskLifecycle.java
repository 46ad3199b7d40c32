package io.b2mash.taskdesk.recurringtask;

import io.b2mash.taskdesk.config.RecurringTaskProperties;
import io.b2mash.taskdesk.exception.InvalidArgumentException;
import io.b2mash.taskdesk.exception.InvalidStateException;
import io.b2mash.taskdesk.recurrence.RecurrenceRuleEngine;
import java.time.LocalDate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * State machine for a recurring task's ACTIVE / PAUSED / STOPPED status and its {@code
 * nextOccurrence}. Mutates only those two fields of the task it is handed; persistence and
 * completion rows belong to {@link RecurringTaskService}.
 */
@Component
public class RecurringTaskLifecycle {

  private static final Logger log = LoggerFactory.getLogger(RecurringTaskLifecycle.class);

  private final RecurrenceRuleEngine ruleEngine;
  private final RecurringTaskProperties properties;

  public RecurringTaskLifecycle(
      RecurrenceRuleEngine ruleEngine, RecurringTaskProperties properties) {
    this.ruleEngine = ruleEngine;
    this.properties = properties;
  }

  /**
   * Schedules the first occurrence of a new (or rescheduled) task one period after its start
   * date.
   *
   * @throws InvalidArgumentException if the end date does not leave room for that occurrence
   */
  public void initialize(RecurringTask task) {
    LocalDate first =
        ruleEngine.nextOccurrenceAfter(task.getRecurrencePattern(), task.getStartDate());
    if (exceedsEndDate(task, first)) {
      throw new InvalidArgumentException(
          "endDate",
          "End date %s is before the first occurrence on %s".formatted(task.getEndDate(), first));
    }
    task.setNextOccurrence(first);
    log.debug("Recurring task {} first occurrence {}", task.getId(), first);
  }

  /** ACTIVE to PAUSED. The next occurrence stays frozen until resume. */
  public void pause(RecurringTask task) {
    task.transitionTo(RecurringTaskStatus.PAUSED, "pause");
  }

  /**
   * PAUSED to ACTIVE. If the frozen next occurrence has already elapsed it is stepped forward to
   * the first occurrence on or after {@code today}, so resuming never produces a backlog of
   * overdue occurrences. A series that runs past its end date while catching up is stopped.
   */
  public void resume(RecurringTask task, LocalDate today) {
    if (task.getStatus() != RecurringTaskStatus.PAUSED) {
      throw new InvalidStateException(
          "Invalid state transition",
          "Recurring task must be PAUSED to resume. Current status: " + task.getStatus());
    }
    task.transitionTo(RecurringTaskStatus.ACTIVE, "resume");

    LocalDate frozen = task.getNextOccurrence();
    if (frozen != null && frozen.isBefore(today)) {
      LocalDate caughtUp =
          ruleEngine.catchUp(
              task.getRecurrencePattern(), frozen, today, properties.resumeCatchUpLimit());
      log.info(
          "Recurring task {} resumed after its occurrence {} elapsed; next occurrence {}",
          task.getId(),
          frozen,
          caughtUp);
      scheduleOrExhaust(task, caughtUp);
    }
  }

  /**
   * Stops generation. Stopping an already stopped task is a no-op.
   *
   * @return true if the status changed
   */
  public boolean stop(RecurringTask task) {
    if (task.getStatus() == RecurringTaskStatus.STOPPED) {
      return false;
    }
    task.transitionTo(RecurringTaskStatus.STOPPED, "stop");
    return true;
  }

  /** Consumes the pending occurrence of an ACTIVE task and schedules the one after it. */
  public void advance(RecurringTask task) {
    if (task.getStatus() != RecurringTaskStatus.ACTIVE) {
      throw new InvalidStateException(
          "Invalid state transition",
          "Recurring task must be ACTIVE to advance. Current status: " + task.getStatus());
    }
    LocalDate next =
        ruleEngine.nextOccurrenceAfter(task.getRecurrencePattern(), task.getNextOccurrence());
    scheduleOrExhaust(task, next);
  }

  /** Completions may be recorded on ACTIVE and PAUSED tasks, not on STOPPED ones. */
  public boolean permitsCompletions(RecurringTask task) {
    return !task.getStatus().isTerminal();
  }

  public void requireCompletionsPermitted(RecurringTask task) {
    if (!permitsCompletions(task)) {
      throw new InvalidStateException(
          "Recurring task stopped",
          "Completions cannot be recorded for stopped recurring task " + task.getId());
    }
  }

  private void scheduleOrExhaust(RecurringTask task, LocalDate next) {
    if (exceedsEndDate(task, next)) {
      log.info(
          "Recurring task {} reached its end date {}; stopping", task.getId(), task.getEndDate());
      task.setNextOccurrence(null);
      task.transitionTo(RecurringTaskStatus.STOPPED, "exhaust");
      return;
    }
    task.setNextOccurrence(next);
  }

  private static boolean exceedsEndDate(RecurringTask task, LocalDate occurrence) {
    return task.getEndDate() != null && occurrence.isAfter(task.getEndDate());
  }
}
