package io.b2mash.taskdesk.recurringtask;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.b2mash.taskdesk.config.RecurringTaskProperties;
import io.b2mash.taskdesk.exception.InvalidArgumentException;
import io.b2mash.taskdesk.exception.InvalidStateException;
import io.b2mash.taskdesk.recurrence.RecurrencePattern;
import io.b2mash.taskdesk.recurrence.RecurrenceRuleEngine;
import java.time.LocalDate;
import java.util.List;
import org.junit.jupiter.api.Test;

class RecurringTaskLifecycleTest {

  private final RecurringTaskLifecycle lifecycle =
      new RecurringTaskLifecycle(new RecurrenceRuleEngine(), RecurringTaskProperties.defaults());

  @Test
  void initializeSchedulesOnePeriodAfterStart() {
    var task = monthly(LocalDate.of(2025, 1, 31), null);

    lifecycle.initialize(task);

    assertThat(task.getNextOccurrence()).isEqualTo(LocalDate.of(2025, 2, 28));
    assertThat(task.getStatus()).isEqualTo(RecurringTaskStatus.ACTIVE);
  }

  @Test
  void initializeRejectsEndDateBeforeFirstOccurrence() {
    var task =
        RecurringTaskTestData.task(
            RecurrencePattern.YEARLY,
            LocalDate.of(2025, 4, 1),
            LocalDate.of(2025, 12, 31),
            List.of("c1"),
            null,
            List.of(),
            false);

    assertThatThrownBy(() -> lifecycle.initialize(task))
        .isInstanceOfSatisfying(
            InvalidArgumentException.class, e -> assertThat(e.getField()).isEqualTo("endDate"));
  }

  @Test
  void pauseThenResumeBeforeOccurrenceElapsesKeepsIt() {
    var task = monthly(LocalDate.of(2025, 1, 10), null);
    lifecycle.initialize(task);

    lifecycle.pause(task);
    assertThat(task.getStatus()).isEqualTo(RecurringTaskStatus.PAUSED);
    assertThat(task.getNextOccurrence()).isEqualTo(LocalDate.of(2025, 2, 10));

    lifecycle.resume(task, LocalDate.of(2025, 2, 1));

    assertThat(task.getStatus()).isEqualTo(RecurringTaskStatus.ACTIVE);
    assertThat(task.getNextOccurrence()).isEqualTo(LocalDate.of(2025, 2, 10));
  }

  @Test
  void resumeAfterOccurrenceElapsedMovesToFirstFutureOccurrence() {
    var task = monthly(LocalDate.of(2025, 1, 10), null);
    lifecycle.initialize(task);
    lifecycle.pause(task);

    lifecycle.resume(task, LocalDate.of(2025, 5, 20));

    assertThat(task.getStatus()).isEqualTo(RecurringTaskStatus.ACTIVE);
    assertThat(task.getNextOccurrence()).isEqualTo(LocalDate.of(2025, 6, 10));
  }

  @Test
  void resumePastEndDateExhaustsSeries() {
    var task = monthly(LocalDate.of(2025, 1, 10), LocalDate.of(2025, 4, 30));
    lifecycle.initialize(task);
    lifecycle.pause(task);

    lifecycle.resume(task, LocalDate.of(2025, 6, 1));

    assertThat(task.getStatus()).isEqualTo(RecurringTaskStatus.STOPPED);
    assertThat(task.getNextOccurrence()).isNull();
    assertThat(task.getStoppedAt()).isNotNull();
  }

  @Test
  void resumeRequiresPausedTask() {
    var task = monthly(LocalDate.of(2025, 1, 10), null);

    assertThatThrownBy(() -> lifecycle.resume(task, LocalDate.of(2025, 2, 1)))
        .isInstanceOf(InvalidStateException.class)
        .hasMessageContaining("ACTIVE");
  }

  @Test
  void stoppedTaskCannotBePausedOrResumed() {
    var task = monthly(LocalDate.of(2025, 1, 10), null);
    assertThat(lifecycle.stop(task)).isTrue();

    assertThatThrownBy(() -> lifecycle.pause(task)).isInstanceOf(InvalidStateException.class);
    assertThatThrownBy(() -> lifecycle.resume(task, LocalDate.of(2025, 2, 1)))
        .isInstanceOf(InvalidStateException.class);
  }

  @Test
  void stopIsIdempotent() {
    var task = monthly(LocalDate.of(2025, 1, 10), null);
    lifecycle.pause(task);

    assertThat(lifecycle.stop(task)).isTrue();
    assertThat(lifecycle.stop(task)).isFalse();
    assertThat(task.getStatus()).isEqualTo(RecurringTaskStatus.STOPPED);
  }

  @Test
  void advanceMovesOnePeriodForward() {
    var task = monthly(LocalDate.of(2025, 1, 10), null);
    lifecycle.initialize(task);

    lifecycle.advance(task);

    assertThat(task.getNextOccurrence()).isEqualTo(LocalDate.of(2025, 3, 10));
  }

  @Test
  void advancePastEndDateStopsSeries() {
    var task = monthly(LocalDate.of(2025, 1, 10), LocalDate.of(2025, 2, 15));
    lifecycle.initialize(task);

    lifecycle.advance(task);

    assertThat(task.getStatus()).isEqualTo(RecurringTaskStatus.STOPPED);
    assertThat(task.getNextOccurrence()).isNull();
  }

  @Test
  void advanceRequiresActiveTask() {
    var task = monthly(LocalDate.of(2025, 1, 10), null);
    lifecycle.pause(task);

    assertThatThrownBy(() -> lifecycle.advance(task)).isInstanceOf(InvalidStateException.class);
  }

  @Test
  void completionsArePermittedUnlessStopped() {
    var task = monthly(LocalDate.of(2025, 1, 10), null);
    assertThat(lifecycle.permitsCompletions(task)).isTrue();

    lifecycle.pause(task);
    assertThat(lifecycle.permitsCompletions(task)).isTrue();

    lifecycle.stop(task);
    assertThat(lifecycle.permitsCompletions(task)).isFalse();
    assertThatThrownBy(() -> lifecycle.requireCompletionsPermitted(task))
        .isInstanceOf(InvalidStateException.class);
  }

  @Test
  void stoppedTaskRejectsEdits() {
    var task = monthly(LocalDate.of(2025, 1, 10), null);
    lifecycle.stop(task);

    assertThatThrownBy(
            () -> task.updateDetails("New title", null, TaskPriority.LOW, null, false))
        .isInstanceOf(InvalidStateException.class);
  }

  private static RecurringTask monthly(LocalDate startDate, LocalDate endDate) {
    return RecurringTaskTestData.task(
        RecurrencePattern.MONTHLY, startDate, endDate, List.of("c1"), null, List.of(), false);
  }
}
