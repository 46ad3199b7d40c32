package io.b2mash.taskdesk.completion;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.tuple;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import io.b2mash.taskdesk.config.RecurringTaskProperties;
import io.b2mash.taskdesk.exception.CompletionBatchFailedException;
import io.b2mash.taskdesk.exception.InvalidArgumentException;
import io.b2mash.taskdesk.recurrence.RecurrencePattern;
import io.b2mash.taskdesk.recurrence.RecurrenceRuleEngine;
import io.b2mash.taskdesk.recurringtask.RecurringTask;
import io.b2mash.taskdesk.recurringtask.RecurringTaskTestData;
import java.time.LocalDate;
import java.util.List;
import java.util.Set;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Captor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataIntegrityViolationException;

@ExtendWith(MockitoExtension.class)
class CompletionTrackerTest {

  private static final String ARN = "123456789012345";

  @Mock private TaskCompletionRepository completionRepository;
  @Captor private ArgumentCaptor<List<TaskCompletion>> savedCaptor;

  private final RecurrenceRuleEngine ruleEngine = new RecurrenceRuleEngine();
  private CompletionTracker tracker;
  private RecurringTask quarterly;

  @BeforeEach
  void setUp() {
    tracker =
        new CompletionTracker(completionRepository, ruleEngine, RecurringTaskProperties.defaults());
    quarterly = task(false);
  }

  @Test
  void bulkSaveCreatesRowsForCompletedCells() {
    when(completionRepository.findByTaskId(quarterly.getId())).thenReturn(List.of());

    var result =
        tracker.bulkSave(
            quarterly,
            List.of(
                CompletionUpdate.of("c1", "2025-04", true),
                CompletionUpdate.of("c2", "2025-07", true)),
            "member-1");

    verify(completionRepository).saveAllAndFlush(savedCaptor.capture());
    assertThat(savedCaptor.getValue())
        .extracting(TaskCompletion::getClientId, TaskCompletion::getPeriodKey)
        .containsExactly(tuple("c1", "2025-04"), tuple("c2", "2025-07"));
    assertThat(savedCaptor.getValue())
        .allSatisfy(
            row -> {
              assertThat(row.isCompleted()).isTrue();
              assertThat(row.getCompletedBy()).isEqualTo("member-1");
              assertThat(row.getCompletedAt()).isNotNull();
            });
    assertThat(result).isEqualTo(new CompletionBatchResult(2, 2, 0));
  }

  @Test
  void uncompletingWithoutRowWritesNothing() {
    when(completionRepository.findByTaskId(quarterly.getId())).thenReturn(List.of());

    var result =
        tracker.bulkSave(quarterly, List.of(CompletionUpdate.of("c1", "2025-04", false)), "m");

    verify(completionRepository).saveAllAndFlush(savedCaptor.capture());
    assertThat(savedCaptor.getValue()).isEmpty();
    assertThat(result.unchanged()).isEqualTo(1);
  }

  @Test
  void uncompletingKeepsRowAndClearsAuditFields() {
    var row = completedRow("c1", "2025-04", "member-1");
    when(completionRepository.findByTaskId(quarterly.getId())).thenReturn(List.of(row));

    var result =
        tracker.bulkSave(quarterly, List.of(CompletionUpdate.of("c1", "2025-04", false)), "m2");

    assertThat(row.isCompleted()).isFalse();
    assertThat(row.getCompletedBy()).isNull();
    assertThat(row.getCompletedAt()).isNull();
    assertThat(result.cleared()).isEqualTo(1);
  }

  @Test
  void recompletingKeepsOriginalAuditFields() {
    var row = completedRow("c1", "2025-04", "member-1");
    var completedAt = row.getCompletedAt();
    when(completionRepository.findByTaskId(quarterly.getId())).thenReturn(List.of(row));

    var result =
        tracker.bulkSave(quarterly, List.of(CompletionUpdate.of("c1", "2025-04", true)), "m2");

    assertThat(row.getCompletedBy()).isEqualTo("member-1");
    assertThat(row.getCompletedAt()).isEqualTo(completedAt);
    assertThat(result.unchanged()).isEqualTo(1);
  }

  @Test
  void malformedEntryRejectsWholeBatch() {
    when(completionRepository.findByTaskId(quarterly.getId())).thenReturn(List.of());
    var updates =
        List.of(
            CompletionUpdate.of("c1", "2025-04", true),
            CompletionUpdate.of("c2", "2025-4", true));

    assertThatThrownBy(() -> tracker.bulkSave(quarterly, updates, "m"))
        .isInstanceOfSatisfying(
            InvalidArgumentException.class, e -> assertThat(e.getField()).isEqualTo("periodKey"));
    verify(completionRepository, never()).saveAllAndFlush(anyList());
  }

  @Test
  void clientOutsideContactsIsRejected() {
    when(completionRepository.findByTaskId(quarterly.getId())).thenReturn(List.of());

    assertThatThrownBy(
            () ->
                tracker.bulkSave(
                    quarterly, List.of(CompletionUpdate.of("c9", "2025-04", true)), "m"))
        .isInstanceOfSatisfying(
            InvalidArgumentException.class, e -> assertThat(e.getField()).isEqualTo("clientId"));
    verify(completionRepository, never()).saveAllAndFlush(anyList());
  }

  @Test
  void periodOutsidePatternIsRejected() {
    when(completionRepository.findByTaskId(quarterly.getId())).thenReturn(List.of());

    assertThatThrownBy(
            () ->
                tracker.bulkSave(
                    quarterly, List.of(CompletionUpdate.of("c1", "2025-05", true)), "m"))
        .isInstanceOf(InvalidArgumentException.class)
        .hasMessageContaining("2025-05");
  }

  @Test
  void duplicateCellIsRejected() {
    when(completionRepository.findByTaskId(quarterly.getId())).thenReturn(List.of());
    var updates =
        List.of(
            CompletionUpdate.of("c1", "2025-04", true),
            CompletionUpdate.of("c1", "2025-04", false));

    assertThatThrownBy(() -> tracker.bulkSave(quarterly, updates, "m"))
        .isInstanceOf(InvalidArgumentException.class)
        .hasMessageContaining("more than once");
  }

  @Test
  void emptyBatchIsRejected() {
    when(completionRepository.findByTaskId(quarterly.getId())).thenReturn(List.of());

    assertThatThrownBy(() -> tracker.bulkSave(quarterly, List.of(), "m"))
        .isInstanceOf(InvalidArgumentException.class);
  }

  @Test
  void arnTaskRequiresFifteenDigitsAndName() {
    var arnTask = task(true);
    when(completionRepository.findByTaskId(arnTask.getId())).thenReturn(List.of());

    assertThatThrownBy(
            () ->
                tracker.bulkSave(
                    arnTask,
                    List.of(new CompletionUpdate("c1", "2025-04", true, "12345", "Ravi")),
                    "m"))
        .isInstanceOfSatisfying(
            InvalidArgumentException.class, e -> assertThat(e.getField()).isEqualTo("arnNumber"));
    assertThatThrownBy(
            () ->
                tracker.bulkSave(
                    arnTask, List.of(new CompletionUpdate("c1", "2025-04", true, ARN, " ")), "m"))
        .isInstanceOfSatisfying(
            InvalidArgumentException.class, e -> assertThat(e.getField()).isEqualTo("arnName"));
    verify(completionRepository, never()).saveAllAndFlush(anyList());
  }

  @Test
  void arnIsStoredOnCompletedRow() {
    var arnTask = task(true);
    when(completionRepository.findByTaskId(arnTask.getId())).thenReturn(List.of());

    tracker.bulkSave(
        arnTask, List.of(new CompletionUpdate("c1", "2025-04", true, ARN, "Ravi")), "m");

    verify(completionRepository).saveAllAndFlush(savedCaptor.capture());
    var row = savedCaptor.getValue().get(0);
    assertThat(row.getArnNumber()).isEqualTo(ARN);
    assertThat(row.getArnName()).isEqualTo("Ravi");
  }

  @Test
  void writeFailureSurfacesAsBatchFailure() {
    when(completionRepository.findByTaskId(quarterly.getId())).thenReturn(List.of());
    when(completionRepository.saveAllAndFlush(anyList()))
        .thenThrow(new DataIntegrityViolationException("duplicate key"));

    assertThatThrownBy(
            () ->
                tracker.bulkSave(
                    quarterly, List.of(CompletionUpdate.of("c1", "2025-04", true)), "m"))
        .isInstanceOf(CompletionBatchFailedException.class)
        .hasCauseInstanceOf(DataIntegrityViolationException.class);
  }

  @Test
  void loadCompletionsListsEveryContactAndOnlyCompletedRows() {
    var cleared = completedRow("c1", "2025-07", "m");
    cleared.markIncomplete();
    when(completionRepository.findByTaskId(quarterly.getId()))
        .thenReturn(List.of(completedRow("c1", "2025-04", "m"), cleared));

    var completions = tracker.loadCompletions(quarterly);

    assertThat(completions).containsOnlyKeys("c1", "c2");
    assertThat(completions.get("c1")).containsExactly("2025-04");
    assertThat(completions.get("c2")).isEmpty();
  }

  @Test
  void statsCountOnlyVisiblePeriods() {
    var periods = ruleEngine.visiblePeriods(RecurrencePattern.QUARTERLY, 2025);

    var stats = tracker.stats(Set.of("2025-04", "2025-05", "2025-07"), periods);

    assertThat(stats).isEqualTo(new CompletionStats(2, 4, 50));
  }

  @Test
  void deleteAllRemovesEveryRowOfTask() {
    when(completionRepository.deleteByTaskId(quarterly.getId())).thenReturn(5);

    assertThat(tracker.deleteAll(quarterly.getId())).isEqualTo(5);
  }

  private TaskCompletion completedRow(String clientId, String periodKey, String actorId) {
    var row = new TaskCompletion(quarterly.getId(), clientId, periodKey);
    row.markCompleted(actorId, null, null);
    return row;
  }

  private static RecurringTask task(boolean requiresArn) {
    return RecurringTaskTestData.task(
        RecurrencePattern.QUARTERLY,
        LocalDate.of(2025, 4, 1),
        null,
        List.of("c1", "c2"),
        null,
        List.of(),
        requiresArn);
  }
}
