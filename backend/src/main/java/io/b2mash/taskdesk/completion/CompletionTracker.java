package io.b2mash.taskdesk.completion;

import io.b2mash.taskdesk.config.RecurringTaskProperties;
import io.b2mash.taskdesk.exception.CompletionBatchFailedException;
import io.b2mash.taskdesk.exception.InvalidArgumentException;
import io.b2mash.taskdesk.recurrence.FiscalPeriod;
import io.b2mash.taskdesk.recurrence.RecurrenceRuleEngine;
import io.b2mash.taskdesk.recurringtask.RecurringTask;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.function.Function;
import java.util.regex.Pattern;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/** Per-client, per-period completion ledger of recurring tasks. */
@Service
public class CompletionTracker {

  private static final Logger log = LoggerFactory.getLogger(CompletionTracker.class);

  private final TaskCompletionRepository completionRepository;
  private final RecurrenceRuleEngine ruleEngine;
  private final int arnLength;
  private final Pattern arnPattern;

  public CompletionTracker(
      TaskCompletionRepository completionRepository,
      RecurrenceRuleEngine ruleEngine,
      RecurringTaskProperties properties) {
    this.completionRepository = completionRepository;
    this.ruleEngine = ruleEngine;
    this.arnLength = properties.arnLength();
    this.arnPattern = Pattern.compile("\\d{" + properties.arnLength() + "}");
  }

  /**
   * Completed period keys per client. Every contact of the task is present, with an empty set when
   * it has no completions; clients with history that are no longer contacts are kept too.
   */
  @Transactional(readOnly = true)
  public Map<String, Set<String>> loadCompletions(RecurringTask task) {
    Map<String, Set<String>> completions = new LinkedHashMap<>();
    task.getContactIds().forEach(clientId -> completions.put(clientId, new LinkedHashSet<>()));
    for (TaskCompletion completion : completionRepository.findByTaskId(task.getId())) {
      if (completion.isCompleted()) {
        completions
            .computeIfAbsent(completion.getClientId(), id -> new LinkedHashSet<>())
            .add(completion.getPeriodKey());
      }
    }
    return completions;
  }

  @Transactional(readOnly = true)
  public Set<String> loadCompletions(RecurringTask task, String clientId) {
    return completionRepository.findByTaskIdAndClientId(task.getId(), clientId).stream()
        .filter(TaskCompletion::isCompleted)
        .map(TaskCompletion::getPeriodKey)
        .collect(Collectors.toCollection(LinkedHashSet::new));
  }

  /**
   * Applies every update as one unit: each entry is validated before anything is written, and a
   * failure while writing rolls back the whole batch. Cells not named in {@code updates} keep
   * their state.
   *
   * @throws InvalidArgumentException naming the first malformed entry; nothing is written
   * @throws CompletionBatchFailedException if the write itself fails; nothing is written
   */
  @Transactional
  public CompletionBatchResult bulkSave(
      RecurringTask task, List<CompletionUpdate> updates, String actorId) {
    Map<String, TaskCompletion> existing =
        completionRepository.findByTaskId(task.getId()).stream()
            .collect(
                Collectors.toMap(
                    c -> c.getClientId() + "|" + c.getPeriodKey(), Function.identity()));

    validate(task, updates, existing);

    int completed = 0;
    int cleared = 0;
    List<TaskCompletion> dirty = new ArrayList<>();
    for (CompletionUpdate update : updates) {
      TaskCompletion row = existing.get(update.cellKey());
      if (update.completed()) {
        if (row == null) {
          row = new TaskCompletion(task.getId(), update.clientId(), update.periodKey());
        }
        String arnNumber = blankToNull(update.arnNumber());
        if (row.markCompleted(actorId, arnNumber, blankToNull(update.arnName()))) {
          completed++;
          dirty.add(row);
        }
      } else if (row != null && row.markIncomplete()) {
        cleared++;
        dirty.add(row);
      }
    }

    try {
      completionRepository.saveAllAndFlush(dirty);
    } catch (DataAccessException e) {
      log.warn(
          "Completion batch of {} entries for recurring task {} failed: {}",
          updates.size(),
          task.getId(),
          e.getMessage());
      throw new CompletionBatchFailedException(task.getId(), updates.size(), e);
    }

    var result = new CompletionBatchResult(updates.size(), completed, cleared);
    log.info(
        "Saved completion batch for recurring task {}: {} completed, {} cleared, {} unchanged",
        task.getId(),
        result.completed(),
        result.cleared(),
        result.unchanged());
    return result;
  }

  /** Stats of one client over {@code visiblePeriods}, read from the ledger. */
  @Transactional(readOnly = true)
  public CompletionStats stats(
      RecurringTask task, String clientId, List<FiscalPeriod> visiblePeriods) {
    return stats(loadCompletions(task, clientId), visiblePeriods);
  }

  /** Counts the completed keys that are among {@code visiblePeriods}; other keys are inert. */
  public CompletionStats stats(
      Set<String> completedPeriodKeys, List<FiscalPeriod> visiblePeriods) {
    int completed =
        (int) visiblePeriods.stream().filter(p -> completedPeriodKeys.contains(p.key())).count();
    return CompletionStats.of(completed, visiblePeriods.size());
  }

  /** Removes every completion row of a task, past and future. */
  @Transactional
  public int deleteAll(UUID taskId) {
    int removed = completionRepository.deleteByTaskId(taskId);
    log.info("Removed {} completion rows of recurring task {}", removed, taskId);
    return removed;
  }

  private void validate(
      RecurringTask task, List<CompletionUpdate> updates, Map<String, TaskCompletion> existing) {
    if (updates == null || updates.isEmpty()) {
      throw new InvalidArgumentException("completions", "Completion batch must not be empty");
    }
    Set<String> contacts = new HashSet<>(task.getContactIds());
    Set<String> seen = new HashSet<>();
    for (CompletionUpdate update : updates) {
      if (update == null) {
        throw new InvalidArgumentException("completions", "Completion entry must not be null");
      }
      if (update.clientId() == null || !contacts.contains(update.clientId())) {
        throw new InvalidArgumentException(
            "clientId",
            "Client %s is not a contact of recurring task %s"
                .formatted(update.clientId(), task.getId()));
      }
      if (!ruleEngine.isVisiblePeriodKey(task.getRecurrencePattern(), update.periodKey())) {
        throw new InvalidArgumentException(
            "periodKey",
            "Period %s is not a %s period of recurring task %s"
                .formatted(update.periodKey(), task.getRecurrencePattern().value(), task.getId()));
      }
      if (!seen.add(update.cellKey())) {
        throw new InvalidArgumentException(
            "completions",
            "Client %s period %s appears more than once in the batch"
                .formatted(update.clientId(), update.periodKey()));
      }
      if (task.isRequiresArn() && update.completed()) {
        TaskCompletion row = existing.get(update.cellKey());
        boolean alreadyCompleted = row != null && row.isCompleted();
        if (!alreadyCompleted) {
          requireArn(update);
        }
      }
    }
  }

  private void requireArn(CompletionUpdate update) {
    if (update.arnNumber() == null || !arnPattern.matcher(update.arnNumber()).matches()) {
      throw new InvalidArgumentException(
          "arnNumber",
          "Client %s period %s requires an ARN of %s digits"
              .formatted(update.clientId(), update.periodKey(), arnLength));
    }
    if (update.arnName() == null || update.arnName().isBlank()) {
      throw new InvalidArgumentException(
          "arnName",
          "Client %s period %s requires the name of whoever provided the ARN"
              .formatted(update.clientId(), update.periodKey()));
    }
  }

  private static String blankToNull(String value) {
    return value == null || value.isBlank() ? null : value.strip();
  }
}
