package io.b2mash.taskdesk.recurringtask;

import io.b2mash.taskdesk.audit.AuditEventBuilder;
import io.b2mash.taskdesk.audit.AuditService;
import io.b2mash.taskdesk.completion.CompletionBatchResult;
import io.b2mash.taskdesk.completion.CompletionStats;
import io.b2mash.taskdesk.completion.CompletionTracker;
import io.b2mash.taskdesk.completion.CompletionUpdate;
import io.b2mash.taskdesk.config.RecurringTaskProperties;
import io.b2mash.taskdesk.exception.CompletionBatchFailedException;
import io.b2mash.taskdesk.exception.InvalidArgumentException;
import io.b2mash.taskdesk.exception.ResourceNotFoundException;
import io.b2mash.taskdesk.member.MemberContext;
import io.b2mash.taskdesk.recurrence.FiscalPeriod;
import io.b2mash.taskdesk.recurrence.RecurrencePattern;
import io.b2mash.taskdesk.recurrence.RecurrenceRuleEngine;
import io.b2mash.taskdesk.recurringtask.dto.AuditEventResponse;
import io.b2mash.taskdesk.recurringtask.dto.ClientProgressResponse;
import io.b2mash.taskdesk.recurringtask.dto.CreateRecurringTaskRequest;
import io.b2mash.taskdesk.recurringtask.dto.RecurringTaskResponse;
import io.b2mash.taskdesk.recurringtask.dto.UpdateRecurringTaskRequest;
import io.b2mash.taskdesk.recurringtask.event.RecurringTaskPausedEvent;
import io.b2mash.taskdesk.recurringtask.event.RecurringTaskResumedEvent;
import io.b2mash.taskdesk.recurringtask.event.RecurringTaskStoppedEvent;
import io.b2mash.taskdesk.recurringtask.event.TaskCompletionsSavedEvent;
import io.b2mash.taskdesk.team.TeamMemberMapping;
import io.b2mash.taskdesk.team.TeamMemberMappingResolver;
import java.time.Instant;
import java.time.LocalDate;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.orm.ObjectOptimisticLockingFailureException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
public class RecurringTaskService {

  private static final Logger log = LoggerFactory.getLogger(RecurringTaskService.class);

  private static final String ENTITY_TYPE = "recurring_task";

  private final RecurringTaskRepository taskRepository;
  private final RecurringTaskLifecycle lifecycle;
  private final RecurrenceRuleEngine ruleEngine;
  private final TeamMemberMappingResolver mappingResolver;
  private final CompletionTracker completionTracker;
  private final RecurringTaskProperties properties;
  private final AuditService auditService;
  private final ApplicationEventPublisher eventPublisher;

  public RecurringTaskService(
      RecurringTaskRepository taskRepository,
      RecurringTaskLifecycle lifecycle,
      RecurrenceRuleEngine ruleEngine,
      TeamMemberMappingResolver mappingResolver,
      CompletionTracker completionTracker,
      RecurringTaskProperties properties,
      AuditService auditService,
      ApplicationEventPublisher eventPublisher) {
    this.taskRepository = taskRepository;
    this.lifecycle = lifecycle;
    this.ruleEngine = ruleEngine;
    this.mappingResolver = mappingResolver;
    this.completionTracker = completionTracker;
    this.properties = properties;
    this.auditService = auditService;
    this.eventPublisher = eventPublisher;
  }

  @Transactional
  public RecurringTaskResponse create(CreateRecurringTaskRequest request, String memberId) {
    requireEndAfterStart(request.startDate(), request.endDate());
    requireContactIds(request.contactIds());
    List<TeamMemberMapping> mappings =
        request.teamMemberMappings() != null ? request.teamMemberMappings() : List.of();
    mappingResolver.validateMapping(mappings, request.contactIds());

    var task =
        new RecurringTask(
            request.title(),
            request.description(),
            request.priority(),
            request.recurrencePattern(),
            request.startDate(),
            request.endDate(),
            request.contactIds(),
            request.teamId(),
            mappings,
            request.requiresArn(),
            request.categoryId(),
            memberId);
    lifecycle.initialize(task);
    task = taskRepository.save(task);

    log.info(
        "Created recurring task {} ({}, next occurrence {})",
        task.getId(),
        task.getRecurrencePattern().value(),
        task.getNextOccurrence());

    auditService.log(
        AuditEventBuilder.builder()
            .eventType("recurring_task.created")
            .entityType(ENTITY_TYPE)
            .entityId(task.getId())
            .details(
                Map.of(
                    "title", task.getTitle(),
                    "recurrence_pattern", task.getRecurrencePattern().value(),
                    "next_occurrence", task.getNextOccurrence().toString(),
                    "contact_count", task.getContactIds().size()))
            .build());

    return RecurringTaskResponse.from(task);
  }

  /**
   * Applies the non-null fields of {@code request}. A new pattern or start date reschedules the
   * series from its start date, as on create.
   */
  @Transactional
  public RecurringTaskResponse update(UUID id, UpdateRecurringTaskRequest request) {
    if (request.title() != null && request.title().isBlank()) {
      throw new InvalidArgumentException("title", "Title must not be blank");
    }
    var task = findTask(id);

    task.updateDetails(
        Objects.requireNonNullElse(request.title(), task.getTitle()),
        request.description() != null ? request.description() : task.getDescription(),
        Objects.requireNonNullElse(request.priority(), task.getPriority()),
        request.categoryId() != null ? request.categoryId() : task.getCategoryId(),
        Objects.requireNonNullElse(request.requiresArn(), task.isRequiresArn()));

    boolean rescheduled = false;
    if (request.reschedules()) {
      RecurrencePattern pattern =
          Objects.requireNonNullElse(request.recurrencePattern(), task.getRecurrencePattern());
      LocalDate startDate = Objects.requireNonNullElse(request.startDate(), task.getStartDate());
      LocalDate endDate = request.endDate() != null ? request.endDate() : task.getEndDate();
      requireEndAfterStart(startDate, endDate);

      rescheduled =
          pattern != task.getRecurrencePattern() || !startDate.equals(task.getStartDate());
      task.reschedule(pattern, startDate, endDate);
      if (rescheduled) {
        lifecycle.initialize(task);
      } else if (endDate != null && task.getNextOccurrence().isAfter(endDate)) {
        throw new InvalidArgumentException(
            "endDate",
            "End date %s is before the next occurrence on %s"
                .formatted(endDate, task.getNextOccurrence()));
      }
    }

    if (request.reassignsClients()) {
      List<String> contactIds =
          Objects.requireNonNullElse(request.contactIds(), task.getContactIds());
      requireContactIds(contactIds);
      List<TeamMemberMapping> mappings =
          Objects.requireNonNullElse(request.teamMemberMappings(), task.getTeamMemberMappings());
      mappingResolver.validateMapping(mappings, contactIds);
      task.assignClients(
          contactIds, request.teamId() != null ? request.teamId() : task.getTeamId(), mappings);
    }

    task = saveTask(task);

    log.info("Updated recurring task {}", id);

    auditService.log(
        AuditEventBuilder.builder()
            .eventType("recurring_task.updated")
            .entityType(ENTITY_TYPE)
            .entityId(id)
            .details(
                Map.of(
                    "title", task.getTitle(),
                    "rescheduled", rescheduled,
                    "next_occurrence", String.valueOf(task.getNextOccurrence())))
            .build());

    return RecurringTaskResponse.from(task);
  }

  @Transactional(readOnly = true)
  public RecurringTaskResponse get(UUID id) {
    return RecurringTaskResponse.from(findTask(id));
  }

  /**
   * Lists tasks by next occurrence, soonest first. {@code search} matches title or description,
   * ignoring case; every filter is optional.
   */
  @Transactional(readOnly = true)
  public List<RecurringTaskResponse> list(
      String status, String priority, String categoryId, String search) {
    var tasks =
        taskRepository.findWithFilters(
            parseStatus(status),
            priority != null && !priority.isBlank() ? TaskPriority.fromValue(priority) : null,
            categoryId != null && !categoryId.isBlank() ? categoryId : null);

    String needle =
        search != null && !search.isBlank() ? search.strip().toLowerCase(Locale.ROOT) : null;
    return tasks.stream()
        .filter(task -> needle == null || matchesSearch(task, needle))
        .map(RecurringTaskResponse::from)
        .toList();
  }

  @Transactional
  public RecurringTaskResponse pause(UUID id) {
    var task = findTask(id);
    lifecycle.pause(task);
    task = saveTask(task);

    log.info("Paused recurring task {} at occurrence {}", id, task.getNextOccurrence());

    auditService.log(
        AuditEventBuilder.builder()
            .eventType("recurring_task.paused")
            .entityType(ENTITY_TYPE)
            .entityId(id)
            .details(
                Map.of(
                    "title", task.getTitle(),
                    "next_occurrence", String.valueOf(task.getNextOccurrence())))
            .build());

    eventPublisher.publishEvent(
        new RecurringTaskPausedEvent(
            id,
            task.getTitle(),
            task.getNextOccurrence(),
            MemberContext.getCurrentMemberId(),
            Instant.now()));

    return RecurringTaskResponse.from(task);
  }

  @Transactional
  public RecurringTaskResponse resume(UUID id) {
    var task = findTask(id);
    LocalDate previous = task.getNextOccurrence();
    lifecycle.resume(task, LocalDate.now());
    task = saveTask(task);

    log.info("Resumed recurring task {}; next occurrence {}", id, task.getNextOccurrence());

    auditService.log(
        AuditEventBuilder.builder()
            .eventType("recurring_task.resumed")
            .entityType(ENTITY_TYPE)
            .entityId(id)
            .details(
                Map.of(
                    "previous_occurrence", String.valueOf(previous),
                    "next_occurrence", String.valueOf(task.getNextOccurrence())))
            .build());

    eventPublisher.publishEvent(
        new RecurringTaskResumedEvent(
            id,
            task.getTitle(),
            previous,
            task.getNextOccurrence(),
            MemberContext.getCurrentMemberId(),
            Instant.now()));

    if (task.getStatus() == RecurringTaskStatus.STOPPED) {
      recordStopped(task, "exhausted");
    }
    return RecurringTaskResponse.from(task);
  }

  /**
   * Deletes a task the way {@code option} names. {@link DeleteOption#STOP} keeps the task and its
   * completions readable; {@link DeleteOption#ALL} removes both.
   */
  @Transactional
  public void delete(UUID id, DeleteOption option) {
    var task = findTaskForUpdate(id);
    switch (option) {
      case STOP -> {
        if (lifecycle.stop(task)) {
          task = saveTask(task);
          log.info("Stopped recurring task {}", id);
          recordStopped(task, "stopped");
        } else {
          log.debug("Recurring task {} already stopped", id);
        }
      }
      case ALL -> {
        int removed = completionTracker.deleteAll(id);
        removeTask(task);

        log.info("Deleted recurring task {} with {} completion rows", id, removed);

        auditService.log(
            AuditEventBuilder.builder()
                .eventType("recurring_task.deleted")
                .entityType(ENTITY_TYPE)
                .entityId(id)
                .details(
                    Map.of(
                        "title", task.getTitle(),
                        "status", task.getStatus().name(),
                        "completions_removed", removed))
                .build());

        eventPublisher.publishEvent(
            new RecurringTaskStoppedEvent(
                id, task.getTitle(), "deleted", MemberContext.getCurrentMemberId(), Instant.now()));
      }
    }
  }

  /** Consumes the pending occurrence; the series stops once it runs past its end date. */
  @Transactional
  public RecurringTaskResponse advanceOccurrence(UUID id) {
    var task = findTask(id);
    LocalDate previous = task.getNextOccurrence();
    lifecycle.advance(task);
    task = saveTask(task);

    log.info(
        "Advanced recurring task {} from {} to {}", id, previous, task.getNextOccurrence());

    auditService.log(
        AuditEventBuilder.builder()
            .eventType("recurring_task.occurrence_advanced")
            .entityType(ENTITY_TYPE)
            .entityId(id)
            .details(
                Map.of(
                    "previous_occurrence", String.valueOf(previous),
                    "next_occurrence", String.valueOf(task.getNextOccurrence())))
            .build());

    if (task.getStatus() == RecurringTaskStatus.STOPPED) {
      recordStopped(task, "exhausted");
    }
    return RecurringTaskResponse.from(task);
  }

  /** Visible periods of the task's pattern in {@code fiscalYear}, or in the current one if null. */
  @Transactional(readOnly = true)
  public List<FiscalPeriod> periods(UUID id, Integer fiscalYear) {
    var task = findTask(id);
    var periods = ruleEngine.visiblePeriods(task.getRecurrencePattern(), resolveYear(fiscalYear));
    log.debug("Recurring task {} has {} visible periods", id, periods.size());
    return periods;
  }

  @Transactional(readOnly = true)
  public List<String> visibleClients(UUID id, String viewerId, String viewerRole) {
    var task = findTask(id);
    return List.copyOf(
        mappingResolver.resolveVisibleClients(
            task, viewerId, properties.isPrivileged(viewerRole)));
  }

  /** Completion stats over the visible periods of {@code fiscalYear}, per visible client. */
  @Transactional(readOnly = true)
  public List<ClientProgressResponse> progress(
      UUID id, Integer fiscalYear, String viewerId, String viewerRole) {
    var task = findTask(id);
    Set<String> clients =
        mappingResolver.resolveVisibleClients(task, viewerId, properties.isPrivileged(viewerRole));
    List<FiscalPeriod> periods =
        ruleEngine.visiblePeriods(task.getRecurrencePattern(), resolveYear(fiscalYear));
    Map<String, Set<String>> completions = completionTracker.loadCompletions(task);

    return clients.stream()
        .map(
            clientId -> {
              Set<String> done = completions.getOrDefault(clientId, Set.of());
              CompletionStats stats = completionTracker.stats(done, periods);
              List<String> completedPeriods =
                  periods.stream().map(FiscalPeriod::key).filter(done::contains).toList();
              return new ClientProgressResponse(
                  clientId,
                  stats.completed(),
                  stats.total(),
                  stats.percentage(),
                  completedPeriods);
            })
        .toList();
  }

  /** Completed period keys per client; only {@code clientId}'s if it is given. */
  @Transactional(readOnly = true)
  public Map<String, Set<String>> loadCompletions(UUID id, String clientId) {
    var task = findTask(id);
    if (clientId == null || clientId.isBlank()) {
      return completionTracker.loadCompletions(task);
    }
    Map<String, Set<String>> single = new LinkedHashMap<>();
    single.put(clientId, completionTracker.loadCompletions(task, clientId));
    return single;
  }

  @Transactional
  public CompletionBatchResult saveCompletions(
      UUID id, List<CompletionUpdate> updates, String actorId) {
    var task = findTaskForUpdate(id);
    lifecycle.requireCompletionsPermitted(task);
    CompletionBatchResult result;
    try {
      result = completionTracker.bulkSave(task, updates, actorId);
    } catch (CompletionBatchFailedException e) {
      if (!taskRepository.existsById(id)) {
        throw new ResourceNotFoundException("RecurringTask", id);
      }
      throw e;
    }

    auditService.log(
        AuditEventBuilder.builder()
            .eventType("task_completion.batch_saved")
            .entityType(ENTITY_TYPE)
            .entityId(id)
            .actorId(actorId)
            .details(
                Map.of(
                    "entries", result.entries(),
                    "completed", result.completed(),
                    "cleared", result.cleared()))
            .build());

    eventPublisher.publishEvent(
        new TaskCompletionsSavedEvent(
            id, result.entries(), result.completed(), result.cleared(), actorId, Instant.now()));

    return result;
  }

  /** Audit trail of a task, newest first. Still readable after the task is deleted. */
  @Transactional(readOnly = true)
  public List<AuditEventResponse> history(UUID id) {
    var events = auditService.findEvents(ENTITY_TYPE, id);
    if (events.isEmpty() && !taskRepository.existsById(id)) {
      throw new ResourceNotFoundException("RecurringTask", id);
    }
    return events.stream().map(AuditEventResponse::from).toList();
  }

  private RecurringTask findTask(UUID id) {
    return taskRepository
        .findById(id)
        .orElseThrow(() -> new ResourceNotFoundException("RecurringTask", id));
  }

  private RecurringTask findTaskForUpdate(UUID id) {
    return taskRepository
        .findByIdForUpdate(id)
        .orElseThrow(() -> new ResourceNotFoundException("RecurringTask", id));
  }

  /** A version conflict against a row deleted in the meantime is reported as not found. */
  private RecurringTask saveTask(RecurringTask task) {
    try {
      return taskRepository.saveAndFlush(task);
    } catch (ObjectOptimisticLockingFailureException e) {
      if (!taskRepository.existsById(task.getId())) {
        throw new ResourceNotFoundException("RecurringTask", task.getId());
      }
      throw e;
    }
  }

  private void removeTask(RecurringTask task) {
    try {
      taskRepository.delete(task);
      taskRepository.flush();
    } catch (ObjectOptimisticLockingFailureException e) {
      if (!taskRepository.existsById(task.getId())) {
        throw new ResourceNotFoundException("RecurringTask", task.getId());
      }
      throw e;
    }
  }

  private void recordStopped(RecurringTask task, String reason) {
    auditService.log(
        AuditEventBuilder.builder()
            .eventType("recurring_task.stopped")
            .entityType(ENTITY_TYPE)
            .entityId(task.getId())
            .details(Map.of("title", task.getTitle(), "reason", reason))
            .build());

    eventPublisher.publishEvent(
        new RecurringTaskStoppedEvent(
            task.getId(),
            task.getTitle(),
            reason,
            MemberContext.getCurrentMemberId(),
            Instant.now()));
  }

  private int resolveYear(Integer fiscalYear) {
    return fiscalYear != null ? fiscalYear : ruleEngine.fiscalYearOf(LocalDate.now());
  }

  private static void requireEndAfterStart(LocalDate startDate, LocalDate endDate) {
    if (endDate != null && !endDate.isAfter(startDate)) {
      throw new InvalidArgumentException(
          "endDate", "End date %s must be after start date %s".formatted(endDate, startDate));
    }
  }

  private static void requireContactIds(List<String> contactIds) {
    if (contactIds == null || contactIds.isEmpty()) {
      throw new InvalidArgumentException("contactIds", "At least one contact is required");
    }
    for (String contactId : contactIds) {
      if (contactId == null || contactId.isBlank()) {
        throw new InvalidArgumentException("contactIds", "Contact ids must not be blank");
      }
    }
  }

  private static RecurringTaskStatus parseStatus(String status) {
    if (status == null || status.isBlank()) {
      return null;
    }
    try {
      return RecurringTaskStatus.valueOf(status.strip().toUpperCase(Locale.ROOT));
    } catch (IllegalArgumentException e) {
      throw new InvalidArgumentException("status", "Unrecognized status: " + status);
    }
  }

  private static boolean matchesSearch(RecurringTask task, String needle) {
    return task.getTitle().toLowerCase(Locale.ROOT).contains(needle)
        || (task.getDescription() != null
            && task.getDescription().toLowerCase(Locale.ROOT).contains(needle));
  }
}
