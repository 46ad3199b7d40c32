package io.b2mash.taskdesk.recurringtask.dto;

import io.b2mash.taskdesk.recurrence.RecurrencePattern;
import io.b2mash.taskdesk.recurringtask.RecurringTask;
import io.b2mash.taskdesk.recurringtask.RecurringTaskStatus;
import io.b2mash.taskdesk.recurringtask.TaskPriority;
import io.b2mash.taskdesk.team.TeamMemberMapping;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.UUID;

public record RecurringTaskResponse(
    UUID id,
    String title,
    String description,
    TaskPriority priority,
    RecurrencePattern recurrencePattern,
    LocalDate startDate,
    LocalDate endDate,
    LocalDate nextOccurrence,
    RecurringTaskStatus status,
    List<String> contactIds,
    String teamId,
    List<TeamMemberMapping> teamMemberMappings,
    boolean requiresArn,
    String categoryId,
    String createdBy,
    Instant createdAt,
    Instant updatedAt,
    Instant stoppedAt) {

  public static RecurringTaskResponse from(RecurringTask task) {
    return new RecurringTaskResponse(
        task.getId(),
        task.getTitle(),
        task.getDescription(),
        task.getPriority(),
        task.getRecurrencePattern(),
        task.getStartDate(),
        task.getEndDate(),
        task.getNextOccurrence(),
        task.getStatus(),
        task.getContactIds(),
        task.getTeamId(),
        task.getTeamMemberMappings(),
        task.isRequiresArn(),
        task.getCategoryId(),
        task.getCreatedBy(),
        task.getCreatedAt(),
        task.getUpdatedAt(),
        task.getStoppedAt());
  }
}
