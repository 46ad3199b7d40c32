package io.b2mash.taskdesk.recurringtask.dto;

import io.b2mash.taskdesk.recurrence.RecurrencePattern;
import io.b2mash.taskdesk.recurringtask.TaskPriority;
import io.b2mash.taskdesk.team.TeamMemberMapping;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import java.time.LocalDate;
import java.util.List;

public record CreateRecurringTaskRequest(
    @NotBlank @Size(max = 200) String title,
    String description,
    TaskPriority priority,
    @NotNull RecurrencePattern recurrencePattern,
    @NotNull LocalDate startDate,
    LocalDate endDate,
    @NotEmpty List<@NotBlank String> contactIds,
    @Size(max = 100) String teamId,
    List<@NotNull @Valid TeamMemberMapping> teamMemberMappings,
    boolean requiresArn,
    @Size(max = 100) String categoryId) {}
