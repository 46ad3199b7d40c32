package io.b2mash.taskdesk.recurringtask.dto;

import io.b2mash.taskdesk.recurrence.RecurrencePattern;
import io.b2mash.taskdesk.recurringtask.TaskPriority;
import io.b2mash.taskdesk.team.TeamMemberMapping;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;
import java.time.LocalDate;
import java.util.List;

/** Partial update: a null field keeps its current value. */
public record UpdateRecurringTaskRequest(
    @Size(min = 1, max = 200) @Pattern(regexp = "(?s).*\\S.*", message = "must not be blank")
        String title,
    String description,
    TaskPriority priority,
    RecurrencePattern recurrencePattern,
    LocalDate startDate,
    LocalDate endDate,
    @Size(min = 1) List<@NotBlank String> contactIds,
    @Size(max = 100) String teamId,
    List<@NotNull @Valid TeamMemberMapping> teamMemberMappings,
    Boolean requiresArn,
    @Size(max = 100) String categoryId) {

  public boolean reschedules() {
    return recurrencePattern != null || startDate != null || endDate != null;
  }

  public boolean reassignsClients() {
    return contactIds != null || teamId != null || teamMemberMappings != null;
  }
}
