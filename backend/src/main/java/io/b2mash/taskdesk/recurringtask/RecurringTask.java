package io.b2mash.taskdesk.recurringtask;

import io.b2mash.taskdesk.exception.InvalidStateException;
import io.b2mash.taskdesk.recurrence.RecurrencePattern;
import io.b2mash.taskdesk.team.TeamMemberMapping;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import jakarta.persistence.Version;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

/**
 * A single recurring task definition. Occurrences are virtual: one row per task, mutated in place
 * by edits and lifecycle transitions, never copied per period.
 */
@Entity
@Table(name = "recurring_tasks")
public class RecurringTask {

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @Column(name = "title", nullable = false, length = 200)
  private String title;

  @Column(name = "description", columnDefinition = "TEXT")
  private String description;

  @Enumerated(EnumType.STRING)
  @Column(name = "priority", nullable = false, length = 20)
  private TaskPriority priority;

  @Enumerated(EnumType.STRING)
  @Column(name = "recurrence_pattern", nullable = false, length = 20)
  private RecurrencePattern recurrencePattern;

  @Column(name = "start_date", nullable = false)
  private LocalDate startDate;

  @Column(name = "end_date")
  private LocalDate endDate;

  // Null once the series has run past its end date
  @Column(name = "next_occurrence")
  private LocalDate nextOccurrence;

  @Enumerated(EnumType.STRING)
  @Column(name = "status", nullable = false, length = 20)
  private RecurringTaskStatus status;

  @JdbcTypeCode(SqlTypes.JSON)
  @Column(name = "contact_ids", nullable = false, columnDefinition = "jsonb")
  private List<String> contactIds = new ArrayList<>();

  @Column(name = "team_id", length = 100)
  private String teamId;

  @JdbcTypeCode(SqlTypes.JSON)
  @Column(name = "team_member_mappings", nullable = false, columnDefinition = "jsonb")
  private List<TeamMemberMapping> teamMemberMappings = new ArrayList<>();

  @Column(name = "requires_arn", nullable = false)
  private boolean requiresArn;

  @Column(name = "category_id", length = 100)
  private String categoryId;

  @Column(name = "created_by", nullable = false, length = 100)
  private String createdBy;

  @Version
  @Column(name = "version", nullable = false)
  private int version;

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  @Column(name = "updated_at", nullable = false)
  private Instant updatedAt;

  @Column(name = "stopped_at")
  private Instant stoppedAt;

  protected RecurringTask() {}

  public RecurringTask(
      String title,
      String description,
      TaskPriority priority,
      RecurrencePattern recurrencePattern,
      LocalDate startDate,
      LocalDate endDate,
      List<String> contactIds,
      String teamId,
      List<TeamMemberMapping> teamMemberMappings,
      boolean requiresArn,
      String categoryId,
      String createdBy) {
    this.title = title;
    this.description = description;
    this.priority = priority != null ? priority : TaskPriority.MEDIUM;
    this.recurrencePattern = recurrencePattern;
    this.startDate = startDate;
    this.endDate = endDate;
    this.contactIds = copyOf(contactIds);
    this.teamId = teamId;
    this.teamMemberMappings = copyOf(teamMemberMappings);
    this.requiresArn = requiresArn;
    this.categoryId = categoryId;
    this.createdBy = createdBy;
    this.status = RecurringTaskStatus.ACTIVE;
    this.createdAt = Instant.now();
    this.updatedAt = Instant.now();
  }

  public void updateDetails(
      String title,
      String description,
      TaskPriority priority,
      String categoryId,
      boolean requiresArn) {
    requireNotStopped("update");
    this.title = title;
    this.description = description;
    this.priority = priority;
    this.categoryId = categoryId;
    this.requiresArn = requiresArn;
    this.updatedAt = Instant.now();
  }

  public void reschedule(
      RecurrencePattern recurrencePattern, LocalDate startDate, LocalDate endDate) {
    requireNotStopped("reschedule");
    this.recurrencePattern = recurrencePattern;
    this.startDate = startDate;
    this.endDate = endDate;
    this.updatedAt = Instant.now();
  }

  public void assignClients(
      List<String> contactIds, String teamId, List<TeamMemberMapping> teamMemberMappings) {
    requireNotStopped("reassign clients of");
    this.contactIds = copyOf(contactIds);
    this.teamId = teamId;
    this.teamMemberMappings = copyOf(teamMemberMappings);
    this.updatedAt = Instant.now();
  }

  public void setNextOccurrence(LocalDate nextOccurrence) {
    this.nextOccurrence = nextOccurrence;
    this.updatedAt = Instant.now();
  }

  /**
   * Moves to {@code target} if the current status allows it.
   *
   * @throws InvalidStateException naming the current status otherwise
   */
  public void transitionTo(RecurringTaskStatus target, String action) {
    if (!status.canTransitionTo(target)) {
      throw new InvalidStateException(
          "Invalid state transition",
          "Cannot %s recurring task %s in status %s".formatted(action, id, status));
    }
    this.status = target;
    if (target == RecurringTaskStatus.STOPPED) {
      this.stoppedAt = Instant.now();
    }
    this.updatedAt = Instant.now();
  }

  private void requireNotStopped(String action) {
    if (status.isTerminal()) {
      throw new InvalidStateException(
          "Recurring task stopped", "Cannot %s stopped recurring task %s".formatted(action, id));
    }
  }

  private static <T> List<T> copyOf(List<T> values) {
    return values != null ? new ArrayList<>(values) : new ArrayList<>();
  }

  public UUID getId() {
    return id;
  }

  public String getTitle() {
    return title;
  }

  public String getDescription() {
    return description;
  }

  public TaskPriority getPriority() {
    return priority;
  }

  public RecurrencePattern getRecurrencePattern() {
    return recurrencePattern;
  }

  public LocalDate getStartDate() {
    return startDate;
  }

  public LocalDate getEndDate() {
    return endDate;
  }

  public LocalDate getNextOccurrence() {
    return nextOccurrence;
  }

  public RecurringTaskStatus getStatus() {
    return status;
  }

  public List<String> getContactIds() {
    return List.copyOf(contactIds);
  }

  public String getTeamId() {
    return teamId;
  }

  public List<TeamMemberMapping> getTeamMemberMappings() {
    return List.copyOf(teamMemberMappings);
  }

  public boolean isRequiresArn() {
    return requiresArn;
  }

  public String getCategoryId() {
    return categoryId;
  }

  public String getCreatedBy() {
    return createdBy;
  }

  public int getVersion() {
    return version;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }

  public Instant getUpdatedAt() {
    return updatedAt;
  }

  public Instant getStoppedAt() {
    return stoppedAt;
  }
}
