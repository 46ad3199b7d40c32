package io.b2mash.taskdesk.completion;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;
import java.time.Instant;
import java.util.UUID;

/**
 * Completion state of one client for one period of a recurring task. Identified by {@code (taskId,
 * clientId, periodKey)}; created the first time the period is marked completed and updated in
 * place afterwards. No version column: concurrent writers to the same row are last-write-wins.
 */
@Entity
@Table(
    name = "task_completions",
    uniqueConstraints =
        @UniqueConstraint(
            name = "uq_task_completions_task_client_period",
            columnNames = {"task_id", "client_id", "period_key"}))
public class TaskCompletion {

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @Column(name = "task_id", nullable = false)
  private UUID taskId;

  @Column(name = "client_id", nullable = false, length = 100)
  private String clientId;

  @Column(name = "period_key", nullable = false, length = 7)
  private String periodKey;

  @Column(name = "is_completed", nullable = false)
  private boolean completed;

  @Column(name = "completed_by", length = 100)
  private String completedBy;

  @Column(name = "completed_at")
  private Instant completedAt;

  @Column(name = "arn_number", length = 32)
  private String arnNumber;

  @Column(name = "arn_name", length = 200)
  private String arnName;

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  @Column(name = "updated_at", nullable = false)
  private Instant updatedAt;

  protected TaskCompletion() {}

  public TaskCompletion(UUID taskId, String clientId, String periodKey) {
    this.taskId = taskId;
    this.clientId = clientId;
    this.periodKey = periodKey;
    this.completed = false;
    this.createdAt = Instant.now();
    this.updatedAt = Instant.now();
  }

  /**
   * Marks the period completed. Audit fields and ARN data are only written on the transition from
   * not completed; re-completing a completed period leaves them as they were.
   *
   * @return true if the row changed state
   */
  public boolean markCompleted(String actorId, String arnNumber, String arnName) {
    if (completed) {
      return false;
    }
    this.completed = true;
    this.completedBy = actorId;
    this.completedAt = Instant.now();
    this.arnNumber = arnNumber;
    this.arnName = arnName;
    this.updatedAt = Instant.now();
    return true;
  }

  /**
   * Clears the completion. The row itself is kept.
   *
   * @return true if the row changed state
   */
  public boolean markIncomplete() {
    if (!completed) {
      return false;
    }
    this.completed = false;
    this.completedBy = null;
    this.completedAt = null;
    this.arnNumber = null;
    this.arnName = null;
    this.updatedAt = Instant.now();
    return true;
  }

  public UUID getId() {
    return id;
  }

  public UUID getTaskId() {
    return taskId;
  }

  public String getClientId() {
    return clientId;
  }

  public String getPeriodKey() {
    return periodKey;
  }

  public boolean isCompleted() {
    return completed;
  }

  public String getCompletedBy() {
    return completedBy;
  }

  public Instant getCompletedAt() {
    return completedAt;
  }

  public String getArnNumber() {
    return arnNumber;
  }

  public String getArnName() {
    return arnName;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }

  public Instant getUpdatedAt() {
    return updatedAt;
  }
}
