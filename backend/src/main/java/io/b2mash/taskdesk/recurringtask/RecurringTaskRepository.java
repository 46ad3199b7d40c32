package io.b2mash.taskdesk.recurringtask;

import jakarta.persistence.LockModeType;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface RecurringTaskRepository extends JpaRepository<RecurringTask, UUID> {

  /**
   * Lists tasks matching the optional filters (null means no filter on that field), ordered by
   * next occurrence ascending with exhausted series last.
   */
  @Query(
      """
      SELECT t FROM RecurringTask t
      WHERE (:status IS NULL OR t.status = :status)
        AND (:priority IS NULL OR t.priority = :priority)
        AND (CAST(:categoryId AS string) IS NULL OR t.categoryId = :categoryId)
      ORDER BY t.nextOccurrence ASC NULLS LAST, t.createdAt DESC
      """)
  List<RecurringTask> findWithFilters(
      @Param("status") RecurringTaskStatus status,
      @Param("priority") TaskPriority priority,
      @Param("categoryId") String categoryId);

  /** Loads a task and holds its row lock until the surrounding transaction ends. */
  @Lock(LockModeType.PESSIMISTIC_WRITE)
  @Query("SELECT t FROM RecurringTask t WHERE t.id = :id")
  Optional<RecurringTask> findByIdForUpdate(@Param("id") UUID id);
}
