package io.b2mash.taskdesk.completion;

import java.util.List;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface TaskCompletionRepository extends JpaRepository<TaskCompletion, UUID> {

  List<TaskCompletion> findByTaskId(UUID taskId);

  List<TaskCompletion> findByTaskIdAndClientId(UUID taskId, String clientId);

  long countByTaskId(UUID taskId);

  @Modifying
  @Query("DELETE FROM TaskCompletion c WHERE c.taskId = :taskId")
  int deleteByTaskId(@Param("taskId") UUID taskId);
}
