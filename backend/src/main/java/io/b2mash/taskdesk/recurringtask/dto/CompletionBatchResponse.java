package io.b2mash.taskdesk.recurringtask.dto;

import io.b2mash.taskdesk.completion.CompletionBatchResult;
import java.util.UUID;

public record CompletionBatchResponse(
    UUID taskId, int entries, int completed, int cleared, int unchanged) {

  public static CompletionBatchResponse of(UUID taskId, CompletionBatchResult result) {
    return new CompletionBatchResponse(
        taskId, result.entries(), result.completed(), result.cleared(), result.unchanged());
  }
}
