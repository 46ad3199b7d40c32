package io.b2mash.taskdesk.recurringtask.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.b2mash.taskdesk.completion.CompletionUpdate;
import jakarta.validation.constraints.NotBlank;

public record CompletionEntryRequest(
    @NotBlank String clientId,
    @NotBlank String periodKey,
    @JsonProperty("isCompleted") boolean completed,
    String arnNumber,
    String arnName) {

  public CompletionUpdate toUpdate() {
    return new CompletionUpdate(clientId, periodKey, completed, arnNumber, arnName);
  }
}
