package io.b2mash.taskdesk.recurringtask.dto;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import java.util.List;

public record BulkSaveCompletionsRequest(
    @NotEmpty List<@NotNull @Valid CompletionEntryRequest> entries) {}
