package io.b2mash.taskdesk.recurringtask.event;

import java.time.Instant;
import java.util.UUID;

public record TaskCompletionsSavedEvent(
    UUID taskId, int entries, int completed, int cleared, String actorId, Instant occurredAt) {}
