package io.b2mash.taskdesk.recurringtask.event;

import java.time.Instant;
import java.time.LocalDate;
import java.util.UUID;

public record RecurringTaskPausedEvent(
    UUID taskId, String title, LocalDate frozenOccurrence, String actorId, Instant occurredAt) {}
