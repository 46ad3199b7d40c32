package io.b2mash.taskdesk.recurringtask.event;

import java.time.Instant;
import java.time.LocalDate;
import java.util.UUID;

/** {@code nextOccurrence} is null when the series ran past its end date while paused. */
public record RecurringTaskResumedEvent(
    UUID taskId,
    String title,
    LocalDate previousOccurrence,
    LocalDate nextOccurrence,
    String actorId,
    Instant occurredAt) {}
