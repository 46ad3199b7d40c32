package io.b2mash.taskdesk.recurringtask.event;

import java.time.Instant;
import java.util.UUID;

/**
 * Published when a series stops generating occurrences.
 *
 * @param reason {@code stopped} for an explicit stop, {@code deleted} for a delete with option all,
 *     {@code exhausted} when the series ran past its end date
 */
public record RecurringTaskStoppedEvent(
    UUID taskId, String title, String reason, String actorId, Instant occurredAt) {}
