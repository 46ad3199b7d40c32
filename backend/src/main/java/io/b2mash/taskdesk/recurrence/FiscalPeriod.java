package io.b2mash.taskdesk.recurrence;

import java.time.LocalDate;

/**
 * One slot of the twelve-month fiscal year.
 *
 * @param key year-month token, e.g. {@code "2025-04"}; the {@code periodKey} of completions
 * @param label display label, e.g. {@code "Apr 2025"}
 * @param date first day of the month
 */
public record FiscalPeriod(String key, String label, LocalDate date) {}
