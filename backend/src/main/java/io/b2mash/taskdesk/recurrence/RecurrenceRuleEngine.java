package io.b2mash.taskdesk.recurrence;

import io.b2mash.taskdesk.exception.InvalidArgumentException;
import java.time.LocalDate;
import java.time.Month;
import java.time.YearMonth;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.stream.IntStream;
import org.springframework.stereotype.Component;

/**
 * Stateless recurrence rules. Occurrences are never materialized: the visible periods of a fiscal
 * year and the next occurrence date are recomputed from the pattern on every call.
 *
 * <p>Periods are always indexed from April. A quarterly task shows April, July, October and
 * January whatever month its start date falls in.
 */
@Component
public class RecurrenceRuleEngine {

  public static final Month FISCAL_YEAR_START = Month.APRIL;
  public static final int PERIODS_PER_FISCAL_YEAR = 12;

  private static final DateTimeFormatter KEY_FORMAT = DateTimeFormatter.ofPattern("uuuu-MM");
  private static final DateTimeFormatter LABEL_FORMAT =
      DateTimeFormatter.ofPattern("MMM uuuu", Locale.ENGLISH);

  /** Returns the twelve monthly periods from April of {@code referenceYear} to March after. */
  public List<FiscalPeriod> generateFiscalYearPeriods(int referenceYear) {
    YearMonth first = YearMonth.of(referenceYear, FISCAL_YEAR_START);
    List<FiscalPeriod> periods = new ArrayList<>(PERIODS_PER_FISCAL_YEAR);
    for (int i = 0; i < PERIODS_PER_FISCAL_YEAR; i++) {
      YearMonth month = first.plusMonths(i);
      periods.add(
          new FiscalPeriod(
              month.format(KEY_FORMAT), month.format(LABEL_FORMAT), month.atDay(1)));
    }
    return List.copyOf(periods);
  }

  /**
   * Keeps every n-th period (1, 3, 6 or 12 by pattern) of {@code allPeriods}, starting at index 0.
   *
   * @param allPeriods the April-anchored fiscal year from {@link #generateFiscalYearPeriods(int)}
   */
  public List<FiscalPeriod> visiblePeriods(
      RecurrencePattern pattern, List<FiscalPeriod> allPeriods) {
    int stride = strideOf(pattern);
    return IntStream.range(0, allPeriods.size())
        .filter(i -> i % stride == 0)
        .mapToObj(allPeriods::get)
        .toList();
  }

  public List<FiscalPeriod> visiblePeriods(RecurrencePattern pattern, int fiscalYear) {
    return visiblePeriods(pattern, generateFiscalYearPeriods(fiscalYear));
  }

  /**
   * Advances {@code anchorDate} by one period using calendar-month arithmetic. Day-of-month is
   * clamped to the end of the target month, so 31 January plus one month is 28 (or 29) February.
   *
   * @throws InvalidArgumentException if {@code anchorDate} is null
   */
  public LocalDate nextOccurrenceAfter(RecurrencePattern pattern, LocalDate anchorDate) {
    if (anchorDate == null) {
      throw new InvalidArgumentException("anchorDate", "Anchor date is required");
    }
    return anchorDate.plusMonths(strideOf(pattern));
  }

  /**
   * Steps {@code occurrence} forward one period at a time until it is on or after {@code today}.
   * Returns {@code occurrence} unchanged when it has not elapsed.
   *
   * @param maxSteps safety valve against runaway loops on corrupt dates
   */
  public LocalDate catchUp(
      RecurrencePattern pattern, LocalDate occurrence, LocalDate today, int maxSteps) {
    LocalDate next = occurrence;
    int steps = 0;
    while (next.isBefore(today) && steps < maxSteps) {
      next = nextOccurrenceAfter(pattern, next);
      steps++;
    }
    if (next.isBefore(today)) {
      // Safety valve reached; jump straight to today rather than leave the task overdue.
      return today;
    }
    return next;
  }

  /** Fiscal year containing {@code date}: January to March belong to the previous year's. */
  public int fiscalYearOf(LocalDate date) {
    return date.getMonthValue() >= FISCAL_YEAR_START.getValue()
        ? date.getYear()
        : date.getYear() - 1;
  }

  public String periodKeyOf(LocalDate date) {
    return YearMonth.from(date).format(KEY_FORMAT);
  }

  /**
   * Parses a {@code yyyy-MM} period key.
   *
   * @throws InvalidArgumentException if the key is blank or not a year-month
   */
  public YearMonth parsePeriodKey(String periodKey) {
    if (periodKey == null || periodKey.isBlank()) {
      throw new InvalidArgumentException("periodKey", "Period key is required");
    }
    try {
      return YearMonth.parse(periodKey, KEY_FORMAT);
    } catch (DateTimeParseException e) {
      throw new InvalidArgumentException(
          "periodKey", "Period key must be formatted yyyy-MM, got: " + periodKey);
    }
  }

  /** Returns true if {@code periodKey} is one of the pattern's visible slots in its fiscal year. */
  public boolean isVisiblePeriodKey(RecurrencePattern pattern, String periodKey) {
    YearMonth month = parsePeriodKey(periodKey);
    int index =
        Math.floorMod(
            month.getMonthValue() - FISCAL_YEAR_START.getValue(), PERIODS_PER_FISCAL_YEAR);
    return index % strideOf(pattern) == 0;
  }

  private static int strideOf(RecurrencePattern pattern) {
    if (pattern == null) {
      throw new IllegalArgumentException("Recurrence pattern must not be null");
    }
    return switch (pattern) {
      case MONTHLY -> 1;
      case QUARTERLY -> 3;
      case HALF_YEARLY -> 6;
      case YEARLY -> 12;
    };
  }
}
