package io.b2mash.taskdesk.recurrence;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.b2mash.taskdesk.exception.InvalidArgumentException;
import java.time.LocalDate;
import java.time.YearMonth;
import java.util.List;
import org.junit.jupiter.api.Test;

class RecurrenceRuleEngineTest {

  private final RecurrenceRuleEngine engine = new RecurrenceRuleEngine();

  // ---- generateFiscalYearPeriods ----

  @Test
  void fiscalYearRunsFromAprilToMarch() {
    var periods = engine.generateFiscalYearPeriods(2025);

    assertThat(periods).hasSize(12);
    assertThat(periods.get(0))
        .isEqualTo(new FiscalPeriod("2025-04", "Apr 2025", LocalDate.of(2025, 4, 1)));
    assertThat(periods.get(11).key()).isEqualTo("2026-03");
    assertThat(periods.get(11).label()).isEqualTo("Mar 2026");
  }

  // ---- visiblePeriods ----

  @Test
  void monthlyShowsEveryPeriod() {
    assertThat(engine.visiblePeriods(RecurrencePattern.MONTHLY, 2025)).hasSize(12);
  }

  @Test
  void quarterlyShowsAprilJulyOctoberJanuary() {
    assertThat(keys(engine.visiblePeriods(RecurrencePattern.QUARTERLY, 2025)))
        .containsExactly("2025-04", "2025-07", "2025-10", "2026-01");
  }

  @Test
  void halfYearlyShowsAprilAndOctober() {
    assertThat(keys(engine.visiblePeriods(RecurrencePattern.HALF_YEARLY, 2025)))
        .containsExactly("2025-04", "2025-10");
  }

  @Test
  void yearlyShowsAprilOnly() {
    assertThat(keys(engine.visiblePeriods(RecurrencePattern.YEARLY, 2025)))
        .containsExactly("2025-04");
  }

  @Test
  void quarterlySlotsStayAprilAnchoredForJuneStart() {
    LocalDate juneStart = LocalDate.of(2025, 6, 15);

    var periods =
        engine.visiblePeriods(RecurrencePattern.QUARTERLY, engine.fiscalYearOf(juneStart));

    assertThat(keys(periods)).containsExactly("2025-04", "2025-07", "2025-10", "2026-01");
  }

  // ---- nextOccurrenceAfter ----

  @Test
  void monthlyClampsToEndOfShorterMonth() {
    assertThat(engine.nextOccurrenceAfter(RecurrencePattern.MONTHLY, LocalDate.of(2025, 1, 31)))
        .isEqualTo(LocalDate.of(2025, 2, 28));
    assertThat(engine.nextOccurrenceAfter(RecurrencePattern.MONTHLY, LocalDate.of(2024, 1, 31)))
        .isEqualTo(LocalDate.of(2024, 2, 29));
  }

  @Test
  void quarterlyAdvancesThreeMonths() {
    assertThat(
            engine.nextOccurrenceAfter(RecurrencePattern.QUARTERLY, LocalDate.of(2025, 11, 30)))
        .isEqualTo(LocalDate.of(2026, 2, 28));
  }

  @Test
  void halfYearlyAdvancesSixMonths() {
    assertThat(
            engine.nextOccurrenceAfter(RecurrencePattern.HALF_YEARLY, LocalDate.of(2025, 8, 31)))
        .isEqualTo(LocalDate.of(2026, 2, 28));
  }

  @Test
  void yearlyFromLeapDayLandsOnTwentyEighth() {
    assertThat(engine.nextOccurrenceAfter(RecurrencePattern.YEARLY, LocalDate.of(2024, 2, 29)))
        .isEqualTo(LocalDate.of(2025, 2, 28));
  }

  @Test
  void nullAnchorIsRejected() {
    assertThatThrownBy(() -> engine.nextOccurrenceAfter(RecurrencePattern.MONTHLY, null))
        .isInstanceOf(InvalidArgumentException.class);
  }

  // ---- catchUp ----

  @Test
  void catchUpStepsToFirstOccurrenceOnOrAfterToday() {
    var next =
        engine.catchUp(
            RecurrencePattern.MONTHLY, LocalDate.of(2025, 1, 15), LocalDate.of(2025, 4, 10), 100);

    assertThat(next).isEqualTo(LocalDate.of(2025, 4, 15));
  }

  @Test
  void catchUpKeepsOccurrenceThatIsToday() {
    var today = LocalDate.of(2025, 4, 10);

    assertThat(engine.catchUp(RecurrencePattern.QUARTERLY, today, today, 100)).isEqualTo(today);
  }

  @Test
  void catchUpKeepsFutureOccurrence() {
    var future = LocalDate.of(2025, 9, 1);

    assertThat(engine.catchUp(RecurrencePattern.MONTHLY, future, LocalDate.of(2025, 4, 1), 100))
        .isEqualTo(future);
  }

  @Test
  void catchUpJumpsToTodayWhenStepLimitIsReached() {
    var today = LocalDate.of(2025, 4, 10);

    assertThat(engine.catchUp(RecurrencePattern.MONTHLY, LocalDate.of(2000, 1, 1), today, 2))
        .isEqualTo(today);
  }

  // ---- period keys ----

  @Test
  void januaryToMarchBelongToPreviousFiscalYear() {
    assertThat(engine.fiscalYearOf(LocalDate.of(2026, 3, 31))).isEqualTo(2025);
    assertThat(engine.fiscalYearOf(LocalDate.of(2026, 4, 1))).isEqualTo(2026);
  }

  @Test
  void periodKeyRoundTripsThroughYearMonth() {
    assertThat(engine.periodKeyOf(LocalDate.of(2025, 7, 19))).isEqualTo("2025-07");
    assertThat(engine.parsePeriodKey("2025-07")).isEqualTo(YearMonth.of(2025, 7));
  }

  @Test
  void visiblePeriodKeyFollowsPatternStride() {
    assertThat(engine.isVisiblePeriodKey(RecurrencePattern.QUARTERLY, "2026-01")).isTrue();
    assertThat(engine.isVisiblePeriodKey(RecurrencePattern.QUARTERLY, "2026-02")).isFalse();
    assertThat(engine.isVisiblePeriodKey(RecurrencePattern.YEARLY, "2025-04")).isTrue();
    assertThat(engine.isVisiblePeriodKey(RecurrencePattern.YEARLY, "2025-10")).isFalse();
    assertThat(engine.isVisiblePeriodKey(RecurrencePattern.MONTHLY, "2025-11")).isTrue();
  }

  @Test
  void malformedPeriodKeysAreRejected() {
    for (String key : List.of("2025-7", "2025-13", "07-2025", "")) {
      assertThatThrownBy(() -> engine.isVisiblePeriodKey(RecurrencePattern.MONTHLY, key))
          .isInstanceOfSatisfying(
              InvalidArgumentException.class, e -> assertThat(e.getField()).isEqualTo("periodKey"));
    }
  }

  @Test
  void patternAcceptsWireValueAndConstantName() {
    assertThat(RecurrencePattern.fromValue("half-yearly")).isEqualTo(RecurrencePattern.HALF_YEARLY);
    assertThat(RecurrencePattern.fromValue("QUARTERLY")).isEqualTo(RecurrencePattern.QUARTERLY);
    assertThatThrownBy(() -> RecurrencePattern.fromValue("weekly"))
        .isInstanceOf(InvalidArgumentException.class);
  }

  private static List<String> keys(List<FiscalPeriod> periods) {
    return periods.stream().map(FiscalPeriod::key).toList();
  }
}
