package io.b2mash.yahrzeit.anniversary;

import static org.assertj.core.api.Assertions.assertThat;

import io.b2mash.yahrzeit.calendar.ArithmeticDateTableSource;
import io.b2mash.yahrzeit.calendar.HebrewCalendarConverter;
import io.b2mash.yahrzeit.calendar.HebrewDate;
import io.b2mash.yahrzeit.calendar.HebrewMonth;
import io.b2mash.yahrzeit.calendar.HebrewMonthDay;
import java.time.LocalDate;
import org.junit.jupiter.api.Test;

class AnniversaryCalculatorTest {

  private static final HebrewMonthDay TEVET_22 = new HebrewMonthDay(HebrewMonth.TEVET, 22);

  private final HebrewCalendarConverter converter =
      new HebrewCalendarConverter(new ArithmeticDateTableSource());
  private final AnniversaryCalculator calculator = new AnniversaryCalculator(converter, 0);

  @Test
  void initialAnniversary_keepsHebrewDateOfDeath() {
    var initial = calculator.initialAnniversary(LocalDate.of(2023, 1, 15));

    assertThat(initial.deathDateHebrew()).isEqualTo(new HebrewDate(5783, HebrewMonth.TEVET, 22));
    assertThat(initial.anniversary()).isEqualTo(TEVET_22);
  }

  @Test
  void initialAnniversary_appliesConfiguredMonthOffset() {
    var elevenMonths = new AnniversaryCalculator(converter, 11);

    var initial = elevenMonths.initialAnniversary(LocalDate.of(2023, 1, 15));

    assertThat(initial.deathDateHebrew()).isEqualTo(new HebrewDate(5783, HebrewMonth.TEVET, 22));
    assertThat(initial.anniversary()).isEqualTo(new HebrewMonthDay(HebrewMonth.KISLEV, 22));
  }

  @Test
  void nextOccurrence_isStrictlyAfterGivenDate() {
    assertThat(calculator.nextOccurrence(TEVET_22, LocalDate.of(2023, 1, 15)))
        .isEqualTo(LocalDate.of(2024, 1, 3));
    assertThat(calculator.nextOccurrence(TEVET_22, LocalDate.of(2024, 1, 2)))
        .isEqualTo(LocalDate.of(2024, 1, 3));
    assertThat(calculator.nextOccurrence(TEVET_22, LocalDate.of(2024, 1, 3)))
        .isEqualTo(LocalDate.of(2025, 1, 22));
  }

  @Test
  void nextOccurrence_skipsYearsWithoutAdarI() {
    var adarI21 = new HebrewMonthDay(HebrewMonth.ADAR_I, 21);

    assertThat(calculator.nextOccurrence(adarI21, LocalDate.of(2024, 1, 1)))
        .isEqualTo(LocalDate.of(2024, 3, 1));
    // 5785 and 5786 are common years; the next Adar I is in 5787
    assertThat(calculator.nextOccurrence(adarI21, LocalDate.of(2024, 3, 1)))
        .isEqualTo(LocalDate.of(2027, 2, 28));
  }

  @Test
  void nextOccurrence_skipsYearsWithShortCheshvanOrKislev() {
    assertThat(
            calculator.nextOccurrence(
                new HebrewMonthDay(HebrewMonth.CHESHVAN, 30), LocalDate.of(2023, 10, 1)))
        .isEqualTo(LocalDate.of(2024, 12, 1));
    assertThat(
            calculator.nextOccurrence(
                new HebrewMonthDay(HebrewMonth.KISLEV, 30), LocalDate.of(2023, 10, 1)))
        .isEqualTo(LocalDate.of(2024, 12, 31));
  }

  @Test
  void firstOccurrence_countsTodayButNeverTheDateOfDeath() {
    var deathDate = LocalDate.of(2023, 1, 15);

    assertThat(calculator.firstOccurrence(TEVET_22, deathDate, deathDate))
        .isEqualTo(LocalDate.of(2024, 1, 3));
    assertThat(calculator.firstOccurrence(TEVET_22, deathDate, LocalDate.of(2024, 1, 3)))
        .isEqualTo(LocalDate.of(2024, 1, 3));
    assertThat(calculator.firstOccurrence(TEVET_22, deathDate, LocalDate.of(2024, 6, 1)))
        .isEqualTo(LocalDate.of(2025, 1, 22));
  }

  @Test
  void cycleYear_isHebrewYearOfOccurrence() {
    assertThat(calculator.cycleYear(LocalDate.of(2024, 1, 3))).isEqualTo(5784);
    assertThat(calculator.cycleYear(LocalDate.of(2025, 1, 22))).isEqualTo(5785);
  }

  @Test
  void consecutiveOccurrences_followLeapCycle() {
    var occurrence = LocalDate.of(2023, 1, 15);
    int previousYear = calculator.cycleYear(occurrence);
    for (int i = 0; i < 19; i++) {
      occurrence = calculator.nextOccurrence(TEVET_22, occurrence);
      int year = calculator.cycleYear(occurrence);
      assertThat(year).isEqualTo(previousYear + 1);
      assertThat(converter.toHebrew(occurrence).monthDay()).isEqualTo(TEVET_22);
      previousYear = year;
    }
  }

  @Test
  void memorialDates_reportsAzkaraAndFirstYahrzeit() {
    var dates = calculator.memorialDates(LocalDate.of(2023, 1, 15), LocalDate.of(2023, 6, 1));

    assertThat(dates.deathDateHebrew()).isEqualTo(new HebrewDate(5783, HebrewMonth.TEVET, 22));
    assertThat(dates.azkara().gregorianDate()).isEqualTo(LocalDate.of(2023, 12, 5));
    assertThat(dates.azkara().hebrewDate()).isEqualTo(new HebrewDate(5784, HebrewMonth.KISLEV, 22));
    assertThat(dates.nextYahrzeit().gregorianDate()).isEqualTo(LocalDate.of(2024, 1, 3));
    assertThat(dates.nextYahrzeit().daysUntil()).isEqualTo(216);
    assertThat(dates.firstYear()).isTrue();
  }

  @Test
  void memorialDates_afterFirstYahrzeit_isNoLongerFirstYear() {
    var dates = calculator.memorialDates(LocalDate.of(2023, 1, 15), LocalDate.of(2024, 6, 1));

    assertThat(dates.nextYahrzeit().gregorianDate()).isEqualTo(LocalDate.of(2025, 1, 22));
    assertThat(dates.firstYear()).isFalse();
  }
}
