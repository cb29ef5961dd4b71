package io.b2mash.yahrzeit.calendar;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.time.LocalDate;
import org.junit.jupiter.api.Test;

class HebrewCalendarConverterTest {

  private final HebrewCalendarConverter converter =
      new HebrewCalendarConverter(new ArithmeticDateTableSource());

  @Test
  void toHebrew_convertsMidwinterDate() {
    assertThat(converter.toHebrew(LocalDate.of(2023, 1, 15)))
        .isEqualTo(new HebrewDate(5783, HebrewMonth.TEVET, 22));
  }

  @Test
  void toHebrew_roshHashanahStartsNewYear() {
    assertThat(converter.toHebrew(LocalDate.of(2023, 9, 16)))
        .isEqualTo(new HebrewDate(5784, HebrewMonth.TISHREI, 1));
    assertThat(converter.toHebrew(LocalDate.of(2023, 9, 15)))
        .isEqualTo(new HebrewDate(5783, HebrewMonth.ELUL, 29));
  }

  @Test
  void toHebrew_distinguishesAdarIAndAdarIIInLeapYear() {
    assertThat(converter.toHebrew(LocalDate.of(2024, 3, 1)))
        .isEqualTo(new HebrewDate(5784, HebrewMonth.ADAR_I, 21));
    assertThat(converter.toHebrew(LocalDate.of(2024, 3, 25)))
        .isEqualTo(new HebrewDate(5784, HebrewMonth.ADAR, 15));
  }

  @Test
  void toGregorian_invertsToHebrew() {
    assertThat(converter.toGregorian(new HebrewDate(5784, HebrewMonth.TEVET, 22)))
        .isEqualTo(LocalDate.of(2024, 1, 3));
    assertThat(converter.toGregorian(new HebrewDate(5784, HebrewMonth.ADAR_I, 1)))
        .isEqualTo(LocalDate.of(2024, 2, 10));
    assertThat(converter.toGregorian(new HebrewDate(5785, HebrewMonth.TISHREI, 1)))
        .isEqualTo(LocalDate.of(2024, 10, 3));
  }

  @Test
  void toGregorian_rejectsDayMissingFromYear() {
    // 5784 is a 383-day year: Cheshvan and Kislev both have 29 days
    assertThatThrownBy(() -> converter.toGregorian(new HebrewDate(5784, HebrewMonth.KISLEV, 30)))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("does not exist");
    assertThatThrownBy(() -> converter.toGregorian(new HebrewDate(5783, HebrewMonth.ADAR_I, 1)))
        .isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  void toHebrew_roundTripsAcrossSeveralYears() {
    var date = LocalDate.of(2022, 9, 1);
    var end = LocalDate.of(2027, 9, 1);
    while (date.isBefore(end)) {
      assertThat(converter.toGregorian(converter.toHebrew(date))).isEqualTo(date);
      date = date.plusDays(17);
    }
  }

  @Test
  void addMonths_countsLeapYearThirteenthMonth() {
    var tevet = new HebrewDate(5783, HebrewMonth.TEVET, 22);

    assertThat(converter.addMonths(tevet, 12))
        .isEqualTo(new HebrewDate(5784, HebrewMonth.TEVET, 22));
    assertThat(converter.addMonths(tevet, 13))
        .isEqualTo(new HebrewDate(5784, HebrewMonth.SHEVAT, 22));
    assertThat(converter.addMonths(tevet, 11))
        .isEqualTo(new HebrewDate(5784, HebrewMonth.KISLEV, 22));
  }

  @Test
  void addMonths_clampsToShorterMonth() {
    assertThat(converter.addMonths(new HebrewDate(5784, HebrewMonth.TISHREI, 30), 1))
        .isEqualTo(new HebrewDate(5784, HebrewMonth.CHESHVAN, 29));
    assertThat(converter.addMonths(new HebrewDate(5784, HebrewMonth.ADAR_I, 30), 1))
        .isEqualTo(new HebrewDate(5784, HebrewMonth.ADAR, 29));
  }

  @Test
  void addMonths_movesBackwardsAcrossYearBoundary() {
    assertThat(converter.addMonths(new HebrewDate(5784, HebrewMonth.TISHREI, 1), -1))
        .isEqualTo(new HebrewDate(5783, HebrewMonth.ELUL, 1));
    assertThat(converter.addMonths(new HebrewDate(5784, HebrewMonth.TEVET, 22), -13))
        .isEqualTo(new HebrewDate(5783, HebrewMonth.KISLEV, 22));
  }

  @Test
  void exists_reportsVariableMonths() {
    var cheshvan30 = new HebrewMonthDay(HebrewMonth.CHESHVAN, 30);

    assertThat(converter.exists(cheshvan30, 5783)).isTrue();
    assertThat(converter.exists(cheshvan30, 5784)).isFalse();
    assertThat(converter.exists(new HebrewMonthDay(HebrewMonth.ADAR_I, 21), 5785)).isFalse();
  }

  @Test
  void toHebrew_outsideSupportedRange_throws() {
    assertThatThrownBy(() -> converter.toHebrew(LocalDate.of(1100, 1, 1)))
        .isInstanceOf(UnsupportedDateRangeException.class);
    assertThatThrownBy(() -> converter.toHebrew(LocalDate.of(2300, 1, 1)))
        .isInstanceOf(UnsupportedDateRangeException.class);
  }
}
