package io.b2mash.yahrzeit.calendar;

import java.util.Objects;

/**
 * A calendar date on the Hebrew calendar. Only the shape is checked here; whether the day exists in
 * the given year (30 Cheshvan, Adar I) is checked against the year's {@link HebrewYearTable}.
 */
public record HebrewDate(int year, HebrewMonth month, int day) {

  public HebrewDate {
    Objects.requireNonNull(month, "month must not be null");
    if (day < 1 || day > 30) {
      throw new IllegalArgumentException("Hebrew day must be between 1 and 30, got " + day);
    }
  }

  public HebrewMonthDay monthDay() {
    return new HebrewMonthDay(month, day);
  }

  @Override
  public String toString() {
    return day + " " + month.displayName(false) + " " + year;
  }
}
