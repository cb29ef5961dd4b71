package io.b2mash.yahrzeit.calendar;

import java.util.Objects;

/** A Hebrew month and day without a year; the recurring part of an anniversary. */
public record HebrewMonthDay(HebrewMonth month, int day) {

  public HebrewMonthDay {
    Objects.requireNonNull(month, "month must not be null");
    if (day < 1 || day > 30) {
      throw new IllegalArgumentException("Hebrew day must be between 1 and 30, got " + day);
    }
  }

  public HebrewDate inYear(int year) {
    return new HebrewDate(year, month, day);
  }
}
