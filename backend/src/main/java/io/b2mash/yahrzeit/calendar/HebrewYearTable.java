package io.b2mash.yahrzeit.calendar;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Month-length table for one Hebrew year, derived from the Gregorian date of 1 Tishrei and the
 * length of the year in days. The length alone determines the intercalation flag (13 months when
 * over 380 days) and the variable lengths of Cheshvan and Kislev.
 */
public record HebrewYearTable(int year, LocalDate newYear, int lengthInDays) {

  private static final Set<Integer> VALID_LENGTHS = Set.of(353, 354, 355, 383, 384, 385);

  public HebrewYearTable {
    Objects.requireNonNull(newYear, "newYear must not be null");
    if (!VALID_LENGTHS.contains(lengthInDays)) {
      throw new IllegalArgumentException(
          "Hebrew year " + year + " cannot be " + lengthInDays + " days long");
    }
  }

  public boolean isLeap() {
    return lengthInDays > 380;
  }

  public List<HebrewMonth> months() {
    var months = new ArrayList<HebrewMonth>(13);
    for (HebrewMonth month : HebrewMonth.values()) {
      if (month != HebrewMonth.ADAR_I || isLeap()) {
        months.add(month);
      }
    }
    return Collections.unmodifiableList(months);
  }

  public int monthCount() {
    return isLeap() ? 13 : 12;
  }

  /** Returns the number of days in the month, or 0 when the month does not occur this year. */
  public int monthLength(HebrewMonth month) {
    return switch (month) {
      case TISHREI, SHEVAT, NISAN, SIVAN, AV -> 30;
      case TEVET, ADAR, IYAR, TAMMUZ, ELUL -> 29;
      case ADAR_I -> isLeap() ? 30 : 0;
      case CHESHVAN -> lengthInDays % 10 == 5 ? 30 : 29;
      case KISLEV -> lengthInDays % 10 == 3 ? 29 : 30;
    };
  }

  public boolean contains(HebrewMonthDay monthDay) {
    return monthDay.day() <= monthLength(monthDay.month());
  }

  /** Zero-based position of the month within this year's month list. */
  public int indexOf(HebrewMonth month) {
    int index = months().indexOf(month);
    if (index < 0) {
      throw new IllegalArgumentException(month + " does not occur in Hebrew year " + year);
    }
    return index;
  }

  public LocalDate firstDayOf(HebrewMonth month) {
    int offset = 0;
    for (HebrewMonth candidate : months()) {
      if (candidate == month) {
        return newYear.plusDays(offset);
      }
      offset += monthLength(candidate);
    }
    throw new IllegalArgumentException(month + " does not occur in Hebrew year " + year);
  }

  public LocalDate lastDay() {
    return newYear.plusDays(lengthInDays - 1L);
  }
}
