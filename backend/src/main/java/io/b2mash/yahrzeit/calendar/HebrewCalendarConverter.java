package io.b2mash.yahrzeit.calendar;

import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import org.springframework.stereotype.Service;

/**
 * Converts between Gregorian and Hebrew dates and performs Hebrew month arithmetic. Every
 * computation goes through the year tables of the {@link DateTableSource}; nothing here reads the
 * current time.
 */
@Service
public class HebrewCalendarConverter {

  /** Gregorian year {@code y} lies in Hebrew year {@code y + 3760} until Rosh Hashanah. */
  private static final int HEBREW_YEAR_OFFSET = 3760;

  private final DateTableSource dateTableSource;

  public HebrewCalendarConverter(DateTableSource dateTableSource) {
    this.dateTableSource = dateTableSource;
  }

  public HebrewYearTable yearTable(int hebrewYear) {
    return dateTableSource.lookup(hebrewYear);
  }

  public HebrewDate toHebrew(LocalDate date) {
    int guess =
        Math.max(date.getYear() + HEBREW_YEAR_OFFSET, UnsupportedDateRangeException.MIN_YEAR);
    var table = yearTable(guess);
    if (date.isBefore(table.newYear())) {
      table = yearTable(guess - 1);
    } else if (date.isAfter(table.lastDay())) {
      table = yearTable(guess + 1);
    }

    long offset = ChronoUnit.DAYS.between(table.newYear(), date);
    for (HebrewMonth month : table.months()) {
      int length = table.monthLength(month);
      if (offset < length) {
        return new HebrewDate(table.year(), month, (int) offset + 1);
      }
      offset -= length;
    }
    throw new IllegalStateException("Date " + date + " not covered by Hebrew year " + table.year());
  }

  public LocalDate toGregorian(HebrewDate date) {
    var table = yearTable(date.year());
    requireExists(table, date);
    return table.firstDayOf(date.month()).plusDays(date.day() - 1L);
  }

  /**
   * Moves a date by {@code months} Hebrew months, forwards or backwards. Months are counted by
   * position in each year's own month list, so a leap year contributes 13 months. When the target
   * month is shorter than the source day, the day is clamped to the last day of the month.
   */
  public HebrewDate addMonths(HebrewDate date, int months) {
    var table = yearTable(date.year());
    requireExists(table, date);

    int year = date.year();
    int index = table.indexOf(date.month()) + months;
    while (index >= table.monthCount()) {
      index -= table.monthCount();
      year++;
      table = yearTable(year);
    }
    while (index < 0) {
      year--;
      table = yearTable(year);
      index += table.monthCount();
    }

    HebrewMonth month = table.months().get(index);
    return new HebrewDate(year, month, Math.min(date.day(), table.monthLength(month)));
  }

  /** Returns whether the month and day exist in the given year (Adar I, 30 Cheshvan, 30 Kislev). */
  public boolean exists(HebrewMonthDay monthDay, int hebrewYear) {
    return yearTable(hebrewYear).contains(monthDay);
  }

  private static void requireExists(HebrewYearTable table, HebrewDate date) {
    if (!table.contains(date.monthDay())) {
      throw new IllegalArgumentException(
          date.day()
              + " "
              + date.month().displayName(table.isLeap())
              + " does not exist in Hebrew year "
              + table.year());
    }
  }
}
