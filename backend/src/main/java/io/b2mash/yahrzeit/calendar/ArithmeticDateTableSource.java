package io.b2mash.yahrzeit.calendar;

import java.time.LocalDate;

/**
 * Computes year tables from the fixed arithmetic of the Hebrew calendar: the mean molad of Tishrei
 * and the four postponement rules. Needs no network access, so it never raises {@link
 * DateComputationException}.
 */
public class ArithmeticDateTableSource implements DateTableSource {

  /** Fixed (R.D.) day number of 1 Tishrei AM 1. */
  private static final long HEBREW_EPOCH_RD = -1_373_427L;

  /** Offset between R.D. day numbers and {@link LocalDate#toEpochDay()}. */
  private static final long RD_TO_EPOCH_DAY = 719_163L;

  @Override
  public String sourceId() {
    return "arithmetic";
  }

  @Override
  public HebrewYearTable lookup(int hebrewYear) {
    if (hebrewYear < UnsupportedDateRangeException.MIN_YEAR
        || hebrewYear > UnsupportedDateRangeException.MAX_YEAR) {
      throw UnsupportedDateRangeException.forHebrewYear(hebrewYear);
    }
    long newYear = newYearRd(hebrewYear);
    int length = (int) (newYearRd(hebrewYear + 1) - newYear);
    return new HebrewYearTable(
        hebrewYear, LocalDate.ofEpochDay(newYear - RD_TO_EPOCH_DAY), length);
  }

  static boolean isLeapYear(int year) {
    return Math.floorMod(7L * year + 1, 19) < 7;
  }

  private static long newYearRd(int year) {
    return HEBREW_EPOCH_RD + elapsedDays(year) + newYearDelay(year);
  }

  /** Days from the epoch to the molad of Tishrei, with the "lo ADU rosh" postponement applied. */
  private static long elapsedDays(int year) {
    long monthsElapsed = Math.floorDiv(235L * year - 234, 19);
    long partsElapsed = 12_084L + 13_753L * monthsElapsed;
    long day = 29L * monthsElapsed + Math.floorDiv(partsElapsed, 25_920);
    return Math.floorMod(3 * (day + 1), 7) < 3 ? day + 1 : day;
  }

  /** Postponements that keep year lengths within 353-355 and 383-385 days. */
  private static long newYearDelay(int year) {
    long previous = elapsedDays(year - 1);
    long current = elapsedDays(year);
    long next = elapsedDays(year + 1);
    if (next - current == 356) {
      return 2;
    }
    if (current - previous == 382) {
      return 1;
    }
    return 0;
  }
}
