package io.b2mash.yahrzeit.anniversary;

import io.b2mash.yahrzeit.calendar.DateComputationException;
import io.b2mash.yahrzeit.calendar.HebrewCalendarConverter;
import io.b2mash.yahrzeit.calendar.HebrewDate;
import io.b2mash.yahrzeit.calendar.HebrewMonthDay;
import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

/**
 * Computes anniversary dates on the Hebrew calendar.
 *
 * <p>The recurring month/day is fixed once from the date of death, optionally shifted by {@code
 * yahrzeit.anniversary.offset-months} Hebrew months (0 keeps the date of death; 11 follows the
 * "eleven months after death" rule). Occurrences are then found by exact month/day match, skipping
 * years in which that day does not exist.
 */
@Service
public class AnniversaryCalculator {

  private static final Logger log = LoggerFactory.getLogger(AnniversaryCalculator.class);

  /**
   * Years scanned before giving up. Adar I recurs at most three years apart, as do 30 Cheshvan and
   * 30 Kislev, and the first candidate year may already have passed.
   */
  static final int MAX_YEARS_SCANNED = 5;

  static final int AZKARA_MONTHS = 11;

  private final HebrewCalendarConverter converter;
  private final int offsetMonths;

  public AnniversaryCalculator(
      HebrewCalendarConverter converter,
      @Value("${yahrzeit.anniversary.offset-months:0}") int offsetMonths) {
    this.converter = converter;
    this.offsetMonths = offsetMonths;
  }

  public InitialAnniversary initialAnniversary(LocalDate deathDate) {
    var deathHebrew = converter.toHebrew(deathDate);
    var anchor = offsetMonths == 0 ? deathHebrew : converter.addMonths(deathHebrew, offsetMonths);
    log.debug(
        "Death date {} is {}; anniversary fixed at {} {}",
        deathDate,
        deathHebrew,
        anchor.day(),
        anchor.month());
    return new InitialAnniversary(deathHebrew, anchor.monthDay());
  }

  /** Returns the smallest Gregorian date strictly after {@code after} on the anniversary. */
  public LocalDate nextOccurrence(HebrewMonthDay anniversary, LocalDate after) {
    int startYear = converter.toHebrew(after).year();
    for (int i = 0; i < MAX_YEARS_SCANNED; i++) {
      int year = startYear + i;
      if (!converter.exists(anniversary, year)) {
        continue;
      }
      var candidate = converter.toGregorian(anniversary.inYear(year));
      if (candidate.isAfter(after)) {
        return candidate;
      }
    }
    throw new DateComputationException(
        "No occurrence of "
            + anniversary.day()
            + " "
            + anniversary.month()
            + " within "
            + MAX_YEARS_SCANNED
            + " Hebrew years after "
            + after,
        null);
  }

  /**
   * Returns the first occurrence to store for a subject: never on or before the date of death, and
   * never before {@code today}.
   */
  public LocalDate firstOccurrence(
      HebrewMonthDay anniversary, LocalDate deathDate, LocalDate today) {
    LocalDate yesterday = today.minusDays(1);
    return nextOccurrence(anniversary, deathDate.isAfter(yesterday) ? deathDate : yesterday);
  }

  /** Hebrew year in which the given occurrence falls; identifies one anniversary cycle. */
  public int cycleYear(LocalDate occurrence) {
    return converter.toHebrew(occurrence).year();
  }

  /**
   * Azkara (eleven Hebrew months after death) and the next yahrzeit on the Hebrew date of death.
   */
  public MemorialDates memorialDates(LocalDate deathDate, LocalDate today) {
    HebrewDate deathHebrew = converter.toHebrew(deathDate);

    HebrewDate azkaraHebrew = converter.addMonths(deathHebrew, AZKARA_MONTHS);
    LocalDate azkara = converter.toGregorian(azkaraHebrew);

    HebrewMonthDay yahrzeitDay = deathHebrew.monthDay();
    LocalDate yahrzeit = firstOccurrence(yahrzeitDay, deathDate, today);
    boolean firstYear = !nextOccurrence(yahrzeitDay, deathDate).isBefore(today);

    return new MemorialDates(
        deathHebrew,
        new ObservanceDate(azkara, azkaraHebrew, ChronoUnit.DAYS.between(today, azkara)),
        new ObservanceDate(
            yahrzeit, converter.toHebrew(yahrzeit), ChronoUnit.DAYS.between(today, yahrzeit)),
        firstYear);
  }

  public record InitialAnniversary(HebrewDate deathDateHebrew, HebrewMonthDay anniversary) {}

  public record ObservanceDate(LocalDate gregorianDate, HebrewDate hebrewDate, long daysUntil) {}

  public record MemorialDates(
      HebrewDate deathDateHebrew,
      ObservanceDate azkara,
      ObservanceDate nextYahrzeit,
      boolean firstYear) {}
}
