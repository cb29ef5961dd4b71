package io.b2mash.yahrzeit.calendar;

import org.springframework.stereotype.Component;

/**
 * Formats Hebrew dates for display, either in English transliteration ({@code 22 Tevet 5783}) or in
 * Hebrew script with Hebrew numerals ({@code כ״ב טבת תשפ״ג}).
 */
@Component
public class HebrewDateFormatter {

  private static final char GERESH = '׳';
  private static final char GERSHAYIM = '״';

  private static final String[] HUNDREDS = {"", "ק", "ר", "ש"};
  private static final String[] TENS = {"", "י", "כ", "ל", "מ", "נ", "ס", "ע", "פ", "צ"};
  private static final String[] UNITS = {"", "א", "ב", "ג", "ד", "ה", "ו", "ז", "ח", "ט"};

  private final HebrewCalendarConverter converter;

  public HebrewDateFormatter(HebrewCalendarConverter converter) {
    this.converter = converter;
  }

  public String formatEnglish(HebrewDate date) {
    boolean leap = converter.yearTable(date.year()).isLeap();
    return date.day() + " " + date.month().displayName(leap) + " " + date.year();
  }

  public String formatHebrew(HebrewDate date) {
    boolean leap = converter.yearTable(date.year()).isLeap();
    // Years are written without the thousands, except for round millennia.
    int shortYear = date.year() % 1000;
    return hebrewNumeral(date.day())
        + " "
        + date.month().hebrewName(leap)
        + " "
        + hebrewNumeral(shortYear == 0 ? date.year() / 1000 : shortYear);
  }

  /**
   * Writes 1..999 in Hebrew numerals. 15 and 16 are written as 9+6 and 9+7 to avoid spelling the
   * divine name. A single letter takes a geresh; longer numerals take gershayim before the last
   * letter.
   */
  static String hebrewNumeral(int number) {
    if (number < 1 || number > 999) {
      throw new IllegalArgumentException("Hebrew numerals are supported for 1-999, got " + number);
    }
    var letters = new StringBuilder();
    int remaining = number;
    while (remaining >= 400) {
      letters.append('ת');
      remaining -= 400;
    }
    letters.append(HUNDREDS[remaining / 100]);
    remaining %= 100;
    if (remaining == 15 || remaining == 16) {
      letters.append('ט').append(remaining == 15 ? 'ו' : 'ז');
    } else {
      letters.append(TENS[remaining / 10]).append(UNITS[remaining % 10]);
    }

    if (letters.length() == 1) {
      return letters.append(GERESH).toString();
    }
    return letters.insert(letters.length() - 1, GERSHAYIM).toString();
  }
}
