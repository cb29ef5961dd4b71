package io.b2mash.yahrzeit.calendar;

/**
 * Months of the Hebrew year in civil order, starting from Tishrei.
 *
 * <p>{@link #ADAR_I} exists only in leap years. {@link #ADAR} is present every year and is the
 * second Adar (Adar II) when the year is a leap year.
 */
public enum HebrewMonth {
  TISHREI("Tishrei", "תשרי"),
  CHESHVAN("Cheshvan", "חשון"),
  KISLEV("Kislev", "כסלו"),
  TEVET("Tevet", "טבת"),
  SHEVAT("Shevat", "שבט"),
  ADAR_I("Adar I", "אדר א׳"),
  ADAR("Adar", "אדר"),
  NISAN("Nisan", "ניסן"),
  IYAR("Iyar", "אייר"),
  SIVAN("Sivan", "סיון"),
  TAMMUZ("Tammuz", "תמוז"),
  AV("Av", "אב"),
  ELUL("Elul", "אלול");

  private final String displayName;
  private final String hebrewName;

  HebrewMonth(String displayName, String hebrewName) {
    this.displayName = displayName;
    this.hebrewName = hebrewName;
  }

  public String displayName(boolean leapYear) {
    return this == ADAR && leapYear ? "Adar II" : displayName;
  }

  public String hebrewName(boolean leapYear) {
    return this == ADAR && leapYear ? "אדר ב׳" : hebrewName;
  }
}
