package io.b2mash.yahrzeit.calendar;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.Test;

class HebrewDateFormatterTest {

  private final HebrewDateFormatter formatter =
      new HebrewDateFormatter(new HebrewCalendarConverter(new ArithmeticDateTableSource()));

  @Test
  void formatEnglish_usesTransliteratedMonth() {
    assertThat(formatter.formatEnglish(new HebrewDate(5783, HebrewMonth.TEVET, 22)))
        .isEqualTo("22 Tevet 5783");
  }

  @Test
  void formatEnglish_namesAdarIIOnlyInLeapYears() {
    assertThat(formatter.formatEnglish(new HebrewDate(5784, HebrewMonth.ADAR, 14)))
        .isEqualTo("14 Adar II 5784");
    assertThat(formatter.formatEnglish(new HebrewDate(5784, HebrewMonth.ADAR_I, 14)))
        .isEqualTo("14 Adar I 5784");
    assertThat(formatter.formatEnglish(new HebrewDate(5785, HebrewMonth.ADAR, 14)))
        .isEqualTo("14 Adar 5785");
  }

  @Test
  void formatHebrew_usesHebrewNumerals() {
    assertThat(formatter.formatHebrew(new HebrewDate(5783, HebrewMonth.TEVET, 22)))
        .isEqualTo("כ״ב טבת תשפ״ג");
    assertThat(formatter.formatHebrew(new HebrewDate(5784, HebrewMonth.ADAR, 5)))
        .isEqualTo("ה׳ אדר ב׳ תשפ״ד");
  }

  @Test
  void hebrewNumeral_avoidsDivineNameForFifteenAndSixteen() {
    assertThat(HebrewDateFormatter.hebrewNumeral(15)).isEqualTo("ט״ו");
    assertThat(HebrewDateFormatter.hebrewNumeral(16)).isEqualTo("ט״ז");
    assertThat(HebrewDateFormatter.hebrewNumeral(30)).isEqualTo("ל׳");
    assertThat(HebrewDateFormatter.hebrewNumeral(515)).isEqualTo("תקט״ו");
  }

  @Test
  void hebrewNumeral_rejectsOutOfRange() {
    assertThatThrownBy(() -> HebrewDateFormatter.hebrewNumeral(0))
        .isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> HebrewDateFormatter.hebrewNumeral(1000))
        .isInstanceOf(IllegalArgumentException.class);
  }
}
