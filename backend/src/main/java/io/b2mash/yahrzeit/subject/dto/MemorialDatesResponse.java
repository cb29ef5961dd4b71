package io.b2mash.yahrzeit.subject.dto;

import java.time.LocalDate;

/** Azkara and next yahrzeit for one subject, as observed from today. */
public record MemorialDatesResponse(
    String deathDateHebrew,
    Observance azkara,
    Observance nextYahrzeit,
    boolean firstYear) {

  public record Observance(
      LocalDate gregorianDate, String hebrewDate, String hebrewDateHebrew, long daysUntil) {}
}
