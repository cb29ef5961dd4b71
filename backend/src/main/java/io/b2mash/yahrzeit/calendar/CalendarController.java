package io.b2mash.yahrzeit.calendar;

import java.time.LocalDate;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/internal/calendar")
public class CalendarController {

  private final HebrewCalendarConverter converter;
  private final HebrewDateFormatter formatter;

  public CalendarController(HebrewCalendarConverter converter, HebrewDateFormatter formatter) {
    this.converter = converter;
    this.formatter = formatter;
  }

  @GetMapping("/convert")
  public ResponseEntity<ConversionResponse> toHebrew(
      @RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate date) {
    return ResponseEntity.ok(toResponse(date, converter.toHebrew(date)));
  }

  @GetMapping("/to-gregorian")
  public ResponseEntity<ConversionResponse> toGregorian(
      @RequestParam int year, @RequestParam HebrewMonth month, @RequestParam int day) {
    var hebrewDate = new HebrewDate(year, month, day);
    return ResponseEntity.ok(toResponse(converter.toGregorian(hebrewDate), hebrewDate));
  }

  private ConversionResponse toResponse(LocalDate gregorian, HebrewDate hebrew) {
    var table = converter.yearTable(hebrew.year());
    return new ConversionResponse(
        gregorian,
        hebrew.year(),
        hebrew.month(),
        hebrew.day(),
        table.isLeap(),
        table.monthLength(hebrew.month()),
        formatter.formatEnglish(hebrew),
        formatter.formatHebrew(hebrew));
  }

  public record ConversionResponse(
      LocalDate gregorianDate,
      int hebrewYear,
      HebrewMonth hebrewMonth,
      int hebrewDay,
      boolean leapYear,
      int daysInMonth,
      String formatted,
      String formattedHebrew) {}
}
