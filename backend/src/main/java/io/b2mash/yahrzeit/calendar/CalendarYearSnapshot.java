package io.b2mash.yahrzeit.calendar;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.time.Instant;
import java.time.LocalDate;

/** Last-known-good copy of a Hebrew year table, served when the live source is unreachable. */
@Entity
@Table(name = "calendar_year_snapshots")
public class CalendarYearSnapshot {

  @Id
  @Column(name = "hebrew_year")
  private Integer hebrewYear;

  @Column(name = "new_year_date", nullable = false)
  private LocalDate newYearDate;

  @Column(name = "length_days", nullable = false)
  private int lengthDays;

  @Column(name = "source", nullable = false, length = 30)
  private String source;

  @Column(name = "fetched_at", nullable = false)
  private Instant fetchedAt;

  protected CalendarYearSnapshot() {}

  public CalendarYearSnapshot(HebrewYearTable table, String source, Instant fetchedAt) {
    this.hebrewYear = table.year();
    this.newYearDate = table.newYear();
    this.lengthDays = table.lengthInDays();
    this.source = source;
    this.fetchedAt = fetchedAt;
  }

  public HebrewYearTable toTable() {
    return new HebrewYearTable(hebrewYear, newYearDate, lengthDays);
  }

  public Integer getHebrewYear() {
    return hebrewYear;
  }

  public LocalDate getNewYearDate() {
    return newYearDate;
  }

  public int getLengthDays() {
    return lengthDays;
  }

  public String getSource() {
    return source;
  }

  public Instant getFetchedAt() {
    return fetchedAt;
  }
}
