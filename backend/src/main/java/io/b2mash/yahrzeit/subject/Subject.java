package io.b2mash.yahrzeit.subject;

import io.b2mash.yahrzeit.calendar.HebrewDate;
import io.b2mash.yahrzeit.calendar.HebrewMonth;
import io.b2mash.yahrzeit.calendar.HebrewMonthDay;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import jakarta.persistence.Version;
import java.time.Instant;
import java.time.LocalDate;
import java.util.UUID;

/** A deceased person whose anniversary is tracked. The id is assigned by record-management. */
@Entity
@Table(name = "subjects")
public class Subject {

  @Id private UUID id;

  @Column(name = "display_name", nullable = false, length = 200)
  private String displayName;

  @Column(name = "death_date_gregorian", nullable = false)
  private LocalDate deathDateGregorian;

  @Column(name = "death_hebrew_year", nullable = false)
  private int deathHebrewYear;

  @Enumerated(EnumType.STRING)
  @Column(name = "death_hebrew_month", nullable = false, length = 20)
  private HebrewMonth deathHebrewMonth;

  @Column(name = "death_hebrew_day", nullable = false)
  private int deathHebrewDay;

  // Fixed when the death date is set; never derived from nextOccurrence
  @Enumerated(EnumType.STRING)
  @Column(name = "anniversary_month", nullable = false, length = 20)
  private HebrewMonth anniversaryMonth;

  @Column(name = "anniversary_day", nullable = false)
  private int anniversaryDay;

  @Column(name = "next_occurrence", nullable = false)
  private LocalDate nextOccurrence;

  @Column(name = "stale", nullable = false)
  private boolean stale;

  @Column(name = "stale_reason", length = 1000)
  private String staleReason;

  @Column(name = "stale_since")
  private Instant staleSince;

  @Column(name = "deleted", nullable = false)
  private boolean deleted;

  @Column(name = "deleted_at")
  private Instant deletedAt;

  @Version
  @Column(name = "version")
  private Long version;

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  @Column(name = "updated_at", nullable = false)
  private Instant updatedAt;

  protected Subject() {}

  public Subject(
      UUID id,
      String displayName,
      LocalDate deathDate,
      HebrewDate deathDateHebrew,
      HebrewMonthDay anniversary,
      LocalDate nextOccurrence,
      Instant now) {
    this.id = id;
    this.displayName = displayName;
    applyDeathDate(deathDate, deathDateHebrew, anniversary, nextOccurrence);
    this.createdAt = now;
    this.updatedAt = now;
  }

  /** Replaces the date of death and everything derived from it; clears a stale flag. */
  public void changeDeathDate(
      LocalDate deathDate,
      HebrewDate deathDateHebrew,
      HebrewMonthDay anniversary,
      LocalDate nextOccurrence,
      Instant now) {
    applyDeathDate(deathDate, deathDateHebrew, anniversary, nextOccurrence);
    this.stale = false;
    this.staleReason = null;
    this.staleSince = null;
    this.updatedAt = now;
  }

  public void rollOver(LocalDate nextOccurrence, Instant now) {
    if (!nextOccurrence.isAfter(this.nextOccurrence)) {
      throw new IllegalArgumentException(
          "Next occurrence " + nextOccurrence + " is not after " + this.nextOccurrence);
    }
    this.nextOccurrence = nextOccurrence;
    this.updatedAt = now;
  }

  public void markStale(String reason, Instant now) {
    this.stale = true;
    this.staleReason = reason;
    this.staleSince = now;
    this.updatedAt = now;
  }

  public void markDeleted(Instant now) {
    this.deleted = true;
    this.deletedAt = now;
    this.updatedAt = now;
  }

  private void applyDeathDate(
      LocalDate deathDate,
      HebrewDate deathDateHebrew,
      HebrewMonthDay anniversary,
      LocalDate nextOccurrence) {
    this.deathDateGregorian = deathDate;
    this.deathHebrewYear = deathDateHebrew.year();
    this.deathHebrewMonth = deathDateHebrew.month();
    this.deathHebrewDay = deathDateHebrew.day();
    this.anniversaryMonth = anniversary.month();
    this.anniversaryDay = anniversary.day();
    this.nextOccurrence = nextOccurrence;
  }

  public HebrewMonthDay getAnniversary() {
    return new HebrewMonthDay(anniversaryMonth, anniversaryDay);
  }

  public HebrewDate getDeathDateHebrew() {
    return new HebrewDate(deathHebrewYear, deathHebrewMonth, deathHebrewDay);
  }

  public UUID getId() {
    return id;
  }

  public String getDisplayName() {
    return displayName;
  }

  public LocalDate getDeathDateGregorian() {
    return deathDateGregorian;
  }

  public LocalDate getNextOccurrence() {
    return nextOccurrence;
  }

  public boolean isStale() {
    return stale;
  }

  public String getStaleReason() {
    return staleReason;
  }

  public Instant getStaleSince() {
    return staleSince;
  }

  public boolean isDeleted() {
    return deleted;
  }

  public Instant getDeletedAt() {
    return deletedAt;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }

  public Instant getUpdatedAt() {
    return updatedAt;
  }
}
