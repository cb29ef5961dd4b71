package io.b2mash.yahrzeit.subject.dto;

import io.b2mash.yahrzeit.calendar.HebrewMonth;
import java.time.Instant;
import java.time.LocalDate;
import java.util.UUID;

public record SubjectResponse(
    UUID id,
    String displayName,
    LocalDate deathDate,
    String deathDateHebrew,
    String deathDateHebrewScript,
    HebrewMonth anniversaryMonth,
    int anniversaryDay,
    LocalDate nextOccurrence,
    String nextOccurrenceHebrew,
    boolean stale,
    String staleReason,
    boolean deleted,
    Instant createdAt,
    Instant updatedAt) {}
