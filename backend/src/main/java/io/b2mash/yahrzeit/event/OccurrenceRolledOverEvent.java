package io.b2mash.yahrzeit.event;

import java.time.Instant;
import java.time.LocalDate;
import java.util.Map;
import java.util.UUID;

public record OccurrenceRolledOverEvent(
    UUID subjectId, LocalDate previousOccurrence, LocalDate nextOccurrence, Instant occurredAt)
    implements DomainEvent {

  @Override
  public String eventType() {
    return "subject.occurrence_rolled_over";
  }

  @Override
  public String entityType() {
    return "subject";
  }

  @Override
  public UUID entityId() {
    return subjectId;
  }

  @Override
  public Map<String, Object> details() {
    return Map.of(
        "previous_occurrence", previousOccurrence.toString(),
        "next_occurrence", nextOccurrence.toString());
  }
}
