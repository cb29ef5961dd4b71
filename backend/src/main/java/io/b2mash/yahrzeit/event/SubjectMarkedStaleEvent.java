package io.b2mash.yahrzeit.event;

import java.time.Instant;
import java.time.LocalDate;
import java.util.HashMap;
import java.util.Map;
import java.util.UUID;

public record SubjectMarkedStaleEvent(
    UUID subjectId, LocalDate lastKnownOccurrence, String reason, Instant occurredAt)
    implements DomainEvent {

  @Override
  public String eventType() {
    return "subject.marked_stale";
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
    var details = new HashMap<String, Object>();
    details.put("reason", reason != null ? reason : "");
    if (lastKnownOccurrence != null) {
      details.put("last_known_occurrence", lastKnownOccurrence.toString());
    }
    return details;
  }
}
