package io.b2mash.yahrzeit.event;

import java.time.Instant;
import java.util.Map;
import java.util.UUID;

/**
 * Published when a recipient stops being eligible because its channel rejected it permanently.
 * Record-management uses it to ask the owner for a corrected address.
 */
public record RecipientDeactivatedEvent(
    UUID recipientId,
    UUID subjectId,
    String channelKind,
    String reason,
    int cancelledEntries,
    Instant occurredAt)
    implements DomainEvent {

  @Override
  public String eventType() {
    return "recipient.deactivated";
  }

  @Override
  public String entityType() {
    return "recipient";
  }

  @Override
  public UUID entityId() {
    return recipientId;
  }

  @Override
  public Map<String, Object> details() {
    return Map.of(
        "subject_id", subjectId.toString(),
        "channel", channelKind,
        "reason", reason != null ? reason : "",
        "cancelled_entries", cancelledEntries);
  }
}
