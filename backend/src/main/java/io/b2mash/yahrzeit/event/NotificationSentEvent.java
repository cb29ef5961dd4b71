package io.b2mash.yahrzeit.event;

import java.time.Instant;
import java.util.HashMap;
import java.util.Map;
import java.util.UUID;

public record NotificationSentEvent(
    UUID ledgerEntryId,
    UUID subjectId,
    UUID recipientId,
    int cycleYear,
    String channelKind,
    String externalId,
    int attemptCount,
    Instant occurredAt)
    implements DomainEvent {

  @Override
  public String eventType() {
    return "notification.sent";
  }

  @Override
  public String entityType() {
    return "ledger_entry";
  }

  @Override
  public UUID entityId() {
    return ledgerEntryId;
  }

  @Override
  public Map<String, Object> details() {
    var details = new HashMap<String, Object>();
    details.put("subject_id", subjectId.toString());
    details.put("recipient_id", recipientId.toString());
    details.put("cycle_year", cycleYear);
    details.put("channel", channelKind);
    details.put("attempt_count", attemptCount);
    if (externalId != null) {
      details.put("external_id", externalId);
    }
    return details;
  }
}
