package io.b2mash.yahrzeit.event;

import java.time.Instant;
import java.util.HashMap;
import java.util.Map;
import java.util.UUID;

/**
 * Published when a ledger entry reaches terminal FAILED, either from a permanent channel rejection
 * or after exhausting its attempts.
 */
public record NotificationFailedTerminalEvent(
    UUID ledgerEntryId,
    UUID subjectId,
    UUID recipientId,
    int cycleYear,
    String channelKind,
    int attemptCount,
    boolean permanent,
    String reason,
    Instant occurredAt)
    implements DomainEvent {

  @Override
  public String eventType() {
    return "notification.failed_terminal";
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
    details.put("permanent", permanent);
    details.put("reason", reason != null ? reason : "");
    return details;
  }
}
