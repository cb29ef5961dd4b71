package io.b2mash.yahrzeit.ledger;

import io.b2mash.yahrzeit.notification.ReminderPayload;
import io.b2mash.yahrzeit.recipient.ChannelKind;
import java.time.Instant;
import java.time.LocalDate;
import java.util.Objects;
import java.util.UUID;

/** Values for a conditional ledger insert, keyed by {@code (subjectId, recipientId, cycleYear)}. */
public record NewLedgerEntry(
    UUID subjectId,
    UUID recipientId,
    int cycleYear,
    LocalDate occurrenceDate,
    Instant scheduledFor,
    ChannelKind channelKind,
    ReminderPayload payload) {

  public NewLedgerEntry {
    Objects.requireNonNull(subjectId, "subjectId must not be null");
    Objects.requireNonNull(recipientId, "recipientId must not be null");
    Objects.requireNonNull(occurrenceDate, "occurrenceDate must not be null");
    Objects.requireNonNull(scheduledFor, "scheduledFor must not be null");
    Objects.requireNonNull(channelKind, "channelKind must not be null");
    Objects.requireNonNull(payload, "payload must not be null");
  }
}
