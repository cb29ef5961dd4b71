package io.b2mash.yahrzeit.ledger;

import io.b2mash.yahrzeit.notification.ReminderPayload;
import io.b2mash.yahrzeit.recipient.ChannelKind;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.time.Instant;
import java.time.LocalDate;
import java.util.UUID;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

/**
 * One reminder for one recipient and one anniversary cycle. Rows are inserted with a conditional
 * insert and changed only through status-guarded updates in {@link LedgerEntryRepository}, so this
 * entity exposes no mutators.
 */
@Entity
@Table(name = "notification_ledger")
public class LedgerEntry {

  @Id private UUID id;

  @Column(name = "subject_id", nullable = false)
  private UUID subjectId;

  @Column(name = "recipient_id", nullable = false)
  private UUID recipientId;

  /** Hebrew year of {@link #occurrenceDate}; one cycle per anniversary occurrence. */
  @Column(name = "cycle_year", nullable = false)
  private int cycleYear;

  @Column(name = "occurrence_date", nullable = false)
  private LocalDate occurrenceDate;

  @Enumerated(EnumType.STRING)
  @Column(name = "status", nullable = false, length = 20)
  private LedgerStatus status;

  @Column(name = "scheduled_for", nullable = false)
  private Instant scheduledFor;

  @Column(name = "attempt_count", nullable = false)
  private int attemptCount;

  @Column(name = "last_attempt_at")
  private Instant lastAttemptAt;

  @Column(name = "next_retry_at")
  private Instant nextRetryAt;

  @Column(name = "claimed_at")
  private Instant claimedAt;

  @Column(name = "claimed_by", length = 100)
  private String claimedBy;

  @Enumerated(EnumType.STRING)
  @Column(name = "channel_kind", nullable = false, length = 20)
  private ChannelKind channelKind;

  @JdbcTypeCode(SqlTypes.JSON)
  @Column(name = "rendered_payload", columnDefinition = "jsonb", nullable = false)
  private ReminderPayload renderedPayload;

  @Column(name = "last_error", length = 1000)
  private String lastError;

  @Column(name = "external_id", length = 255)
  private String externalId;

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  @Column(name = "updated_at", nullable = false)
  private Instant updatedAt;

  protected LedgerEntry() {}

  public UUID getId() {
    return id;
  }

  public UUID getSubjectId() {
    return subjectId;
  }

  public UUID getRecipientId() {
    return recipientId;
  }

  public int getCycleYear() {
    return cycleYear;
  }

  public LocalDate getOccurrenceDate() {
    return occurrenceDate;
  }

  public LedgerStatus getStatus() {
    return status;
  }

  public Instant getScheduledFor() {
    return scheduledFor;
  }

  public int getAttemptCount() {
    return attemptCount;
  }

  public Instant getLastAttemptAt() {
    return lastAttemptAt;
  }

  public Instant getNextRetryAt() {
    return nextRetryAt;
  }

  public Instant getClaimedAt() {
    return claimedAt;
  }

  public String getClaimedBy() {
    return claimedBy;
  }

  public ChannelKind getChannelKind() {
    return channelKind;
  }

  public ReminderPayload getRenderedPayload() {
    return renderedPayload;
  }

  public String getLastError() {
    return lastError;
  }

  public String getExternalId() {
    return externalId;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }

  public Instant getUpdatedAt() {
    return updatedAt;
  }
}
