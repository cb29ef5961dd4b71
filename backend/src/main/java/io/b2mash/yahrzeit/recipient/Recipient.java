package io.b2mash.yahrzeit.recipient;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import jakarta.persistence.Version;
import java.time.Instant;
import java.util.Locale;
import java.util.UUID;

/** A contact who receives reminders about one subject over one channel. */
@Entity
@Table(name = "recipients")
public class Recipient {

  @Id private UUID id;

  @Column(name = "subject_id", nullable = false)
  private UUID subjectId;

  @Enumerated(EnumType.STRING)
  @Column(name = "channel_kind", nullable = false, length = 20)
  private ChannelKind channelKind;

  @Column(name = "address", nullable = false, length = 320)
  private String address;

  @Column(name = "display_name", length = 200)
  private String displayName;

  // Null means the scheduler default applies
  @Column(name = "lead_days")
  private Integer leadDays;

  @Column(name = "active", nullable = false)
  private boolean active;

  @Column(name = "opted_out", nullable = false)
  private boolean optedOut;

  @Column(name = "deactivation_reason", length = 1000)
  private String deactivationReason;

  @Column(name = "deactivated_at")
  private Instant deactivatedAt;

  @Version
  @Column(name = "version")
  private Long version;

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  @Column(name = "updated_at", nullable = false)
  private Instant updatedAt;

  protected Recipient() {}

  public Recipient(
      UUID id,
      UUID subjectId,
      ChannelKind channelKind,
      String address,
      String displayName,
      Integer leadDays,
      Instant now) {
    this.id = id;
    this.subjectId = subjectId;
    this.channelKind = channelKind;
    this.address = normalizeAddress(channelKind, address);
    this.displayName = displayName;
    this.leadDays = leadDays;
    this.active = true;
    this.optedOut = false;
    this.createdAt = now;
    this.updatedAt = now;
  }

  /** Email addresses compare case-insensitively; group handles keep their case. */
  public static String normalizeAddress(ChannelKind channelKind, String address) {
    if (address == null || address.isBlank()) {
      throw new IllegalArgumentException("Recipient address must not be blank");
    }
    String trimmed = address.trim();
    return switch (channelKind) {
      case EMAIL -> trimmed.toLowerCase(Locale.ROOT);
      case GROUP_MESSAGE -> trimmed;
    };
  }

  public int effectiveLeadDays(int defaultLeadDays) {
    return leadDays != null ? leadDays : defaultLeadDays;
  }

  public void deactivate(String reason, Instant now) {
    this.active = false;
    this.deactivationReason = reason;
    this.deactivatedAt = now;
    this.updatedAt = now;
  }

  public void optOut(Instant now) {
    this.optedOut = true;
    this.updatedAt = now;
  }

  public void reactivate(Instant now) {
    this.active = true;
    this.optedOut = false;
    this.deactivationReason = null;
    this.deactivatedAt = null;
    this.updatedAt = now;
  }

  public UUID getId() {
    return id;
  }

  public UUID getSubjectId() {
    return subjectId;
  }

  public ChannelKind getChannelKind() {
    return channelKind;
  }

  public String getAddress() {
    return address;
  }

  public String getDisplayName() {
    return displayName;
  }

  public Integer getLeadDays() {
    return leadDays;
  }

  public boolean isActive() {
    return active;
  }

  public boolean isOptedOut() {
    return optedOut;
  }

  public String getDeactivationReason() {
    return deactivationReason;
  }

  public Instant getDeactivatedAt() {
    return deactivatedAt;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }

  public Instant getUpdatedAt() {
    return updatedAt;
  }
}
