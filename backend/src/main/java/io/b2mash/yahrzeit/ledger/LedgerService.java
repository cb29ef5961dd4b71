package io.b2mash.yahrzeit.ledger;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.b2mash.yahrzeit.exception.ResourceConflictException;
import io.b2mash.yahrzeit.exception.ResourceNotFoundException;
import jakarta.persistence.EntityManager;
import jakarta.persistence.PersistenceContext;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * The notification ledger. Entries are created with an {@code INSERT .. ON CONFLICT DO NOTHING}
 * against the partial unique index on {@code (subject_id, recipient_id, cycle_year)}, so a repeated
 * sweep is a silent no-op. All later changes are status-guarded updates; a method returning {@code
 * false} means another actor changed the entry first.
 */
@Service
public class LedgerService {

  private static final Logger log = LoggerFactory.getLogger(LedgerService.class);

  private static final int MAX_ERROR_LENGTH = 1000;

  private static final String INSERT_IF_ABSENT =
      """
      INSERT INTO notification_ledger
          (id, subject_id, recipient_id, cycle_year, occurrence_date, status, scheduled_for,
           attempt_count, channel_kind, rendered_payload, created_at, updated_at)
      VALUES
          (:id, :subjectId, :recipientId, :cycleYear, :occurrenceDate, 'PENDING', :scheduledFor,
           0, :channelKind, CAST(:payload AS jsonb), :now, :now)
      ON CONFLICT (subject_id, recipient_id, cycle_year) WHERE status <> 'CANCELLED'
      DO NOTHING
      """;

  @PersistenceContext private EntityManager entityManager;

  private final LedgerEntryRepository repository;
  private final ObjectMapper objectMapper;
  private final Clock clock;

  public LedgerService(LedgerEntryRepository repository, ObjectMapper objectMapper, Clock clock) {
    this.repository = repository;
    this.objectMapper = objectMapper;
    this.clock = clock;
  }

  /**
   * Inserts a PENDING entry unless a non-cancelled entry already exists for the same key.
   *
   * @return true if a row was inserted, false if the key was already taken
   */
  @Transactional
  public boolean createIfAbsent(NewLedgerEntry entry) {
    int inserted =
        entityManager
            .createNativeQuery(INSERT_IF_ABSENT)
            .setParameter("id", UUID.randomUUID())
            .setParameter("subjectId", entry.subjectId())
            .setParameter("recipientId", entry.recipientId())
            .setParameter("cycleYear", entry.cycleYear())
            .setParameter("occurrenceDate", entry.occurrenceDate())
            .setParameter("scheduledFor", entry.scheduledFor())
            .setParameter("channelKind", entry.channelKind().name())
            .setParameter("payload", toJson(entry))
            .setParameter("now", clock.instant())
            .executeUpdate();
    if (inserted == 0) {
      log.debug(
          "Ledger entry already exists for subject={}, recipient={}, cycle={}",
          entry.subjectId(),
          entry.recipientId(),
          entry.cycleYear());
      return false;
    }
    return true;
  }

  @Transactional
  public int promoteDue() {
    return repository.promotePendingToDue(clock.instant());
  }

  /** Claims a DUE entry for one worker and counts the attempt. */
  @Transactional
  public boolean claim(UUID id, String worker) {
    return repository.claim(id, worker, clock.instant()) == 1;
  }

  @Transactional
  public boolean markSent(UUID id, String externalId) {
    return repository.markSent(id, externalId, clock.instant()) == 1;
  }

  @Transactional
  public boolean markFailed(UUID id, String error) {
    return repository.markFailed(id, truncate(error), clock.instant()) == 1;
  }

  @Transactional
  public boolean scheduleRetry(UUID id, Instant nextRetryAt, String error) {
    return repository.scheduleRetry(id, nextRetryAt, truncate(error), clock.instant()) == 1;
  }

  /** Releases a claimed entry whose recipient or subject stopped being eligible. */
  @Transactional
  public boolean cancelInFlight(UUID id, String reason) {
    LedgerStatus.IN_FLIGHT.requireTransitionTo(LedgerStatus.CANCELLED);
    return repository.transition(
            id, LedgerStatus.IN_FLIGHT, LedgerStatus.CANCELLED, truncate(reason), clock.instant())
        == 1;
  }

  /**
   * Returns claims older than {@code timeout} to DUE, or fails them when no attempts remain. Covers
   * a worker that crashed between claiming and recording the result.
   */
  @Transactional
  public RecoveryResult recoverStaleClaims(Duration timeout, int maxAttempts) {
    Instant now = clock.instant();
    Instant cutoff = now.minus(timeout);
    int requeued = repository.requeueStaleClaims(cutoff, maxAttempts, now);
    int failed = repository.failExhaustedStaleClaims(cutoff, maxAttempts, now);
    if (requeued > 0 || failed > 0) {
      log.warn("Recovered stale claims: requeued={}, failed={}", requeued, failed);
    }
    return new RecoveryResult(requeued, failed);
  }

  /**
   * Cancels the subject's entries that no worker has claimed yet. A claimed entry is left to its
   * worker, whose eligibility check or result settles it without reopening the cycle.
   */
  @Transactional
  public int cancelForSubject(UUID subjectId, String reason) {
    int cancelled =
        repository.cancelForSubject(
            subjectId, LedgerStatus.unclaimed(), truncate(reason), clock.instant());
    log.info("Cancelled {} ledger entries for subject {}: {}", cancelled, subjectId, reason);
    return cancelled;
  }

  @Transactional
  public int cancelForRecipient(UUID recipientId, String reason) {
    int cancelled =
        repository.cancelForRecipient(
            recipientId, LedgerStatus.unclaimed(), truncate(reason), clock.instant());
    log.info("Cancelled {} ledger entries for recipient {}: {}", cancelled, recipientId, reason);
    return cancelled;
  }

  /**
   * Cancels a single entry on request; rejected when the entry is terminal or is being delivered.
   */
  @Transactional
  public LedgerEntry cancel(UUID id, String reason) {
    var entry =
        repository
            .findById(id)
            .orElseThrow(() -> new ResourceNotFoundException("LedgerEntry", id));
    LedgerStatus current = entry.getStatus();
    if (current == LedgerStatus.IN_FLIGHT) {
      throw new ResourceConflictException(
          "Ledger entry in flight", "Ledger entry " + id + " is being delivered");
    }
    current.requireTransitionTo(LedgerStatus.CANCELLED);
    int updated =
        repository.transition(
            id, current, LedgerStatus.CANCELLED, truncate(reason), clock.instant());
    if (updated == 0) {
      throw new ResourceConflictException(
          "Ledger entry changed", "Ledger entry " + id + " changed while it was being cancelled");
    }
    entityManager.refresh(entry);
    return entry;
  }

  @Transactional(readOnly = true)
  public LedgerEntry find(UUID id) {
    return repository
        .findById(id)
        .orElseThrow(() -> new ResourceNotFoundException("LedgerEntry", id));
  }

  @Transactional(readOnly = true)
  public List<LedgerEntry> findForSubject(UUID subjectId) {
    return repository.findBySubjectIdOrderByCreatedAtDesc(subjectId);
  }

  @Transactional(readOnly = true)
  public List<UUID> findDispatchableIds(int limit) {
    return repository.findDispatchableIds(clock.instant(), PageRequest.of(0, limit));
  }

  private String toJson(NewLedgerEntry entry) {
    try {
      return objectMapper.writeValueAsString(entry.payload());
    } catch (JsonProcessingException e) {
      throw new IllegalStateException(
          "Cannot serialize reminder payload for subject " + entry.subjectId(), e);
    }
  }

  private static String truncate(String value) {
    if (value == null || value.length() <= MAX_ERROR_LENGTH) {
      return value;
    }
    return value.substring(0, MAX_ERROR_LENGTH);
  }

  public record RecoveryResult(int requeued, int failed) {}
}
