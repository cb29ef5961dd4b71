package io.b2mash.yahrzeit.ledger;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.UUID;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

/**
 * Every update here is a compare-and-set: the {@code WHERE} clause names the status the caller
 * observed, and the returned row count tells the caller whether its transition won.
 */
public interface LedgerEntryRepository extends JpaRepository<LedgerEntry, UUID> {

  List<LedgerEntry> findBySubjectIdOrderByCreatedAtDesc(UUID subjectId);

  List<LedgerEntry> findBySubjectIdAndRecipientIdAndCycleYear(
      UUID subjectId, UUID recipientId, int cycleYear);

  @Query(
      """
      SELECT e.id FROM LedgerEntry e
      WHERE e.status = io.b2mash.yahrzeit.ledger.LedgerStatus.DUE
        AND (e.nextRetryAt IS NULL OR e.nextRetryAt <= :now)
      ORDER BY e.scheduledFor
      """)
  List<UUID> findDispatchableIds(@Param("now") Instant now, Pageable pageable);

  @Modifying
  @Query(
      """
      UPDATE LedgerEntry e
      SET e.status = io.b2mash.yahrzeit.ledger.LedgerStatus.DUE, e.updatedAt = :now
      WHERE e.status = io.b2mash.yahrzeit.ledger.LedgerStatus.PENDING
        AND e.scheduledFor <= :now
      """)
  int promotePendingToDue(@Param("now") Instant now);

  @Modifying
  @Query(
      """
      UPDATE LedgerEntry e
      SET e.status = io.b2mash.yahrzeit.ledger.LedgerStatus.IN_FLIGHT,
          e.claimedAt = :now,
          e.claimedBy = :worker,
          e.attemptCount = e.attemptCount + 1,
          e.lastAttemptAt = :now,
          e.updatedAt = :now
      WHERE e.id = :id
        AND e.status = io.b2mash.yahrzeit.ledger.LedgerStatus.DUE
        AND (e.nextRetryAt IS NULL OR e.nextRetryAt <= :now)
      """)
  int claim(@Param("id") UUID id, @Param("worker") String worker, @Param("now") Instant now);

  @Modifying
  @Query(
      """
      UPDATE LedgerEntry e
      SET e.status = io.b2mash.yahrzeit.ledger.LedgerStatus.SENT,
          e.externalId = :externalId,
          e.lastError = NULL,
          e.claimedAt = NULL,
          e.nextRetryAt = NULL,
          e.updatedAt = :now
      WHERE e.id = :id AND e.status = io.b2mash.yahrzeit.ledger.LedgerStatus.IN_FLIGHT
      """)
  int markSent(
      @Param("id") UUID id, @Param("externalId") String externalId, @Param("now") Instant now);

  @Modifying
  @Query(
      """
      UPDATE LedgerEntry e
      SET e.status = io.b2mash.yahrzeit.ledger.LedgerStatus.FAILED,
          e.lastError = :error,
          e.claimedAt = NULL,
          e.nextRetryAt = NULL,
          e.updatedAt = :now
      WHERE e.id = :id AND e.status = io.b2mash.yahrzeit.ledger.LedgerStatus.IN_FLIGHT
      """)
  int markFailed(@Param("id") UUID id, @Param("error") String error, @Param("now") Instant now);

  @Modifying
  @Query(
      """
      UPDATE LedgerEntry e
      SET e.status = io.b2mash.yahrzeit.ledger.LedgerStatus.DUE,
          e.lastError = :error,
          e.nextRetryAt = :nextRetryAt,
          e.claimedAt = NULL,
          e.claimedBy = NULL,
          e.updatedAt = :now
      WHERE e.id = :id AND e.status = io.b2mash.yahrzeit.ledger.LedgerStatus.IN_FLIGHT
      """)
  int scheduleRetry(
      @Param("id") UUID id,
      @Param("nextRetryAt") Instant nextRetryAt,
      @Param("error") String error,
      @Param("now") Instant now);

  @Modifying
  @Query(
      """
      UPDATE LedgerEntry e
      SET e.status = :target, e.lastError = :reason, e.claimedAt = NULL, e.updatedAt = :now
      WHERE e.id = :id AND e.status = :expected
      """)
  int transition(
      @Param("id") UUID id,
      @Param("expected") LedgerStatus expected,
      @Param("target") LedgerStatus target,
      @Param("reason") String reason,
      @Param("now") Instant now);

  /** Requeues stale claims that still have attempts left. */
  @Modifying
  @Query(
      """
      UPDATE LedgerEntry e
      SET e.status = io.b2mash.yahrzeit.ledger.LedgerStatus.DUE,
          e.lastError = 'Claim expired before a result was recorded',
          e.claimedAt = NULL,
          e.claimedBy = NULL,
          e.updatedAt = :now
      WHERE e.status = io.b2mash.yahrzeit.ledger.LedgerStatus.IN_FLIGHT
        AND e.claimedAt < :cutoff
        AND e.attemptCount < :maxAttempts
      """)
  int requeueStaleClaims(
      @Param("cutoff") Instant cutoff,
      @Param("maxAttempts") int maxAttempts,
      @Param("now") Instant now);

  /** Fails stale claims that have used up their attempts. */
  @Modifying
  @Query(
      """
      UPDATE LedgerEntry e
      SET e.status = io.b2mash.yahrzeit.ledger.LedgerStatus.FAILED,
          e.lastError = 'Claim expired on the final attempt',
          e.claimedAt = NULL,
          e.updatedAt = :now
      WHERE e.status = io.b2mash.yahrzeit.ledger.LedgerStatus.IN_FLIGHT
        AND e.claimedAt < :cutoff
        AND e.attemptCount >= :maxAttempts
      """)
  int failExhaustedStaleClaims(
      @Param("cutoff") Instant cutoff,
      @Param("maxAttempts") int maxAttempts,
      @Param("now") Instant now);

  @Modifying
  @Query(
      """
      UPDATE LedgerEntry e
      SET e.status = io.b2mash.yahrzeit.ledger.LedgerStatus.CANCELLED,
          e.lastError = :reason,
          e.claimedAt = NULL,
          e.updatedAt = :now
      WHERE e.subjectId = :subjectId AND e.status IN :statuses
      """)
  int cancelForSubject(
      @Param("subjectId") UUID subjectId,
      @Param("statuses") Collection<LedgerStatus> statuses,
      @Param("reason") String reason,
      @Param("now") Instant now);

  @Modifying
  @Query(
      """
      UPDATE LedgerEntry e
      SET e.status = io.b2mash.yahrzeit.ledger.LedgerStatus.CANCELLED,
          e.lastError = :reason,
          e.claimedAt = NULL,
          e.updatedAt = :now
      WHERE e.recipientId = :recipientId AND e.status IN :statuses
      """)
  int cancelForRecipient(
      @Param("recipientId") UUID recipientId,
      @Param("statuses") Collection<LedgerStatus> statuses,
      @Param("reason") String reason,
      @Param("now") Instant now);
}
