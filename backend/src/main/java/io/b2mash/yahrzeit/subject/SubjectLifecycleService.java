package io.b2mash.yahrzeit.subject;

import io.b2mash.yahrzeit.anniversary.AnniversaryCalculator;
import io.b2mash.yahrzeit.anniversary.AnniversaryCalculator.MemorialDates;
import io.b2mash.yahrzeit.exception.InvalidStateException;
import io.b2mash.yahrzeit.exception.ResourceConflictException;
import io.b2mash.yahrzeit.exception.ResourceNotFoundException;
import io.b2mash.yahrzeit.ledger.LedgerService;
import java.time.Clock;
import java.time.LocalDate;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Inbound hooks from record-management. Every hook that changes what will be sent cancels the
 * subject's non-terminal ledger entries in the same transaction.
 */
@Service
public class SubjectLifecycleService {

  private static final Logger log = LoggerFactory.getLogger(SubjectLifecycleService.class);

  private final SubjectRepository subjectRepository;
  private final AnniversaryCalculator anniversaryCalculator;
  private final LedgerService ledgerService;
  private final Clock clock;

  public SubjectLifecycleService(
      SubjectRepository subjectRepository,
      AnniversaryCalculator anniversaryCalculator,
      LedgerService ledgerService,
      Clock clock) {
    this.subjectRepository = subjectRepository;
    this.anniversaryCalculator = anniversaryCalculator;
    this.ledgerService = ledgerService;
    this.clock = clock;
  }

  @Transactional
  public Subject create(UUID id, String displayName, LocalDate deathDate) {
    if (subjectRepository.existsById(id)) {
      throw new ResourceConflictException("Subject exists", "Subject " + id + " already exists");
    }
    requireNotInFuture(deathDate);
    LocalDate today = LocalDate.now(clock);
    var initial = anniversaryCalculator.initialAnniversary(deathDate);
    LocalDate next =
        anniversaryCalculator.firstOccurrence(initial.anniversary(), deathDate, today);

    var subject =
        new Subject(
            id,
            displayName,
            deathDate,
            initial.deathDateHebrew(),
            initial.anniversary(),
            next,
            clock.instant());
    subject = subjectRepository.save(subject);
    log.info(
        "Created subject {}: anniversary {}, next occurrence {}", id, initial.anniversary(), next);
    return subject;
  }

  /**
   * Recomputes the anniversary for a corrected date of death. Entries already created belong to the
   * old anniversary and are cancelled.
   */
  @Transactional
  public Subject changeDeathDate(UUID id, LocalDate deathDate) {
    var subject = requireLive(id);
    if (subject.getDeathDateGregorian().equals(deathDate) && !subject.isStale()) {
      log.debug("Death date of subject {} unchanged at {}", id, deathDate);
      return subject;
    }
    requireNotInFuture(deathDate);
    LocalDate today = LocalDate.now(clock);
    var initial = anniversaryCalculator.initialAnniversary(deathDate);
    LocalDate next =
        anniversaryCalculator.firstOccurrence(initial.anniversary(), deathDate, today);

    int cancelled = ledgerService.cancelForSubject(id, "Death date changed");
    subject.changeDeathDate(
        deathDate, initial.deathDateHebrew(), initial.anniversary(), next, clock.instant());
    log.info(
        "Death date of subject {} changed to {}: next occurrence {}, {} entries cancelled",
        id,
        deathDate,
        next,
        cancelled);
    return subject;
  }

  /** Soft-deletes the subject; repeated calls are no-ops. */
  @Transactional
  public void delete(UUID id) {
    var subject =
        subjectRepository
            .findByIdForUpdate(id)
            .orElseThrow(() -> new ResourceNotFoundException("Subject", id));
    if (subject.isDeleted()) {
      log.debug("Subject {} already deleted", id);
      return;
    }
    subject.markDeleted(clock.instant());
    int cancelled = ledgerService.cancelForSubject(id, "Subject deleted");
    log.info("Deleted subject {}: {} entries cancelled", id, cancelled);
  }

  @Transactional(readOnly = true)
  public Subject get(UUID id) {
    return subjectRepository
        .findById(id)
        .orElseThrow(() -> new ResourceNotFoundException("Subject", id));
  }

  @Transactional(readOnly = true)
  public MemorialDates memorialDates(UUID id) {
    var subject = get(id);
    return anniversaryCalculator.memorialDates(
        subject.getDeathDateGregorian(), LocalDate.now(clock));
  }

  /** Loads a subject that is not deleted, locking its row against a concurrent sweep. */
  private Subject requireLive(UUID id) {
    var subject =
        subjectRepository
            .findByIdForUpdate(id)
            .orElseThrow(() -> new ResourceNotFoundException("Subject", id));
    if (subject.isDeleted()) {
      throw new InvalidStateException("Subject deleted", "Subject " + id + " has been deleted");
    }
    return subject;
  }

  private void requireNotInFuture(LocalDate deathDate) {
    if (deathDate.isAfter(LocalDate.now(clock))) {
      throw new IllegalArgumentException("Date of death " + deathDate + " is in the future");
    }
  }
}
