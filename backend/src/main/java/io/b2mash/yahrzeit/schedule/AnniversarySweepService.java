package io.b2mash.yahrzeit.schedule;

import io.b2mash.yahrzeit.anniversary.AnniversaryCalculator;
import io.b2mash.yahrzeit.event.OccurrenceRolledOverEvent;
import io.b2mash.yahrzeit.event.SubjectMarkedStaleEvent;
import io.b2mash.yahrzeit.ledger.LedgerService;
import io.b2mash.yahrzeit.ledger.NewLedgerEntry;
import io.b2mash.yahrzeit.notification.ReminderContentFactory;
import io.b2mash.yahrzeit.recipient.Recipient;
import io.b2mash.yahrzeit.recipient.RecipientRepository;
import io.b2mash.yahrzeit.subject.Subject;
import io.b2mash.yahrzeit.subject.SubjectRepository;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

/**
 * Per-subject work of the anniversary sweep. A subject is handled in two steps, each in its own
 * transaction with the subject row locked: entries for the stored occurrence first, then the
 * rollover together with the entries for the new occurrence. A failing rollover therefore never
 * takes the elapsed cycle's entries with it. The loop lives in {@link AnniversarySweepScheduler}
 * so every call here goes through the transactional proxy.
 */
@Service
@EnableConfigurationProperties(SchedulerProperties.class)
public class AnniversarySweepService {

  private static final Logger log = LoggerFactory.getLogger(AnniversarySweepService.class);

  private final SubjectRepository subjectRepository;
  private final RecipientRepository recipientRepository;
  private final LedgerService ledgerService;
  private final AnniversaryCalculator anniversaryCalculator;
  private final ReminderContentFactory contentFactory;
  private final ApplicationEventPublisher eventPublisher;
  private final SchedulerProperties properties;
  private final Clock clock;

  public AnniversarySweepService(
      SubjectRepository subjectRepository,
      RecipientRepository recipientRepository,
      LedgerService ledgerService,
      AnniversaryCalculator anniversaryCalculator,
      ReminderContentFactory contentFactory,
      ApplicationEventPublisher eventPublisher,
      SchedulerProperties properties,
      Clock clock) {
    this.subjectRepository = subjectRepository;
    this.recipientRepository = recipientRepository;
    this.ledgerService = ledgerService;
    this.anniversaryCalculator = anniversaryCalculator;
    this.contentFactory = contentFactory;
    this.eventPublisher = eventPublisher;
    this.properties = properties;
    this.clock = clock;
  }

  /** Subjects whose stored occurrence falls inside the widest creation window, or has elapsed. */
  @Transactional(readOnly = true)
  public List<UUID> findSubjectsDue(LocalDate today) {
    Integer maxOverride = recipientRepository.findMaxLeadDays();
    int widestLead = Math.max(properties.leadDays(), maxOverride != null ? maxOverride : 0);
    return subjectRepository.findIdsDueForSweep(
        today.plusDays((long) widestLead + properties.horizonDays()));
  }

  /**
   * Creates entries for the occurrence stored on the subject, including an elapsed one still inside
   * the grace period. Stale subjects are included: they keep their last known occurrence and only
   * lose the rollover.
   */
  @Transactional(propagation = Propagation.REQUIRES_NEW)
  public StoredOccurrenceOutcome sweepStoredOccurrence(UUID subjectId, LocalDate today) {
    var subject = subjectRepository.findByIdForUpdate(subjectId).orElse(null);
    if (subject == null || subject.isDeleted()) {
      return StoredOccurrenceOutcome.SKIPPED;
    }
    LocalDate occurrence = subject.getNextOccurrence();
    int created = 0;
    if (!today.isAfter(occurrence.plusDays(properties.graceDays()))) {
      var recipients = recipientRepository.findBySubjectIdAndActiveTrueAndOptedOutFalse(subjectId);
      created = createEntries(subject, occurrence, recipients, today);
    }

    boolean elapsed = today.isAfter(occurrence);
    if (elapsed && subject.isStale()) {
      log.debug(
          "Subject {} is stale; keeping occurrence {} until its date of death is corrected",
          subjectId,
          occurrence);
    }
    return new StoredOccurrenceOutcome(created, elapsed && !subject.isStale());
  }

  /**
   * Advances an elapsed occurrence to the next one after {@code today} and creates the entries the
   * new occurrence already needs, so a short lead window is not missed.
   */
  @Transactional(propagation = Propagation.REQUIRES_NEW)
  public SubjectSweepOutcome rollOver(UUID subjectId, LocalDate today) {
    var subject = subjectRepository.findByIdForUpdate(subjectId).orElse(null);
    if (subject == null || subject.isDeleted() || subject.isStale()) {
      return SubjectSweepOutcome.UNCHANGED;
    }
    LocalDate occurrence = subject.getNextOccurrence();
    if (!today.isAfter(occurrence)) {
      return SubjectSweepOutcome.UNCHANGED;
    }

    LocalDate next = anniversaryCalculator.nextOccurrence(subject.getAnniversary(), today);
    subject.rollOver(next, clock.instant());
    eventPublisher.publishEvent(
        new OccurrenceRolledOverEvent(subjectId, occurrence, next, clock.instant()));
    log.info("Subject {} rolled over from {} to {}", subjectId, occurrence, next);

    var recipients = recipientRepository.findBySubjectIdAndActiveTrueAndOptedOutFalse(subjectId);
    return new SubjectSweepOutcome(createEntries(subject, next, recipients, today), true);
  }

  /**
   * Flags a subject whose dates cannot be computed. Its stored occurrence is still served, but it
   * is not rolled over until its date of death is corrected.
   */
  @Transactional(propagation = Propagation.REQUIRES_NEW)
  public void markStale(UUID subjectId, String reason) {
    var subject = subjectRepository.findByIdForUpdate(subjectId).orElse(null);
    if (subject == null || subject.isStale()) {
      return;
    }
    Instant now = clock.instant();
    subject.markStale(reason, now);
    eventPublisher.publishEvent(
        new SubjectMarkedStaleEvent(subjectId, subject.getNextOccurrence(), reason, now));
    log.warn("Subject {} marked stale: {}", subjectId, reason);
  }

  private int createEntries(
      Subject subject, LocalDate occurrence, List<Recipient> recipients, LocalDate today) {
    int created = 0;
    Integer cycleYear = null;
    for (var recipient : recipients) {
      int leadDays = recipient.effectiveLeadDays(properties.leadDays());
      LocalDate sendDate = occurrence.minusDays(leadDays);
      if (today.isBefore(sendDate.minusDays(properties.horizonDays()))) {
        continue;
      }
      if (cycleYear == null) {
        cycleYear = anniversaryCalculator.cycleYear(occurrence);
      }
      Instant scheduledFor =
          sendDate.atTime(properties.sendTime()).atZone(clock.getZone()).toInstant();
      var entry =
          new NewLedgerEntry(
              subject.getId(),
              recipient.getId(),
              cycleYear,
              occurrence,
              scheduledFor,
              recipient.getChannelKind(),
              contentFactory.create(subject, recipient, occurrence, leadDays));
      if (ledgerService.createIfAbsent(entry)) {
        created++;
        log.debug(
            "Created ledger entry for subject={}, recipient={}, cycle={}, scheduledFor={}",
            subject.getId(),
            recipient.getId(),
            cycleYear,
            scheduledFor);
      }
    }
    return created;
  }

  public record StoredOccurrenceOutcome(int entriesCreated, boolean rolloverDue) {

    static final StoredOccurrenceOutcome SKIPPED = new StoredOccurrenceOutcome(0, false);
  }

  public record SubjectSweepOutcome(int entriesCreated, boolean rolledOver) {

    static final SubjectSweepOutcome UNCHANGED = new SubjectSweepOutcome(0, false);
  }
}
