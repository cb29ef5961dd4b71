package io.b2mash.yahrzeit.recipient;

import io.b2mash.yahrzeit.event.RecipientDeactivatedEvent;
import io.b2mash.yahrzeit.exception.InvalidStateException;
import io.b2mash.yahrzeit.exception.ResourceConflictException;
import io.b2mash.yahrzeit.exception.ResourceNotFoundException;
import io.b2mash.yahrzeit.ledger.LedgerService;
import io.b2mash.yahrzeit.subject.SubjectRepository;
import java.time.Clock;
import java.util.List;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
public class RecipientService {

  private static final Logger log = LoggerFactory.getLogger(RecipientService.class);

  static final int MAX_RECIPIENTS_PER_SUBJECT = 20;
  static final int MAX_LEAD_DAYS = 30;

  private final RecipientRepository recipientRepository;
  private final SubjectRepository subjectRepository;
  private final LedgerService ledgerService;
  private final ApplicationEventPublisher eventPublisher;
  private final Clock clock;

  public RecipientService(
      RecipientRepository recipientRepository,
      SubjectRepository subjectRepository,
      LedgerService ledgerService,
      ApplicationEventPublisher eventPublisher,
      Clock clock) {
    this.recipientRepository = recipientRepository;
    this.subjectRepository = subjectRepository;
    this.ledgerService = ledgerService;
    this.eventPublisher = eventPublisher;
    this.clock = clock;
  }

  @Transactional
  public Recipient register(
      UUID subjectId,
      UUID recipientId,
      ChannelKind channelKind,
      String address,
      String displayName,
      Integer leadDays) {
    var subject =
        subjectRepository
            .findByIdForUpdate(subjectId)
            .orElseThrow(() -> new ResourceNotFoundException("Subject", subjectId));
    if (subject.isDeleted()) {
      throw new InvalidStateException(
          "Subject deleted", "Subject " + subjectId + " has been deleted");
    }
    if (leadDays != null && (leadDays < 0 || leadDays > MAX_LEAD_DAYS)) {
      throw new IllegalArgumentException(
          "Lead days must be between 0 and " + MAX_LEAD_DAYS + ", got " + leadDays);
    }
    if (channelKind == ChannelKind.EMAIL && (address == null || !address.contains("@"))) {
      throw new IllegalArgumentException("Not an email address: " + address);
    }
    if (recipientRepository.existsById(recipientId)) {
      throw new ResourceConflictException(
          "Recipient exists", "Recipient " + recipientId + " already exists");
    }
    String normalized = Recipient.normalizeAddress(channelKind, address);
    if (recipientRepository.existsBySubjectIdAndChannelKindAndAddress(
        subjectId, channelKind, normalized)) {
      throw new ResourceConflictException(
          "Duplicate recipient",
          "Subject " + subjectId + " already has a " + channelKind + " recipient at that address");
    }
    if (recipientRepository.countBySubjectId(subjectId) >= MAX_RECIPIENTS_PER_SUBJECT) {
      throw new ResourceConflictException(
          "Recipient limit reached",
          "Subject " + subjectId + " already has " + MAX_RECIPIENTS_PER_SUBJECT + " recipients");
    }

    var recipient =
        recipientRepository.save(
            new Recipient(
                recipientId,
                subjectId,
                channelKind,
                address,
                displayName,
                leadDays,
                clock.instant()));
    log.info("Registered {} recipient {} for subject {}", channelKind, recipientId, subjectId);
    return recipient;
  }

  /** Deactivation requested by record-management; cancels every pending reminder. */
  @Transactional
  public Recipient deactivate(UUID recipientId, String reason) {
    var recipient = require(recipientId);
    if (!recipient.isActive()) {
      log.debug("Recipient {} already inactive", recipientId);
      return recipient;
    }
    recipient.deactivate(reason, clock.instant());
    ledgerService.cancelForRecipient(recipientId, "Recipient deactivated");
    return recipient;
  }

  @Transactional
  public Recipient optOut(UUID recipientId) {
    var recipient = require(recipientId);
    if (recipient.isOptedOut()) {
      return recipient;
    }
    recipient.optOut(clock.instant());
    ledgerService.cancelForRecipient(recipientId, "Recipient opted out");
    return recipient;
  }

  /** Makes the recipient eligible again; reminders resume from the next sweep. */
  @Transactional
  public Recipient reactivate(UUID recipientId) {
    var recipient = require(recipientId);
    var subject =
        subjectRepository
            .findById(recipient.getSubjectId())
            .orElseThrow(() -> new ResourceNotFoundException("Subject", recipient.getSubjectId()));
    if (subject.isDeleted()) {
      throw new InvalidStateException(
          "Subject deleted", "Subject " + subject.getId() + " has been deleted");
    }
    recipient.reactivate(clock.instant());
    log.info("Reactivated recipient {}", recipientId);
    return recipient;
  }

  /**
   * Deactivates a recipient whose channel rejected it permanently and tells record-management, so
   * the owner can be asked for a corrected address.
   */
  @Transactional
  public void deactivateAfterPermanentFailure(UUID recipientId, String reason) {
    var recipient = recipientRepository.findById(recipientId).orElse(null);
    if (recipient == null || !recipient.isActive()) {
      return;
    }
    recipient.deactivate(reason, clock.instant());
    int cancelled = ledgerService.cancelForRecipient(recipientId, "Recipient rejected by channel");
    log.warn(
        "Deactivated recipient {} after permanent {} failure: {}",
        recipientId,
        recipient.getChannelKind(),
        reason);
    eventPublisher.publishEvent(
        new RecipientDeactivatedEvent(
            recipientId,
            recipient.getSubjectId(),
            recipient.getChannelKind().name(),
            reason,
            cancelled,
            clock.instant()));
  }

  @Transactional(readOnly = true)
  public Recipient get(UUID recipientId) {
    return require(recipientId);
  }

  @Transactional(readOnly = true)
  public List<Recipient> listForSubject(UUID subjectId) {
    return recipientRepository.findBySubjectIdOrderByCreatedAt(subjectId);
  }

  private Recipient require(UUID recipientId) {
    return recipientRepository
        .findById(recipientId)
        .orElseThrow(() -> new ResourceNotFoundException("Recipient", recipientId));
  }
}
