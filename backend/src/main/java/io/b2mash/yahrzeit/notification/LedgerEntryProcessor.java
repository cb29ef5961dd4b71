package io.b2mash.yahrzeit.notification;

import io.b2mash.yahrzeit.event.NotificationFailedTerminalEvent;
import io.b2mash.yahrzeit.event.NotificationSentEvent;
import io.b2mash.yahrzeit.ledger.LedgerEntry;
import io.b2mash.yahrzeit.ledger.LedgerService;
import io.b2mash.yahrzeit.notification.channel.ChannelPermanentException;
import io.b2mash.yahrzeit.notification.channel.ChannelRegistry;
import io.b2mash.yahrzeit.notification.channel.DeliveryReceipt;
import io.b2mash.yahrzeit.recipient.Recipient;
import io.b2mash.yahrzeit.recipient.RecipientRepository;
import io.b2mash.yahrzeit.recipient.RecipientService;
import io.b2mash.yahrzeit.subject.Subject;
import io.b2mash.yahrzeit.subject.SubjectRepository;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Component;

/**
 * Delivers one ledger entry. The entry is claimed first; only the worker whose claim succeeds
 * sends, which keeps delivery at most once per entry even when polls overlap.
 */
@Component
public class LedgerEntryProcessor {

  private static final Logger log = LoggerFactory.getLogger(LedgerEntryProcessor.class);

  private final LedgerService ledgerService;
  private final SubjectRepository subjectRepository;
  private final RecipientRepository recipientRepository;
  private final RecipientService recipientService;
  private final ChannelRegistry channelRegistry;
  private final RetryBackoffPolicy backoffPolicy;
  private final DispatchProperties properties;
  private final ApplicationEventPublisher eventPublisher;
  private final Clock clock;

  public LedgerEntryProcessor(
      LedgerService ledgerService,
      SubjectRepository subjectRepository,
      RecipientRepository recipientRepository,
      RecipientService recipientService,
      ChannelRegistry channelRegistry,
      RetryBackoffPolicy backoffPolicy,
      DispatchProperties properties,
      ApplicationEventPublisher eventPublisher,
      Clock clock) {
    this.ledgerService = ledgerService;
    this.subjectRepository = subjectRepository;
    this.recipientRepository = recipientRepository;
    this.recipientService = recipientService;
    this.channelRegistry = channelRegistry;
    this.backoffPolicy = backoffPolicy;
    this.properties = properties;
    this.eventPublisher = eventPublisher;
    this.clock = clock;
  }

  public DispatchOutcome process(UUID entryId, String workerId) {
    try {
      if (!ledgerService.claim(entryId, workerId)) {
        log.debug("Entry {} already claimed or not due", entryId);
        return DispatchOutcome.SKIPPED;
      }
      return deliver(ledgerService.find(entryId));
    } catch (RuntimeException e) {
      // The claim stays IN_FLIGHT and is recovered after the in-flight timeout
      log.error("Unexpected failure processing ledger entry {}", entryId, e);
      return DispatchOutcome.ERROR;
    }
  }

  private DispatchOutcome deliver(LedgerEntry entry) {
    var subject = subjectRepository.findById(entry.getSubjectId()).orElse(null);
    var recipient = recipientRepository.findById(entry.getRecipientId()).orElse(null);
    String ineligible = ineligibilityReason(subject, recipient);
    if (ineligible != null) {
      if (ledgerService.cancelInFlight(entry.getId(), ineligible)) {
        log.info("Cancelled ledger entry {}: {}", entry.getId(), ineligible);
      }
      return DispatchOutcome.CANCELLED;
    }

    DeliveryReceipt receipt;
    try {
      receipt =
          channelRegistry
              .get(entry.getChannelKind())
              .send(recipient.getAddress(), entry.getRenderedPayload());
    } catch (ChannelPermanentException e) {
      return failPermanently(entry, e.getMessage());
    } catch (RuntimeException e) {
      return retryOrFail(entry, e);
    }

    if (!ledgerService.markSent(entry.getId(), receipt.externalId())) {
      log.warn(
          "Entry {} was sent via {} but changed state before it could be marked sent",
          entry.getId(),
          receipt.providerId());
      return DispatchOutcome.SENT;
    }
    log.info(
        "Sent {} reminder for subject {} to recipient {} (entry {}, attempt {})",
        entry.getChannelKind(),
        entry.getSubjectId(),
        entry.getRecipientId(),
        entry.getId(),
        entry.getAttemptCount());
    eventPublisher.publishEvent(
        new NotificationSentEvent(
            entry.getId(),
            entry.getSubjectId(),
            entry.getRecipientId(),
            entry.getCycleYear(),
            entry.getChannelKind().name(),
            receipt.externalId(),
            entry.getAttemptCount(),
            clock.instant()));
    return DispatchOutcome.SENT;
  }

  private static String ineligibilityReason(Subject subject, Recipient recipient) {
    if (subject == null || subject.isDeleted()) {
      return "Subject deleted";
    }
    if (recipient == null) {
      return "Recipient removed";
    }
    if (!recipient.isActive()) {
      return "Recipient deactivated";
    }
    if (recipient.isOptedOut()) {
      return "Recipient opted out";
    }
    return null;
  }

  private DispatchOutcome failPermanently(LedgerEntry entry, String reason) {
    log.warn(
        "Permanent {} failure for entry {} (recipient {}): {}",
        entry.getChannelKind(),
        entry.getId(),
        entry.getRecipientId(),
        reason);
    if (ledgerService.markFailed(entry.getId(), reason)) {
      publishTerminalFailure(entry, true, reason);
    }
    recipientService.deactivateAfterPermanentFailure(entry.getRecipientId(), reason);
    return DispatchOutcome.FAILED;
  }

  private DispatchOutcome retryOrFail(LedgerEntry entry, RuntimeException failure) {
    String reason = failure.getMessage() != null ? failure.getMessage() : failure.toString();
    int attempt = entry.getAttemptCount();
    if (attempt >= properties.maxAttempts()) {
      log.warn(
          "Entry {} failed on final attempt {}/{}: {}",
          entry.getId(),
          attempt,
          properties.maxAttempts(),
          reason);
      if (ledgerService.markFailed(entry.getId(), reason)) {
        publishTerminalFailure(entry, false, reason);
      }
      return DispatchOutcome.FAILED;
    }

    Duration delay = backoffPolicy.delayAfter(attempt);
    Instant nextRetryAt = clock.instant().plus(delay);
    if (!ledgerService.scheduleRetry(entry.getId(), nextRetryAt, reason)) {
      log.warn(
          "Entry {} attempt {}/{} failed but changed state before a retry was scheduled: {}",
          entry.getId(),
          attempt,
          properties.maxAttempts(),
          reason);
      return DispatchOutcome.SKIPPED;
    }
    log.warn(
        "Entry {} attempt {}/{} failed, retrying at {}: {}",
        entry.getId(),
        attempt,
        properties.maxAttempts(),
        nextRetryAt,
        reason);
    return DispatchOutcome.RETRY_SCHEDULED;
  }

  private void publishTerminalFailure(LedgerEntry entry, boolean permanent, String reason) {
    eventPublisher.publishEvent(
        new NotificationFailedTerminalEvent(
            entry.getId(),
            entry.getSubjectId(),
            entry.getRecipientId(),
            entry.getCycleYear(),
            entry.getChannelKind().name(),
            entry.getAttemptCount(),
            permanent,
            reason,
            clock.instant()));
  }
}
