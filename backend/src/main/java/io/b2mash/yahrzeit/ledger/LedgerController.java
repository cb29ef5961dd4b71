package io.b2mash.yahrzeit.ledger;

import io.b2mash.yahrzeit.notification.ReminderPayload;
import io.b2mash.yahrzeit.recipient.ChannelKind;
import jakarta.validation.constraints.Size;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.UUID;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/internal")
public class LedgerController {

  private final LedgerService ledgerService;

  public LedgerController(LedgerService ledgerService) {
    this.ledgerService = ledgerService;
  }

  @GetMapping("/subjects/{subjectId}/ledger")
  public ResponseEntity<List<LedgerEntryResponse>> listForSubject(@PathVariable UUID subjectId) {
    return ResponseEntity.ok(
        ledgerService.findForSubject(subjectId).stream().map(LedgerEntryResponse::from).toList());
  }

  @GetMapping("/ledger/{id}")
  public ResponseEntity<LedgerEntryResponse> get(@PathVariable UUID id) {
    return ResponseEntity.ok(LedgerEntryResponse.from(ledgerService.find(id)));
  }

  @PostMapping("/ledger/{id}/cancel")
  public ResponseEntity<LedgerEntryResponse> cancel(
      @PathVariable UUID id, @RequestBody(required = false) CancelRequest request) {
    String reason =
        request != null && request.reason() != null && !request.reason().isBlank()
            ? request.reason()
            : "Cancelled by operator";
    return ResponseEntity.ok(LedgerEntryResponse.from(ledgerService.cancel(id, reason)));
  }

  public record CancelRequest(@Size(max = 500) String reason) {}

  public record LedgerEntryResponse(
      UUID id,
      UUID subjectId,
      UUID recipientId,
      int cycleYear,
      LocalDate occurrenceDate,
      LedgerStatus status,
      Instant scheduledFor,
      int attemptCount,
      Instant lastAttemptAt,
      Instant nextRetryAt,
      ChannelKind channelKind,
      ReminderPayload payload,
      String lastError,
      String externalId,
      Instant createdAt,
      Instant updatedAt) {

    static LedgerEntryResponse from(LedgerEntry entry) {
      return new LedgerEntryResponse(
          entry.getId(),
          entry.getSubjectId(),
          entry.getRecipientId(),
          entry.getCycleYear(),
          entry.getOccurrenceDate(),
          entry.getStatus(),
          entry.getScheduledFor(),
          entry.getAttemptCount(),
          entry.getLastAttemptAt(),
          entry.getNextRetryAt(),
          entry.getChannelKind(),
          entry.getRenderedPayload(),
          entry.getLastError(),
          entry.getExternalId(),
          entry.getCreatedAt(),
          entry.getUpdatedAt());
    }
  }
}
