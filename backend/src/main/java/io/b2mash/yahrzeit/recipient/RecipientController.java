package io.b2mash.yahrzeit.recipient;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import java.net.URI;
import java.time.Instant;
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
public class RecipientController {

  private final RecipientService recipientService;

  public RecipientController(RecipientService recipientService) {
    this.recipientService = recipientService;
  }

  @PostMapping("/subjects/{subjectId}/recipients")
  public ResponseEntity<RecipientResponse> registerRecipient(
      @PathVariable UUID subjectId, @Valid @RequestBody RegisterRecipientRequest request) {
    var recipient =
        recipientService.register(
            subjectId,
            request.id(),
            request.channelKind(),
            request.address(),
            request.displayName(),
            request.leadDays());
    return ResponseEntity.created(URI.create("/internal/recipients/" + recipient.getId()))
        .body(RecipientResponse.from(recipient));
  }

  @GetMapping("/subjects/{subjectId}/recipients")
  public ResponseEntity<List<RecipientResponse>> listRecipients(@PathVariable UUID subjectId) {
    return ResponseEntity.ok(
        recipientService.listForSubject(subjectId).stream().map(RecipientResponse::from).toList());
  }

  @GetMapping("/recipients/{id}")
  public ResponseEntity<RecipientResponse> getRecipient(@PathVariable UUID id) {
    return ResponseEntity.ok(RecipientResponse.from(recipientService.get(id)));
  }

  @PostMapping("/recipients/{id}/deactivate")
  public ResponseEntity<RecipientResponse> deactivate(
      @PathVariable UUID id, @RequestBody(required = false) DeactivateRequest request) {
    String reason =
        request != null && request.reason() != null ? request.reason() : "Deactivated by owner";
    return ResponseEntity.ok(RecipientResponse.from(recipientService.deactivate(id, reason)));
  }

  @PostMapping("/recipients/{id}/opt-out")
  public ResponseEntity<RecipientResponse> optOut(@PathVariable UUID id) {
    return ResponseEntity.ok(RecipientResponse.from(recipientService.optOut(id)));
  }

  @PostMapping("/recipients/{id}/reactivate")
  public ResponseEntity<RecipientResponse> reactivate(@PathVariable UUID id) {
    return ResponseEntity.ok(RecipientResponse.from(recipientService.reactivate(id)));
  }

  public record RegisterRecipientRequest(
      @NotNull UUID id,
      @NotNull ChannelKind channelKind,
      @NotBlank @Size(max = 320) String address,
      @Size(max = 200) String displayName,
      @Min(0) @Max(30) Integer leadDays) {}

  public record DeactivateRequest(@Size(max = 500) String reason) {}

  public record RecipientResponse(
      UUID id,
      UUID subjectId,
      ChannelKind channelKind,
      String address,
      String displayName,
      Integer leadDays,
      boolean active,
      boolean optedOut,
      String deactivationReason,
      Instant deactivatedAt,
      Instant createdAt) {

    static RecipientResponse from(Recipient recipient) {
      return new RecipientResponse(
          recipient.getId(),
          recipient.getSubjectId(),
          recipient.getChannelKind(),
          recipient.getAddress(),
          recipient.getDisplayName(),
          recipient.getLeadDays(),
          recipient.isActive(),
          recipient.isOptedOut(),
          recipient.getDeactivationReason(),
          recipient.getDeactivatedAt(),
          recipient.getCreatedAt());
    }
  }
}
