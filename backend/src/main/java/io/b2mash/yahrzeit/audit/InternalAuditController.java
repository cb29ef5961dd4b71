package io.b2mash.yahrzeit.audit;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Sort;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/internal/audit-events")
public class InternalAuditController {

  private final AuditService auditService;

  public InternalAuditController(AuditService auditService) {
    this.auditService = auditService;
  }

  @GetMapping
  public ResponseEntity<Page<InternalAuditEventResponse>> listAuditEvents(
      @RequestParam(required = false) String entityType,
      @RequestParam(required = false) UUID entityId,
      @RequestParam(required = false) String eventType,
      @RequestParam(required = false) Instant from,
      @RequestParam(required = false) Instant to,
      @RequestParam(defaultValue = "0") int page,
      @RequestParam(defaultValue = "50") int size) {
    var filter = new AuditEventFilter(entityType, entityId, eventType, from, to);
    var pageable =
        PageRequest.of(page, Math.min(size, 200), Sort.by(Sort.Direction.DESC, "occurredAt"));
    Page<AuditEvent> events = auditService.findEvents(filter, pageable);
    return ResponseEntity.ok(events.map(InternalAuditEventResponse::from));
  }

  @GetMapping("/stats")
  public ResponseEntity<AuditStatsResponse> getStats() {
    var counts = auditService.countEventsByType();
    long totalEvents =
        counts.stream().mapToLong(AuditEventRepository.EventTypeCount::getCount).sum();
    List<EventTypeStat> stats =
        counts.stream().map(c -> new EventTypeStat(c.getEventType(), c.getCount())).toList();
    return ResponseEntity.ok(new AuditStatsResponse(stats, totalEvents));
  }

  public record InternalAuditEventResponse(
      UUID id,
      String eventType,
      String entityType,
      UUID entityId,
      String actorType,
      String source,
      Map<String, Object> details,
      Instant occurredAt) {

    public static InternalAuditEventResponse from(AuditEvent event) {
      return new InternalAuditEventResponse(
          event.getId(),
          event.getEventType(),
          event.getEntityType(),
          event.getEntityId(),
          event.getActorType(),
          event.getSource(),
          event.getDetails(),
          event.getOccurredAt());
    }
  }

  public record AuditStatsResponse(List<EventTypeStat> eventTypeCounts, long totalEvents) {}

  public record EventTypeStat(String eventType, long count) {}
}
