package io.b2mash.yahrzeit.audit;

import io.b2mash.yahrzeit.event.DomainEvent;
import io.b2mash.yahrzeit.event.OccurrenceRolledOverEvent;
import io.b2mash.yahrzeit.event.SubjectMarkedStaleEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

/**
 * Persists every outbound {@link DomainEvent}. Runs synchronously in the publisher's transaction,
 * so an event is recorded exactly when the change it describes commits.
 */
@Component
public class AuditEventListener {

  private static final Logger log = LoggerFactory.getLogger(AuditEventListener.class);

  private final AuditService auditService;

  public AuditEventListener(AuditService auditService) {
    this.auditService = auditService;
  }

  @EventListener
  public void onDomainEvent(DomainEvent event) {
    log.debug("Domain event {} for {}/{}", event.eventType(), event.entityType(), event.entityId());
    auditService.log(
        new AuditEventRecord(
            event.eventType(),
            event.entityType(),
            event.entityId(),
            "SYSTEM",
            sourceOf(event),
            event.details(),
            event.occurredAt()));
  }

  private static String sourceOf(DomainEvent event) {
    if (event instanceof OccurrenceRolledOverEvent || event instanceof SubjectMarkedStaleEvent) {
      return "SCHEDULED";
    }
    return "DISPATCH";
  }
}
