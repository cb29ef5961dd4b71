package io.b2mash.yahrzeit.audit;

import java.time.Instant;
import java.util.Map;
import java.util.UUID;

/**
 * Non-JPA DTO passed to {@link AuditService#log(AuditEventRecord)}.
 *
 * @param eventType event type following the {@code {entity}.{action}} convention
 * @param entityType the kind of entity being audited (e.g., "subject", "ledger_entry")
 * @param entityId ID of the affected entity (not a FK)
 * @param actorType SYSTEM for everything this service does on its own
 * @param source origin of the action: SCHEDULED, DISPATCH or INTERNAL
 * @param details event-specific values as JSONB; nullable
 * @param occurredAt when the event happened
 */
public record AuditEventRecord(
    String eventType,
    String entityType,
    UUID entityId,
    String actorType,
    String source,
    Map<String, Object> details,
    Instant occurredAt) {}
