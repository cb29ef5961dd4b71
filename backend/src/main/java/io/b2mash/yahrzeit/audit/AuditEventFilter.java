package io.b2mash.yahrzeit.audit;

import java.time.Instant;
import java.util.UUID;

/** Optional query filters; null means "no filter on this field". */
public record AuditEventFilter(
    String entityType, UUID entityId, String eventType, Instant from, Instant to) {}
