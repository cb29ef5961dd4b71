package io.b2mash.yahrzeit.event;

import java.time.Instant;
import java.util.Map;
import java.util.UUID;

/**
 * Base interface for events published through Spring's ApplicationEventPublisher. Implementations
 * are records holding ids and values only, never JPA entities, so they stay valid after the
 * publishing transaction has closed.
 *
 * <p>These events are the outbound stream consumed by record-management and audit. {@link
 * #eventType()} follows the {@code {entity}.{action}} convention.
 */
public sealed interface DomainEvent
    permits OccurrenceRolledOverEvent,
        NotificationSentEvent,
        NotificationFailedTerminalEvent,
        RecipientDeactivatedEvent,
        SubjectMarkedStaleEvent {

  String eventType();

  String entityType();

  UUID entityId();

  Instant occurredAt();

  Map<String, Object> details();
}
