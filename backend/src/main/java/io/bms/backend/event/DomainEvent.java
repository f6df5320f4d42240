package io.bms.backend.event;

import java.time.Instant;
import java.util.UUID;

/**
 * Base interface for billing events published via Spring ApplicationEventPublisher. Implementations
 * are records holding ids and values only, never JPA entities, so they stay valid after the
 * publishing transaction commits.
 */
public sealed interface DomainEvent permits InvoiceGeneratedEvent, InvoiceOverdueEvent {

  String eventType();

  UUID entityId();

  String organizationId();

  Instant occurredAt();
}
