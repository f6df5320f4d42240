package io.bms.backend.event;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.UUID;

public record InvoiceGeneratedEvent(
    String eventType,
    UUID entityId,
    String organizationId,
    Instant occurredAt,
    UUID leaseId,
    UUID tenantId,
    String invoiceNumber,
    BigDecimal total,
    LocalDate dueDate)
    implements DomainEvent {}
