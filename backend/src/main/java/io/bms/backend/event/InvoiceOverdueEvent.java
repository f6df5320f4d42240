package io.bms.backend.event;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

public record InvoiceOverdueEvent(
    String eventType,
    UUID entityId,
    String organizationId,
    Instant occurredAt,
    UUID leaseId,
    UUID tenantId,
    String invoiceNumber,
    BigDecimal lateFee,
    BigDecimal total)
    implements DomainEvent {}
