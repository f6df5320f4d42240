package io.bms.backend.billing.dto;

import io.bms.backend.lease.Lease;
import java.time.LocalDate;
import java.util.UUID;

public record BillingPointersResponse(
    UUID leaseId, LocalDate nextInvoiceDate, LocalDate lastInvoicedAt) {

  public static BillingPointersResponse from(Lease lease) {
    return new BillingPointersResponse(
        lease.getId(), lease.getNextInvoiceDate(), lease.getLastInvoicedAt());
  }
}
