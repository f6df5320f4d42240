package io.bms.backend.billing.dto;

import java.util.UUID;

/**
 * Result of the generation pass for one lease.
 *
 * @param invoiceId the created invoice, null unless CREATED
 * @param reason why the lease was skipped or failed, null when CREATED
 */
public record LeaseInvoicingOutcome(
    UUID leaseId, Outcome outcome, UUID invoiceId, String invoiceNumber, String reason) {

  public enum Outcome {
    CREATED,
    SKIPPED,
    FAILED
  }

  public static LeaseInvoicingOutcome created(UUID leaseId, UUID invoiceId, String invoiceNumber) {
    return new LeaseInvoicingOutcome(leaseId, Outcome.CREATED, invoiceId, invoiceNumber, null);
  }

  public static LeaseInvoicingOutcome skipped(UUID leaseId, String reason) {
    return new LeaseInvoicingOutcome(leaseId, Outcome.SKIPPED, null, null, reason);
  }

  public static LeaseInvoicingOutcome failed(UUID leaseId, String reason) {
    return new LeaseInvoicingOutcome(leaseId, Outcome.FAILED, null, null, reason);
  }
}
