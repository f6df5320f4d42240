package io.bms.backend.billing.dto;

import java.time.LocalDate;
import java.util.List;

/** Per-item outcomes of one invoicing run for an organization. */
public record InvoicingRunResult(
    String organizationId,
    LocalDate asOf,
    List<LateFeeOutcome> lateFees,
    List<LeaseInvoicingOutcome> invoices) {

  public long createdCount() {
    return count(LeaseInvoicingOutcome.Outcome.CREATED);
  }

  public long skippedCount() {
    return count(LeaseInvoicingOutcome.Outcome.SKIPPED);
  }

  /** Failed leases plus failed late-fee invoices. */
  public long failedCount() {
    return count(LeaseInvoicingOutcome.Outcome.FAILED)
        + lateFees.stream().filter(o -> o.outcome() == LateFeeOutcome.Outcome.FAILED).count();
  }

  public long lateFeesAppliedCount() {
    return lateFees.stream().filter(o -> o.outcome() == LateFeeOutcome.Outcome.APPLIED).count();
  }

  private long count(LeaseInvoicingOutcome.Outcome outcome) {
    return invoices.stream().filter(o -> o.outcome() == outcome).count();
  }
}
