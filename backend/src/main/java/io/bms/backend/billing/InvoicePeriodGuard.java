package io.bms.backend.billing;

import io.bms.backend.invoice.InvoiceRepository;
import java.time.LocalDate;
import java.util.UUID;
import org.springframework.stereotype.Component;

/**
 * Prevents duplicate billing when a run is repeated for the same period. Periods are derived
 * deterministically from the lease pointers, so an exact match on both boundaries is sufficient.
 * The unique constraint on (lease_id, period_start, period_end) backs this check up when two runs
 * race.
 */
@Component
public class InvoicePeriodGuard {

  private final InvoiceRepository invoiceRepository;

  public InvoicePeriodGuard(InvoiceRepository invoiceRepository) {
    this.invoiceRepository = invoiceRepository;
  }

  public boolean invoiceExistsForPeriod(
      UUID leaseId, LocalDate periodStart, LocalDate periodEnd, String organizationId) {
    return invoiceRepository.findByLeaseIdAndOrganizationId(leaseId, organizationId).stream()
        .anyMatch(
            invoice ->
                invoice.getPeriodStart().equals(periodStart)
                    && invoice.getPeriodEnd().equals(periodEnd));
  }
}
