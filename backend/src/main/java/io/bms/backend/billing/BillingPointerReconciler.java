package io.bms.backend.billing;

import io.bms.backend.audit.AuditEventBuilder;
import io.bms.backend.audit.AuditService;
import io.bms.backend.exception.ResourceNotFoundException;
import io.bms.backend.invoice.Invoice;
import io.bms.backend.invoice.InvoiceRepository;
import io.bms.backend.lease.Lease;
import io.bms.backend.lease.LeaseRepository;
import java.time.LocalDate;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Repairs a lease whose billing pointers disagree with its invoices, for example after an invoice
 * was inserted but the pointer update was lost. Pointers are rebuilt from the latest invoiced
 * period. Cancelled invoices count, as they still occupy their period.
 */
@Service
public class BillingPointerReconciler {

  private static final Logger log = LoggerFactory.getLogger(BillingPointerReconciler.class);

  private final LeaseRepository leaseRepository;
  private final InvoiceRepository invoiceRepository;
  private final AuditService auditService;

  public BillingPointerReconciler(
      LeaseRepository leaseRepository,
      InvoiceRepository invoiceRepository,
      AuditService auditService) {
    this.leaseRepository = leaseRepository;
    this.invoiceRepository = invoiceRepository;
    this.auditService = auditService;
  }

  @Transactional
  public Lease reconcile(UUID leaseId, String organizationId) {
    Lease lease =
        leaseRepository
            .findByIdAndOrganizationId(leaseId, organizationId)
            .orElseThrow(() -> new ResourceNotFoundException("Lease", leaseId));

    LocalDate previousNext = lease.getNextInvoiceDate();
    LocalDate previousLast = lease.getLastInvoicedAt();

    LocalDate lastInvoicedAt =
        invoiceRepository.findByLeaseIdAndOrganizationId(leaseId, organizationId).stream()
            .map(Invoice::getPeriodEnd)
            .max(Comparator.naturalOrder())
            .orElse(null);
    LocalDate nextInvoiceDate =
        lease
            .getBillingCycle()
            .advance(lastInvoicedAt != null ? lastInvoicedAt : lease.getStartDate());

    lease.updateBillingPointers(nextInvoiceDate, lastInvoicedAt);
    lease = leaseRepository.save(lease);

    var details = new LinkedHashMap<String, Object>();
    details.put("previous_next_invoice_date", String.valueOf(previousNext));
    details.put("previous_last_invoiced_at", String.valueOf(previousLast));
    details.put("next_invoice_date", nextInvoiceDate.toString());
    details.put("last_invoiced_at", String.valueOf(lastInvoicedAt));
    auditService.log(
        AuditEventBuilder.builder()
            .eventType("lease.billing_pointers_reconciled")
            .entityType("lease")
            .entityId(leaseId)
            .organizationId(organizationId)
            .details(details)
            .build());

    log.info(
        "Reconciled billing pointers for lease {}: next {} -> {}, last {} -> {}",
        leaseId,
        previousNext,
        nextInvoiceDate,
        previousLast,
        lastInvoicedAt);
    return lease;
  }
}
