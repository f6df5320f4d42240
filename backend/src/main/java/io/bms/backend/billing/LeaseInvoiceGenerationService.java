package io.bms.backend.billing;

import io.bms.backend.audit.AuditEventBuilder;
import io.bms.backend.audit.AuditService;
import io.bms.backend.billing.dto.LeaseInvoicingOutcome;
import io.bms.backend.event.InvoiceGeneratedEvent;
import io.bms.backend.exception.ResourceNotFoundException;
import io.bms.backend.invoice.Invoice;
import io.bms.backend.invoice.InvoiceItem;
import io.bms.backend.invoice.InvoiceLine;
import io.bms.backend.invoice.InvoiceLineRepository;
import io.bms.backend.invoice.InvoiceNumberService;
import io.bms.backend.invoice.InvoiceRepository;
import io.bms.backend.invoice.InvoiceTotalsCalculator;
import io.bms.backend.lease.Lease;
import io.bms.backend.lease.LeaseRepository;
import io.bms.backend.tax.VatNormalizationService;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

/**
 * Generates the invoice for the current billing period of a single lease and advances the lease's
 * billing pointers.
 *
 * <p>Each call runs in its own transaction so that the invoice, its lines, its number and the
 * pointer update commit or roll back together, and a failure on one lease leaves the others of the
 * run untouched. A lease whose invoice could not be created therefore keeps its pointers and is
 * retried by the next run.
 */
@Service
public class LeaseInvoiceGenerationService {

  private static final Logger log = LoggerFactory.getLogger(LeaseInvoiceGenerationService.class);

  private final LeaseRepository leaseRepository;
  private final InvoiceRepository invoiceRepository;
  private final InvoiceLineRepository invoiceLineRepository;
  private final InvoicePeriodGuard periodGuard;
  private final InvoiceLineBuilder lineBuilder;
  private final VatNormalizationService vatNormalizationService;
  private final InvoiceTotalsCalculator totalsCalculator;
  private final LateFeeCalculator lateFeeCalculator;
  private final InvoiceNumberService invoiceNumberService;
  private final AuditService auditService;
  private final ApplicationEventPublisher eventPublisher;

  public LeaseInvoiceGenerationService(
      LeaseRepository leaseRepository,
      InvoiceRepository invoiceRepository,
      InvoiceLineRepository invoiceLineRepository,
      InvoicePeriodGuard periodGuard,
      InvoiceLineBuilder lineBuilder,
      VatNormalizationService vatNormalizationService,
      InvoiceTotalsCalculator totalsCalculator,
      LateFeeCalculator lateFeeCalculator,
      InvoiceNumberService invoiceNumberService,
      AuditService auditService,
      ApplicationEventPublisher eventPublisher) {
    this.leaseRepository = leaseRepository;
    this.invoiceRepository = invoiceRepository;
    this.invoiceLineRepository = invoiceLineRepository;
    this.periodGuard = periodGuard;
    this.lineBuilder = lineBuilder;
    this.vatNormalizationService = vatNormalizationService;
    this.totalsCalculator = totalsCalculator;
    this.lateFeeCalculator = lateFeeCalculator;
    this.invoiceNumberService = invoiceNumberService;
    this.auditService = auditService;
    this.eventPublisher = eventPublisher;
  }

  /**
   * Invoices the period ending at the lease's {@code nextInvoiceDate}.
   *
   * @param leaseId the lease to invoice
   * @param organizationId organization owning the lease
   * @param asOf run date; becomes the invoice issue date
   * @return CREATED with the new invoice, or SKIPPED if the lease is no longer due or the period is
   *     already invoiced
   * @throws ResourceNotFoundException if the lease does not exist in the organization
   * @throws org.springframework.dao.DataIntegrityViolationException if a concurrent run inserted
   *     the same period first
   */
  @Transactional(propagation = Propagation.REQUIRES_NEW)
  public LeaseInvoicingOutcome generateForLease(
      UUID leaseId, String organizationId, LocalDate asOf) {
    // Re-load in this transaction; the run's lease list was read outside it
    Lease lease =
        leaseRepository
            .findByIdAndOrganizationId(leaseId, organizationId)
            .orElseThrow(() -> new ResourceNotFoundException("Lease", leaseId));

    if (!lease.isDueForInvoicing(asOf)) {
      return LeaseInvoicingOutcome.skipped(leaseId, "Lease is not due for invoicing");
    }

    LocalDate periodEnd = lease.getNextInvoiceDate();
    LocalDate periodStart = lease.currentPeriodStart();

    if (periodGuard.invoiceExistsForPeriod(leaseId, periodStart, periodEnd, organizationId)) {
      log.warn(
          "Skipping lease {}: invoice already exists for period {} - {}; billing pointers may need"
              + " reconciliation",
          leaseId,
          periodStart,
          periodEnd);
      return LeaseInvoicingOutcome.skipped(
          leaseId, "Invoice already exists for period " + periodStart + " - " + periodEnd);
    }

    boolean includeDeposit =
        lease.getLastInvoicedAt() == null
            && InvoiceLineBuilder.isPresent(lease.getTerms().getDeposit());
    var rawItems = lineBuilder.buildInvoiceItems(lease, includeDeposit);
    var normalized = vatNormalizationService.normalizeVat(lease, rawItems);
    var totals = totalsCalculator.calculate(normalized.items(), null, normalized.vatRate());

    LocalDate dueDate = asOf.plusDays(lateFeeCalculator.getPaymentDueDays(lease));
    String invoiceNumber = invoiceNumberService.assignNumber(organizationId, asOf.getYear());

    var invoice =
        new Invoice(
            organizationId,
            lease.getId(),
            lease.getTenantId(),
            lease.getUnitId(),
            invoiceNumber,
            asOf,
            dueDate,
            periodStart,
            periodEnd);
    invoice.applyTotals(totals, normalized.vatRate());
    invoice.markSent();
    // Flush so a unique constraint violation surfaces here rather than at commit
    invoice = invoiceRepository.saveAndFlush(invoice);
    saveLines(invoice.getId(), normalized.items());

    lease.updateBillingPointers(lease.getBillingCycle().advance(periodEnd), periodEnd);
    leaseRepository.save(lease);

    var details = new LinkedHashMap<String, Object>();
    details.put("invoice_number", invoiceNumber);
    details.put("lease_id", leaseId.toString());
    details.put("period_start", periodStart.toString());
    details.put("period_end", periodEnd.toString());
    details.put("total", invoice.getTotal().toPlainString());
    details.put("deposit_included", includeDeposit);
    auditService.log(
        AuditEventBuilder.builder()
            .eventType("invoice.generated")
            .entityType("invoice")
            .entityId(invoice.getId())
            .organizationId(organizationId)
            .details(details)
            .build());

    eventPublisher.publishEvent(
        new InvoiceGeneratedEvent(
            "invoice.generated",
            invoice.getId(),
            organizationId,
            Instant.now(),
            leaseId,
            lease.getTenantId(),
            invoiceNumber,
            invoice.getTotal(),
            dueDate));

    log.info(
        "Generated invoice {} for lease {} (period {} - {}, total {}); next invoice date {}",
        invoiceNumber,
        leaseId,
        periodStart,
        periodEnd,
        invoice.getTotal(),
        lease.getNextInvoiceDate());
    return LeaseInvoicingOutcome.created(leaseId, invoice.getId(), invoiceNumber);
  }

  private void saveLines(UUID invoiceId, List<InvoiceItem> items) {
    var lines = new ArrayList<InvoiceLine>();
    for (int i = 0; i < items.size(); i++) {
      lines.add(new InvoiceLine(invoiceId, items.get(i), i));
    }
    invoiceLineRepository.saveAll(lines);
  }
}
