package io.bms.backend.billing;

import io.bms.backend.audit.AuditEventBuilder;
import io.bms.backend.audit.AuditService;
import io.bms.backend.billing.dto.LateFeeOutcome;
import io.bms.backend.event.InvoiceOverdueEvent;
import io.bms.backend.exception.ResourceNotFoundException;
import io.bms.backend.invoice.Invoice;
import io.bms.backend.invoice.InvoiceItem;
import io.bms.backend.invoice.InvoiceLine;
import io.bms.backend.invoice.InvoiceLineRepository;
import io.bms.backend.invoice.InvoiceLineType;
import io.bms.backend.invoice.InvoiceRepository;
import io.bms.backend.invoice.InvoiceStatus;
import io.bms.backend.invoice.InvoiceTotalsCalculator;
import io.bms.backend.lease.Lease;
import io.bms.backend.lease.LeaseRepository;
import io.bms.backend.tax.VatNormalizationService;
import java.math.BigDecimal;
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
 * Brings the late fee of a single past-due invoice up to date and flags it OVERDUE.
 *
 * <p>The fee is recomputed from scratch on every run and replaces any penalty line left by an
 * earlier run, so repeated runs on the same date leave the invoice unchanged.
 */
@Service
public class LateFeeApplicationService {

  private static final Logger log = LoggerFactory.getLogger(LateFeeApplicationService.class);

  private final InvoiceRepository invoiceRepository;
  private final InvoiceLineRepository invoiceLineRepository;
  private final LeaseRepository leaseRepository;
  private final LateFeeCalculator lateFeeCalculator;
  private final VatNormalizationService vatNormalizationService;
  private final InvoiceTotalsCalculator totalsCalculator;
  private final AuditService auditService;
  private final ApplicationEventPublisher eventPublisher;

  public LateFeeApplicationService(
      InvoiceRepository invoiceRepository,
      InvoiceLineRepository invoiceLineRepository,
      LeaseRepository leaseRepository,
      LateFeeCalculator lateFeeCalculator,
      VatNormalizationService vatNormalizationService,
      InvoiceTotalsCalculator totalsCalculator,
      AuditService auditService,
      ApplicationEventPublisher eventPublisher) {
    this.invoiceRepository = invoiceRepository;
    this.invoiceLineRepository = invoiceLineRepository;
    this.leaseRepository = leaseRepository;
    this.lateFeeCalculator = lateFeeCalculator;
    this.vatNormalizationService = vatNormalizationService;
    this.totalsCalculator = totalsCalculator;
    this.auditService = auditService;
    this.eventPublisher = eventPublisher;
  }

  @Transactional(propagation = Propagation.REQUIRES_NEW)
  public LateFeeOutcome applyLateFee(UUID invoiceId, String organizationId, LocalDate asOf) {
    Invoice invoice =
        invoiceRepository
            .findById(invoiceId)
            .filter(i -> i.getOrganizationId().equals(organizationId))
            .orElseThrow(() -> new ResourceNotFoundException("Invoice", invoiceId));
    Lease lease =
        leaseRepository
            .findByIdAndOrganizationId(invoice.getLeaseId(), organizationId)
            .orElseThrow(() -> new ResourceNotFoundException("Lease", invoice.getLeaseId()));

    BigDecimal vatRate =
        invoice.getVatRate() != null
            ? invoice.getVatRate()
            : vatNormalizationService.resolveExplicitVatRate(lease);

    List<InvoiceLine> lines = invoiceLineRepository.findByInvoiceIdOrderBySortOrder(invoiceId);
    List<InvoiceLine> penaltyLines =
        lines.stream().filter(l -> l.getLineType() == InvoiceLineType.PENALTY).toList();
    List<InvoiceItem> baseItems =
        lines.stream()
            .filter(l -> l.getLineType() != InvoiceLineType.PENALTY)
            .map(InvoiceItem::from)
            .toList();

    // Fee accrues on the amount payable without earlier penalties
    BigDecimal amountBase =
        totalsCalculator.calculate(baseItems, invoice.getDiscount(), vatRate).total();
    BigDecimal lateFee =
        lateFeeCalculator.computeLateFee(lease, amountBase, invoice.getDueDate(), asOf);

    if (!penaltyLines.isEmpty()) {
      invoiceLineRepository.deleteAll(penaltyLines);
    }

    var items = new ArrayList<>(baseItems);
    if (lateFee.signum() > 0) {
      int sortOrder =
          lines.stream()
                  .filter(l -> l.getLineType() != InvoiceLineType.PENALTY)
                  .mapToInt(InvoiceLine::getSortOrder)
                  .max()
                  .orElse(-1)
              + 1;
      var penalty =
          new InvoiceItem(
              "Late fee (" + lease.getPenaltyConfig().getLateFeeRatePerDay().toPlainString()
                  + " per day)",
              lateFee,
              InvoiceLineType.PENALTY);
      invoiceLineRepository.save(new InvoiceLine(invoiceId, penalty, sortOrder));
      items.add(penalty);
    }

    InvoiceStatus previousStatus = invoice.getStatus();
    invoice.applyTotals(totalsCalculator.calculate(items, invoice.getDiscount(), vatRate), vatRate);
    invoice.markOverdue();
    invoiceRepository.save(invoice);

    var details = new LinkedHashMap<String, Object>();
    details.put("invoice_number", invoice.getInvoiceNumber());
    details.put("late_fee", lateFee.toPlainString());
    details.put("total", invoice.getTotal().toPlainString());
    details.put("as_of", asOf.toString());
    auditService.log(
        AuditEventBuilder.builder()
            .eventType("invoice.late_fee_applied")
            .entityType("invoice")
            .entityId(invoiceId)
            .organizationId(organizationId)
            .details(details)
            .build());

    if (previousStatus == InvoiceStatus.SENT) {
      eventPublisher.publishEvent(
          new InvoiceOverdueEvent(
              "invoice.overdue",
              invoiceId,
              organizationId,
              Instant.now(),
              lease.getId(),
              invoice.getTenantId(),
              invoice.getInvoiceNumber(),
              lateFee,
              invoice.getTotal()));
    }

    log.debug(
        "Invoice {} is overdue as of {}: late fee {}, total {}",
        invoice.getInvoiceNumber(),
        asOf,
        lateFee,
        invoice.getTotal());
    return LateFeeOutcome.applied(invoiceId, lateFee, invoice.getTotal());
  }
}
