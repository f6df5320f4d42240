package io.bms.backend.billing;

import io.bms.backend.billing.dto.InvoicingRunResult;
import io.bms.backend.billing.dto.LateFeeOutcome;
import io.bms.backend.billing.dto.LeaseInvoicingOutcome;
import io.bms.backend.invoice.InvoiceRepository;
import io.bms.backend.invoice.InvoiceStatus;
import io.bms.backend.lease.LeaseRepository;
import io.bms.backend.lease.LeaseStatus;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import org.hibernate.exception.ConstraintViolationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;

/**
 * Runs the daily billing cycle for one organization: first updates late fees on past-due invoices,
 * then generates invoices for every active lease whose billing period has ended.
 *
 * <p>The loops live here rather than in the per-item services so that each {@code applyLateFee}
 * and {@code generateForLease} call goes through the Spring proxy and gets its own {@code
 * REQUIRES_NEW} transaction. A failing invoice or lease is recorded in the result and the run
 * moves on.
 */
@Service
public class LeaseInvoicingService {

  private static final Logger log = LoggerFactory.getLogger(LeaseInvoicingService.class);

  static final String MDC_ORGANIZATION_ID = "organizationId";

  private static final String PERIOD_CONSTRAINT = "uq_invoices_lease_period";

  private static final List<InvoiceStatus> OVERDUE_CANDIDATE_STATUSES =
      Arrays.stream(InvoiceStatus.values()).filter(InvoiceStatus::isOutstanding).toList();

  private final LeaseRepository leaseRepository;
  private final InvoiceRepository invoiceRepository;
  private final LateFeeApplicationService lateFeeApplicationService;
  private final LeaseInvoiceGenerationService invoiceGenerationService;

  public LeaseInvoicingService(
      LeaseRepository leaseRepository,
      InvoiceRepository invoiceRepository,
      LateFeeApplicationService lateFeeApplicationService,
      LeaseInvoiceGenerationService invoiceGenerationService) {
    this.leaseRepository = leaseRepository;
    this.invoiceRepository = invoiceRepository;
    this.lateFeeApplicationService = lateFeeApplicationService;
    this.invoiceGenerationService = invoiceGenerationService;
  }

  public InvoicingRunResult runLeaseInvoicingForOrg(String organizationId) {
    return runLeaseInvoicingForOrg(organizationId, LocalDate.now());
  }

  /**
   * Runs both billing passes for an organization as of the given date. Safe to re-run: a second
   * run on the same date recomputes identical late fees and creates no further invoices.
   *
   * @param organizationId the organization to bill
   * @param asOf billing date
   * @return per-invoice and per-lease outcomes
   */
  public InvoicingRunResult runLeaseInvoicingForOrg(String organizationId, LocalDate asOf) {
    MDC.put(MDC_ORGANIZATION_ID, organizationId);
    try {
      log.info("Invoicing run started for {} as of {}", organizationId, asOf);
      var lateFees = applyLateFees(organizationId, asOf);
      var invoices = generateInvoices(organizationId, asOf);
      var result = new InvoicingRunResult(organizationId, asOf, lateFees, invoices);
      log.info(
          "Invoicing run completed for {}: {} late fees updated, {} invoices created, {} skipped,"
              + " {} failed",
          organizationId,
          result.lateFeesAppliedCount(),
          result.createdCount(),
          result.skippedCount(),
          result.failedCount());
      return result;
    } finally {
      MDC.remove(MDC_ORGANIZATION_ID);
    }
  }

  private List<LateFeeOutcome> applyLateFees(String organizationId, LocalDate asOf) {
    var candidates =
        invoiceRepository.findOverdueCandidates(organizationId, OVERDUE_CANDIDATE_STATUSES, asOf);
    var outcomes = new ArrayList<LateFeeOutcome>(candidates.size());
    for (var invoice : candidates) {
      try {
        outcomes.add(lateFeeApplicationService.applyLateFee(invoice.getId(), organizationId, asOf));
      } catch (Exception e) {
        log.error(
            "Failed to apply late fee to invoice {}: {}",
            invoice.getInvoiceNumber(),
            e.getMessage(),
            e);
        outcomes.add(LateFeeOutcome.failed(invoice.getId(), e.getMessage()));
      }
    }
    return outcomes;
  }

  private List<LeaseInvoicingOutcome> generateInvoices(String organizationId, LocalDate asOf) {
    var dueLeases = leaseRepository.findDueForInvoicing(organizationId, LeaseStatus.ACTIVE, asOf);
    var outcomes = new ArrayList<LeaseInvoicingOutcome>(dueLeases.size());
    for (var lease : dueLeases) {
      try {
        outcomes.add(
            invoiceGenerationService.generateForLease(lease.getId(), organizationId, asOf));
      } catch (DataIntegrityViolationException e) {
        if (violatesPeriodConstraint(e)) {
          // Another run inserted this period between our check and our insert
          log.warn("Invoice for lease {} was created concurrently; skipping", lease.getId());
          outcomes.add(
              LeaseInvoicingOutcome.skipped(lease.getId(), "Invoice already exists for period"));
        } else {
          log.error(
              "Failed to invoice lease {}: {}",
              lease.getId(),
              e.getMostSpecificCause().getMessage(),
              e);
          outcomes.add(
              LeaseInvoicingOutcome.failed(lease.getId(), e.getMostSpecificCause().getMessage()));
        }
      } catch (Exception e) {
        log.error("Failed to invoice lease {}: {}", lease.getId(), e.getMessage(), e);
        outcomes.add(LeaseInvoicingOutcome.failed(lease.getId(), e.getMessage()));
      }
    }
    return outcomes;
  }

  /** Only a clash on the lease period is a duplicate; any other constraint is a real failure. */
  static boolean violatesPeriodConstraint(DataIntegrityViolationException e) {
    for (Throwable cause = e; cause != null; cause = cause.getCause()) {
      if (cause instanceof ConstraintViolationException violation
          && violation.getConstraintName() != null) {
        return PERIOD_CONSTRAINT.equalsIgnoreCase(violation.getConstraintName());
      }
    }
    String message = e.getMostSpecificCause().getMessage();
    return message != null && message.contains(PERIOD_CONSTRAINT);
  }
}
