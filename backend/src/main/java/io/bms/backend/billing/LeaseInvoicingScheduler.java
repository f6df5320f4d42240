package io.bms.backend.billing;

import io.bms.backend.lease.LeaseRepository;
import java.time.LocalDate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Scheduled job that runs the daily invoicing cycle for every organization owning leases. Runs at
 * 01:30 by default ({@code bms.billing.invoicing.cron}). Each organization is processed
 * independently and a failure in one does not stop the others.
 */
@Component
@ConditionalOnProperty(
    prefix = "bms.billing.invoicing",
    name = "scheduler-enabled",
    havingValue = "true",
    matchIfMissing = true)
public class LeaseInvoicingScheduler {

  private static final Logger log = LoggerFactory.getLogger(LeaseInvoicingScheduler.class);

  private final LeaseRepository leaseRepository;
  private final LeaseInvoicingService leaseInvoicingService;

  public LeaseInvoicingScheduler(
      LeaseRepository leaseRepository, LeaseInvoicingService leaseInvoicingService) {
    this.leaseRepository = leaseRepository;
    this.leaseInvoicingService = leaseInvoicingService;
  }

  @Scheduled(cron = "${bms.billing.invoicing.cron:0 30 1 * * *}")
  public void runDailyInvoicing() {
    log.info("Lease invoicing job started");
    LocalDate today = LocalDate.now();
    var organizationIds = leaseRepository.findDistinctOrganizationIds();
    long totalCreated = 0;
    long totalSkipped = 0;
    long totalFailed = 0;
    long totalLateFees = 0;

    for (String organizationId : organizationIds) {
      try {
        var result = leaseInvoicingService.runLeaseInvoicingForOrg(organizationId, today);
        totalCreated += result.createdCount();
        totalSkipped += result.skippedCount();
        totalFailed += result.failedCount();
        totalLateFees += result.lateFeesAppliedCount();
      } catch (Exception e) {
        log.error("Lease invoicing: failed to process organization {}", organizationId, e);
      }
    }

    log.info(
        "Lease invoicing job completed: {} organizations processed, {} invoices created, {} skipped,"
            + " {} failures, {} late fees applied",
        organizationIds.size(),
        totalCreated,
        totalSkipped,
        totalFailed,
        totalLateFees);
  }
}
