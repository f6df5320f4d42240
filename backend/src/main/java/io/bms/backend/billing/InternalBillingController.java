package io.bms.backend.billing;

import io.bms.backend.billing.dto.BillingPointersResponse;
import io.bms.backend.billing.dto.InvoicingRunResult;
import java.time.LocalDate;
import java.util.UUID;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/** Operator endpoints for triggering invoicing runs and repairing lease billing pointers. */
@RestController
@RequestMapping("/internal/billing")
public class InternalBillingController {

  private final LeaseInvoicingService leaseInvoicingService;
  private final BillingPointerReconciler billingPointerReconciler;

  public InternalBillingController(
      LeaseInvoicingService leaseInvoicingService,
      BillingPointerReconciler billingPointerReconciler) {
    this.leaseInvoicingService = leaseInvoicingService;
    this.billingPointerReconciler = billingPointerReconciler;
  }

  @PostMapping("/invoicing-runs")
  public ResponseEntity<InvoicingRunResult> runInvoicing(
      @RequestParam String orgId,
      @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE)
          LocalDate asOf) {
    var result =
        asOf != null
            ? leaseInvoicingService.runLeaseInvoicingForOrg(orgId, asOf)
            : leaseInvoicingService.runLeaseInvoicingForOrg(orgId);
    return ResponseEntity.ok(result);
  }

  @PostMapping("/leases/{leaseId}/billing-pointers/reconcile")
  public ResponseEntity<BillingPointersResponse> reconcileBillingPointers(
      @PathVariable UUID leaseId, @RequestParam String orgId) {
    var lease = billingPointerReconciler.reconcile(leaseId, orgId);
    return ResponseEntity.ok(BillingPointersResponse.from(lease));
  }
}
