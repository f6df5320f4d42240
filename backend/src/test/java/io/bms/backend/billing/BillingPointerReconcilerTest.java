package io.bms.backend.billing;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import io.bms.backend.audit.AuditEventRecord;
import io.bms.backend.audit.AuditService;
import io.bms.backend.invoice.Invoice;
import io.bms.backend.invoice.InvoiceRepository;
import io.bms.backend.lease.BillingCycle;
import io.bms.backend.lease.Lease;
import io.bms.backend.lease.LeaseRepository;
import io.bms.backend.lease.LeaseTerms;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Captor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.test.util.ReflectionTestUtils;

@ExtendWith(MockitoExtension.class)
class BillingPointerReconcilerTest {

  private static final String ORG_ID = "org_reconcile_test";

  @Mock private LeaseRepository leaseRepository;
  @Mock private InvoiceRepository invoiceRepository;
  @Mock private AuditService auditService;

  @Captor private ArgumentCaptor<AuditEventRecord> auditCaptor;

  private BillingPointerReconciler reconciler;
  private Lease lease;

  @BeforeEach
  void setUp() {
    reconciler = new BillingPointerReconciler(leaseRepository, invoiceRepository, auditService);
    lease =
        new Lease(
            ORG_ID,
            UUID.randomUUID(),
            UUID.randomUUID(),
            LocalDate.of(2024, 1, 1),
            BillingCycle.MONTHLY,
            new LeaseTerms(new BigDecimal("5000"), null, null, null, false),
            LocalDate.of(2024, 2, 1));
    ReflectionTestUtils.setField(lease, "id", UUID.randomUUID());
    when(leaseRepository.findByIdAndOrganizationId(lease.getId(), ORG_ID))
        .thenReturn(Optional.of(lease));
    when(leaseRepository.save(any(Lease.class))).thenAnswer(invocation -> invocation.getArgument(0));
  }

  private Invoice invoiceFor(LocalDate periodStart, LocalDate periodEnd) {
    return new Invoice(
        ORG_ID,
        lease.getId(),
        lease.getTenantId(),
        lease.getUnitId(),
        "INV-" + periodEnd,
        periodEnd,
        periodEnd.plusDays(7),
        periodStart,
        periodEnd);
  }

  @Test
  void pointersLaggingBehindInvoices_movedPastLatestPeriod() {
    // Invoice for Feb-Mar exists but the pointer update was lost
    when(invoiceRepository.findByLeaseIdAndOrganizationId(lease.getId(), ORG_ID))
        .thenReturn(
            List.of(
                invoiceFor(LocalDate.of(2024, 2, 1), LocalDate.of(2024, 3, 1)),
                invoiceFor(LocalDate.of(2024, 1, 1), LocalDate.of(2024, 2, 1))));

    var reconciled = reconciler.reconcile(lease.getId(), ORG_ID);

    assertThat(reconciled.getLastInvoicedAt()).isEqualTo(LocalDate.of(2024, 3, 1));
    assertThat(reconciled.getNextInvoiceDate()).isEqualTo(LocalDate.of(2024, 4, 1));
    assertThat(reconciled.currentPeriodStart()).isEqualTo(LocalDate.of(2024, 3, 1));
  }

  @Test
  void noInvoices_pointersResetToFirstPeriod() {
    lease.updateBillingPointers(LocalDate.of(2024, 5, 1), LocalDate.of(2024, 4, 1));
    when(invoiceRepository.findByLeaseIdAndOrganizationId(lease.getId(), ORG_ID))
        .thenReturn(List.of());

    var reconciled = reconciler.reconcile(lease.getId(), ORG_ID);

    assertThat(reconciled.getLastInvoicedAt()).isNull();
    assertThat(reconciled.getNextInvoiceDate()).isEqualTo(LocalDate.of(2024, 2, 1));
  }

  @Test
  void reconcile_isAudited() {
    when(invoiceRepository.findByLeaseIdAndOrganizationId(lease.getId(), ORG_ID))
        .thenReturn(List.of());

    reconciler.reconcile(lease.getId(), ORG_ID);

    verify(auditService).log(auditCaptor.capture());
    assertThat(auditCaptor.getValue().eventType()).isEqualTo("lease.billing_pointers_reconciled");
    assertThat(auditCaptor.getValue().entityId()).isEqualTo(lease.getId());
  }
}
