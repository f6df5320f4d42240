package io.bms.backend.billing;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import io.bms.backend.audit.AuditService;
import io.bms.backend.billing.dto.LateFeeOutcome;
import io.bms.backend.event.InvoiceOverdueEvent;
import io.bms.backend.invoice.Invoice;
import io.bms.backend.invoice.InvoiceItem;
import io.bms.backend.invoice.InvoiceLine;
import io.bms.backend.invoice.InvoiceLineRepository;
import io.bms.backend.invoice.InvoiceLineType;
import io.bms.backend.invoice.InvoiceRepository;
import io.bms.backend.invoice.InvoiceStatus;
import io.bms.backend.invoice.InvoiceTotals;
import io.bms.backend.invoice.InvoiceTotalsCalculator;
import io.bms.backend.lease.BillingCycle;
import io.bms.backend.lease.Lease;
import io.bms.backend.lease.LeaseRepository;
import io.bms.backend.lease.LeaseTerms;
import io.bms.backend.lease.PenaltyConfig;
import io.bms.backend.lease.TestLeaseFactory;
import io.bms.backend.tax.VatNormalizationService;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.ArrayList;
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
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.test.util.ReflectionTestUtils;

@ExtendWith(MockitoExtension.class)
class LateFeeApplicationServiceTest {

  private static final String ORG_ID = "org_late_fee_apply";
  private static final LocalDate DUE = LocalDate.of(2024, 2, 8);

  @Mock private InvoiceRepository invoiceRepository;
  @Mock private InvoiceLineRepository invoiceLineRepository;
  @Mock private LeaseRepository leaseRepository;
  @Mock private AuditService auditService;
  @Mock private ApplicationEventPublisher eventPublisher;

  @Captor private ArgumentCaptor<InvoiceLine> lineCaptor;

  private LateFeeApplicationService service;
  private Lease lease;
  private Invoice invoice;
  private List<InvoiceLine> lines;

  @BeforeEach
  void setUp() {
    var properties = new BillingProperties(new BigDecimal("15"), 7);
    service =
        new LateFeeApplicationService(
            invoiceRepository,
            invoiceLineRepository,
            leaseRepository,
            new LateFeeCalculator(properties),
            new VatNormalizationService(properties),
            new InvoiceTotalsCalculator(),
            auditService,
            eventPublisher);

    lease =
        new Lease(
            ORG_ID,
            UUID.randomUUID(),
            UUID.randomUUID(),
            LocalDate.of(2024, 1, 1),
            BillingCycle.MONTHLY,
            new LeaseTerms(new BigDecimal("5000"), null, null, null, false),
            LocalDate.of(2024, 3, 1));
    ReflectionTestUtils.setField(lease, "id", UUID.randomUUID());
    TestLeaseFactory.withPenaltyConfig(
        lease, new PenaltyConfig(new BigDecimal("0.001"), 3, null, null, null));

    invoice =
        new Invoice(
            ORG_ID,
            lease.getId(),
            lease.getTenantId(),
            lease.getUnitId(),
            "INV-2024-001",
            LocalDate.of(2024, 2, 1),
            DUE,
            LocalDate.of(2024, 1, 1),
            LocalDate.of(2024, 2, 1));
    ReflectionTestUtils.setField(invoice, "id", UUID.randomUUID());
    invoice.applyTotals(
        new InvoiceTotals(new BigDecimal("5000"), BigDecimal.ZERO, new BigDecimal("5000")), null);
    invoice.markSent();

    lines = new ArrayList<>();
    lines.add(
        new InvoiceLine(
            invoice.getId(),
            new InvoiceItem("Rent", new BigDecimal("5000"), InvoiceLineType.RENT),
            0));

    when(invoiceRepository.findById(invoice.getId())).thenReturn(Optional.of(invoice));
    when(leaseRepository.findByIdAndOrganizationId(lease.getId(), ORG_ID))
        .thenReturn(Optional.of(lease));
    when(invoiceLineRepository.findByInvoiceIdOrderBySortOrder(invoice.getId())).thenReturn(lines);
  }

  private static InvoiceItem penaltyItem(BigDecimal amount) {
    return new InvoiceItem("Late fee (0.001 per day)", amount, InvoiceLineType.PENALTY);
  }

  @Test
  void pastGrace_addsPenaltyLineAndMarksOverdue() {
    var outcome = service.applyLateFee(invoice.getId(), ORG_ID, LocalDate.of(2024, 2, 15));

    assertThat(outcome.outcome()).isEqualTo(LateFeeOutcome.Outcome.APPLIED);
    assertThat(outcome.lateFee()).isEqualByComparingTo("20");
    assertThat(invoice.getStatus()).isEqualTo(InvoiceStatus.OVERDUE);
    assertThat(invoice.getTotal()).isEqualByComparingTo("5020");

    verify(invoiceLineRepository).save(lineCaptor.capture());
    assertThat(lineCaptor.getValue().getLineType()).isEqualTo(InvoiceLineType.PENALTY);
    assertThat(lineCaptor.getValue().getAmount()).isEqualByComparingTo("20");
    assertThat(lineCaptor.getValue().getSortOrder()).isEqualTo(1);
    verify(eventPublisher).publishEvent(any(InvoiceOverdueEvent.class));
  }

  @Test
  void rerun_replacesExistingPenaltyInsteadOfAccumulating() {
    var previousPenalty =
        new InvoiceLine(invoice.getId(), penaltyItem(new BigDecimal("20")), 1);
    lines.add(previousPenalty);
    invoice.applyTotals(
        new InvoiceTotals(new BigDecimal("5020"), BigDecimal.ZERO, new BigDecimal("5020")), null);
    invoice.markOverdue();

    var outcome = service.applyLateFee(invoice.getId(), ORG_ID, LocalDate.of(2024, 2, 15));

    assertThat(outcome.lateFee()).isEqualByComparingTo("20");
    assertThat(invoice.getTotal()).isEqualByComparingTo("5020");
    verify(invoiceLineRepository).deleteAll(List.of(previousPenalty));
    verify(eventPublisher, never()).publishEvent(any(InvoiceOverdueEvent.class));
  }

  @Test
  void laterRun_growsFeeFromPenaltyFreeBase() {
    var previousPenalty =
        new InvoiceLine(invoice.getId(), penaltyItem(new BigDecimal("20")), 1);
    lines.add(previousPenalty);
    invoice.markOverdue();

    // 10 days past grace on 5000, not on 5020
    var outcome = service.applyLateFee(invoice.getId(), ORG_ID, LocalDate.of(2024, 2, 21));

    assertThat(outcome.lateFee()).isEqualByComparingTo("50");
    assertThat(invoice.getTotal()).isEqualByComparingTo("5050");
  }

  @Test
  void withinGrace_marksOverdueWithoutPenalty() {
    var outcome = service.applyLateFee(invoice.getId(), ORG_ID, LocalDate.of(2024, 2, 10));

    assertThat(outcome.lateFee()).isEqualByComparingTo("0");
    assertThat(invoice.getStatus()).isEqualTo(InvoiceStatus.OVERDUE);
    assertThat(invoice.getTotal()).isEqualByComparingTo("5000");
    verify(invoiceLineRepository, never()).save(any());
  }

  @Test
  void vatRateOfInvoice_keptWhenRecalculating() {
    invoice.applyTotals(
        new InvoiceTotals(new BigDecimal("5000"), new BigDecimal("750"), new BigDecimal("5750")),
        new BigDecimal("15"));

    service.applyLateFee(invoice.getId(), ORG_ID, LocalDate.of(2024, 2, 15));

    // base 5750 * 0.001 * 4 = 23; (5000 + 23) * 15% = 753.45
    assertThat(invoice.getTaxAmount()).isEqualByComparingTo("753");
    assertThat(invoice.getTotal()).isEqualByComparingTo("5776");
  }
}
