package io.bms.backend.billing;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.when;

import io.bms.backend.invoice.Invoice;
import io.bms.backend.invoice.InvoiceRepository;
import java.time.LocalDate;
import java.util.List;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class InvoicePeriodGuardTest {

  private static final String ORG_ID = "org_guard_test";
  private static final UUID LEASE_ID = UUID.randomUUID();

  @Mock private InvoiceRepository invoiceRepository;

  private InvoicePeriodGuard guard;

  @BeforeEach
  void setUp() {
    guard = new InvoicePeriodGuard(invoiceRepository);
  }

  private static Invoice invoiceFor(LocalDate periodStart, LocalDate periodEnd) {
    return new Invoice(
        ORG_ID,
        LEASE_ID,
        UUID.randomUUID(),
        UUID.randomUUID(),
        "INV-2024-001",
        periodEnd,
        periodEnd.plusDays(7),
        periodStart,
        periodEnd);
  }

  @Test
  void exactPeriodMatch_exists() {
    when(invoiceRepository.findByLeaseIdAndOrganizationId(LEASE_ID, ORG_ID))
        .thenReturn(List.of(invoiceFor(LocalDate.of(2024, 1, 1), LocalDate.of(2024, 2, 1))));

    assertThat(
            guard.invoiceExistsForPeriod(
                LEASE_ID, LocalDate.of(2024, 1, 1), LocalDate.of(2024, 2, 1), ORG_ID))
        .isTrue();
  }

  @Test
  void overlappingButDifferentPeriod_doesNotCount() {
    when(invoiceRepository.findByLeaseIdAndOrganizationId(LEASE_ID, ORG_ID))
        .thenReturn(List.of(invoiceFor(LocalDate.of(2024, 1, 1), LocalDate.of(2024, 2, 1))));

    assertThat(
            guard.invoiceExistsForPeriod(
                LEASE_ID, LocalDate.of(2024, 1, 15), LocalDate.of(2024, 2, 1), ORG_ID))
        .isFalse();
  }

  @Test
  void noInvoices_doesNotExist() {
    when(invoiceRepository.findByLeaseIdAndOrganizationId(LEASE_ID, ORG_ID)).thenReturn(List.of());

    assertThat(
            guard.invoiceExistsForPeriod(
                LEASE_ID, LocalDate.of(2024, 1, 1), LocalDate.of(2024, 2, 1), ORG_ID))
        .isFalse();
  }
}
