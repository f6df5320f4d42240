package io.bms.backend.lease;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.bms.backend.exception.InvalidStateException;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.UUID;
import org.junit.jupiter.api.Test;

class LeaseTest {

  private static final LocalDate START = LocalDate.of(2024, 1, 1);

  private Lease monthlyLease() {
    return new Lease(
        "org_lease_test",
        UUID.randomUUID(),
        UUID.randomUUID(),
        START,
        BillingCycle.MONTHLY,
        new LeaseTerms(new BigDecimal("5000"), null, null, null, false),
        LocalDate.of(2024, 2, 1));
  }

  @Test
  void newLease_isActiveWithPeriodStartingAtStartDate() {
    var lease = monthlyLease();

    assertThat(lease.getStatus()).isEqualTo(LeaseStatus.ACTIVE);
    assertThat(lease.currentPeriodStart()).isEqualTo(START);
    assertThat(lease.getLastInvoicedAt()).isNull();
  }

  @Test
  void isDueForInvoicing_onAndAfterNextInvoiceDate() {
    var lease = monthlyLease();

    assertThat(lease.isDueForInvoicing(LocalDate.of(2024, 1, 31))).isFalse();
    assertThat(lease.isDueForInvoicing(LocalDate.of(2024, 2, 1))).isTrue();
    assertThat(lease.isDueForInvoicing(LocalDate.of(2024, 3, 10))).isTrue();
  }

  @Test
  void isDueForInvoicing_falseWhenNotActive() {
    var lease = monthlyLease();
    lease.setStatus(LeaseStatus.TERMINATED);

    assertThat(lease.isDueForInvoicing(LocalDate.of(2024, 2, 1))).isFalse();
  }

  @Test
  void updateBillingPointers_movesPeriodStart() {
    var lease = monthlyLease();

    lease.updateBillingPointers(LocalDate.of(2024, 3, 1), LocalDate.of(2024, 2, 1));

    assertThat(lease.getNextInvoiceDate()).isEqualTo(LocalDate.of(2024, 3, 1));
    assertThat(lease.currentPeriodStart()).isEqualTo(LocalDate.of(2024, 2, 1));
  }

  @Test
  void updateBillingPointers_rejectsNextNotAfterLast() {
    var lease = monthlyLease();

    assertThatThrownBy(
            () -> lease.updateBillingPointers(LocalDate.of(2024, 2, 1), LocalDate.of(2024, 2, 1)))
        .isInstanceOf(InvalidStateException.class);
    assertThat(lease.getNextInvoiceDate()).isEqualTo(LocalDate.of(2024, 2, 1));
  }

  @Test
  void effectiveRent_prefersOverride() {
    var lease = monthlyLease();
    assertThat(lease.effectiveRent()).isEqualByComparingTo("5000");

    lease.setRentAmount(new BigDecimal("5500"));

    assertThat(lease.effectiveRent()).isEqualByComparingTo("5500");
  }
}
