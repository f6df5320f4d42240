package io.bms.backend.tax;

import static org.assertj.core.api.Assertions.assertThat;

import io.bms.backend.billing.BillingProperties;
import io.bms.backend.invoice.InvoiceItem;
import io.bms.backend.invoice.InvoiceLineType;
import io.bms.backend.invoice.InvoiceTotalsCalculator;
import io.bms.backend.lease.BillingCycle;
import io.bms.backend.lease.Lease;
import io.bms.backend.lease.LeaseTerms;
import io.bms.backend.lease.TestLeaseFactory;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import java.util.UUID;
import org.junit.jupiter.api.Test;

class VatNormalizationServiceTest {

  private final VatNormalizationService service =
      new VatNormalizationService(new BillingProperties(new BigDecimal("15"), 7));

  private static Lease lease(BigDecimal vatRate, boolean vatIncluded) {
    return new Lease(
        "org_vat_test",
        UUID.randomUUID(),
        UUID.randomUUID(),
        LocalDate.of(2024, 1, 1),
        BillingCycle.MONTHLY,
        new LeaseTerms(new BigDecimal("5000"), null, null, vatRate, vatIncluded),
        LocalDate.of(2024, 2, 1));
  }

  private static List<InvoiceItem> rentAndDeposit() {
    return List.of(
        new InvoiceItem("Rent", new BigDecimal("5000"), InvoiceLineType.RENT),
        new InvoiceItem("Security Deposit", new BigDecimal("10000"), InvoiceLineType.DEPOSIT));
  }

  @Test
  void vatExclusiveLease_itemsUnchanged() {
    var result = service.normalizeVat(lease(new BigDecimal("15"), false), rentAndDeposit());

    assertThat(result.items()).isEqualTo(rentAndDeposit());
    assertThat(result.vatRate()).isEqualByComparingTo("15");
  }

  @Test
  void noRateAndNotInclusive_carriesNoVat() {
    var result = service.normalizeVat(lease(null, false), rentAndDeposit());

    assertThat(result.vatRate()).isNull();
    assertThat(result.items()).isEqualTo(rentAndDeposit());
  }

  @Test
  void vatInclusiveLease_backsOutTaxFromRentOnly() {
    var result = service.normalizeVat(lease(new BigDecimal("15"), true), rentAndDeposit());

    // 5000 / 1.15 = 4347.83
    assertThat(result.items().get(0).amount()).isEqualByComparingTo("4348");
    assertThat(result.items().get(1).amount()).isEqualByComparingTo("10000");
  }

  @Test
  void vatInclusiveWithoutRate_usesDefaultRate() {
    var result = service.normalizeVat(lease(null, true), rentAndDeposit());

    assertThat(result.vatRate()).isEqualByComparingTo("15");
    assertThat(result.items().get(0).amount()).isEqualByComparingTo("4348");
  }

  @Test
  void leaseLevelRate_usedWhenTermsHaveNone() {
    var lease = lease(null, false);
    TestLeaseFactory.withVatRate(lease, new BigDecimal("16"));

    assertThat(service.resolveVatRate(lease)).isEqualByComparingTo("16");
    assertThat(service.resolveExplicitVatRate(lease)).isEqualByComparingTo("16");
  }

  @Test
  void inclusiveRent_reconstitutesQuotedAmountAfterTax() {
    var normalized =
        service.normalizeVat(
            lease(new BigDecimal("15"), true),
            List.of(new InvoiceItem("Rent", new BigDecimal("5000"), InvoiceLineType.RENT)));

    var totals =
        new InvoiceTotalsCalculator().calculate(normalized.items(), null, normalized.vatRate());

    assertThat(totals.subtotal()).isEqualByComparingTo("4348");
    assertThat(totals.tax()).isEqualByComparingTo("652");
    assertThat(totals.total()).isEqualByComparingTo("5000");
  }
}
