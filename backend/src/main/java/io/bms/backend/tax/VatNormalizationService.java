package io.bms.backend.tax;

import io.bms.backend.billing.BillingProperties;
import io.bms.backend.invoice.InvoiceItem;
import io.bms.backend.lease.Lease;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.List;
import org.springframework.stereotype.Service;

/** Stateless service that converts a lease's quoted amounts into tax-exclusive invoice items. */
@Service
public class VatNormalizationService {

  private static final BigDecimal HUNDRED = new BigDecimal("100");

  private final BillingProperties billingProperties;

  public VatNormalizationService(BillingProperties billingProperties) {
    this.billingProperties = billingProperties;
  }

  /**
   * Resolves the VAT rate and, for VAT-inclusive leases, backs the tax out of every rent and charge
   * line: {@code amount / (1 + rate/100)}, rounded HALF_UP to a whole currency unit per line.
   * Deposit and penalty lines are never adjusted.
   *
   * @param lease the lease being invoiced
   * @param items items from {@link io.bms.backend.billing.InvoiceLineBuilder}
   * @return the tax-exclusive items and the rate to apply to them
   */
  public VatNormalization normalizeVat(Lease lease, List<InvoiceItem> items) {
    BigDecimal vatRate = resolveVatRate(lease);
    if (!lease.getTerms().isVatIncluded()) {
      return new VatNormalization(items, vatRate);
    }

    BigDecimal divisor = BigDecimal.ONE.add(vatRate.divide(HUNDRED, 10, RoundingMode.HALF_UP));
    List<InvoiceItem> netItems =
        items.stream()
            .map(
                item ->
                    item.type().isVatAdjustable()
                        ? item.withAmount(item.amount().divide(divisor, 0, RoundingMode.HALF_UP))
                        : item)
            .toList();
    return new VatNormalization(netItems, vatRate);
  }

  /**
   * Resolves the VAT rate of a lease: the rate in its terms, then the lease-level rate. A lease that
   * declares VAT-inclusive rent without a rate falls back to the configured default rate. A lease
   * with neither a rate nor VAT-inclusive rent carries no VAT and yields null.
   */
  public BigDecimal resolveVatRate(Lease lease) {
    BigDecimal explicitRate = resolveExplicitVatRate(lease);
    if (explicitRate != null) {
      return explicitRate;
    }
    return lease.getTerms().isVatIncluded() ? billingProperties.defaultVatRate() : null;
  }

  /** The rate stated on the lease itself, ignoring the configured default. */
  public BigDecimal resolveExplicitVatRate(Lease lease) {
    if (lease.getTerms().getVatRate() != null) {
      return lease.getTerms().getVatRate();
    }
    return lease.getVatRate();
  }
}
