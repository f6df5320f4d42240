package io.bms.backend.invoice;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.List;
import org.springframework.stereotype.Component;

/**
 * Computes invoice subtotal, tax and total from line items. Used when an invoice is created and
 * again whenever the late-fee pass rewrites its penalty line, so the result depends only on the
 * items, the discount and the rate.
 */
@Component
public class InvoiceTotalsCalculator {

  private static final BigDecimal HUNDRED = new BigDecimal("100");

  /**
   * @param items invoice items; all amounts count towards the subtotal
   * @param discount amount deducted from the total, null for none
   * @param vatRate VAT percentage (e.g. 15 for 15%), null when the invoice carries no VAT
   * @return subtotal, tax (HALF_UP to whole currency units) and total
   */
  public InvoiceTotals calculate(List<InvoiceItem> items, BigDecimal discount, BigDecimal vatRate) {
    BigDecimal subtotal =
        items.stream().map(InvoiceItem::amount).reduce(BigDecimal.ZERO, BigDecimal::add);

    BigDecimal tax =
        vatRate != null
            ? subtotal.multiply(vatRate).divide(HUNDRED, 0, RoundingMode.HALF_UP)
            : BigDecimal.ZERO;

    BigDecimal effectiveDiscount = discount != null ? discount : BigDecimal.ZERO;
    BigDecimal total = subtotal.add(tax).subtract(effectiveDiscount);
    return new InvoiceTotals(subtotal, tax, total);
  }
}
