package io.bms.backend.tax;

import io.bms.backend.invoice.InvoiceItem;
import java.math.BigDecimal;
import java.util.List;

/**
 * Tax-exclusive invoice items and the VAT rate to charge on them.
 *
 * @param items items with VAT-inclusive amounts converted to their tax-exclusive base
 * @param vatRate VAT percentage, null when the lease carries no VAT
 */
public record VatNormalization(List<InvoiceItem> items, BigDecimal vatRate) {}
