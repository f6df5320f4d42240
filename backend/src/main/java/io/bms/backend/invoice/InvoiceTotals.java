package io.bms.backend.invoice;

import java.math.BigDecimal;

public record InvoiceTotals(BigDecimal subtotal, BigDecimal tax, BigDecimal total) {}
