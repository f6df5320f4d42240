package io.bms.backend.invoice;

import java.math.BigDecimal;

/** Unpersisted invoice line used while building and recalculating invoices. */
public record InvoiceItem(String description, BigDecimal amount, InvoiceLineType type) {

  public static InvoiceItem from(InvoiceLine line) {
    return new InvoiceItem(line.getDescription(), line.getAmount(), line.getLineType());
  }

  public InvoiceItem withAmount(BigDecimal newAmount) {
    return new InvoiceItem(description, newAmount, type);
  }
}
