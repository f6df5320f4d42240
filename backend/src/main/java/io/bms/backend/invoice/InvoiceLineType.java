package io.bms.backend.invoice;

public enum InvoiceLineType {
  RENT,
  CHARGE,
  DEPOSIT,
  PENALTY;

  /** Lines whose quoted amount may include VAT and is backed out on VAT-inclusive leases. */
  public boolean isVatAdjustable() {
    return this == RENT || this == CHARGE;
  }
}
