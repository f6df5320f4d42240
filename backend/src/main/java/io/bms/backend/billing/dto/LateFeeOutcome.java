package io.bms.backend.billing.dto;

import java.math.BigDecimal;
import java.util.UUID;

/**
 * Result of the late-fee pass for one invoice.
 *
 * @param lateFee the penalty now on the invoice (zero while within grace), null when FAILED
 * @param total the invoice total after recalculation, null when FAILED
 */
public record LateFeeOutcome(
    UUID invoiceId, Outcome outcome, BigDecimal lateFee, BigDecimal total, String reason) {

  public enum Outcome {
    APPLIED,
    FAILED
  }

  public static LateFeeOutcome applied(UUID invoiceId, BigDecimal lateFee, BigDecimal total) {
    return new LateFeeOutcome(invoiceId, Outcome.APPLIED, lateFee, total, null);
  }

  public static LateFeeOutcome failed(UUID invoiceId, String reason) {
    return new LateFeeOutcome(invoiceId, Outcome.FAILED, null, null, reason);
  }
}
