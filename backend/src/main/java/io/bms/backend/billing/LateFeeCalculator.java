package io.bms.backend.billing;

import io.bms.backend.lease.Lease;
import io.bms.backend.lease.PenaltyConfig;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import org.springframework.stereotype.Component;

/** Late-fee and payment-term rules derived from a lease's penalty configuration. */
@Component
public class LateFeeCalculator {

  private final BillingProperties billingProperties;

  public LateFeeCalculator(BillingProperties billingProperties) {
    this.billingProperties = billingProperties;
  }

  /**
   * Computes the late fee owed on an invoice as of a given date.
   *
   * <p>{@code fee = round(amountBase * lateFeeRatePerDay * effectiveDays)}, HALF_UP to a whole
   * currency unit, where {@code effectiveDays} is the number of whole days past the due date minus
   * the grace days, capped at {@code lateFeeCapDays} when configured. The fee never decreases as
   * {@code asOf} moves forward and stops growing once the cap is reached.
   *
   * @param lease the lease holding the penalty configuration
   * @param amountBase the payable amount the fee accrues on
   * @param dueDate the invoice due date
   * @param asOf evaluation date
   * @return the fee, zero when the lease has no penalty regime or the invoice is within grace
   */
  public BigDecimal computeLateFee(
      Lease lease, BigDecimal amountBase, LocalDate dueDate, LocalDate asOf) {
    PenaltyConfig config = lease.getPenaltyConfig();
    if (config == null
        || config.getLateFeeRatePerDay() == null
        || config.getLateFeeRatePerDay().signum() == 0) {
      return BigDecimal.ZERO;
    }

    int grace = firstNonNull(config.getLateFeeGraceDays(), config.getGracePeriodDays(), 0);
    long daysLateRaw = ChronoUnit.DAYS.between(dueDate, asOf);
    long daysLate = Math.max(0, daysLateRaw - grace);
    if (daysLate <= 0) {
      return BigDecimal.ZERO;
    }

    Integer cap = config.getLateFeeCapDays();
    long effectiveDays = cap != null && cap > 0 ? Math.min(daysLate, cap) : daysLate;

    BigDecimal fee =
        amountBase
            .multiply(config.getLateFeeRatePerDay())
            .multiply(BigDecimal.valueOf(effectiveDays))
            .setScale(0, RoundingMode.HALF_UP);
    return fee.signum() > 0 ? fee : BigDecimal.ZERO;
  }

  /**
   * Days between issue and due date. Resolved from the lease, then the penalty configuration's
   * legacy {@code paymentDueDays} and {@code gracePeriodDays}, then the configured default.
   */
  public int getPaymentDueDays(Lease lease) {
    if (lease.getPaymentDueDays() != null) {
      return lease.getPaymentDueDays();
    }
    PenaltyConfig config = lease.getPenaltyConfig();
    if (config != null) {
      if (config.getPaymentDueDays() != null) {
        return config.getPaymentDueDays();
      }
      if (config.getGracePeriodDays() != null) {
        return config.getGracePeriodDays();
      }
    }
    return billingProperties.defaultPaymentDueDays();
  }

  private static int firstNonNull(Integer first, Integer second, int fallback) {
    if (first != null) {
      return first;
    }
    return second != null ? second : fallback;
  }
}
