package io.bms.backend.lease;

import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;
import java.math.BigDecimal;

/**
 * Late-payment penalty settings of a lease. Hibernate maps the embedded value to {@code null} when
 * every column is null, which is how a lease without a penalty regime is represented.
 *
 * <p>{@code gracePeriodDays} and {@code paymentDueDays} are legacy field names still present on
 * older leases. They are honoured as fallbacks for {@code lateFeeGraceDays} and for the lease-level
 * payment due days respectively.
 */
@Embeddable
public class PenaltyConfig {

  /** Fraction of the invoice amount charged per day late, e.g. 0.001 for 0.1% per day. */
  @Column(name = "penalty_late_fee_rate_per_day", precision = 9, scale = 6)
  private BigDecimal lateFeeRatePerDay;

  @Column(name = "penalty_late_fee_grace_days")
  private Integer lateFeeGraceDays;

  @Column(name = "penalty_late_fee_cap_days")
  private Integer lateFeeCapDays;

  @Column(name = "penalty_grace_period_days")
  private Integer gracePeriodDays;

  @Column(name = "penalty_payment_due_days")
  private Integer paymentDueDays;

  protected PenaltyConfig() {}

  public PenaltyConfig(
      BigDecimal lateFeeRatePerDay,
      Integer lateFeeGraceDays,
      Integer lateFeeCapDays,
      Integer gracePeriodDays,
      Integer paymentDueDays) {
    this.lateFeeRatePerDay = lateFeeRatePerDay;
    this.lateFeeGraceDays = lateFeeGraceDays;
    this.lateFeeCapDays = lateFeeCapDays;
    this.gracePeriodDays = gracePeriodDays;
    this.paymentDueDays = paymentDueDays;
  }

  public BigDecimal getLateFeeRatePerDay() {
    return lateFeeRatePerDay;
  }

  public Integer getLateFeeGraceDays() {
    return lateFeeGraceDays;
  }

  public Integer getLateFeeCapDays() {
    return lateFeeCapDays;
  }

  public Integer getGracePeriodDays() {
    return gracePeriodDays;
  }

  public Integer getPaymentDueDays() {
    return paymentDueDays;
  }
}
