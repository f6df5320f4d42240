package io.bms.backend.lease;

import java.time.LocalDate;

public enum BillingCycle {
  MONTHLY,
  QUARTERLY,
  ANNUAL;

  /**
   * Advances a period end by one billing cycle. A monthly lease invoiced up to 2024-02-01 is next
   * invoiced on 2024-03-01.
   *
   * <p>Month-length overflow clamps to the last valid day of the target month: 2024-01-31 advances
   * to 2024-02-29, 2025-01-31 to 2025-02-28, and 2024-02-29 + one year to 2025-02-28. The result is
   * always relative to the supplied date, so a clamped date stays clamped on the following advance
   * (2025-02-28 advances to 2025-03-28).
   *
   * @param periodEnd the end of the period just invoiced
   * @return the next period end
   */
  public LocalDate advance(LocalDate periodEnd) {
    return switch (this) {
      case MONTHLY -> periodEnd.plusMonths(1);
      case QUARTERLY -> periodEnd.plusMonths(3);
      case ANNUAL -> periodEnd.plusYears(1);
    };
  }
}
