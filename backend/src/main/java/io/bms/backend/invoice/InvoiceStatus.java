package io.bms.backend.invoice;

/**
 * Invoice lifecycle status.
 *
 * <p>Valid transitions:
 *
 * <ul>
 *   <li>DRAFT → SENT (issued by the billing run)
 *   <li>SENT → OVERDUE (late-fee pass after the due date)
 *   <li>OVERDUE → OVERDUE (late fee recalculated on a later run)
 *   <li>SENT, OVERDUE → PAID (payment recorded)
 *   <li>DRAFT, SENT, OVERDUE → CANCELLED
 *   <li>PAID and CANCELLED are terminal
 * </ul>
 */
public enum InvoiceStatus {
  DRAFT,
  SENT,
  OVERDUE,
  PAID,
  CANCELLED;

  public boolean canTransitionTo(InvoiceStatus target) {
    return switch (this) {
      case DRAFT -> target == SENT || target == CANCELLED;
      case SENT -> target == OVERDUE || target == PAID || target == CANCELLED;
      case OVERDUE -> target == OVERDUE || target == PAID || target == CANCELLED;
      case PAID, CANCELLED -> false;
    };
  }

  /** Statuses the late-fee pass re-evaluates once the due date has passed. */
  public boolean isOutstanding() {
    return this == SENT || this == OVERDUE;
  }
}
