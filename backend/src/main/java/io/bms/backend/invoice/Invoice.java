package io.bms.backend.invoice;

import io.bms.backend.exception.InvalidStateException;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.UUID;

/**
 * Invoice for one billing period of a lease.
 *
 * <p>Lifecycle: DRAFT → SENT (issued by the billing run) → OVERDUE (late-fee pass) → PAID. Can be
 * CANCELLED until paid. Payments and cancellations come from outside the billing engine.
 *
 * <p>At most one invoice exists per (leaseId, periodStart, periodEnd), enforced by the unique
 * constraint {@code uq_invoices_lease_period}.
 */
@Entity
@Table(name = "invoices")
public class Invoice {

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @Column(name = "organization_id", nullable = false, length = 255)
  private String organizationId;

  @Column(name = "lease_id", nullable = false)
  private UUID leaseId;

  @Column(name = "tenant_id", nullable = false)
  private UUID tenantId;

  @Column(name = "unit_id", nullable = false)
  private UUID unitId;

  @Column(name = "invoice_number", nullable = false, length = 50)
  private String invoiceNumber;

  @Enumerated(EnumType.STRING)
  @Column(name = "status", nullable = false, length = 20)
  private InvoiceStatus status = InvoiceStatus.DRAFT;

  @Column(name = "issue_date", nullable = false)
  private LocalDate issueDate;

  @Column(name = "due_date", nullable = false)
  private LocalDate dueDate;

  @Column(name = "period_start", nullable = false)
  private LocalDate periodStart;

  @Column(name = "period_end", nullable = false)
  private LocalDate periodEnd;

  @Column(name = "vat_rate", precision = 5, scale = 2)
  private BigDecimal vatRate;

  @Column(name = "subtotal", precision = 14, scale = 2, nullable = false)
  private BigDecimal subtotal = BigDecimal.ZERO;

  @Column(name = "tax_amount", precision = 14, scale = 2, nullable = false)
  private BigDecimal taxAmount = BigDecimal.ZERO;

  @Column(name = "discount", precision = 14, scale = 2, nullable = false)
  private BigDecimal discount = BigDecimal.ZERO;

  @Column(name = "total", precision = 14, scale = 2, nullable = false)
  private BigDecimal total = BigDecimal.ZERO;

  @Column(name = "paid_at")
  private Instant paidAt;

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  @Column(name = "updated_at", nullable = false)
  private Instant updatedAt;

  protected Invoice() {}

  public Invoice(
      String organizationId,
      UUID leaseId,
      UUID tenantId,
      UUID unitId,
      String invoiceNumber,
      LocalDate issueDate,
      LocalDate dueDate,
      LocalDate periodStart,
      LocalDate periodEnd) {
    if (periodEnd.isBefore(periodStart)) {
      throw new InvalidStateException(
          "Invalid invoice period",
          "Period end " + periodEnd + " is before period start " + periodStart);
    }
    this.organizationId = organizationId;
    this.leaseId = leaseId;
    this.tenantId = tenantId;
    this.unitId = unitId;
    this.invoiceNumber = invoiceNumber;
    this.issueDate = issueDate;
    this.dueDate = dueDate;
    this.periodStart = periodStart;
    this.periodEnd = periodEnd;
    this.createdAt = Instant.now();
    this.updatedAt = Instant.now();
  }

  /** Issues the invoice to the tenant, transitioning from DRAFT to SENT. */
  public void markSent() {
    transitionTo(InvoiceStatus.SENT);
  }

  /** Flags the invoice as overdue. Re-applying on an OVERDUE invoice is allowed. */
  public void markOverdue() {
    transitionTo(InvoiceStatus.OVERDUE);
  }

  /**
   * Records a payment captured by the payment module.
   *
   * @throws InvalidStateException if the invoice is not SENT or OVERDUE
   */
  void recordPayment(Instant paidAt) {
    transitionTo(InvoiceStatus.PAID);
    this.paidAt = paidAt;
  }

  void cancel() {
    transitionTo(InvoiceStatus.CANCELLED);
  }

  /**
   * Stores freshly computed totals together with the VAT rate they were computed with.
   *
   * @param totals totals from {@link InvoiceTotalsCalculator}
   * @param vatRate the rate used, null when the invoice carries no VAT
   */
  public void applyTotals(InvoiceTotals totals, BigDecimal vatRate) {
    this.subtotal = totals.subtotal();
    this.taxAmount = totals.tax();
    this.total = totals.total();
    this.vatRate = vatRate;
    this.updatedAt = Instant.now();
  }

  private void transitionTo(InvoiceStatus target) {
    if (!status.canTransitionTo(target)) {
      throw new InvalidStateException(
          "Invalid invoice status",
          "Cannot move invoice " + invoiceNumber + " from " + status + " to " + target);
    }
    this.status = target;
    this.updatedAt = Instant.now();
  }

  // --- Getters ---

  public UUID getId() {
    return id;
  }

  public String getOrganizationId() {
    return organizationId;
  }

  public UUID getLeaseId() {
    return leaseId;
  }

  public UUID getTenantId() {
    return tenantId;
  }

  public UUID getUnitId() {
    return unitId;
  }

  public String getInvoiceNumber() {
    return invoiceNumber;
  }

  public InvoiceStatus getStatus() {
    return status;
  }

  public LocalDate getIssueDate() {
    return issueDate;
  }

  public LocalDate getDueDate() {
    return dueDate;
  }

  public LocalDate getPeriodStart() {
    return periodStart;
  }

  public LocalDate getPeriodEnd() {
    return periodEnd;
  }

  public BigDecimal getVatRate() {
    return vatRate;
  }

  public BigDecimal getSubtotal() {
    return subtotal;
  }

  public BigDecimal getTaxAmount() {
    return taxAmount;
  }

  public BigDecimal getDiscount() {
    return discount;
  }

  public BigDecimal getTotal() {
    return total;
  }

  public Instant getPaidAt() {
    return paidAt;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }

  public Instant getUpdatedAt() {
    return updatedAt;
  }
}
