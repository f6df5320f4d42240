package io.bms.backend.lease;

import io.bms.backend.exception.InvalidStateException;
import jakarta.persistence.Column;
import jakarta.persistence.Embedded;
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
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

/**
 * Lease between a tenant and a unit of a building, owned by an organization.
 *
 * <p>The lease record itself is maintained by the lease management module. The billing engine reads
 * the billing configuration and only ever writes the two billing pointers: {@code nextInvoiceDate}
 * (end of the next period to invoice) and {@code lastInvoicedAt} (end of the last invoiced period,
 * null before the first invoice). The pointers are a denormalized cache of the invoice history and
 * can be rebuilt from it.
 */
@Entity
@Table(name = "leases")
public class Lease {

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @Column(name = "organization_id", nullable = false, length = 255)
  private String organizationId;

  @Column(name = "tenant_id", nullable = false)
  private UUID tenantId;

  @Column(name = "unit_id", nullable = false)
  private UUID unitId;

  @Column(name = "start_date", nullable = false)
  private LocalDate startDate;

  @Enumerated(EnumType.STRING)
  @Column(name = "status", nullable = false, length = 20)
  private LeaseStatus status = LeaseStatus.ACTIVE;

  @Enumerated(EnumType.STRING)
  @Column(name = "billing_cycle", nullable = false, length = 20)
  private BillingCycle billingCycle;

  @Embedded private LeaseTerms terms;

  @Column(name = "rent_amount", precision = 14, scale = 2)
  private BigDecimal rentAmount;

  @Column(name = "vat_rate", precision = 5, scale = 2)
  private BigDecimal vatRate;

  @JdbcTypeCode(SqlTypes.JSON)
  @Column(name = "additional_charges", columnDefinition = "jsonb")
  private List<AdditionalCharge> additionalCharges = new ArrayList<>();

  @Column(name = "payment_due_days")
  private Integer paymentDueDays;

  @Embedded private PenaltyConfig penaltyConfig;

  @Column(name = "next_invoice_date")
  private LocalDate nextInvoiceDate;

  @Column(name = "last_invoiced_at")
  private LocalDate lastInvoicedAt;

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  @Column(name = "updated_at", nullable = false)
  private Instant updatedAt;

  protected Lease() {}

  public Lease(
      String organizationId,
      UUID tenantId,
      UUID unitId,
      LocalDate startDate,
      BillingCycle billingCycle,
      LeaseTerms terms,
      LocalDate nextInvoiceDate) {
    this.organizationId = organizationId;
    this.tenantId = tenantId;
    this.unitId = unitId;
    this.startDate = startDate;
    this.billingCycle = billingCycle;
    this.terms = terms;
    this.nextInvoiceDate = nextInvoiceDate;
    this.createdAt = Instant.now();
    this.updatedAt = Instant.now();
  }

  /**
   * Moves the billing pointers after a period has been invoiced, or when they are rebuilt from the
   * invoice history.
   *
   * @param nextInvoiceDate end of the next period to invoice
   * @param lastInvoicedAt end of the last invoiced period, or null if nothing was invoiced yet
   * @throws InvalidStateException if {@code nextInvoiceDate} is not strictly after {@code
   *     lastInvoicedAt}
   */
  public void updateBillingPointers(LocalDate nextInvoiceDate, LocalDate lastInvoicedAt) {
    if (nextInvoiceDate == null
        || (lastInvoicedAt != null && !nextInvoiceDate.isAfter(lastInvoicedAt))) {
      throw new InvalidStateException(
          "Invalid billing pointers",
          "Next invoice date "
              + nextInvoiceDate
              + " must be after last invoiced date "
              + lastInvoicedAt
              + " for lease "
              + id);
    }
    this.nextInvoiceDate = nextInvoiceDate;
    this.lastInvoicedAt = lastInvoicedAt;
    this.updatedAt = Instant.now();
  }

  /** Returns true if the next billing period ends on or before {@code asOf}. */
  public boolean isDueForInvoicing(LocalDate asOf) {
    return status == LeaseStatus.ACTIVE
        && nextInvoiceDate != null
        && !nextInvoiceDate.isAfter(asOf);
  }

  /** Start of the period ending at {@code nextInvoiceDate}. */
  public LocalDate currentPeriodStart() {
    return lastInvoicedAt != null ? lastInvoicedAt : startDate;
  }

  /** Rent billed per period: the explicit override if set, otherwise the agreed rent. */
  public BigDecimal effectiveRent() {
    return rentAmount != null ? rentAmount : terms.getRent();
  }

  // Billing configuration, written only by lease management

  public UUID getId() {
    return id;
  }

  public String getOrganizationId() {
    return organizationId;
  }

  public UUID getTenantId() {
    return tenantId;
  }

  public UUID getUnitId() {
    return unitId;
  }

  public LocalDate getStartDate() {
    return startDate;
  }

  public LeaseStatus getStatus() {
    return status;
  }

  void setStatus(LeaseStatus status) {
    this.status = status;
    this.updatedAt = Instant.now();
  }

  public BillingCycle getBillingCycle() {
    return billingCycle;
  }

  public LeaseTerms getTerms() {
    return terms;
  }

  public BigDecimal getRentAmount() {
    return rentAmount;
  }

  void setRentAmount(BigDecimal rentAmount) {
    this.rentAmount = rentAmount;
    this.updatedAt = Instant.now();
  }

  public BigDecimal getVatRate() {
    return vatRate;
  }

  void setVatRate(BigDecimal vatRate) {
    this.vatRate = vatRate;
    this.updatedAt = Instant.now();
  }

  public List<AdditionalCharge> getAdditionalCharges() {
    return additionalCharges != null ? additionalCharges : List.of();
  }

  void setAdditionalCharges(List<AdditionalCharge> additionalCharges) {
    this.additionalCharges = additionalCharges != null ? additionalCharges : new ArrayList<>();
    this.updatedAt = Instant.now();
  }

  public Integer getPaymentDueDays() {
    return paymentDueDays;
  }

  void setPaymentDueDays(Integer paymentDueDays) {
    this.paymentDueDays = paymentDueDays;
    this.updatedAt = Instant.now();
  }

  public PenaltyConfig getPenaltyConfig() {
    return penaltyConfig;
  }

  void setPenaltyConfig(PenaltyConfig penaltyConfig) {
    this.penaltyConfig = penaltyConfig;
    this.updatedAt = Instant.now();
  }

  public LocalDate getNextInvoiceDate() {
    return nextInvoiceDate;
  }

  public LocalDate getLastInvoicedAt() {
    return lastInvoicedAt;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }

  public Instant getUpdatedAt() {
    return updatedAt;
  }
}
