package io.bms.backend.lease;

import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;
import java.math.BigDecimal;

/**
 * Commercial terms agreed on a lease. When {@code vatIncluded} is true, the quoted rent and
 * service charges already contain VAT at {@code vatRate} percent.
 */
@Embeddable
public class LeaseTerms {

  @Column(name = "terms_rent", nullable = false, precision = 14, scale = 2)
  private BigDecimal rent;

  @Column(name = "terms_deposit", precision = 14, scale = 2)
  private BigDecimal deposit;

  @Column(name = "terms_service_charges", precision = 14, scale = 2)
  private BigDecimal serviceCharges;

  @Column(name = "terms_vat_rate", precision = 5, scale = 2)
  private BigDecimal vatRate;

  @Column(name = "terms_vat_included", nullable = false)
  private boolean vatIncluded;

  protected LeaseTerms() {}

  public LeaseTerms(
      BigDecimal rent,
      BigDecimal deposit,
      BigDecimal serviceCharges,
      BigDecimal vatRate,
      boolean vatIncluded) {
    this.rent = rent;
    this.deposit = deposit;
    this.serviceCharges = serviceCharges;
    this.vatRate = vatRate;
    this.vatIncluded = vatIncluded;
  }

  public BigDecimal getRent() {
    return rent;
  }

  public BigDecimal getDeposit() {
    return deposit;
  }

  public BigDecimal getServiceCharges() {
    return serviceCharges;
  }

  public BigDecimal getVatRate() {
    return vatRate;
  }

  public boolean isVatIncluded() {
    return vatIncluded;
  }
}
