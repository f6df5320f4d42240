package io.bms.backend.billing;

import io.bms.backend.invoice.InvoiceItem;
import io.bms.backend.invoice.InvoiceLineType;
import io.bms.backend.lease.AdditionalCharge;
import io.bms.backend.lease.Lease;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import org.springframework.stereotype.Component;

/** Assembles the charge lines billed for one period of a lease. */
@Component
public class InvoiceLineBuilder {

  static final String RENT_DESCRIPTION = "Rent";
  static final String SERVICE_CHARGES_DESCRIPTION = "Service Charges";
  static final String DEPOSIT_DESCRIPTION = "Security Deposit";

  /**
   * Builds the invoice items, in order: rent, service charges, deposit, additional charges.
   *
   * @param lease the lease being invoiced
   * @param includeDeposit true only for the first invoice of the lease
   * @return the quoted (possibly VAT-inclusive) items
   */
  public List<InvoiceItem> buildInvoiceItems(Lease lease, boolean includeDeposit) {
    var items = new ArrayList<InvoiceItem>();
    items.add(new InvoiceItem(RENT_DESCRIPTION, lease.effectiveRent(), InvoiceLineType.RENT));

    BigDecimal serviceCharges = lease.getTerms().getServiceCharges();
    if (isPresent(serviceCharges)) {
      items.add(
          new InvoiceItem(SERVICE_CHARGES_DESCRIPTION, serviceCharges, InvoiceLineType.CHARGE));
    }

    BigDecimal deposit = lease.getTerms().getDeposit();
    if (includeDeposit && isPresent(deposit)) {
      items.add(new InvoiceItem(DEPOSIT_DESCRIPTION, deposit, InvoiceLineType.DEPOSIT));
    }

    for (AdditionalCharge charge : lease.getAdditionalCharges()) {
      items.add(new InvoiceItem(charge.name(), charge.amount(), InvoiceLineType.CHARGE));
    }
    return items;
  }

  static boolean isPresent(BigDecimal amount) {
    return amount != null && amount.signum() != 0;
  }
}
