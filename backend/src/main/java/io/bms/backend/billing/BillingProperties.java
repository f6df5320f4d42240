package io.bms.backend.billing;

import java.math.BigDecimal;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

/**
 * Configuration properties for lease billing.
 *
 * @param defaultVatRate VAT percentage assumed for VAT-inclusive leases that state no rate
 * @param defaultPaymentDueDays days between issue and due date when a lease configures none
 */
@ConfigurationProperties(prefix = "bms.billing")
public record BillingProperties(
    @DefaultValue("15") BigDecimal defaultVatRate, @DefaultValue("7") int defaultPaymentDueDays) {}
