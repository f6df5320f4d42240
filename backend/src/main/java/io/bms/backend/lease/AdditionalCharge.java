package io.bms.backend.lease;

import java.math.BigDecimal;

/** A recurring named charge billed with every invoice of a lease (e.g. parking, generator fee). */
public record AdditionalCharge(String name, BigDecimal amount) {}
