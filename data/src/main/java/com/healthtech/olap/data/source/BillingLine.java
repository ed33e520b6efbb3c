package com.healthtech.olap.data.source;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * A row of the OLTP billing table. Amounts may be null; a null amount is absent, not zero.
 */
public record BillingLine(int billingId, Integer encounterId, BigDecimal claimAmount, BigDecimal allowedAmount, LocalDate claimDate) {
}
