package com.healthtech.olap.etl.report;

import java.math.BigDecimal;

public record MonthlyRevenue(
    int year,
    int month,
    String monthName,
    String specialtyName,
    long encountersWithBilling,
    BigDecimal totalClaimed,
    BigDecimal totalAllowed,
    BigDecimal avgAllowed,
    BigDecimal allowedPercentage
) {
}
