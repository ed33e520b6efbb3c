package com.healthtech.olap.etl.fact;

import java.math.BigDecimal;
import java.time.LocalDateTime;

/**
 * Staging row: one dated encounter with its provider's specialty and its detail rows rolled up. Billing totals stay null when the
 * encounter has no billed amount; the fact load decides what null becomes.
 */
public record EncounterMetrics(
    int encounterId,
    Integer patientId,
    Integer providerId,
    Integer departmentId,
    String encounterType,
    LocalDateTime encounterDate,
    LocalDateTime dischargeDate,
    Integer specialtyId,
    int diagnosisCount,
    int procedureCount,
    BigDecimal totalClaimAmount,
    BigDecimal totalAllowedAmount
) {
}
