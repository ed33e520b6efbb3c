package com.healthtech.olap.data.source;

import java.time.LocalDateTime;

/**
 * A row of the OLTP encounters table. Foreign keys are nullable because the source does not enforce them; the fact load drops
 * encounters whose references do not resolve.
 */
public record Encounter(
    int encounterId,
    Integer patientId,
    Integer providerId,
    Integer departmentId,
    String encounterType,
    LocalDateTime encounterDate,
    LocalDateTime dischargeDate
) {
}
