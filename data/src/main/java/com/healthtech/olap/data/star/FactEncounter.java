package com.healthtech.olap.data.star;

import java.math.BigDecimal;

/**
 * One row of fact_encounters. Everything but the readmission flag is fixed when the fact load creates the row; the flag starts false
 * and is set afterwards by the readmission pass.
 */
public class FactEncounter {

    private final int encounterKey;
    private final int encounterId;
    private final int dateKey;
    private final int patientKey;
    private final int providerKey;
    private final int specialtyKey;
    private final int departmentKey;
    private final int encounterTypeKey;
    private final BigDecimal totalClaimAmount;
    private final BigDecimal totalAllowedAmount;
    private final int lengthOfStayDays;
    private final int diagnosisCount;
    private final int procedureCount;

    private boolean readmission;

    public FactEncounter(int encounterKey, int encounterId, int dateKey, int patientKey, int providerKey, int specialtyKey,
        int departmentKey, int encounterTypeKey, BigDecimal totalClaimAmount, BigDecimal totalAllowedAmount, int lengthOfStayDays,
        int diagnosisCount, int procedureCount) {
        this.encounterKey = encounterKey;
        this.encounterId = encounterId;
        this.dateKey = dateKey;
        this.patientKey = patientKey;
        this.providerKey = providerKey;
        this.specialtyKey = specialtyKey;
        this.departmentKey = departmentKey;
        this.encounterTypeKey = encounterTypeKey;
        this.totalClaimAmount = totalClaimAmount;
        this.totalAllowedAmount = totalAllowedAmount;
        this.lengthOfStayDays = lengthOfStayDays;
        this.diagnosisCount = diagnosisCount;
        this.procedureCount = procedureCount;
    }

    public int getEncounterKey() {
        return encounterKey;
    }

    public int getEncounterId() {
        return encounterId;
    }

    public int getDateKey() {
        return dateKey;
    }

    public int getPatientKey() {
        return patientKey;
    }

    public int getProviderKey() {
        return providerKey;
    }

    public int getSpecialtyKey() {
        return specialtyKey;
    }

    public int getDepartmentKey() {
        return departmentKey;
    }

    public int getEncounterTypeKey() {
        return encounterTypeKey;
    }

    public BigDecimal getTotalClaimAmount() {
        return totalClaimAmount;
    }

    public BigDecimal getTotalAllowedAmount() {
        return totalAllowedAmount;
    }

    public int getLengthOfStayDays() {
        return lengthOfStayDays;
    }

    public int getDiagnosisCount() {
        return diagnosisCount;
    }

    public int getProcedureCount() {
        return procedureCount;
    }

    public boolean isReadmission() {
        return readmission;
    }

    public void setReadmission(boolean readmission) {
        this.readmission = readmission;
    }

    @Override
    public String toString() {
        return "FactEncounter[encounterKey=" + encounterKey + ", encounterId=" + encounterId + ", dateKey=" + dateKey
            + ", readmission=" + readmission + "]";
    }
}
