package com.healthtech.olap.data.source;

public record Diagnosis(int diagnosisId, String icd10Code, String icd10Description) {
}
