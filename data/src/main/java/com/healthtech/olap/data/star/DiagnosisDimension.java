package com.healthtech.olap.data.star;

public record DiagnosisDimension(int diagnosisKey, int diagnosisId, String icd10Code, String icd10Description) {
}
