package com.healthtech.olap.etl.report;

public record DiagnosisProcedurePair(
    String icd10Code, String icd10Description, String cptCode, String cptDescription, long encounterCount
) {
}
