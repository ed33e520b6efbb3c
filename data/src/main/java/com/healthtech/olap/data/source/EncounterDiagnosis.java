package com.healthtech.olap.data.source;

public record EncounterDiagnosis(int encounterId, int diagnosisId, Integer diagnosisSequence) {
}
