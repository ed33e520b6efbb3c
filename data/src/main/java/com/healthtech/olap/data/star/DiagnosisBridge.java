package com.healthtech.olap.data.star;

public record DiagnosisBridge(int encounterKey, int diagnosisKey, Integer diagnosisSequence) {
}
