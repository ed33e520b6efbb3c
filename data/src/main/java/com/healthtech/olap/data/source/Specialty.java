package com.healthtech.olap.data.source;

public record Specialty(int specialtyId, String specialtyName, String specialtyCode) {
}
