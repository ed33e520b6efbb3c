package com.healthtech.olap.data.star;

public record SpecialtyDimension(int specialtyKey, int specialtyId, String specialtyName, String specialtyCode) {
}
