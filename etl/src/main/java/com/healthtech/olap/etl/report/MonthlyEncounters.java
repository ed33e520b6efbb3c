package com.healthtech.olap.etl.report;

public record MonthlyEncounters(
    int year, int month, String monthName, String specialtyName, String encounterTypeName, long totalEncounters, long uniquePatients
) {
}
