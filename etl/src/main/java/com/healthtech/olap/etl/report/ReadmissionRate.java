package com.healthtech.olap.etl.report;

import java.math.BigDecimal;

public record ReadmissionRate(String specialtyName, long totalInpatientEncounters, long readmissions, BigDecimal readmissionRatePct) {
}
