package com.healthtech.olap.data.star;

import java.time.LocalDate;

public record ProcedureBridge(int encounterKey, int procedureKey, LocalDate procedureDate) {
}
