package com.healthtech.olap.data.source;

import java.time.LocalDate;

public record EncounterProcedure(int encounterId, int procedureId, LocalDate procedureDate) {
}
