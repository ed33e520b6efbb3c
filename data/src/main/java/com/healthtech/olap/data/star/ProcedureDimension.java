package com.healthtech.olap.data.star;

public record ProcedureDimension(int procedureKey, int procedureId, String cptCode, String cptDescription) {
}
