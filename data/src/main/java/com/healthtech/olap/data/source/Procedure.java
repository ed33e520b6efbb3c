package com.healthtech.olap.data.source;

public record Procedure(int procedureId, String cptCode, String cptDescription) {
}
