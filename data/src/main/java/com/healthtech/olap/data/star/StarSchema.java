package com.healthtech.olap.data.star;

import java.util.List;

/**
 * A fully staged load, ready to be published in place of the current target content.
 */
public record StarSchema(
    DimensionSet dimensions,
    List<FactEncounter> facts,
    List<DiagnosisBridge> diagnosisBridges,
    List<ProcedureBridge> procedureBridges
) {

    public StarSchema {
        facts = List.copyOf(facts);
        diagnosisBridges = List.copyOf(diagnosisBridges);
        procedureBridges = List.copyOf(procedureBridges);
    }

    public int totalRows() {
        return dimensions.totalRows() + facts.size() + diagnosisBridges.size() + procedureBridges.size();
    }
}
