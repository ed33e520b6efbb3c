package com.healthtech.olap.etl.fact;

import com.healthtech.olap.data.star.DiagnosisBridge;
import com.healthtech.olap.data.star.ProcedureBridge;

import java.util.List;

/**
 * Bridge rows of one run, plus how many source links were folded into an existing row because the source repeats them.
 */
public record BridgeRows(List<DiagnosisBridge> diagnoses, List<ProcedureBridge> procedures, int repeatedLinks) {

    public BridgeRows {
        diagnoses = List.copyOf(diagnoses);
        procedures = List.copyOf(procedures);
    }

    public int size() {
        return diagnoses.size() + procedures.size();
    }
}
