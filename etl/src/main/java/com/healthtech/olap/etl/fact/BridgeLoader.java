package com.healthtech.olap.etl.fact;

import com.healthtech.olap.data.source.EncounterDiagnosis;
import com.healthtech.olap.data.source.EncounterProcedure;
import com.healthtech.olap.data.star.DiagnosisBridge;
import com.healthtech.olap.data.star.DimensionSet;
import com.healthtech.olap.data.star.FactEncounter;
import com.healthtech.olap.data.star.ProcedureBridge;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Links fact rows to their diagnoses and procedures. A link is kept only when its encounter became a fact row and its diagnosis or
 * procedure is in the dimension.
 *
 * The bridge tables are keyed on (encounter, diagnosis) and (encounter, procedure), and the fact's diagnosis and procedure counts are
 * distinct counts. A link repeated in the source is therefore written once, keeping the sequence number or date of its first
 * occurrence, and the repeats are reported apart from the links that had nothing to join to.
 */
@Component
public class BridgeLoader {

    private static final Logger log = LoggerFactory.getLogger(BridgeLoader.class);

    public BridgeRows load(
        List<EncounterDiagnosis> diagnosisLinks, List<EncounterProcedure> procedureLinks, List<FactEncounter> facts, DimensionSet dimensions
    ) {
        Map<Integer, Integer> encounterKeys = facts.stream()
            .collect(Collectors.toMap(FactEncounter::getEncounterId, FactEncounter::getEncounterKey));

        List<DiagnosisBridge> diagnoses = new ArrayList<>();
        Set<List<Integer>> seenDiagnoses = new HashSet<>();
        int skippedDiagnoses = 0;
        int repeatedDiagnoses = 0;
        for (EncounterDiagnosis link : diagnosisLinks) {
            Integer encounterKey = encounterKeys.get(link.encounterId());
            Optional<Integer> diagnosisKey = dimensions.diagnoses().keyFor(link.diagnosisId());
            if (encounterKey == null || diagnosisKey.isEmpty()) {
                skippedDiagnoses++;
            } else if (seenDiagnoses.add(List.of(encounterKey, diagnosisKey.get()))) {
                diagnoses.add(new DiagnosisBridge(encounterKey, diagnosisKey.get(), link.diagnosisSequence()));
            } else {
                repeatedDiagnoses++;
                log.debug("Repeated diagnosis link on encounter {}: diagnosis {} sequence {}",
                    link.encounterId(), link.diagnosisId(), link.diagnosisSequence());
            }
        }
        diagnoses.sort(Comparator.comparingInt(DiagnosisBridge::encounterKey).thenComparingInt(DiagnosisBridge::diagnosisKey));

        List<ProcedureBridge> procedures = new ArrayList<>();
        Set<List<Integer>> seenProcedures = new HashSet<>();
        int skippedProcedures = 0;
        int repeatedProcedures = 0;
        for (EncounterProcedure link : procedureLinks) {
            Integer encounterKey = encounterKeys.get(link.encounterId());
            Optional<Integer> procedureKey = dimensions.procedures().keyFor(link.procedureId());
            if (encounterKey == null || procedureKey.isEmpty()) {
                skippedProcedures++;
            } else if (seenProcedures.add(List.of(encounterKey, procedureKey.get()))) {
                procedures.add(new ProcedureBridge(encounterKey, procedureKey.get(), link.procedureDate()));
            } else {
                repeatedProcedures++;
                log.debug("Repeated procedure link on encounter {}: procedure {} on {}",
                    link.encounterId(), link.procedureId(), link.procedureDate());
            }
        }
        procedures.sort(Comparator.comparingInt(ProcedureBridge::encounterKey).thenComparingInt(ProcedureBridge::procedureKey));

        log.info("Loaded {} diagnosis and {} procedure bridge rows ({} and {} links without a fact or dimension row)",
            diagnoses.size(), procedures.size(), skippedDiagnoses, skippedProcedures);
        if (repeatedDiagnoses + repeatedProcedures > 0) {
            log.warn("Source repeats {} diagnosis and {} procedure links; each was written once", repeatedDiagnoses, repeatedProcedures);
        }
        return new BridgeRows(diagnoses, procedures, repeatedDiagnoses + repeatedProcedures);
    }
}
