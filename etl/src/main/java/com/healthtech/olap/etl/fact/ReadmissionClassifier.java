package com.healthtech.olap.etl.fact;

import com.healthtech.olap.data.source.Encounter;
import com.healthtech.olap.data.star.EncounterTypeDimension;
import com.healthtech.olap.data.star.FactEncounter;
import com.healthtech.olap.etl.config.EtlConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.LocalDateTime;
import java.util.ArrayDeque;
import java.util.Comparator;
import java.util.Deque;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Flags fact rows whose patient had an inpatient encounter in the window before them.
 *
 * Each patient's dated encounters are walked once in time order while a deque holds the inpatient timestamps still inside the window.
 * A prior encounter counts when {@code current - window <= prior < current}, so encounters sharing a timestamp never count for each
 * other. The current encounter's own type does not matter.
 */
@Component
public class ReadmissionClassifier {

    private static final Logger log = LoggerFactory.getLogger(ReadmissionClassifier.class);

    private static final Comparator<Encounter> CHRONOLOGICAL =
        Comparator.comparing(Encounter::encounterDate).thenComparingInt(Encounter::encounterId);

    private final EtlConfig config;

    public ReadmissionClassifier(EtlConfig config) {
        this.config = config;
    }

    /**
     * @param facts      loaded fact rows, flagged in place
     * @param encounters the full source encounter history, including encounters that did not become facts
     * @return the number of fact rows flagged as readmissions
     */
    public int classify(List<FactEncounter> facts, List<Encounter> encounters) {
        Set<Integer> readmissions = readmissionEncounterIds(encounters);
        int flagged = 0;
        for (FactEncounter fact : facts) {
            boolean readmission = readmissions.contains(fact.getEncounterId());
            fact.setReadmission(readmission);
            if (readmission) {
                flagged++;
            }
        }
        log.info("Flagged {} of {} encounters as {}-day readmissions", flagged, facts.size(), config.getReadmissionWindowDays());
        return flagged;
    }

    Set<Integer> readmissionEncounterIds(List<Encounter> encounters) {
        Map<Integer, List<Encounter>> byPatient = encounters.stream()
            .filter(encounter -> encounter.patientId() != null && encounter.encounterDate() != null)
            .collect(Collectors.groupingBy(Encounter::patientId));

        Set<Integer> readmissions = new HashSet<>();
        for (List<Encounter> history : byPatient.values()) {
            history.sort(CHRONOLOGICAL);
            scanPatient(history, readmissions);
        }
        return readmissions;
    }

    private void scanPatient(List<Encounter> history, Set<Integer> readmissions) {
        long windowDays = config.getReadmissionWindowDays();
        String inpatient = EncounterTypeDimension.normalize(config.getInpatientEncounterType());
        Deque<LocalDateTime> inpatientWindow = new ArrayDeque<>();

        int i = 0;
        while (i < history.size()) {
            LocalDateTime current = history.get(i).encounterDate();
            int groupEnd = i;
            while (groupEnd < history.size() && history.get(groupEnd).encounterDate().equals(current)) {
                groupEnd++;
            }

            LocalDateTime windowStart = current.minusDays(windowDays);
            while (!inpatientWindow.isEmpty() && inpatientWindow.peekFirst().isBefore(windowStart)) {
                inpatientWindow.pollFirst();
            }
            boolean readmission = !inpatientWindow.isEmpty();

            for (int j = i; j < groupEnd; j++) {
                Encounter encounter = history.get(j);
                if (readmission) {
                    readmissions.add(encounter.encounterId());
                }
                if (inpatient.equals(EncounterTypeDimension.normalize(encounter.encounterType()))) {
                    inpatientWindow.addLast(current);
                }
            }
            i = groupEnd;
        }
    }
}
