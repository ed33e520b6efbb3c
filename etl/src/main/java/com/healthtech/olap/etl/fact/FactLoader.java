package com.healthtech.olap.etl.fact;

import com.google.common.collect.HashMultiset;
import com.google.common.collect.Multiset;
import com.healthtech.olap.data.star.DateDimension;
import com.healthtech.olap.data.star.DimensionSet;
import com.healthtech.olap.data.star.EncounterTypeDimension;
import com.healthtech.olap.data.star.FactEncounter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Turns staged encounter metrics into fact rows.
 *
 * Every dimension reference must resolve. A metrics row that misses any of them is left out of the fact table rather than pointed at a
 * default member; the exclusions are counted per dimension and logged. Encounter keys are handed out 1..n in encounter id order over
 * the rows that make it in.
 */
@Component
public class FactLoader {

    private static final Logger log = LoggerFactory.getLogger(FactLoader.class);

    public List<FactEncounter> load(List<EncounterMetrics> metrics, DimensionSet dimensions) {
        Set<Integer> dateKeys = dimensions.dates().stream().map(DateDimension::dateKey).collect(Collectors.toSet());
        List<EncounterMetrics> ordered = new ArrayList<>(metrics);
        ordered.sort(Comparator.comparingInt(EncounterMetrics::encounterId));

        List<FactEncounter> facts = new ArrayList<>(ordered.size());
        Multiset<String> excluded = HashMultiset.create();
        int nextEncounterKey = 1;
        for (EncounterMetrics row : ordered) {
            int dateKey = DateDimension.keyOf(row.encounterDate().toLocalDate());
            Optional<Integer> patientKey = dimensions.patients().keyFor(row.patientId());
            Optional<Integer> providerKey = dimensions.providers().keyFor(row.providerId());
            Optional<Integer> specialtyKey = dimensions.specialties().keyFor(row.specialtyId());
            Optional<Integer> departmentKey = dimensions.departments().keyFor(row.departmentId());
            Optional<Integer> encounterTypeKey = dimensions.encounterTypes().keyFor(EncounterTypeDimension.normalize(row.encounterType()));

            if (!dateKeys.contains(dateKey)) {
                excluded.add("date");
            } else if (patientKey.isEmpty()) {
                excluded.add("patient");
            } else if (providerKey.isEmpty()) {
                excluded.add("provider");
            } else if (specialtyKey.isEmpty()) {
                excluded.add("specialty");
            } else if (departmentKey.isEmpty()) {
                excluded.add("department");
            } else if (encounterTypeKey.isEmpty()) {
                excluded.add("encounter type");
            } else {
                facts.add(new FactEncounter(
                    nextEncounterKey++,
                    row.encounterId(),
                    dateKey,
                    patientKey.get(),
                    providerKey.get(),
                    specialtyKey.get(),
                    departmentKey.get(),
                    encounterTypeKey.get(),
                    orZero(row.totalClaimAmount()),
                    orZero(row.totalAllowedAmount()),
                    lengthOfStay(row.encounterDate(), row.dischargeDate()),
                    row.diagnosisCount(),
                    row.procedureCount()
                ));
            }
        }

        if (!excluded.isEmpty()) {
            log.info("Excluded {} encounters with unresolved dimension references: {}", excluded.size(), excluded);
        }
        log.info("Loaded {} fact rows", facts.size());
        return facts;
    }

    /**
     * Whole calendar days from the encounter date to the discharge date. An encounter without a discharge date stays zero days.
     */
    static int lengthOfStay(LocalDateTime encounterDate, LocalDateTime dischargeDate) {
        LocalDateTime end = dischargeDate == null ? encounterDate : dischargeDate;
        return Math.toIntExact(ChronoUnit.DAYS.between(encounterDate.toLocalDate(), end.toLocalDate()));
    }

    private static BigDecimal orZero(BigDecimal amount) {
        return amount == null ? BigDecimal.ZERO : amount;
    }
}
