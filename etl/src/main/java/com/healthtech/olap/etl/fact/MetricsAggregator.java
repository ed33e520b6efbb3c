package com.healthtech.olap.etl.fact;

import com.google.common.collect.ImmutableListMultimap;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Maps;
import com.google.common.collect.Multimaps;
import com.healthtech.olap.data.source.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Rolls each dated encounter up with its diagnosis links, procedure links and billing lines.
 *
 * Each detail table is grouped by encounter on its own and counted or summed per encounter, so an encounter with several diagnoses,
 * procedures and billing lines is never multiplied out into their cross product before aggregating.
 */
@Component
public class MetricsAggregator {

    private static final Logger log = LoggerFactory.getLogger(MetricsAggregator.class);

    public List<EncounterMetrics> aggregate(SourceSnapshot source) {
        ImmutableMap<Integer, Provider> providers = Maps.uniqueIndex(source.providers(), Provider::providerId);
        ImmutableListMultimap<Integer, EncounterDiagnosis> diagnoses =
            Multimaps.index(source.encounterDiagnoses(), EncounterDiagnosis::encounterId);
        ImmutableListMultimap<Integer, EncounterProcedure> procedures =
            Multimaps.index(source.encounterProcedures(), EncounterProcedure::encounterId);
        ImmutableListMultimap<Integer, BillingLine> billing = Multimaps.index(
            source.billing().stream().filter(line -> line.encounterId() != null).collect(Collectors.toList()),
            BillingLine::encounterId
        );

        List<EncounterMetrics> metrics = new ArrayList<>();
        int undated = 0;
        int unknownProvider = 0;
        for (Encounter encounter : source.encounters()) {
            if (encounter.encounterDate() == null) {
                undated++;
                continue;
            }
            Provider provider = encounter.providerId() == null ? null : providers.get(encounter.providerId());
            if (provider == null) {
                unknownProvider++;
                continue;
            }
            List<BillingLine> lines = billing.get(encounter.encounterId());
            metrics.add(new EncounterMetrics(
                encounter.encounterId(),
                encounter.patientId(),
                encounter.providerId(),
                encounter.departmentId(),
                encounter.encounterType(),
                encounter.encounterDate(),
                encounter.dischargeDate(),
                provider.specialtyId(),
                countDistinct(diagnoses.get(encounter.encounterId()), EncounterDiagnosis::diagnosisId),
                countDistinct(procedures.get(encounter.encounterId()), EncounterProcedure::procedureId),
                sum(lines, BillingLine::claimAmount),
                sum(lines, BillingLine::allowedAmount)
            ));
        }
        metrics.sort(Comparator.comparingInt(EncounterMetrics::encounterId));

        log.info("Staged metrics for {} encounters ({} without an encounter date, {} with an unknown provider)",
            metrics.size(), undated, unknownProvider);
        return metrics;
    }

    static <T> int countDistinct(Collection<T> rows, Function<T, Integer> id) {
        return (int) rows.stream().map(id).distinct().count();
    }

    /**
     * Sums the non-null amounts. Returns null when there is nothing to sum, the same as SQL SUM over no values.
     */
    static <T> BigDecimal sum(Collection<T> rows, Function<T, BigDecimal> amount) {
        return rows.stream()
            .map(amount)
            .filter(Objects::nonNull)
            .reduce(BigDecimal::add)
            .orElse(null);
    }
}
