package com.healthtech.olap.etl.dimension;

import com.google.common.base.Joiner;
import com.google.common.util.concurrent.ThreadFactoryBuilder;
import com.healthtech.olap.data.run.EtlPhase;
import com.healthtech.olap.data.source.*;
import com.healthtech.olap.data.star.*;
import com.healthtech.olap.etl.config.EtlConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.Period;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.TreeSet;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.function.Consumer;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Builds the eight dimensions of the star schema from one source snapshot.
 *
 * The dimensions do not depend on each other, so they are built concurrently on a small pool. Every build is waited for; if any of
 * them failed the whole phase fails afterwards, since a fact row could otherwise point at a dimension that was never built.
 */
@Component
public class DimensionLoader {

    private static final Logger log = LoggerFactory.getLogger(DimensionLoader.class);

    static final String UNKNOWN_CREDENTIAL = "UNKNOWN";

    private static final Joiner NAME_JOINER = Joiner.on(' ').skipNulls();

    private final EtlConfig config;
    private final Clock clock;

    public DimensionLoader(EtlConfig config, Clock clock) {
        this.config = config;
        this.clock = clock;
    }

    public DimensionSet load(SourceSnapshot source) {
        return load(source, phase -> { });
    }

    /**
     * Builds every dimension, reporting each one's phase to {@code onLoaded} as soon as it and every dimension before it in the
     * canonical order have been built. Nothing more is reported once a dimension has failed, so the last reported phase is the
     * furthest point the load reached. Reports happen on the calling thread.
     */
    public DimensionSet load(SourceSnapshot source, Consumer<EtlPhase> onLoaded) {
        LocalDate loadDate = LocalDate.now(clock);
        ExecutorService pool = Executors.newFixedThreadPool(
            config.getDimensionThreads(),
            new ThreadFactoryBuilder().setNameFormat("dimension-loader-%d").setDaemon(true).build()
        );
        try {
            Future<DimensionTable<Integer, SpecialtyDimension>> specialties = pool.submit(() -> specialties(source));
            Future<DimensionTable<Integer, DepartmentDimension>> departments = pool.submit(() -> departments(source));
            Future<DimensionTable<Integer, ProviderDimension>> providers = pool.submit(() -> providers(source));
            Future<DimensionTable<Integer, PatientDimension>> patients = pool.submit(() -> patients(source, loadDate));
            Future<DimensionTable<Integer, DiagnosisDimension>> diagnoses = pool.submit(() -> diagnoses(source));
            Future<DimensionTable<Integer, ProcedureDimension>> procedures = pool.submit(() -> procedures(source));
            Future<DimensionTable<String, EncounterTypeDimension>> encounterTypes = pool.submit(() -> encounterTypes(source));
            Future<List<DateDimension>> dates = pool.submit(() -> dates(source));

            List<Throwable> failures = new ArrayList<>();
            DimensionTable<Integer, SpecialtyDimension> specialtyTable =
                await("dim_specialty", EtlPhase.DIM_SPECIALTY_LOADED, specialties, failures, onLoaded);
            DimensionTable<Integer, DepartmentDimension> departmentTable =
                await("dim_department", EtlPhase.DIM_DEPARTMENT_LOADED, departments, failures, onLoaded);
            DimensionTable<Integer, ProviderDimension> providerTable =
                await("dim_provider", EtlPhase.DIM_PROVIDER_LOADED, providers, failures, onLoaded);
            DimensionTable<Integer, PatientDimension> patientTable =
                await("dim_patient", EtlPhase.DIM_PATIENT_LOADED, patients, failures, onLoaded);
            DimensionTable<Integer, DiagnosisDimension> diagnosisTable =
                await("dim_diagnoses", EtlPhase.DIM_DIAGNOSIS_LOADED, diagnoses, failures, onLoaded);
            DimensionTable<Integer, ProcedureDimension> procedureTable =
                await("dim_procedures", EtlPhase.DIM_PROCEDURE_LOADED, procedures, failures, onLoaded);
            DimensionTable<String, EncounterTypeDimension> encounterTypeTable =
                await("dim_encounter_type", EtlPhase.DIM_ENCOUNTER_TYPE_LOADED, encounterTypes, failures, onLoaded);
            List<DateDimension> dateRows =
                await("dim_date", EtlPhase.DIM_DATE_LOADED, dates, failures, onLoaded);
            if (!failures.isEmpty()) {
                IllegalStateException e = new IllegalStateException(failures.size() + " dimension load(s) failed", failures.get(0));
                failures.stream().skip(1).forEach(e::addSuppressed);
                throw e;
            }

            DimensionSet dimensions = new DimensionSet(
                specialtyTable, departmentTable, providerTable, patientTable,
                diagnosisTable, procedureTable, encounterTypeTable, dateRows
            );
            log.info("Loaded {} dimension rows", dimensions.totalRows());
            return dimensions;
        } finally {
            pool.shutdownNow();
        }
    }

    private <T> T await(String table, EtlPhase phase, Future<T> future, List<Throwable> failures, Consumer<EtlPhase> onLoaded) {
        try {
            T loaded = future.get();
            if (failures.isEmpty()) {
                onLoaded.accept(phase);
            }
            return loaded;
        } catch (ExecutionException e) {
            log.error("Loading {} failed", table, e.getCause());
            failures.add(e.getCause());
            return null;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while loading " + table, e);
        }
    }

    DimensionTable<Integer, SpecialtyDimension> specialties(SourceSnapshot source) {
        return logged(DimensionTable.build(
            "dim_specialty", source.specialties(), Specialty::specialtyId,
            (key, s) -> new SpecialtyDimension(key, s.specialtyId(), s.specialtyName(), s.specialtyCode())
        ));
    }

    DimensionTable<Integer, DepartmentDimension> departments(SourceSnapshot source) {
        return logged(DimensionTable.build(
            "dim_department", source.departments(), Department::departmentId,
            (key, d) -> new DepartmentDimension(key, d.departmentId(), d.departmentName(), d.floor(), d.capacity())
        ));
    }

    DimensionTable<Integer, ProviderDimension> providers(SourceSnapshot source) {
        return logged(DimensionTable.build(
            "dim_provider", source.providers(), Provider::providerId,
            (key, p) -> new ProviderDimension(key, p.providerId(), fullName(p), credential(p.credential()))
        ));
    }

    DimensionTable<Integer, PatientDimension> patients(SourceSnapshot source, LocalDate loadDate) {
        List<Patient> withBirthDate = source.patients().stream()
            .filter(p -> p.dateOfBirth() != null)
            .collect(Collectors.toList());
        int excluded = source.patients().size() - withBirthDate.size();
        if (excluded > 0) {
            log.info("Excluding {} patients without a date of birth from dim_patient", excluded);
        }
        return logged(DimensionTable.build(
            "dim_patient", withBirthDate, Patient::patientId,
            (key, p) -> {
                int age = ageOn(p.dateOfBirth(), loadDate);
                return new PatientDimension(
                    key, p.patientId(), p.firstName(), p.lastName(), upper(p.gender()), p.dateOfBirth(), p.mrn(), age, ageGroup(age)
                );
            }
        ));
    }

    DimensionTable<Integer, DiagnosisDimension> diagnoses(SourceSnapshot source) {
        return logged(DimensionTable.build(
            "dim_diagnoses", source.diagnoses(), Diagnosis::diagnosisId,
            (key, d) -> new DiagnosisDimension(key, d.diagnosisId(), d.icd10Code(), d.icd10Description())
        ));
    }

    DimensionTable<Integer, ProcedureDimension> procedures(SourceSnapshot source) {
        return logged(DimensionTable.build(
            "dim_procedures", source.procedures(), Procedure::procedureId,
            (key, p) -> new ProcedureDimension(key, p.procedureId(), p.cptCode(), p.cptDescription())
        ));
    }

    DimensionTable<String, EncounterTypeDimension> encounterTypes(SourceSnapshot source) {
        List<String> observed = source.encounters().stream()
            .map(Encounter::encounterType)
            .map(EncounterTypeDimension::normalize)
            .collect(Collectors.toList());
        return logged(DimensionTable.build(
            "dim_encounter_type", observed, Function.identity(), EncounterTypeDimension::new
        ));
    }

    List<DateDimension> dates(SourceSnapshot source) {
        TreeSet<LocalDate> distinct = source.encounters().stream()
            .map(Encounter::encounterDate)
            .filter(Objects::nonNull)
            .map(LocalDateTime::toLocalDate)
            .collect(Collectors.toCollection(TreeSet::new));
        List<DateDimension> rows = distinct.stream().map(DateDimension::of).collect(Collectors.toList());
        log.info("Built dim_date with {} rows", rows.size());
        return rows;
    }

    static String fullName(Provider provider) {
        return NAME_JOINER.join(provider.firstName(), provider.lastName()).trim();
    }

    static String credential(String credential) {
        return credential == null ? UNKNOWN_CREDENTIAL : credential.toUpperCase(Locale.ROOT);
    }

    static int ageOn(LocalDate dateOfBirth, LocalDate loadDate) {
        return Period.between(dateOfBirth, loadDate).getYears();
    }

    static String ageGroup(int age) {
        if (age < 18) {
            return "0-18";
        }
        if (age <= 65) {
            return "19-65";
        }
        return "65+";
    }

    private static String upper(String value) {
        return value == null ? null : value.toUpperCase(Locale.ROOT);
    }

    private <K extends Comparable<? super K>, R> DimensionTable<K, R> logged(DimensionTable<K, R> table) {
        log.info("Built {} with {} rows", table.getTableName(), table.size());
        return table;
    }
}
