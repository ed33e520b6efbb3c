package com.healthtech.olap.etl.source;

import com.healthtech.olap.data.source.*;
import com.healthtech.olap.etl.config.EtlConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.List;

/**
 * Reads every OLTP table the star schema is built from. Each table is read ordered by its natural key so surrogate key assignment
 * downstream is the same on every run.
 */
@Component
public class JdbcOltpSourceReader implements OltpSourceReader {

    private static final Logger log = LoggerFactory.getLogger(JdbcOltpSourceReader.class);

    private final JdbcTemplate template;
    private final EtlConfig config;

    public JdbcOltpSourceReader(JdbcTemplate template, EtlConfig config) {
        this.template = template;
        this.config = config;
    }

    @Override
    public SourceSnapshot read() {
        log.info("Extracting source tables from schema {}", config.getSourceSchema());
        SourceSnapshot snapshot = SourceSnapshot.builder()
            .specialties(readSpecialties())
            .departments(readDepartments())
            .providers(readProviders())
            .patients(readPatients())
            .diagnoses(readDiagnoses())
            .procedures(readProcedures())
            .encounters(readEncounters())
            .encounterDiagnoses(readEncounterDiagnoses())
            .encounterProcedures(readEncounterProcedures())
            .billing(readBilling())
            .build();
        log.info(
            "Extracted {} encounters, {} patients, {} providers, {} diagnosis links, {} procedure links, {} billing lines",
            snapshot.encounters().size(), snapshot.patients().size(), snapshot.providers().size(),
            snapshot.encounterDiagnoses().size(), snapshot.encounterProcedures().size(), snapshot.billing().size()
        );
        return snapshot;
    }

    List<Specialty> readSpecialties() {
        return template.query(
            "SELECT specialty_id, specialty_name, specialty_code FROM " + config.sourceTable("specialties") + " ORDER BY specialty_id",
            (rs, rowNum) -> new Specialty(rs.getInt("specialty_id"), rs.getString("specialty_name"), rs.getString("specialty_code"))
        );
    }

    List<Department> readDepartments() {
        return template.query(
            "SELECT department_id, department_name, floor, capacity FROM " + config.sourceTable("departments")
                + " ORDER BY department_id",
            (rs, rowNum) -> new Department(
                rs.getInt("department_id"),
                rs.getString("department_name"),
                rs.getObject("floor", Integer.class),
                rs.getObject("capacity", Integer.class)
            )
        );
    }

    List<Provider> readProviders() {
        return template.query(
            "SELECT provider_id, first_name, last_name, credential, specialty_id FROM " + config.sourceTable("providers")
                + " ORDER BY provider_id",
            (rs, rowNum) -> new Provider(
                rs.getInt("provider_id"),
                rs.getString("first_name"),
                rs.getString("last_name"),
                rs.getString("credential"),
                rs.getObject("specialty_id", Integer.class)
            )
        );
    }

    List<Patient> readPatients() {
        return template.query(
            "SELECT patient_id, first_name, last_name, gender, date_of_birth, mrn FROM " + config.sourceTable("patients")
                + " ORDER BY patient_id",
            (rs, rowNum) -> new Patient(
                rs.getInt("patient_id"),
                rs.getString("first_name"),
                rs.getString("last_name"),
                rs.getString("gender"),
                rs.getObject("date_of_birth", LocalDate.class),
                rs.getString("mrn")
            )
        );
    }

    List<Diagnosis> readDiagnoses() {
        return template.query(
            "SELECT diagnosis_id, icd10_code, icd10_description FROM " + config.sourceTable("diagnoses") + " ORDER BY diagnosis_id",
            (rs, rowNum) -> new Diagnosis(rs.getInt("diagnosis_id"), rs.getString("icd10_code"), rs.getString("icd10_description"))
        );
    }

    List<Procedure> readProcedures() {
        return template.query(
            "SELECT procedure_id, cpt_code, cpt_description FROM " + config.sourceTable("procedures") + " ORDER BY procedure_id",
            (rs, rowNum) -> new Procedure(rs.getInt("procedure_id"), rs.getString("cpt_code"), rs.getString("cpt_description"))
        );
    }

    List<Encounter> readEncounters() {
        return template.query(
            "SELECT encounter_id, patient_id, provider_id, department_id, encounter_type, encounter_date, discharge_date FROM "
                + config.sourceTable("encounters") + " ORDER BY encounter_id",
            (rs, rowNum) -> new Encounter(
                rs.getInt("encounter_id"),
                rs.getObject("patient_id", Integer.class),
                rs.getObject("provider_id", Integer.class),
                rs.getObject("department_id", Integer.class),
                rs.getString("encounter_type"),
                rs.getObject("encounter_date", LocalDateTime.class),
                rs.getObject("discharge_date", LocalDateTime.class)
            )
        );
    }

    List<EncounterDiagnosis> readEncounterDiagnoses() {
        return template.query(
            "SELECT encounter_id, diagnosis_id, diagnosis_sequence FROM " + config.sourceTable("encounter_diagnoses")
                + " WHERE encounter_id IS NOT NULL AND diagnosis_id IS NOT NULL ORDER BY encounter_id, diagnosis_id",
            (rs, rowNum) -> new EncounterDiagnosis(
                rs.getInt("encounter_id"),
                rs.getInt("diagnosis_id"),
                rs.getObject("diagnosis_sequence", Integer.class)
            )
        );
    }

    List<EncounterProcedure> readEncounterProcedures() {
        return template.query(
            "SELECT encounter_id, procedure_id, procedure_date FROM " + config.sourceTable("encounter_procedures")
                + " WHERE encounter_id IS NOT NULL AND procedure_id IS NOT NULL ORDER BY encounter_id, procedure_id",
            (rs, rowNum) -> new EncounterProcedure(
                rs.getInt("encounter_id"),
                rs.getInt("procedure_id"),
                rs.getObject("procedure_date", LocalDate.class)
            )
        );
    }

    List<BillingLine> readBilling() {
        return template.query(
            "SELECT billing_id, encounter_id, claim_amount, allowed_amount, claim_date FROM " + config.sourceTable("billing")
                + " ORDER BY billing_id",
            (rs, rowNum) -> new BillingLine(
                rs.getInt("billing_id"),
                rs.getObject("encounter_id", Integer.class),
                rs.getObject("claim_amount", BigDecimal.class),
                rs.getObject("allowed_amount", BigDecimal.class),
                rs.getObject("claim_date", LocalDate.class)
            )
        );
    }
}
