package com.healthtech.olap.etl.target;

import com.healthtech.olap.data.star.*;
import com.healthtech.olap.etl.config.EtlConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.ParameterizedPreparedStatementSetter;
import org.springframework.stereotype.Component;
import org.springframework.transaction.support.TransactionTemplate;

import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.sql.Types;
import java.util.Collections;
import java.util.List;

/**
 * Publishes a staged star schema in one transaction: every bridge, fact and dimension row is deleted, children first, and the staged
 * rows are batch inserted, parents first.
 *
 * Rows are deleted rather than truncated because TRUNCATE commits implicitly on MySQL. Readers of the target schema therefore see the
 * previous load until the new one commits, and a failed publish leaves the previous load in place.
 */
@Component
public class JdbcStarSchemaPublisher implements StarSchemaPublisher {

    private static final Logger log = LoggerFactory.getLogger(JdbcStarSchemaPublisher.class);

    static final List<String> DELETE_ORDER = List.of(
        "bridge_encounter_procedures",
        "bridge_encounter_diagnoses",
        "fact_encounters",
        "dim_date",
        "dim_encounter_type",
        "dim_procedures",
        "dim_diagnoses",
        "dim_patient",
        "dim_provider",
        "dim_department",
        "dim_specialty"
    );

    private final JdbcTemplate template;
    private final TransactionTemplate transactionTemplate;
    private final EtlConfig config;

    public JdbcStarSchemaPublisher(JdbcTemplate template, TransactionTemplate transactionTemplate, EtlConfig config) {
        this.template = template;
        this.transactionTemplate = transactionTemplate;
        this.config = config;
    }

    @Override
    public PublishResult publish(StarSchema schema) {
        PublishResult result = transactionTemplate.execute(status -> {
            int deleted = deleteAll();
            int inserted = insertAll(schema);
            return new PublishResult(deleted, inserted);
        });
        log.info("Published star schema to {}: {} rows replaced by {}", config.getTargetSchema(), result.rowsDeleted(),
            result.rowsInserted());
        return result;
    }

    private int deleteAll() {
        int deleted = 0;
        for (String table : DELETE_ORDER) {
            int rows = template.update("DELETE FROM " + config.targetTable(table));
            log.debug("Deleted {} rows from {}", rows, table);
            deleted += rows;
        }
        return deleted;
    }

    private int insertAll(StarSchema schema) {
        DimensionSet dimensions = schema.dimensions();
        int inserted = 0;

        inserted += insert(
            "dim_specialty", "specialty_key, specialty_id, specialty_name, specialty_code", dimensions.specialties().getRows(),
            (ps, row) -> {
                ps.setInt(1, row.specialtyKey());
                ps.setInt(2, row.specialtyId());
                ps.setString(3, row.specialtyName());
                ps.setString(4, row.specialtyCode());
            }
        );
        inserted += insert(
            "dim_department", "department_key, department_id, department_name, floor, capacity", dimensions.departments().getRows(),
            (ps, row) -> {
                ps.setInt(1, row.departmentKey());
                ps.setInt(2, row.departmentId());
                ps.setString(3, row.departmentName());
                setNullableInt(ps, 4, row.floor());
                setNullableInt(ps, 5, row.capacity());
            }
        );
        inserted += insert(
            "dim_provider", "provider_key, provider_id, full_name, credential", dimensions.providers().getRows(),
            (ps, row) -> {
                ps.setInt(1, row.providerKey());
                ps.setInt(2, row.providerId());
                ps.setString(3, row.fullName());
                ps.setString(4, row.credential());
            }
        );
        inserted += insert(
            "dim_patient", "patient_key, patient_id, first_name, last_name, gender, date_of_birth, mrn, current_age, age_group",
            dimensions.patients().getRows(),
            (ps, row) -> {
                ps.setInt(1, row.patientKey());
                ps.setInt(2, row.patientId());
                ps.setString(3, row.firstName());
                ps.setString(4, row.lastName());
                ps.setString(5, row.gender());
                ps.setObject(6, row.dateOfBirth(), Types.DATE);
                ps.setString(7, row.mrn());
                ps.setInt(8, row.currentAge());
                ps.setString(9, row.ageGroup());
            }
        );
        inserted += insert(
            "dim_diagnoses", "diagnosis_key, diagnosis_id, icd10_code, icd10_description", dimensions.diagnoses().getRows(),
            (ps, row) -> {
                ps.setInt(1, row.diagnosisKey());
                ps.setInt(2, row.diagnosisId());
                ps.setString(3, row.icd10Code());
                ps.setString(4, row.icd10Description());
            }
        );
        inserted += insert(
            "dim_procedures", "procedure_key, procedure_id, cpt_code, cpt_description", dimensions.procedures().getRows(),
            (ps, row) -> {
                ps.setInt(1, row.procedureKey());
                ps.setInt(2, row.procedureId());
                ps.setString(3, row.cptCode());
                ps.setString(4, row.cptDescription());
            }
        );
        inserted += insert(
            "dim_encounter_type", "encounter_type_key, encounter_type_name", dimensions.encounterTypes().getRows(),
            (ps, row) -> {
                ps.setInt(1, row.encounterTypeKey());
                ps.setString(2, row.encounterTypeName());
            }
        );
        inserted += insert(
            "dim_date", "date_key, full_date, year, quarter, month, month_name, week_of_year, day_of_month, day_name, is_weekend",
            dimensions.dates(),
            (ps, row) -> {
                ps.setInt(1, row.dateKey());
                ps.setObject(2, row.fullDate(), Types.DATE);
                ps.setInt(3, row.year());
                ps.setInt(4, row.quarter());
                ps.setInt(5, row.month());
                ps.setString(6, row.monthName());
                ps.setInt(7, row.weekOfYear());
                ps.setInt(8, row.dayOfMonth());
                ps.setString(9, row.dayName());
                ps.setBoolean(10, row.weekend());
            }
        );
        inserted += insert(
            "fact_encounters",
            "encounter_key, encounter_id, date_key, patient_key, provider_key, specialty_key, department_key, encounter_type_key, "
                + "is_readmission, total_claim_amount, total_allowed_amount, length_of_stay_days, diagnosis_count, procedure_count",
            schema.facts(),
            (ps, row) -> {
                ps.setInt(1, row.getEncounterKey());
                ps.setInt(2, row.getEncounterId());
                ps.setInt(3, row.getDateKey());
                ps.setInt(4, row.getPatientKey());
                ps.setInt(5, row.getProviderKey());
                ps.setInt(6, row.getSpecialtyKey());
                ps.setInt(7, row.getDepartmentKey());
                ps.setInt(8, row.getEncounterTypeKey());
                ps.setBoolean(9, row.isReadmission());
                ps.setBigDecimal(10, row.getTotalClaimAmount());
                ps.setBigDecimal(11, row.getTotalAllowedAmount());
                ps.setInt(12, row.getLengthOfStayDays());
                ps.setInt(13, row.getDiagnosisCount());
                ps.setInt(14, row.getProcedureCount());
            }
        );
        inserted += insert(
            "bridge_encounter_diagnoses", "encounter_key, diagnosis_key, diagnosis_sequence", schema.diagnosisBridges(),
            (ps, row) -> {
                ps.setInt(1, row.encounterKey());
                ps.setInt(2, row.diagnosisKey());
                setNullableInt(ps, 3, row.diagnosisSequence());
            }
        );
        inserted += insert(
            "bridge_encounter_procedures", "encounter_key, procedure_key, procedure_date", schema.procedureBridges(),
            (ps, row) -> {
                ps.setInt(1, row.encounterKey());
                ps.setInt(2, row.procedureKey());
                ps.setObject(3, row.procedureDate(), Types.DATE);
            }
        );
        return inserted;
    }

    private <T> int insert(String table, String columns, List<T> rows, ParameterizedPreparedStatementSetter<T> setter) {
        if (rows.isEmpty()) {
            return 0;
        }
        String placeholders = String.join(", ", Collections.nCopies(columns.split(",").length, "?"));
        String sql = "INSERT INTO " + config.targetTable(table) + " (" + columns + ") VALUES (" + placeholders + ")";
        template.batchUpdate(sql, rows, config.getBatchSize(), setter);
        log.debug("Inserted {} rows into {}", rows.size(), table);
        return rows.size();
    }

    private static void setNullableInt(PreparedStatement ps, int index, Integer value) throws SQLException {
        if (value == null) {
            ps.setNull(index, Types.INTEGER);
        } else {
            ps.setInt(index, value);
        }
    }
}
