package com.healthtech.olap.etl.report;

import com.healthtech.olap.data.star.EncounterTypeDimension;
import com.healthtech.olap.etl.config.EtlConfig;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Read-only analytic queries over the published star schema.
 *
 * Percentages are rounded to two decimals in Java rather than in SQL so MySQL and H2 return the same scale.
 */
@Repository
public class StarSchemaReportRepository {

    private final JdbcTemplate template;
    private final EtlConfig config;

    public StarSchemaReportRepository(JdbcTemplate template, EtlConfig config) {
        this.template = template;
        this.config = config;
    }

    /**
     * Encounters and distinct patients per month, specialty and encounter type, newest month first.
     */
    public List<MonthlyEncounters> monthlyEncountersBySpecialty() {
        String sql = "SELECT d.year, d.month, d.month_name, s.specialty_name, et.encounter_type_name, "
            + "COUNT(*) AS total_encounters, COUNT(DISTINCT f.patient_key) AS unique_patients "
            + "FROM " + t("fact_encounters") + " f "
            + "JOIN " + t("dim_date") + " d ON f.date_key = d.date_key "
            + "JOIN " + t("dim_specialty") + " s ON f.specialty_key = s.specialty_key "
            + "JOIN " + t("dim_encounter_type") + " et ON f.encounter_type_key = et.encounter_type_key "
            + "GROUP BY d.year, d.month, d.month_name, s.specialty_name, et.encounter_type_name "
            + "ORDER BY d.year DESC, d.month DESC, s.specialty_name, et.encounter_type_name";
        return template.query(sql, (rs, rowNum) -> new MonthlyEncounters(
            rs.getInt("year"),
            rs.getInt("month"),
            rs.getString("month_name"),
            rs.getString("specialty_name"),
            rs.getString("encounter_type_name"),
            rs.getLong("total_encounters"),
            rs.getLong("unique_patients")
        ));
    }

    /**
     * Diagnosis and procedure combinations recorded on the same encounter, most frequent first.
     */
    public List<DiagnosisProcedurePair> topDiagnosisProcedurePairs(int minEncounters, int limit) {
        String sql = "SELECT dx.icd10_code, dx.icd10_description, pr.cpt_code, pr.cpt_description, "
            + "COUNT(DISTINCT bed.encounter_key) AS encounter_count "
            + "FROM " + t("bridge_encounter_diagnoses") + " bed "
            + "JOIN " + t("bridge_encounter_procedures") + " bep ON bed.encounter_key = bep.encounter_key "
            + "JOIN " + t("dim_diagnoses") + " dx ON bed.diagnosis_key = dx.diagnosis_key "
            + "JOIN " + t("dim_procedures") + " pr ON bep.procedure_key = pr.procedure_key "
            + "GROUP BY dx.icd10_code, dx.icd10_description, pr.cpt_code, pr.cpt_description "
            + "HAVING COUNT(DISTINCT bed.encounter_key) >= ? "
            + "ORDER BY encounter_count DESC, dx.icd10_code, pr.cpt_code "
            + "LIMIT ?";
        return template.query(sql, (rs, rowNum) -> new DiagnosisProcedurePair(
            rs.getString("icd10_code"),
            rs.getString("icd10_description"),
            rs.getString("cpt_code"),
            rs.getString("cpt_description"),
            rs.getLong("encounter_count")
        ), minEncounters, limit);
    }

    /**
     * Share of inpatient encounters flagged as readmissions, per specialty with at least {@code minInpatientEncounters}. Only inpatient
     * encounters are counted here, although the flag itself is set on every encounter type.
     */
    public List<ReadmissionRate> readmissionRateBySpecialty(int minInpatientEncounters) {
        String sql = "SELECT s.specialty_name, COUNT(*) AS total_inpatient_encounters, "
            + "SUM(CASE WHEN f.is_readmission THEN 1 ELSE 0 END) AS readmissions "
            + "FROM " + t("fact_encounters") + " f "
            + "JOIN " + t("dim_specialty") + " s ON f.specialty_key = s.specialty_key "
            + "JOIN " + t("dim_encounter_type") + " et ON f.encounter_type_key = et.encounter_type_key "
            + "WHERE et.encounter_type_name = ? "
            + "GROUP BY s.specialty_name "
            + "HAVING COUNT(*) >= ?";
        List<ReadmissionRate> rates = template.query(sql, (rs, rowNum) -> {
            long total = rs.getLong("total_inpatient_encounters");
            long readmissions = rs.getLong("readmissions");
            return new ReadmissionRate(rs.getString("specialty_name"), total, readmissions, percentage(readmissions, total));
        }, EncounterTypeDimension.normalize(config.getInpatientEncounterType()), minInpatientEncounters);
        return rates.stream()
            .sorted(Comparator.comparing(ReadmissionRate::readmissionRatePct).reversed().thenComparing(ReadmissionRate::specialtyName))
            .collect(Collectors.toList());
    }

    /**
     * Claimed and allowed totals per month and specialty over the encounters of {@code year} that carry a claim.
     */
    public List<MonthlyRevenue> revenueBySpecialtyAndMonth(int year) {
        String sql = "SELECT d.year, d.month, d.month_name, s.specialty_name, COUNT(*) AS encounters_with_billing, "
            + "SUM(f.total_claim_amount) AS total_claimed, SUM(f.total_allowed_amount) AS total_allowed "
            + "FROM " + t("fact_encounters") + " f "
            + "JOIN " + t("dim_date") + " d ON f.date_key = d.date_key "
            + "JOIN " + t("dim_specialty") + " s ON f.specialty_key = s.specialty_key "
            + "WHERE d.year = ? AND f.total_claim_amount > 0 "
            + "GROUP BY d.year, d.month, d.month_name, s.specialty_name "
            + "ORDER BY d.month, total_allowed DESC, s.specialty_name";
        return template.query(sql, (rs, rowNum) -> {
            long encounters = rs.getLong("encounters_with_billing");
            BigDecimal claimed = rs.getBigDecimal("total_claimed");
            BigDecimal allowed = rs.getBigDecimal("total_allowed");
            return new MonthlyRevenue(
                rs.getInt("year"),
                rs.getInt("month"),
                rs.getString("month_name"),
                rs.getString("specialty_name"),
                encounters,
                claimed,
                allowed,
                allowed.divide(BigDecimal.valueOf(encounters), 2, RoundingMode.HALF_UP),
                allowed.multiply(BigDecimal.valueOf(100)).divide(claimed, 2, RoundingMode.HALF_UP)
            );
        }, year);
    }

    static BigDecimal percentage(long part, long whole) {
        if (whole == 0) {
            return BigDecimal.ZERO.setScale(2, RoundingMode.UNNECESSARY);
        }
        return BigDecimal.valueOf(part * 100L).divide(BigDecimal.valueOf(whole), 2, RoundingMode.HALF_UP);
    }

    private String t(String table) {
        return config.targetTable(table);
    }
}
