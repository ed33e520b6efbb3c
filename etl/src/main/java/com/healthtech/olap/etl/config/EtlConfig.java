package com.healthtech.olap.etl.config;

import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Configuration properties for the star schema ETL.
 *
 * Uses Spring Boot property binding with fail-fast validation. All properties use the "etl.*" prefix.
 */
@ConfigurationProperties(prefix = "etl")
public class EtlConfig {
    private static final Logger log = LoggerFactory.getLogger(EtlConfig.class);

    // schema names are spliced into SQL, so they must be plain identifiers
    private static final Pattern SCHEMA_NAME = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");

    private String sourceSchema = "healthtech_oltp";
    private String targetSchema = "healthtech_olap";
    private int batchSize = 10000;
    private int dimensionThreads = 4;
    private int readmissionWindowDays = 30;
    private String inpatientEncounterType = "INPATIENT";
    private boolean guardConcurrentRuns = true;
    private Duration staleRunTimeout = Duration.ofHours(12);
    private boolean initializeSchema = true;
    private boolean runOnStartup = true;
    private String summaryFile; // null = log only
    private boolean logReadmissionReport = false;

    @PostConstruct
    public void validateAndLog() {
        log.info("=== VALIDATING ETL CONFIGURATION ===");

        List<String> errors = new ArrayList<>();

        if (sourceSchema == null || !SCHEMA_NAME.matcher(sourceSchema).matches()) {
            errors.add("etl.source-schema must be a plain identifier, was: " + sourceSchema);
        }
        if (targetSchema == null || !SCHEMA_NAME.matcher(targetSchema).matches()) {
            errors.add("etl.target-schema must be a plain identifier, was: " + targetSchema);
        }
        if (sourceSchema != null && sourceSchema.equalsIgnoreCase(targetSchema)) {
            errors.add("etl.source-schema and etl.target-schema must differ; a full refresh would delete the source");
        }
        if (batchSize <= 0) {
            errors.add("etl.batch-size must be positive, was: " + batchSize);
        }
        if (dimensionThreads <= 0) {
            errors.add("etl.dimension-threads must be positive, was: " + dimensionThreads);
        }
        if (readmissionWindowDays <= 0) {
            errors.add("etl.readmission-window-days must be positive, was: " + readmissionWindowDays);
        }
        if (staleRunTimeout == null || staleRunTimeout.isZero() || staleRunTimeout.isNegative()) {
            errors.add("etl.stale-run-timeout must be positive, was: " + staleRunTimeout);
        }
        if (inpatientEncounterType == null || inpatientEncounterType.isBlank()) {
            errors.add("etl.inpatient-encounter-type is required");
        }

        if (!errors.isEmpty()) {
            String errorMsg = "ETL configuration validation failed:\n  - " + String.join("\n  - ", errors);
            log.error(errorMsg);
            throw new IllegalStateException(errorMsg);
        }

        log.info("=== EFFECTIVE ETL CONFIGURATION ===");
        log.info("Source schema: {}", sourceSchema);
        log.info("Target schema: {}", targetSchema);
        log.info("Batch size: {}", batchSize);
        log.info("Dimension threads: {}", dimensionThreads);
        log.info("Readmission window: {} days after a {} encounter", readmissionWindowDays, inpatientEncounterType);
        log.info("Guard concurrent runs: {} (stale after {})", guardConcurrentRuns, staleRunTimeout);
        log.info("Initialize schema: {}", initializeSchema);
        log.info("Summary file: {}", summaryFile != null ? summaryFile : "(none)");
    }

    public String getSourceSchema() {
        return sourceSchema;
    }

    public void setSourceSchema(String sourceSchema) {
        this.sourceSchema = sourceSchema;
    }

    public String getTargetSchema() {
        return targetSchema;
    }

    public void setTargetSchema(String targetSchema) {
        this.targetSchema = targetSchema;
    }

    public int getBatchSize() {
        return batchSize;
    }

    public void setBatchSize(int batchSize) {
        this.batchSize = batchSize;
    }

    public int getDimensionThreads() {
        return dimensionThreads;
    }

    public void setDimensionThreads(int dimensionThreads) {
        this.dimensionThreads = dimensionThreads;
    }

    public int getReadmissionWindowDays() {
        return readmissionWindowDays;
    }

    public void setReadmissionWindowDays(int readmissionWindowDays) {
        this.readmissionWindowDays = readmissionWindowDays;
    }

    public String getInpatientEncounterType() {
        return inpatientEncounterType;
    }

    public void setInpatientEncounterType(String inpatientEncounterType) {
        this.inpatientEncounterType = inpatientEncounterType;
    }

    public boolean isGuardConcurrentRuns() {
        return guardConcurrentRuns;
    }

    public void setGuardConcurrentRuns(boolean guardConcurrentRuns) {
        this.guardConcurrentRuns = guardConcurrentRuns;
    }

    /**
     * How long a run may stay RUNNING before the concurrent-run guard treats it as abandoned.
     */
    public Duration getStaleRunTimeout() {
        return staleRunTimeout;
    }

    public void setStaleRunTimeout(Duration staleRunTimeout) {
        this.staleRunTimeout = staleRunTimeout;
    }

    public boolean isInitializeSchema() {
        return initializeSchema;
    }

    public void setInitializeSchema(boolean initializeSchema) {
        this.initializeSchema = initializeSchema;
    }

    public boolean isRunOnStartup() {
        return runOnStartup;
    }

    public void setRunOnStartup(boolean runOnStartup) {
        this.runOnStartup = runOnStartup;
    }

    public String getSummaryFile() {
        return summaryFile;
    }

    public void setSummaryFile(String summaryFile) {
        this.summaryFile = summaryFile;
    }

    public boolean isLogReadmissionReport() {
        return logReadmissionReport;
    }

    public void setLogReadmissionReport(boolean logReadmissionReport) {
        this.logReadmissionReport = logReadmissionReport;
    }

    /**
     * Qualifies a source table name with the configured source schema.
     */
    public String sourceTable(String table) {
        return sourceSchema + "." + table;
    }

    /**
     * Qualifies a target table name with the configured target schema.
     */
    public String targetTable(String table) {
        return targetSchema + "." + table;
    }
}
