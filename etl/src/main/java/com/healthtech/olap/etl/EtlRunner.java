package com.healthtech.olap.etl;

import com.healthtech.olap.etl.config.EtlConfig;
import com.healthtech.olap.etl.report.ReadmissionRate;
import com.healthtech.olap.etl.report.StarSchemaReportRepository;
import com.healthtech.olap.etl.run.RunSummary;
import com.healthtech.olap.etl.target.StarSchemaInitializer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/**
 * Runs one refresh when the application starts. An exception escapes so the process exits non-zero.
 */
@Component
@ConditionalOnProperty(prefix = "etl", name = "run-on-startup", havingValue = "true", matchIfMissing = true)
public class EtlRunner implements ApplicationRunner {
    private static final Logger log = LoggerFactory.getLogger(EtlRunner.class);

    // specialties with fewer inpatient encounters are left out of the logged report
    static final int REPORT_MIN_INPATIENT_ENCOUNTERS = 10;

    private final EtlConfig config;
    private final StarSchemaInitializer initializer;
    private final EtlPipeline pipeline;
    private final StarSchemaReportRepository reports;

    public EtlRunner(EtlConfig config, StarSchemaInitializer initializer, EtlPipeline pipeline, StarSchemaReportRepository reports) {
        this.config = config;
        this.initializer = initializer;
        this.pipeline = pipeline;
        this.reports = reports;
    }

    @Override
    public void run(ApplicationArguments args) throws Exception {
        if (config.isInitializeSchema()) {
            initializer.initialize();
        }

        RunSummary summary = pipeline.run();
        log.info("ETL run {} completed in {}s with {} fact rows", summary.runId(), summary.durationSeconds(), summary.recordsProcessed());

        if (config.isLogReadmissionReport()) {
            log.info("=== {}-DAY READMISSION RATE BY SPECIALTY ===", config.getReadmissionWindowDays());
            for (ReadmissionRate rate : reports.readmissionRateBySpecialty(REPORT_MIN_INPATIENT_ENCOUNTERS)) {
                log.info("{}: {} of {} inpatient encounters ({}%)", rate.specialtyName(), rate.readmissions(),
                    rate.totalInpatientEncounters(), rate.readmissionRatePct());
            }
        }
    }
}
