package com.healthtech.olap.etl.config;

import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class EtlConfigTest {

    @Test
    void defaults_areValid() {
        EtlConfig config = new EtlConfig();

        assertDoesNotThrow(config::validateAndLog);
        assertEquals("healthtech_oltp.encounters", config.sourceTable("encounters"));
        assertEquals("healthtech_olap.fact_encounters", config.targetTable("fact_encounters"));
        assertEquals(10000, config.getBatchSize());
        assertEquals(30, config.getReadmissionWindowDays());
        assertEquals(Duration.ofHours(12), config.getStaleRunTimeout());
    }

    @Test
    void validate_reportsEveryProblem() {
        EtlConfig config = new EtlConfig();
        config.setTargetSchema("olap; DROP TABLE x");
        config.setBatchSize(0);
        config.setDimensionThreads(-1);
        config.setInpatientEncounterType(" ");
        config.setStaleRunTimeout(Duration.ZERO);

        IllegalStateException e = assertThrows(IllegalStateException.class, config::validateAndLog);

        assertTrue(e.getMessage().contains("etl.target-schema"));
        assertTrue(e.getMessage().contains("etl.batch-size"));
        assertTrue(e.getMessage().contains("etl.dimension-threads"));
        assertTrue(e.getMessage().contains("etl.inpatient-encounter-type"));
        assertTrue(e.getMessage().contains("etl.stale-run-timeout"));
    }

    @Test
    void validate_rejectsSourceAsTarget() {
        EtlConfig config = new EtlConfig();
        config.setTargetSchema("HEALTHTECH_OLTP");

        IllegalStateException e = assertThrows(IllegalStateException.class, config::validateAndLog);

        assertTrue(e.getMessage().contains("must differ"));
    }

    @Test
    void validate_rejectsNonPositiveWindow() {
        EtlConfig config = new EtlConfig();
        config.setReadmissionWindowDays(0);

        assertThrows(IllegalStateException.class, config::validateAndLog);
    }
}
