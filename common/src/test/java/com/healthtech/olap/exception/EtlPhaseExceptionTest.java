package com.healthtech.olap.exception;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class EtlPhaseExceptionTest {

    @Test
    void shouldCarryRunAndPhaseInMessage() {
        IllegalStateException cause = new IllegalStateException("duplicate key");
        EtlPhaseException e = new EtlPhaseException(7L, "FACT_TABLE_LOADED", cause);

        assertEquals(7L, e.getRunId());
        assertEquals("FACT_TABLE_LOADED", e.getPhase());
        assertSame(cause, e.getCause());
        assertEquals("ETL run 7 failed after phase FACT_TABLE_LOADED: duplicate key", e.getMessage());
    }

    @Test
    void shouldFallBackToExceptionTypeWhenCauseHasNoMessage() {
        EtlPhaseException e = new EtlPhaseException(1L, "INITIALIZATION", new NullPointerException());

        assertTrue(e.getMessage().endsWith("NullPointerException"));
    }
}
