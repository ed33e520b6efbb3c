package com.healthtech.olap.etl.run;

import com.healthtech.olap.data.run.EtlPhase;
import com.healthtech.olap.data.run.EtlRun;
import com.healthtech.olap.data.run.RunStatus;
import com.healthtech.olap.etl.TestDatabase;
import com.healthtech.olap.etl.config.EtlConfig;
import com.healthtech.olap.exception.RunAlreadyInProgressException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class JdbcRunTrackerTest {

    private static final Instant START = Instant.parse("2024-06-01T02:00:00Z");

    private final EtlConfig config = new EtlConfig();
    private TestDatabase database;
    private Clock clock;
    private JdbcRunTracker tracker;

    @BeforeEach
    void setUp() throws IOException {
        database = TestDatabase.create("run-tracker", config);
        clock = mock(Clock.class);
        when(clock.getZone()).thenReturn(ZoneOffset.UTC);
        when(clock.instant()).thenReturn(START, START.plusSeconds(42));
        tracker = new JdbcRunTracker(database.getTemplate(), config, clock);
    }

    @AfterEach
    void tearDown() {
        database.shutdown();
    }

    @Test
    void start_opensRunningRun() {
        long runId = tracker.start();

        EtlRun run = tracker.find(runId).orElseThrow();
        assertEquals(RunStatus.RUNNING, run.status());
        assertEquals(EtlPhase.INITIALIZATION.name(), run.phase());
        assertEquals(LocalDateTime.of(2024, 6, 1, 2, 0), run.runStart());
        assertNull(run.runEnd());
        assertNull(run.recordsProcessed());
        assertNull(run.durationSeconds());
    }

    @Test
    void advance_keepsRecordCountWhenNoneGiven() {
        long runId = tracker.start();

        tracker.advance(runId, EtlPhase.FACT_TABLE_LOADED, 6);
        tracker.advance(runId, EtlPhase.READMISSIONS_FLAGGED, null);

        EtlRun run = tracker.find(runId).orElseThrow();
        assertEquals(EtlPhase.READMISSIONS_FLAGGED.name(), run.phase());
        assertEquals(Integer.valueOf(6), run.recordsProcessed());
    }

    @Test
    void complete_successMovesToCompleted() {
        long runId = tracker.start();
        tracker.advance(runId, EtlPhase.PUBLISHED, null);

        tracker.complete(runId, RunStatus.SUCCESS, null);

        EtlRun run = tracker.find(runId).orElseThrow();
        assertEquals(RunStatus.SUCCESS, run.status());
        assertEquals(EtlPhase.COMPLETED.name(), run.phase());
        assertEquals(Long.valueOf(42), run.durationSeconds());
        assertNull(run.errorMessage());
    }

    @Test
    void complete_failureKeepsLastPhase() {
        long runId = tracker.start();
        tracker.advance(runId, EtlPhase.ALL_DIMENSIONS_LOADED, null);

        tracker.complete(runId, RunStatus.FAILED, "boom");

        EtlRun run = tracker.find(runId).orElseThrow();
        assertEquals(RunStatus.FAILED, run.status());
        assertEquals(EtlPhase.ALL_DIMENSIONS_LOADED.name(), run.phase());
        assertEquals("boom", run.errorMessage());
        assertNotNull(run.runEnd());
    }

    @Test
    void complete_rejectsRunningStatus() {
        long runId = tracker.start();

        assertThrows(IllegalArgumentException.class, () -> tracker.complete(runId, RunStatus.RUNNING, null));
    }

    @Test
    void start_refusesWhileAnotherRunIsRunning() {
        long first = tracker.start();

        RunAlreadyInProgressException e = assertThrows(RunAlreadyInProgressException.class, () -> tracker.start());
        assertEquals(first, e.getRunningRunId());

        tracker.complete(first, RunStatus.FAILED, "abandoned");
        long second = tracker.start();
        assertTrue(second > first);
    }

    @Test
    void start_closesRunsLeftRunningPastTheStaleTimeout() {
        when(clock.instant()).thenReturn(START, START.plus(Duration.ofHours(13)));
        long crashed = tracker.start();
        tracker.advance(crashed, EtlPhase.ALL_DIMENSIONS_LOADED, null);

        long next = tracker.start();

        EtlRun abandoned = tracker.find(crashed).orElseThrow();
        assertEquals(RunStatus.FAILED, abandoned.status());
        assertEquals(EtlPhase.ALL_DIMENSIONS_LOADED.name(), abandoned.phase());
        assertEquals("Abandoned: still RUNNING after PT12H", abandoned.errorMessage());
        assertEquals(LocalDateTime.of(2024, 6, 1, 15, 0), abandoned.runEnd());
        assertEquals(RunStatus.RUNNING, tracker.find(next).orElseThrow().status());
    }

    @Test
    void start_keepsRefusingWithinTheStaleTimeout() {
        config.setStaleRunTimeout(Duration.ofHours(1));
        when(clock.instant()).thenReturn(START, START.plus(Duration.ofMinutes(59)));
        long first = tracker.start();

        assertThrows(RunAlreadyInProgressException.class, () -> tracker.start());
        assertEquals(RunStatus.RUNNING, tracker.find(first).orElseThrow().status());
    }

    @Test
    void start_allowsOverlapWhenGuardIsOff() {
        config.setGuardConcurrentRuns(false);

        long first = tracker.start();
        long second = tracker.start();

        assertNotEquals(first, second);
        assertEquals(2, database.count(config.targetTable("etl_control")));
    }

    @Test
    void find_unknownRun() {
        assertTrue(tracker.find(12345L).isEmpty());
    }
}
