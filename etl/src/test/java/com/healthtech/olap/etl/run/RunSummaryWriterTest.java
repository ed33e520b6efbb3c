package com.healthtech.olap.etl.run;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.healthtech.olap.data.run.RunStatus;
import com.healthtech.olap.etl.config.EtlConfig;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDateTime;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class RunSummaryWriterTest {

    @TempDir
    Path tempDir;

    private static RunSummary summary(long runId, RunStatus status, String error) {
        return new RunSummary(
            runId, LocalDateTime.of(2024, 6, 1, 2, 0), LocalDateTime.of(2024, 6, 1, 2, 1, 5), 65L, status, 6,
            status == RunStatus.SUCCESS ? "COMPLETED" : "FACT_TABLE_LOADED", error
        );
    }

    @Test
    void shouldAppendOneJsonLinePerRun() throws IOException {
        Path file = tempDir.resolve("runs.jsonl");
        EtlConfig config = new EtlConfig();
        config.setSummaryFile(file.toString());
        RunSummaryWriter writer = new RunSummaryWriter(config);

        writer.write(summary(1, RunStatus.SUCCESS, null));
        writer.write(summary(2, RunStatus.FAILED, "ETL run 2 failed after phase FACT_TABLE_LOADED: boom"));

        List<String> lines = Files.readAllLines(file);
        assertEquals(2, lines.size());

        JsonNode first = new ObjectMapper().readTree(lines.get(0));
        assertEquals(1, first.get("runId").asLong());
        assertEquals("SUCCESS", first.get("status").asText());
        assertEquals("2024-06-01T02:00:00", first.get("runStart").asText());
        assertEquals(65, first.get("durationSeconds").asLong());

        JsonNode second = new ObjectMapper().readTree(lines.get(1));
        assertEquals("FACT_TABLE_LOADED", second.get("phase").asText());
        assertTrue(second.get("errorMessage").asText().endsWith("boom"));
    }

    @Test
    void shouldNotFailTheRunWhenTheFileCannotBeWritten() {
        EtlConfig config = new EtlConfig();
        config.setSummaryFile(tempDir.toString());
        RunSummaryWriter writer = new RunSummaryWriter(config);

        assertDoesNotThrow(() -> writer.write(summary(3, RunStatus.SUCCESS, null)));
    }

    @Test
    void shouldOnlyLogWithoutSummaryFile() {
        RunSummaryWriter writer = new RunSummaryWriter(new EtlConfig());

        assertDoesNotThrow(() -> writer.write(summary(4, RunStatus.SUCCESS, null)));
    }
}
