package com.healthtech.olap.etl.run;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.healthtech.olap.etl.config.EtlConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;

/**
 * JSONL sink for run summaries.
 *
 * Every summary is logged. When etl.summary-file is set it is also appended to that file, one JSON object per line, so monitoring can
 * tail it. A summary that cannot be written is logged and does not fail the run.
 */
@Component
public class RunSummaryWriter {
    private static final Logger log = LoggerFactory.getLogger(RunSummaryWriter.class);

    private final EtlConfig config;
    private final ObjectMapper mapper;

    public RunSummaryWriter(EtlConfig config) {
        this.config = config;
        this.mapper = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
    }

    public synchronized void write(RunSummary summary) {
        try {
            String json = mapper.writeValueAsString(summary);
            log.info("ETL run summary: {}", json);

            if (config.getSummaryFile() != null) {
                Path file = Path.of(config.getSummaryFile());
                try (BufferedWriter writer = Files.newBufferedWriter(file, StandardCharsets.UTF_8,
                    StandardOpenOption.CREATE,
                    StandardOpenOption.APPEND,
                    StandardOpenOption.WRITE)) {
                    writer.write(json);
                    writer.newLine();
                }
            }
        } catch (IOException e) {
            log.error("Failed to write summary of ETL run {}", summary.runId(), e);
        }
    }
}
