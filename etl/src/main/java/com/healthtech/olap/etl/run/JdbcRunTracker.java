package com.healthtech.olap.etl.run;

import com.google.common.base.Preconditions;
import com.healthtech.olap.data.run.EtlPhase;
import com.healthtech.olap.data.run.EtlRun;
import com.healthtech.olap.data.run.RunStatus;
import com.healthtech.olap.etl.config.EtlConfig;
import com.healthtech.olap.exception.RunAlreadyInProgressException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.support.GeneratedKeyHolder;
import org.springframework.jdbc.support.KeyHolder;
import org.springframework.stereotype.Component;

import java.sql.PreparedStatement;
import java.sql.Types;
import java.time.Clock;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

/**
 * Run tracking on the etl_control table of the target schema.
 */
@Component
public class JdbcRunTracker implements RunTracker {

    private static final Logger log = LoggerFactory.getLogger(JdbcRunTracker.class);

    private static final RowMapper<EtlRun> RUN_MAPPER = (rs, rowNum) -> new EtlRun(
        rs.getLong("etl_run_id"),
        rs.getObject("run_start_datetime", LocalDateTime.class),
        rs.getObject("run_end_datetime", LocalDateTime.class),
        RunStatus.valueOf(rs.getString("status")),
        rs.getObject("records_processed", Integer.class),
        rs.getString("error_message"),
        rs.getString("etl_phase")
    );

    private final JdbcTemplate template;
    private final EtlConfig config;
    private final Clock clock;

    public JdbcRunTracker(JdbcTemplate template, EtlConfig config, Clock clock) {
        this.template = template;
        this.config = config;
        this.clock = clock;
    }

    /**
     * Opens a RUNNING run. With the concurrent-run guard on, runs RUNNING for longer than the stale-run timeout are first closed as
     * FAILED, and any other RUNNING run refuses the start.
     */
    @Override
    public long start() {
        String table = config.targetTable("etl_control");
        LocalDateTime now = LocalDateTime.now(clock);
        if (config.isGuardConcurrentRuns()) {
            failStaleRuns(table, now);
            List<Long> running = template.queryForList(
                "SELECT etl_run_id FROM " + table + " WHERE status = ? ORDER BY etl_run_id", Long.class, RunStatus.RUNNING.name()
            );
            if (!running.isEmpty()) {
                throw new RunAlreadyInProgressException(running.get(0));
            }
        }

        KeyHolder keyHolder = new GeneratedKeyHolder();
        template.update(con -> {
            PreparedStatement ps = con.prepareStatement(
                "INSERT INTO " + table + " (run_start_datetime, status, etl_phase) VALUES (?, ?, ?)", new String[] {"etl_run_id"}
            );
            ps.setObject(1, now, Types.TIMESTAMP);
            ps.setString(2, RunStatus.RUNNING.name());
            ps.setString(3, EtlPhase.INITIALIZATION.name());
            return ps;
        }, keyHolder);

        Number key = keyHolder.getKey();
        if (key == null) {
            throw new IllegalStateException("etl_control insert returned no run id");
        }
        log.info("Started ETL run {}", key.longValue());
        return key.longValue();
    }

    private void failStaleRuns(String table, LocalDateTime now) {
        Duration timeout = config.getStaleRunTimeout();
        LocalDateTime cutoff = now.minus(timeout);
        int abandoned = template.update(
            "UPDATE " + table + " SET status = ?, run_end_datetime = ?, error_message = ? WHERE status = ? AND run_start_datetime < ?",
            ps -> {
                ps.setString(1, RunStatus.FAILED.name());
                ps.setObject(2, now, Types.TIMESTAMP);
                ps.setString(3, "Abandoned: still RUNNING after " + timeout);
                ps.setString(4, RunStatus.RUNNING.name());
                ps.setObject(5, cutoff, Types.TIMESTAMP);
            }
        );
        if (abandoned > 0) {
            log.warn("Closed {} ETL run(s) RUNNING since before {} as FAILED", abandoned, cutoff);
        }
    }

    @Override
    public void advance(long runId, EtlPhase phase, Integer recordsProcessed) {
        template.update(
            "UPDATE " + config.targetTable("etl_control")
                + " SET etl_phase = ?, records_processed = COALESCE(?, records_processed) WHERE etl_run_id = ?",
            ps -> {
                ps.setString(1, phase.name());
                if (recordsProcessed == null) {
                    ps.setNull(2, Types.INTEGER);
                } else {
                    ps.setInt(2, recordsProcessed);
                }
                ps.setLong(3, runId);
            }
        );
        log.debug("ETL run {} reached {}", runId, phase);
    }

    @Override
    public void complete(long runId, RunStatus status, String errorMessage) {
        Preconditions.checkArgument(status.isTerminal(), "Cannot complete a run with status %s", status);
        String phaseUpdate = status == RunStatus.SUCCESS ? ", etl_phase = '" + EtlPhase.COMPLETED.name() + "'" : "";
        LocalDateTime now = LocalDateTime.now(clock);
        template.update(
            "UPDATE " + config.targetTable("etl_control")
                + " SET run_end_datetime = ?, status = ?, error_message = ?" + phaseUpdate + " WHERE etl_run_id = ?",
            ps -> {
                ps.setObject(1, now, Types.TIMESTAMP);
                ps.setString(2, status.name());
                ps.setString(3, errorMessage);
                ps.setLong(4, runId);
            }
        );
        log.info("ETL run {} finished with status {}", runId, status);
    }

    @Override
    public Optional<EtlRun> find(long runId) {
        List<EtlRun> runs = template.query(
            "SELECT etl_run_id, run_start_datetime, run_end_datetime, status, records_processed, error_message, etl_phase FROM "
                + config.targetTable("etl_control") + " WHERE etl_run_id = ?",
            RUN_MAPPER, runId
        );
        return runs.stream().findFirst();
    }
}
