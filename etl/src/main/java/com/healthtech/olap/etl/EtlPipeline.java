package com.healthtech.olap.etl;

import com.healthtech.olap.data.run.EtlPhase;
import com.healthtech.olap.data.run.RunStatus;
import com.healthtech.olap.data.source.SourceSnapshot;
import com.healthtech.olap.data.star.DimensionSet;
import com.healthtech.olap.data.star.FactEncounter;
import com.healthtech.olap.data.star.StarSchema;
import com.healthtech.olap.etl.dimension.DimensionLoader;
import com.healthtech.olap.etl.fact.BridgeLoader;
import com.healthtech.olap.etl.fact.BridgeRows;
import com.healthtech.olap.etl.fact.EncounterMetrics;
import com.healthtech.olap.etl.fact.FactLoader;
import com.healthtech.olap.etl.fact.MetricsAggregator;
import com.healthtech.olap.etl.fact.ReadmissionClassifier;
import com.healthtech.olap.etl.run.RunSummary;
import com.healthtech.olap.etl.run.RunSummaryWriter;
import com.healthtech.olap.etl.run.RunTracker;
import com.healthtech.olap.etl.source.OltpSourceReader;
import com.healthtech.olap.etl.target.StarSchemaPublisher;
import com.healthtech.olap.exception.EtlPhaseException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * One full refresh of the star schema.
 *
 * Flow: open a run, extract the source, build the dimensions, stage encounter metrics, load facts, flag readmissions, load bridges,
 * publish everything in one transaction, close the run. Every phase boundary is recorded on the run, each dimension as its build
 * completes. Any failure, {@link Error}s included, closes the run as FAILED at the last phase it reached; exceptions surface as
 * {@link EtlPhaseException}. Recovery is another full run.
 */
@Component
public class EtlPipeline {
    private static final Logger log = LoggerFactory.getLogger(EtlPipeline.class);

    private final RunTracker tracker;
    private final OltpSourceReader sourceReader;
    private final DimensionLoader dimensionLoader;
    private final MetricsAggregator metricsAggregator;
    private final FactLoader factLoader;
    private final ReadmissionClassifier readmissionClassifier;
    private final BridgeLoader bridgeLoader;
    private final StarSchemaPublisher publisher;
    private final RunSummaryWriter summaryWriter;

    public EtlPipeline(
        RunTracker tracker,
        OltpSourceReader sourceReader,
        DimensionLoader dimensionLoader,
        MetricsAggregator metricsAggregator,
        FactLoader factLoader,
        ReadmissionClassifier readmissionClassifier,
        BridgeLoader bridgeLoader,
        StarSchemaPublisher publisher,
        RunSummaryWriter summaryWriter
    ) {
        this.tracker = tracker;
        this.sourceReader = sourceReader;
        this.dimensionLoader = dimensionLoader;
        this.metricsAggregator = metricsAggregator;
        this.factLoader = factLoader;
        this.readmissionClassifier = readmissionClassifier;
        this.bridgeLoader = bridgeLoader;
        this.publisher = publisher;
        this.summaryWriter = summaryWriter;
    }

    public RunSummary run() {
        long runId = tracker.start();
        RunProgress progress = new RunProgress(runId);
        try {
            SourceSnapshot source = sourceReader.read();
            progress.advance(EtlPhase.SOURCE_EXTRACTED, null);

            DimensionSet dimensions = dimensionLoader.load(source, dimensionPhase -> progress.advance(dimensionPhase, null));
            progress.advance(EtlPhase.ALL_DIMENSIONS_LOADED, null);

            List<EncounterMetrics> metrics = metricsAggregator.aggregate(source);
            progress.advance(EtlPhase.STAGING_TABLE_CREATED, null);

            List<FactEncounter> facts = factLoader.load(metrics, dimensions);
            progress.advance(EtlPhase.FACT_TABLE_LOADED, facts.size());

            readmissionClassifier.classify(facts, source.encounters());
            progress.advance(EtlPhase.READMISSIONS_FLAGGED, null);

            BridgeRows bridges = bridgeLoader.load(source.encounterDiagnoses(), source.encounterProcedures(), facts, dimensions);
            progress.advance(EtlPhase.BRIDGES_LOADED, null);

            publisher.publish(new StarSchema(dimensions, facts, bridges.diagnoses(), bridges.procedures()));
            progress.advance(EtlPhase.CLEANUP_COMPLETE, null);
            progress.advance(EtlPhase.PUBLISHED, null);

            tracker.complete(runId, RunStatus.SUCCESS, null);
        } catch (RuntimeException | Error e) {
            EtlPhaseException failure = new EtlPhaseException(runId, progress.phase.name(), e);
            log.error(failure.getMessage(), e);
            // an Error reaches the caller unwrapped
            Throwable surfaced = e instanceof Error ? e : failure;
            recordFailure(runId, failure.getMessage(), surfaced);
            if (e instanceof Error) {
                throw (Error) e;
            }
            throw failure;
        }
        return writeSummary(runId);
    }

    private void recordFailure(long runId, String message, Throwable failure) {
        try {
            tracker.complete(runId, RunStatus.FAILED, message);
            writeSummary(runId);
        } catch (RuntimeException trackingFailure) {
            log.error("Could not record failure of ETL run {}", runId, trackingFailure);
            failure.addSuppressed(trackingFailure);
        }
    }

    private RunSummary writeSummary(long runId) {
        RunSummary summary = tracker.find(runId)
            .map(RunSummary::of)
            .orElseThrow(() -> new IllegalStateException("ETL run " + runId + " is missing from etl_control"));
        summaryWriter.write(summary);
        return summary;
    }

    /**
     * Last phase a run has reached, advanced on the run record as the pipeline moves on.
     */
    private class RunProgress {
        private final long runId;
        private EtlPhase phase = EtlPhase.INITIALIZATION;

        RunProgress(long runId) {
            this.runId = runId;
        }

        void advance(EtlPhase next, Integer recordsProcessed) {
            tracker.advance(runId, next, recordsProcessed);
            log.info("ETL run {}: {}", runId, next);
            phase = next;
        }
    }
}
