package com.healthtech.olap.etl;

import com.healthtech.olap.data.source.SourceSnapshot;
import com.healthtech.olap.data.star.DimensionSet;
import com.healthtech.olap.data.star.FactEncounter;
import com.healthtech.olap.data.star.StarSchema;
import com.healthtech.olap.etl.config.EtlConfig;
import com.healthtech.olap.etl.dimension.DimensionLoader;
import com.healthtech.olap.etl.fact.BridgeLoader;
import com.healthtech.olap.etl.fact.BridgeRows;
import com.healthtech.olap.etl.fact.FactLoader;
import com.healthtech.olap.etl.fact.MetricsAggregator;
import com.healthtech.olap.etl.fact.ReadmissionClassifier;

import java.util.List;

/**
 * Stages the fixture hospital into a star schema without touching a database.
 */
public final class StarSchemas {

    private StarSchemas() {
    }

    public static StarSchema hospital(EtlConfig config) {
        SourceSnapshot source = SourceFixtures.hospital();
        DimensionSet dimensions = new DimensionLoader(config, SourceFixtures.LOAD_CLOCK).load(source);
        List<FactEncounter> facts = new FactLoader().load(new MetricsAggregator().aggregate(source), dimensions);
        new ReadmissionClassifier(config).classify(facts, source.encounters());
        BridgeRows bridges = new BridgeLoader().load(source.encounterDiagnoses(), source.encounterProcedures(), facts, dimensions);
        return new StarSchema(dimensions, facts, bridges.diagnoses(), bridges.procedures());
    }
}
