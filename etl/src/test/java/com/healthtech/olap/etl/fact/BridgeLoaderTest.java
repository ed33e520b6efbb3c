package com.healthtech.olap.etl.fact;

import com.healthtech.olap.data.source.EncounterDiagnosis;
import com.healthtech.olap.data.source.EncounterProcedure;
import com.healthtech.olap.data.source.SourceSnapshot;
import com.healthtech.olap.data.star.DiagnosisBridge;
import com.healthtech.olap.data.star.DimensionSet;
import com.healthtech.olap.data.star.FactEncounter;
import com.healthtech.olap.data.star.ProcedureBridge;
import com.healthtech.olap.etl.SourceFixtures;
import com.healthtech.olap.etl.config.EtlConfig;
import com.healthtech.olap.etl.dimension.DimensionLoader;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class BridgeLoaderTest {

    private final BridgeLoader loader = new BridgeLoader();

    private SourceSnapshot source;
    private DimensionSet dimensions;
    private List<FactEncounter> facts;

    @BeforeEach
    void setUp() {
        source = SourceFixtures.hospital();
        dimensions = new DimensionLoader(new EtlConfig(), SourceFixtures.LOAD_CLOCK).load(source);
        facts = new FactLoader().load(new MetricsAggregator().aggregate(source), dimensions);
    }

    @Test
    void shouldLinkFactsToDiagnosesAndProcedures() {
        BridgeRows rows = loader.load(source.encounterDiagnoses(), source.encounterProcedures(), facts, dimensions);

        // encounter 101 has key 1, 104 has key 4; the link on 105 has no fact row
        assertEquals(
            List.of(new DiagnosisBridge(1, 1, 1), new DiagnosisBridge(4, 1, 1), new DiagnosisBridge(4, 2, 2)),
            rows.diagnoses()
        );
        assertEquals(
            List.of(
                new ProcedureBridge(1, 3, LocalDate.of(2024, 1, 1)),
                new ProcedureBridge(4, 1, LocalDate.of(2024, 2, 10)),
                new ProcedureBridge(4, 2, LocalDate.of(2024, 2, 10)),
                new ProcedureBridge(4, 3, LocalDate.of(2024, 2, 10))
            ),
            rows.procedures()
        );
        assertEquals(7, rows.size());
        assertEquals(0, rows.repeatedLinks());
    }

    @Test
    void shouldMatchBridgeCountToFactCounts() {
        BridgeRows rows = loader.load(source.encounterDiagnoses(), source.encounterProcedures(), facts, dimensions);

        for (FactEncounter fact : facts) {
            long diagnoses = rows.diagnoses().stream().filter(b -> b.encounterKey() == fact.getEncounterKey()).count();
            long procedures = rows.procedures().stream().filter(b -> b.encounterKey() == fact.getEncounterKey()).count();
            assertEquals(fact.getDiagnosisCount(), diagnoses, "diagnoses of encounter " + fact.getEncounterId());
            assertEquals(fact.getProcedureCount(), procedures, "procedures of encounter " + fact.getEncounterId());
        }
    }

    @Test
    void shouldSkipUnknownDiagnosesAndRepeatedLinks() {
        List<EncounterDiagnosis> links = List.of(
            new EncounterDiagnosis(101, 1, 1),
            new EncounterDiagnosis(101, 1, 3),
            new EncounterDiagnosis(101, 42, 2)
        );
        List<EncounterProcedure> procedures = List.of(new EncounterProcedure(999, 1, null));

        BridgeRows rows = loader.load(links, procedures, facts, dimensions);

        assertEquals(List.of(new DiagnosisBridge(1, 1, 1)), rows.diagnoses());
        assertTrue(rows.procedures().isEmpty());
        assertEquals(1, rows.repeatedLinks());
    }

    @Test
    void shouldCountRepeatedProcedureLinksApartFromUnmatchedOnes() {
        List<EncounterProcedure> procedures = List.of(
            new EncounterProcedure(104, 1, LocalDate.of(2024, 2, 10)),
            new EncounterProcedure(104, 1, LocalDate.of(2024, 2, 11)),
            new EncounterProcedure(104, 1, LocalDate.of(2024, 2, 12)),
            new EncounterProcedure(105, 1, LocalDate.of(2024, 2, 11))
        );

        BridgeRows rows = loader.load(List.of(), procedures, facts, dimensions);

        assertEquals(List.of(new ProcedureBridge(4, 1, LocalDate.of(2024, 2, 10))), rows.procedures());
        assertEquals(2, rows.repeatedLinks(), "the link on 105 has no fact row and is not a repeat");
    }
}
