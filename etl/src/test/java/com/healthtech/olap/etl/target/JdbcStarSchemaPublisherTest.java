package com.healthtech.olap.etl.target;

import com.healthtech.olap.data.star.FactEncounter;
import com.healthtech.olap.data.star.StarSchema;
import com.healthtech.olap.etl.StarSchemas;
import com.healthtech.olap.etl.TestDatabase;
import com.healthtech.olap.etl.config.EtlConfig;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.dao.DataAccessException;

import java.io.IOException;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class JdbcStarSchemaPublisherTest {

    private final EtlConfig config = new EtlConfig();
    private TestDatabase database;
    private JdbcStarSchemaPublisher publisher;
    private StarSchema schema;

    @BeforeEach
    void setUp() throws IOException {
        config.setBatchSize(2);
        database = TestDatabase.create("publisher", config);
        publisher = new JdbcStarSchemaPublisher(database.getTemplate(), database.transactionTemplate(), config);
        schema = StarSchemas.hospital(config);
    }

    @AfterEach
    void tearDown() {
        database.shutdown();
    }

    @Test
    void shouldInsertEveryStagedRow() {
        PublishResult result = publisher.publish(schema);

        assertEquals(0, result.rowsDeleted());
        assertEquals(schema.totalRows(), result.rowsInserted());
        assertEquals(6, database.count(config.targetTable("fact_encounters")));
        assertEquals(8, database.count(config.targetTable("dim_date")));
        assertEquals(3, database.count(config.targetTable("bridge_encounter_diagnoses")));
        assertEquals(4, database.count(config.targetTable("bridge_encounter_procedures")));
    }

    @Test
    void shouldWriteFactColumns() {
        publisher.publish(schema);

        Map<String, Object> row = database.getTemplate().queryForMap(
            "SELECT * FROM " + config.targetTable("fact_encounters") + " WHERE encounter_id = 102"
        );
        assertEquals(2, ((Number) row.get("encounter_key")).intValue());
        assertEquals(20240120, ((Number) row.get("date_key")).intValue());
        assertEquals(Boolean.TRUE, row.get("is_readmission"));
        assertEquals(2, ((Number) row.get("length_of_stay_days")).intValue());
        assertEquals(0, BigDecimal.ZERO.compareTo((BigDecimal) row.get("total_claim_amount")));

        Map<String, Object> date = database.getTemplate().queryForMap(
            "SELECT * FROM " + config.targetTable("dim_date") + " WHERE date_key = 20240120"
        );
        assertEquals("Saturday", date.get("day_name"));
        assertEquals(Boolean.TRUE, date.get("is_weekend"));
        assertEquals("January", date.get("month_name"));
    }

    @Test
    void shouldReplacePreviousLoad() {
        int firstInsert = publisher.publish(schema).rowsInserted();

        PublishResult second = publisher.publish(StarSchemas.hospital(config));

        assertEquals(firstInsert, second.rowsDeleted());
        assertEquals(firstInsert, second.rowsInserted());
        assertEquals(6, database.count(config.targetTable("fact_encounters")));
    }

    @Test
    void shouldKeepPreviousLoadWhenPublishFails() {
        publisher.publish(schema);
        List<FactEncounter> facts = new ArrayList<>(schema.facts());
        facts.add(new FactEncounter(7, 999, 19990101, 1, 1, 1, 1, 1, BigDecimal.ZERO, BigDecimal.ZERO, 0, 0, 0));
        StarSchema broken = new StarSchema(schema.dimensions(), facts, schema.diagnosisBridges(), schema.procedureBridges());

        assertThrows(DataAccessException.class, () -> publisher.publish(broken));

        assertEquals(6, database.count(config.targetTable("fact_encounters")));
        assertEquals(3, database.count(config.targetTable("dim_patient")));
    }
}
