package com.healthtech.olap.etl.target;

import com.healthtech.olap.etl.config.EtlConfig;
import org.apache.commons.io.IOUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.ByteArrayResource;
import org.springframework.core.io.ClassPathResource;
import org.springframework.jdbc.datasource.init.ResourceDatabasePopulator;
import org.springframework.stereotype.Component;

import javax.sql.DataSource;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;

/**
 * Creates the target schema, its star schema tables and the etl_control table when they do not exist yet.
 */
@Component
public class StarSchemaInitializer {

    private static final Logger log = LoggerFactory.getLogger(StarSchemaInitializer.class);

    static final String SCHEMA_SCRIPT = "db/olap-schema.sql";

    private static final String SCRIPT_SCHEMA_NAME = "healthtech_olap";

    private final DataSource dataSource;
    private final EtlConfig config;

    public StarSchemaInitializer(DataSource dataSource, EtlConfig config) {
        this.dataSource = dataSource;
        this.config = config;
    }

    public void initialize() throws IOException {
        String script;
        try (InputStream in = new ClassPathResource(SCHEMA_SCRIPT).getInputStream()) {
            script = IOUtils.toString(in, StandardCharsets.UTF_8);
        }
        script = script.replace(SCRIPT_SCHEMA_NAME, config.getTargetSchema());

        ResourceDatabasePopulator populator = new ResourceDatabasePopulator(new ByteArrayResource(script.getBytes(StandardCharsets.UTF_8)));
        populator.execute(dataSource);
        log.info("Star schema tables are in place in {}", config.getTargetSchema());
    }
}
