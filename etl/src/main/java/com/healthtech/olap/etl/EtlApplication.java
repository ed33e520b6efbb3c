package com.healthtech.olap.etl;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;
import org.springframework.context.annotation.Bean;

import java.time.Clock;

/**
 * Healthcare star schema ETL.
 *
 * Reads the OLTP schema, rebuilds the dimensional model in the OLAP schema and exits. Run with:
 * java -jar etl.jar \
 *   --spring.datasource.url=jdbc:mysql://localhost:3306 \
 *   --spring.datasource.username=etl \
 *   --spring.datasource.password=... \
 *   --etl.source-schema=healthtech_oltp \
 *   --etl.target-schema=healthtech_olap
 */
@SpringBootApplication
@ConfigurationPropertiesScan("com.healthtech.olap.etl.config")
public class EtlApplication {

    public static void main(String[] args) {
        SpringApplication app = new SpringApplication(EtlApplication.class);
        System.exit(SpringApplication.exit(app.run(args)));
    }

    @Bean
    public Clock clock() {
        return Clock.systemDefaultZone();
    }
}
