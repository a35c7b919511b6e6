package com.pgokache;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

/**
 * pgokache backend.
 *
 * Checks pg_stat_statements readiness on registered Postgres instances, captures statistics
 * snapshots and turns them into ranked index and scaling recommendations.
 */
@SpringBootApplication
@ConfigurationPropertiesScan
public class PgOkacheApplication {

    public static void main(String[] args) {
        SpringApplication.run(PgOkacheApplication.class, args);
    }

}
