package com.pgost.migration;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.context.ConfigurableApplicationContext;
import org.springframework.data.jpa.repository.config.EnableJpaRepositories;

/**
 * Main application class for the online schema change orchestrator.
 * With {@code migration.one-shot.enabled=true} the process runs one migration and exits with its exit code.
 */
@SpringBootApplication
@EnableJpaRepositories
public class PgOstApplication {

    public static void main(String[] args) {
        ConfigurableApplicationContext context = SpringApplication.run(PgOstApplication.class, args);
        if (context.isActive() && context.getEnvironment().getProperty("migration.one-shot.enabled", Boolean.class, false)) {
            System.exit(SpringApplication.exit(context));
        }
    }
}
