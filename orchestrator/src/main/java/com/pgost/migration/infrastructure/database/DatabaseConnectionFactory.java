package com.pgost.migration.infrastructure.database;

import com.pgost.migration.exception.ConnectionException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;
import java.util.List;

/**
 * Factory for creating database connections with proper URL building and driver loading.
 * Every unit of a migration (control, backfill, replay) gets its own session from here.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class DatabaseConnectionFactory {
    
    private final List<JdbcUrlBuilder> urlBuilders;
    
    /**
     * Create a database connection from configuration.
     */
    public Connection createConnection(DatabaseConnectionConfig config) {
        try {
            // Load driver class
            Class.forName(config.getType().getDriverClassName());
            
            String jdbcUrl = buildJdbcUrl(config);
            
            log.debug("Creating connection to: {}", jdbcUrl);
            
            return DriverManager.getConnection(
                jdbcUrl,
                config.getUser(),
                config.getPassword()
            );
            
        } catch (ClassNotFoundException e) {
            throw new ConnectionException(
                "Database driver not found: " + config.getType().getDriverClassName(),
                e
            );
        } catch (SQLException e) {
            throw new ConnectionException(
                "Failed to connect to database: " + config.getHost() + ":" + config.getPortOrDefault(),
                e
            );
        }
    }
    
    /**
     * Open a lazily connected session. The name shows up in logs only.
     */
    public DatabaseSession openSession(DatabaseConnectionConfig config, String name) {
        return new DatabaseSession(() -> createConnection(config), name);
    }
    
    /**
     * Build JDBC URL using appropriate strategy.
     */
    public String buildJdbcUrl(DatabaseConnectionConfig config) {
        return urlBuilders.stream()
            .filter(builder -> builder.supports(config.getType()))
            .findFirst()
            .map(builder -> builder.buildUrl(config))
            .orElseThrow(() -> new ConnectionException(
                "No JDBC URL builder found for database type: " + config.getType()
            ));
    }

}
