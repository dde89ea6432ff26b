package com.pgost.migration.infrastructure.database;

import org.springframework.stereotype.Component;

/**
 * PostgreSQL-specific JDBC URL builder.
 * Tags every connection with an application name so migration sessions are easy to spot in pg_stat_activity.
 */
@Component
public class PostgreSQLJdbcUrlBuilder implements JdbcUrlBuilder {
    
    static final String APPLICATION_NAME = "pg-ost";
    
    @Override
    public String buildUrl(DatabaseConnectionConfig config) {
        return String.format(
            "%s%s:%d/%s?ApplicationName=%s",
            config.getType().getJdbcPrefix(),
            config.getHost(),
            config.getPortOrDefault(),
            config.getDatabase(),
            APPLICATION_NAME
        );
    }
    
    @Override
    public boolean supports(DatabaseType type) {
        return type == DatabaseType.POSTGRESQL;
    }
}
