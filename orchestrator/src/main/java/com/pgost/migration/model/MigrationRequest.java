package com.pgost.migration.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.pgost.migration.exception.ValidationException;
import com.pgost.migration.infrastructure.database.DatabaseConnectionConfig;
import com.pgost.migration.infrastructure.database.DatabaseType;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.ToString;

/**
 * Request DTO for starting a migration or a replay-only run.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
@JsonIgnoreProperties(ignoreUnknown = true)
public class MigrationRequest {
    
    @NotNull(message = "Database connection is required")
    @Valid
    private DbConfig connection;
    
    /**
     * Target DDL: one table-affecting statement, optionally followed by
     * CREATE TABLE ... PARTITION OF and CREATE INDEX statements.
     */
    @NotBlank(message = "DDL statement is required")
    private String sql;

    /**
     * Database configuration.
     */
    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @Builder
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class DbConfig {
        
        /**
         * Only PostgreSQL is supported; kept so requests state it explicitly.
         */
        @Builder.Default
        private String type = "postgresql";
        
        @NotBlank(message = "Database host is required")
        private String host;
        
        @PositiveOrZero(message = "Port must not be negative")
        private int port;
        
        @NotBlank(message = "Database name is required")
        private String database;
        
        @NotBlank(message = "Database user is required")
        private String user;
        
        @ToString.Exclude
        @JsonProperty(access = JsonProperty.Access.WRITE_ONLY)
        private String password;
        
        /**
         * Schema the unqualified table names in the DDL resolve to. Defaults to 'public'.
         */
        private String schema;
        
        public DatabaseConnectionConfig toConnectionConfig() {
            DatabaseType databaseType;
            try {
                databaseType = DatabaseType.fromString(type);
            } catch (IllegalArgumentException e) {
                throw new ValidationException(e.getMessage(), e);
            }
            return DatabaseConnectionConfig.builder()
                .type(databaseType)
                .host(host)
                .port(port)
                .database(database)
                .schema(schema)
                .user(user)
                .password(password)
                .build();
        }
    }
}
