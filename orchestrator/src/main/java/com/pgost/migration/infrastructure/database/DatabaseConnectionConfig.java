package com.pgost.migration.infrastructure.database;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.ToString;

/**
 * Configuration holder for database connections.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class DatabaseConnectionConfig {
    @Builder.Default
    private DatabaseType type = DatabaseType.POSTGRESQL;
    private String host;
    private int port;
    private String database;
    private String schema;
    private String user;
    @ToString.Exclude
    private String password;
    
    /**
     * Get schema with default fallback.
     */
    public String getSchemaOrDefault() {
        if (schema != null && !schema.isEmpty()) {
            return schema;
        }
        return "public";
    }
    
    /**
     * Get port with the type's default when unset.
     */
    public int getPortOrDefault() {
        return port > 0 ? port : type.getDefaultPort();
    }
}
