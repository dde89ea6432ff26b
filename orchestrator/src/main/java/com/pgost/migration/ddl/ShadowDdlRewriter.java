package com.pgost.migration.ddl;

/**
 * Turns user-supplied target DDL into statements that build the shadow table.
 */
public interface ShadowDdlRewriter {
    
    /**
     * @param sql the user's DDL, one or more statements separated by semicolons
     * @param defaultSchema schema unqualified table names resolve to
     * @param shadowSchema schema the shadow table and its partitions are created in
     * @throws com.pgost.migration.exception.ValidationException if the DDL is not usable
     */
    ShadowDefinition rewrite(String sql, String defaultSchema, String shadowSchema);
}
