package com.pgost.migration.model;

import lombok.Getter;
import lombok.Value;

/**
 * The single integral primary-key column that orders backfill and keys replay.
 */
@Value
public class PrimaryKeyColumn {
    
    String name;
    Type type;
    
    public String quotedName() {
        return TableName.quote(name);
    }
    
    /**
     * Supported key types, named as {@code format_type} prints them.
     */
    @Getter
    public enum Type {
        SMALLINT("smallint"),
        INTEGER("integer"),
        BIGINT("bigint");
        
        private final String sqlName;
        
        Type(String sqlName) {
            this.sqlName = sqlName;
        }
        
        public static Type fromSqlName(String sqlName) {
            for (Type type : values()) {
                if (type.sqlName.equalsIgnoreCase(sqlName)) {
                    return type;
                }
            }
            return null;
        }
    }
}
