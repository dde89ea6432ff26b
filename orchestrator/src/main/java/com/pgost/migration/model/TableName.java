package com.pgost.migration.model;

import lombok.Value;

/**
 * Schema-qualified table identifier.
 * {@link #qualified()} renders it quoted for SQL, {@link #toString()} renders it plain for logs and keys.
 */
@Value
public class TableName {
    
    String schema;
    String name;
    
    public static TableName of(String schema, String name) {
        if (schema == null || schema.isEmpty() || name == null || name.isEmpty()) {
            throw new IllegalArgumentException("Schema and table name are required, got " + schema + "." + name);
        }
        return new TableName(schema, name);
    }
    
    public TableName inSchema(String otherSchema) {
        return of(otherSchema, name);
    }
    
    public TableName renamed(String otherName) {
        return of(schema, otherName);
    }
    
    /**
     * Quoted, schema-qualified form usable in any SQL statement and as a regclass literal.
     */
    public String qualified() {
        return quote(schema) + "." + quote(name);
    }
    
    public String quotedName() {
        return quote(name);
    }
    
    @Override
    public String toString() {
        return schema + "." + name;
    }
    
    public static String quote(String identifier) {
        return "\"" + identifier.replace("\"", "\"\"") + "\"";
    }
}
