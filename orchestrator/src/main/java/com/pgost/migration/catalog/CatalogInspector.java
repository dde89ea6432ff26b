package com.pgost.migration.catalog;

import com.pgost.migration.exception.ValidationException;
import com.pgost.migration.infrastructure.database.DatabaseSession;
import com.pgost.migration.model.PrimaryKeyColumn;
import com.pgost.migration.model.TableName;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.util.ArrayList;
import java.util.List;

/**
 * Read-only queries against the PostgreSQL catalog.
 * All methods run in autocommit on the given session.
 */
@Slf4j
@Component
public class CatalogInspector {
    
    /**
     * Oldest server release with everything the engine relies on (stored generated columns excluded).
     */
    public static final int MINIMUM_SERVER_VERSION = 110000;
    
    public int serverVersion(DatabaseSession session) {
        String version = session.queryForString("SHOW server_version_num");
        return Integer.parseInt(version.trim());
    }
    
    public boolean hasCreatePrivilege(DatabaseSession session) {
        return session.queryForBoolean("SELECT has_database_privilege(current_database(), 'CREATE')");
    }
    
    public boolean hasTriggerPrivilege(DatabaseSession session, TableName table) {
        return session.queryForBoolean("SELECT has_table_privilege(?::regclass, 'TRIGGER')", table.qualified());
    }
    
    public boolean tableExists(DatabaseSession session, TableName table) {
        return session.queryForBoolean("SELECT to_regclass(?) IS NOT NULL", table.qualified());
    }
    
    /**
     * All live columns in ordinal order.
     */
    public List<String> columns(DatabaseSession session, TableName table) {
        return queryStrings(session,
            "SELECT column_name FROM information_schema.columns "
                + "WHERE table_schema = ? AND table_name = ? ORDER BY ordinal_position",
            table.getSchema(), table.getName());
    }
    
    /**
     * Columns that accept values on INSERT, that is everything except generated columns.
     */
    public List<String> writableColumns(DatabaseSession session, TableName table) {
        return queryStrings(session,
            "SELECT column_name FROM information_schema.columns "
                + "WHERE table_schema = ? AND table_name = ? AND is_generated = 'NEVER' ORDER BY ordinal_position",
            table.getSchema(), table.getName());
    }
    
    /**
     * The table's primary key, which must be a single smallint, integer or bigint column.
     */
    public PrimaryKeyColumn primaryKey(DatabaseSession session, TableName table) {
        List<String[]> keyColumns = session.withConnection(conn -> {
            List<String[]> rows = new ArrayList<>();
            try (PreparedStatement stmt = conn.prepareStatement(
                    "SELECT a.attname, format_type(a.atttypid, a.atttypmod) "
                        + "FROM pg_index i "
                        + "JOIN pg_attribute a ON a.attrelid = i.indrelid AND a.attnum = ANY(i.indkey) "
                        + "WHERE i.indrelid = ?::regclass AND i.indisprimary")) {
                stmt.setString(1, table.qualified());
                try (ResultSet rs = stmt.executeQuery()) {
                    while (rs.next()) {
                        rows.add(new String[] {rs.getString(1), rs.getString(2)});
                    }
                }
            }
            return rows;
        });
        
        if (keyColumns.isEmpty()) {
            throw new ValidationException("Table " + table + " has no primary key");
        }
        if (keyColumns.size() > 1) {
            throw new ValidationException("Table " + table + " has a composite primary key; a single integral column is required");
        }
        
        String name = keyColumns.get(0)[0];
        String typeName = keyColumns.get(0)[1];
        PrimaryKeyColumn.Type type = PrimaryKeyColumn.Type.fromSqlName(typeName);
        if (type == null) {
            throw new ValidationException("Primary key " + table + "." + name + " has type " + typeName
                + "; only smallint, integer and bigint keys are supported");
        }
        return new PrimaryKeyColumn(name, type);
    }
    
    /**
     * True when a unique index (or primary key) on exactly the given column exists.
     */
    public boolean hasUniqueIndexOn(DatabaseSession session, TableName table, String column) {
        return session.queryForBoolean(
            "SELECT EXISTS (SELECT 1 FROM pg_index i "
                + "JOIN pg_attribute a ON a.attrelid = i.indrelid AND a.attnum = i.indkey[0] "
                + "WHERE i.indrelid = ?::regclass AND i.indisunique AND i.indnatts = 1 AND a.attname = ?)",
            table.qualified(), column);
    }
    
    /**
     * Direct partitions of a partitioned table; empty for plain tables.
     */
    public List<TableName> partitions(DatabaseSession session, TableName table) {
        return session.withConnection(conn -> {
            List<TableName> partitions = new ArrayList<>();
            try (PreparedStatement stmt = conn.prepareStatement(
                    "SELECT n.nspname, c.relname FROM pg_inherits i "
                        + "JOIN pg_class c ON c.oid = i.inhrelid "
                        + "JOIN pg_namespace n ON n.oid = c.relnamespace "
                        + "WHERE i.inhparent = ?::regclass ORDER BY c.relname")) {
                stmt.setString(1, table.qualified());
                try (ResultSet rs = stmt.executeQuery()) {
                    while (rs.next()) {
                        partitions.add(TableName.of(rs.getString(1), rs.getString(2)));
                    }
                }
            }
            return partitions;
        });
    }
    
    /**
     * Sequences attached to the table's columns.
     *
     * @param dependencyType 'a' for serial-style OWNED BY sequences, 'i' for identity sequences
     */
    public List<SequenceBinding> sequences(DatabaseSession session, TableName table, char dependencyType) {
        return session.withConnection(conn -> {
            List<SequenceBinding> bindings = new ArrayList<>();
            try (PreparedStatement stmt = conn.prepareStatement(
                    "SELECT sn.nspname, s.relname, a.attname FROM pg_depend d "
                        + "JOIN pg_class s ON s.oid = d.objid AND s.relkind = 'S' "
                        + "JOIN pg_namespace sn ON sn.oid = s.relnamespace "
                        + "JOIN pg_attribute a ON a.attrelid = d.refobjid AND a.attnum = d.refobjsubid "
                        + "WHERE d.classid = 'pg_class'::regclass AND d.refclassid = 'pg_class'::regclass "
                        + "AND d.refobjid = ?::regclass AND d.deptype = ?::\"char\" ORDER BY a.attnum")) {
                stmt.setString(1, table.qualified());
                stmt.setString(2, String.valueOf(dependencyType));
                try (ResultSet rs = stmt.executeQuery()) {
                    while (rs.next()) {
                        bindings.add(new SequenceBinding(TableName.of(rs.getString(1), rs.getString(2)), rs.getString(3)));
                    }
                }
            }
            return bindings;
        });
    }
    
    private List<String> queryStrings(DatabaseSession session, String sql, Object... params) {
        return session.withConnection(conn -> {
            List<String> values = new ArrayList<>();
            try (PreparedStatement stmt = conn.prepareStatement(sql)) {
                for (int i = 0; i < params.length; i++) {
                    stmt.setObject(i + 1, params[i]);
                }
                try (ResultSet rs = stmt.executeQuery()) {
                    while (rs.next()) {
                        values.add(rs.getString(1));
                    }
                }
            }
            return values;
        });
    }
}
