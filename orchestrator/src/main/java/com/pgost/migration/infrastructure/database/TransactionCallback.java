package com.pgost.migration.infrastructure.database;

import java.sql.Connection;
import java.sql.SQLException;

/**
 * Unit of work executed inside one database transaction.
 */
@FunctionalInterface
public interface TransactionCallback<T> {
    
    T doInTransaction(Connection connection) throws SQLException;
}
