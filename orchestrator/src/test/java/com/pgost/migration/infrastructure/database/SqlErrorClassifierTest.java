package com.pgost.migration.infrastructure.database;

import com.pgost.migration.exception.DatabaseOperationException;
import com.pgost.migration.exception.MigrationException;
import org.junit.jupiter.api.Test;

import java.sql.SQLException;

import static org.assertj.core.api.Assertions.assertThat;

class SqlErrorClassifierTest {

    @Test
    void isTransient_shouldAcceptConnectionLossAndLockContention() {
        assertThat(SqlErrorClassifier.isTransient("08006")).isTrue();
        assertThat(SqlErrorClassifier.isTransient("40P01")).isTrue();
        assertThat(SqlErrorClassifier.isTransient("40001")).isTrue();
        assertThat(SqlErrorClassifier.isTransient("55P03")).isTrue();
    }

    @Test
    void isTransient_shouldRejectDataAndSyntaxErrors() {
        assertThat(SqlErrorClassifier.isTransient("23505")).isFalse();
        assertThat(SqlErrorClassifier.isTransient("42601")).isFalse();
        assertThat(SqlErrorClassifier.isTransient((String) null)).isFalse();
    }

    @Test
    void isTransient_shouldFollowTheCauseChain() {
        SQLException deadlock = new SQLException("deadlock detected", "40P01");
        MigrationException wrapped = new MigrationException("batch failed", new RuntimeException(deadlock));

        assertThat(SqlErrorClassifier.isTransient(wrapped)).isTrue();
        assertThat(SqlErrorClassifier.isTransient(new IllegalStateException("boom"))).isFalse();
    }

    @Test
    void translate_shouldKeepSqlStateAndClassification() {
        DatabaseOperationException e = SqlErrorClassifier.translate("Copy failed",
            new SQLException("canceling statement due to lock timeout", "55P03"));

        assertThat(e.getSqlState()).isEqualTo("55P03");
        assertThat(e.isTransientFailure()).isTrue();
        assertThat(e.getMessage()).isEqualTo("Copy failed: canceling statement due to lock timeout [SQLState 55P03]");
    }

    @Test
    void isConstraintViolation_shouldMatchIntegrityClassAnywhereInTheChain() {
        DatabaseOperationException unique = SqlErrorClassifier.translate("Copy failed",
            new SQLException("duplicate key value violates unique constraint", "23505"));

        assertThat(SqlErrorClassifier.isConstraintViolation(unique)).isTrue();
        assertThat(SqlErrorClassifier.isConstraintViolation(new MigrationException("wrapped", unique))).isTrue();
        assertThat(SqlErrorClassifier.isConstraintViolation(new SQLException("null value", "23502"))).isTrue();
        assertThat(SqlErrorClassifier.isConstraintViolation(new SQLException("deadlock", "40P01"))).isFalse();
        assertThat(SqlErrorClassifier.isConstraintViolation(new IllegalStateException("boom"))).isFalse();
    }
}
