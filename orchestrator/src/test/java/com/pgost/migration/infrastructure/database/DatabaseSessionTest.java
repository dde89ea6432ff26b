package com.pgost.migration.infrastructure.database;

import com.pgost.migration.exception.AdvisoryLockLostException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.function.Supplier;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class DatabaseSessionTest {

    private static final String LOCK_SQL = "SELECT pg_try_advisory_lock(hashtext(?))";
    private static final String LOCK_KEY = "pgost:public.accounts";

    @Mock
    private Supplier<Connection> connectionSupplier;
    @Mock
    private Connection firstConnection;
    @Mock
    private Connection secondConnection;
    @Mock
    private PreparedStatement firstLock;
    @Mock
    private PreparedStatement secondLock;
    @Mock
    private ResultSet firstLockResult;
    @Mock
    private ResultSet secondLockResult;
    @Mock
    private PreparedStatement check;
    @Mock
    private ResultSet checkResult;

    private DatabaseSession session;

    @BeforeEach
    void setUp() throws SQLException {
        session = new DatabaseSession(connectionSupplier, "control-1");
        when(connectionSupplier.get()).thenReturn(firstConnection, secondConnection);

        when(firstConnection.prepareStatement(LOCK_SQL)).thenReturn(firstLock);
        when(firstLock.executeQuery()).thenReturn(firstLockResult);
        when(firstLockResult.next()).thenReturn(true);
        when(firstLockResult.getBoolean(1)).thenReturn(true);

        // The control connection dies: the next statement fails and the connection reports itself invalid
        when(firstConnection.prepareStatement("SELECT true"))
            .thenThrow(new SQLException("An I/O error occurred while sending to the backend", "08006"));

        when(secondConnection.prepareStatement(LOCK_SQL)).thenReturn(secondLock);
        when(secondLock.executeQuery()).thenReturn(secondLockResult);
        when(secondLockResult.next()).thenReturn(true);
    }

    @Test
    void verifyAdvisoryLocks_shouldTakeHeldLocksAgainOnTheNewConnection() throws SQLException {
        when(secondLockResult.getBoolean(1)).thenReturn(true);
        when(secondConnection.prepareStatement("SELECT true")).thenReturn(check);
        when(check.executeQuery()).thenReturn(checkResult);
        when(checkResult.next()).thenReturn(true);
        when(checkResult.getBoolean(1)).thenReturn(true);

        assertThat(session.tryAdvisoryLock(LOCK_KEY)).isTrue();
        session.verifyAdvisoryLocks();

        verify(firstConnection).close();
        verify(secondLock).setObject(1, LOCK_KEY);
        verify(secondConnection, times(1)).prepareStatement("SELECT true");
    }

    @Test
    void verifyAdvisoryLocks_shouldFailWhenAnotherSessionTookTheLock() throws SQLException {
        when(secondLockResult.getBoolean(1)).thenReturn(false);

        assertThat(session.tryAdvisoryLock(LOCK_KEY)).isTrue();

        assertThatThrownBy(() -> session.verifyAdvisoryLocks())
            .isInstanceOf(AdvisoryLockLostException.class)
            .hasMessageContaining(LOCK_KEY)
            .hasMessageContaining("control-1");
        verify(secondConnection).close();

        // The lock is no longer ours, so there is nothing left to verify
        assertThatCode(() -> session.verifyAdvisoryLocks()).doesNotThrowAnyException();
        verify(connectionSupplier, times(2)).get();
    }
}
