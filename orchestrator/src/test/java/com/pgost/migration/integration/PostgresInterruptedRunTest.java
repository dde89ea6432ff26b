package com.pgost.migration.integration;

import com.pgost.migration.exception.AdvisoryLockLostException;
import com.pgost.migration.model.MigrationMode;
import com.pgost.migration.model.MigrationRequest;
import com.pgost.migration.model.MigrationRun;
import com.pgost.migration.model.MigrationStatus;
import com.pgost.migration.model.TableName;
import com.pgost.migration.progress.MigrationProgressStore;
import com.pgost.migration.service.MigrationService;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.SpyBean;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;
import org.testcontainers.utility.DockerImageName;

import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Predicate;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.Mockito.doAnswer;

/**
 * Runs that stop part-way through backfill: a run that loses its table lock, and an operator abort.
 */
@Tag("containers")
@Testcontainers(disabledWithoutDocker = true)
@SpringBootTest(properties = {
    "migration.backfill.chunk-size=500",
    "migration.replay.poll-interval-ms=20",
    "migration.quiescence.stable-window-ms=300",
    "migration.quiescence.check-interval-ms=20",
    "migration.retry.delay-ms=50"
})
class PostgresInterruptedRunTest {

    @Container
    static final PostgreSQLContainer<?> POSTGRES = new PostgreSQLContainer<>(DockerImageName.parse("postgres:16-alpine"));

    @Autowired
    private MigrationService migrationService;

    @SpyBean
    private MigrationProgressStore progressStore;

    @Test
    void resubmittedDdl_shouldContinueBackfillFromTheSavedCursor() throws Exception {
        exec("CREATE TABLE orders (id bigint PRIMARY KEY, amount bigint NOT NULL)",
            "INSERT INTO orders SELECT g, g FROM generate_series(1, 5000) g");
        String ddl = "ALTER TABLE orders ADD COLUMN shipped boolean NOT NULL DEFAULT false";
        AtomicBoolean interrupt = new AtomicBoolean(true);
        AtomicInteger chunks = new AtomicInteger();
        doAnswer(invocation -> {
            if (interrupt.get() && chunks.incrementAndGet() > 2) {
                throw new AdvisoryLockLostException("Advisory lock pgost:public.orders is now held by another session");
            }
            return invocation.callRealMethod();
        }).when(progressStore).advanceCursor(any(Connection.class), any(TableName.class), anyLong(), anyBoolean());

        assertThat(migrationService.runMigration(request(ddl), MigrationMode.MIGRATE)).isEqualTo(MigrationStatus.FAILED);
        assertThat(queryLong("SELECT backfill_cursor FROM post_migrations.migration_progress WHERE source_table = 'public.orders'"))
            .isEqualTo(1000);
        assertThat(queryLong("SELECT count(*) FROM post_migrations.orders")).isEqualTo(1000);
        assertThat(queryBoolean("SELECT to_regclass('post_migrations.orders_log') IS NOT NULL")).isTrue();

        // A different DDL must not take over the earlier run's shadow
        assertThat(migrationService.runMigration(request("ALTER TABLE orders ADD COLUMN note text"), MigrationMode.MIGRATE))
            .isEqualTo(MigrationStatus.REJECTED);
        assertThat(queryLong("SELECT count(*) FROM post_migrations.orders")).isEqualTo(1000);

        // Rows below the cursor are not copied again, so one removed from the shadow stays missing
        exec("DELETE FROM post_migrations.orders WHERE id = 1");
        interrupt.set(false);

        assertThat(migrationService.runMigration(request(ddl), MigrationMode.MIGRATE)).isEqualTo(MigrationStatus.DONE);
        assertThat(queryLong("SELECT count(*) FROM orders")).isEqualTo(4999);
        assertThat(queryLong("SELECT min(id) FROM orders")).isEqualTo(2);
        assertThat(queryLong("SELECT count(*) FROM orders WHERE NOT shipped")).isEqualTo(4999);
        assertThat(progressRecorded("orders")).isFalse();
        assertThat(queryBoolean("SELECT to_regclass('post_migrations.orders_log') IS NULL")).isTrue();
    }

    @Test
    void abortDuringBackfill_shouldRemoveCaptureShadowAndProgress() throws Exception {
        exec("CREATE TABLE shipments (id integer PRIMARY KEY, carrier text NOT NULL)",
            "INSERT INTO shipments SELECT g, 'carrier-' || (g % 7) FROM generate_series(1, 3000) g");
        CountDownLatch chunkInFlight = new CountDownLatch(1);
        CountDownLatch abortSent = new CountDownLatch(1);
        doAnswer(invocation -> {
            chunkInFlight.countDown();
            abortSent.await(10, TimeUnit.SECONDS);
            return invocation.callRealMethod();
        }).when(progressStore).advanceCursor(any(Connection.class), any(TableName.class), anyLong(), anyBoolean());

        MigrationRun run = migrationService.startMigration(
            request("ALTER TABLE shipments ADD COLUMN weight numeric"), MigrationMode.MIGRATE);
        assertThat(chunkInFlight.await(30, TimeUnit.SECONDS)).isTrue();
        assertThat(migrationService.getRun(run.getId()).map(MigrationRun::getStatus)).contains(MigrationStatus.BACKFILLING);

        assertThat(migrationService.requestAbort(run.getId())).isEqualTo(MigrationService.AbortResult.ACCEPTED);
        abortSent.countDown();
        MigrationStatus outcome = awaitStatus(run.getId(), MigrationStatus::isTerminal);

        assertThat(outcome).isEqualTo(MigrationStatus.ABORTED);
        assertThat(queryBoolean("SELECT to_regclass('post_migrations.shipments') IS NULL")).isTrue();
        assertThat(queryBoolean("SELECT to_regclass('post_migrations.shipments_log') IS NULL")).isTrue();
        assertThat(queryLong("SELECT count(*) FROM pg_trigger WHERE tgrelid = 'public.shipments'::regclass "
            + "AND tgname LIKE 'pgost\\_%'")).isZero();
        assertThat(progressRecorded("shipments")).isFalse();
        assertThat(queryLong("SELECT count(*) FROM shipments")).isEqualTo(3000);
    }

    private MigrationStatus awaitStatus(Long runId, Predicate<MigrationStatus> condition) throws InterruptedException {
        long deadline = System.currentTimeMillis() + 30_000;
        MigrationStatus status = null;
        while (System.currentTimeMillis() < deadline) {
            status = migrationService.getRun(runId).map(MigrationRun::getStatus).orElse(null);
            if (status != null && condition.test(status)) {
                return status;
            }
            Thread.sleep(50);
        }
        throw new AssertionError("Run " + runId + " still in status " + status);
    }

    private static boolean progressRecorded(String table) throws SQLException {
        if (!queryBoolean("SELECT to_regclass('post_migrations.migration_progress') IS NOT NULL")) {
            return false;
        }
        return queryLong("SELECT count(*) FROM post_migrations.migration_progress WHERE source_table = 'public." + table + "'") > 0;
    }

    private static MigrationRequest request(String sql) {
        return MigrationRequest.builder()
            .connection(MigrationRequest.DbConfig.builder()
                .host(POSTGRES.getHost())
                .port(POSTGRES.getMappedPort(PostgreSQLContainer.POSTGRESQL_PORT))
                .database(POSTGRES.getDatabaseName())
                .user(POSTGRES.getUsername())
                .password(POSTGRES.getPassword())
                .build())
            .sql(sql)
            .build();
    }

    private static Connection connect() throws SQLException {
        return DriverManager.getConnection(POSTGRES.getJdbcUrl(), POSTGRES.getUsername(), POSTGRES.getPassword());
    }

    private static void exec(String... statements) throws SQLException {
        try (Connection conn = connect(); Statement stmt = conn.createStatement()) {
            for (String sql : statements) {
                stmt.execute(sql);
            }
        }
    }

    private static long queryLong(String sql) throws SQLException {
        try (Connection conn = connect(); Statement stmt = conn.createStatement(); ResultSet rs = stmt.executeQuery(sql)) {
            rs.next();
            return rs.getLong(1);
        }
    }

    private static boolean queryBoolean(String sql) throws SQLException {
        try (Connection conn = connect(); Statement stmt = conn.createStatement(); ResultSet rs = stmt.executeQuery(sql)) {
            rs.next();
            return rs.getBoolean(1);
        }
    }
}
