package org.carball.litepilot.pool;

import org.carball.litepilot.concurrent.WriteMutexRegistry;
import org.carball.litepilot.config.PoolConfig;
import org.carball.litepilot.model.query.CompiledQuery;
import org.carball.litepilot.model.query.QueryResult;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.sql.SQLException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class SqliteConnectionPoolTest {

    @TempDir
    Path tempDir;

    private WriteMutexRegistry registry;
    private final List<SqliteConnectionPool> pools = new ArrayList<>();

    @BeforeEach
    void setUp() {
        registry = new WriteMutexRegistry();
    }

    @AfterEach
    void tearDown() {
        pools.forEach(SqliteConnectionPool::destroy);
    }

    // Statements run on the calling thread, so every future below is settled on return
    private SqliteConnectionPool openPool(String fileName, int size) throws SQLException {
        SqliteConnectionPool pool = new SqliteConnectionPool(PoolConfig.builder()
                .databasePath(tempDir.resolve(fileName).toString())
                .poolSize(size)
                .executor(Runnable::run)
                .build(), registry);
        pool.init();
        pools.add(pool);
        return pool;
    }

    private static int countItems(SqliteConnectionPool pool, PooledConnection connection) {
        QueryResult result = pool.executeQuery(connection, CompiledQuery.raw("SELECT COUNT(*) AS n FROM items")).join();
        return ((Number) result.firstValue("n")).intValue();
    }

    private static int intPragma(SqliteConnectionPool pool, PooledConnection connection, String pragma) {
        QueryResult result = pool.executeQuery(connection, CompiledQuery.raw("PRAGMA " + pragma)).join();
        return ((Number) result.firstValue(pragma)).intValue();
    }

    private static void createItems(SqliteConnectionPool pool, PooledConnection connection) {
        pool.executeQuery(connection,
                CompiledQuery.raw("CREATE TABLE items (id INTEGER PRIMARY KEY, name TEXT)")).join();
    }

    @Test
    void shouldApplyBaselinePragmasToEveryConnection() throws SQLException {
        SqliteConnectionPool pool = openPool("baseline.db", 2);

        PooledConnection first = pool.acquireConnection().join();
        PooledConnection second = pool.acquireConnection().join();

        for (PooledConnection connection : List.of(first, second)) {
            assertThat(pool.executeQuery(connection, CompiledQuery.raw("PRAGMA journal_mode")).join()
                    .firstValue("journal_mode")).isEqualTo("wal");
            assertThat(((Number) pool.executeQuery(connection, CompiledQuery.raw("PRAGMA busy_timeout")).join()
                    .firstValue(null)).intValue()).isEqualTo(5000);
            assertThat(((Number) pool.executeQuery(connection, CompiledQuery.raw("PRAGMA synchronous")).join()
                    .firstValue("synchronous")).intValue()).isEqualTo(1);
            assertThat(((Number) pool.executeQuery(connection, CompiledQuery.raw("PRAGMA temp_store")).join()
                    .firstValue("temp_store")).intValue()).isEqualTo(2);
        }
    }

    @Test
    void shouldResolveDatabasePathAndAttachToWriteMutex() throws SQLException {
        SqliteConnectionPool pool = openPool("path.db", 2);

        assertThat(pool.isInitialized()).isTrue();
        assertThat(pool.getSize()).isEqualTo(2);
        assertThat(pool.getIdleCount()).isEqualTo(2);
        assertThat(pool.getDatabasePath()).endsWith("path.db");
        assertThat(registry.getReferenceCount(pool.getDatabasePath())).isEqualTo(1);
    }

    @Test
    void shouldUseSingleConnectionForInMemoryDatabase() throws SQLException {
        SqliteConnectionPool pool = new SqliteConnectionPool(PoolConfig.builder()
                .poolSize(4)
                .executor(Runnable::run)
                .build(), registry);
        pool.init();
        pools.add(pool);

        assertThat(pool.getSize()).isEqualTo(1);
        assertThat(pool.getDatabasePath()).isEqualTo(":memory:");
        assertThat(registry.isRegistered(":memory:")).isTrue();
    }

    @Test
    void shouldHandOutConnectionsInRequestOrder() throws SQLException {
        SqliteConnectionPool pool = openPool("fifo.db", 1);

        PooledConnection connection = pool.acquireConnection().join();
        CompletableFuture<PooledConnection> second = pool.acquireConnection();
        CompletableFuture<PooledConnection> third = pool.acquireConnection();

        assertThat(second).isNotDone();
        assertThat(pool.getWaitingCount()).isEqualTo(2);

        pool.releaseConnection(connection);
        assertThat(second).isDone();
        assertThat(third).isNotDone();
        assertThat(second.join()).isSameAs(connection);

        pool.releaseConnection(second.join());
        assertThat(third.join()).isSameAs(connection);
        assertThat(pool.getIdleCount()).isZero();

        pool.releaseConnection(third.join());
        assertThat(pool.getIdleCount()).isEqualTo(1);
    }

    @Test
    void shouldServeQueuedRequestsInOrderWhenEveryConnectionIsBusy() throws SQLException {
        SqliteConnectionPool pool = openPool("fifo-pair.db", 2);

        // Given
        CompletableFuture<PooledConnection> first = pool.acquireConnection();
        CompletableFuture<PooledConnection> second = pool.acquireConnection();
        CompletableFuture<PooledConnection> third = pool.acquireConnection();
        CompletableFuture<PooledConnection> fourth = pool.acquireConnection();

        assertThat(first).isDone();
        assertThat(second).isDone();
        assertThat(first.join()).isNotSameAs(second.join());
        assertThat(third).isNotDone();
        assertThat(fourth).isNotDone();
        assertThat(pool.getWaitingCount()).isEqualTo(2);

        // When
        pool.releaseConnection(second.join());

        // Then
        assertThat(third.join()).isSameAs(second.join());
        assertThat(fourth).isNotDone();

        pool.releaseConnection(first.join());
        assertThat(fourth.join()).isSameAs(first.join());
        assertThat(pool.getWaitingCount()).isZero();
        assertThat(pool.getIdleCount()).isZero();
    }

    @Test
    void shouldSkipCancelledWaiterOnRelease() throws SQLException {
        SqliteConnectionPool pool = openPool("cancel.db", 1);

        PooledConnection connection = pool.acquireConnection().join();
        CompletableFuture<PooledConnection> abandoned = pool.acquireConnection();
        CompletableFuture<PooledConnection> next = pool.acquireConnection();

        abandoned.cancel(false);
        pool.releaseConnection(connection);

        assertThat(next.join()).isSameAs(connection);
    }

    @Test
    void shouldRejectUseBeforeInit() {
        SqliteConnectionPool pool = new SqliteConnectionPool(PoolConfig.forDatabase(":memory:"), registry);

        assertThat(pool.isInitialized()).isFalse();
        assertThatThrownBy(pool::acquireConnection)
                .isInstanceOf(PoolStateException.class)
                .hasMessage("Pool has not been initialized");
    }

    @Test
    void shouldRejectUseAfterDestroy() throws SQLException {
        SqliteConnectionPool pool = openPool("destroyed.db", 1);
        String path = pool.getDatabasePath();

        pool.destroy();
        pool.destroy();

        assertThat(registry.isRegistered(path)).isFalse();
        assertThatThrownBy(pool::acquireConnection)
                .isInstanceOf(PoolStateException.class)
                .hasMessage("Pool has been destroyed");
        assertThatThrownBy(pool::init).isInstanceOf(PoolStateException.class);
    }

    @Test
    void shouldRejectSecondInit() throws SQLException {
        SqliteConnectionPool pool = openPool("twice.db", 1);

        assertThatThrownBy(pool::init)
                .isInstanceOf(PoolStateException.class)
                .hasMessageContaining("already been initialized");
    }

    @Test
    void shouldFailWaitersWhenDestroyed() throws SQLException {
        SqliteConnectionPool pool = openPool("waiters.db", 1);
        pool.acquireConnection().join();
        CompletableFuture<PooledConnection> waiter = pool.acquireConnection();

        pool.destroy();

        assertThat(waiter).isCompletedExceptionally();
        assertThatThrownBy(waiter::join)
                .isInstanceOf(CompletionException.class)
                .hasCauseInstanceOf(PoolStateException.class)
                .hasMessageContaining("destroyed while waiting");
    }

    @Test
    void shouldLeaveNothingOpenWhenInitFails() {
        SqliteConnectionPool pool = new SqliteConnectionPool(PoolConfig.builder()
                .connectionFactory(() -> {
                    throw new SQLException("cannot open database");
                })
                .executor(Runnable::run)
                .build(), registry);

        assertThatThrownBy(pool::init)
                .isInstanceOf(SQLException.class)
                .hasMessage("cannot open database");
        assertThat(pool.isInitialized()).isFalse();
        assertThat(registry.size()).isZero();
    }

    @Test
    void shouldRunConnectionHookOnEveryNewConnection() throws SQLException {
        AtomicInteger created = new AtomicInteger();
        SqliteConnectionPool pool = new SqliteConnectionPool(PoolConfig.builder()
                .databasePath(tempDir.resolve("hook.db").toString())
                .poolSize(3)
                .executor(Runnable::run)
                .onCreateConnection(connection -> {
                    created.incrementAndGet();
                    connection.executeRaw("PRAGMA foreign_keys = ON");
                })
                .build(), registry);
        pool.init();
        pools.add(pool);

        PooledConnection connection = pool.acquireConnection().join();

        assertThat(created).hasValue(3);
        assertThat(((Number) pool.executeQuery(connection, CompiledQuery.raw("PRAGMA foreign_keys")).join()
                .firstValue("foreign_keys")).intValue()).isEqualTo(1);
    }

    @Test
    void shouldBindParametersAndReportInsertId() throws SQLException {
        SqliteConnectionPool pool = openPool("params.db", 1);
        PooledConnection connection = pool.acquireConnection().join();
        pool.executeQuery(connection, CompiledQuery.raw(
                "CREATE TABLE params (id INTEGER PRIMARY KEY, label TEXT, flag INTEGER, amount REAL, note TEXT, tags TEXT)")).join();

        QueryResult insert = pool.executeQuery(connection, CompiledQuery.of(
                "INSERT INTO params (label, flag, amount, note, tags) VALUES (?, ?, ?, ?, ?)",
                "first", true, 2.5, null, Map.of("k", "v"))).join();

        assertThat(insert.numAffectedRows()).isEqualTo(1L);
        assertThat(insert.insertId()).isEqualTo(1L);

        Map<String, Object> row = pool.executeQuery(connection, CompiledQuery.raw("SELECT * FROM params"))
                .join().rows().get(0);
        assertThat(row.get("label")).isEqualTo("first");
        assertThat(((Number) row.get("flag")).intValue()).isEqualTo(1);
        assertThat(((Number) row.get("amount")).doubleValue()).isEqualTo(2.5);
        assertThat(row.get("note")).isNull();
        assertThat(row.get("tags")).isEqualTo("{\"k\":\"v\"}");
    }

    @Test
    void shouldSerializeWritesAcrossPoolsOnSameFile() throws SQLException {
        SqliteConnectionPool poolA = openPool("shared.db", 1);
        SqliteConnectionPool poolB = openPool("shared.db", 2);
        assertThat(registry.getReferenceCount(poolA.getDatabasePath())).isEqualTo(2);

        PooledConnection a = poolA.acquireConnection().join();
        PooledConnection writer = poolB.acquireConnection().join();
        PooledConnection reader = poolB.acquireConnection().join();
        createItems(poolA, a);

        poolA.beginTransaction(a).join();
        poolA.executeQuery(a, CompiledQuery.of("INSERT INTO items (name) VALUES (?)", "from-a")).join();

        CompletableFuture<QueryResult> blockedWrite = poolB.executeQuery(writer,
                CompiledQuery.of("INSERT INTO items (name) VALUES (?)", "from-b"));

        assertThat(blockedWrite).isNotDone();
        // Readers never wait on the write mutex and see only committed rows
        assertThat(countItems(poolB, reader)).isZero();

        poolA.commitTransaction(a).join();

        assertThat(blockedWrite).isDone();
        assertThat(blockedWrite.join().numAffectedRows()).isEqualTo(1L);
        assertThat(countItems(poolB, reader)).isEqualTo(2);
    }

    @Test
    void shouldQueueTransactionsUntilHolderFinishes() throws SQLException {
        SqliteConnectionPool poolA = openPool("queued.db", 1);
        SqliteConnectionPool poolB = openPool("queued.db", 1);
        PooledConnection a = poolA.acquireConnection().join();
        PooledConnection b = poolB.acquireConnection().join();

        poolA.beginTransaction(a).join();
        CompletableFuture<Void> second = poolB.beginTransaction(b);

        assertThat(a.holdsWriteMutex()).isTrue();
        assertThat(second).isNotDone();
        assertThat(b.holdsWriteMutex()).isFalse();

        poolA.rollbackTransaction(a).join();

        assertThat(a.holdsWriteMutex()).isFalse();
        assertThat(second).isDone();
        assertThat(b.holdsWriteMutex()).isTrue();

        poolB.commitTransaction(b).join();
        assertThat(b.holdsWriteMutex()).isFalse();
    }

    @Test
    void shouldPassWriteMutexOnWhenQueuedPoolIsDestroyed() throws SQLException {
        String path = tempDir.resolve("handoff.db").toString();
        SqliteConnectionPool holder = openPool("handoff.db", 1);
        // Runs on its own threads, which stop accepting work once the pool is destroyed
        SqliteConnectionPool queued = new SqliteConnectionPool(PoolConfig.forDatabase(path), registry);
        queued.init();
        pools.add(queued);
        SqliteConnectionPool writer = openPool("handoff.db", 1);

        // Given
        PooledConnection holding = holder.acquireConnection().join();
        createItems(holder, holding);
        holder.beginTransaction(holding).join();

        PooledConnection waiting = queued.acquireConnection().join();
        CompletableFuture<Void> queuedBegin = queued.beginTransaction(waiting);
        assertThat(queuedBegin).isNotDone();

        // When
        queued.destroy();
        holder.commitTransaction(holding).join();

        // Then
        assertThat(queuedBegin).isCompletedExceptionally();
        assertThat(waiting.holdsWriteMutex()).isFalse();
        PooledConnection writing = writer.acquireConnection().join();
        assertThat(writer.executeQuery(writing, CompiledQuery.of("INSERT INTO items (name) VALUES (?)", "after")))
                .succeedsWithin(Duration.ofSeconds(2));
        assertThat(registry.getReferenceCount(holder.getDatabasePath())).isEqualTo(2);
    }

    @Test
    void shouldCarryConnectionSettingsToEveryConnection() throws SQLException {
        SqliteConnectionPool pool = openPool("settings.db", 2);
        PooledConnection first = pool.acquireConnection().join();
        PooledConnection second = pool.acquireConnection().join();

        // When
        pool.executeQuery(first, CompiledQuery.raw("PRAGMA foreign_keys = ON")).join();
        pool.executeQuery(first, CompiledQuery.raw("PRAGMA cache_size = -32000")).join();

        // Then
        assertThat(intPragma(pool, second, "foreign_keys")).isEqualTo(1);
        assertThat(intPragma(pool, second, "cache_size")).isEqualTo(-32000);

        // A setting changed later reaches the other connection before its transaction starts
        pool.executeQuery(first, CompiledQuery.raw("PRAGMA foreign_keys = OFF")).join();
        pool.beginTransaction(second).join();
        assertThat(intPragma(pool, second, "foreign_keys")).isZero();
        pool.rollbackTransaction(second).join();
    }

    @Test
    void shouldRejectNestedBegin() throws SQLException {
        SqliteConnectionPool pool = openPool("nested.db", 1);
        PooledConnection connection = pool.acquireConnection().join();
        pool.beginTransaction(connection).join();

        CompletableFuture<Void> nested = pool.beginTransaction(connection);

        assertThatThrownBy(nested::join).hasCauseInstanceOf(IllegalStateException.class);
        assertThat(connection.holdsWriteMutex()).isTrue();
        pool.rollbackTransaction(connection).join();
    }

    @Test
    void shouldRollBackAndFreeMutexWhenReleasedInsideTransaction() throws SQLException {
        SqliteConnectionPool pool = openPool("abandoned.db", 2);
        PooledConnection first = pool.acquireConnection().join();
        PooledConnection second = pool.acquireConnection().join();
        createItems(pool, first);

        pool.beginTransaction(first).join();
        pool.executeQuery(first, CompiledQuery.of("INSERT INTO items (name) VALUES (?)", "lost")).join();
        pool.releaseConnection(first);

        assertThat(first.holdsWriteMutex()).isFalse();
        assertThat(pool.beginTransaction(second)).isDone();
        assertThat(countItems(pool, second)).isZero();
        pool.commitTransaction(second).join();
    }

    @Test
    void shouldRollBackToSavepoint() throws SQLException {
        SqliteConnectionPool pool = openPool("savepoint.db", 1);
        PooledConnection connection = pool.acquireConnection().join();
        createItems(pool, connection);

        pool.beginTransaction(connection).join();
        pool.executeQuery(connection, CompiledQuery.of("INSERT INTO items (name) VALUES (?)", "kept")).join();
        pool.savepoint(connection, "before_second").join();
        pool.executeQuery(connection, CompiledQuery.of("INSERT INTO items (name) VALUES (?)", "undone")).join();
        pool.rollbackToSavepoint(connection, "before_second").join();
        pool.releaseSavepoint(connection, "before_second").join();
        pool.commitTransaction(connection).join();

        assertThat(countItems(pool, connection)).isEqualTo(1);
    }

    @Test
    void shouldRejectInvalidSavepointName() throws SQLException {
        SqliteConnectionPool pool = openPool("badname.db", 1);
        PooledConnection connection = pool.acquireConnection().join();

        assertThatThrownBy(() -> pool.savepoint(connection, "x\"; DROP TABLE items; --").join())
                .hasCauseInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Invalid savepoint name");
        assertThatThrownBy(() -> pool.releaseSavepoint(connection, "1abc").join())
                .hasCauseInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void shouldFreeMutexWhenWriteFails() throws SQLException {
        SqliteConnectionPool pool = openPool("failing.db", 1);
        PooledConnection connection = pool.acquireConnection().join();

        CompletableFuture<QueryResult> failed = pool.executeQuery(connection,
                CompiledQuery.raw("INSERT INTO missing_table VALUES (1)"));

        assertThatThrownBy(failed::join)
                .isInstanceOf(CompletionException.class)
                .hasCauseInstanceOf(DatabaseAccessException.class)
                .hasMessageContaining("Query failed");

        createItems(pool, connection);
        assertThat(pool.executeQuery(connection, CompiledQuery.of("INSERT INTO items (name) VALUES (?)", "after")))
                .isDone();
    }

    @Test
    void shouldNotifyListenersAndSurviveFailingOnes() throws SQLException {
        SqliteConnectionPool pool = openPool("listeners.db", 1);
        List<String> seen = new ArrayList<>();
        pool.addQueryListener((sql, elapsedMs) -> {
            throw new IllegalStateException("listener broke");
        });
        pool.addQueryListener((sql, elapsedMs) -> seen.add(sql));
        PooledConnection connection = pool.acquireConnection().join();

        QueryResult result = pool.executeQuery(connection, CompiledQuery.raw("SELECT 1 AS one")).join();

        assertThat(((Number) result.firstValue("one")).intValue()).isEqualTo(1);
        assertThat(seen).containsExactly("SELECT 1 AS one");
    }
}
