package org.carball.litepilot.pool;

import lombok.extern.slf4j.Slf4j;
import org.carball.litepilot.concurrent.AsyncMutex;
import org.carball.litepilot.concurrent.WriteMutexRegistry;
import org.carball.litepilot.config.PoolConfig;
import org.carball.litepilot.model.query.CompiledQuery;
import org.carball.litepilot.model.query.QueryResult;
import org.carball.litepilot.parser.StatementClassifier;

import java.sql.SQLException;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Pool of SQLite connections to one database file that serializes writers across the process.
 * <p>
 * Connections are handed out in strict request order. Writes are serialized through the write
 * mutex shared by every pool attached to the same file in the given {@link WriteMutexRegistry}:
 * explicit transactions hold it from {@code BEGIN IMMEDIATE} until commit or rollback, and a write
 * outside a transaction holds it for that one statement. Reads never wait on it.
 * <p>
 * Waiting is never done by blocking a thread; every operation that may wait returns a
 * {@link CompletableFuture}. Blocking JDBC calls run on the configured executor.
 * <p>
 * A connection-scoped PRAGMA assignment (cache_size, foreign_keys, synchronous...) executed through
 * the pool is remembered and applied to every other connection before its next statement, so the
 * pool behaves as if it were one connection.
 */
@Slf4j
public class SqliteConnectionPool {

    static final List<String> BASELINE_PRAGMAS = List.of(
            "PRAGMA busy_timeout = 5000",
            "PRAGMA journal_mode = WAL",
            "PRAGMA synchronous = NORMAL",
            "PRAGMA journal_size_limit = 67108864",
            "PRAGMA temp_store = MEMORY"
    );

    private static final Pattern SAVEPOINT_NAME = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");
    private static final Pattern CONNECTION_PRAGMA = Pattern.compile(
            "^\\s*PRAGMA\\s+(?:main\\.)?(cache_size|foreign_keys|synchronous|temp_store|busy_timeout"
                    + "|recursive_triggers|cache_spill)\\s*=\\s*([^;]+?)\\s*;?\\s*$",
            Pattern.CASE_INSENSITIVE);
    private static final AtomicInteger POOL_SEQUENCE = new AtomicInteger();

    private enum State { NEW, OPEN, DESTROYED }

    private final PoolConfig config;
    private final WriteMutexRegistry mutexRegistry;
    private final List<QueryExecutionListener> listeners = new CopyOnWriteArrayList<>();

    private final Object monitor = new Object();
    private final List<PooledConnection> connections = new ArrayList<>();
    private final Deque<PooledConnection> freeConnections = new ArrayDeque<>();
    private final Deque<CompletableFuture<PooledConnection>> waiters = new ArrayDeque<>();
    private State state = State.NEW;
    private final Map<String, String> connectionSettings = new LinkedHashMap<>();
    private int settingsVersion;

    private volatile Executor executor;
    private ExecutorService ownedExecutor;
    private volatile AsyncMutex writeMutex;
    private volatile String databasePath;

    public SqliteConnectionPool(PoolConfig config, WriteMutexRegistry mutexRegistry) {
        this.config = config;
        this.mutexRegistry = mutexRegistry;
        if (config.getQueryListeners() != null) {
            listeners.addAll(config.getQueryListeners());
        }
    }

    /**
     * Opens the connections, applies the baseline PRAGMAs and the connection hook to each, and
     * attaches to the write mutex of the database file.
     *
     * @throws SQLException if a connection cannot be opened or set up; nothing stays open then
     */
    public void init() throws SQLException {
        synchronized (monitor) {
            if (state != State.NEW) {
                throw new PoolStateException("Pool has already been " + (state == State.OPEN ? "initialized" : "destroyed"));
            }
        }

        ConnectionFactory factory = config.resolveConnectionFactory();
        int size = Math.max(1, config.getPoolSize());
        if (!factory.isReentrant() && size > 1) {
            log.debug("Connection factory is not re-entrant, using a single connection instead of {}", size);
            size = 1;
        }

        List<PooledConnection> opened = new ArrayList<>();
        String path;
        try {
            for (int i = 0; i < size; i++) {
                PooledConnection connection = new PooledConnection(i + 1, factory.create());
                opened.add(connection);
                applyBaselinePragmas(connection);
                if (config.getOnCreateConnection() != null) {
                    config.getOnCreateConnection().onCreate(connection);
                }
            }
            path = resolveDatabasePath(opened.get(0));
        } catch (SQLException | RuntimeException e) {
            log.error("Failed to initialize SQLite connection pool: {}", e.getMessage());
            opened.forEach(PooledConnection::close);
            throw e;
        }

        synchronized (monitor) {
            connections.addAll(opened);
            freeConnections.addAll(opened);
            databasePath = path;
            writeMutex = mutexRegistry.attach(path);
            executor = config.getExecutor() != null ? config.getExecutor() : createOwnedExecutor(size);
            state = State.OPEN;
        }
        log.info("Opened {} SQLite connection(s) to {}", size, path);
    }

    /**
     * Hands out a free connection, or queues the caller until one is released.
     *
     * @throws PoolStateException if the pool is not initialized or already destroyed
     */
    public CompletableFuture<PooledConnection> acquireConnection() {
        synchronized (monitor) {
            ensureOpen();
            PooledConnection connection = freeConnections.pollFirst();
            if (connection != null) {
                return CompletableFuture.completedFuture(connection);
            }
            CompletableFuture<PooledConnection> waiter = new CompletableFuture<>();
            waiters.addLast(waiter);
            return waiter;
        }
    }

    /**
     * Returns a connection to the pool, or straight to the oldest waiter.
     * A connection still holding the write mutex has its transaction rolled back and the mutex freed.
     */
    public void releaseConnection(PooledConnection connection) {
        if (connection.holdsWriteMutex()) {
            log.warn("Connection {} released inside a transaction; rolling back and freeing the write mutex",
                    connection.getId());
            try {
                connection.executeRaw("ROLLBACK");
            } catch (SQLException e) {
                log.debug("Rollback on release of connection {} failed: {}", connection.getId(), e.getMessage());
            }
            releaseWriteMutex(connection);
        }

        while (true) {
            CompletableFuture<PooledConnection> next;
            synchronized (monitor) {
                if (state != State.OPEN) {
                    return;
                }
                next = waiters.pollFirst();
                if (next == null) {
                    freeConnections.addLast(connection);
                    return;
                }
            }
            if (next.complete(connection)) {
                return;
            }
        }
    }

    /**
     * Waits for the write mutex, then starts an immediate transaction on {@code connection}.
     * If the transaction cannot be started the mutex is passed on, including when this pool was
     * destroyed while waiting and its executor no longer accepts work.
     */
    public CompletableFuture<Void> beginTransaction(PooledConnection connection) {
        ensureOpenState();
        if (connection.holdsWriteMutex()) {
            return CompletableFuture.failedFuture(
                    new IllegalStateException("Connection " + connection.getId() + " is already in a transaction"));
        }
        AsyncMutex mutex = writeMutex;
        return mutex.lock().thenRunAsync(() -> {
            // Settings such as foreign_keys cannot change once the transaction has started
            applyConnectionSettings(connection);
            connection.setHoldsWriteMutex(true);
            try {
                connection.executeRaw("BEGIN IMMEDIATE");
            } catch (SQLException e) {
                connection.setHoldsWriteMutex(false);
                throw new DatabaseAccessException("Failed to begin transaction: " + e.getMessage(), e);
            }
        }, executor).whenComplete((ignored, error) -> {
            if (error != null && !connection.holdsWriteMutex()) {
                mutex.unlock();
            }
        });
    }

    /**
     * Commits and frees the write mutex. If COMMIT fails the transaction stays open and the mutex
     * stays held until the caller rolls back or releases the connection.
     */
    public CompletableFuture<Void> commitTransaction(PooledConnection connection) {
        ensureOpenState();
        return CompletableFuture.runAsync(() -> {
            try {
                connection.executeRaw("COMMIT");
            } catch (SQLException e) {
                throw new DatabaseAccessException("Failed to commit transaction: " + e.getMessage(), e);
            }
            releaseWriteMutex(connection);
        }, executor);
    }

    /**
     * Rolls back and frees the write mutex, even when ROLLBACK itself fails.
     */
    public CompletableFuture<Void> rollbackTransaction(PooledConnection connection) {
        ensureOpenState();
        return CompletableFuture.runAsync(() -> {
            try {
                connection.executeRaw("ROLLBACK");
            } catch (SQLException e) {
                throw new DatabaseAccessException("Failed to roll back transaction: " + e.getMessage(), e);
            } finally {
                releaseWriteMutex(connection);
            }
        }, executor);
    }

    public CompletableFuture<Void> savepoint(PooledConnection connection, String name) {
        return runSavepointCommand(connection, "SAVEPOINT", name);
    }

    public CompletableFuture<Void> rollbackToSavepoint(PooledConnection connection, String name) {
        return runSavepointCommand(connection, "ROLLBACK TO", name);
    }

    public CompletableFuture<Void> releaseSavepoint(PooledConnection connection, String name) {
        return runSavepointCommand(connection, "RELEASE", name);
    }

    /**
     * Executes one statement. Outside an explicit transaction a write holds the write mutex for just
     * this statement; reads run straight away.
     */
    public CompletableFuture<QueryResult> executeQuery(PooledConnection connection, CompiledQuery query) {
        ensureOpenState();
        if (connection.holdsWriteMutex() || StatementClassifier.isRead(query.sql())) {
            return CompletableFuture.supplyAsync(() -> run(connection, query), executor);
        }
        AsyncMutex mutex = writeMutex;
        return mutex.lock()
                .thenApplyAsync(ignored -> run(connection, query), executor)
                .whenComplete((result, error) -> mutex.unlock());
    }

    /**
     * Closes every connection, fails pending waiters and detaches from the write mutex.
     */
    public void destroy() {
        List<PooledConnection> toClose;
        List<CompletableFuture<PooledConnection>> pending;
        boolean wasOpen;
        synchronized (monitor) {
            if (state == State.DESTROYED) {
                return;
            }
            wasOpen = state == State.OPEN;
            state = State.DESTROYED;
            toClose = new ArrayList<>(connections);
            pending = new ArrayList<>(waiters);
            connections.clear();
            freeConnections.clear();
            waiters.clear();
        }

        pending.forEach(waiter -> waiter.completeExceptionally(
                new PoolStateException("Pool was destroyed while waiting for a connection")));

        for (PooledConnection connection : toClose) {
            if (connection.holdsWriteMutex()) {
                releaseWriteMutex(connection);
            }
            connection.close();
        }

        if (wasOpen) {
            mutexRegistry.detach(databasePath);
            log.info("Closed SQLite connection pool for {}", databasePath);
        }
        if (ownedExecutor != null) {
            ownedExecutor.shutdown();
        }
    }

    public void addQueryListener(QueryExecutionListener listener) {
        listeners.add(listener);
    }

    public void removeQueryListener(QueryExecutionListener listener) {
        listeners.remove(listener);
    }

    /**
     * File path the write mutex is keyed by; {@code :memory:} for in-memory databases.
     */
    public String getDatabasePath() {
        return databasePath;
    }

    public boolean isInitialized() {
        synchronized (monitor) {
            return state == State.OPEN;
        }
    }

    public int getSize() {
        synchronized (monitor) {
            return connections.size();
        }
    }

    public int getIdleCount() {
        synchronized (monitor) {
            return freeConnections.size();
        }
    }

    public int getWaitingCount() {
        synchronized (monitor) {
            return waiters.size();
        }
    }

    private QueryResult run(PooledConnection connection, CompiledQuery query) {
        if (!connection.holdsWriteMutex()) {
            applyConnectionSettings(connection);
        }
        long start = System.nanoTime();
        QueryResult result;
        try {
            result = connection.execute(query);
        } catch (SQLException e) {
            throw new DatabaseAccessException("Query failed: " + e.getMessage(), e);
        }
        rememberConnectionSetting(query.sql());
        double elapsedMs = (System.nanoTime() - start) / 1_000_000.0;
        notifyListeners(query.sql(), elapsedMs);
        return result;
    }

    private void rememberConnectionSetting(String sql) {
        Matcher matcher = CONNECTION_PRAGMA.matcher(sql);
        if (!matcher.matches()) {
            return;
        }
        synchronized (monitor) {
            connectionSettings.put(matcher.group(1).toLowerCase(Locale.ROOT), matcher.group(2));
            settingsVersion++;
        }
        log.debug("Applying {} = {} to every pooled connection", matcher.group(1), matcher.group(2));
    }

    /**
     * Brings {@code connection} up to date with the connection-scoped settings run on its siblings.
     */
    private void applyConnectionSettings(PooledConnection connection) {
        List<String> statements;
        int version;
        synchronized (monitor) {
            if (connection.getSettingsVersion() == settingsVersion) {
                return;
            }
            version = settingsVersion;
            statements = connectionSettings.entrySet().stream()
                    .map(setting -> "PRAGMA " + setting.getKey() + " = " + setting.getValue())
                    .collect(Collectors.toList());
        }
        for (String statement : statements) {
            try {
                connection.executeRaw(statement);
            } catch (SQLException e) {
                log.warn("Could not apply '{}' to connection {}: {}", statement, connection.getId(), e.getMessage());
            }
        }
        connection.setSettingsVersion(version);
    }

    private void notifyListeners(String sql, double elapsedMs) {
        for (QueryExecutionListener listener : listeners) {
            try {
                listener.onQueryExecuted(sql, elapsedMs);
            } catch (RuntimeException e) {
                log.warn("Query listener {} failed: {}", listener.getClass().getSimpleName(), e.getMessage());
            }
        }
    }

    private CompletableFuture<Void> runSavepointCommand(PooledConnection connection, String command, String name) {
        ensureOpenState();
        if (name == null || !SAVEPOINT_NAME.matcher(name).matches()) {
            return CompletableFuture.failedFuture(new IllegalArgumentException("Invalid savepoint name: " + name));
        }
        return CompletableFuture.runAsync(() -> {
            try {
                connection.executeRaw(command + " \"" + name + "\"");
            } catch (SQLException e) {
                throw new DatabaseAccessException(command + " " + name + " failed: " + e.getMessage(), e);
            }
        }, executor);
    }

    private void releaseWriteMutex(PooledConnection connection) {
        if (connection.holdsWriteMutex()) {
            connection.setHoldsWriteMutex(false);
            writeMutex.unlock();
        }
    }

    private static void applyBaselinePragmas(PooledConnection connection) throws SQLException {
        for (String pragma : BASELINE_PRAGMAS) {
            connection.executeRaw(pragma);
        }
    }

    private static String resolveDatabasePath(PooledConnection connection) {
        try {
            QueryResult result = connection.execute(CompiledQuery.raw("PRAGMA database_list"));
            return result.rows().stream()
                    .filter(row -> row.get("seq") instanceof Number seq && seq.intValue() == 0)
                    .map(row -> row.get("file"))
                    .filter(file -> file != null && !file.toString().isEmpty())
                    .map(Object::toString)
                    .findFirst()
                    .orElse(JdbcConnectionFactory.MEMORY_DATABASE);
        } catch (SQLException e) {
            log.debug("Could not resolve database file path: {}", e.getMessage());
            return JdbcConnectionFactory.MEMORY_DATABASE;
        }
    }

    private ExecutorService createOwnedExecutor(int threads) {
        int poolNumber = POOL_SEQUENCE.incrementAndGet();
        AtomicInteger threadNumber = new AtomicInteger();
        ownedExecutor = Executors.newFixedThreadPool(threads, runnable -> {
            Thread thread = new Thread(runnable, "litepilot-sqlite-" + poolNumber + "-" + threadNumber.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });
        return ownedExecutor;
    }

    private void ensureOpen() {
        if (state == State.NEW) {
            throw new PoolStateException("Pool has not been initialized");
        }
        if (state == State.DESTROYED) {
            throw new PoolStateException("Pool has been destroyed");
        }
    }

    private void ensureOpenState() {
        synchronized (monitor) {
            ensureOpen();
        }
    }
}
