package org.carball.litepilot.config;

import lombok.Builder;
import lombok.Data;
import org.carball.litepilot.pool.ConnectionFactory;
import org.carball.litepilot.pool.ConnectionHook;
import org.carball.litepilot.pool.JdbcConnectionFactory;
import org.carball.litepilot.pool.QueryExecutionListener;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Executor;

@Data
@Builder(toBuilder = true)
public class PoolConfig {

    @Builder.Default
    private String databasePath = JdbcConnectionFactory.MEMORY_DATABASE;

    @Builder.Default
    private int poolSize = 1;

    // Defaults to a JDBC factory for databasePath
    private ConnectionFactory connectionFactory;

    private ConnectionHook onCreateConnection;

    // Runs the blocking JDBC calls; the pool creates and owns one when absent
    private Executor executor;

    @Builder.Default
    private List<QueryExecutionListener> queryListeners = new ArrayList<>();

    public static PoolConfig forDatabase(String databasePath) {
        return PoolConfig.builder().databasePath(databasePath).build();
    }

    public ConnectionFactory resolveConnectionFactory() {
        return connectionFactory != null ? connectionFactory : new JdbcConnectionFactory(databasePath);
    }
}
