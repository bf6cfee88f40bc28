package com.sqlmcp.db;

import com.sqlmcp.config.ConfigParams;
import com.sqlmcp.config.ResourceManager;
import com.sqlmcp.tools.ErrorKind;
import com.sqlmcp.tools.ToolException;
import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.DatabaseMetaData;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.SQLTransientConnectionException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Owns the fixed-size connection pool and hands out one exclusive {@link PooledConnection} lease per tool call.
 * We use <a href="https://github.com/brettwooldridge/HikariCP">HikariCP</a> for pooling; this class adds
 * lease tracking, liveness probes on release and an explicit pool health check.
 * This class is thread-safe.
 */
public class ConnectionManager implements AutoCloseable {
    private static final Logger logger = LoggerFactory.getLogger(ConnectionManager.class);
    private static final AtomicInteger poolCounter = new AtomicInteger(0);
    static final Duration PROBE_INTERVAL = Duration.ofSeconds(30);

    private final ConfigParams configParams;
    private final HikariDataSource dataSource;
    private final Clock clock;
    private final Set<PooledConnection> activeLeases = ConcurrentHashMap.newKeySet();
    private final ReentrantLock healthCheckLock = new ReentrantLock();

    /**
     * Creates a connection manager with its own HikariCP pool.
     * The pool starts even when the database is unreachable; tool calls then fail with ConnectionUnavailable
     * until it recovers.
     *
     * @param configParams Gateway configuration
     * @throws IllegalStateException if the JDBC driver cannot be loaded
     */
    public ConnectionManager(ConfigParams configParams) {
        this(configParams, createDataSource(configParams), Clock.systemUTC());
    }

    /**
     * Creates a connection manager around an existing data source.
     * Useful for testing or when the pool is managed externally.
     */
    public ConnectionManager(ConfigParams configParams, HikariDataSource dataSource) {
        this(configParams, dataSource, Clock.systemUTC());
    }

    ConnectionManager(ConfigParams configParams, HikariDataSource dataSource, Clock clock) {
        this.configParams = configParams;
        this.dataSource = dataSource;
        this.clock = clock;
    }

    static HikariDataSource createDataSource(ConfigParams configParams) {
        try {
            Class.forName(configParams.dbDriver());
            logger.info("Database driver loaded successfully: {}", configParams.dbDriver());
        } catch (ClassNotFoundException e) {
            logger.error("Failed to load database driver '{}' for database type '{}'",
                    configParams.dbDriver(), configParams.getDatabaseType(), e);
            throw new IllegalStateException(
                    ResourceManager.getErrorMessage("database.driver.not.found", configParams.dbDriver()), e);
        } catch (LinkageError e) {
            logger.error("Database driver '{}' failed to initialize: {}", configParams.dbDriver(), e.getMessage(), e);
            throw new IllegalStateException(
                    ResourceManager.getErrorMessage("database.driver.init.failed", configParams.dbDriver()), e);
        }

        HikariConfig poolConfig = new HikariConfig();
        poolConfig.setJdbcUrl(configParams.dbUrl());
        poolConfig.setUsername(configParams.dbUser());
        poolConfig.setPassword(configParams.dbPass());
        poolConfig.setDriverClassName(configParams.dbDriver());

        // Fixed size: the pool never grows past the configured size and keeps it filled
        poolConfig.setMaximumPoolSize(configParams.maxConnections());
        poolConfig.setMinimumIdle(configParams.maxConnections());
        poolConfig.setConnectionTimeout(configParams.connectionTimeoutMs());
        poolConfig.setValidationTimeout(Math.max(250L, configParams.validationTimeoutSeconds() * 1000L));
        poolConfig.setConnectionTestQuery(validationQuery(configParams.getDatabaseType()));
        poolConfig.setInitializationFailTimeout(-1);
        poolConfig.setPoolName("SqlMcpPool-" + poolCounter.incrementAndGet());

        configureDatabaseSpecificSettings(configParams, poolConfig);

        logger.info("Initializing connection pool for {} with fixed size {}, acquire timeout {}ms",
                configParams.maskSensitive(configParams.dbUrl()), configParams.maxConnections(),
                configParams.connectionTimeoutMs());
        return new HikariDataSource(poolConfig);
    }

    private static void configureDatabaseSpecificSettings(ConfigParams configParams, HikariConfig poolConfig) {
        switch (configParams.getDatabaseType()) {
            case "mysql", "mariadb" -> {
                poolConfig.addDataSourceProperty("cachePrepStmts", "true");
                poolConfig.addDataSourceProperty("prepStmtCacheSize", "250");
                poolConfig.addDataSourceProperty("useServerPrepStmts", "true");
            }
            case "postgresql" -> poolConfig.addDataSourceProperty("ApplicationName", "sql-mcp-gateway");
            case "sqlserver" -> poolConfig.addDataSourceProperty("applicationName", "sql-mcp-gateway");
            default -> logger.debug("No database specific pool settings for type: {}", configParams.getDatabaseType());
        }
    }

    static String validationQuery(String dbType) {
        return switch (dbType) {
            case "oracle" -> "SELECT 1 FROM DUAL";
            case "db2" -> "SELECT 1 FROM SYSIBM.SYSDUMMY1";
            default -> "SELECT 1";
        };
    }

    /**
     * Leases one connection from the pool. Waits at most the configured connection timeout.
     *
     * @return An exclusive lease; close it to release the connection
     * @throws ToolException PoolExhausted when every connection stays leased for the whole wait,
     *                       ConnectionUnavailable when the database cannot be reached
     */
    public PooledConnection acquire() throws ToolException {
        Connection rawConnection;
        try {
            rawConnection = dataSource.getConnection();
        } catch (SQLTransientConnectionException e) {
            throw classifyAcquireFailure(e);
        } catch (SQLException e) {
            logger.warn("Failed to obtain connection: {}", e.getMessage());
            throw new ToolException(ErrorKind.CONNECTION_UNAVAILABLE,
                    ResourceManager.getErrorMessage("connection.unavailable", SqlErrors.describe(e)), e);
        }
        if (rawConnection == null) {
            throw new ToolException(ErrorKind.CONNECTION_UNAVAILABLE,
                    ResourceManager.getErrorMessage("connection.unavailable", "pool returned no connection"));
        }

        PooledConnection lease = new PooledConnection(rawConnection, this, clock.instant());
        activeLeases.add(lease);
        logger.trace("Connection leased, {} of {} in use", activeLeases.size(), configParams.maxConnections());
        return lease;
    }

    private ToolException classifyAcquireFailure(SQLTransientConnectionException e) {
        // Hikari attaches the last connection failure as the cause when it could not create connections
        boolean databaseFailure = e.getCause() != null || e.getNextException() != null;
        if (activeLeases.size() >= configParams.maxConnections() || !databaseFailure) {
            logger.warn("Connection pool exhausted after {}ms: {} of {} connections in use",
                    configParams.connectionTimeoutMs(), activeLeases.size(), configParams.maxConnections());
            return new ToolException(ErrorKind.POOL_EXHAUSTED,
                    ResourceManager.getErrorMessage("connection.pool.exhausted",
                            String.valueOf(configParams.maxConnections()),
                            String.valueOf(configParams.connectionTimeoutMs())), e);
        }
        Throwable rootCause = e.getCause() != null ? e.getCause() : e.getNextException();
        logger.warn("Database unreachable: {}", rootCause.getMessage());
        return new ToolException(ErrorKind.CONNECTION_UNAVAILABLE,
                ResourceManager.getErrorMessage("connection.unavailable", rootCause.getMessage()), e);
    }

    /**
     * Returns a lease to the pool. Suspect connections, and connections not probed for a while,
     * are probed first; a connection that fails the probe is evicted and replaced by the pool.
     * Releasing the same lease twice has no effect.
     */
    void release(PooledConnection lease) {
        if (!lease.markReleased() || !activeLeases.remove(lease)) {
            logger.debug("Ignoring release of a lease that was already released");
            return;
        }

        Connection rawConnection = lease.rawConnection();
        Instant releaseTime = clock.instant();
        boolean probeDue = lease.healthState() != HealthState.HEALTHY
                || lease.lastChecked() == null
                || Duration.between(lease.lastChecked(), releaseTime).compareTo(PROBE_INTERVAL) >= 0;

        if (probeDue) {
            boolean alive = probe(rawConnection);
            lease.recordProbe(alive, releaseTime);
            if (!alive) {
                logger.warn("Released connection failed its liveness probe, evicting it from the pool");
                dataSource.evictConnection(rawConnection);
                return;
            }
        }

        try {
            rawConnection.close();
        } catch (SQLException e) {
            logger.warn("Error returning connection to the pool: {}", e.getMessage());
        }
    }

    /**
     * Probes every idle connection, evicts the dead ones and tries to replace each of them.
     * The first replacement that fails marks the database unreachable and the connections not yet
     * probed count as dead, so an outage costs at most one connection timeout.
     *
     * @return Health snapshot of the pool
     */
    public PoolHealth checkHealth() {
        healthCheckLock.lock();
        try {
            int poolSize = configParams.maxConnections();
            int inUse = activeLeases.size();
            int degraded = (int) activeLeases.stream().filter(l -> l.healthState() != HealthState.HEALTHY).count();
            int toProbe = Math.max(0, poolSize - inUse);

            int healthy = 0;
            int dead = 0;
            int replaced = 0;
            int replacementsFailed = 0;
            String lastError = null;
            boolean unreachable = false;
            List<Connection> probedConnections = new ArrayList<>();

            try {
                for (int i = 0; i < toProbe; i++) {
                    Connection candidate;
                    try {
                        candidate = dataSource.getConnection();
                    } catch (SQLException e) {
                        lastError = e.getCause() != null ? e.getCause().getMessage() : e.getMessage();
                        logger.warn("Health check could not obtain a connection: {}", lastError);
                        dead += toProbe - i;
                        unreachable = true;
                        break;
                    }

                    if (probe(candidate)) {
                        healthy++;
                        probedConnections.add(candidate);
                        continue;
                    }

                    dead++;
                    lastError = "connection failed liveness probe";
                    dataSource.evictConnection(candidate);
                    Connection replacement = reconnect();
                    if (replacement != null) {
                        replaced++;
                        probedConnections.add(replacement);
                        continue;
                    }

                    // the database did not answer; probing the remaining idle connections would only wait again
                    replacementsFailed++;
                    lastError = "could not replace dead connection";
                    dead += toProbe - i - 1;
                    unreachable = true;
                    break;
                }
            } finally {
                for (Connection probedConnection : probedConnections) {
                    try {
                        probedConnection.close();
                    } catch (SQLException e) {
                        logger.warn("Error returning probed connection to the pool: {}", e.getMessage());
                    }
                }
            }

            HealthState status;
            if (unreachable && healthy == 0 && replaced == 0) {
                status = HealthState.DEAD;
            } else if (unreachable || replacementsFailed > 0 || degraded > 0) {
                status = HealthState.DEGRADED;
            } else {
                status = HealthState.HEALTHY;
            }

            PoolHealth poolHealth = new PoolHealth(status, poolSize, healthy, degraded, dead, replaced, inUse,
                    clock.instant(), lastError);
            logger.info("Pool health: status={}, healthy={}, dead={}, replaced={}, inUse={}",
                    status, healthy, dead, replaced, inUse);
            return poolHealth;
        } finally {
            healthCheckLock.unlock();
        }
    }

    /**
     * Tries a bounded number of times to obtain a fresh connection that passes the probe.
     *
     * @return The replacement connection, or null when every attempt failed
     */
    private Connection reconnect() {
        for (int attempt = 1; attempt <= configParams.reconnectAttempts(); attempt++) {
            Connection replacement;
            try {
                replacement = dataSource.getConnection();
            } catch (SQLException e) {
                logger.warn("Reconnect attempt {} of {} failed: {}", attempt, configParams.reconnectAttempts(), e.getMessage());
                return null;
            }
            if (probe(replacement)) {
                logger.info("Replaced dead connection on attempt {}", attempt);
                return replacement;
            }
            dataSource.evictConnection(replacement);
        }
        return null;
    }

    /**
     * Validates a database connection by executing a simple test query.
     *
     * @param conn The connection to validate
     * @return true if the connection is valid, false otherwise
     */
    boolean probe(Connection conn) {
        if (conn == null) {
            return false;
        }
        try (PreparedStatement stmt = conn.prepareStatement(validationQuery(configParams.getDatabaseType()))) {
            stmt.setQueryTimeout(configParams.validationTimeoutSeconds());
            try (ResultSet rs = stmt.executeQuery()) {
                return rs.next();
            }
        } catch (SQLException e) {
            logger.debug("Connection validation failed: {}", e.getMessage());
            return false;
        }
    }

    /**
     * Runs a health check and, when the database answers, reads the server identity.
     */
    public ConnectionStatus checkConnection() {
        PoolHealth poolHealth = checkHealth();
        if (poolHealth.status() == HealthState.DEAD) {
            return new ConnectionStatus(false, poolHealth.status(), poolHealth, null);
        }

        try (PooledConnection lease = acquire()) {
            DatabaseMetaData metaData = lease.connection().getMetaData();
            ServerInfo serverInfo = new ServerInfo(
                    metaData.getDatabaseProductName(),
                    metaData.getDatabaseProductVersion(),
                    metaData.getDriverName(),
                    metaData.getDriverVersion(),
                    lease.connection().getCatalog(),
                    configParams.getDatabaseType());
            return new ConnectionStatus(true, poolHealth.status(), poolHealth, serverInfo);
        } catch (ToolException | SQLException e) {
            logger.warn("Pool reported {} but server metadata could not be read: {}", poolHealth.status(), e.getMessage());
            return new ConnectionStatus(false, HealthState.DEGRADED, poolHealth, null);
        }
    }

    public ConfigParams getConfig() {
        return configParams;
    }

    public int activeLeaseCount() {
        return activeLeases.size();
    }

    /**
     * Closes the connection pool and releases all database resources.
     * This method is idempotent and safe to call multiple times.
     */
    @Override
    public void close() {
        if (dataSource != null && !dataSource.isClosed()) {
            if (!activeLeases.isEmpty()) {
                logger.warn("Closing pool with {} connections still leased", activeLeases.size());
            }
            dataSource.close();
            logger.info("Database connection pool closed");
        }
    }
}
