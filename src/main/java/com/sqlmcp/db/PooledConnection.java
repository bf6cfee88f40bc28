package com.sqlmcp.db;

import java.sql.Connection;
import java.time.Instant;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Exclusive lease on one pooled connection for the duration of a single tool call.
 * Closing the lease releases it back to the {@link ConnectionManager}; closing twice is a no-op.
 */
public class PooledConnection implements AutoCloseable {
    private final Connection connection;
    private final ConnectionManager owner;
    private final AtomicBoolean released = new AtomicBoolean(false);
    private volatile HealthState healthState = HealthState.HEALTHY;
    private volatile Instant lastChecked;

    PooledConnection(Connection connection, ConnectionManager owner, Instant borrowedAt) {
        this.connection = connection;
        this.owner = owner;
        this.lastChecked = borrowedAt;
    }

    /**
     * Returns the underlying connection.
     *
     * @throws IllegalStateException if the lease was already released
     */
    public Connection connection() {
        if (released.get()) {
            throw new IllegalStateException("Connection lease already released");
        }
        return connection;
    }

    /**
     * Flags the connection as suspect, so it is probed before going back to the pool.
     */
    public void markDegraded() {
        if (healthState == HealthState.HEALTHY) {
            healthState = HealthState.DEGRADED;
        }
    }

    public HealthState healthState() {
        return healthState;
    }

    public Instant lastChecked() {
        return lastChecked;
    }

    public boolean isReleased() {
        return released.get();
    }

    Connection rawConnection() {
        return connection;
    }

    boolean markReleased() {
        return released.compareAndSet(false, true);
    }

    void recordProbe(boolean alive, Instant checkedAt) {
        healthState = alive ? HealthState.HEALTHY : HealthState.DEAD;
        lastChecked = checkedAt;
    }

    @Override
    public void close() {
        owner.release(this);
    }
}
