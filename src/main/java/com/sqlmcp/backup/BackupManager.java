package com.sqlmcp.backup;

import com.sqlmcp.config.ConfigParams;
import com.sqlmcp.config.ResourceManager;
import com.sqlmcp.db.SqlErrors;
import com.sqlmcp.db.SqlNames;
import com.sqlmcp.schema.SchemaInspector;
import com.sqlmcp.schema.TableRef;
import com.sqlmcp.tools.ErrorKind;
import com.sqlmcp.tools.ToolException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;

/**
 * Copies a table's structure and rows into a new table next to it.
 *
 * <p>The target is created empty from the source's column list and filled with one
 * {@code INSERT ... SELECT} inside a transaction. If any step fails the transaction is rolled back
 * and the target is dropped, so a partial copy is never left behind.
 */
public class BackupManager {
    private static final Logger logger = LoggerFactory.getLogger(BackupManager.class);
    private static final DateTimeFormatter SUFFIX_FORMAT = DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss");
    static final int MAX_NAME_ATTEMPTS = 10;

    private final ConfigParams configParams;
    private final SchemaInspector schemaInspector;
    private final Clock clock;

    public BackupManager(ConfigParams configParams, SchemaInspector schemaInspector) {
        this(configParams, schemaInspector, Clock.systemDefaultZone());
    }

    public BackupManager(ConfigParams configParams, SchemaInspector schemaInspector, Clock clock) {
        this.configParams = configParams;
        this.schemaInspector = schemaInspector;
        this.clock = clock;
    }

    /**
     * Backs up a table.
     *
     * @param dbConn Leased connection; its auto-commit mode is restored afterwards
     * @param tableName Table to copy
     * @param requestedName Name for the copy, or null to derive {@code <table>_backup_<yyyyMMdd_HHmmss>}
     * @return Description of the committed copy
     * @throws ToolException SourceNotFound, TargetNameCollisionUnresolved or CopyFailed
     */
    public BackupSpec backupTable(Connection dbConn, String tableName, String requestedName) throws ToolException {
        TableRef sourceRef = schemaInspector.resolveTable(dbConn, tableName).orElseThrow(() -> new ToolException(
                ErrorKind.SOURCE_NOT_FOUND, ResourceManager.getErrorMessage("backup.source.not.found", tableName)));

        String baseName = requestedName != null
                ? requestedName
                : sourceRef.name() + "_backup_" + LocalDateTime.now(clock).format(SUFFIX_FORMAT);

        String quoteString;
        try {
            quoteString = SqlNames.quoteString(dbConn.getMetaData());
        } catch (SQLException e) {
            throw SqlErrors.classify(e, "read identifier quote");
        }
        String sourceQualified = sourceRef.qualifiedName(quoteString);

        for (int attempt = 1; ; attempt++) {
            String targetName = freeTargetName(dbConn, baseName);
            String targetQualified = SqlNames.qualify(sourceRef.schema(), targetName, quoteString);
            logger.info("SECURITY: Backing up table {} into {}", sourceQualified, targetQualified);
            try {
                long rowsCopied = copyTable(dbConn, sourceQualified, targetName, targetQualified);
                Instant completedAt = Instant.now(clock);
                logger.info("Backup of {} completed: {} rows copied into {}", sourceRef.name(), rowsCopied, targetName);
                return new BackupSpec(sourceRef.schema(), sourceRef.name(), targetName, rowsCopied, completedAt);
            } catch (ToolException e) {
                if (e.getErrorKind() != ErrorKind.TARGET_NAME_COLLISION_UNRESOLVED || attempt >= MAX_NAME_ATTEMPTS) {
                    throw e;
                }
                logger.info("Backup name {} was taken concurrently, choosing another", targetName);
            }
        }
    }

    /**
     * Returns the base name if no table has it, otherwise the first free {@code base_N}.
     */
    String freeTargetName(Connection dbConn, String baseName) throws ToolException {
        String candidateName = baseName;
        for (int attempt = 1; attempt <= MAX_NAME_ATTEMPTS; attempt++) {
            if (schemaInspector.resolveTable(dbConn, candidateName).isEmpty()) {
                return candidateName;
            }
            logger.debug("Backup name {} already taken", candidateName);
            candidateName = baseName + "_" + (attempt + 1);
        }
        throw new ToolException(ErrorKind.TARGET_NAME_COLLISION_UNRESOLVED,
                ResourceManager.getErrorMessage("backup.name.collision", baseName, MAX_NAME_ATTEMPTS));
    }

    /**
     * Creates and fills the target. Only a target this call created is dropped on failure; when the
     * structure statement fails because another caller took the name first, that table is left alone
     * and the failure is reported as a name collision.
     */
    private long copyTable(Connection dbConn, String sourceQualified, String targetName, String targetQualified)
            throws ToolException {
        boolean originalAutoCommit = true;
        boolean targetCreated = false;
        try {
            originalAutoCommit = dbConn.getAutoCommit();
            dbConn.setAutoCommit(false);

            try (Statement copyStmt = dbConn.createStatement()) {
                copyStmt.setQueryTimeout(configParams.backupTimeoutSeconds());
                copyStmt.execute(structureStatement(configParams.getDatabaseType(), sourceQualified, targetQualified));
                targetCreated = true;
                long rowsCopied = copyStmt.executeUpdate("INSERT INTO " + targetQualified + " SELECT * FROM " + sourceQualified);
                dbConn.commit();
                return rowsCopied;
            }
        } catch (SQLException e) {
            ToolException copyFailure = new ToolException(ErrorKind.COPY_FAILED,
                    ResourceManager.getErrorMessage("backup.copy.failed", sourceQualified, e.getMessage()), e);
            rollbackQuietly(dbConn, copyFailure);
            if (targetCreated) {
                dropLeftoverTarget(dbConn, targetName, targetQualified, copyFailure);
            } else if (targetTaken(dbConn, targetName, copyFailure)) {
                throw new ToolException(ErrorKind.TARGET_NAME_COLLISION_UNRESOLVED,
                        ResourceManager.getErrorMessage("backup.name.taken", targetName), e);
            }
            throw copyFailure;
        } finally {
            try {
                dbConn.setAutoCommit(originalAutoCommit);
            } catch (SQLException e) {
                logger.warn("Could not restore auto-commit after backup: {}", e.getMessage());
            }
        }
    }

    static String structureStatement(String dbType, String sourceQualified, String targetQualified) {
        if ("sqlserver".equals(dbType)) {
            return "SELECT * INTO " + targetQualified + " FROM " + sourceQualified + " WHERE 1 = 0";
        }
        return "CREATE TABLE " + targetQualified + " AS SELECT * FROM " + sourceQualified + " WHERE 1 = 0";
    }

    private static void rollbackQuietly(Connection dbConn, ToolException copyFailure) {
        try {
            dbConn.rollback();
        } catch (SQLException e) {
            logger.warn("Rollback after failed backup failed: {}", e.getMessage());
            copyFailure.addSuppressed(e);
        }
    }

    private boolean targetTaken(Connection dbConn, String targetName, ToolException copyFailure) {
        try {
            return schemaInspector.resolveTable(dbConn, targetName).isPresent();
        } catch (ToolException e) {
            copyFailure.addSuppressed(e);
            return false;
        }
    }

    // DDL commits implicitly on H2, MySQL and Oracle, so the rollback alone may leave the empty target behind
    private void dropLeftoverTarget(Connection dbConn, String targetName, String targetQualified, ToolException copyFailure) {
        try {
            if (schemaInspector.resolveTable(dbConn, targetName).isEmpty()) {
                return;
            }
            try (Statement dropStmt = dbConn.createStatement()) {
                dropStmt.setQueryTimeout(configParams.backupTimeoutSeconds());
                dropStmt.execute("DROP TABLE " + targetQualified);
                dbConn.commit();
            }
            logger.info("Dropped partial backup table {}", targetQualified);
        } catch (ToolException | SQLException e) {
            logger.error("Partial backup table {} could not be dropped: {}", targetQualified, e.getMessage());
            copyFailure.addSuppressed(e);
        }
    }
}
