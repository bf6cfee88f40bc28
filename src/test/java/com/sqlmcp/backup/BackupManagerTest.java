package com.sqlmcp.backup;

import com.sqlmcp.TestUtils;
import com.sqlmcp.config.ConfigParams;
import com.sqlmcp.schema.JdbcSchemaInspector;
import com.sqlmcp.schema.SchemaInspector;
import com.sqlmcp.schema.TableRef;
import com.sqlmcp.tools.ErrorKind;
import com.sqlmcp.tools.ToolException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.sql.Connection;
import java.sql.DatabaseMetaData;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.atLeastOnce;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.spy;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class BackupManagerTest {
    private static final Instant NOW = Instant.parse("2025-03-14T09:30:00Z");
    private static final Clock FIXED_CLOCK = Clock.fixed(NOW, ZoneOffset.UTC);

    @Nested
    class WithH2 {
        private ConfigParams configParams;
        private Connection dbConn;
        private BackupManager backupManager;

        @BeforeEach
        void setUp() throws SQLException {
            configParams = TestUtils.createTestH2Config();
            TestUtils.setupTestDatabase(configParams);
            dbConn = TestUtils.openConnection(configParams);
            backupManager = new BackupManager(configParams, new JdbcSchemaInspector(configParams), FIXED_CLOCK);
        }

        @AfterEach
        void tearDown() throws SQLException {
            dbConn.close();
        }

        @Test
        void backupTable_DerivesTimestampedName() throws Exception {
            BackupSpec backupSpec = backupManager.backupTable(dbConn, "users", null);

            assertEquals("USERS_backup_20250314_093000", backupSpec.backupTable());
            assertEquals("USERS", backupSpec.sourceTable());
            assertEquals("PUBLIC", backupSpec.schema());
            assertEquals(4, backupSpec.rowsCopied());
            assertEquals(NOW, backupSpec.completedAt());
            assertEquals(4, TestUtils.countRows(configParams, "\"USERS_backup_20250314_093000\""));
            assertEquals(4, TestUtils.countRows(configParams, "users"));
            assertTrue(dbConn.getAutoCommit());
        }

        @Test
        void backupTable_CollisionGetsNumericSuffix() throws Exception {
            try (Statement stmt = dbConn.createStatement()) {
                stmt.execute("CREATE TABLE users_backup_20250314_093000 (id INT)");
            }

            BackupSpec first = backupManager.backupTable(dbConn, "users", null);
            BackupSpec second = backupManager.backupTable(dbConn, "users", null);

            assertEquals("USERS_backup_20250314_093000_2", first.backupTable());
            assertEquals("USERS_backup_20250314_093000_3", second.backupTable());
        }

        @Test
        void backupTable_RequestedName() throws Exception {
            BackupSpec backupSpec = backupManager.backupTable(dbConn, "ORDERS", "orders_before_cleanup");

            assertEquals("orders_before_cleanup", backupSpec.backupTable());
            assertEquals(4, backupSpec.rowsCopied());
            assertTrue(new JdbcSchemaInspector(configParams).resolveTable(dbConn, "ORDERS_BEFORE_CLEANUP").isPresent());
        }

        @Test
        void backupTable_EmptyTableCopiesStructure() throws Exception {
            try (Statement stmt = dbConn.createStatement()) {
                stmt.execute("CREATE TABLE staging (id INT, payload VARCHAR(20))");
            }

            BackupSpec backupSpec = backupManager.backupTable(dbConn, "staging", "staging_copy");

            assertEquals(0, backupSpec.rowsCopied());
            assertEquals(2, new JdbcSchemaInspector(configParams)
                    .describe(dbConn, new JdbcSchemaInspector(configParams).requireTable(dbConn, "staging_copy"), false)
                    .columns().size());
        }

        @Test
        void backupTable_MissingSource() {
            ToolException exception = assertThrows(ToolException.class,
                    () -> backupManager.backupTable(dbConn, "ghosts", null));

            assertEquals(ErrorKind.SOURCE_NOT_FOUND, exception.getErrorKind());
        }

        @Test
        void backupTable_NameTakenByConcurrentBackupIsLeftIntact() throws Exception {
            JdbcSchemaInspector racingInspector = spy(new JdbcSchemaInspector(configParams));
            AtomicBoolean otherBackupCreated = new AtomicBoolean();
            doAnswer(invocation -> {
                Object resolved = invocation.callRealMethod();
                if (otherBackupCreated.compareAndSet(false, true)) {
                    try (Connection otherConn = TestUtils.openConnection(configParams);
                         Statement stmt = otherConn.createStatement()) {
                        stmt.execute("CREATE TABLE \"users_copy\" AS SELECT * FROM users");
                    }
                }
                return resolved;
            }).when(racingInspector).resolveTable(any(Connection.class), eq("users_copy"));

            BackupSpec backupSpec = new BackupManager(configParams, racingInspector, FIXED_CLOCK)
                    .backupTable(dbConn, "users", "users_copy");

            assertEquals("users_copy_2", backupSpec.backupTable());
            assertEquals(4, backupSpec.rowsCopied());
            assertEquals(4, TestUtils.countRows(configParams, "\"users_copy\""));
            assertEquals(4, TestUtils.countRows(configParams, "\"users_copy_2\""));
        }

        @Test
        void freeTargetName_GivesUpAfterMaxAttempts() throws Exception {
            try (Statement stmt = dbConn.createStatement()) {
                stmt.execute("CREATE TABLE taken (id INT)");
                for (int i = 2; i <= BackupManager.MAX_NAME_ATTEMPTS; i++) {
                    stmt.execute("CREATE TABLE taken_" + i + " (id INT)");
                }
            }

            ToolException exception = assertThrows(ToolException.class,
                    () -> backupManager.freeTargetName(dbConn, "taken"));
            assertEquals(ErrorKind.TARGET_NAME_COLLISION_UNRESOLVED, exception.getErrorKind());
        }
    }

    @Nested
    @ExtendWith(MockitoExtension.class)
    class WithMockedConnection {
        @Mock
        private SchemaInspector schemaInspector;
        @Mock
        private Connection dbConn;
        @Mock
        private DatabaseMetaData metaData;
        @Mock
        private Statement copyStmt;

        @Test
        void backupTable_FailedCopyIsRolledBackAndDropped() throws Exception {
            ConfigParams configParams = ConfigParams.defaultConfig("jdbc:postgresql://db:5432/stats", "u", "p", "org.postgresql.Driver");
            TableRef sourceRef = new TableRef("stats", "public", "orders", "TABLE");
            TableRef leftoverRef = new TableRef("stats", "public", "orders_copy", "TABLE");

            when(schemaInspector.resolveTable(dbConn, "orders")).thenReturn(Optional.of(sourceRef));
            when(schemaInspector.resolveTable(dbConn, "orders_copy")).thenReturn(Optional.empty(), Optional.of(leftoverRef));
            when(dbConn.getMetaData()).thenReturn(metaData);
            when(metaData.getIdentifierQuoteString()).thenReturn("\"");
            when(dbConn.getAutoCommit()).thenReturn(true);
            when(dbConn.createStatement()).thenReturn(copyStmt);
            when(copyStmt.executeUpdate(anyString())).thenThrow(new SQLException("disk full", "53100"));
            lenient().when(copyStmt.execute(anyString())).thenReturn(false);

            BackupManager backupManager = new BackupManager(configParams, schemaInspector, FIXED_CLOCK);
            ToolException exception = assertThrows(ToolException.class,
                    () -> backupManager.backupTable(dbConn, "orders", "orders_copy"));

            assertEquals(ErrorKind.COPY_FAILED, exception.getErrorKind());
            InOrder inOrder = inOrder(dbConn, copyStmt);
            inOrder.verify(dbConn).setAutoCommit(false);
            inOrder.verify(copyStmt).execute("CREATE TABLE \"public\".\"orders_copy\" AS SELECT * FROM \"public\".\"orders\" WHERE 1 = 0");
            inOrder.verify(dbConn).rollback();
            inOrder.verify(copyStmt).execute("DROP TABLE \"public\".\"orders_copy\"");
            inOrder.verify(dbConn).setAutoCommit(true);
            verify(copyStmt, atLeastOnce()).setQueryTimeout(configParams.backupTimeoutSeconds());
        }

        @Test
        void backupTable_SourceNotFoundTouchesNothing() throws Exception {
            ConfigParams configParams = ConfigParams.defaultConfig("jdbc:postgresql://db:5432/stats", "u", "p", "org.postgresql.Driver");
            when(schemaInspector.resolveTable(dbConn, "orders")).thenReturn(Optional.empty());

            BackupManager backupManager = new BackupManager(configParams, schemaInspector, FIXED_CLOCK);
            ToolException exception = assertThrows(ToolException.class,
                    () -> backupManager.backupTable(dbConn, "orders", null));

            assertEquals(ErrorKind.SOURCE_NOT_FOUND, exception.getErrorKind());
            verify(dbConn, never()).createStatement();
        }
    }

    @Test
    void structureStatement_PerDialect() {
        assertEquals("SELECT * INTO [dbo].[t_copy] FROM [dbo].[t] WHERE 1 = 0",
                BackupManager.structureStatement("sqlserver", "[dbo].[t]", "[dbo].[t_copy]"));
        assertEquals("CREATE TABLE \"t_copy\" AS SELECT * FROM \"t\" WHERE 1 = 0",
                BackupManager.structureStatement("postgresql", "\"t\"", "\"t_copy\""));
    }
}
