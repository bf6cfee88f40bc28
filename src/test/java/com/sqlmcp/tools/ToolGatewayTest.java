package com.sqlmcp.tools;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.sqlmcp.TestUtils;
import com.sqlmcp.config.ConfigParams;
import com.sqlmcp.db.ConnectionManager;
import com.sqlmcp.db.PooledConnection;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.sql.SQLTimeoutException;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.startsWith;
import static org.mockito.Mockito.doReturn;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.spy;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class ToolGatewayTest {
    private static final ObjectMapper objectMapper = JsonSupport.mapper();
    private static final Clock FIXED_CLOCK = Clock.fixed(Instant.parse("2025-03-14T09:30:00Z"), ZoneOffset.UTC);

    @Nested
    class WithH2 {
        private ConfigParams configParams;
        private ConnectionManager connectionManager;
        private ToolGateway toolGateway;

        @BeforeEach
        void setUp() throws SQLException {
            configParams = TestUtils.createTestH2Config();
            TestUtils.setupTestDatabase(configParams);
            connectionManager = TestUtils.createConnectionManager(configParams);
            toolGateway = new ToolGateway(connectionManager, FIXED_CLOCK);
        }

        @AfterEach
        void tearDown() {
            connectionManager.close();
        }

        @Test
        void testDispatch_UnknownTool() {
            ToolResponse toolResponse = toolGateway.dispatch("drop_database", objectMapper.createObjectNode());

            assertEquals(RequestState.REJECTED, toolResponse.state());
            assertEquals(ErrorKind.UNKNOWN_TOOL, toolResponse.error().kind());
            assertEquals("drop_database", toolResponse.toolName());
            assertEquals(0, connectionManager.activeLeaseCount());
        }

        @Test
        void testDispatch_WriteStatementNeverReachesDatabase() throws SQLException {
            ObjectNode arguments = objectMapper.createObjectNode().put("query", "DELETE FROM users");

            ToolResponse toolResponse = toolGateway.dispatch("execute_query", arguments);

            assertEquals(RequestState.REJECTED, toolResponse.state());
            assertEquals(ErrorKind.VALIDATION_REJECTED, toolResponse.error().kind());
            assertEquals(4, TestUtils.countRows(configParams, "users"));
        }

        @Test
        void testDispatch_ExecuteQueryCompleted() {
            ObjectNode arguments = objectMapper.createObjectNode().put("query", "SELECT name FROM users WHERE id = ?");
            arguments.putArray("params").add(2);

            ToolResponse toolResponse = toolGateway.dispatch("execute_query", arguments);

            assertTrue(toolResponse.succeeded(), () -> toolResponse.toJson().toString());
            JsonNode resultNode = toolResponse.result();
            assertEquals(1, resultNode.path("row_count").asInt());
            assertFalse(resultNode.path("truncated").asBoolean());
            assertEquals(1000, resultNode.path("effective_limit").asInt());
            assertEquals("Jane Smith", resultNode.path("rows").get(0).path("NAME").asText());
            assertEquals(0, connectionManager.activeLeaseCount());
        }

        @Test
        void testDispatch_MetadataTools() {
            ToolResponse schemaResponse = toolGateway.dispatch("get_schema", objectMapper.createObjectNode());
            assertTrue(schemaResponse.succeeded());
            assertEquals(3, schemaResponse.result().path("table_count").asInt());
            assertTrue(schemaResponse.result().path("tables").get(0).has("columns"));

            ToolResponse namesOnlyResponse = toolGateway.dispatch("get_schema",
                    objectMapper.createObjectNode().put("include_columns", false));
            assertTrue(namesOnlyResponse.succeeded());
            assertFalse(namesOnlyResponse.result().path("tables").get(0).has("columns"));

            ToolResponse infoResponse = toolGateway.dispatch("get_table_info",
                    objectMapper.createObjectNode().put("table", "orders").put("sample_rows", 2));
            assertTrue(infoResponse.succeeded());
            assertEquals(4, infoResponse.result().path("row_count").asLong());
            assertEquals(2, infoResponse.result().path("sample_rows").size());

            ToolResponse searchResponse = toolGateway.dispatch("search_tables",
                    objectMapper.createObjectNode().put("pattern", "user").put("search_type", "table"));
            assertTrue(searchResponse.succeeded());
            assertEquals("table", searchResponse.result().path("search_type").asText());
            assertThat(searchResponse.result().path("matches").findValuesAsText("table"))
                    .containsExactly("ACTIVE_USERS", "USERS");

            ToolResponse statsResponse = toolGateway.dispatch("get_table_stats",
                    objectMapper.createObjectNode().put("table", "users"));
            assertTrue(statsResponse.succeeded());
            assertEquals(1, statsResponse.result().path("table_count").asInt());
            assertEquals(4, statsResponse.result().path("tables").get(0).path("row_count").asLong());
        }

        @Test
        void testDispatch_ExplainQuery() {
            ToolResponse toolResponse = toolGateway.dispatch("explain_query",
                    objectMapper.createObjectNode().put("query", "SELECT * FROM orders WHERE amount > 100"));

            assertTrue(toolResponse.succeeded(), () -> toolResponse.toJson().toString());
            assertEquals("h2", toolResponse.result().path("dialect").asText());
            assertTrue(toolResponse.result().path("root").has("operation"));
        }

        @Test
        void testDispatch_BackupAndInsert() throws SQLException {
            ToolResponse backupResponse = toolGateway.dispatch("backup_table",
                    objectMapper.createObjectNode().put("table", "users"));
            assertTrue(backupResponse.succeeded(), () -> backupResponse.toJson().toString());
            assertEquals("USERS_backup_20250314_093000", backupResponse.result().path("backup_table").asText());
            assertEquals(4, backupResponse.result().path("rows_copied").asLong());

            ObjectNode insertArguments = objectMapper.createObjectNode().put("table", "users").put("conflict_policy", "ignore");
            insertArguments.putArray("rows")
                    .add(objectMapper.createObjectNode().put("id", 1).put("name", "Again"))
                    .add(objectMapper.createObjectNode().put("id", 5).put("name", "Eve"));
            ToolResponse insertResponse = toolGateway.dispatch("insert_data", insertArguments);

            assertTrue(insertResponse.succeeded(), () -> insertResponse.toJson().toString());
            assertEquals(1, insertResponse.result().path("inserted").asInt());
            assertEquals(1, insertResponse.result().path("skipped").asInt());
            assertEquals(5, TestUtils.countRows(configParams, "users"));
        }

        @Test
        void testDispatch_FailureCarriesErrorKind() {
            ToolResponse toolResponse = toolGateway.dispatch("get_table_info",
                    objectMapper.createObjectNode().put("table", "missing_table"));

            assertEquals(RequestState.FAILED, toolResponse.state());
            assertEquals(ErrorKind.NOT_FOUND, toolResponse.error().kind());

            JsonNode responseJson = toolResponse.toJson();
            assertEquals("failed", responseJson.path("state").asText());
            assertEquals("NotFound", responseJson.path("error").path("kind").asText());
            assertFalse(responseJson.has("result"));
            assertEquals(0, connectionManager.activeLeaseCount());
        }

        @Test
        void testDispatch_CheckConnection() {
            ToolResponse toolResponse = toolGateway.dispatch("check_connection", null);

            assertTrue(toolResponse.succeeded());
            assertTrue(toolResponse.result().path("connected").asBoolean());
            assertEquals("healthy", toolResponse.result().path("status").asText());
            assertEquals("H2", toolResponse.result().path("server").path("database_product").asText());
        }

        @Test
        void testDispatch_ConcurrentCallsShareThePool() throws Exception {
            ExecutorService callers = Executors.newFixedThreadPool(12);
            try {
                List<Callable<ToolResponse>> toolCalls = new ArrayList<>();
                for (int i = 0; i < 40; i++) {
                    int userId = i % 4 + 1;
                    toolCalls.add(() -> {
                        ObjectNode arguments = objectMapper.createObjectNode()
                                .put("query", "SELECT id FROM users WHERE id = :id");
                        arguments.putObject("params").put("id", userId);
                        return toolGateway.dispatch("execute_query", arguments);
                    });
                }

                for (Future<ToolResponse> callResult : callers.invokeAll(toolCalls)) {
                    ToolResponse toolResponse = callResult.get();
                    assertTrue(toolResponse.succeeded(), () -> toolResponse.toJson().toString());
                    assertEquals(1, toolResponse.result().path("row_count").asInt());
                }
            } finally {
                callers.shutdownNow();
            }
            assertEquals(0, connectionManager.activeLeaseCount());
        }
    }

    @Nested
    @ExtendWith(MockitoExtension.class)
    class WithMockedPool {
        @Mock
        private ConnectionManager connectionManager;
        @Mock
        private PooledConnection lease;
        @Mock
        private Connection dbConn;

        private ToolGateway toolGateway;

        @BeforeEach
        void setUp() {
            ConfigParams configParams = ConfigParams.defaultConfig("jdbc:h2:mem:unused", "sa", "", "org.h2.Driver");
            lenient().when(connectionManager.getConfig()).thenReturn(configParams);
            toolGateway = new ToolGateway(connectionManager, FIXED_CLOCK);
        }

        @Test
        void testDispatch_PoolExhausted() throws Exception {
            when(connectionManager.acquire()).thenThrow(new ToolException(ErrorKind.POOL_EXHAUSTED, "all connections busy"));

            ToolResponse toolResponse = toolGateway.dispatch("get_schema", null);

            assertEquals(RequestState.FAILED, toolResponse.state());
            assertEquals(ErrorKind.POOL_EXHAUSTED, toolResponse.error().kind());
        }

        @Test
        void testDispatch_TimeoutMarksLeaseDegraded() throws Exception {
            when(connectionManager.acquire()).thenReturn(lease);
            when(lease.connection()).thenReturn(dbConn);
            when(dbConn.prepareStatement(anyString())).thenThrow(new SQLTimeoutException("statement cancelled"));

            ToolResponse toolResponse = toolGateway.dispatch("execute_query",
                    objectMapper.createObjectNode().put("query", "SELECT 1"));

            assertEquals(ErrorKind.TIMEOUT, toolResponse.error().kind());
            verify(lease).markDegraded();
            verify(lease).close();
        }

        @Test
        void testDispatch_TimedOutCountMarksLeaseDegraded() throws Exception {
            ConfigParams h2Config = TestUtils.createTestH2Config();
            TestUtils.setupTestDatabase(h2Config);
            try (Connection realConn = TestUtils.openConnection(h2Config)) {
                Connection slowCountConn = spy(realConn);
                PreparedStatement countStmt = mock(PreparedStatement.class);
                when(countStmt.executeQuery()).thenThrow(new SQLTimeoutException("statement cancelled"));
                doReturn(countStmt).when(slowCountConn).prepareStatement(startsWith("SELECT COUNT(*)"));
                when(connectionManager.acquire()).thenReturn(lease);
                when(lease.connection()).thenReturn(slowCountConn);

                ToolResponse toolResponse = toolGateway.dispatch("get_table_info",
                        objectMapper.createObjectNode().put("table", "users").put("sample_rows", 0));

                assertTrue(toolResponse.succeeded());
                assertTrue(toolResponse.result().path("row_count").isNull());
                verify(lease).markDegraded();
                verify(lease).close();
            }
        }

        @Test
        void testDispatch_RejectedCallNeverLeases() throws Exception {
            ToolResponse toolResponse = toolGateway.dispatch("backup_table",
                    objectMapper.createObjectNode().put("table", "users; DROP TABLE users"));

            assertEquals(ErrorKind.VALIDATION_REJECTED, toolResponse.error().kind());
            verify(connectionManager, never()).acquire();
        }
    }

    @Test
    void testLeavesConnectionSuspect() {
        assertTrue(ToolGateway.leavesConnectionSuspect(new ToolException(ErrorKind.TIMEOUT, "slow")));
        assertTrue(ToolGateway.leavesConnectionSuspect(new ToolException(ErrorKind.COPY_FAILED, "copy",
                new SQLException("link failure", "08S01"))));
        assertFalse(ToolGateway.leavesConnectionSuspect(new ToolException(ErrorKind.ROW_CONFLICT, "dup",
                new SQLException("duplicate", "23505"))));
        assertFalse(ToolGateway.leavesConnectionSuspect(new ToolException(ErrorKind.NOT_FOUND, "gone")));
    }
}
