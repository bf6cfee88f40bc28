package com.sqlmcp.safety;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.sqlmcp.config.ConfigParams;
import com.sqlmcp.tools.ErrorKind;
import com.sqlmcp.tools.ToolName;
import com.sqlmcp.tools.ToolRequest;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class SafetyPolicyEnforcerTest {
    private final ObjectMapper objectMapper = new ObjectMapper();
    private ConfigParams configParams;
    private SafetyPolicyEnforcer enforcer;

    @BeforeEach
    void setUp() {
        configParams = ConfigParams.customConfig("jdbc:h2:mem:policy", "sa", "", "org.h2.Driver", 5, 500)
                .withMaxInsertRows(3);
        enforcer = new SafetyPolicyEnforcer(configParams);
    }

    private SafetyDecision evaluate(ToolName toolName, ObjectNode arguments) {
        return enforcer.evaluate(new ToolRequest(toolName, arguments));
    }

    private static void assertRejected(SafetyDecision decision, ErrorKind expectedKind) {
        assertFalse(decision.allowed(), "expected a rejection");
        assertEquals(expectedKind, decision.rejectionKind());
        assertThat(decision.reason()).isNotBlank();
    }

    @Nested
    class ExecuteQuery {
        @Test
        void allowsReadWithDefaultLimit() {
            ObjectNode arguments = objectMapper.createObjectNode();
            arguments.put("query", "SELECT * FROM users");

            SafetyDecision decision = evaluate(ToolName.EXECUTE_QUERY, arguments);

            assertTrue(decision.allowed());
            assertEquals(500, decision.effectiveLimit());
            assertThat(decision.statement()).endsWith("LIMIT 501");
            assertTrue(decision.parameters().isEmpty());
            assertEquals(ToolName.EXECUTE_QUERY, decision.tool());
        }

        @Test
        void clampsRequestedLimitToCeiling() {
            ObjectNode arguments = objectMapper.createObjectNode();
            arguments.put("query", "SELECT * FROM users");
            arguments.put("limit", 100000);

            assertEquals(500, evaluate(ToolName.EXECUTE_QUERY, arguments).effectiveLimit());

            arguments.put("limit", 10);
            assertEquals(10, evaluate(ToolName.EXECUTE_QUERY, arguments).effectiveLimit());
        }

        @Test
        void rejectsBadLimits() {
            ObjectNode arguments = objectMapper.createObjectNode();
            arguments.put("query", "SELECT 1");
            arguments.put("limit", 0);
            assertRejected(evaluate(ToolName.EXECUTE_QUERY, arguments), ErrorKind.INVALID_ARGUMENTS);

            arguments.put("limit", -5);
            assertRejected(evaluate(ToolName.EXECUTE_QUERY, arguments), ErrorKind.INVALID_ARGUMENTS);

            arguments.put("limit", "ten");
            assertRejected(evaluate(ToolName.EXECUTE_QUERY, arguments), ErrorKind.INVALID_ARGUMENTS);
        }

        @Test
        void rejectsWriteStatement() {
            ObjectNode arguments = objectMapper.createObjectNode();
            arguments.put("query", "DELETE FROM users");

            SafetyDecision decision = evaluate(ToolName.EXECUTE_QUERY, arguments);

            assertRejected(decision, ErrorKind.VALIDATION_REJECTED);
            assertNull(decision.statement());
        }

        @Test
        void missingQueryIsInvalidArguments() {
            assertRejected(evaluate(ToolName.EXECUTE_QUERY, objectMapper.createObjectNode()), ErrorKind.INVALID_ARGUMENTS);

            ObjectNode arguments = objectMapper.createObjectNode();
            arguments.put("query", 42);
            assertRejected(evaluate(ToolName.EXECUTE_QUERY, arguments), ErrorKind.INVALID_ARGUMENTS);
        }

        @Test
        void rejectsUnknownArguments() {
            ObjectNode arguments = objectMapper.createObjectNode();
            arguments.put("query", "SELECT 1");
            arguments.put("select_only", false);

            SafetyDecision decision = evaluate(ToolName.EXECUTE_QUERY, arguments);

            assertRejected(decision, ErrorKind.INVALID_ARGUMENTS);
            assertThat(decision.reason()).contains("select_only");
        }

        @Test
        void bindsPositionalParameters() {
            ObjectNode arguments = objectMapper.createObjectNode();
            arguments.put("query", "SELECT * FROM users WHERE age > ? AND name = ?");
            ArrayNode params = arguments.putArray("params");
            params.add(30);
            params.addNull();

            SafetyDecision decision = evaluate(ToolName.EXECUTE_QUERY, arguments);

            assertTrue(decision.allowed());
            assertEquals(Arrays.asList(30, null), decision.parameters());
        }

        @Test
        void bindsNamedParameters() {
            ObjectNode arguments = objectMapper.createObjectNode();
            arguments.put("query", "SELECT * FROM users WHERE age > :min_age AND country = :country");
            ObjectNode params = arguments.putObject("params");
            params.put("country", "DE");
            params.put("min_age", 18);

            SafetyDecision decision = evaluate(ToolName.EXECUTE_QUERY, arguments);

            assertTrue(decision.allowed());
            assertThat(decision.statement()).contains("age > ? AND country = ?");
            assertEquals(List.of(18, "DE"), decision.parameters());
        }

        @Test
        void rejectsParameterMismatches() {
            ObjectNode arguments = objectMapper.createObjectNode();
            arguments.put("query", "SELECT * FROM users WHERE age > ?");
            assertRejected(evaluate(ToolName.EXECUTE_QUERY, arguments), ErrorKind.INVALID_ARGUMENTS);

            arguments.putArray("params").add(1).add(2);
            SafetyDecision tooMany = evaluate(ToolName.EXECUTE_QUERY, arguments);
            assertRejected(tooMany, ErrorKind.INVALID_ARGUMENTS);
            assertThat(tooMany.reason()).contains("1").contains("2");

            arguments.put("query", "SELECT * FROM users WHERE age > :age");
            arguments.putObject("params").put("other", 1);
            assertRejected(evaluate(ToolName.EXECUTE_QUERY, arguments), ErrorKind.INVALID_ARGUMENTS);

            arguments.put("query", "SELECT * FROM users WHERE age > :age AND id = ?");
            arguments.putObject("params").put("age", 1);
            assertRejected(evaluate(ToolName.EXECUTE_QUERY, arguments), ErrorKind.INVALID_ARGUMENTS);

            arguments.put("query", "SELECT * FROM users WHERE age > ?");
            arguments.putArray("params").addObject().put("nested", true);
            assertRejected(evaluate(ToolName.EXECUTE_QUERY, arguments), ErrorKind.INVALID_ARGUMENTS);
        }

        @Test
        void injectionInParameterIsJustAValue() {
            ObjectNode arguments = objectMapper.createObjectNode();
            arguments.put("query", "SELECT * FROM users WHERE name = ?");
            arguments.putArray("params").add("'; DROP TABLE users; --");

            SafetyDecision decision = evaluate(ToolName.EXECUTE_QUERY, arguments);

            assertTrue(decision.allowed());
            assertEquals(List.of("'; DROP TABLE users; --"), decision.parameters());
        }
    }

    @Nested
    class MetadataTools {
        @Test
        void identifiersMustBePlain() {
            ObjectNode arguments = objectMapper.createObjectNode();
            arguments.put("table", "users; DROP TABLE users");
            assertRejected(evaluate(ToolName.GET_SCHEMA, arguments), ErrorKind.VALIDATION_REJECTED);
            assertRejected(evaluate(ToolName.GET_TABLE_STATS, arguments), ErrorKind.VALIDATION_REJECTED);
            assertRejected(evaluate(ToolName.GET_TABLE_INFO, arguments), ErrorKind.VALIDATION_REJECTED);

            arguments.put("table", "x".repeat(129));
            assertRejected(evaluate(ToolName.GET_SCHEMA, arguments), ErrorKind.VALIDATION_REJECTED);

            arguments.put("table", "Series_Record_2024");
            assertTrue(evaluate(ToolName.GET_SCHEMA, arguments).allowed());
        }

        @Test
        void getSchemaFlagMustBeBoolean() {
            ObjectNode arguments = objectMapper.createObjectNode();
            arguments.put("include_indexes", "yes");
            assertRejected(evaluate(ToolName.GET_SCHEMA, arguments), ErrorKind.INVALID_ARGUMENTS);

            arguments.put("include_indexes", true);
            assertTrue(evaluate(ToolName.GET_SCHEMA, arguments).allowed());

            arguments.put("include_columns", 0);
            assertRejected(evaluate(ToolName.GET_SCHEMA, arguments), ErrorKind.INVALID_ARGUMENTS);
            arguments.put("include_columns", false);
            assertTrue(evaluate(ToolName.GET_SCHEMA, arguments).allowed());
            assertTrue(evaluate(ToolName.GET_SCHEMA, objectMapper.createObjectNode()).allowed());
        }

        @Test
        void tableInfoSampleRowsAreCapped() {
            ObjectNode arguments = objectMapper.createObjectNode();
            arguments.put("table", "users");
            assertEquals(ConfigParams.DEFAULT_SAMPLE_ROWS, evaluate(ToolName.GET_TABLE_INFO, arguments).effectiveLimit());

            arguments.put("sample_rows", 1000);
            assertEquals(configParams.sampleRowLimit(), evaluate(ToolName.GET_TABLE_INFO, arguments).effectiveLimit());

            arguments.put("sample_rows", 0);
            assertEquals(0, evaluate(ToolName.GET_TABLE_INFO, arguments).effectiveLimit());

            assertRejected(evaluate(ToolName.GET_TABLE_INFO, objectMapper.createObjectNode()), ErrorKind.INVALID_ARGUMENTS);
        }

        @Test
        void checkConnectionTakesNoArguments() {
            assertTrue(evaluate(ToolName.CHECK_CONNECTION, objectMapper.createObjectNode()).allowed());

            ObjectNode arguments = objectMapper.createObjectNode();
            arguments.put("verbose", true);
            assertRejected(evaluate(ToolName.CHECK_CONNECTION, arguments), ErrorKind.INVALID_ARGUMENTS);
        }

        @Test
        void searchPatternIsLiteral() {
            ObjectNode arguments = objectMapper.createObjectNode();
            arguments.put("pattern", "gdp");
            arguments.put("search_type", "COLUMN");
            assertTrue(evaluate(ToolName.SEARCH_TABLES, arguments).allowed());

            arguments.put("pattern", "gdp%' OR 1=1 --");
            assertTrue(evaluate(ToolName.SEARCH_TABLES, arguments).allowed());
            arguments.put("pattern", "Größe");
            assertTrue(evaluate(ToolName.SEARCH_TABLES, arguments).allowed());

            arguments.put("pattern", "gdp\u0000");
            assertRejected(evaluate(ToolName.SEARCH_TABLES, arguments), ErrorKind.VALIDATION_REJECTED);
            arguments.put("pattern", "   ");
            assertRejected(evaluate(ToolName.SEARCH_TABLES, arguments), ErrorKind.VALIDATION_REJECTED);
            arguments.put("pattern", "x".repeat(129));
            assertRejected(evaluate(ToolName.SEARCH_TABLES, arguments), ErrorKind.VALIDATION_REJECTED);

            arguments.put("pattern", "gdp");
            arguments.put("search_type", "index");
            assertRejected(evaluate(ToolName.SEARCH_TABLES, arguments), ErrorKind.INVALID_ARGUMENTS);
        }

        @Test
        void explainQueryUsesReadPolicyWithoutLimit() {
            ObjectNode arguments = objectMapper.createObjectNode();
            arguments.put("query", "SELECT * FROM users WHERE id = ?");
            arguments.putArray("params").add(1);

            SafetyDecision decision = evaluate(ToolName.EXPLAIN_QUERY, arguments);
            assertTrue(decision.allowed());
            assertEquals("SELECT * FROM users WHERE id = ?", decision.statement());

            arguments.put("query", "UPDATE users SET name = 'x'");
            arguments.remove("params");
            assertRejected(evaluate(ToolName.EXPLAIN_QUERY, arguments), ErrorKind.VALIDATION_REJECTED);

            arguments.put("query", "SELECT 1");
            arguments.put("limit", 5);
            assertRejected(evaluate(ToolName.EXPLAIN_QUERY, arguments), ErrorKind.INVALID_ARGUMENTS);
        }

        @Test
        void backupNamesAreIdentifiers() {
            ObjectNode arguments = objectMapper.createObjectNode();
            arguments.put("table", "users");
            assertTrue(evaluate(ToolName.BACKUP_TABLE, arguments).allowed());

            arguments.put("backup_name", "users-copy");
            assertRejected(evaluate(ToolName.BACKUP_TABLE, arguments), ErrorKind.VALIDATION_REJECTED);
        }
    }

    @Nested
    class InsertData {
        private ObjectNode insertArguments(int rowCount) {
            ObjectNode arguments = objectMapper.createObjectNode();
            arguments.put("table", "users");
            ArrayNode rows = arguments.putArray("rows");
            for (int i = 0; i < rowCount; i++) {
                rows.addObject().put("id", i).put("name", "user " + i);
            }
            return arguments;
        }

        @Test
        void allowsBatchWithinCeiling() {
            SafetyDecision decision = evaluate(ToolName.INSERT_DATA, insertArguments(3));

            assertTrue(decision.allowed());
            assertEquals(3, decision.effectiveLimit());
        }

        @Test
        void rejectsOversizedBatch() {
            SafetyDecision decision = evaluate(ToolName.INSERT_DATA, insertArguments(4));

            assertRejected(decision, ErrorKind.BATCH_TOO_LARGE);
            assertThat(decision.reason()).contains("4").contains("3");
        }

        @Test
        void rejectsMalformedRows() {
            assertRejected(evaluate(ToolName.INSERT_DATA, insertArguments(0)), ErrorKind.INVALID_ARGUMENTS);

            ObjectNode nestedValue = insertArguments(1);
            ((ObjectNode) nestedValue.get("rows").get(0)).putObject("name").put("first", "x");
            assertRejected(evaluate(ToolName.INSERT_DATA, nestedValue), ErrorKind.INVALID_ARGUMENTS);

            ObjectNode badColumn = insertArguments(1);
            ((ObjectNode) badColumn.get("rows").get(0)).put("name; DROP", "x");
            assertRejected(evaluate(ToolName.INSERT_DATA, badColumn), ErrorKind.VALIDATION_REJECTED);
        }

        @Test
        void conflictOptions() {
            ObjectNode arguments = insertArguments(2);
            arguments.put("conflict_policy", "upsert");
            assertRejected(evaluate(ToolName.INSERT_DATA, arguments), ErrorKind.INVALID_ARGUMENTS);

            arguments.put("conflict_policy", "update");
            arguments.putArray("conflict_key").add("id");
            assertTrue(evaluate(ToolName.INSERT_DATA, arguments).allowed());

            arguments.putArray("conflict_key");
            assertRejected(evaluate(ToolName.INSERT_DATA, arguments), ErrorKind.INVALID_ARGUMENTS);

            arguments.put("conflict_key", "id");
            assertRejected(evaluate(ToolName.INSERT_DATA, arguments), ErrorKind.INVALID_ARGUMENTS);
        }
    }
}
