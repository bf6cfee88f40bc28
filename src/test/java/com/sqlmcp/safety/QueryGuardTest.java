package com.sqlmcp.safety;

import com.sqlmcp.tools.ErrorKind;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class QueryGuardTest {
    private static final int MAX_LENGTH = 10000;

    private final QueryGuard h2Guard = new QueryGuard("h2");

    @Test
    void requireSingleRead_AcceptsSelectAndWith() throws PolicyViolation {
        assertEquals("SELECT * FROM users", h2Guard.requireSingleRead("SELECT * FROM users", MAX_LENGTH));
        assertEquals("WITH a AS (SELECT 1 AS x) SELECT x FROM a",
                h2Guard.requireSingleRead("WITH a AS (SELECT 1 AS x) SELECT x FROM a", MAX_LENGTH));
        assertEquals("(SELECT 1)", h2Guard.requireSingleRead("(SELECT 1)", MAX_LENGTH));
    }

    @Test
    void requireSingleRead_DropsTrailingSemicolonsAndComments() throws PolicyViolation {
        assertEquals("SELECT 1", h2Guard.requireSingleRead("  SELECT 1 ;; \n", MAX_LENGTH));
        assertThat(h2Guard.requireSingleRead("SELECT 1 -- trailing note\n", MAX_LENGTH)).isEqualTo("SELECT 1");
        assertThat(h2Guard.requireSingleRead("SELECT /* ; DROP TABLE users */ 1", MAX_LENGTH))
                .doesNotContain("DROP");
    }

    @Test
    void requireSingleRead_LiteralsCannotHideStatements() throws PolicyViolation {
        String statement = "SELECT * FROM users WHERE name = 'x; DROP TABLE users' AND note = \"delete\"";
        assertEquals(statement, h2Guard.requireSingleRead(statement, MAX_LENGTH));

        String escapedQuote = "SELECT * FROM users WHERE name = 'O''Brien; DELETE FROM users'";
        assertEquals(escapedQuote, h2Guard.requireSingleRead(escapedQuote, MAX_LENGTH));
    }

    @ParameterizedTest
    @ValueSource(strings = {
            "DELETE FROM users",
            "UPDATE users SET name = 'x'",
            "INSERT INTO users VALUES (1)",
            "DROP TABLE users",
            "CREATE TABLE t (id INT)",
            "TRUNCATE TABLE users",
            "GRANT SELECT ON users TO public",
            "CALL some_procedure()",
            "EXEC xp_cmdshell 'dir'",
            "SELECT 1; DROP TABLE users",
            "SELECT * INTO users_copy FROM users",
            "WITH d AS (DELETE FROM users RETURNING *) SELECT * FROM d",
            "SELECT 1 /* harmless */ ; DELETE FROM users",
            "sElEcT 1; dRoP table users"
    })
    void requireSingleRead_RejectsWritesAndBatches(String statement) {
        PolicyViolation violation = assertThrows(PolicyViolation.class,
                () -> h2Guard.requireSingleRead(statement, MAX_LENGTH));
        assertEquals(ErrorKind.VALIDATION_REJECTED, violation.getErrorKind());
    }

    @Test
    void requireSingleRead_EmptyIsInvalidArguments() {
        PolicyViolation blank = assertThrows(PolicyViolation.class, () -> h2Guard.requireSingleRead("   ", MAX_LENGTH));
        assertEquals(ErrorKind.INVALID_ARGUMENTS, blank.getErrorKind());

        PolicyViolation onlyComment = assertThrows(PolicyViolation.class,
                () -> h2Guard.requireSingleRead("-- nothing here", MAX_LENGTH));
        assertEquals(ErrorKind.INVALID_ARGUMENTS, onlyComment.getErrorKind());
    }

    @Test
    void requireSingleRead_LengthAndSyntax() {
        PolicyViolation tooLong = assertThrows(PolicyViolation.class,
                () -> h2Guard.requireSingleRead("SELECT " + "1, ".repeat(20) + "1", 30));
        assertThat(tooLong.getMessage()).contains("30");

        assertThrows(PolicyViolation.class, () -> h2Guard.requireSingleRead("SELECT * FROM users WHERE (", MAX_LENGTH));
        assertThrows(PolicyViolation.class, () -> h2Guard.requireSingleRead("SELECT 'unterminated", MAX_LENGTH));
        assertThrows(PolicyViolation.class, () -> h2Guard.requireSingleRead("SELECT 1 /* open", MAX_LENGTH));
    }

    @Test
    void requireSingleRead_DialectQuoting() throws PolicyViolation {
        QueryGuard sqlServerGuard = new QueryGuard("sqlserver");
        assertEquals("SELECT [delete] FROM [orders]",
                sqlServerGuard.requireSingleRead("SELECT [delete] FROM [orders]", MAX_LENGTH));

        QueryGuard mySqlGuard = new QueryGuard("mysql");
        assertEquals("SELECT `drop`, 'a;b' FROM t",
                mySqlGuard.requireSingleRead("SELECT `drop`, 'a;b' FROM t # note", MAX_LENGTH));
    }

    @Test
    void countPlaceholders_IgnoresLiterals() throws PolicyViolation {
        assertEquals(2, h2Guard.countPlaceholders("SELECT '?', ? FROM t WHERE a = ? -- ?"));
        assertEquals(0, h2Guard.countPlaceholders("SELECT 1"));
    }

    @Test
    void rewriteNamedParameters_LeavesCastsAndLiterals() throws PolicyViolation {
        QueryGuard.NamedStatement namedStatement = h2Guard.rewriteNamedParameters(
                "SELECT * FROM t WHERE a = :a AND b = :b_2 AND c::int = 1 AND d = ':x' AND e = :a");

        assertEquals("SELECT * FROM t WHERE a = ? AND b = ? AND c::int = 1 AND d = ':x' AND e = ?",
                namedStatement.statement());
        assertEquals(List.of("a", "b_2", "a"), namedStatement.parameterNames());
    }

    @Test
    void injectRowLimit_PerDialect() throws PolicyViolation {
        assertThat(h2Guard.injectRowLimit("SELECT * FROM users", 11)).endsWith("LIMIT 11");
        assertEquals("SELECT * FROM users LIMIT 5", h2Guard.injectRowLimit("SELECT * FROM users LIMIT 5", 11));

        QueryGuard sqlServerGuard = new QueryGuard("sqlserver");
        assertThat(sqlServerGuard.injectRowLimit("SELECT name FROM users", 11)).startsWith("SELECT TOP 11 ");
        assertEquals("SELECT TOP 3 name FROM users", sqlServerGuard.injectRowLimit("SELECT TOP 3 name FROM users", 11));

        QueryGuard oracleGuard = new QueryGuard("oracle");
        assertEquals("SELECT * FROM users", oracleGuard.injectRowLimit("SELECT * FROM users", 11));
    }
}
