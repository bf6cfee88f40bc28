package com.sqlmcp;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.sqlmcp.config.ConfigParams;
import com.sqlmcp.db.ConnectionManager;

import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Test utilities for gateway tests
 */
public class TestUtils {
    private static final AtomicInteger dbCounter = new AtomicInteger(0);

    /**
     * Creates a unique H2 in-memory database configuration for testing
     */
    public static ConfigParams createTestH2Config() {
        String dbName = "testdb" + dbCounter.incrementAndGet();
        return ConfigParams.defaultConfig(
                "jdbc:h2:mem:" + dbName + ";DB_CLOSE_DELAY=-1;DB_CLOSE_ON_EXIT=FALSE",
                "sa",
                "",
                "org.h2.Driver");
    }

    public static Connection openConnection(ConfigParams config) throws SQLException {
        return DriverManager.getConnection(config.dbUrl(), config.dbUser(), config.dbPass());
    }

    /**
     * Creates users and orders with a view, the shape most tool tests run against
     */
    public static void setupTestDatabase(ConfigParams config) throws SQLException {
        try (Connection conn = openConnection(config);
             Statement stmt = conn.createStatement()) {

            stmt.execute("""
                CREATE TABLE users (
                    id INT PRIMARY KEY,
                    name VARCHAR(255) NOT NULL,
                    email VARCHAR(255) UNIQUE,
                    age INT,
                    created_date DATE DEFAULT CURRENT_DATE,
                    is_active BOOLEAN DEFAULT TRUE
                )
                """);

            stmt.execute("""
                CREATE TABLE orders (
                    id INT PRIMARY KEY AUTO_INCREMENT,
                    user_id INT,
                    product_name VARCHAR(255),
                    amount DECIMAL(10,2),
                    FOREIGN KEY (user_id) REFERENCES users(id)
                )
                """);

            stmt.execute("""
                CREATE VIEW active_users AS
                SELECT id, name, email, age
                FROM users
                WHERE is_active = TRUE
                """);

            stmt.execute("""
                INSERT INTO users (id, name, email, age, is_active) VALUES
                (1, 'John Doe', 'john@example.com', 30, TRUE),
                (2, 'Jane Smith', 'jane@example.com', 25, TRUE),
                (3, 'Bob Johnson', 'bob@example.com', 35, FALSE),
                (4, 'Alice Brown', 'alice@example.com', 28, TRUE)
                """);

            stmt.execute("""
                INSERT INTO orders (user_id, product_name, amount) VALUES
                (1, 'Laptop', 999.99),
                (1, 'Mouse', 29.99),
                (2, 'Keyboard', 79.99),
                (4, 'Monitor', 299.99)
                """);
        }
    }

    /**
     * Creates the statistics tables used by the search, stats and backup tests
     */
    public static void setupSeriesDatabase(ConfigParams config) throws SQLException {
        try (Connection conn = openConnection(config);
             Statement stmt = conn.createStatement()) {

            stmt.execute("""
                CREATE TABLE SeriesRecord (
                    series_id VARCHAR(40) PRIMARY KEY,
                    title VARCHAR(200) NOT NULL,
                    frequency VARCHAR(10)
                )
                """);
            stmt.execute("""
                CREATE TABLE country_gdp (
                    country_code CHAR(3) NOT NULL,
                    year_num INT NOT NULL,
                    gdp_usd DECIMAL(20,2),
                    PRIMARY KEY (country_code, year_num)
                )
                """);
            stmt.execute("""
                CREATE TABLE inflation (
                    country_code CHAR(3) NOT NULL,
                    year_num INT NOT NULL,
                    cpi DECIMAL(8,3),
                    gdp_deflator DECIMAL(8,3)
                )
                """);
            stmt.execute("CREATE INDEX idx_inflation_country ON inflation (country_code)");

            stmt.execute("""
                INSERT INTO SeriesRecord (series_id, title, frequency) VALUES
                ('GDPC1', 'Real Gross Domestic Product', 'Q'),
                ('CPIAUCSL', 'Consumer Price Index', 'M'),
                ('UNRATE', 'Unemployment Rate', 'M')
                """);
            stmt.execute("""
                INSERT INTO country_gdp (country_code, year_num, gdp_usd) VALUES
                ('USA', 2022, 25462700000000.00),
                ('USA', 2023, 27360900000000.00),
                ('DEU', 2023, 4456080000000.00)
                """);
        }
    }

    /**
     * Creates a table with the given number of sequential rows
     */
    public static void setupLargeTable(ConfigParams config, int rowCount) throws SQLException {
        try (Connection conn = openConnection(config);
             Statement stmt = conn.createStatement()) {
            stmt.execute("CREATE TABLE large_table (id INT PRIMARY KEY, label VARCHAR(50))");
            stmt.execute("INSERT INTO large_table SELECT X, 'row ' || X FROM SYSTEM_RANGE(1, " + rowCount + ")");
        }
    }

    public static long countRows(ConfigParams config, String tableName) throws SQLException {
        try (Connection conn = openConnection(config);
             Statement stmt = conn.createStatement();
             var resultSet = stmt.executeQuery("SELECT COUNT(*) FROM " + tableName)) {
            resultSet.next();
            return resultSet.getLong(1);
        }
    }

    public static ConnectionManager createConnectionManager(ConfigParams config) {
        return new ConnectionManager(config);
    }

    /**
     * Helper method to initialize the server for tests
     */
    public static void initializeServer(McpServer mcpServer, ObjectMapper objectMapper) {
        ObjectNode initRequest = objectMapper.createObjectNode();
        initRequest.put("jsonrpc", "2.0");
        initRequest.put("id", 1);
        initRequest.put("method", "initialize");

        ObjectNode initParams = initRequest.putObject("params");
        initParams.put("protocolVersion", McpServer.DEFAULT_PROTOCOL_VERSION);
        initParams.putObject("capabilities");

        JsonNode initResponse = mcpServer.handleRequest(initRequest);
        assertNotNull(initResponse);
        assertTrue(initResponse.has("result"));

        ObjectNode initializedRequest = objectMapper.createObjectNode();
        initializedRequest.put("jsonrpc", "2.0");
        initializedRequest.put("method", "notifications/initialized");

        assertNull(mcpServer.handleRequest(initializedRequest));
    }

    /**
     * Creates a JSON-RPC request for the 'tools/call' MCP method.
     */
    public static ObjectNode createToolCallRequest(String toolName, ObjectNode arguments, ObjectMapper objectMapper) {
        ObjectNode request = objectMapper.createObjectNode();
        request.put("jsonrpc", "2.0");
        request.put("id", "test-req-1");
        request.put("method", "tools/call");

        ObjectNode params = request.putObject("params");
        params.put("name", toolName);
        params.set("arguments", arguments);
        return request;
    }
}
