package com.sqlmcp.config;

import com.sqlmcp.McpServer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.FileReader;
import java.io.IOException;
import java.util.HashMap;
import java.util.Map;

/**
 * Utility class for handling command line interface operations.
 * Provides argument parsing, help display, version information and configuration loading.
 */
public class CliUtils {
    public static final String SERVER_NAME = "sql-mcp-gateway";
    public static final String SERVER_VERSION = "1.0.0";
    public static final String SERVER_DESCRIPTION = "MCP tool gateway for safety-checked SQL database access";

    static final String DEFAULT_DB_USER = "sa";
    static final String DEFAULT_DB_PASSWORD = "";
    static final String DEFAULT_DB_TYPE = "sqlserver";

    /**
     * Maps short form arguments to their long form equivalents.
     *
     * @return Map of short form to long form argument names
     */
    static Map<String, String> getShortFormMapping() {
        Map<String, String> shortToLong = new HashMap<>();

        shortToLong.put("h", "help");
        shortToLong.put("v", "version");
        shortToLong.put("c", "config_file");

        // Database connection
        shortToLong.put("u", "db_url");
        shortToLong.put("H", "db_host");
        shortToLong.put("p", "db_port");
        shortToLong.put("n", "db_name");
        shortToLong.put("T", "db_type");
        shortToLong.put("U", "db_user");
        shortToLong.put("P", "db_password");
        shortToLong.put("d", "db_driver");

        // Pool and limits
        shortToLong.put("C", "pool_size");
        shortToLong.put("t", "connection_timeout_ms");
        shortToLong.put("q", "query_timeout_seconds");
        shortToLong.put("M", "max_sql");
        shortToLong.put("r", "max_row_limit");
        shortToLong.put("l", "log_level");

        return shortToLong;
    }

    /**
     * Parses command line arguments into a key-value map.
     * Supports both short form (-h) and long form (--help) arguments,
     * in key=value and key value formats. Keys are uppercased for lookup.
     *
     * @param args Command line arguments array
     * @return Map of uppercase keys to values
     */
    public static Map<String, String> parseArgs(String[] args) {
        Map<String, String> argsMap = new HashMap<>();
        Map<String, String> shortToLong = getShortFormMapping();

        for (int i = 0; i < args.length; i++) {
            String currArg = args[i];
            String argKey = null;
            String argValue = null;

            if (currArg.startsWith("--")) {
                String argWithoutPrefix = currArg.substring(2);

                if (argWithoutPrefix.contains("=")) {
                    String[] argParts = argWithoutPrefix.split("=", 2);
                    argKey = argParts[0];
                    argValue = argParts[1];
                } else {
                    argKey = argWithoutPrefix;
                    if (i + 1 < args.length && !args[i + 1].startsWith("-")) {
                        argValue = args[++i];
                    } else {
                        argValue = "true";
                    }
                }
            } else if (currArg.startsWith("-") && currArg.length() > 1) {
                String shortArg = currArg.substring(1);

                if (shortArg.contains("=")) {
                    String[] argParts = shortArg.split("=", 2);
                    argKey = shortToLong.get(argParts[0]);
                    argValue = argParts[1];
                } else {
                    argKey = shortToLong.get(shortArg);
                    if (i + 1 < args.length && !args[i + 1].startsWith("-")) {
                        argValue = args[++i];
                    } else {
                        argValue = "true";
                    }
                }
            }

            if (argKey != null) {
                argsMap.put(argKey.toUpperCase(), argValue);
            }
        }

        return argsMap;
    }

    /**
     * Checks for help and version arguments and handles them.
     *
     * @param args Command line arguments
     * @return true if help or version was displayed (caller should exit), false otherwise
     */
    public static boolean handleHelpAndVersion(String[] args) {
        for (String arg : args) {
            if ("--help".equals(arg) || "-h".equals(arg)) {
                displayHelp();
                return true;
            }
            if ("--version".equals(arg) || "-v".equals(arg)) {
                displayVersion();
                return true;
            }
        }
        return false;
    }

    // stdout is used here only because the process exits right after; in server mode it carries the protocol.
    static void displayHelp() {
        System.out.println(SERVER_NAME + " v" + SERVER_VERSION);
        System.out.println("Usage: java -jar " + SERVER_NAME + "-" + SERVER_VERSION + ".jar [OPTIONS]");
        System.out.println();
        System.out.println("OPTIONS:");
        System.out.println("  -h, --help                       Show this help message and exit");
        System.out.println("  -v, --version                    Show version information and exit");
        System.out.println("  -c, --config_file=<path>         Load KEY=VALUE configuration from file");
        System.out.println();
        System.out.println("DATABASE CONFIGURATION:");
        System.out.println("  -u, --db_url=<url>               JDBC URL (derived from host/port/name when absent)");
        System.out.println("  -H, --db_host=<host>             Database host");
        System.out.println("  -p, --db_port=<port>             Database port (default depends on db_type)");
        System.out.println("  -n, --db_name=<name>             Database name");
        System.out.println("  -T, --db_type=<type>             sqlserver (default), postgresql, mysql, mariadb");
        System.out.println("  -U, --db_user=<username>         Database username (default: sa)");
        System.out.println("  -P, --db_password=<password>     Database password (default: empty)");
        System.out.println("  -d, --db_driver=<class>          JDBC driver class (derived from the URL when absent)");
        System.out.println();
        System.out.println("POOL AND LIMITS:");
        System.out.println("  -C, --pool_size=<num>            Fixed connection pool size (default: 5)");
        System.out.println("  -t, --connection_timeout_ms=<ms> Wait for a pooled connection (default: 30000)");
        System.out.println("  -q, --query_timeout_seconds=<s>  Statement timeout (default: 30)");
        System.out.println("  -M, --max_sql=<chars>            Max statement length (default: 10000)");
        System.out.println("  -r, --max_row_limit=<num>        Max rows returned by execute_query (default: 1000)");
        System.out.println("      --default_row_limit=<num>    Rows returned when no limit is given (default: 1000)");
        System.out.println("      --max_insert_rows=<num>      Max rows per insert_data call (default: 1000)");
        System.out.println("      --sample_rows=<num>          Max sample rows for get_table_info (default: 5)");
        System.out.println("      --reconnect_attempts=<num>   Replacement attempts per dead connection (default: 3)");
        System.out.println("  -l, --log_level=<level>          trace, debug, info, warn, error (default: info)");
    }

    static void displayVersion() {
        System.out.println(SERVER_NAME + " v" + SERVER_VERSION);
        System.out.println(SERVER_DESCRIPTION);
        System.out.println("MCP Protocol Version: " + McpServer.DEFAULT_PROTOCOL_VERSION);
        System.out.println("Java Version: " + System.getProperty("java.version"));
    }

    /**
     * Resolves the log level before any other configuration is loaded, so it can be applied
     * to the logging backend ahead of the first logger.
     *
     * @param args Command line arguments
     * @return The configured log level, or "info"
     */
    public static String resolveLogLevel(String[] args) {
        Map<String, String> cliArgs = parseArgs(args);
        return getConfigValue("LOG_LEVEL", ConfigParams.DEFAULT_LOG_LEVEL, cliArgs, null);
    }

    /**
     * Loads configuration from command line arguments, config file, environment variables, and system properties.
     * Uses priority order: CLI args (--db_url) > config file > environment variables (DB_URL) >
     * system properties (-Ddb.url=) > defaults.
     *
     * @param args Command line arguments in --key=value format
     * @return Configured ConfigParams instance
     * @throws IOException if config file cannot be read
     * @throws IllegalArgumentException if a value cannot be parsed or fails validation
     */
    public static ConfigParams loadConfiguration(String[] args) throws IOException {
        Map<String, String> cliArgs = parseArgs(args);

        Map<String, String> fileConfig = null;
        String configFile = getConfigValue("CONFIG_FILE", null, cliArgs, null);
        if (configFile != null) {
            try {
                fileConfig = loadConfigFile(configFile);
                logger().info("Configuration file loaded: {}", configFile);
            } catch (IOException e) {
                logger().error("Failed to load configuration file: {}", configFile, e);
                throw new IOException(ResourceManager.getErrorMessage("config.file.unreadable", configFile), e);
            }
        }

        String dbType = getConfigValue("DB_TYPE", DEFAULT_DB_TYPE, cliArgs, fileConfig).toLowerCase();
        String dbUrl = getConfigValue("DB_URL", null, cliArgs, fileConfig);
        if (dbUrl == null) {
            String dbHost = getConfigValue("DB_HOST", null, cliArgs, fileConfig);
            if (dbHost == null) {
                throw new IllegalArgumentException(ResourceManager.getErrorMessage("config.url.missing"));
            }
            String dbPort = getConfigValue("DB_PORT", defaultPort(dbType), cliArgs, fileConfig);
            String dbName = getConfigValue("DB_NAME", "", cliArgs, fileConfig);
            dbUrl = buildJdbcUrl(dbType, dbHost, dbPort, dbName);
        }
        String dbUser = getConfigValue("DB_USER", DEFAULT_DB_USER, cliArgs, fileConfig);
        String dbPassword = getConfigValue("DB_PASSWORD", DEFAULT_DB_PASSWORD, cliArgs, fileConfig);
        String dbDriver = getConfigValue("DB_DRIVER", driverForUrl(dbUrl), cliArgs, fileConfig);

        try {
            return new ConfigParams(dbUrl, dbUser, dbPassword, dbDriver,
                    intValue("POOL_SIZE", ConfigParams.DEFAULT_MAX_CONNECTIONS, cliArgs, fileConfig),
                    intValue("CONNECTION_TIMEOUT_MS", ConfigParams.DEFAULT_CONNECTION_TIMEOUT_MS, cliArgs, fileConfig),
                    intValue("QUERY_TIMEOUT_SECONDS", ConfigParams.DEFAULT_QUERY_TIMEOUT_SECONDS, cliArgs, fileConfig),
                    intValue("MAX_SQL", ConfigParams.DEFAULT_MAX_SQL_LENGTH, cliArgs, fileConfig),
                    intValue("DEFAULT_ROW_LIMIT", ConfigParams.DEFAULT_ROW_LIMIT, cliArgs, fileConfig),
                    intValue("MAX_ROW_LIMIT", ConfigParams.DEFAULT_ROW_LIMIT, cliArgs, fileConfig),
                    intValue("MAX_INSERT_ROWS", ConfigParams.DEFAULT_MAX_INSERT_ROWS, cliArgs, fileConfig),
                    intValue("SAMPLE_ROWS", ConfigParams.DEFAULT_SAMPLE_ROWS, cliArgs, fileConfig),
                    intValue("RECONNECT_ATTEMPTS", ConfigParams.DEFAULT_RECONNECT_ATTEMPTS, cliArgs, fileConfig),
                    intValue("VALIDATION_TIMEOUT_SECONDS", ConfigParams.DEFAULT_VALIDATION_TIMEOUT_SECONDS, cliArgs, fileConfig),
                    intValue("BACKUP_TIMEOUT_SECONDS", ConfigParams.DEFAULT_BACKUP_TIMEOUT_SECONDS, cliArgs, fileConfig),
                    intValue("STATS_TIMEOUT_SECONDS", ConfigParams.DEFAULT_STATS_TIMEOUT_SECONDS, cliArgs, fileConfig),
                    getConfigValue("LOG_LEVEL", ConfigParams.DEFAULT_LOG_LEVEL, cliArgs, fileConfig));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException(
                    ResourceManager.getErrorMessage("config.validation.failed", e.getMessage()), e);
        }
    }

    /**
     * Builds a JDBC URL for the given database type from host, port and database name.
     */
    static String buildJdbcUrl(String dbType, String dbHost, String dbPort, String dbName) {
        return switch (dbType) {
            case "sqlserver" -> "jdbc:sqlserver://" + dbHost + ":" + dbPort
                    + (dbName.isEmpty() ? "" : ";databaseName=" + dbName) + ";encrypt=true;trustServerCertificate=true";
            // JSON carries dates and times as strings; let the server infer their parameter types
            case "postgresql" -> "jdbc:postgresql://" + dbHost + ":" + dbPort + "/" + dbName + "?stringtype=unspecified";
            case "mysql" -> "jdbc:mysql://" + dbHost + ":" + dbPort + "/" + dbName;
            case "mariadb" -> "jdbc:mariadb://" + dbHost + ":" + dbPort + "/" + dbName;
            default -> throw new IllegalArgumentException(
                    ResourceManager.getErrorMessage("config.db.type.unsupported", dbType));
        };
    }

    static String defaultPort(String dbType) {
        return switch (dbType) {
            case "postgresql" -> "5432";
            case "mysql", "mariadb" -> "3306";
            default -> "1433";
        };
    }

    /**
     * Picks the JDBC driver class matching a URL, used when no driver is configured explicitly.
     */
    static String driverForUrl(String dbUrl) {
        String lowerUrl = dbUrl.toLowerCase();
        if (lowerUrl.startsWith("jdbc:sqlserver:")) return "com.microsoft.sqlserver.jdbc.SQLServerDriver";
        if (lowerUrl.startsWith("jdbc:postgresql:")) return "org.postgresql.Driver";
        if (lowerUrl.startsWith("jdbc:mysql:")) return "com.mysql.cj.jdbc.Driver";
        if (lowerUrl.startsWith("jdbc:mariadb:")) return "org.mariadb.jdbc.Driver";
        if (lowerUrl.startsWith("jdbc:sqlite:")) return "org.sqlite.JDBC";
        if (lowerUrl.startsWith("jdbc:oracle:")) return "oracle.jdbc.OracleDriver";
        return "org.h2.Driver";
    }

    /**
     * Gets a configuration value using the priority order:
     * CLI args > config file > env vars > system properties > default.
     *
     * @param varName Config parameter name (uppercase)
     * @param defaultValue Default value if not found in any source
     * @param cliArgs Parsed command line arguments
     * @param fileConfig Configuration from file (can be null if no config file)
     * @return The configuration value from the highest priority source
     */
    static String getConfigValue(String varName, String defaultValue, Map<String, String> cliArgs, Map<String, String> fileConfig) {
        String cliValue = cliArgs.get(varName.toUpperCase());
        if (cliValue != null) {
            return cliValue;
        }

        if (fileConfig != null) {
            String fileValue = fileConfig.get(varName.toUpperCase());
            if (fileValue != null) {
                return fileValue;
            }
        }

        String envValue = System.getenv(varName);
        if (envValue != null) {
            return envValue;
        }

        // DB_URL -> db.url
        String propValue = System.getProperty(varName.toLowerCase().replace('_', '.'));
        if (propValue != null) {
            return propValue;
        }

        return defaultValue;
    }

    /**
     * Loads configuration parameters from a file.
     * Each line should be in KEY=VALUE format. Lines starting with # are comments, empty lines are ignored.
     *
     * @param configFilePath Path to the configuration file
     * @return Map of configuration key-value pairs
     * @throws IOException if the file cannot be read
     */
    public static Map<String, String> loadConfigFile(String configFilePath) throws IOException {
        Map<String, String> configMap = new HashMap<>();

        try (BufferedReader bufferedReader = new BufferedReader(new FileReader(configFilePath))) {
            String currLine;
            int lineNumber = 0;

            while ((currLine = bufferedReader.readLine()) != null) {
                lineNumber++;
                currLine = currLine.trim();

                if (currLine.isEmpty() || currLine.startsWith("#")) {
                    continue;
                }

                String[] lineParts = currLine.split("=", 2);
                if (lineParts.length != 2) {
                    logger().warn("Invalid config line {} in file {}: {}", lineNumber, configFilePath, currLine);
                    continue;
                }

                String paramKey = lineParts[0].trim().toUpperCase();
                String paramValue = lineParts[1].trim();

                if (paramKey.isEmpty()) {
                    logger().warn("Empty key on line {} in file {}", lineNumber, configFilePath);
                    continue;
                }

                if ((paramValue.startsWith("\"") && paramValue.endsWith("\"") && paramValue.length() > 1)
                        || (paramValue.startsWith("'") && paramValue.endsWith("'") && paramValue.length() > 1)) {
                    paramValue = paramValue.substring(1, paramValue.length() - 1);
                }

                configMap.put(paramKey, paramValue);
                logger().debug("Loaded config: {} = {}", paramKey, paramKey.contains("PASSWORD") ? "***" : paramValue);
            }
        }

        logger().info("Loaded {} configuration parameters from file: {}", configMap.size(), configFilePath);
        return configMap;
    }

    private static int intValue(String paramName, int defaultValue, Map<String, String> cliArgs, Map<String, String> fileConfig) {
        return parseIntegerConfig(paramName, getConfigValue(paramName, String.valueOf(defaultValue), cliArgs, fileConfig));
    }

    /**
     * Parses an integer configuration value with detailed error context.
     *
     * @throws IllegalArgumentException if the value cannot be parsed as an integer
     */
    static int parseIntegerConfig(String paramName, String value) {
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(
                    ResourceManager.getErrorMessage("config.parse.integer.failed", paramName, value), e);
        }
    }

    // Looked up on first use: resolveLogLevel must run before the logging backend reads its level.
    private static Logger logger() {
        return LoggerFactory.getLogger(CliUtils.class);
    }
}
