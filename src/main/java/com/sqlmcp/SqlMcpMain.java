package com.sqlmcp;

import com.sqlmcp.config.CliUtils;
import com.sqlmcp.config.ConfigParams;
import com.sqlmcp.config.ResourceManager;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;

/**
 * Process entry point. Resolves configuration once, opens the pool and serves MCP over stdio.
 *
 * <p>Exit codes: 0 normal, 1 start-up failure, 2 configuration error, 3 unexpected error.
 */
public final class SqlMcpMain {
    static final String LOG_LEVEL_PROPERTY = "org.slf4j.simpleLogger.defaultLogLevel";

    private SqlMcpMain() {
    }

    public static void main(String[] args) {
        // Must happen before the first logger is created
        if (System.getProperty(LOG_LEVEL_PROPERTY) == null) {
            System.setProperty(LOG_LEVEL_PROPERTY, CliUtils.resolveLogLevel(args).toLowerCase());
        }
        Logger logger = LoggerFactory.getLogger(SqlMcpMain.class);

        if (CliUtils.handleHelpAndVersion(args)) {
            System.exit(0);
        }

        ConfigParams configParams;
        try {
            configParams = CliUtils.loadConfiguration(args);
        } catch (IOException | IllegalArgumentException e) {
            logger.error("Configuration error: {}", e.getMessage());
            logger.error("\n{}", ResourceManager.getErrorMessage("startup.config.error.format"));
            System.exit(2);
            return;
        }
        logger.info("Starting {} v{} against {} ({})", CliUtils.SERVER_NAME, CliUtils.SERVER_VERSION,
                configParams.maskSensitive(configParams.dbUrl()), configParams.getDatabaseType());

        McpServer mcpServer;
        try {
            mcpServer = new McpServer(configParams);
        } catch (RuntimeException e) {
            logger.error("Failed to start server: {}", e.getMessage(), e);
            logger.error("\n{}", ResourceManager.getErrorMessage("startup.generic.error.reason", e.getMessage()));
            System.exit(1);
            return;
        }

        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            logger.info("Shutting down SQL MCP gateway...");
            mcpServer.shutdown();
        }));

        try {
            mcpServer.startStdioMode();
            mcpServer.shutdown();
        } catch (IOException e) {
            logger.error("Failed to serve stdio: {}", e.getMessage(), e);
            System.exit(1);
        } catch (Exception e) {
            logger.error("Unexpected error while serving", e);
            logger.error("\n{}", ResourceManager.getErrorMessage("startup.unexpected.error", e.getMessage()));
            System.exit(3);
        }
    }
}
