package com.sqlmcp.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.text.MessageFormat;
import java.util.Arrays;
import java.util.Properties;

/**
 * Loads user facing messages from {@code error-messages.properties} and formats them with {@link MessageFormat}.
 */
public final class ResourceManager {
    private static final Logger logger = LoggerFactory.getLogger(ResourceManager.class);
    private static final String ERROR_MESSAGES_RESOURCE = "/error-messages.properties";
    private static final Properties errorMessages = loadProperties(ERROR_MESSAGES_RESOURCE);

    private ResourceManager() {
    }

    /**
     * Returns the message registered under the given key with the arguments substituted.
     * Unknown keys fall back to the key itself so a missing entry never hides the failure it describes.
     *
     * @param messageKey Key in error-messages.properties
     * @param messageArgs Values for the {0}, {1}... placeholders
     * @return The formatted message
     */
    public static String getErrorMessage(String messageKey, Object... messageArgs) {
        String messagePattern = errorMessages.getProperty(messageKey);
        if (messagePattern == null) {
            logger.warn("Missing message for key: {}", messageKey);
            return messageArgs.length == 0 ? messageKey : messageKey + " " + Arrays.toString(messageArgs);
        }
        if (messageArgs.length == 0) {
            return messagePattern;
        }
        return MessageFormat.format(messagePattern, messageArgs);
    }

    private static Properties loadProperties(String resourceName) {
        Properties loadedProperties = new Properties();
        try (InputStream inputStream = ResourceManager.class.getResourceAsStream(resourceName)) {
            if (inputStream == null) {
                logger.error("Message resource not found on classpath: {}", resourceName);
                return loadedProperties;
            }
            loadedProperties.load(new InputStreamReader(inputStream, StandardCharsets.UTF_8));
        } catch (IOException e) {
            logger.error("Failed to load message resource: {}", resourceName, e);
        }
        return loadedProperties;
    }
}
