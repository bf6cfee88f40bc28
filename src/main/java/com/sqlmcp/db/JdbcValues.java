package com.sqlmcp.db;

import com.fasterxml.jackson.databind.JsonNode;

import java.math.BigDecimal;
import java.sql.Array;
import java.sql.Blob;
import java.sql.Clob;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Types;
import java.util.Arrays;
import java.util.Base64;

/**
 * Conversions between JSON argument values, JDBC parameters and JSON friendly result values.
 */
public final class JdbcValues {
    static final int MAX_LOB_CHARS = 65536;

    private JdbcValues() {
    }

    /**
     * Sets a parameter value in a PreparedStatement with appropriate type handling.
     *
     * @param prepStmt   The PreparedStatement to set the parameter on
     * @param paramIndex The 1-based parameter index
     * @param paramValue The parameter value to set
     * @throws SQLException if parameter setting fails
     */
    public static void bind(PreparedStatement prepStmt, int paramIndex, Object paramValue) throws SQLException {
        if (paramValue == null) {
            prepStmt.setNull(paramIndex, Types.NULL);
        } else if (paramValue instanceof String stringValue) {
            prepStmt.setString(paramIndex, stringValue);
        } else if (paramValue instanceof Integer intValue) {
            prepStmt.setInt(paramIndex, intValue);
        } else if (paramValue instanceof Long longValue) {
            prepStmt.setLong(paramIndex, longValue);
        } else if (paramValue instanceof Double doubleValue) {
            prepStmt.setDouble(paramIndex, doubleValue);
        } else if (paramValue instanceof Boolean booleanValue) {
            prepStmt.setBoolean(paramIndex, booleanValue);
        } else if (paramValue instanceof BigDecimal decimalValue) {
            prepStmt.setBigDecimal(paramIndex, decimalValue);
        } else {
            // let the database convert anything else
            prepStmt.setString(paramIndex, paramValue.toString());
        }
    }

    /**
     * Converts a JSON scalar into a Java value for PreparedStatement binding.
     *
     * @param paramNode The JsonNode containing the parameter value
     * @return The converted value, or null for JSON null
     * @throws IllegalArgumentException if the node is an object or array
     */
    public static Object fromJson(JsonNode paramNode) {
        if (paramNode == null || paramNode.isNull() || paramNode.isMissingNode()) {
            return null;
        } else if (paramNode.isBoolean()) {
            return paramNode.asBoolean();
        } else if (paramNode.isInt()) {
            return paramNode.asInt();
        } else if (paramNode.isLong()) {
            return paramNode.asLong();
        } else if (paramNode.isBigInteger() || paramNode.isBigDecimal()) {
            return paramNode.decimalValue();
        } else if (paramNode.isDouble() || paramNode.isFloat()) {
            return paramNode.asDouble();
        } else if (paramNode.isTextual()) {
            return paramNode.asText();
        }
        throw new IllegalArgumentException("Only scalar values can be bound, got " + paramNode.getNodeType());
    }

    public static boolean isScalar(JsonNode valueNode) {
        return valueNode == null || valueNode.isNull() || valueNode.isValueNode();
    }

    /**
     * Reads a column and converts it to a value Jackson can serialize without extra modules:
     * temporal values become ISO-8601 strings, binary values Base64, LOBs bounded text.
     */
    public static Object read(ResultSet resultSet, int columnIndex) throws SQLException {
        Object columnValue = resultSet.getObject(columnIndex);
        if (columnValue == null
                || columnValue instanceof String
                || columnValue instanceof Number
                || columnValue instanceof Boolean) {
            return columnValue;
        }
        if (columnValue instanceof java.sql.Timestamp timestamp) {
            return timestamp.toLocalDateTime().toString();
        }
        if (columnValue instanceof java.sql.Date date) {
            return date.toLocalDate().toString();
        }
        if (columnValue instanceof java.sql.Time time) {
            return time.toLocalTime().toString();
        }
        if (columnValue instanceof byte[] bytes) {
            return Base64.getEncoder().encodeToString(bytes);
        }
        if (columnValue instanceof Clob clob) {
            long clobLength = clob.length();
            return clob.getSubString(1, (int) Math.min(clobLength, MAX_LOB_CHARS));
        }
        if (columnValue instanceof Blob blob) {
            long blobLength = blob.length();
            return Base64.getEncoder().encodeToString(blob.getBytes(1, (int) Math.min(blobLength, MAX_LOB_CHARS)));
        }
        if (columnValue instanceof Array sqlArray) {
            Object arrayValue = sqlArray.getArray();
            return arrayValue instanceof Object[] objects ? Arrays.asList(objects) : arrayValue.toString();
        }
        return columnValue.toString();
    }
}
