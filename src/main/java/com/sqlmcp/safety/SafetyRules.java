package com.sqlmcp.safety;

import com.fasterxml.jackson.databind.JsonNode;
import com.sqlmcp.config.ConfigParams;
import com.sqlmcp.config.ResourceManager;
import com.sqlmcp.db.JdbcValues;
import com.sqlmcp.tools.ErrorKind;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.regex.Pattern;

/**
 * Factories for the rules that make up the per tool policy table.
 */
public final class SafetyRules {
    static final Pattern IDENTIFIER = Pattern.compile("^[A-Za-z0-9_]{1,128}$");
    // matched in Java only, never embedded in SQL
    static final Pattern SEARCH_TERM = Pattern.compile("^[^\\p{Cc}\\p{Cf}]{1,128}$");

    private SafetyRules() {
    }

    /**
     * Rejects arguments the tool does not declare.
     */
    public static SafetyRule allowedArguments(String... argumentNames) {
        Set<String> allowedNames = Set.of(argumentNames);
        return policyContext -> {
            Set<String> unknownNames = new TreeSet<>();
            Iterator<String> fieldNames = policyContext.request().arguments().fieldNames();
            while (fieldNames.hasNext()) {
                String fieldName = fieldNames.next();
                if (!allowedNames.contains(fieldName)) {
                    unknownNames.add(fieldName);
                }
            }
            if (!unknownNames.isEmpty()) {
                throw invalid("policy.argument.unknown", String.join(", ", unknownNames));
            }
        };
    }

    public static SafetyRule requiredIdentifier(String argumentName) {
        return policyContext -> {
            if (!policyContext.request().has(argumentName)) {
                throw invalid("policy.argument.missing", argumentName);
            }
            checkIdentifier(argumentName, policyContext.request().argument(argumentName));
        };
    }

    public static SafetyRule optionalIdentifier(String argumentName) {
        return policyContext -> {
            if (policyContext.request().has(argumentName)) {
                checkIdentifier(argumentName, policyContext.request().argument(argumentName));
            }
        };
    }

    /**
     * An optional non-empty array of identifiers, such as an explicit conflict key.
     */
    public static SafetyRule optionalIdentifierList(String argumentName) {
        return policyContext -> {
            if (!policyContext.request().has(argumentName)) {
                return;
            }
            JsonNode listNode = policyContext.request().argument(argumentName);
            if (!listNode.isArray() || listNode.isEmpty()) {
                throw invalid("policy.argument.type", argumentName, "non-empty array of names");
            }
            for (JsonNode elementNode : listNode) {
                checkIdentifier(argumentName, elementNode);
            }
        };
    }

    public static SafetyRule optionalFlag(String argumentName) {
        return policyContext -> {
            if (policyContext.request().has(argumentName)
                    && !policyContext.request().argument(argumentName).isBoolean()) {
                throw invalid("policy.argument.type", argumentName, "boolean");
            }
        };
    }

    /**
     * An optional string restricted to a fixed set of values. Matching ignores case.
     */
    public static SafetyRule optionalChoice(String argumentName, String... choices) {
        Set<String> allowedChoices = Set.of(choices);
        return policyContext -> {
            if (!policyContext.request().has(argumentName)) {
                return;
            }
            JsonNode choiceNode = policyContext.request().argument(argumentName);
            if (!choiceNode.isTextual() || !allowedChoices.contains(choiceNode.asText().toLowerCase())) {
                throw invalid("policy.argument.choice", argumentName, String.join(", ", new TreeSet<>(allowedChoices)));
            }
        };
    }

    /**
     * Caps the sample size requested for table details.
     */
    public static SafetyRule sampleRows(String argumentName) {
        return policyContext -> {
            int sampleCeiling = policyContext.config().sampleRowLimit();
            int requestedRows = Math.min(ConfigParams.DEFAULT_SAMPLE_ROWS, sampleCeiling);
            if (policyContext.request().has(argumentName)) {
                requestedRows = nonNegativeInt(policyContext.request().argument(argumentName), argumentName);
            }
            policyContext.setEffectiveLimit(Math.min(requestedRows, sampleCeiling));
        };
    }

    /**
     * Requires a single read statement and stores its normalized text in the context.
     */
    public static SafetyRule readStatement(String argumentName) {
        return policyContext -> {
            if (!policyContext.request().has(argumentName)) {
                throw invalid("policy.argument.missing", argumentName);
            }
            JsonNode statementNode = policyContext.request().argument(argumentName);
            if (!statementNode.isTextual()) {
                throw invalid("policy.argument.type", argumentName, "string");
            }
            policyContext.setStatement(policyContext.guard()
                    .requireSingleRead(statementNode.asText(), policyContext.config().maxSqlLength()));
        };
    }

    /**
     * Binds caller values to placeholders. An array binds positionally to {@code ?};
     * an object binds by name to {@code :name}, which is rewritten to {@code ?}.
     * The number of values must match the number of placeholders exactly.
     */
    public static SafetyRule boundParameters(String argumentName) {
        return policyContext -> {
            QueryGuard queryGuard = policyContext.guard();
            String statement = policyContext.statement();
            JsonNode paramsNode = policyContext.request().argument(argumentName);

            if (paramsNode.isObject()) {
                QueryGuard.NamedStatement namedStatement = queryGuard.rewriteNamedParameters(statement);
                if (queryGuard.countPlaceholders(namedStatement.statement()) != namedStatement.parameterNames().size()) {
                    throw invalid("policy.params.mixed");
                }
                List<Object> boundValues = new ArrayList<>();
                for (String parameterName : namedStatement.parameterNames()) {
                    if (!paramsNode.has(parameterName)) {
                        throw invalid("policy.params.name.missing", parameterName);
                    }
                    boundValues.add(scalar(paramsNode.get(parameterName), argumentName));
                }
                policyContext.setStatement(namedStatement.statement());
                policyContext.setParameters(boundValues);
                return;
            }

            List<Object> boundValues = new ArrayList<>();
            if (paramsNode.isArray()) {
                for (JsonNode valueNode : paramsNode) {
                    boundValues.add(scalar(valueNode, argumentName));
                }
            } else if (!paramsNode.isMissingNode() && !paramsNode.isNull()) {
                throw invalid("policy.argument.type", argumentName, "array or object");
            }

            if (!queryGuard.rewriteNamedParameters(statement).parameterNames().isEmpty()) {
                throw invalid("policy.params.named.without.object");
            }
            int placeholderCount = queryGuard.countPlaceholders(statement);
            if (placeholderCount != boundValues.size()) {
                throw invalid("policy.params.count", placeholderCount, boundValues.size());
            }
            policyContext.setParameters(boundValues);
        };
    }

    /**
     * Settles the row limit and adds a limit clause to the statement.
     * The clause allows one row more than the limit so truncation can be detected.
     */
    public static SafetyRule rowLimit(String argumentName) {
        return policyContext -> {
            int maxRowLimit = policyContext.config().maxRowLimit();
            int effectiveLimit = policyContext.config().defaultRowLimit();
            if (policyContext.request().has(argumentName)) {
                int requestedLimit = nonNegativeInt(policyContext.request().argument(argumentName), argumentName);
                if (requestedLimit == 0) {
                    throw invalid("policy.argument.type", argumentName, "positive integer");
                }
                effectiveLimit = requestedLimit;
            }
            effectiveLimit = Math.min(effectiveLimit, maxRowLimit);
            policyContext.setEffectiveLimit(effectiveLimit);
            policyContext.setStatement(policyContext.guard().injectRowLimit(policyContext.statement(), effectiveLimit + 1L));
        };
    }

    /**
     * A literal search term. Wildcards and quoting characters are not accepted.
     */
    public static SafetyRule searchPattern(String argumentName) {
        return policyContext -> {
            if (!policyContext.request().has(argumentName)) {
                throw invalid("policy.argument.missing", argumentName);
            }
            JsonNode patternNode = policyContext.request().argument(argumentName);
            if (!patternNode.isTextual()) {
                throw invalid("policy.argument.type", argumentName, "string");
            }
            if (patternNode.asText().isBlank() || !SEARCH_TERM.matcher(patternNode.asText()).matches()) {
                throw rejected("policy.pattern.invalid", argumentName);
            }
        };
    }

    /**
     * A non-empty array of row objects with identifier keys and scalar values, capped at the insert ceiling.
     */
    public static SafetyRule rowBatch(String argumentName) {
        return policyContext -> {
            if (!policyContext.request().has(argumentName)) {
                throw invalid("policy.argument.missing", argumentName);
            }
            JsonNode rowsNode = policyContext.request().argument(argumentName);
            if (!rowsNode.isArray() || rowsNode.isEmpty()) {
                throw invalid("policy.argument.type", argumentName, "non-empty array of objects");
            }
            int maxInsertRows = policyContext.config().maxInsertRows();
            if (rowsNode.size() > maxInsertRows) {
                throw new PolicyViolation(ErrorKind.BATCH_TOO_LARGE,
                        ResourceManager.getErrorMessage("policy.batch.too.large", rowsNode.size(), maxInsertRows));
            }
            for (JsonNode rowNode : rowsNode) {
                if (!rowNode.isObject() || rowNode.isEmpty()) {
                    throw invalid("policy.argument.type", argumentName, "non-empty array of objects");
                }
                Iterator<Map.Entry<String, JsonNode>> rowFields = rowNode.fields();
                while (rowFields.hasNext()) {
                    Map.Entry<String, JsonNode> rowField = rowFields.next();
                    if (!IDENTIFIER.matcher(rowField.getKey()).matches()) {
                        throw rejected("policy.identifier.invalid", argumentName);
                    }
                    if (!JdbcValues.isScalar(rowField.getValue())) {
                        throw invalid("policy.value.not.scalar", rowField.getKey());
                    }
                }
            }
            policyContext.setEffectiveLimit(rowsNode.size());
        };
    }

    private static void checkIdentifier(String argumentName, JsonNode identifierNode) throws PolicyViolation {
        if (!identifierNode.isTextual()) {
            throw invalid("policy.argument.type", argumentName, "string");
        }
        if (!IDENTIFIER.matcher(identifierNode.asText()).matches()) {
            throw rejected("policy.identifier.invalid", argumentName);
        }
    }

    private static int nonNegativeInt(JsonNode numberNode, String argumentName) throws PolicyViolation {
        if (!numberNode.isIntegralNumber() || !numberNode.canConvertToInt() || numberNode.asInt() < 0) {
            throw invalid("policy.argument.type", argumentName, "non-negative integer");
        }
        return numberNode.asInt();
    }

    private static Object scalar(JsonNode valueNode, String argumentName) throws PolicyViolation {
        if (!JdbcValues.isScalar(valueNode)) {
            throw invalid("policy.value.not.scalar", argumentName);
        }
        return JdbcValues.fromJson(valueNode);
    }

    private static PolicyViolation invalid(String messageKey, Object... messageArgs) {
        return new PolicyViolation(ErrorKind.INVALID_ARGUMENTS, ResourceManager.getErrorMessage(messageKey, messageArgs));
    }

    private static PolicyViolation rejected(String messageKey, Object... messageArgs) {
        return new PolicyViolation(ErrorKind.VALIDATION_REJECTED, ResourceManager.getErrorMessage(messageKey, messageArgs));
    }
}
