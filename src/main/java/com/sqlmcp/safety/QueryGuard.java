package com.sqlmcp.safety;

import com.sqlmcp.config.ResourceManager;
import com.sqlmcp.tools.ErrorKind;
import net.sf.jsqlparser.JSQLParserException;
import net.sf.jsqlparser.expression.LongValue;
import net.sf.jsqlparser.parser.CCJSqlParserUtil;
import net.sf.jsqlparser.statement.Statement;
import net.sf.jsqlparser.statement.select.Limit;
import net.sf.jsqlparser.statement.select.PlainSelect;
import net.sf.jsqlparser.statement.select.Select;
import net.sf.jsqlparser.statement.select.Top;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Lexical and syntactic checks on caller supplied statement text.
 *
 * <p>Every check runs on a masked copy of the statement in which comments are removed and the contents of
 * string literals and quoted identifiers are blanked out, so nothing inside a literal can influence a decision.
 * Statements must also parse as a single {@link Select} with JSqlParser.
 */
public class QueryGuard {
    private static final Set<String> READ_KEYWORDS = Set.of("SELECT", "WITH");
    private static final Pattern WRITE_KEYWORDS = Pattern.compile(
            "\\b(INSERT|UPDATE|DELETE|MERGE|UPSERT|DROP|CREATE|ALTER|TRUNCATE|GRANT|REVOKE|DENY|EXEC|EXECUTE|CALL"
                    + "|COPY|LOCK|INTO|SHUTDOWN|DBCC|KILL|ATTACH|DETACH|PRAGMA|VACUUM"
                    + "|OPENROWSET|OPENQUERY|OPENDATASOURCE)\\b",
            Pattern.CASE_INSENSITIVE);
    private static final Pattern OWN_ROW_LIMIT = Pattern.compile(
            "\\b(LIMIT|TOP|FETCH|OFFSET)\\b", Pattern.CASE_INSENSITIVE);
    private static final Pattern LEADING_KEYWORD = Pattern.compile("^[\\s(]*([A-Za-z]+)");

    private final String dbType;
    private final boolean bracketIdentifiers;
    private final boolean backslashEscapes;

    public QueryGuard(String dbType) {
        this.dbType = dbType;
        this.bracketIdentifiers = "sqlserver".equals(dbType);
        this.backslashEscapes = "mysql".equals(dbType) || "mariadb".equals(dbType);
    }

    /**
     * Statement text with comments removed, paired with a masked copy of identical length.
     */
    record ScannedSql(String text, String masked) {
    }

    /**
     * Strips comments and masks literal contents. Unterminated literals and comments are rejected.
     */
    ScannedSql scan(String sqlText) throws PolicyViolation {
        StringBuilder text = new StringBuilder(sqlText.length());
        StringBuilder masked = new StringBuilder(sqlText.length());
        int length = sqlText.length();
        int i = 0;

        while (i < length) {
            char current = sqlText.charAt(i);
            char next = i + 1 < length ? sqlText.charAt(i + 1) : '\0';

            if (current == '-' && next == '-' || current == '#' && backslashEscapes) {
                int lineEnd = sqlText.indexOf('\n', i);
                i = lineEnd < 0 ? length : lineEnd;
                text.append(' ');
                masked.append(' ');
            } else if (current == '/' && next == '*') {
                int commentEnd = sqlText.indexOf("*/", i + 2);
                if (commentEnd < 0) {
                    throw violation("policy.statement.unterminated", "comment");
                }
                i = commentEnd + 2;
                text.append(' ');
                masked.append(' ');
            } else if (current == '\'' || current == '"' || current == '`' || current == '[' && bracketIdentifiers) {
                char closing = current == '[' ? ']' : current;
                int literalEnd = findLiteralEnd(sqlText, i + 1, closing, current == '\'' && backslashEscapes);
                if (literalEnd < 0) {
                    throw violation("policy.statement.unterminated", "quoted text");
                }
                text.append(sqlText, i, literalEnd + 1);
                masked.append(current);
                masked.append(" ".repeat(literalEnd - i - 1));
                masked.append(closing);
                i = literalEnd + 1;
            } else {
                text.append(current);
                masked.append(current);
                i++;
            }
        }

        // trailing semicolons end the single statement and are dropped
        int end = masked.length();
        while (end > 0 && (Character.isWhitespace(masked.charAt(end - 1)) || masked.charAt(end - 1) == ';')) {
            end--;
        }
        int start = 0;
        while (start < end && Character.isWhitespace(masked.charAt(start))) {
            start++;
        }
        return new ScannedSql(text.substring(start, end), masked.substring(start, end));
    }

    private static int findLiteralEnd(String sqlText, int from, char closing, boolean backslashEscapes) {
        int i = from;
        while (i < sqlText.length()) {
            char current = sqlText.charAt(i);
            if (backslashEscapes && current == '\\') {
                i += 2;
                continue;
            }
            if (current == closing) {
                // doubled delimiter is an escaped delimiter
                if (i + 1 < sqlText.length() && sqlText.charAt(i + 1) == closing) {
                    i += 2;
                    continue;
                }
                return i;
            }
            i++;
        }
        return -1;
    }

    /**
     * Checks that the text is exactly one read statement and returns it normalized.
     *
     * @param sqlText Caller supplied statement
     * @param maxLength Maximum accepted length
     * @return The statement with comments and trailing semicolons removed
     * @throws PolicyViolation if the statement is empty, too long, not a single read statement or unparseable
     */
    public String requireSingleRead(String sqlText, int maxLength) throws PolicyViolation {
        if (sqlText == null || sqlText.isBlank()) {
            throw new PolicyViolation(ErrorKind.INVALID_ARGUMENTS, ResourceManager.getErrorMessage("policy.statement.empty"));
        }
        if (sqlText.length() > maxLength) {
            throw violation("policy.statement.too.long", String.valueOf(maxLength));
        }

        ScannedSql scanned = scan(sqlText);
        if (scanned.text().isEmpty()) {
            throw new PolicyViolation(ErrorKind.INVALID_ARGUMENTS, ResourceManager.getErrorMessage("policy.statement.empty"));
        }
        if (scanned.masked().indexOf(';') >= 0) {
            throw violation("policy.statement.multiple");
        }

        Matcher leadingMatcher = LEADING_KEYWORD.matcher(scanned.masked());
        String leadingKeyword = leadingMatcher.find() ? leadingMatcher.group(1).toUpperCase(Locale.ROOT) : "";
        if (!READ_KEYWORDS.contains(leadingKeyword)) {
            throw violation("policy.statement.not.read", leadingKeyword.isEmpty() ? "?" : leadingKeyword);
        }

        Matcher writeMatcher = WRITE_KEYWORDS.matcher(scanned.masked());
        if (writeMatcher.find()) {
            throw violation("policy.statement.write.keyword", writeMatcher.group(1).toUpperCase(Locale.ROOT));
        }

        parseSelect(scanned.text());
        return scanned.text();
    }

    private Select parseSelect(String statementText) throws PolicyViolation {
        Statement parsedStatement;
        try {
            parsedStatement = CCJSqlParserUtil.parse(statementText,
                    parser -> parser.withSquareBracketQuotation(bracketIdentifiers));
        } catch (JSQLParserException e) {
            String parserMessage = e.getCause() != null ? e.getCause().getMessage() : e.getMessage();
            throw violation("policy.statement.unparseable", firstLine(parserMessage));
        }
        if (!(parsedStatement instanceof Select select)) {
            throw violation("policy.statement.not.read", parsedStatement.getClass().getSimpleName());
        }
        return select;
    }

    /**
     * Counts positional placeholders outside literals and comments.
     */
    public int countPlaceholders(String statementText) throws PolicyViolation {
        String masked = scan(statementText).masked();
        int placeholderCount = 0;
        for (int i = 0; i < masked.length(); i++) {
            if (masked.charAt(i) == '?') {
                placeholderCount++;
            }
        }
        return placeholderCount;
    }

    /**
     * Statement with named placeholders replaced by positional ones, and the names in binding order.
     */
    public record NamedStatement(String statement, List<String> parameterNames) {
    }

    /**
     * Rewrites {@code :name} placeholders to {@code ?}. Casts such as {@code ::int} are left alone.
     */
    public NamedStatement rewriteNamedParameters(String statementText) throws PolicyViolation {
        ScannedSql scanned = scan(statementText);
        String masked = scanned.masked();
        String text = scanned.text();
        StringBuilder rewritten = new StringBuilder(text.length());
        List<String> parameterNames = new ArrayList<>();

        int i = 0;
        while (i < masked.length()) {
            char current = masked.charAt(i);
            boolean startsName = current == ':'
                    && i + 1 < masked.length()
                    && (Character.isLetter(masked.charAt(i + 1)) || masked.charAt(i + 1) == '_')
                    && (i == 0 || masked.charAt(i - 1) != ':' && !Character.isLetterOrDigit(masked.charAt(i - 1)));
            if (startsName) {
                int nameEnd = i + 1;
                while (nameEnd < masked.length()
                        && (Character.isLetterOrDigit(masked.charAt(nameEnd)) || masked.charAt(nameEnd) == '_')) {
                    nameEnd++;
                }
                parameterNames.add(masked.substring(i + 1, nameEnd));
                rewritten.append('?');
                i = nameEnd;
            } else {
                rewritten.append(text.charAt(i));
                i++;
            }
        }
        return new NamedStatement(rewritten.toString(), parameterNames);
    }

    /**
     * Adds a row limit clause when the statement carries none of its own.
     * SQL Server gets {@code TOP}; dialects without a portable clause rely on the driver's max rows.
     *
     * @param statementText A statement already accepted by {@link #requireSingleRead}
     * @param rowCount The number of rows the clause allows
     * @return The statement to execute
     */
    public String injectRowLimit(String statementText, long rowCount) throws PolicyViolation {
        ScannedSql scanned = scan(statementText);
        if (OWN_ROW_LIMIT.matcher(scanned.masked()).find()) {
            return statementText;
        }

        switch (dbType) {
            case "oracle", "db2", "unknown" -> {
                return statementText;
            }
            case "sqlserver" -> {
                Select select = parseSelect(statementText);
                if (select instanceof PlainSelect plainSelect) {
                    Top top = new Top();
                    top.setExpression(new LongValue(rowCount));
                    plainSelect.setTop(top);
                    return plainSelect.toString();
                }
                return statementText;
            }
            default -> {
                Select select = parseSelect(statementText);
                select.setLimit(new Limit().withRowCount(new LongValue(rowCount)));
                return select.toString();
            }
        }
    }

    private static String firstLine(String message) {
        if (message == null) {
            return "syntax error";
        }
        int newline = message.indexOf('\n');
        return newline < 0 ? message : message.substring(0, newline);
    }

    private static PolicyViolation violation(String messageKey, Object... messageArgs) {
        return new PolicyViolation(ErrorKind.VALIDATION_REJECTED, ResourceManager.getErrorMessage(messageKey, messageArgs));
    }
}
