package org.iceforge.pivot.sql;

import org.apache.calcite.avatica.util.Casing;
import org.apache.calcite.avatica.util.Quoting;
import org.apache.calcite.sql.SqlKind;
import org.apache.calcite.sql.SqlNode;
import org.apache.calcite.sql.parser.SqlParseException;
import org.apache.calcite.sql.parser.SqlParser;
import org.apache.calcite.sql.parser.babel.SqlBabelParserImpl;
import org.apache.calcite.sql.validate.SqlConformanceEnum;
import org.iceforge.pivot.config.PivotProperties;
import org.iceforge.pivot.error.UnsafeQueryException;
import org.iceforge.pivot.model.Cube;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.Locale;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * The gate every generated statement passes before it may reach the warehouse.
 * <ol>
 *   <li>rejects mutating or DDL keywords (whole words, any case, outside quoted text),
 *       comments and stacked statements;</li>
 *   <li>parses the statement and rejects anything that is not a query;</li>
 *   <li>rejects references to tables or columns outside the whitelist;</li>
 *   <li>appends the result cap when there is no top-level limit and lowers a larger one.</li>
 * </ol>
 * Nothing else is rewritten. The validator has no state of its own and can be used by any
 * path that produces SQL.
 */
@Component
public class SqlSafetyValidator {

    private static final Logger log = LoggerFactory.getLogger(SqlSafetyValidator.class);

    private static final Pattern MUTATING = Pattern.compile(
            "\\b(INSERT|UPDATE|DELETE|MERGE|UPSERT|DROP|ALTER|CREATE|TRUNCATE|RENAME|GRANT|REVOKE"
                    + "|EXEC|EXECUTE|CALL|COPY|INTO|LOCK|VACUUM|REPLACE(?!\\s*\\())\\b",
            Pattern.CASE_INSENSITIVE);

    private static final SqlParser.Config PARSER_CONFIG = SqlParser.config()
            .withParserFactory(SqlBabelParserImpl.FACTORY)
            .withConformance(SqlConformanceEnum.BABEL)
            .withQuoting(Quoting.DOUBLE_QUOTE)
            .withUnquotedCasing(Casing.UNCHANGED)
            .withQuotedCasing(Casing.UNCHANGED)
            .withCaseSensitive(false);

    private final int resultLimit;
    private final String warehouseSchema;

    public SqlSafetyValidator(PivotProperties props) {
        Objects.requireNonNull(props);
        this.resultLimit = props.getResultLimit();
        this.warehouseSchema = props.getWarehouseSchema();
    }

    public int getResultLimit() {
        return resultLimit;
    }

    public ValidatedSql validate(String sql, Collection<Cube> cubes) {
        return validate(sql, SqlWhitelist.forCubes(cubes, warehouseSchema));
    }

    public ValidatedSql validate(String sql, SqlWhitelist whitelist) {
        String statement = stripTerminators(sql);
        if (statement.isEmpty()) {
            throw reject(SafetyRule.EMPTY_STATEMENT, "statement is empty", sql);
        }

        SqlText text;
        try {
            text = SqlText.of(statement);
        } catch (IllegalArgumentException e) {
            throw reject(SafetyRule.UNPARSEABLE, e.getMessage(), statement);
        }
        String masked = text.masked();

        Matcher keyword = MUTATING.matcher(masked);
        if (keyword.find()) {
            throw reject(SafetyRule.MUTATING_KEYWORD,
                    "statement contains " + keyword.group(1).toUpperCase(Locale.ROOT), statement);
        }
        if (masked.contains("--") || masked.contains("/*")) {
            throw reject(SafetyRule.COMMENT, "comments are not allowed", statement);
        }
        if (masked.indexOf(';') >= 0) {
            throw reject(SafetyRule.MULTIPLE_STATEMENTS, "only a single statement is allowed", statement);
        }

        SqlNode root;
        try {
            root = SqlParser.create(statement, PARSER_CONFIG).parseStmt();
        } catch (SqlParseException e) {
            throw reject(SafetyRule.UNPARSEABLE, firstLine(e.getMessage()), statement);
        }
        if (!root.isA(SqlKind.QUERY)) {
            throw reject(SafetyRule.NOT_A_QUERY, "only SELECT queries are allowed, got " + root.getKind(), statement);
        }

        new WhitelistChecker(whitelist, statement).check(root);

        return enforceLimit(statement, text);
    }

    private ValidatedSql enforceLimit(String statement, SqlText text) {
        SqlText.LimitClause limit = text.topLevelLimit();
        if (limit == null) {
            log.debug("Injecting LIMIT {}", resultLimit);
            return new ValidatedSql(statement + "\nLIMIT " + resultLimit, resultLimit, null, true, false);
        }
        if (limit.value() == null || limit.value() > resultLimit) {
            log.debug("Clamping LIMIT {} to {}", limit.value() == null ? "ALL" : limit.value(), resultLimit);
            return new ValidatedSql(text.replace(limit, resultLimit), resultLimit, limit.value(), false, true);
        }
        return new ValidatedSql(statement, resultLimit, limit.value(), false, false);
    }

    private static String stripTerminators(String sql) {
        String s = sql == null ? "" : sql.trim();
        while (s.endsWith(";")) {
            s = s.substring(0, s.length() - 1).trim();
        }
        return s;
    }

    private static String firstLine(String message) {
        if (message == null) {
            return "statement could not be parsed";
        }
        int nl = message.indexOf('\n');
        return nl < 0 ? message : message.substring(0, nl);
    }

    private static UnsafeQueryException reject(SafetyRule rule, String detail, String sql) {
        log.warn("Rejected statement by {}: {}", rule, detail);
        return new UnsafeQueryException(rule, detail, sql);
    }
}
